package com.care.assist.test;

import com.care.assist.model.EventKind;
import com.care.assist.model.LedgerEvent;
import com.care.assist.service.ObservabilitySink;
import com.care.assist.service.impl.InMemoryObservabilitySink;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 可觀測性緩衝區測試
 */
public class InMemoryObservabilitySinkTest {

    private static LedgerEvent event(long seq, EventKind kind, long ts) {
        return new LedgerEvent("s-1", seq, kind, ts, Map.of("seq", seq));
    }

    @Test
    @DisplayName("緩衝區滿時丟棄最舊的事件並計數")
    public void testDropOldest() {
        InMemoryObservabilitySink sink = new InMemoryObservabilitySink(3);
        for (long i = 1; i <= 5; i++) {
            sink.publish(event(i, EventKind.TURN_RECEIVED, 1000L + i));
        }

        List<ObservabilitySink.Entry> entries = sink.query(null, 10, null);

        assertEquals(3, entries.size());
        assertEquals(3L, entries.get(0).sequence());
        assertEquals(5L, entries.get(2).sequence());
        assertEquals(2L, sink.droppedCount());
        assertEquals(5L, sink.stats().get("published"));
        assertEquals(3, sink.stats().get("buffered"));
    }

    @Test
    @DisplayName("依時間與種類篩選，limit 取最新的 N 筆")
    public void testQueryFilters() {
        InMemoryObservabilitySink sink = new InMemoryObservabilitySink(100);
        sink.publish(event(1, EventKind.SESSION_CREATED, 1000L));
        sink.publish(event(2, EventKind.TURN_RECEIVED, 2000L));
        sink.publish(event(3, EventKind.RISK_ASSESSED, 3000L));
        sink.publish(event(4, EventKind.TURN_RECEIVED, 4000L));

        assertEquals(2, sink.query(null, null, "turn_received").size());
        assertEquals(2, sink.query(3000L, null, null).size());
        List<ObservabilitySink.Entry> latest = sink.query(null, 1, null);
        assertEquals(1, latest.size());
        assertEquals(4L, latest.get(0).sequence());
        assertTrue(sink.query(null, null, "TURN").isEmpty());
        assertEquals(0L, sink.droppedCount());
    }
}
