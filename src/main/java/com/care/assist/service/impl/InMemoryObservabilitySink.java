package com.care.assist.service.impl;

import com.care.assist.model.LedgerEvent;
import com.care.assist.service.ObservabilitySink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 記憶體內可觀測性輸出 (In-Memory Observability Sink)
 * <p>
 * 機制：
 * 1. 使用 `ConcurrentLinkedDeque` 儲存事件副本，publish 不取鎖、不阻塞。
 * 2. Rolling Buffer：超過 `capacity` 時以 `pollFirst` 移除最舊的項目。
 * 3. 每次捨棄都計入 droppedCount，並記錄一筆 `observability.dropped` 日誌。
 */
@Service
public class InMemoryObservabilitySink implements ObservabilitySink {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryObservabilitySink.class);

    static final String DROPPED_EVENT = "observability.dropped";

    private final int capacity;

    private final Deque<Entry> entries = new ConcurrentLinkedDeque<>();
    private final AtomicInteger size = new AtomicInteger();
    private final AtomicLong dropped = new AtomicLong();
    private final AtomicLong published = new AtomicLong();

    public InMemoryObservabilitySink(@Value("${assist.observability.capacity:1000}") int capacity) {
        this.capacity = Math.max(1, capacity);
    }

    @Override
    public void publish(LedgerEvent event) {
        entries.addLast(new Entry(event.timestampMs(), event.sessionId(), event.sequence(),
                event.kind().name(), event.payload()));
        published.incrementAndGet();
        if (size.incrementAndGet() <= capacity) {
            return;
        }
        Entry evicted = entries.pollFirst();
        if (evicted != null) {
            size.decrementAndGet();
            long total = dropped.incrementAndGet();
            logger.warn("{}: session={}, seq={}, kind={}, totalDropped={}",
                    DROPPED_EVENT, evicted.sessionId(), evicted.sequence(), evicted.kind(), total);
        }
    }

    /**
     * 查詢事件 (Query Entries)
     * <p>
     * 篩選條件：
     * - sinceMs: 時間戳記是否在指定時間之後。
     * - kind: 事件種類（不分大小寫，完全相符）。
     * 依 `limit` 截取最新的 N 筆。
     */
    @Override
    public List<Entry> query(Long sinceMs, Integer limit, String kind) {
        long since = sinceMs != null ? sinceMs : 0L;
        int lim = limit != null ? Math.max(1, limit) : 200;
        String kindLike = kind != null && !kind.isBlank() ? kind.trim().toUpperCase(Locale.ROOT) : null;

        List<Entry> out = new ArrayList<>();
        for (Entry e : entries) {
            if (e.timestampMs() < since) {
                continue;
            }
            if (kindLike != null && !kindLike.equals(e.kind())) {
                continue;
            }
            out.add(e);
        }

        int from = Math.max(0, out.size() - lim);
        return new ArrayList<>(out.subList(from, out.size()));
    }

    @Override
    public long droppedCount() {
        return dropped.get();
    }

    @Override
    public Map<String, Object> stats() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("capacity", capacity);
        out.put("buffered", Math.min(size.get(), capacity));
        out.put("published", published.get());
        out.put("dropped", dropped.get());
        return out;
    }
}
