package com.care.assist.service;

import com.care.assist.model.LedgerEvent;

import java.util.List;
import java.util.Map;

/**
 * 可觀測性輸出 (Observability Sink)
 * <p>
 * 有界、非阻塞；滿載時捨棄最舊的項目並計數。
 */
public interface ObservabilitySink {

    record Entry(long timestampMs, String sessionId, long sequence, String kind, Map<String, Object> data) {
    }

    void publish(LedgerEvent event);

    List<Entry> query(Long sinceMs, Integer limit, String kind);

    long droppedCount();

    Map<String, Object> stats();
}
