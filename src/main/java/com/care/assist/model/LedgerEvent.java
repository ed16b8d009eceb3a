package com.care.assist.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Ledger 事件
 * <p>
 * 同一 Session 內以 sequence 排序（從 1 開始、連續不跳號）；
 * 跨 Session 只有 timestamp 可供參考。payload 已經過遮罩。
 */
public record LedgerEvent(
        String sessionId,
        long sequence,
        EventKind kind,
        long timestampMs,
        Map<String, Object> payload) {

    public LedgerEvent {
        payload = payload != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(payload))
                : Map.of();
    }

    public Object get(String key) {
        return payload.get(key);
    }

    public String getString(String key) {
        Object v = payload.get(key);
        return v != null ? String.valueOf(v) : null;
    }
}
