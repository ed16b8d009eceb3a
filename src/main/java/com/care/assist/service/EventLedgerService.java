package com.care.assist.service;

import com.care.assist.model.EventKind;
import com.care.assist.model.LedgerEvent;

import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * 事件帳本 (Event Ledger)
 * <p>
 * 每個 Session 一條只能附加的事件串流，sequence 從 1 開始且不跳號。
 * payload 內所有字串在存入前都會經過遮罩。
 */
public interface EventLedgerService {

    LedgerEvent append(String sessionId, EventKind kind, Map<String, Object> payload);

    /**
     * 回傳 sequence ≥ fromSeq 的事件，依序排列
     */
    List<LedgerEvent> replay(String sessionId, long fromSeq);

    /**
     * 訂閱之後新增的事件（不含歷史）；listener 在投遞執行緒上依序被呼叫，不在附加者的執行緒上
     */
    LedgerSubscription subscribe(String sessionId, Consumer<LedgerEvent> listener);

    long lastSequence(String sessionId);

    /**
     * 以封存的事件重建記憶體串流，之後的 append 延續其 sequence
     */
    void restore(String sessionId, List<LedgerEvent> events);

    /**
     * 從記憶體移除並通知封存釋放快取（檔案封存仍保留）
     */
    void evict(String sessionId);
}
