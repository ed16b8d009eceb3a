package com.care.assist.service;

import com.care.assist.model.EscalationPlan;
import com.care.assist.model.Severity;

/**
 * 升級協調服務 (Escalation Coordinator)
 * <p>
 * 只由 State Machine 在持有 Session 鎖時呼叫；回傳的計畫已是終止狀態
 * （COMPLETED 或 FAILED）。非預期錯誤以 RuntimeException 拋出，由 State Machine 記錄並排程重試。
 */
public interface EscalationCoordinatorService {

    /**
     * 執行升級：必要時先給出緊急電話指示，再嘗試轉接
     *
     * @param sessionId      Session ID
     * @param severity       觸發的風險等級（HIGH 或 CRITICAL）
     * @param contextSummary 遮罩後的情境摘要
     * @param locale         地區
     * @return 已結束的升級計畫
     */
    EscalationPlan escalate(String sessionId, Severity severity, String contextSummary, String locale);

    /**
     * 重試次數用盡時，直接建立 FAILED 的計畫並附上危機專線指示
     */
    EscalationPlan abandon(String sessionId, Severity severity, String locale, String reason);
}
