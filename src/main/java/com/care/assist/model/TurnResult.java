package com.care.assist.model;

/**
 * 單一回合處理後回傳給呼叫端的結果
 */
public record TurnResult(
        String sessionId,
        int turnNumber,
        Phase phase,
        String reply,
        RiskVerdict verdict,
        EscalationPlan escalation,
        ResourceBundle resources,
        boolean closed,
        String closeReason) {
}
