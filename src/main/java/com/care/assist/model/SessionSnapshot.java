package com.care.assist.model;

import java.util.List;
import java.util.Map;

/**
 * Session 唯讀快照，亦作為封存的 Session 紀錄
 */
public record SessionSnapshot(
        String sessionId,
        Phase phase,
        boolean consented,
        long createdAtMs,
        long lastActivityAtMs,
        int messageCount,
        String locale,
        Map<String, String> metadata,
        List<RiskVerdict> riskHistory,
        String escalationStatus,
        String closeReason) {

    public SessionSnapshot {
        metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
        riskHistory = riskHistory != null ? List.copyOf(riskHistory) : List.of();
    }

    public static SessionSnapshot of(SupportSession session) {
        EscalationPlan plan = session.getEscalationPlan();
        CloseReason reason = session.getCloseReason();
        return new SessionSnapshot(
                session.getSessionId(),
                session.getPhase(),
                session.isConsented(),
                session.getCreatedAtMs(),
                session.getLastActivityAtMs(),
                session.getMessageCount(),
                session.getLocale(),
                session.getMetadata(),
                session.getRiskHistory(),
                plan != null ? plan.getStatus().name() : null,
                reason != null ? reason.code() : null);
    }
}
