package com.care.assist.model;

/**
 * Ledger 事件種類
 */
public enum EventKind {
    SESSION_CREATED,
    TURN_RECEIVED,
    RISK_ASSESSED,
    RISK_DEGRADED,
    PHASE_TRANSITION,
    GUARD_VIOLATION,
    TRIAGE_COMPLETED,
    RESOURCES_DELIVERED,
    REPLY_FALLBACK,
    ESCALATION_STARTED,
    EMERGENCY_DIRECTIVE,
    HANDOFF_ATTEMPT,
    ESCALATION_RESOLVED,
    ESCALATION_UNRESOLVED,
    REDACTION_FAILURE,
    SESSION_CLOSED,
    SESSION_REATTACHED;

    public boolean isRiskVerdict() {
        return this == RISK_ASSESSED || this == RISK_DEGRADED;
    }
}
