package com.care.assist.model;

import java.util.UUID;

/**
 * 升級計畫 (Escalation Plan)
 * <p>
 * 由 Escalation Coordinator 建立並唯一修改；Session 只持有參考。
 * 狀態一旦為 COMPLETED 或 FAILED 即不再改變。
 */
public class EscalationPlan {

    public enum Priority {
        HIGH,
        URGENT
    }

    private final String planId;
    private final String sessionId;
    private final Severity severity;
    private final String channel;
    private final Priority priority;
    private final long createdAtMs;
    private final Object lock = new Object();

    private EscalationStatus status = EscalationStatus.PENDING;
    private String emergencyDirective;
    private String fallbackDirective;
    private int attempts;
    private String failureReason;
    private long resolvedAtMs;

    public EscalationPlan(String sessionId, Severity severity, String channel, Priority priority, long createdAtMs) {
        this.planId = UUID.randomUUID().toString();
        this.sessionId = sessionId;
        this.severity = severity;
        this.channel = channel;
        this.priority = priority;
        this.createdAtMs = createdAtMs;
    }

    public String getPlanId() {
        return planId;
    }

    public String getSessionId() {
        return sessionId;
    }

    public Severity getSeverity() {
        return severity;
    }

    public String getChannel() {
        return channel;
    }

    public Priority getPriority() {
        return priority;
    }

    public long getCreatedAtMs() {
        return createdAtMs;
    }

    public EscalationStatus getStatus() {
        synchronized (lock) {
            return status;
        }
    }

    public String getEmergencyDirective() {
        synchronized (lock) {
            return emergencyDirective;
        }
    }

    public String getFallbackDirective() {
        synchronized (lock) {
            return fallbackDirective;
        }
    }

    public int getAttempts() {
        synchronized (lock) {
            return attempts;
        }
    }

    public String getFailureReason() {
        synchronized (lock) {
            return failureReason;
        }
    }

    public long getResolvedAtMs() {
        synchronized (lock) {
            return resolvedAtMs;
        }
    }

    public boolean isResolved() {
        return getStatus().isTerminal();
    }

    public boolean hasEmergencyDirective() {
        return getEmergencyDirective() != null;
    }

    public void markInProgress() {
        synchronized (lock) {
            if (status == EscalationStatus.PENDING) {
                status = EscalationStatus.IN_PROGRESS;
            }
        }
    }

    public void attachEmergencyDirective(String directive) {
        synchronized (lock) {
            this.emergencyDirective = directive;
        }
    }

    public void attachFallbackDirective(String directive) {
        synchronized (lock) {
            this.fallbackDirective = directive;
        }
    }

    public int recordAttempt() {
        synchronized (lock) {
            return ++attempts;
        }
    }

    public void complete(long now) {
        synchronized (lock) {
            if (!status.isTerminal()) {
                status = EscalationStatus.COMPLETED;
                resolvedAtMs = now;
            }
        }
    }

    public void fail(String reason, long now) {
        synchronized (lock) {
            if (!status.isTerminal()) {
                status = EscalationStatus.FAILED;
                failureReason = reason;
                resolvedAtMs = now;
            }
        }
    }
}
