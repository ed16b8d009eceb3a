package com.care.assist.config;

import com.care.assist.model.Severity;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Session 政策 (Session Policy)
 * <p>
 * 啟動時建立一次、之後不可變的設定值，注入 Session Registry 與各元件。
 * 所有時間單位為毫秒。
 */
public record SessionPolicy(
        int maxMessages,
        long idleTimeoutMs,
        long hardTimeoutMs,
        long consentTimeoutMs,
        long triageTimeoutMs,
        int triageRequiredTurns,
        long closedRetentionMs,
        int riskContextTurns,
        Severity escalationThreshold,
        long classifierTimeoutMs,
        long generationTimeoutMs,
        long handoffTimeoutMs,
        int maxHandoffAttempts,
        int maxEscalationRetries) {

    public SessionPolicy {
        if (maxMessages < 1) {
            throw new IllegalArgumentException("maxMessages must be >= 1");
        }
        if (maxHandoffAttempts < 1) {
            throw new IllegalArgumentException("maxHandoffAttempts must be >= 1");
        }
        triageRequiredTurns = Math.max(1, triageRequiredTurns);
        riskContextTurns = Math.max(0, riskContextTurns);
        maxEscalationRetries = Math.max(0, maxEscalationRetries);
        escalationThreshold = escalationThreshold != null ? escalationThreshold : Severity.HIGH;
    }

    public static SessionPolicy defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .maxMessages(maxMessages)
                .idleTimeoutMs(idleTimeoutMs)
                .hardTimeoutMs(hardTimeoutMs)
                .consentTimeoutMs(consentTimeoutMs)
                .triageTimeoutMs(triageTimeoutMs)
                .triageRequiredTurns(triageRequiredTurns)
                .closedRetentionMs(closedRetentionMs)
                .riskContextTurns(riskContextTurns)
                .escalationThreshold(escalationThreshold)
                .classifierTimeoutMs(classifierTimeoutMs)
                .generationTimeoutMs(generationTimeoutMs)
                .handoffTimeoutMs(handoffTimeoutMs)
                .maxHandoffAttempts(maxHandoffAttempts)
                .maxEscalationRetries(maxEscalationRetries);
    }

    /**
     * 取得設定快照，用於後台顯示
     */
    public Map<String, Object> snapshot() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("maxMessages", maxMessages);
        out.put("idleTimeoutMs", idleTimeoutMs);
        out.put("hardTimeoutMs", hardTimeoutMs);
        out.put("consentTimeoutMs", consentTimeoutMs);
        out.put("triageTimeoutMs", triageTimeoutMs);
        out.put("triageRequiredTurns", triageRequiredTurns);
        out.put("closedRetentionMs", closedRetentionMs);
        out.put("riskContextTurns", riskContextTurns);
        out.put("escalationThreshold", escalationThreshold.name());
        out.put("classifierTimeoutMs", classifierTimeoutMs);
        out.put("generationTimeoutMs", generationTimeoutMs);
        out.put("handoffTimeoutMs", handoffTimeoutMs);
        out.put("maxHandoffAttempts", maxHandoffAttempts);
        out.put("maxEscalationRetries", maxEscalationRetries);
        return out;
    }

    public static final class Builder {
        private int maxMessages = 50;
        private long idleTimeoutMs = 30L * 60_000L;
        private long hardTimeoutMs = 120L * 60_000L;
        private long consentTimeoutMs = 10L * 60_000L;
        private long triageTimeoutMs = 5L * 60_000L;
        private int triageRequiredTurns = 1;
        private long closedRetentionMs = 10L * 60_000L;
        private int riskContextTurns = 5;
        private Severity escalationThreshold = Severity.HIGH;
        private long classifierTimeoutMs = 2_000L;
        private long generationTimeoutMs = 5_000L;
        private long handoffTimeoutMs = 5_000L;
        private int maxHandoffAttempts = 3;
        private int maxEscalationRetries = 3;

        public Builder maxMessages(int v) {
            this.maxMessages = v;
            return this;
        }

        public Builder idleTimeoutMs(long v) {
            this.idleTimeoutMs = v;
            return this;
        }

        public Builder hardTimeoutMs(long v) {
            this.hardTimeoutMs = v;
            return this;
        }

        public Builder consentTimeoutMs(long v) {
            this.consentTimeoutMs = v;
            return this;
        }

        public Builder triageTimeoutMs(long v) {
            this.triageTimeoutMs = v;
            return this;
        }

        public Builder triageRequiredTurns(int v) {
            this.triageRequiredTurns = v;
            return this;
        }

        public Builder closedRetentionMs(long v) {
            this.closedRetentionMs = v;
            return this;
        }

        public Builder riskContextTurns(int v) {
            this.riskContextTurns = v;
            return this;
        }

        public Builder escalationThreshold(Severity v) {
            this.escalationThreshold = v;
            return this;
        }

        public Builder classifierTimeoutMs(long v) {
            this.classifierTimeoutMs = v;
            return this;
        }

        public Builder generationTimeoutMs(long v) {
            this.generationTimeoutMs = v;
            return this;
        }

        public Builder handoffTimeoutMs(long v) {
            this.handoffTimeoutMs = v;
            return this;
        }

        public Builder maxHandoffAttempts(int v) {
            this.maxHandoffAttempts = v;
            return this;
        }

        public Builder maxEscalationRetries(int v) {
            this.maxEscalationRetries = v;
            return this;
        }

        public SessionPolicy build() {
            return new SessionPolicy(maxMessages, idleTimeoutMs, hardTimeoutMs, consentTimeoutMs,
                    triageTimeoutMs, triageRequiredTurns, closedRetentionMs, riskContextTurns,
                    escalationThreshold, classifierTimeoutMs, generationTimeoutMs, handoffTimeoutMs,
                    maxHandoffAttempts, maxEscalationRetries);
        }
    }
}
