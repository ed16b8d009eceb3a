package com.care.assist.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 支援 Session 模型
 * <p>
 * 由 Session Registry 持有；階段與風險歷史只由 State Machine 寫入。
 * 所有讀寫都必須在 {@link #getLock()} 之內進行，只有時間戳記與階段
 * 以 volatile 暴露，供清理排程在不取鎖的情況下判斷是否逾時。
 */
public class SupportSession {

    private final String sessionId;
    private final long createdAtMs;
    private final String locale;
    private final Map<String, String> metadata;
    private final ReentrantLock lock = new ReentrantLock(true);

    private volatile Phase phase = Phase.INIT;
    private volatile long lastActivityAtMs;
    private volatile long phaseEnteredAtMs;
    private volatile boolean consented;
    private volatile int messageCount;
    private volatile CloseReason closeReason;
    private volatile long closedAtMs;
    private volatile EscalationPlan escalationPlan;

    private final List<RiskVerdict> riskHistory = new ArrayList<>();
    private final List<String> triageNotes = new ArrayList<>();
    private final List<String> recentTurns = new ArrayList<>();
    private String triageSummary;
    private boolean triageDegraded;
    private int escalationRetries;

    public SupportSession(String sessionId, String locale, Map<String, String> metadata, long createdAtMs) {
        this.sessionId = sessionId;
        this.locale = locale != null && !locale.isBlank() ? locale : "US";
        Map<String, String> copy = new HashMap<>();
        if (metadata != null) {
            metadata.forEach((k, v) -> {
                if (k != null && v != null) {
                    copy.put(k, v);
                }
            });
        }
        this.metadata = Collections.unmodifiableMap(copy);
        this.createdAtMs = createdAtMs;
        this.lastActivityAtMs = createdAtMs;
        this.phaseEnteredAtMs = createdAtMs;
    }

    public String getSessionId() {
        return sessionId;
    }

    public long getCreatedAtMs() {
        return createdAtMs;
    }

    public String getLocale() {
        return locale;
    }

    public Map<String, String> getMetadata() {
        return metadata;
    }

    public ReentrantLock getLock() {
        return lock;
    }

    public Phase getPhase() {
        return phase;
    }

    public long getLastActivityAtMs() {
        return lastActivityAtMs;
    }

    public long getPhaseEnteredAtMs() {
        return phaseEnteredAtMs;
    }

    public boolean isConsented() {
        return consented;
    }

    public int getMessageCount() {
        return messageCount;
    }

    public CloseReason getCloseReason() {
        return closeReason;
    }

    public long getClosedAtMs() {
        return closedAtMs;
    }

    public EscalationPlan getEscalationPlan() {
        return escalationPlan;
    }

    public boolean isClosed() {
        return phase.isTerminal();
    }

    public List<RiskVerdict> getRiskHistory() {
        return List.copyOf(riskHistory);
    }

    public List<String> getRecentTurns(int limit) {
        int from = Math.max(0, recentTurns.size() - Math.max(0, limit));
        return List.copyOf(recentTurns.subList(from, recentTurns.size()));
    }

    public List<String> getTriageNotes() {
        return List.copyOf(triageNotes);
    }

    public String getTriageSummary() {
        return triageSummary;
    }

    public boolean isTriageDegraded() {
        return triageDegraded;
    }

    public int getEscalationRetries() {
        return escalationRetries;
    }

    // ========== 以下僅供 State Machine 呼叫 ==========

    public void enterPhase(Phase next, long now) {
        this.phase = next;
        this.phaseEnteredAtMs = now;
    }

    /**
     * 同意旗標一旦為 true 就不會被重設
     */
    public void markConsented() {
        this.consented = true;
    }

    public int incrementMessageCount(long now) {
        this.messageCount++;
        touch(now);
        return messageCount;
    }

    public void touch(long now) {
        if (now > lastActivityAtMs) {
            this.lastActivityAtMs = now;
        }
    }

    public void addRiskVerdict(RiskVerdict verdict) {
        riskHistory.add(verdict);
    }

    public void rememberTurn(String sanitizedText, int keep) {
        recentTurns.add(sanitizedText);
        while (recentTurns.size() > Math.max(1, keep)) {
            recentTurns.remove(0);
        }
    }

    public void addTriageNote(String note) {
        triageNotes.add(note);
    }

    public void completeTriage(String summary, boolean degraded) {
        this.triageSummary = summary;
        this.triageDegraded = degraded;
    }

    public void attachEscalationPlan(EscalationPlan plan) {
        this.escalationPlan = plan;
    }

    public int incrementEscalationRetries() {
        return ++escalationRetries;
    }

    public void markClosed(CloseReason reason, long now) {
        this.closeReason = reason;
        this.closedAtMs = now;
    }

    /**
     * 從封存事件還原時使用；訊息數只能往上調
     */
    public void restoreCounters(int messageCount, long lastActivityAtMs) {
        if (messageCount > this.messageCount) {
            this.messageCount = messageCount;
        }
        touch(lastActivityAtMs);
    }
}
