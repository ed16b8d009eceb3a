package com.care.assist.model;

/**
 * 對話階段 (Session Phase)
 * <p>
 * INIT 為初始階段，CLOSE 為終止階段（進入後不再轉移）。
 * RISK_CHECK 只在單一回合內短暫經過，不會成為 Session 停留的階段。
 */
public enum Phase {
    INIT,
    CONSENTED,
    TRIAGE,
    SUPPORT_LOOP,
    RISK_CHECK,
    RESOURCES,
    ESCALATE,
    CLOSE;

    public boolean isTerminal() {
        return this == CLOSE;
    }

    /**
     * ESCALATE 與 CLOSE 之後的風險判定只記錄、不再觸發轉移
     */
    public boolean ignoresRiskTransitions() {
        return this == ESCALATE || this == CLOSE;
    }
}
