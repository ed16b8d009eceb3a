package com.care.assist.model;

/**
 * Session 關閉原因
 */
public enum CloseReason {
    USER_EXIT("user_exit"),
    CONSENT_REVOKED("consent_revoked"),
    CONSENT_TIMEOUT("consent_timeout"),
    IDLE_TIMEOUT("idle_timeout"),
    HARD_TIMEOUT("hard_timeout"),
    MESSAGE_CAP("message_cap"),
    ESCALATION_COMPLETED("escalation_completed"),
    ESCALATION_FAILED("escalation_failed"),
    OPERATOR_TERMINATED("operator_terminated");

    private final String code;

    CloseReason(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static CloseReason fromCode(String code) {
        for (CloseReason r : values()) {
            if (r.code.equals(code)) {
                return r;
            }
        }
        return null;
    }
}
