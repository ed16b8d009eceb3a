package com.care.assist.exception;

/**
 * 對已關閉的 Session 送出訊息時拋出；不會造成任何狀態變更
 */
public class SessionClosedException extends RuntimeException {

    private final String sessionId;
    private final String closeReason;

    public SessionClosedException(String sessionId, String closeReason) {
        super("Session " + sessionId + " is closed (" + closeReason + ")");
        this.sessionId = sessionId;
        this.closeReason = closeReason;
    }

    public String getSessionId() {
        return sessionId;
    }

    public String getCloseReason() {
        return closeReason;
    }
}
