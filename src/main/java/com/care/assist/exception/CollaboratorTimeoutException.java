package com.care.assist.exception;

/**
 * 外部協作者呼叫超過時限或無法執行
 * <p>
 * 只在元件內部流通，由各元件轉為降級結果，不會讓 Session 失敗。
 */
public class CollaboratorTimeoutException extends Exception {

    private final String collaborator;

    public CollaboratorTimeoutException(String collaborator, String message, Throwable cause) {
        super(message, cause);
        this.collaborator = collaborator;
    }

    public String getCollaborator() {
        return collaborator;
    }
}
