package com.care.assist.model;

/**
 * 轉接（Warm Hand-off）單次嘗試的結果
 */
public enum TransferStatus {
    CONNECTED,
    BUSY,
    FAILED,
    TIMEOUT,
    UNAVAILABLE;

    public boolean isConnected() {
        return this == CONNECTED;
    }
}
