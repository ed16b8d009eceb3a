package com.care.assist.service;

/**
 * 即時事件訂閱；關閉後不再收到事件
 */
public interface LedgerSubscription extends AutoCloseable {

    String getSessionId();

    boolean isActive();

    @Override
    void close();
}
