package com.care.assist.service;

import com.care.assist.model.SessionSnapshot;
import com.care.assist.model.TurnInput;
import com.care.assist.model.TurnResult;

import java.util.List;
import java.util.Map;

/**
 * Session 註冊與排程服務 (Session Registry)
 */
public interface SessionRegistryService {

    SessionSnapshot createSession(String locale, Map<String, String> metadata);

    /**
     * @throws com.care.assist.exception.SessionNotFoundException 找不到 Session
     * @throws com.care.assist.exception.SessionClosedException   Session 已關閉
     */
    TurnResult submitTurn(String sessionId, TurnInput input);

    SessionSnapshot getSession(String sessionId);

    /**
     * 營運人員強制結束
     */
    SessionSnapshot terminate(String sessionId);

    List<SessionSnapshot> listActive();

    int activeCount();

    /**
     * 以封存的事件串流重新掛載 Session；已關閉的 Session 無法重新掛載
     */
    SessionSnapshot reattach(String sessionId);

    /**
     * 檢查逾時與待重試的升級，將需要處理的 Session 排入工作執行緒
     *
     * @return 本次排入的工作數
     */
    int sweep();
}
