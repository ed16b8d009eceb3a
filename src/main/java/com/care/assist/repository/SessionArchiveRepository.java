package com.care.assist.repository;

import com.care.assist.model.LedgerEvent;
import com.care.assist.model.SessionSnapshot;

import java.util.List;
import java.util.Optional;

/**
 * Session 封存儲存庫
 * 保存 Session 紀錄（快照）與只能附加的事件串流，內容皆已遮罩
 */
public interface SessionArchiveRepository {

    void appendEvent(LedgerEvent event);

    void saveSession(SessionSnapshot snapshot);

    Optional<SessionSnapshot> findSession(String sessionId);

    /**
     * 依 sequence 由小到大回傳
     */
    List<LedgerEvent> loadEvents(String sessionId);

    /**
     * Session 已從帳本移除；釋放記憶體快取，檔案封存不受影響
     */
    void evict(String sessionId);

    boolean isPersistenceEnabled();

    String getDataDir();
}
