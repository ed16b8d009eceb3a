package com.care.assist.service.impl;

import com.care.assist.config.SessionPolicy;
import com.care.assist.exception.SessionClosedException;
import com.care.assist.exception.SessionNotFoundException;
import com.care.assist.model.EventKind;
import com.care.assist.model.LedgerEvent;
import com.care.assist.model.SessionSnapshot;
import com.care.assist.model.SupportSession;
import com.care.assist.model.TurnInput;
import com.care.assist.model.TurnResult;
import com.care.assist.repository.SessionArchiveRepository;
import com.care.assist.service.EventLedgerService;
import com.care.assist.service.SessionRegistryService;
import com.care.assist.statemachine.SessionStateMachine;
import com.care.assist.statemachine.SessionStateMachineFactory;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Session 註冊服務實作 (Session Registry Implementation)
 * <p>
 * 功能：
 * 負責 Session 的建立、查詢、關閉、重新掛載與逾時清理。
 * <p>
 * 機制：
 * 1. 使用 ConcurrentHashMap 儲存所有 Session 的 State Machine，這是唯一的多寫入者結構；不使用全域鎖。
 * 2. 同一 Session 的操作由 State Machine 以該 Session 的鎖序列化。
 * 3. 清理排程只負責偵測；實際的強制轉移排入工作執行緒，並等待同一把 Session 鎖。
 * 4. 已關閉的 Session 在保留時間後從記憶體移除，封存紀錄仍在。
 */
@Service
public class SessionRegistryServiceImpl implements SessionRegistryService {

    private static final Logger logger = LoggerFactory.getLogger(SessionRegistryServiceImpl.class);

    private final Map<String, SessionStateMachine> sessions = new ConcurrentHashMap<>();

    // 已排入工作執行緒、尚未執行完畢的 Session，避免重複排入
    private final Set<String> pending = ConcurrentHashMap.newKeySet();

    private final SessionStateMachineFactory factory;
    private final EventLedgerService ledger;
    private final SessionArchiveRepository archiveRepository;
    private final SessionPolicy policy;
    private final Clock clock;
    private final Executor worker;
    private final ExecutorService ownedWorker;

    @Autowired
    public SessionRegistryServiceImpl(SessionStateMachineFactory factory,
                                      EventLedgerService ledger,
                                      SessionArchiveRepository archiveRepository,
                                      SessionPolicy policy,
                                      Clock clock) {
        this(factory, ledger, archiveRepository, policy, clock, new ThreadPoolExecutor(
                2,
                8,
                60L,
                TimeUnit.SECONDS,
                new ArrayBlockingQueue<>(500),
                new ThreadPoolExecutor.AbortPolicy()));
    }

    public SessionRegistryServiceImpl(SessionStateMachineFactory factory,
                                      EventLedgerService ledger,
                                      SessionArchiveRepository archiveRepository,
                                      SessionPolicy policy,
                                      Clock clock,
                                      Executor worker) {
        this.factory = factory;
        this.ledger = ledger;
        this.archiveRepository = archiveRepository;
        this.policy = policy;
        this.clock = clock;
        this.worker = worker;
        this.ownedWorker = worker instanceof ExecutorService es ? es : null;
    }

    @PreDestroy
    public void shutdownWorker() {
        if (ownedWorker == null) {
            return;
        }
        ownedWorker.shutdown();
        try {
            ownedWorker.awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public SessionSnapshot createSession(String locale, Map<String, String> metadata) {
        String sessionId = UUID.randomUUID().toString();
        SupportSession session = new SupportSession(sessionId, locale, metadata, clock.millis());
        SessionStateMachine machine = factory.create(session);

        ReentrantLock lock = session.getLock();
        lock.lock();
        try {
            sessions.put(sessionId, machine);
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("locale", session.getLocale());
            payload.put("metadata", new HashMap<String, Object>(session.getMetadata()));
            ledger.append(sessionId, EventKind.SESSION_CREATED, payload);
            SessionSnapshot snapshot = SessionSnapshot.of(session);
            archiveRepository.saveSession(snapshot);
            logger.info("建立 Session: {}, locale={}", sessionId, session.getLocale());
            return snapshot;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public TurnResult submitTurn(String sessionId, TurnInput input) {
        return require(sessionId).handleTurn(input);
    }

    @Override
    public SessionSnapshot getSession(String sessionId) {
        SessionStateMachine machine = sessions.get(sessionId);
        if (machine != null) {
            return machine.snapshot();
        }
        return archiveRepository.findSession(sessionId)
                .orElseThrow(() -> new SessionNotFoundException(sessionId));
    }

    @Override
    public SessionSnapshot terminate(String sessionId) {
        SessionSnapshot snapshot = require(sessionId).terminate();
        logger.info("營運人員結束 Session: {}", sessionId);
        return snapshot;
    }

    @Override
    public List<SessionSnapshot> listActive() {
        List<SessionSnapshot> out = new ArrayList<>();
        for (SessionStateMachine machine : sessions.values()) {
            if (!machine.getSession().isClosed()) {
                out.add(machine.snapshot());
            }
        }
        return out;
    }

    @Override
    public int activeCount() {
        int count = 0;
        for (SessionStateMachine machine : sessions.values()) {
            if (!machine.getSession().isClosed()) {
                count++;
            }
        }
        return count;
    }

    /**
     * 重新掛載 Session (Reattach)
     * <p>
     * 流程：
     * 1. 已在記憶體且未關閉：直接回傳目前快照。
     * 2. 從封存讀取事件串流；沒有事件視為不存在。
     * 3. 以 Session 紀錄（或 SESSION_CREATED 事件）取得地區、metadata 與建立時間，重播串流。
     * 4. 重播結果已關閉則拒絕；否則還原帳本、延續 sequence 並記錄 SESSION_REATTACHED。
     */
    @Override
    public SessionSnapshot reattach(String sessionId) {
        SessionStateMachine live = sessions.get(sessionId);
        if (live != null) {
            if (live.getSession().isClosed()) {
                throw new SessionClosedException(sessionId, closeCode(live));
            }
            return live.snapshot();
        }

        List<LedgerEvent> events = archiveRepository.loadEvents(sessionId);
        if (events.isEmpty()) {
            throw new SessionNotFoundException(sessionId);
        }
        Optional<SessionSnapshot> record = archiveRepository.findSession(sessionId);
        LedgerEvent created = events.get(0);
        String locale = record.map(SessionSnapshot::locale).orElse(created.getString("locale"));
        Map<String, String> metadata = record.map(SessionSnapshot::metadata).orElse(Map.of());
        long createdAt = record.map(SessionSnapshot::createdAtMs).orElse(created.timestampMs());

        SessionStateMachine machine = factory.restore(sessionId, locale, metadata, createdAt, events);
        if (machine.getSession().isClosed()) {
            throw new SessionClosedException(sessionId, closeCode(machine));
        }

        ReentrantLock lock = machine.getSession().getLock();
        lock.lock();
        try {
            SessionStateMachine existing = sessions.putIfAbsent(sessionId, machine);
            if (existing != null) {
                return existing.snapshot();
            }
            ledger.restore(sessionId, events);
            machine.getSession().touch(clock.millis());

            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("phase", machine.getSession().getPhase().name());
            payload.put("restoredEvents", events.size());
            ledger.append(sessionId, EventKind.SESSION_REATTACHED, payload);

            SessionSnapshot snapshot = SessionSnapshot.of(machine.getSession());
            archiveRepository.saveSession(snapshot);
            logger.info("重新掛載 Session: {}, phase={}, events={}",
                    sessionId, snapshot.phase(), events.size());
            return snapshot;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 清理排程 (Sweep)
     * <p>
     * 流程：
     * 1. 已關閉且超過保留時間：從記憶體與帳本移除。
     * 2. 逾時（總時限、同意、閒置、分流）：排入 {@link SessionStateMachine#expire()}。
     * 3. 升級未結束：排入 {@link SessionStateMachine#retryEscalation()}。
     */
    @Override
    public int sweep() {
        long now = clock.millis();
        int queued = 0;
        int removed = 0;
        for (Map.Entry<String, SessionStateMachine> entry : sessions.entrySet()) {
            String sessionId = entry.getKey();
            SessionStateMachine machine = entry.getValue();
            SupportSession session = machine.getSession();

            if (session.isClosed()) {
                if (evictIfExpired(sessionId, machine, now)) {
                    removed++;
                }
                continue;
            }
            if (machine.isExpiryDue(now)) {
                if (enqueue(sessionId, machine::expire)) {
                    queued++;
                }
            } else if (machine.isEscalationRetryDue()) {
                if (enqueue(sessionId, machine::retryEscalation)) {
                    queued++;
                }
            }
        }
        if (queued > 0 || removed > 0) {
            logger.info("清理排程: 排入 {} 個工作，移除 {} 個已關閉 Session", queued, removed);
        }
        return queued;
    }

    /**
     * 移除保留時間已過的已關閉 Session
     * <p>
     * 只在取得 Session 鎖、且不是從鎖內重入時才移除；關閉流程尚未寫完事件（closedAtMs 仍為 0）時略過，留待下一輪。
     */
    private boolean evictIfExpired(String sessionId, SessionStateMachine machine, long now) {
        SupportSession session = machine.getSession();
        ReentrantLock lock = session.getLock();
        if (!lock.tryLock()) {
            return false;
        }
        try {
            if (lock.getHoldCount() > 1) {
                return false;
            }
            long closedAt = session.getClosedAtMs();
            if (closedAt <= 0 || now - closedAt < policy.closedRetentionMs()) {
                return false;
            }
            if (!sessions.remove(sessionId, machine)) {
                return false;
            }
            ledger.evict(sessionId);
            logger.debug("已關閉的 Session 移出記憶體: {}", sessionId);
            return true;
        } finally {
            lock.unlock();
        }
    }

    private boolean enqueue(String sessionId, Runnable task) {
        if (!pending.add(sessionId)) {
            return false;
        }
        try {
            worker.execute(() -> {
                try {
                    task.run();
                } catch (RuntimeException e) {
                    logger.error("清理工作失敗: session={}: {}", sessionId, e.getMessage());
                } finally {
                    pending.remove(sessionId);
                }
            });
            return true;
        } catch (RejectedExecutionException e) {
            pending.remove(sessionId);
            logger.warn("清理工作被拒絕（工作佇列已滿）: session={}", sessionId);
            return false;
        }
    }

    private SessionStateMachine require(String sessionId) {
        SessionStateMachine machine = sessions.get(sessionId);
        if (machine == null) {
            Optional<SessionSnapshot> archived = archiveRepository.findSession(sessionId);
            if (archived.isPresent() && archived.get().closeReason() != null) {
                throw new SessionClosedException(sessionId, archived.get().closeReason());
            }
            throw new SessionNotFoundException(sessionId);
        }
        return machine;
    }

    private static String closeCode(SessionStateMachine machine) {
        return machine.getSession().getCloseReason() != null
                ? machine.getSession().getCloseReason().code()
                : null;
    }
}
