package com.care.assist.repository.impl;

import com.care.assist.model.LedgerEvent;
import com.care.assist.model.SessionSnapshot;
import com.care.assist.repository.SessionArchiveRepository;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * 檔案型 Session 封存
 * <p>
 * 設定 {@code assist.archive.data-dir} 時，每個 Session 寫入：
 * - {@code <id>.session.json}：Session 紀錄
 * - {@code <id>.events.jsonl}：事件串流，一行一筆
 * <p>
 * 未設定時只保存在記憶體中。
 * <p>
 * 機制：
 * 1. 每個 Session 一把 {@code ReentrantReadWriteLock}，檔案 I/O 只在該 Session 的鎖內進行，不同 Session 互不等待。
 * 2. {@link #evict(String)}：有資料目錄時直接丟棄記憶體快取，之後改讀檔案；
 *    只在記憶體時保留最近 {@code assist.archive.memory-retained-sessions} 個已移除的 Session，超過的最舊者整筆丟棄。
 */
@Repository
public class FileBackedSessionArchiveRepository implements SessionArchiveRepository {

    private static final Logger logger = LoggerFactory.getLogger(FileBackedSessionArchiveRepository.class);

    private final Map<String, ReentrantReadWriteLock> locks = new ConcurrentHashMap<>();

    private final ObjectMapper objectMapper;

    private final Map<String, List<LedgerEvent>> events = new ConcurrentHashMap<>();

    private final Map<String, SessionSnapshot> sessions = new ConcurrentHashMap<>();

    // 只在記憶體模式使用：已從帳本移除、仍保留封存的 Session，依移除先後排列
    private final Deque<String> retained = new ConcurrentLinkedDeque<>();

    private final String dataDir;

    private final int memoryRetainedSessions;

    public FileBackedSessionArchiveRepository(String dataDir) {
        this(dataDir, 1000);
    }

    @Autowired
    public FileBackedSessionArchiveRepository(
            @Value("${assist.archive.data-dir:}") String dataDir,
            @Value("${assist.archive.memory-retained-sessions:1000}") int memoryRetainedSessions) {
        this.dataDir = dataDir != null ? dataDir.trim() : "";
        this.memoryRetainedSessions = Math.max(0, memoryRetainedSessions);
        this.objectMapper = new ObjectMapper();
        this.objectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        logger.info("Session 封存初始化: persistenceEnabled={}, dataDir={}", isPersistenceEnabled(), this.dataDir);
    }

    @Override
    public void appendEvent(LedgerEvent event) {
        ReentrantReadWriteLock lock = lockFor(event.sessionId());
        lock.writeLock().lock();
        try {
            // 重新掛載後首次寫入時，先以檔案內容補齊記憶體中的串流
            events.computeIfAbsent(event.sessionId(), this::readPersisted).add(event);
            if (isPersistenceEnabled()) {
                Path p = eventsFile(event.sessionId());
                ensureParentDir(p);
                String line = objectMapper.writeValueAsString(event) + System.lineSeparator();
                Files.writeString(p, line, StandardCharsets.UTF_8,
                        StandardOpenOption.CREATE, StandardOpenOption.APPEND);
            }
        } catch (IOException e) {
            logger.warn("事件封存寫入失敗 (session={}, seq={}): {}", event.sessionId(), event.sequence(), e.getMessage());
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void saveSession(SessionSnapshot snapshot) {
        ReentrantReadWriteLock lock = lockFor(snapshot.sessionId());
        lock.writeLock().lock();
        try {
            sessions.put(snapshot.sessionId(), snapshot);
            if (isPersistenceEnabled()) {
                Path p = sessionFile(snapshot.sessionId());
                ensureParentDir(p);
                objectMapper.writerWithDefaultPrettyPrinter().writeValue(p.toFile(), snapshot);
            }
        } catch (IOException e) {
            logger.warn("Session 紀錄寫入失敗 (session={}): {}", snapshot.sessionId(), e.getMessage());
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Optional<SessionSnapshot> findSession(String sessionId) {
        ReentrantReadWriteLock lock = lockFor(sessionId);
        lock.readLock().lock();
        try {
            SessionSnapshot cached = sessions.get(sessionId);
            if (cached != null || !isPersistenceEnabled()) {
                return Optional.ofNullable(cached);
            }
            Path p = sessionFile(sessionId);
            if (!Files.exists(p)) {
                return Optional.empty();
            }
            return Optional.of(objectMapper.readValue(p.toFile(), SessionSnapshot.class));
        } catch (IOException e) {
            logger.warn("Session 紀錄讀取失敗 (session={}): {}", sessionId, e.getMessage());
            return Optional.empty();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<LedgerEvent> loadEvents(String sessionId) {
        ReentrantReadWriteLock lock = lockFor(sessionId);
        lock.readLock().lock();
        try {
            List<LedgerEvent> cached = events.get(sessionId);
            if (cached != null) {
                return sorted(cached);
            }
            if (!isPersistenceEnabled() || !Files.exists(eventsFile(sessionId))) {
                return List.of();
            }
            return sorted(readEvents(eventsFile(sessionId)));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void evict(String sessionId) {
        if (isPersistenceEnabled()) {
            drop(sessionId);
            return;
        }
        retained.remove(sessionId);
        retained.addLast(sessionId);
        while (retained.size() > memoryRetainedSessions) {
            String oldest = retained.pollFirst();
            if (oldest == null) {
                break;
            }
            drop(oldest);
            logger.info("記憶體封存已滿，丟棄最舊的 Session: {}", oldest);
        }
    }

    /**
     * 記憶體中快取的 Session 數（測試與狀態查詢用）
     */
    public int cachedSessionCount() {
        return events.size();
    }

    private void drop(String sessionId) {
        ReentrantReadWriteLock lock = lockFor(sessionId);
        lock.writeLock().lock();
        try {
            events.remove(sessionId);
            sessions.remove(sessionId);
        } finally {
            lock.writeLock().unlock();
        }
        locks.remove(sessionId, lock);
    }

    private ReentrantReadWriteLock lockFor(String sessionId) {
        return locks.computeIfAbsent(sessionId, id -> new ReentrantReadWriteLock());
    }

    @Override
    public boolean isPersistenceEnabled() {
        return !dataDir.isEmpty();
    }

    @Override
    public String getDataDir() {
        return dataDir;
    }

    private List<LedgerEvent> readPersisted(String sessionId) {
        if (!isPersistenceEnabled() || !Files.exists(eventsFile(sessionId))) {
            return new ArrayList<>();
        }
        return sorted(readEvents(eventsFile(sessionId)));
    }

    private List<LedgerEvent> readEvents(Path path) {
        List<LedgerEvent> out = new ArrayList<>();
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (!line.isBlank()) {
                    out.add(objectMapper.readValue(line, LedgerEvent.class));
                }
            }
        } catch (IOException e) {
            logger.warn("事件封存讀取失敗 {}: {}", path, e.getMessage());
        }
        return out;
    }

    private static List<LedgerEvent> sorted(List<LedgerEvent> list) {
        List<LedgerEvent> copy = new ArrayList<>(list);
        copy.sort(Comparator.comparingLong(LedgerEvent::sequence));
        return copy;
    }

    private Path sessionFile(String sessionId) {
        return Paths.get(dataDir, safeName(sessionId) + ".session.json");
    }

    private Path eventsFile(String sessionId) {
        return Paths.get(dataDir, safeName(sessionId) + ".events.jsonl");
    }

    private static String safeName(String sessionId) {
        return sessionId.replaceAll("[^A-Za-z0-9_-]", "_");
    }

    private static void ensureParentDir(Path p) throws IOException {
        Path parent = p.toAbsolutePath().getParent();
        if (parent != null && !Files.exists(parent)) {
            Files.createDirectories(parent);
        }
    }
}
