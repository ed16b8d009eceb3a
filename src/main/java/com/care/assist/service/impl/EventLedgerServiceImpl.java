package com.care.assist.service.impl;

import com.care.assist.model.EventKind;
import com.care.assist.model.LedgerEvent;
import com.care.assist.repository.SessionArchiveRepository;
import com.care.assist.service.EventLedgerService;
import com.care.assist.service.LedgerSubscription;
import com.care.assist.service.ObservabilitySink;
import com.care.assist.service.RedactionService;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * 事件帳本實作 (Event Ledger Implementation)
 * <p>
 * 機制：
 * 1. 每個 Session 一個 {@code Stream}，以 Stream 物件本身同步，確保 sequence 的配發與附加是原子的。
 * 2. 附加前以 {@link RedactionService#redactPayload} 遮罩 payload。
 * 3. 附加後依序複製到可觀測性輸出與封存儲存庫。
 * 4. 即時訂閱者各有一個有界佇列，附加時只放入佇列，由投遞執行緒依序送出；
 *    附加端不等待訂閱者。佇列滿（訂閱者跟不上）或訂閱者拋出例外時，記錄並移除該訂閱。
 */
@Service
public class EventLedgerServiceImpl implements EventLedgerService {

    private static final Logger logger = LoggerFactory.getLogger(EventLedgerServiceImpl.class);

    private final RedactionService redactionService;
    private final ObservabilitySink observabilitySink;
    private final SessionArchiveRepository archiveRepository;
    private final Clock clock;

    static final int SUBSCRIBER_QUEUE_CAPACITY = 256;

    private final Map<String, Stream> streams = new ConcurrentHashMap<>();

    private final Executor delivery;
    private final ExecutorService ownedDelivery;

    @Autowired
    public EventLedgerServiceImpl(RedactionService redactionService,
                                  ObservabilitySink observabilitySink,
                                  SessionArchiveRepository archiveRepository,
                                  Clock clock) {
        this(redactionService, observabilitySink, archiveRepository, clock, new ThreadPoolExecutor(
                1,
                4,
                60L,
                TimeUnit.SECONDS,
                new ArrayBlockingQueue<>(1000),
                new ThreadPoolExecutor.AbortPolicy()));
    }

    public EventLedgerServiceImpl(RedactionService redactionService,
                                  ObservabilitySink observabilitySink,
                                  SessionArchiveRepository archiveRepository,
                                  Clock clock,
                                  Executor delivery) {
        this.redactionService = redactionService;
        this.observabilitySink = observabilitySink;
        this.archiveRepository = archiveRepository;
        this.clock = clock;
        this.delivery = delivery;
        this.ownedDelivery = delivery instanceof ExecutorService es ? es : null;
    }

    @PreDestroy
    public void shutdownDelivery() {
        if (ownedDelivery == null) {
            return;
        }
        ownedDelivery.shutdown();
        try {
            ownedDelivery.awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public LedgerEvent append(String sessionId, EventKind kind, Map<String, Object> payload) {
        Map<String, Object> redacted = redactionService.redactPayload(payload != null ? payload : Map.of());
        Stream stream = streams.computeIfAbsent(sessionId, Stream::new);

        LedgerEvent event;
        synchronized (stream) {
            event = new LedgerEvent(sessionId, ++stream.lastSequence, kind, clock.millis(), redacted);
            stream.events.add(event);
            observabilitySink.publish(event);
            archiveRepository.appendEvent(event);
            for (Subscription s : stream.subscribers) {
                s.offer(event);
            }
        }
        logger.debug("事件附加: session={}, seq={}, kind={}", sessionId, event.sequence(), kind);
        return event;
    }

    @Override
    public List<LedgerEvent> replay(String sessionId, long fromSeq) {
        Stream stream = streams.get(sessionId);
        List<LedgerEvent> source;
        if (stream != null) {
            synchronized (stream) {
                source = new ArrayList<>(stream.events);
            }
        } else {
            source = archiveRepository.loadEvents(sessionId);
        }
        List<LedgerEvent> out = new ArrayList<>();
        for (LedgerEvent e : source) {
            if (e.sequence() >= fromSeq) {
                out.add(e);
            }
        }
        return out;
    }

    @Override
    public LedgerSubscription subscribe(String sessionId, Consumer<LedgerEvent> listener) {
        Stream stream = streams.computeIfAbsent(sessionId, Stream::new);
        Subscription subscription = new Subscription(stream, listener, delivery);
        stream.subscribers.add(subscription);
        return subscription;
    }

    @Override
    public long lastSequence(String sessionId) {
        Stream stream = streams.get(sessionId);
        if (stream == null) {
            return 0L;
        }
        synchronized (stream) {
            return stream.lastSequence;
        }
    }

    @Override
    public void restore(String sessionId, List<LedgerEvent> events) {
        Stream stream = streams.computeIfAbsent(sessionId, Stream::new);
        synchronized (stream) {
            stream.events.clear();
            stream.lastSequence = 0L;
            for (LedgerEvent e : events) {
                if (e.sequence() != stream.lastSequence + 1) {
                    throw new IllegalStateException("event stream has a gap before seq " + e.sequence());
                }
                stream.events.add(e);
                stream.lastSequence = e.sequence();
            }
        }
        logger.info("事件串流已還原: session={}, lastSeq={}", sessionId, stream.lastSequence);
    }

    @Override
    public void evict(String sessionId) {
        Stream stream = streams.remove(sessionId);
        if (stream != null) {
            stream.subscribers.forEach(Subscription::close);
        }
        archiveRepository.evict(sessionId);
    }

    private static final class Stream {
        private final String sessionId;
        private final List<LedgerEvent> events = new ArrayList<>();
        private final List<Subscription> subscribers = new CopyOnWriteArrayList<>();
        private long lastSequence;

        private Stream(String sessionId) {
            this.sessionId = sessionId;
        }
    }

    private static final class Subscription implements LedgerSubscription {
        private final Stream stream;
        private final Consumer<LedgerEvent> listener;
        private final Executor delivery;
        private final BlockingQueue<LedgerEvent> queue = new ArrayBlockingQueue<>(SUBSCRIBER_QUEUE_CAPACITY);
        private final AtomicBoolean draining = new AtomicBoolean();
        private volatile boolean active = true;

        private Subscription(Stream stream, Consumer<LedgerEvent> listener, Executor delivery) {
            this.stream = stream;
            this.listener = listener;
            this.delivery = delivery;
        }

        /**
         * 在帳本的串流鎖內呼叫，只入佇列，不執行訂閱者
         */
        private void offer(LedgerEvent event) {
            if (!active) {
                return;
            }
            if (!queue.offer(event)) {
                logger.warn("訂閱者跟不上，已移除: session={}, seq={}, queued={}",
                        stream.sessionId, event.sequence(), queue.size());
                close();
                return;
            }
            scheduleDrain();
        }

        private void scheduleDrain() {
            if (!draining.compareAndSet(false, true)) {
                return;
            }
            try {
                delivery.execute(this::drain);
            } catch (RejectedExecutionException e) {
                draining.set(false);
                logger.warn("投遞執行緒池已滿，移除訂閱: session={}", stream.sessionId);
                close();
            }
        }

        private void drain() {
            try {
                LedgerEvent event;
                while (active && (event = queue.poll()) != null) {
                    deliver(event);
                }
            } finally {
                draining.set(false);
            }
            // 結束前剛好有新事件入列時，重新排程
            if (active && !queue.isEmpty()) {
                scheduleDrain();
            }
        }

        private void deliver(LedgerEvent event) {
            try {
                listener.accept(event);
            } catch (RuntimeException e) {
                logger.warn("訂閱者處理事件失敗，已移除: session={}, seq={}: {}",
                        stream.sessionId, event.sequence(), e.getMessage());
                close();
            }
        }

        @Override
        public String getSessionId() {
            return stream.sessionId;
        }

        @Override
        public boolean isActive() {
            return active;
        }

        @Override
        public void close() {
            active = false;
            queue.clear();
            stream.subscribers.remove(this);
        }
    }
}
