package com.care.assist.controller;

import com.care.assist.model.ConsentSignal;
import com.care.assist.model.LedgerEvent;
import com.care.assist.model.SessionSnapshot;
import com.care.assist.model.TurnInput;
import com.care.assist.model.TurnResult;
import com.care.assist.service.EventLedgerService;
import com.care.assist.service.LedgerSubscription;
import com.care.assist.service.ObservabilitySink;
import com.care.assist.service.SessionRegistryService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.*;

/**
 * Session 控制器
 * 提供建立 Session、送出訊息、查詢事件與即時事件串流的 REST API
 */
@RestController
@RequestMapping("/api/sessions")
@CrossOrigin(origins = "*")
public class SessionController {

    private static final Logger logger = LoggerFactory.getLogger(SessionController.class);

    @Autowired
    private SessionRegistryService registryService;

    @Autowired
    private EventLedgerService ledgerService;

    @Autowired
    private ObservabilitySink observabilitySink;

    /**
     * 建立 Session 的請求內容
     */
    public record CreateSessionRequest(String locale, Map<String, String> metadata) {
    }

    /**
     * 送出訊息的請求內容；consent 以字串接收，無法辨識時視為未同意
     */
    public record TurnRequest(String text, String consent, Boolean exitRequested, Boolean resourceRequested) {

        TurnInput toInput() {
            return new TurnInput(text, ConsentSignal.parse(consent),
                    Boolean.TRUE.equals(exitRequested), Boolean.TRUE.equals(resourceRequested));
        }
    }

    @PostMapping
    public Map<String, Object> createSession(@RequestBody(required = false) CreateSessionRequest request) {
        String locale = request != null ? request.locale() : null;
        Map<String, String> metadata = request != null ? request.metadata() : null;
        SessionSnapshot snapshot = registryService.createSession(locale, metadata);

        Map<String, Object> response = new HashMap<>();
        response.put("success", true);
        response.put("sessionId", snapshot.sessionId());
        response.put("data", snapshot);
        return response;
    }

    @GetMapping("/{id}")
    public Map<String, Object> getSession(@PathVariable String id) {
        Map<String, Object> response = new HashMap<>();
        response.put("success", true);
        response.put("data", registryService.getSession(id));
        return response;
    }

    /**
     * 送出單一回合（回應中不包含原始訊息）
     */
    @PostMapping("/{id}/turns")
    public Map<String, Object> submitTurn(@PathVariable String id, @RequestBody TurnRequest request) {
        logger.info("收到訊息: sessionId={}", id);
        TurnResult result = registryService.submitTurn(id, request.toInput());

        Map<String, Object> response = new HashMap<>();
        response.put("success", true);
        response.put("data", result);
        return response;
    }

    @DeleteMapping("/{id}")
    public Map<String, Object> terminate(@PathVariable String id) {
        logger.info("結束 Session 請求: {}", id);
        SessionSnapshot snapshot = registryService.terminate(id);
        Map<String, Object> response = new HashMap<>();
        response.put("success", true);
        response.put("data", snapshot);
        return response;
    }

    @GetMapping("/{id}/events")
    public Map<String, Object> replay(@PathVariable String id,
                                      @RequestParam(required = false, defaultValue = "1") long fromSeq) {
        registryService.getSession(id);
        List<LedgerEvent> events = ledgerService.replay(id, fromSeq);
        Map<String, Object> response = new HashMap<>();
        response.put("success", true);
        response.put("data", events);
        response.put("count", events.size());
        return response;
    }

    /**
     * 即時事件串流 (SSE)，只推送訂閱之後的新事件
     */
    @GetMapping(value = "/{id}/events/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream(@PathVariable String id) {
        registryService.getSession(id);
        SseEmitter emitter = new SseEmitter(180000L); // 3 分鐘 timeout
        LedgerSubscription subscription = ledgerService.subscribe(id, event -> {
            try {
                emitter.send(SseEmitter.event()
                        .id(String.valueOf(event.sequence()))
                        .name(event.kind().name())
                        .data(event, MediaType.APPLICATION_JSON));
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        });
        emitter.onCompletion(subscription::close);
        emitter.onTimeout(subscription::close);
        emitter.onError(e -> subscription.close());
        return emitter;
    }

    @GetMapping("/status")
    public Map<String, Object> getStatus() {
        Map<String, Object> status = new HashMap<>();
        status.put("activeSessions", registryService.activeCount());
        status.put("observability", observabilitySink.stats());
        status.put("success", true);
        return status;
    }
}
