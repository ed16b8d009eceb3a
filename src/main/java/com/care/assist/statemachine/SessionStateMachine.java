package com.care.assist.statemachine;

import com.care.assist.client.GenerationClient;
import com.care.assist.client.impl.TemplateGenerationClient;
import com.care.assist.config.SessionPolicy;
import com.care.assist.exception.CollaboratorTimeoutException;
import com.care.assist.exception.SessionClosedException;
import com.care.assist.model.CloseReason;
import com.care.assist.model.ConsentSignal;
import com.care.assist.model.EscalationPlan;
import com.care.assist.model.EscalationStatus;
import com.care.assist.model.EventKind;
import com.care.assist.model.LedgerEvent;
import com.care.assist.model.Phase;
import com.care.assist.model.RedactedEntity;
import com.care.assist.model.RedactionResult;
import com.care.assist.model.ResourceBundle;
import com.care.assist.model.RiskVerdict;
import com.care.assist.model.SessionSnapshot;
import com.care.assist.model.Severity;
import com.care.assist.model.SupportResource;
import com.care.assist.model.SupportSession;
import com.care.assist.model.Turn;
import com.care.assist.model.TurnInput;
import com.care.assist.model.TurnResult;
import com.care.assist.service.ResourceDirectoryService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import java.util.regex.Pattern;

/**
 * Session 狀態機 (Session State Machine)
 * <p>
 * 功能：
 * 依轉移表推進單一 Session 的階段，並在每回合套用風險快速通道。
 * <p>
 * 單一回合流程：
 * 1. 遮罩訊息，記錄 TURN_RECEIVED（遮罩失敗另記 REDACTION_FAILURE）。
 * 2. 風險評估，記錄 RISK_ASSESSED 或 RISK_DEGRADED。
 * 3. 判定 ≥ 升級門檻且不在 ESCALATE/CLOSE：下一筆事件即為轉入 ESCALATE，並交由升級協調服務處理。
 * 4. 否則依序處理撤回同意、結束要求，再依目前階段處理（同意、分流、支持、資源）。
 * 5. 檢查訊息上限。
 * <p>
 * 所有公開操作都在 Session 的 {@link ReentrantLock} 內執行；事件附加完成後才釋放。
 * RISK_CHECK 只是回合內的短暫檢查，不會成為停留的階段，也不會記錄轉移事件；
 * 該回合的 RISK_ASSESSED 以 {@code riskCheck=true} 標示。
 */
public class SessionStateMachine {

    private static final Logger logger = LoggerFactory.getLogger(SessionStateMachine.class);

    static final String GENERATION = "generation";

    private static final Pattern RESOURCE_REQUEST = Pattern.compile(
            "\\b(resources?|hotlines?|helplines?|phone numbers?|who (can|should) i (call|talk to)"
                    + "|where can i (get|find) help|(find|see) (a )?(therapist|counselor|counsellor)|support groups?)\\b",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern SUBSTANCE_HINT = Pattern.compile(
            "\\b(drinking|alcohol|drugs?|using again|relapse|addicted|addiction)\\b", Pattern.CASE_INSENSITIVE);

    private final SupportSession session;
    private final SessionPolicy policy;
    private final SessionStateMachineFactory deps;

    SessionStateMachine(SupportSession session, SessionStateMachineFactory deps) {
        this.session = session;
        this.deps = deps;
        this.policy = deps.policy();
    }

    public SupportSession getSession() {
        return session;
    }

    public String getSessionId() {
        return session.getSessionId();
    }

    // ========== 公開操作 ==========

    /**
     * 處理單一使用者回合
     *
     * @throws SessionClosedException Session 已關閉（或在本次檢查時因逾時而關閉），不會修改狀態
     */
    public TurnResult handleTurn(TurnInput input) {
        ReentrantLock lock = session.getLock();
        lock.lock();
        try {
            if (session.isClosed()) {
                throw closedException();
            }
            long now = deps.clock().millis();
            CloseReason expired = dueClosure(now);
            if (expired != null) {
                close(expired);
                persist();
                throw closedException();
            }
            completeTriageIfTimedOut(now);
            TurnResult result = processTurn(input != null ? input : TurnInput.message(""), now);
            persist();
            return result;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 清理排程觸發：在鎖內重新確認逾時後才關閉；分流逾時則以部分摘要推進
     *
     * @return 是否有狀態變更
     */
    public boolean expire() {
        ReentrantLock lock = session.getLock();
        lock.lock();
        try {
            if (session.isClosed()) {
                return false;
            }
            long now = deps.clock().millis();
            CloseReason reason = dueClosure(now);
            if (reason != null) {
                logger.info("Session 逾時關閉: session={}, reason={}", getSessionId(), reason.code());
                close(reason);
                persist();
                return true;
            }
            if (completeTriageIfTimedOut(now)) {
                persist();
                return true;
            }
            return false;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 升級協調失敗後的重試；超過 {@code maxEscalationRetries} 即強制 FAILED 並關閉
     *
     * @return 是否已結束升級
     */
    public boolean retryEscalation() {
        ReentrantLock lock = session.getLock();
        lock.lock();
        try {
            if (!isEscalationRetryDue()) {
                return false;
            }
            int retry = session.incrementEscalationRetries();
            Severity severity = highestSeverity();
            boolean resolved = false;
            if (retry <= policy.maxEscalationRetries()) {
                logger.warn("重試升級協調: session={}, retry={}/{}", getSessionId(), retry, policy.maxEscalationRetries());
                resolved = runCoordinator(severity);
            }
            if (!resolved && retry >= policy.maxEscalationRetries()) {
                forceEscalationFailure(severity);
                resolved = true;
            }
            persist();
            return resolved;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 營運人員強制結束
     *
     * @throws SessionClosedException Session 已關閉
     */
    public SessionSnapshot terminate() {
        ReentrantLock lock = session.getLock();
        lock.lock();
        try {
            if (session.isClosed()) {
                throw closedException();
            }
            close(CloseReason.OPERATOR_TERMINATED);
            persist();
            return SessionSnapshot.of(session);
        } finally {
            lock.unlock();
        }
    }

    public SessionSnapshot snapshot() {
        ReentrantLock lock = session.getLock();
        lock.lock();
        try {
            return SessionSnapshot.of(session);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 不取鎖的快速判斷，供清理排程決定是否排入工作
     */
    public boolean isExpiryDue(long now) {
        if (session.isClosed()) {
            return false;
        }
        return dueClosure(now) != null || isTriageTimedOut(now);
    }

    public boolean isEscalationRetryDue() {
        if (session.getPhase() != Phase.ESCALATE) {
            return false;
        }
        EscalationPlan plan = session.getEscalationPlan();
        return plan == null || !plan.isResolved();
    }

    // ========== 單一回合 ==========

    private TurnResult processTurn(TurnInput input, long now) {
        String sessionId = getSessionId();
        Phase phaseAtStart = session.getPhase();

        RedactionResult redaction = deps.redactionService().redact(input.text());
        String text = redaction.sanitizedText();
        int turnNumber = session.incrementMessageCount(now);
        Turn turn = new Turn(turnNumber, input.text().length(), text, redaction.entities(), phaseAtStart,
                input.consent(), input.exitRequested(), input.resourceRequested(), now);
        deps.ledger().append(sessionId, EventKind.TURN_RECEIVED, turnPayload(turn));
        if (redaction.failedClosed()) {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("turn", turnNumber);
            payload.put("rawLength", turn.rawLength());
            deps.ledger().append(sessionId, EventKind.REDACTION_FAILURE, payload);
        }

        List<String> context = session.getRecentTurns(policy.riskContextTurns());
        boolean hasText = !text.isBlank();
        if (hasText) {
            session.rememberTurn(text, policy.riskContextTurns());
        }

        // SUPPORT_LOOP 每個回合都做風險檢查（空白訊息只依前文判斷）；其他階段的空白回合只是同意等控制訊號
        RiskVerdict verdict = null;
        if (hasText || phaseAtStart == Phase.SUPPORT_LOOP) {
            verdict = deps.riskMonitor().assess(text, context);
            if (redaction.failedClosed()) {
                verdict = failedClosedVerdict(verdict, now);
            }
            recordVerdict(verdict, turnNumber, phaseAtStart);
        }

        // 快速通道優先於同一回合的其他轉移（含結束與撤回同意）
        if (verdict != null && verdict.severity().isAtLeast(policy.escalationThreshold())
                && !phaseAtStart.ignoresRiskTransitions()) {
            startEscalation(verdict.severity(), phaseAtStart == Phase.SUPPORT_LOOP ? "risk_check" : "risk");
            return result(turnNumber, escalationReply(), verdict, null);
        }

        if (input.consent() == ConsentSignal.REVOKED) {
            close(CloseReason.CONSENT_REVOKED);
            return result(turnNumber, closingReply(), verdict, null);
        }
        if (input.exitRequested()) {
            close(CloseReason.USER_EXIT);
            return result(turnNumber, closingReply(), verdict, null);
        }

        String reply;
        ResourceBundle delivered = null;
        switch (phaseAtStart) {
            case INIT -> reply = handleConsent(input.consent(), turnNumber);
            case CONSENTED -> {
                transition(Phase.TRIAGE, "consent_granted");
                reply = generate(Phase.TRIAGE, turnNumber);
            }
            case TRIAGE -> reply = handleTriage(text, turnNumber);
            case SUPPORT_LOOP, RISK_CHECK, RESOURCES -> {
                if (phaseAtStart != Phase.SUPPORT_LOOP) {
                    transition(Phase.SUPPORT_LOOP, "resume");
                }
                if (input.resourceRequested() || (hasText && RESOURCE_REQUEST.matcher(text).find())) {
                    delivered = deliverResources(turnNumber, "user_request");
                    reply = formatResources(delivered);
                } else {
                    reply = generate(Phase.SUPPORT_LOOP, turnNumber);
                    if (reply.contains(GenerationClient.RESOURCE_MARKER)) {
                        reply = reply.replace(GenerationClient.RESOURCE_MARKER, "").trim();
                        delivered = deliverResources(turnNumber, "generation_marker");
                        reply = reply + "\n\n" + formatResources(delivered);
                    }
                }
            }
            case ESCALATE -> reply = escalationReply();
            default -> throw closedException();
        }
        // 資源標記只在 SUPPORT_LOOP 生效，其他階段直接移除
        reply = reply.replace(GenerationClient.RESOURCE_MARKER, "").trim();

        if (!session.isClosed() && session.getPhase() != Phase.ESCALATE
                && session.getMessageCount() >= policy.maxMessages()) {
            logger.info("達到訊息上限: session={}, count={}", sessionId, session.getMessageCount());
            close(CloseReason.MESSAGE_CAP);
        }
        if (session.isClosed()) {
            reply = reply + "\n\n" + closingReply();
        }
        return result(turnNumber, reply, verdict, delivered);
    }

    private String handleConsent(ConsentSignal consent, int turnNumber) {
        if (consent == ConsentSignal.GRANTED) {
            session.markConsented();
            transition(Phase.CONSENTED, "consent_granted");
            transition(Phase.TRIAGE, "consent_granted");
            logger.info("使用者同意: session={}", getSessionId());
            return generate(Phase.TRIAGE, turnNumber);
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("turn", turnNumber);
        payload.put("guard", "consent_required");
        payload.put("phase", Phase.INIT.name());
        payload.put("signal", consent.name());
        deps.ledger().append(getSessionId(), EventKind.GUARD_VIOLATION, payload);
        return generate(Phase.INIT, turnNumber);
    }

    private String handleTriage(String text, int turnNumber) {
        if (!text.isBlank()) {
            session.addTriageNote(text);
        }
        if (session.getTriageNotes().size() >= policy.triageRequiredTurns()) {
            finishTriage(false, "triage_complete");
        }
        return generate(session.getPhase(), turnNumber);
    }

    private boolean completeTriageIfTimedOut(long now) {
        if (!isTriageTimedOut(now)) {
            return false;
        }
        logger.warn("分流逾時，以部分摘要繼續: session={}", getSessionId());
        finishTriage(true, "triage_timeout");
        return true;
    }

    private boolean isTriageTimedOut(long now) {
        return session.getPhase() == Phase.TRIAGE
                && now - session.getPhaseEnteredAtMs() >= policy.triageTimeoutMs();
    }

    private void finishTriage(boolean degraded, String trigger) {
        List<String> notes = session.getTriageNotes();
        String summary = String.join(" | ", notes);
        session.completeTriage(summary, degraded);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("turns", notes.size());
        payload.put("degraded", degraded);
        payload.put("summary", summary);
        deps.ledger().append(getSessionId(), EventKind.TRIAGE_COMPLETED, payload);
        transition(Phase.SUPPORT_LOOP, trigger);
    }

    private ResourceBundle deliverResources(int turnNumber, String trigger) {
        transition(Phase.RESOURCES, trigger);
        ResourceBundle bundle = deps.resourceDirectory().lookup(session.getLocale(), resourceCategory());

        List<String> ids = new ArrayList<>();
        for (SupportResource r : bundle.resources()) {
            ids.add(r.id());
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("turn", turnNumber);
        payload.put("locale", bundle.locale());
        payload.put("category", bundle.category());
        payload.put("emergencyNumber", bundle.emergencyNumber());
        payload.put("resources", ids);
        deps.ledger().append(getSessionId(), EventKind.RESOURCES_DELIVERED, payload);

        long now = deps.clock().millis();
        CloseReason due = dueClosure(now);
        if (due == null && session.getMessageCount() >= policy.maxMessages()) {
            due = CloseReason.MESSAGE_CAP;
        }
        if (due != null) {
            close(due);
        } else {
            transition(Phase.SUPPORT_LOOP, "resources_delivered");
        }
        return bundle;
    }

    private String resourceCategory() {
        List<RiskVerdict> history = session.getRiskHistory();
        if (!history.isEmpty()) {
            List<String> signals = history.get(history.size() - 1).signals();
            if (signals.contains("keyword:abuse")) {
                return ResourceDirectoryService.CATEGORY_DOMESTIC_VIOLENCE;
            }
            for (String s : signals) {
                if (s.contains("suicide") || s.contains("self_harm") || s.startsWith("pattern:")) {
                    return ResourceDirectoryService.CATEGORY_SUICIDE_PREVENTION;
                }
            }
        }
        for (String previous : session.getRecentTurns(policy.riskContextTurns())) {
            if (SUBSTANCE_HINT.matcher(previous).find()) {
                return ResourceDirectoryService.CATEGORY_SUBSTANCE_ABUSE;
            }
        }
        return ResourceDirectoryService.CATEGORY_MENTAL_HEALTH;
    }

    // ========== 風險與升級 ==========

    private void recordVerdict(RiskVerdict verdict, int turnNumber, Phase phase) {
        session.addRiskVerdict(verdict);
        Map<String, Object> payload = verdict.toPayload();
        payload.put("turn", turnNumber);
        payload.put("phase", phase.name());
        payload.put("riskCheck", phase == Phase.SUPPORT_LOOP);
        deps.ledger().append(getSessionId(),
                verdict.degraded() ? EventKind.RISK_DEGRADED : EventKind.RISK_ASSESSED, payload);
        if (verdict.severity().isAtLeast(Severity.MEDIUM)) {
            logger.warn("風險判定: session={}, severity={}, degraded={}",
                    getSessionId(), verdict.severity(), verdict.degraded());
        }
    }

    /**
     * 遮罩失敗時看不到原文，保守地至少視為 MEDIUM 並標記 degraded
     */
    private RiskVerdict failedClosedVerdict(RiskVerdict verdict, long now) {
        List<String> signals = new ArrayList<>(verdict.signals());
        signals.add("redaction:failed_closed");
        return new RiskVerdict(Severity.max(verdict.severity(), Severity.MEDIUM), verdict.confidence(),
                signals, true, now);
    }

    private void startEscalation(Severity severity, String trigger) {
        Map<String, Object> extra = new LinkedHashMap<>();
        extra.put("severity", severity.name());
        transition(Phase.ESCALATE, trigger, extra);
        runCoordinator(severity);
    }

    /**
     * @return 升級是否已結束（Session 已關閉）
     */
    private boolean runCoordinator(Severity severity) {
        try {
            EscalationPlan plan = deps.coordinator().escalate(getSessionId(), severity, contextSummary(severity),
                    session.getLocale());
            session.attachEscalationPlan(plan);
            if (!plan.isResolved()) {
                throw new IllegalStateException("coordinator returned unresolved plan " + plan.getPlanId());
            }
            close(plan.getStatus() == EscalationStatus.COMPLETED
                    ? CloseReason.ESCALATION_COMPLETED
                    : CloseReason.ESCALATION_FAILED);
            return true;
        } catch (RuntimeException e) {
            logger.error("升級協調失敗: session={}, retries={}: {}",
                    getSessionId(), session.getEscalationRetries(), e.getMessage());
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("severity", severity.name());
            payload.put("retries", session.getEscalationRetries());
            payload.put("maxRetries", policy.maxEscalationRetries());
            payload.put("error", e.getClass().getSimpleName());
            deps.ledger().append(getSessionId(), EventKind.ESCALATION_UNRESOLVED, payload);
            return false;
        }
    }

    private void forceEscalationFailure(Severity severity) {
        try {
            EscalationPlan plan = deps.coordinator().abandon(getSessionId(), severity, session.getLocale(),
                    "escalation_retries_exhausted");
            session.attachEscalationPlan(plan);
        } catch (RuntimeException e) {
            logger.error("強制結束升級時發生錯誤: session={}: {}", getSessionId(), e.getMessage());
        }
        close(CloseReason.ESCALATION_FAILED);
    }

    private Severity highestSeverity() {
        Severity max = policy.escalationThreshold();
        for (RiskVerdict v : session.getRiskHistory()) {
            max = Severity.max(max, v.severity());
        }
        return max;
    }

    private String contextSummary(Severity severity) {
        StringBuilder sb = new StringBuilder();
        sb.append("severity=").append(severity.name());
        if (session.getTriageSummary() != null && !session.getTriageSummary().isBlank()) {
            sb.append("\ntriage: ").append(session.getTriageSummary());
        }
        List<String> recent = session.getRecentTurns(policy.riskContextTurns());
        if (!recent.isEmpty()) {
            sb.append("\nrecent:\n").append(String.join("\n", recent));
        }
        return sb.toString();
    }

    // ========== 轉移與關閉 ==========

    private void transition(Phase to, String trigger) {
        transition(to, trigger, Map.of());
    }

    private void transition(Phase to, String trigger, Map<String, Object> extra) {
        Phase from = session.getPhase();
        TransitionTable.check(from, to);
        session.enterPhase(to, deps.clock().millis());

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("from", from.name());
        payload.put("to", to.name());
        payload.put("trigger", trigger);
        payload.putAll(extra);
        deps.ledger().append(getSessionId(), EventKind.PHASE_TRANSITION, payload);
        logger.info("階段轉移: session={}, {} -> {} ({})", getSessionId(), from, to, trigger);
    }

    private void close(CloseReason reason) {
        Phase from = session.getPhase();
        long now = deps.clock().millis();
        // 先記錄關閉時間，階段轉為 CLOSE 後 closedAtMs 一定有值
        session.markClosed(reason, now);
        transition(Phase.CLOSE, reason.code());

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("reason", reason.code());
        payload.put("from", from.name());
        payload.put("messageCount", session.getMessageCount());
        deps.ledger().append(getSessionId(), EventKind.SESSION_CLOSED, payload);
        logger.info("Session 已關閉: session={}, reason={}, messages={}",
                getSessionId(), reason.code(), session.getMessageCount());
    }

    /**
     * 依優先順序回傳應關閉的原因：總時限、同意逾時、閒置逾時；ESCALATE 只受總時限約束
     */
    private CloseReason dueClosure(long now) {
        if (now - session.getCreatedAtMs() >= policy.hardTimeoutMs()) {
            return CloseReason.HARD_TIMEOUT;
        }
        Phase phase = session.getPhase();
        if (phase == Phase.ESCALATE) {
            return null;
        }
        if (phase == Phase.INIT && now - session.getPhaseEnteredAtMs() >= policy.consentTimeoutMs()) {
            return CloseReason.CONSENT_TIMEOUT;
        }
        if (now - session.getLastActivityAtMs() >= policy.idleTimeoutMs()) {
            return CloseReason.IDLE_TIMEOUT;
        }
        return null;
    }

    private void persist() {
        deps.archiveRepository().saveSession(SessionSnapshot.of(session));
    }

    private SessionClosedException closedException() {
        CloseReason reason = session.getCloseReason();
        return new SessionClosedException(getSessionId(), reason != null ? reason.code() : null);
    }

    // ========== 回覆 ==========

    /**
     * 語言生成受時限約束；失敗時改用固定安全訊息並記錄 REPLY_FALLBACK，不影響階段推進
     */
    private String generate(Phase phase, int turnNumber) {
        String context = String.join("\n", session.getRecentTurns(Math.max(1, policy.riskContextTurns())));
        try {
            String reply = deps.executor().call(GENERATION,
                    () -> deps.generationClient().generate(phase, context), policy.generationTimeoutMs());
            if (reply != null && !reply.isBlank()) {
                return reply;
            }
            recordFallback(phase, turnNumber, "empty reply");
        } catch (CollaboratorTimeoutException e) {
            recordFallback(phase, turnNumber, e.getMessage());
        }
        return TemplateGenerationClient.SAFE_FALLBACK;
    }

    private void recordFallback(Phase phase, int turnNumber, String reason) {
        logger.warn("語言生成失敗，改用固定訊息: session={}, phase={}", getSessionId(), phase);
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("turn", turnNumber);
        payload.put("phase", phase.name());
        payload.put("reason", reason);
        deps.ledger().append(getSessionId(), EventKind.REPLY_FALLBACK, payload);
    }

    private String escalationReply() {
        EscalationPlan plan = session.getEscalationPlan();
        StringBuilder sb = new StringBuilder();
        if (plan != null && plan.hasEmergencyDirective()) {
            sb.append(plan.getEmergencyDirective());
        }
        if (plan != null && plan.getStatus() == EscalationStatus.COMPLETED) {
            appendLine(sb, "You are being connected with a crisis counselor now.");
        }
        if (plan != null && plan.getFallbackDirective() != null) {
            appendLine(sb, plan.getFallbackDirective());
        }
        if (sb.length() == 0) {
            sb.append(TemplateGenerationClient.messageFor(Phase.ESCALATE));
            appendLine(sb, "If you need to talk to someone right now, call or text "
                    + deps.resourceDirectory().crisisLine() + ".");
        }
        return sb.toString();
    }

    private String closingReply() {
        return TemplateGenerationClient.messageFor(Phase.CLOSE);
    }

    private static String formatResources(ResourceBundle bundle) {
        StringBuilder sb = new StringBuilder(TemplateGenerationClient.messageFor(Phase.RESOURCES));
        for (SupportResource r : bundle.resources()) {
            sb.append("\n- ").append(r.name());
            if (r.phone() != null) {
                sb.append(" | Phone: ").append(r.phone());
            }
            if (r.textNumber() != null) {
                sb.append(" | Text: ").append(r.textNumber());
            }
            if (r.website() != null) {
                sb.append(" | ").append(r.website());
            }
        }
        sb.append("\nIn an emergency, call ").append(bundle.emergencyNumber()).append('.');
        return sb.toString();
    }

    private static void appendLine(StringBuilder sb, String line) {
        if (sb.length() > 0) {
            sb.append('\n');
        }
        sb.append(line);
    }

    private TurnResult result(int turnNumber, String reply, RiskVerdict verdict, ResourceBundle resources) {
        CloseReason reason = session.getCloseReason();
        return new TurnResult(getSessionId(), turnNumber, session.getPhase(), reply, verdict,
                session.getEscalationPlan(), resources, session.isClosed(), reason != null ? reason.code() : null);
    }

    private static Map<String, Object> turnPayload(Turn turn) {
        List<Map<String, Object>> entities = new ArrayList<>();
        for (RedactedEntity e : turn.entities()) {
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("type", e.type());
            m.put("start", e.start());
            m.put("end", e.end());
            m.put("token", e.token());
            entities.add(m);
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("turn", turn.turnNumber());
        payload.put("phase", turn.phase().name());
        payload.put("rawLength", turn.rawLength());
        payload.put("text", turn.sanitizedText());
        payload.put("entities", entities);
        payload.put("consent", turn.consent().name());
        payload.put("exitRequested", turn.exitRequested());
        payload.put("resourceRequested", turn.resourceRequested());
        return payload;
    }

    // ========== 重播 ==========

    /**
     * 以事件串流重建 State Machine (Replay)
     * <p>
     * 流程：
     * 1. 依 sequence 逐筆套用；PHASE_TRANSITION 的起點必須等於目前階段，且須在轉移表內。
     * 2. RISK_ASSESSED / RISK_DEGRADED 依序重建風險歷史。
     * 3. TURN_RECEIVED 還原訊息數、最近活動時間與分流紀錄。
     * 4. 升級事件重建升級計畫的狀態。
     * <p>
     * 重播不會附加任何事件，也不會呼叫協作者。
     *
     * @throws IllegalStateException 串流中有表外轉移或跳號
     */
    public static SessionStateMachine restore(SessionStateMachineFactory deps, String sessionId, String locale,
                                              Map<String, String> metadata, long createdAtMs,
                                              List<LedgerEvent> events) {
        SupportSession session = new SupportSession(sessionId, locale, metadata, createdAtMs);
        int messageCount = 0;
        long lastActivity = createdAtMs;
        long expectedSeq = 1;
        EscalationPlan plan = null;

        for (LedgerEvent e : events) {
            if (e.sequence() != expectedSeq) {
                throw new IllegalStateException("event stream gap at seq " + e.sequence() + ", expected " + expectedSeq);
            }
            expectedSeq++;

            switch (e.kind()) {
                case TURN_RECEIVED -> {
                    messageCount = intValue(e.get("turn"), messageCount + 1);
                    lastActivity = Math.max(lastActivity, e.timestampMs());
                    String text = e.getString("text");
                    if (text != null && !text.isBlank()) {
                        session.rememberTurn(text, deps.policy().riskContextTurns());
                        if (Phase.TRIAGE.name().equals(e.getString("phase"))) {
                            session.addTriageNote(text);
                        }
                    }
                }
                case RISK_ASSESSED, RISK_DEGRADED -> session.addRiskVerdict(RiskVerdict.fromPayload(e.payload()));
                case PHASE_TRANSITION -> {
                    Phase from = Phase.valueOf(e.getString("from"));
                    Phase to = Phase.valueOf(e.getString("to"));
                    if (from != session.getPhase()) {
                        throw new IllegalStateException("transition at seq " + e.sequence() + " starts from "
                                + from + " but session is in " + session.getPhase());
                    }
                    TransitionTable.check(from, to);
                    session.enterPhase(to, e.timestampMs());
                    if (to == Phase.CONSENTED) {
                        session.markConsented();
                    }
                }
                case TRIAGE_COMPLETED -> session.completeTriage(e.getString("summary"),
                        Boolean.TRUE.equals(e.get("degraded")));
                case ESCALATION_STARTED -> {
                    plan = new EscalationPlan(sessionId,
                            Severity.parse(e.getString("severity"), Severity.HIGH),
                            e.getString("channel"),
                            EscalationPlan.Priority.valueOf(e.getString("priority")),
                            e.timestampMs());
                    plan.markInProgress();
                }
                case EMERGENCY_DIRECTIVE -> {
                    if (plan != null) {
                        plan.attachEmergencyDirective(e.getString("directive"));
                    }
                }
                case HANDOFF_ATTEMPT -> {
                    if (plan != null) {
                        plan.recordAttempt();
                    }
                }
                case ESCALATION_RESOLVED -> {
                    if (plan != null) {
                        if (e.getString("fallbackDirective") != null) {
                            plan.attachFallbackDirective(e.getString("fallbackDirective"));
                        }
                        if (EscalationStatus.COMPLETED.name().equals(e.getString("status"))) {
                            plan.complete(e.timestampMs());
                        } else {
                            plan.fail(e.getString("failureReason"), e.timestampMs());
                        }
                        session.attachEscalationPlan(plan);
                    }
                }
                case ESCALATION_UNRESOLVED -> {
                    int retries = intValue(e.get("retries"), 0);
                    while (session.getEscalationRetries() < retries) {
                        session.incrementEscalationRetries();
                    }
                }
                case SESSION_CLOSED -> session.markClosed(CloseReason.fromCode(e.getString("reason")), e.timestampMs());
                default -> {
                    // 其餘事件不影響狀態
                }
            }
        }

        session.restoreCounters(messageCount, lastActivity);
        return new SessionStateMachine(session, deps);
    }

    private static int intValue(Object value, int fallback) {
        return value instanceof Number n ? n.intValue() : fallback;
    }
}
