package com.care.assist.service.impl;

import com.care.assist.client.HandoffClient;
import com.care.assist.config.SessionPolicy;
import com.care.assist.exception.CollaboratorTimeoutException;
import com.care.assist.model.EscalationPlan;
import com.care.assist.model.EventKind;
import com.care.assist.model.Severity;
import com.care.assist.model.TransferStatus;
import com.care.assist.service.EscalationCoordinatorService;
import com.care.assist.service.EventLedgerService;
import com.care.assist.service.ResourceDirectoryService;
import com.care.assist.util.CollaboratorExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 升級協調服務實作 (Escalation Coordinator Implementation)
 * <p>
 * 流程：
 * 1. 建立計畫（PENDING → IN_PROGRESS），記錄 ESCALATION_STARTED。
 * 2. CRITICAL：在任何轉接之前，同步附上緊急電話指示並記錄 EMERGENCY_DIRECTIVE。
 * 3. 嘗試轉接，最多 {@code maxHandoffAttempts} 次，每次受時限約束並記錄 HANDOFF_ATTEMPT。
 * 4. 接通即 COMPLETED；用盡則 FAILED，HIGH 附上危機專線作為後備指示。
 * 5. 記錄 ESCALATION_RESOLVED。
 */
@Service
public class EscalationCoordinatorServiceImpl implements EscalationCoordinatorService {

    private static final Logger logger = LoggerFactory.getLogger(EscalationCoordinatorServiceImpl.class);

    static final String HANDOFF = "handoff";
    static final String CHANNEL_EMERGENCY = "emergency_services";
    static final String CHANNEL_CRISIS_LINE = "crisis_line";

    private final EventLedgerService ledger;
    private final ResourceDirectoryService resourceDirectory;
    private final HandoffClient handoffClient;
    private final CollaboratorExecutor executor;
    private final SessionPolicy policy;
    private final Clock clock;

    public EscalationCoordinatorServiceImpl(EventLedgerService ledger,
                                            ResourceDirectoryService resourceDirectory,
                                            HandoffClient handoffClient,
                                            CollaboratorExecutor executor,
                                            SessionPolicy policy,
                                            Clock clock) {
        this.ledger = ledger;
        this.resourceDirectory = resourceDirectory;
        this.handoffClient = handoffClient;
        this.executor = executor;
        this.policy = policy;
        this.clock = clock;
    }

    @Override
    public EscalationPlan escalate(String sessionId, Severity severity, String contextSummary, String locale) {
        EscalationPlan plan = start(sessionId, severity);
        logger.warn("啟動升級: session={}, severity={}, planId={}", sessionId, severity, plan.getPlanId());

        if (severity == Severity.CRITICAL) {
            String emergency = resourceDirectory.emergencyNumber(locale);
            String crisisLine = resourceDirectory.crisisLine();
            String directive = emergencyDirective(emergency, crisisLine);
            plan.attachEmergencyDirective(directive);

            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("planId", plan.getPlanId());
            payload.put("emergencyNumber", emergency);
            payload.put("crisisLine", crisisLine);
            payload.put("directive", directive);
            ledger.append(sessionId, EventKind.EMERGENCY_DIRECTIVE, payload);
        }

        TransferStatus last = null;
        for (int i = 0; i < policy.maxHandoffAttempts(); i++) {
            last = attemptHandoff(contextSummary);
            int attempt = plan.recordAttempt();

            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("planId", plan.getPlanId());
            payload.put("attempt", attempt);
            payload.put("outcome", last.name());
            ledger.append(sessionId, EventKind.HANDOFF_ATTEMPT, payload);

            if (last.isConnected()) {
                plan.complete(clock.millis());
                break;
            }
            if (last == TransferStatus.UNAVAILABLE) {
                break;
            }
        }

        if (!plan.isResolved()) {
            String reason = last == TransferStatus.UNAVAILABLE ? "handoff_unavailable" : "handoff_exhausted";
            if (severity == Severity.HIGH) {
                plan.attachFallbackDirective(crisisLineDirective(resourceDirectory.crisisLine()));
            }
            plan.fail(reason, clock.millis());
            logger.warn("轉接未成功: session={}, attempts={}, reason={}", sessionId, plan.getAttempts(), reason);
        }

        resolve(plan, false);
        return plan;
    }

    @Override
    public EscalationPlan abandon(String sessionId, Severity severity, String locale, String reason) {
        EscalationPlan plan = start(sessionId, severity);
        if (severity == Severity.CRITICAL) {
            plan.attachEmergencyDirective(emergencyDirective(resourceDirectory.emergencyNumber(locale),
                    resourceDirectory.crisisLine()));
        }
        plan.attachFallbackDirective(crisisLineDirective(resourceDirectory.crisisLine()));
        plan.fail(reason, clock.millis());
        logger.error("升級重試用盡，強制結束: session={}, reason={}", sessionId, reason);
        resolve(plan, true);
        return plan;
    }

    private EscalationPlan start(String sessionId, Severity severity) {
        boolean critical = severity == Severity.CRITICAL;
        EscalationPlan plan = new EscalationPlan(
                sessionId,
                severity,
                critical ? CHANNEL_EMERGENCY : CHANNEL_CRISIS_LINE,
                critical ? EscalationPlan.Priority.URGENT : EscalationPlan.Priority.HIGH,
                clock.millis());
        plan.markInProgress();

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("planId", plan.getPlanId());
        payload.put("severity", severity.name());
        payload.put("channel", plan.getChannel());
        payload.put("priority", plan.getPriority().name());
        ledger.append(sessionId, EventKind.ESCALATION_STARTED, payload);
        return plan;
    }

    private void resolve(EscalationPlan plan, boolean forced) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("planId", plan.getPlanId());
        payload.put("status", plan.getStatus().name());
        payload.put("attempts", plan.getAttempts());
        payload.put("failureReason", plan.getFailureReason());
        payload.put("fallbackDirective", plan.getFallbackDirective());
        payload.put("forced", forced);
        ledger.append(plan.getSessionId(), EventKind.ESCALATION_RESOLVED, payload);
    }

    private TransferStatus attemptHandoff(String contextSummary) {
        try {
            TransferStatus status = executor.call(HANDOFF, () -> handoffClient.initiate(contextSummary),
                    policy.handoffTimeoutMs());
            return status != null ? status : TransferStatus.FAILED;
        } catch (CollaboratorTimeoutException e) {
            return e.getMessage() != null && e.getMessage().startsWith("timeout")
                    ? TransferStatus.TIMEOUT
                    : TransferStatus.FAILED;
        }
    }

    static String emergencyDirective(String emergencyNumber, String crisisLine) {
        return "If you are in immediate danger, please call " + emergencyNumber
                + " now. You can also call or text " + crisisLine + " to reach a crisis counselor.";
    }

    static String crisisLineDirective(String crisisLine) {
        return "Please call or text " + crisisLine + " to talk with a crisis counselor right now.";
    }
}
