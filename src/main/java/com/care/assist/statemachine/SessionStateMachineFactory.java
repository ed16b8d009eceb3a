package com.care.assist.statemachine;

import com.care.assist.client.GenerationClient;
import com.care.assist.config.SessionPolicy;
import com.care.assist.model.LedgerEvent;
import com.care.assist.model.SupportSession;
import com.care.assist.repository.SessionArchiveRepository;
import com.care.assist.service.EscalationCoordinatorService;
import com.care.assist.service.EventLedgerService;
import com.care.assist.service.RedactionService;
import com.care.assist.service.ResourceDirectoryService;
import com.care.assist.service.RiskMonitorService;
import com.care.assist.util.CollaboratorExecutor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.Map;

/**
 * 建立 State Machine，集中持有其所需的無狀態協作者
 */
@Component
public class SessionStateMachineFactory {

    private final SessionPolicy policy;
    private final RedactionService redactionService;
    private final RiskMonitorService riskMonitor;
    private final EventLedgerService ledger;
    private final ResourceDirectoryService resourceDirectory;
    private final EscalationCoordinatorService coordinator;
    private final GenerationClient generationClient;
    private final CollaboratorExecutor executor;
    private final SessionArchiveRepository archiveRepository;
    private final Clock clock;

    public SessionStateMachineFactory(SessionPolicy policy,
                                      RedactionService redactionService,
                                      RiskMonitorService riskMonitor,
                                      EventLedgerService ledger,
                                      ResourceDirectoryService resourceDirectory,
                                      EscalationCoordinatorService coordinator,
                                      GenerationClient generationClient,
                                      CollaboratorExecutor executor,
                                      SessionArchiveRepository archiveRepository,
                                      Clock clock) {
        this.policy = policy;
        this.redactionService = redactionService;
        this.riskMonitor = riskMonitor;
        this.ledger = ledger;
        this.resourceDirectory = resourceDirectory;
        this.coordinator = coordinator;
        this.generationClient = generationClient;
        this.executor = executor;
        this.archiveRepository = archiveRepository;
        this.clock = clock;
    }

    public SessionStateMachine create(SupportSession session) {
        return new SessionStateMachine(session, this);
    }

    /**
     * 以事件串流重建 State Machine，詳見 {@link SessionStateMachine#restore}
     */
    public SessionStateMachine restore(String sessionId, String locale, Map<String, String> metadata,
                                       long createdAtMs, List<LedgerEvent> events) {
        return SessionStateMachine.restore(this, sessionId, locale, metadata, createdAtMs, events);
    }

    SessionPolicy policy() {
        return policy;
    }

    RedactionService redactionService() {
        return redactionService;
    }

    RiskMonitorService riskMonitor() {
        return riskMonitor;
    }

    EventLedgerService ledger() {
        return ledger;
    }

    ResourceDirectoryService resourceDirectory() {
        return resourceDirectory;
    }

    EscalationCoordinatorService coordinator() {
        return coordinator;
    }

    GenerationClient generationClient() {
        return generationClient;
    }

    CollaboratorExecutor executor() {
        return executor;
    }

    SessionArchiveRepository archiveRepository() {
        return archiveRepository;
    }

    Clock clock() {
        return clock;
    }
}
