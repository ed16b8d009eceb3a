package com.care.assist.test;

import com.care.assist.client.GenerationClient;
import com.care.assist.client.HandoffClient;
import com.care.assist.client.RiskClassifierClient;
import com.care.assist.client.impl.TemplateGenerationClient;
import com.care.assist.config.SessionPolicy;
import com.care.assist.model.ConsentSignal;
import com.care.assist.model.EventKind;
import com.care.assist.model.LedgerEvent;
import com.care.assist.model.SessionSnapshot;
import com.care.assist.model.TurnInput;
import com.care.assist.repository.impl.FileBackedSessionArchiveRepository;
import com.care.assist.service.EscalationCoordinatorService;
import com.care.assist.service.impl.EscalationCoordinatorServiceImpl;
import com.care.assist.service.impl.EventLedgerServiceImpl;
import com.care.assist.service.impl.InMemoryObservabilitySink;
import com.care.assist.service.impl.RedactionServiceImpl;
import com.care.assist.service.impl.ResourceDirectoryServiceImpl;
import com.care.assist.service.impl.RiskMonitorServiceImpl;
import com.care.assist.service.impl.SessionRegistryServiceImpl;
import com.care.assist.statemachine.SessionStateMachineFactory;
import com.care.assist.util.CollaboratorExecutor;
import com.care.assist.util.KeywordRiskMatcher;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.mockito.Mockito.mock;

/**
 * 以真實元件組成的測試環境（不啟動 Spring），外部協作者可替換
 */
public class AssistTestFixture {

    public static final long START = 1_700_000_000_000L;

    public final MutableClock clock = new MutableClock(START);
    public final SessionPolicy policy;
    public final RedactionServiceImpl redaction = new RedactionServiceImpl("test-token-key", 8000);
    public final InMemoryObservabilitySink sink = new InMemoryObservabilitySink(10_000);
    public final FileBackedSessionArchiveRepository archive;
    public final EventLedgerServiceImpl ledger;
    public final ResourceDirectoryServiceImpl resources = new ResourceDirectoryServiceImpl("resource-directory.json");
    public final CollaboratorExecutor executor = new CollaboratorExecutor(4, 16, 100);
    public final HandoffClient handoff;
    public final RiskMonitorServiceImpl riskMonitor;
    public final EscalationCoordinatorService coordinator;
    public final SessionStateMachineFactory factory;
    public final SessionRegistryServiceImpl registry;

    public AssistTestFixture(SessionPolicy policy) {
        this(policy, null, null, null, null);
    }

    public AssistTestFixture(SessionPolicy policy,
                             HandoffClient handoff,
                             RiskClassifierClient classifier,
                             EscalationCoordinatorService coordinator,
                             GenerationClient generation) {
        this(policy, new FileBackedSessionArchiveRepository(""), handoff, classifier, coordinator, generation);
    }

    /**
     * 共用同一個封存（例如指向同一個資料目錄），模擬服務重啟
     */
    public AssistTestFixture(SessionPolicy policy,
                             FileBackedSessionArchiveRepository archive,
                             HandoffClient handoff,
                             RiskClassifierClient classifier,
                             EscalationCoordinatorService coordinator,
                             GenerationClient generation) {
        this.policy = policy;
        this.archive = archive;
        this.handoff = handoff != null ? handoff : mock(HandoffClient.class);
        // 訂閱者直接在附加執行緒上收到事件，方便斷言
        this.ledger = new EventLedgerServiceImpl(redaction, sink, archive, clock, Runnable::run);
        this.riskMonitor = new RiskMonitorServiceImpl(KeywordRiskMatcher.fromClasspath("risk-keywords.json"),
                Optional.ofNullable(classifier), executor, policy, clock);
        this.coordinator = coordinator != null
                ? coordinator
                : new EscalationCoordinatorServiceImpl(ledger, resources, this.handoff, executor, policy, clock);
        this.factory = new SessionStateMachineFactory(policy, redaction, riskMonitor, ledger, resources,
                this.coordinator, generation != null ? generation : new TemplateGenerationClient(),
                executor, archive, clock);
        // 清理工作直接在呼叫執行緒上執行，方便斷言
        this.registry = new SessionRegistryServiceImpl(factory, ledger, archive, policy, clock, Runnable::run);
    }

    public String newSession() {
        SessionSnapshot snapshot = registry.createSession("US", Map.of("channel", "web"));
        return snapshot.sessionId();
    }

    /**
     * 建立 Session 並走到 SUPPORT_LOOP（同意 + 一次分流）
     */
    public String sessionInSupportLoop() {
        String id = newSession();
        registry.submitTurn(id, TurnInput.consent(ConsentSignal.GRANTED));
        registry.submitTurn(id, TurnInput.message("I have been feeling low since I moved to a new city"));
        return id;
    }

    public List<LedgerEvent> events(String sessionId) {
        return ledger.replay(sessionId, 1);
    }

    public List<EventKind> kinds(String sessionId) {
        return events(sessionId).stream().map(LedgerEvent::kind).toList();
    }

    public void shutdown() {
        executor.shutdown();
    }
}
