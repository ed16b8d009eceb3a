package com.care.assist.test;

import com.care.assist.client.RiskClassifierClient;
import com.care.assist.config.SessionPolicy;
import com.care.assist.exception.SessionClosedException;
import com.care.assist.model.ClassifierResult;
import com.care.assist.model.ConsentSignal;
import com.care.assist.model.EscalationStatus;
import com.care.assist.model.EventKind;
import com.care.assist.model.LedgerEvent;
import com.care.assist.model.Phase;
import com.care.assist.model.SessionSnapshot;
import com.care.assist.model.Severity;
import com.care.assist.model.TransferStatus;
import com.care.assist.model.TurnInput;
import com.care.assist.model.TurnResult;
import com.care.assist.statemachine.SessionStateMachine;
import com.care.assist.statemachine.TransitionTable;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Session 狀態機情境測試
 * <p>
 * 以真實元件組合執行，外部轉接與分類器以 Mockito 或簡單實作替換。
 */
public class SessionStateMachineTest {

    private static final String NEUTRAL = "I had a long day at work and I feel tired";

    private AssistTestFixture fixture;

    @AfterEach
    public void tearDown() {
        if (fixture != null) {
            fixture.shutdown();
        }
    }

    private AssistTestFixture fixture(SessionPolicy policy) {
        fixture = new AssistTestFixture(policy);
        return fixture;
    }

    // ========== 同意 ==========

    @Test
    @DisplayName("拒絕同意：記錄 GUARD_VIOLATION 並停留在 INIT，同意逾時後關閉")
    public void testConsentDeniedThenTimeout() {
        AssistTestFixture f = fixture(SessionPolicy.defaults());
        String id = f.newSession();

        TurnResult result = f.registry.submitTurn(id, TurnInput.consent(ConsentSignal.DENIED));

        assertEquals(Phase.INIT, result.phase());
        assertFalse(result.closed());
        assertEquals(List.of(EventKind.SESSION_CREATED, EventKind.TURN_RECEIVED, EventKind.GUARD_VIOLATION),
                f.kinds(id));
        LedgerEvent guard = f.events(id).get(2);
        assertEquals("consent_required", guard.getString("guard"));
        assertEquals("DENIED", guard.getString("signal"));

        f.clock.advance(Duration.ofMillis(f.policy.consentTimeoutMs()));
        f.registry.sweep();

        SessionSnapshot snapshot = f.registry.getSession(id);
        assertEquals(Phase.CLOSE, snapshot.phase());
        assertEquals("consent_timeout", snapshot.closeReason());

        SessionClosedException ex = assertThrows(SessionClosedException.class,
                () -> f.registry.submitTurn(id, TurnInput.message("hello?")));
        assertEquals("consent_timeout", ex.getCloseReason());
    }

    @Test
    @DisplayName("未同意前的一般訊息不會推進階段")
    public void testMessageWithoutConsentStaysInInit() {
        AssistTestFixture f = fixture(SessionPolicy.defaults());
        String id = f.newSession();

        TurnResult result = f.registry.submitTurn(id, TurnInput.message(NEUTRAL));

        assertEquals(Phase.INIT, result.phase());
        assertTrue(f.kinds(id).contains(EventKind.GUARD_VIOLATION));
        assertFalse(f.registry.getSession(id).consented());
    }

    @Test
    @DisplayName("同意後進入 TRIAGE，完成分流後進入 SUPPORT_LOOP")
    public void testConsentAndTriage() {
        AssistTestFixture f = fixture(SessionPolicy.defaults());
        String id = f.newSession();

        TurnResult consented = f.registry.submitTurn(id, TurnInput.consent(ConsentSignal.GRANTED));
        assertEquals(Phase.TRIAGE, consented.phase());

        TurnResult triaged = f.registry.submitTurn(id,
                TurnInput.message("I have been feeling low since I moved to a new city"));
        assertEquals(Phase.SUPPORT_LOOP, triaged.phase());

        LedgerEvent completed = f.events(id).stream()
                .filter(e -> e.kind() == EventKind.TRIAGE_COMPLETED)
                .findFirst()
                .orElseThrow();
        assertEquals(false, completed.get("degraded"));
        assertTrue(completed.getString("summary").contains("new city"));
        assertTrue(f.registry.getSession(id).consented());
    }

    // ========== 風險快速通道 ==========

    @Test
    @DisplayName("CRITICAL：下一筆事件即轉入 ESCALATE，緊急指示先於轉接")
    public void testCriticalFastPath() {
        AssistTestFixture f = fixture(SessionPolicy.defaults());
        when(f.handoff.initiate(anyString())).thenReturn(TransferStatus.CONNECTED);
        String id = f.sessionInSupportLoop();
        long before = f.ledger.lastSequence(id);

        TurnResult result = f.registry.submitTurn(id, TurnInput.message("I am going to kill myself tonight"));

        List<LedgerEvent> events = f.ledger.replay(id, before + 1);
        List<EventKind> kinds = events.stream().map(LedgerEvent::kind).toList();
        assertEquals(List.of(
                EventKind.TURN_RECEIVED,
                EventKind.RISK_ASSESSED,
                EventKind.PHASE_TRANSITION,
                EventKind.ESCALATION_STARTED,
                EventKind.EMERGENCY_DIRECTIVE,
                EventKind.HANDOFF_ATTEMPT,
                EventKind.ESCALATION_RESOLVED,
                EventKind.PHASE_TRANSITION,
                EventKind.SESSION_CLOSED), kinds);

        LedgerEvent assessed = events.get(1);
        assertEquals("CRITICAL", assessed.getString("severity"));
        assertEquals(true, assessed.get("riskCheck"));

        LedgerEvent toEscalate = events.get(2);
        assertEquals("SUPPORT_LOOP", toEscalate.getString("from"));
        assertEquals("ESCALATE", toEscalate.getString("to"));
        assertEquals("risk_check", toEscalate.getString("trigger"));

        assertEquals("911", events.get(4).getString("emergencyNumber"));
        assertEquals("emergency_services", events.get(3).getString("channel"));
        assertEquals("URGENT", events.get(3).getString("priority"));

        assertTrue(result.closed());
        assertEquals("escalation_completed", result.closeReason());
        assertEquals(EscalationStatus.COMPLETED, result.escalation().getStatus());
        assertTrue(result.reply().contains("911"));
        assertEquals(Severity.CRITICAL, result.verdict().severity());
    }

    @Test
    @DisplayName("HIGH 且轉接用盡：FAILED 並附上危機專線後備指示")
    public void testHighEscalationExhausted() {
        AssistTestFixture f = fixture(SessionPolicy.defaults());
        when(f.handoff.initiate(anyString())).thenReturn(TransferStatus.BUSY);
        String id = f.sessionInSupportLoop();

        TurnResult result = f.registry.submitTurn(id, TurnInput.message("I want to die"));

        assertEquals("escalation_failed", result.closeReason());
        assertEquals(EscalationStatus.FAILED, result.escalation().getStatus());
        assertEquals(3, result.escalation().getAttempts());
        assertTrue(result.reply().contains("988"));
        assertFalse(f.kinds(id).contains(EventKind.EMERGENCY_DIRECTIVE));
        verify(f.handoff, times(3)).initiate(anyString());
    }

    @Test
    @DisplayName("同一回合同時要求結束與高風險時，升級優先")
    public void testEscalationBeatsExit() {
        AssistTestFixture f = fixture(SessionPolicy.defaults());
        when(f.handoff.initiate(anyString())).thenReturn(TransferStatus.CONNECTED);
        String id = f.sessionInSupportLoop();

        TurnResult result = f.registry.submitTurn(id,
                new TurnInput("I want to die, goodbye", ConsentSignal.REVOKED, true, false));

        assertEquals("escalation_completed", result.closeReason());
        assertTrue(f.kinds(id).contains(EventKind.ESCALATION_STARTED));
    }

    @Test
    @DisplayName("同意前（INIT）出現高風險同樣升級")
    public void testRiskAssessedBeforeConsent() {
        AssistTestFixture f = fixture(SessionPolicy.defaults());
        when(f.handoff.initiate(anyString())).thenReturn(TransferStatus.CONNECTED);
        String id = f.newSession();

        TurnResult result = f.registry.submitTurn(id, TurnInput.message("I want to die"));

        assertTrue(result.closed());
        LedgerEvent toEscalate = f.events(id).stream()
                .filter(e -> e.kind() == EventKind.PHASE_TRANSITION)
                .findFirst()
                .orElseThrow();
        assertEquals("INIT", toEscalate.getString("from"));
        assertEquals("ESCALATE", toEscalate.getString("to"));
        assertEquals("risk", toEscalate.getString("trigger"));
    }

    @Test
    @DisplayName("分類器逾時：RISK_DEGRADED，一般訊息不觸發升級")
    public void testClassifierTimeoutDegradesWithoutEscalation() {
        RiskClassifierClient slow = text -> {
            try {
                Thread.sleep(2_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return new ClassifierResult(Severity.NONE, 1.0);
        };
        SessionPolicy policy = SessionPolicy.builder().classifierTimeoutMs(100).build();
        fixture = new AssistTestFixture(policy, null, slow, null, null);
        AssistTestFixture f = fixture;
        String id = f.sessionInSupportLoop();
        long before = f.ledger.lastSequence(id);

        TurnResult result = f.registry.submitTurn(id, TurnInput.message(NEUTRAL));

        List<EventKind> kinds = f.ledger.replay(id, before + 1).stream().map(LedgerEvent::kind).toList();
        assertTrue(kinds.contains(EventKind.RISK_DEGRADED));
        assertFalse(kinds.contains(EventKind.ESCALATION_STARTED));
        assertEquals(Phase.SUPPORT_LOOP, result.phase());
        assertEquals(Severity.MEDIUM, result.verdict().severity());
        assertTrue(result.verdict().degraded());
    }

    @Test
    @DisplayName("遮罩失敗時保守判定並記錄 REDACTION_FAILURE")
    public void testRedactionFailureIsConservative() {
        AssistTestFixture f = fixture(SessionPolicy.defaults());
        String id = f.sessionInSupportLoop();
        long before = f.ledger.lastSequence(id);

        TurnResult result = f.registry.submitTurn(id, TurnInput.message("x".repeat(9000)));

        List<LedgerEvent> events = f.ledger.replay(id, before + 1);
        assertEquals(EventKind.TURN_RECEIVED, events.get(0).kind());
        assertEquals("[REDACTED]", events.get(0).getString("text"));
        assertEquals(EventKind.REDACTION_FAILURE, events.get(1).kind());
        assertEquals(EventKind.RISK_DEGRADED, events.get(2).kind());
        assertEquals(Severity.MEDIUM, result.verdict().severity());
        assertTrue(result.verdict().signals().contains("redaction:failed_closed"));
    }

    @Test
    @DisplayName("SUPPORT_LOOP 的空白訊息也會做風險檢查")
    public void testBlankSupportTurnIsRiskChecked() {
        AssistTestFixture f = fixture(SessionPolicy.defaults());
        String id = f.sessionInSupportLoop();
        long before = f.ledger.lastSequence(id);

        TurnResult result = f.registry.submitTurn(id, TurnInput.message("   "));

        assertEquals(Phase.SUPPORT_LOOP, result.phase());
        LedgerEvent assessed = f.ledger.replay(id, before + 1).stream()
                .filter(e -> e.kind() == EventKind.RISK_ASSESSED)
                .findFirst()
                .orElseThrow();
        assertEquals(true, assessed.get("riskCheck"));
        assertEquals("SUPPORT_LOOP", assessed.getString("phase"));
    }

    // ========== 結束條件 ==========

    @Test
    @DisplayName("達到訊息上限後關閉，之後的訊息被拒絕")
    public void testMessageCap() {
        AssistTestFixture f = fixture(SessionPolicy.builder().maxMessages(4).build());
        String id = f.sessionInSupportLoop();

        TurnResult third = f.registry.submitTurn(id, TurnInput.message(NEUTRAL));
        assertFalse(third.closed());
        TurnResult fourth = f.registry.submitTurn(id, TurnInput.message(NEUTRAL));
        assertTrue(fourth.closed());
        assertEquals("message_cap", fourth.closeReason());

        SessionClosedException ex = assertThrows(SessionClosedException.class,
                () -> f.registry.submitTurn(id, TurnInput.message(NEUTRAL)));
        assertEquals("message_cap", ex.getCloseReason());
        assertEquals(4, f.registry.getSession(id).messageCount());
    }

    @Test
    @DisplayName("使用者要求結束")
    public void testUserExit() {
        AssistTestFixture f = fixture(SessionPolicy.defaults());
        String id = f.sessionInSupportLoop();

        TurnResult result = f.registry.submitTurn(id, new TurnInput("thanks, bye", ConsentSignal.NONE, true, false));

        assertTrue(result.closed());
        assertEquals("user_exit", result.closeReason());
        LedgerEvent closed = f.events(id).get(f.events(id).size() - 1);
        assertEquals(EventKind.SESSION_CLOSED, closed.kind());
        assertEquals("SUPPORT_LOOP", closed.getString("from"));
    }

    @Test
    @DisplayName("撤回同意")
    public void testConsentRevoked() {
        AssistTestFixture f = fixture(SessionPolicy.defaults());
        String id = f.sessionInSupportLoop();

        TurnResult result = f.registry.submitTurn(id, TurnInput.consent(ConsentSignal.REVOKED));

        assertEquals("consent_revoked", result.closeReason());
        assertEquals(Phase.CLOSE, f.registry.getSession(id).phase());
    }

    @Test
    @DisplayName("總時限優先於閒置逾時")
    public void testHardTimeoutBeatsIdle() {
        AssistTestFixture f = fixture(SessionPolicy.defaults());
        String id = f.sessionInSupportLoop();

        f.clock.advance(Duration.ofMillis(f.policy.hardTimeoutMs()));

        SessionClosedException ex = assertThrows(SessionClosedException.class,
                () -> f.registry.submitTurn(id, TurnInput.message(NEUTRAL)));
        assertEquals("hard_timeout", ex.getCloseReason());
        assertEquals("hard_timeout", f.registry.getSession(id).closeReason());
    }

    @Test
    @DisplayName("閒置逾時由清理排程關閉")
    public void testIdleTimeoutViaSweep() {
        AssistTestFixture f = fixture(SessionPolicy.defaults());
        String id = f.sessionInSupportLoop();

        f.clock.advance(Duration.ofMillis(f.policy.idleTimeoutMs() - 1));
        assertEquals(0, f.registry.sweep());
        f.clock.advance(Duration.ofMillis(1));
        assertEquals(1, f.registry.sweep());

        assertEquals("idle_timeout", f.registry.getSession(id).closeReason());
        assertEquals(0, f.registry.activeCount());
    }

    @Test
    @DisplayName("分流逾時：以部分摘要標記 degraded 並進入 SUPPORT_LOOP")
    public void testTriageTimeout() {
        AssistTestFixture f = fixture(SessionPolicy.builder().triageRequiredTurns(3).build());
        String id = f.newSession();
        f.registry.submitTurn(id, TurnInput.consent(ConsentSignal.GRANTED));
        f.registry.submitTurn(id, TurnInput.message("I have been feeling low since I moved to a new city"));
        assertEquals(Phase.TRIAGE, f.registry.getSession(id).phase());

        f.clock.advance(Duration.ofMillis(f.policy.triageTimeoutMs()));
        f.registry.sweep();

        assertEquals(Phase.SUPPORT_LOOP, f.registry.getSession(id).phase());
        LedgerEvent completed = f.events(id).stream()
                .filter(e -> e.kind() == EventKind.TRIAGE_COMPLETED)
                .findFirst()
                .orElseThrow();
        assertEquals(true, completed.get("degraded"));
        assertEquals(1, completed.get("turns"));
    }

    // ========== 資源 ==========

    @Test
    @DisplayName("要求資源：經 RESOURCES 回到 SUPPORT_LOOP 並記錄 RESOURCES_DELIVERED")
    public void testResourceRequest() {
        AssistTestFixture f = fixture(SessionPolicy.defaults());
        String id = f.sessionInSupportLoop();
        long before = f.ledger.lastSequence(id);

        TurnResult result = f.registry.submitTurn(id,
                TurnInput.message("Is there a hotline I could reach out to?"));

        assertEquals(Phase.SUPPORT_LOOP, result.phase());
        assertNotNull(result.resources());
        assertFalse(result.resources().isEmpty());
        assertEquals("US", result.resources().locale());

        List<LedgerEvent> events = f.ledger.replay(id, before + 1);
        List<String> transitions = events.stream()
                .filter(e -> e.kind() == EventKind.PHASE_TRANSITION)
                .map(e -> e.getString("from") + "->" + e.getString("to"))
                .toList();
        assertEquals(List.of("SUPPORT_LOOP->RESOURCES", "RESOURCES->SUPPORT_LOOP"), transitions);
        LedgerEvent delivered = events.stream()
                .filter(e -> e.kind() == EventKind.RESOURCES_DELIVERED)
                .findFirst()
                .orElseThrow();
        assertEquals("911", delivered.getString("emergencyNumber"));
    }

    @Test
    @DisplayName("資源傳遞時正好達到訊息上限，直接關閉")
    public void testResourcesAtMessageCap() {
        AssistTestFixture f = fixture(SessionPolicy.builder().maxMessages(3).build());
        String id = f.sessionInSupportLoop();

        TurnResult result = f.registry.submitTurn(id, new TurnInput("", ConsentSignal.NONE, false, true));

        assertTrue(result.closed());
        assertEquals("message_cap", result.closeReason());
        assertNotNull(result.resources());
    }

    // ========== 轉移表與重播 ==========

    @Test
    @DisplayName("所有記錄的轉移都在轉移表內且首尾相接")
    public void testTransitionsAreLegal() {
        AssistTestFixture f = fixture(SessionPolicy.builder().maxMessages(6).build());
        when(f.handoff.initiate(anyString())).thenReturn(TransferStatus.FAILED);

        String a = f.sessionInSupportLoop();
        f.registry.submitTurn(a, new TurnInput("", ConsentSignal.NONE, false, true));
        f.registry.submitTurn(a, TurnInput.message(NEUTRAL));
        f.registry.submitTurn(a, TurnInput.message("I want to hurt myself right now"));

        String b = f.sessionInSupportLoop();
        f.registry.submitTurn(b, TurnInput.message(NEUTRAL));
        f.registry.submitTurn(b, new TurnInput("bye", ConsentSignal.NONE, true, false));

        for (String id : List.of(a, b)) {
            Phase current = Phase.INIT;
            for (LedgerEvent e : f.events(id)) {
                if (e.kind() != EventKind.PHASE_TRANSITION) {
                    continue;
                }
                Phase from = Phase.valueOf(e.getString("from"));
                Phase to = Phase.valueOf(e.getString("to"));
                assertEquals(current, from);
                assertTrue(TransitionTable.isAllowed(from, to), from + " -> " + to);
                assertNotEquals(Phase.RISK_CHECK, to);
                current = to;
            }
            assertEquals(Phase.CLOSE, current);
        }
    }

    @Test
    @DisplayName("CLOSE 為終止階段，ESCALATE 只能轉入 CLOSE")
    public void testTransitionTableShape() {
        assertTrue(TransitionTable.targetsOf(Phase.CLOSE).isEmpty());
        assertEquals(Set.of(Phase.CLOSE), TransitionTable.targetsOf(Phase.ESCALATE));
        for (Phase p : Phase.values()) {
            if (p != Phase.CLOSE) {
                assertTrue(TransitionTable.isAllowed(p, Phase.CLOSE), p + " 應可轉入 CLOSE");
            }
        }
        assertThrows(IllegalStateException.class, () -> TransitionTable.check(Phase.INIT, Phase.SUPPORT_LOOP));
    }

    @Test
    @DisplayName("以事件串流重播可重建階段、訊息數與風險歷史")
    public void testReplayReproducesState() {
        AssistTestFixture f = fixture(SessionPolicy.defaults());
        String id = f.sessionInSupportLoop();
        f.registry.submitTurn(id, TurnInput.message("I feel hopeless and overwhelmed"));
        f.registry.submitTurn(id, TurnInput.message("Is there a hotline I could reach out to?"));
        SessionSnapshot live = f.registry.getSession(id);

        SessionStateMachine restored = f.factory.restore(id, live.locale(), live.metadata(), live.createdAtMs(),
                f.events(id));
        SessionSnapshot replayed = restored.snapshot();

        assertEquals(live.phase(), replayed.phase());
        assertEquals(live.messageCount(), replayed.messageCount());
        assertEquals(live.consented(), replayed.consented());
        assertEquals(live.riskHistory(), replayed.riskHistory());
        assertEquals(Severity.LOW, replayed.riskHistory().get(1).severity());
        assertEquals(live.lastActivityAtMs(), replayed.lastActivityAtMs());
    }

    @Test
    @DisplayName("重播遇到表外轉移或跳號時失敗")
    public void testReplayRejectsCorruptStream() {
        AssistTestFixture f = fixture(SessionPolicy.defaults());
        String id = f.sessionInSupportLoop();
        List<LedgerEvent> events = f.events(id);

        List<LedgerEvent> gapped = new ArrayList<>(events);
        gapped.remove(1);
        assertThrows(IllegalStateException.class,
                () -> f.factory.restore(id, "US", Map.of(), AssistTestFixture.START, gapped));

        List<LedgerEvent> illegal = List.of(
                events.get(0),
                new LedgerEvent(id, 2, EventKind.PHASE_TRANSITION, AssistTestFixture.START,
                        Map.of("from", "INIT", "to", "SUPPORT_LOOP", "trigger", "bogus")));
        assertThrows(IllegalStateException.class,
                () -> f.factory.restore(id, "US", Map.of(), AssistTestFixture.START, illegal));
    }
}
