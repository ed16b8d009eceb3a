package com.care.assist.test;

import com.care.assist.config.SessionPolicy;
import com.care.assist.exception.SessionClosedException;
import com.care.assist.exception.SessionNotFoundException;
import com.care.assist.model.EscalationPlan;
import com.care.assist.model.EventKind;
import com.care.assist.model.LedgerEvent;
import com.care.assist.model.Phase;
import com.care.assist.model.SessionSnapshot;
import com.care.assist.model.Severity;
import com.care.assist.model.TurnInput;
import com.care.assist.model.TurnResult;
import com.care.assist.repository.impl.FileBackedSessionArchiveRepository;
import com.care.assist.service.EscalationCoordinatorService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Session 註冊服務測試：建立、結束、清理、重新掛載與升級重試
 */
public class SessionRegistryServiceTest {

    private final List<AssistTestFixture> fixtures = new ArrayList<>();

    @AfterEach
    public void tearDown() {
        fixtures.forEach(AssistTestFixture::shutdown);
    }

    private AssistTestFixture fixture(SessionPolicy policy) {
        return track(new AssistTestFixture(policy));
    }

    private AssistTestFixture track(AssistTestFixture f) {
        fixtures.add(f);
        return f;
    }

    @Test
    @DisplayName("建立 Session：INIT、SESSION_CREATED 為第 1 筆事件並寫入封存")
    public void testCreateSession() {
        AssistTestFixture f = fixture(SessionPolicy.defaults());

        SessionSnapshot snapshot = f.registry.createSession("ca", Map.of("channel", "sms"));

        assertEquals(Phase.INIT, snapshot.phase());
        assertFalse(snapshot.consented());
        assertEquals("ca", snapshot.locale());
        LedgerEvent created = f.events(snapshot.sessionId()).get(0);
        assertEquals(1L, created.sequence());
        assertEquals(EventKind.SESSION_CREATED, created.kind());
        assertTrue(f.archive.findSession(snapshot.sessionId()).isPresent());
        assertEquals(1, f.registry.activeCount());
        assertEquals(1, f.registry.listActive().size());
    }

    @Test
    @DisplayName("找不到 Session 時拋出 SessionNotFoundException")
    public void testUnknownSession() {
        AssistTestFixture f = fixture(SessionPolicy.defaults());

        assertThrows(SessionNotFoundException.class, () -> f.registry.getSession("missing"));
        assertThrows(SessionNotFoundException.class,
                () -> f.registry.submitTurn("missing", TurnInput.message("hi")));
        assertThrows(SessionNotFoundException.class, () -> f.registry.reattach("missing"));
    }

    @Test
    @DisplayName("營運人員結束 Session，重複結束會被拒絕")
    public void testTerminate() {
        AssistTestFixture f = fixture(SessionPolicy.defaults());
        String id = f.sessionInSupportLoop();

        SessionSnapshot snapshot = f.registry.terminate(id);

        assertEquals(Phase.CLOSE, snapshot.phase());
        assertEquals("operator_terminated", snapshot.closeReason());
        assertThrows(SessionClosedException.class, () -> f.registry.terminate(id));
    }

    @Test
    @DisplayName("已關閉的 Session 超過保留時間後移出記憶體，仍可從封存查詢")
    public void testClosedSessionEviction() {
        AssistTestFixture f = fixture(SessionPolicy.defaults());
        String id = f.sessionInSupportLoop();
        f.registry.terminate(id);
        int eventCount = f.events(id).size();

        f.clock.advance(Duration.ofMillis(f.policy.closedRetentionMs()));
        f.registry.sweep();

        SessionSnapshot archived = f.registry.getSession(id);
        assertEquals("operator_terminated", archived.closeReason());
        assertEquals(eventCount, f.events(id).size());
        assertEquals(0L, f.ledger.lastSequence(id));

        SessionClosedException ex = assertThrows(SessionClosedException.class,
                () -> f.registry.submitTurn(id, TurnInput.message("hello")));
        assertEquals("operator_terminated", ex.getCloseReason());
    }

    @Test
    @DisplayName("關閉途中觸發清理排程不會移除 Session，事件 sequence 保持連續")
    public void testSweepDuringCloseKeepsStreamGapless(@TempDir Path dir) {
        SessionPolicy policy = SessionPolicy.defaults();
        FileBackedSessionArchiveRepository archive = new FileBackedSessionArchiveRepository(dir.toString());
        AssistTestFixture f = track(new AssistTestFixture(policy, archive, null, null, null, null));
        String id = f.sessionInSupportLoop();
        List<Integer> sweepResults = new ArrayList<>();
        f.ledger.subscribe(id, e -> {
            if (e.kind() == EventKind.PHASE_TRANSITION && "CLOSE".equals(e.getString("to"))) {
                sweepResults.add(f.registry.sweep());
            }
        });

        TurnResult result = f.registry.submitTurn(id, new TurnInput("goodbye", null, true, false));

        assertTrue(result.closed());
        assertEquals(List.of(0), sweepResults);
        List<LedgerEvent> archived = archive.loadEvents(id);
        for (int i = 0; i < archived.size(); i++) {
            assertEquals(i + 1L, archived.get(i).sequence(), "archived stream must be gapless");
        }
        assertEquals(EventKind.SESSION_CLOSED, archived.get(archived.size() - 1).kind());
        assertEquals(archived.size(), f.ledger.lastSequence(id));

        // 保留時間過後才移除
        f.clock.advance(Duration.ofMillis(policy.closedRetentionMs()));
        f.registry.sweep();
        assertEquals(0L, f.ledger.lastSequence(id));
        assertEquals("user_exit", f.registry.getSession(id).closeReason());
    }

    @Test
    @DisplayName("記憶體中仍在的 Session 重新掛載時直接回傳快照")
    public void testReattachLiveSession() {
        AssistTestFixture f = fixture(SessionPolicy.defaults());
        String id = f.sessionInSupportLoop();
        long last = f.ledger.lastSequence(id);

        SessionSnapshot snapshot = f.registry.reattach(id);

        assertEquals(Phase.SUPPORT_LOOP, snapshot.phase());
        assertEquals(last, f.ledger.lastSequence(id));
    }

    @Test
    @DisplayName("服務重啟後以資料目錄重新掛載，sequence 延續")
    public void testReattachFromDataDir(@TempDir Path dir) {
        SessionPolicy policy = SessionPolicy.defaults();
        AssistTestFixture before = track(new AssistTestFixture(policy,
                new FileBackedSessionArchiveRepository(dir.toString()), null, null, null, null));
        String id = before.sessionInSupportLoop();
        before.registry.submitTurn(id, TurnInput.message("I feel hopeless and overwhelmed"));
        long lastSeq = before.ledger.lastSequence(id);
        SessionSnapshot original = before.registry.getSession(id);

        assertTrue(Files.exists(dir.resolve(id + ".events.jsonl")));
        assertTrue(Files.exists(dir.resolve(id + ".session.json")));

        AssistTestFixture after = track(new AssistTestFixture(policy,
                new FileBackedSessionArchiveRepository(dir.toString()), null, null, null, null));
        after.clock.advance(Duration.ofMinutes(1));

        SessionSnapshot reattached = after.registry.reattach(id);

        assertEquals(Phase.SUPPORT_LOOP, reattached.phase());
        assertEquals(original.messageCount(), reattached.messageCount());
        assertEquals(original.riskHistory(), reattached.riskHistory());
        assertEquals(AssistTestFixture.START + 60_000L, reattached.lastActivityAtMs());
        assertEquals(lastSeq + 1, after.ledger.lastSequence(id));
        List<LedgerEvent> events = after.events(id);
        assertEquals(EventKind.SESSION_REATTACHED, events.get(events.size() - 1).kind());

        TurnResult result = after.registry.submitTurn(id, TurnInput.message("It helps to talk about it"));
        assertEquals(original.messageCount() + 1, result.turnNumber());

        List<LedgerEvent> stored = after.archive.loadEvents(id);
        for (int i = 0; i < stored.size(); i++) {
            assertEquals(i + 1, stored.get(i).sequence(), "封存的事件應連續不跳號");
        }
        assertEquals(after.ledger.lastSequence(id), stored.size());
    }

    @Test
    @DisplayName("已關閉的 Session 不可重新掛載")
    public void testReattachClosedSessionRejected(@TempDir Path dir) {
        SessionPolicy policy = SessionPolicy.defaults();
        AssistTestFixture before = track(new AssistTestFixture(policy,
                new FileBackedSessionArchiveRepository(dir.toString()), null, null, null, null));
        String id = before.sessionInSupportLoop();
        before.registry.submitTurn(id, TurnInput.message("I am done for today, bye"));
        before.registry.terminate(id);

        AssistTestFixture after = track(new AssistTestFixture(policy,
                new FileBackedSessionArchiveRepository(dir.toString()), null, null, null, null));

        SessionClosedException ex = assertThrows(SessionClosedException.class, () -> after.registry.reattach(id));
        assertEquals("operator_terminated", ex.getCloseReason());
        assertEquals(0, after.registry.activeCount());
    }

    @Test
    @DisplayName("升級協調失敗：停留在 ESCALATE，清理排程重試，用盡後強制 FAILED 並關閉")
    public void testEscalationRetriesThenAbandon() {
        EscalationCoordinatorService coordinator = mock(EscalationCoordinatorService.class);
        when(coordinator.escalate(anyString(), any(), anyString(), anyString()))
                .thenThrow(new IllegalStateException("coordinator crashed"));
        when(coordinator.abandon(anyString(), any(), anyString(), anyString())).thenAnswer(inv -> {
            EscalationPlan plan = new EscalationPlan(inv.getArgument(0), inv.getArgument(1), "crisis_line",
                    EscalationPlan.Priority.HIGH, AssistTestFixture.START);
            plan.markInProgress();
            plan.attachFallbackDirective("Please call or text 988.");
            plan.fail(inv.getArgument(3), AssistTestFixture.START);
            return plan;
        });
        SessionPolicy policy = SessionPolicy.builder().maxEscalationRetries(2).build();
        AssistTestFixture f = track(new AssistTestFixture(policy, null, null, coordinator, null));
        String id = f.sessionInSupportLoop();

        TurnResult result = f.registry.submitTurn(id, TurnInput.message("I want to die"));

        assertFalse(result.closed());
        assertEquals(Phase.ESCALATE, result.phase());
        assertTrue(result.reply().contains("988"));
        assertTrue(f.kinds(id).contains(EventKind.ESCALATION_UNRESOLVED));

        TurnResult during = f.registry.submitTurn(id, TurnInput.message("are you still there?"));
        assertEquals(Phase.ESCALATE, during.phase());
        assertFalse(during.closed());

        assertEquals(1, f.registry.sweep());
        assertEquals(Phase.ESCALATE, f.registry.getSession(id).phase());

        f.registry.sweep();

        SessionSnapshot closed = f.registry.getSession(id);
        assertEquals(Phase.CLOSE, closed.phase());
        assertEquals("escalation_failed", closed.closeReason());
        assertEquals("FAILED", closed.escalationStatus());
        verify(coordinator, times(3)).escalate(anyString(), eq(Severity.HIGH), anyString(), anyString());
        verify(coordinator, times(1)).abandon(anyString(), eq(Severity.HIGH), anyString(),
                eq("escalation_retries_exhausted"));
        assertEquals(3, f.kinds(id).stream().filter(k -> k == EventKind.ESCALATION_UNRESOLVED).count());
    }
}
