package takeoff.tasks.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import takeoff.tasks.engine.FakeExecutionEngine;
import takeoff.tasks.exception.TaskNotFoundException;
import takeoff.tasks.model.CancelResult;
import takeoff.tasks.model.TaskRecord;
import takeoff.tasks.model.TaskRegistration;
import takeoff.tasks.model.TaskStatus;
import takeoff.tasks.store.InMemoryTaskRecordRepository;

import static org.junit.jupiter.api.Assertions.*;

class CancellationCoordinatorTest {

    private InMemoryTaskRecordRepository repo;
    private FakeExecutionEngine engine;
    private TaskTracker tracker;
    private CancellationCoordinator coordinator;

    @BeforeEach
    void setup() {
        repo = new InMemoryTaskRecordRepository();
        engine = new FakeExecutionEngine();
        tracker = new TaskTracker(repo);
        coordinator = new CancellationCoordinator(repo, engine, tracker);
        tracker.register(TaskRegistration.of("t-1", "document_processing", "Process").withProject("p-1"));
    }

    @Test
    void cancelRunningTask() {
        tracker.updateProgress("t-1", 30, "ocr");

        CancelResult result = coordinator.cancel("t-1");

        assertEquals(TaskStatus.REVOKED, result.status());
        assertEquals(CancelResult.SIGNAL_SENT, result.message());
        assertTrue(result.changed());
        assertTrue(engine.isRevoked("t-1"));

        TaskRecord record = repo.findById("t-1").orElseThrow();
        assertEquals(TaskStatus.REVOKED, record.status());
        assertNotNull(record.completedAt());
        assertEquals(30.0, record.progressPercent());
    }

    @Test
    @DisplayName("Cancelling a finished task is a no-op, not an error")
    void cancelCompletedTaskIsIdempotent() {
        tracker.markCompleted("t-1", null);
        TaskRecord before = repo.findById("t-1").orElseThrow();

        CancelResult result = coordinator.cancel("t-1");

        assertEquals(TaskStatus.SUCCESS, result.status());
        assertEquals(CancelResult.ALREADY_COMPLETED, result.message());
        assertFalse(result.changed());
        assertEquals(0, engine.revokeCalls());
        assertTrue(before.sameContentAs(repo.findById("t-1").orElseThrow()));
    }

    @Test
    void cancelTwice() {
        coordinator.cancel("t-1");
        CancelResult second = coordinator.cancel("t-1");

        assertEquals(TaskStatus.REVOKED, second.status());
        assertEquals(CancelResult.ALREADY_COMPLETED, second.message());
        assertEquals(1, engine.revokeCalls());
    }

    @Test
    void cancelUnknownTaskIsNotFound() {
        assertThrows(TaskNotFoundException.class, () -> coordinator.cancel("ghost"));
        assertEquals(0, engine.revokeCalls());
    }

    @Test
    @DisplayName("Durable REVOKED is recorded even when the engine is down")
    void engineDownStillRevokesDurably() {
        engine.setAvailable(false);

        CancelResult result = coordinator.cancel("t-1");

        assertEquals(TaskStatus.REVOKED, result.status());
        assertFalse(result.signalDelivered());
        assertEquals(CancelResult.SIGNAL_NOT_DELIVERED, result.message());
        assertEquals(TaskStatus.REVOKED, repo.findById("t-1").orElseThrow().status());
        assertTrue(coordinator.durableCheck().isCancelled("t-1"));
    }

    @Test
    void completionAfterCancelIsDropped() {
        coordinator.cancel("t-1");

        tracker.markCompleted("t-1", null);

        assertEquals(TaskStatus.REVOKED, repo.findById("t-1").orElseThrow().status());
    }

    @Test
    void durableCheckIsFalseForRunningAndUnknown() {
        assertFalse(coordinator.durableCheck().isCancelled("t-1"));
        assertFalse(coordinator.durableCheck().isCancelled("ghost"));
    }
}
