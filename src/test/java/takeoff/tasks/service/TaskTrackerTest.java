package takeoff.tasks.service;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import takeoff.tasks.exception.DuplicateTaskException;
import takeoff.tasks.model.EntityRef;
import takeoff.tasks.model.TaskRecord;
import takeoff.tasks.model.TaskRegistration;
import takeoff.tasks.model.TaskStatus;
import takeoff.tasks.model.TransitionResult;
import takeoff.tasks.store.InMemoryTaskRecordRepository;
import takeoff.tasks.util.Jsons;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class TaskTrackerTest {

    private static final Instant T0 = Instant.parse("2026-03-01T12:00:00Z");

    private InMemoryTaskRecordRepository repo;
    private MutableClock clock;
    private TaskTracker tracker;

    @BeforeEach
    void setup() {
        repo = new InMemoryTaskRecordRepository();
        clock = new MutableClock(T0);
        tracker = new TaskTracker(repo, clock);
    }

    private TaskRecord stored(String taskId) {
        return repo.findById(taskId).orElseThrow();
    }

    private void register(String taskId) {
        tracker.register(TaskRegistration.of(taskId, "document_processing", "Process " + taskId)
                .withProject("p-1"));
    }

    @Test
    void registerCreatesPendingRecord() {
        ObjectNode meta = Jsons.mapper().createObjectNode().put("filename", "a.pdf");
        TaskRecord record = tracker.register(TaskRegistration.of("t-1", "document_processing", "Process a.pdf")
                .withProject("p-1")
                .withEntity(EntityRef.of("document", "doc-1"))
                .withInitiatedBy("user-1")
                .withProvider("anthropic")
                .withMetadata(meta));

        assertEquals(TaskStatus.PENDING, record.status());
        assertEquals(0.0, record.progressPercent());
        assertEquals(T0, record.createdAt());
        assertNull(record.startedAt());
        assertTrue(record.sameContentAs(stored("t-1")));
    }

    @Test
    void registerValidatesRequiredFields() {
        assertThrows(IllegalArgumentException.class,
                () -> tracker.register(TaskRegistration.of("t-1", "", "name")));
        assertThrows(IllegalArgumentException.class,
                () -> tracker.register(TaskRegistration.of(null, "type", "name")));
        assertTrue(repo.findById("t-1").isEmpty());
    }

    @Test
    void registerTwiceIsDuplicate() {
        register("t-1");
        assertThrows(DuplicateTaskException.class, () -> register("t-1"));
    }

    @Test
    void startSetsStartedAtOnce() {
        register("t-1");
        clock.advance(Duration.ofSeconds(2));

        assertEquals(TransitionResult.APPLIED, tracker.markStarted("t-1"));
        assertEquals(TaskStatus.STARTED, stored("t-1").status());
        assertEquals(T0.plusSeconds(2), stored("t-1").startedAt());

        clock.advance(Duration.ofSeconds(2));
        assertEquals(TransitionResult.ALREADY_APPLIED, tracker.markStarted("t-1"));
        assertEquals(T0.plusSeconds(2), stored("t-1").startedAt());
    }

    @Test
    void progressMovesToProgressState() {
        register("t-1");
        tracker.markStarted("t-1");

        assertEquals(TransitionResult.APPLIED, tracker.updateProgress("t-1", 40, "parsing", "page 4 of 10"));

        TaskRecord record = stored("t-1");
        assertEquals(TaskStatus.PROGRESS, record.status());
        assertEquals(40.0, record.progressPercent());
        assertEquals("parsing", record.progressStep());
        assertEquals("page 4 of 10", record.progressDetail());
    }

    @Test
    @DisplayName("Progress on a PENDING task implicitly starts it")
    void progressFromPendingStartsTask() {
        register("t-1");
        clock.advance(Duration.ofMillis(300));

        assertEquals(TransitionResult.APPLIED, tracker.updateProgress("t-1", 10, "warming up"));
        assertEquals(TaskStatus.PROGRESS, stored("t-1").status());
        assertEquals(T0.plusMillis(300), stored("t-1").startedAt());
    }

    @Test
    void equalProgressIsAcceptedLowerIsDropped() {
        register("t-1");
        tracker.updateProgress("t-1", 50, "a");

        assertEquals(TransitionResult.APPLIED, tracker.updateProgress("t-1", 50, "b"));
        assertEquals("b", stored("t-1").progressStep());

        assertEquals(TransitionResult.PROGRESS_REGRESSION, tracker.updateProgress("t-1", 20, "c"));
        assertEquals(50.0, stored("t-1").progressPercent());
        assertEquals("b", stored("t-1").progressStep());
    }

    @Test
    void progressOutOfRangeIsRejected() {
        register("t-1");
        assertThrows(IllegalArgumentException.class, () -> tracker.updateProgress("t-1", -1, "x"));
        assertThrows(IllegalArgumentException.class, () -> tracker.updateProgress("t-1", 100.5, "x"));
        assertThrows(IllegalArgumentException.class, () -> tracker.updateProgress("t-1", Double.NaN, "x"));
        assertEquals(TaskStatus.PENDING, stored("t-1").status());
    }

    @Test
    void completeSetsResultAndDuration() {
        register("t-1");
        clock.advance(Duration.ofSeconds(1));
        tracker.markStarted("t-1");
        tracker.updateProgress("t-1", 70, "embedding");
        clock.advance(Duration.ofMillis(4500));

        ObjectNode result = Jsons.mapper().createObjectNode().put("chunks", 12);
        assertEquals(TransitionResult.APPLIED, tracker.markCompleted("t-1", result));

        TaskRecord record = stored("t-1");
        assertEquals(TaskStatus.SUCCESS, record.status());
        assertEquals(100.0, record.progressPercent());
        assertEquals(result, record.resultSummary());
        assertEquals(T0.plusMillis(5500), record.completedAt());
        assertEquals(4500L, record.durationMs());
    }

    @Test
    void durationFallsBackToCreatedAtWhenNeverStarted() {
        register("t-1");
        clock.advance(Duration.ofSeconds(3));

        tracker.markFailed("t-1", "quota exceeded");

        assertEquals(3000L, stored("t-1").durationMs());
        assertNull(stored("t-1").startedAt());
    }

    @Test
    void failKeepsLastCheckpoint() {
        register("t-1");
        tracker.updateProgress("t-1", 35, "ocr");

        assertEquals(TransitionResult.APPLIED, tracker.markFailed("t-1", "boom", "trace..."));

        TaskRecord record = stored("t-1");
        assertEquals(TaskStatus.FAILURE, record.status());
        assertEquals("boom", record.errorMessage());
        assertEquals("trace...", record.errorTrace());
        assertEquals(35.0, record.progressPercent());
        assertNull(record.resultSummary());
    }

    @Test
    @DisplayName("Terminal records ignore every later lifecycle write")
    void terminalRecordIsFrozen() {
        register("t-1");
        tracker.markCompleted("t-1", null);
        TaskRecord done = stored("t-1");

        clock.advance(Duration.ofSeconds(5));
        assertEquals(TransitionResult.STALE_WRITE, tracker.markStarted("t-1"));
        assertEquals(TransitionResult.STALE_WRITE, tracker.updateProgress("t-1", 100, "again"));
        assertEquals(TransitionResult.STALE_WRITE, tracker.markFailed("t-1", "late failure"));
        assertEquals(TransitionResult.STALE_WRITE, tracker.markRevoked("t-1"));
        assertEquals(TransitionResult.STALE_WRITE, tracker.markCompleted("t-1", null));

        assertTrue(done.sameContentAs(stored("t-1")));
    }

    @Test
    void revokeFromPendingAndStarted() {
        register("t-1");
        register("t-2");
        tracker.markStarted("t-2");

        assertEquals(TransitionResult.APPLIED, tracker.markRevoked("t-1"));
        assertEquals(TransitionResult.APPLIED, tracker.markRevoked("t-2"));
        assertEquals(TaskStatus.REVOKED, stored("t-1").status());
        assertNotNull(stored("t-2").completedAt());
    }

    @Test
    void metadataMergesEvenAfterCompletion() {
        tracker.register(TaskRegistration.of("t-1", "export", "Export")
                .withMetadata(Jsons.mapper().createObjectNode().put("format", "pdf").put("pages", 1)));
        tracker.markCompleted("t-1", null);

        ObjectNode patch = Jsons.mapper().createObjectNode().put("pages", 9).put("url", "s3://x");
        assertEquals(TransitionResult.APPLIED, tracker.updateMetadata("t-1", patch));

        TaskRecord record = stored("t-1");
        assertEquals("pdf", record.metadata().get("format").asText());
        assertEquals(9, record.metadata().get("pages").asInt());
        assertEquals("s3://x", record.metadata().get("url").asText());
        assertEquals(TaskStatus.SUCCESS, record.status());
    }

    @Test
    void missingRecordIsNotFound() {
        assertEquals(TransitionResult.NOT_FOUND, tracker.markStarted("ghost"));
        assertEquals(TransitionResult.NOT_FOUND, tracker.updateProgress("ghost", 10, "x"));
        assertEquals(TransitionResult.NOT_FOUND, tracker.markCompleted("ghost", null));
        assertEquals(TransitionResult.NOT_FOUND, tracker.markFailed("ghost", "x"));
        assertEquals(TransitionResult.NOT_FOUND, tracker.markRevoked("ghost"));
        assertTrue(repo.findById("ghost").isEmpty());
    }
}
