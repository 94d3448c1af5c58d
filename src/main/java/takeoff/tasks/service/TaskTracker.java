package takeoff.tasks.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import takeoff.tasks.exception.DuplicateTaskException;
import takeoff.tasks.model.TaskRecord;
import takeoff.tasks.model.TaskRegistration;
import takeoff.tasks.model.TaskStatus;
import takeoff.tasks.model.TransitionResult;
import takeoff.tasks.repository.TaskRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Optional;
import java.util.function.Function;

/**
 * Write API for task lifecycle transitions, called from inside the worker that
 * owns the task. Every call writes through to the record store before
 * returning. Calls arriving after the record turned terminal are dropped and
 * logged.
 */
public class TaskTracker {

    private static final Logger log = LoggerFactory.getLogger(TaskTracker.class);

    private final TaskRecordRepository repository;
    private final Clock clock;

    public TaskTracker(TaskRecordRepository repository) {
        this(repository, Clock.systemUTC());
    }

    public TaskTracker(TaskRecordRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    /**
     * Create the PENDING record for a task just handed to the engine.
     *
     * @throws DuplicateTaskException if the task id is already registered
     */
    public TaskRecord register(TaskRegistration registration) {
        registration.validate();

        TaskRecord record = TaskRecord.builder()
                .taskId(registration.taskId())
                .projectId(registration.projectId())
                .taskType(registration.taskType())
                .taskName(registration.taskName())
                .status(TaskStatus.PENDING)
                .progressPercent(0.0)
                .entity(registration.entity())
                .initiatedBy(registration.initiatedBy())
                .provider(registration.provider())
                .metadata(registration.metadata())
                .createdAt(now())
                .build();

        try {
            repository.insert(record);
        } catch (DuplicateTaskException e) {
            log.warn("Rejected duplicate registration of task {} (type {})", registration.taskId(),
                    registration.taskType());
            throw e;
        }

        log.info("Task {} registered: type={}, name='{}', project={}",
                record.taskId(), record.taskType(), record.taskName(), record.projectId());
        return record;
    }

    public TransitionResult markStarted(String taskId) {
        requireTaskId(taskId);
        Instant now = now();
        TransitionResult result = apply(taskId, "mark_started", current -> TaskTransitions.start(current, now));
        if (result == TransitionResult.APPLIED) {
            log.info("Task {} started", taskId);
        }
        return result;
    }

    public TransitionResult updateProgress(String taskId, double percent, String step, String detail) {
        requireTaskId(taskId);
        if (Double.isNaN(percent) || percent < 0.0 || percent > 100.0) {
            throw new IllegalArgumentException("percent must be between 0 and 100");
        }
        Instant now = now();
        TransitionResult result = apply(taskId, "update_progress",
                current -> TaskTransitions.progress(current, percent, step, detail, now));
        if (result == TransitionResult.APPLIED) {
            log.debug("Task {} progress {}% ({})", taskId, percent, step);
        }
        return result;
    }

    public TransitionResult updateProgress(String taskId, double percent, String step) {
        return updateProgress(taskId, percent, step, null);
    }

    public TransitionResult markCompleted(String taskId, JsonNode resultSummary) {
        requireTaskId(taskId);
        Instant now = now();
        TransitionResult result = apply(taskId, "mark_completed",
                current -> TaskTransitions.complete(current, resultSummary, now));
        if (result == TransitionResult.APPLIED) {
            log.info("Task {} completed", taskId);
        }
        return result;
    }

    public TransitionResult markFailed(String taskId, String errorMessage, String errorTrace) {
        requireTaskId(taskId);
        Instant now = now();
        TransitionResult result = apply(taskId, "mark_failed",
                current -> TaskTransitions.fail(current, errorMessage, errorTrace, now));
        if (result == TransitionResult.APPLIED) {
            log.info("Task {} failed: {}", taskId, errorMessage);
        }
        return result;
    }

    public TransitionResult markFailed(String taskId, String errorMessage) {
        return markFailed(taskId, errorMessage, null);
    }

    public TransitionResult markRevoked(String taskId) {
        requireTaskId(taskId);
        Instant now = now();
        TransitionResult result = apply(taskId, "mark_revoked", current -> TaskTransitions.revoke(current, now));
        if (result == TransitionResult.APPLIED) {
            log.info("Task {} revoked", taskId);
        }
        return result;
    }

    /**
     * Merge keys into the record's metadata. Unlike every other field this is
     * writable after the task finished.
     */
    public TransitionResult updateMetadata(String taskId, ObjectNode patch) {
        requireTaskId(taskId);
        if (patch == null) {
            throw new IllegalArgumentException("metadata patch is required");
        }
        return apply(taskId, "update_metadata", current -> TaskTransitions.mergeMetadata(current, patch));
    }

    public Optional<TaskRecord> findById(String taskId) {
        return repository.findById(taskId);
    }

    /**
     * Run one transition under the row lock and log dropped writes.
     */
    private TransitionResult apply(String taskId, String caller,
            Function<TaskRecord, TaskTransitions.Outcome> transition) {
        TaskTransitions.Outcome[] outcome = new TaskTransitions.Outcome[1];
        Optional<TaskRecord> stored = repository.update(taskId, current -> {
            outcome[0] = transition.apply(current);
            return outcome[0].record();
        });

        if (stored.isEmpty() || outcome[0] == null) {
            log.warn("{}: no record for task {}, ignoring", caller, taskId);
            return TransitionResult.NOT_FOUND;
        }

        TransitionResult result = outcome[0].result();
        switch (result) {
            case STALE_WRITE -> log.warn("{}: dropped stale write for task {} already in {}",
                    caller, taskId, stored.get().status());
            case PROGRESS_REGRESSION -> log.warn("{}: dropped progress regression for task {} (stored {}%)",
                    caller, taskId, stored.get().progressPercent());
            case ALREADY_APPLIED -> log.debug("{}: task {} already {}", caller, taskId, stored.get().status());
            default -> {
            }
        }
        return result;
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }

    private static void requireTaskId(String taskId) {
        if (taskId == null || taskId.isBlank()) {
            throw new IllegalArgumentException("taskId is required");
        }
    }
}
