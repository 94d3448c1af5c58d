package takeoff.tasks.service;

import takeoff.tasks.engine.CancellationCheck;
import takeoff.tasks.engine.ExecutionEngine;
import takeoff.tasks.exception.EngineUnavailableException;
import takeoff.tasks.exception.TaskNotFoundException;
import takeoff.tasks.model.CancelResult;
import takeoff.tasks.model.TaskRecord;
import takeoff.tasks.model.TaskStatus;
import takeoff.tasks.model.TransitionResult;
import takeoff.tasks.repository.TaskRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * User-initiated cancellation. Sends the termination signal to the engine and
 * records REVOKED durably, in that order. The durable flip happens even when
 * the signal cannot be delivered: workers also poll the store.
 */
public class CancellationCoordinator {

    private static final Logger log = LoggerFactory.getLogger(CancellationCoordinator.class);

    private final TaskRecordRepository repository;
    private final ExecutionEngine engine;
    private final TaskTracker tracker;

    public CancellationCoordinator(TaskRecordRepository repository, ExecutionEngine engine, TaskTracker tracker) {
        this.repository = repository;
        this.engine = engine;
        this.tracker = tracker;
    }

    /**
     * Cancel a task. Idempotent: cancelling a finished task is not an error.
     *
     * @throws TaskNotFoundException if no record exists
     */
    public CancelResult cancel(String taskId) {
        if (taskId == null || taskId.isBlank()) {
            throw new IllegalArgumentException("taskId is required");
        }

        TaskRecord record = repository.findById(taskId)
                .orElseThrow(() -> new TaskNotFoundException(taskId));
        if (record.isTerminal()) {
            log.debug("Cancel of task {} ignored: already {}", taskId, record.status());
            return CancelResult.alreadyCompleted(taskId, record.status());
        }

        boolean delivered = true;
        try {
            engine.revoke(taskId);
        } catch (EngineUnavailableException e) {
            delivered = false;
            log.warn("Cancellation rejected by engine for task {}: {}", taskId, e.getMessage());
        }

        TransitionResult result = tracker.markRevoked(taskId);
        if (result == TransitionResult.APPLIED) {
            log.info("Task {} cancelled (signal delivered: {})", taskId, delivered);
            return CancelResult.revoked(taskId, delivered);
        }

        // Lost the race against a terminal write from the worker
        TaskRecord current = repository.findById(taskId)
                .orElseThrow(() -> new TaskNotFoundException(taskId));
        log.info("Cancel of task {} raced with completion; final status {}", taskId, current.status());
        return CancelResult.alreadyCompleted(taskId, current.status());
    }

    /**
     * Cancellation as recorded in the store. Complements the engine's own flag
     * when the signal was lost.
     */
    public CancellationCheck durableCheck() {
        return taskId -> repository.findById(taskId)
                .map(r -> r.status() == TaskStatus.REVOKED)
                .orElse(false);
    }
}
