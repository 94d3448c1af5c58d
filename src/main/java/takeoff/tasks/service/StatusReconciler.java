package takeoff.tasks.service;

import takeoff.tasks.engine.ExecutionEngine;
import takeoff.tasks.exception.EngineUnavailableException;
import takeoff.tasks.exception.TaskNotFoundException;
import takeoff.tasks.model.LiveState;
import takeoff.tasks.model.TaskRecord;
import takeoff.tasks.model.TaskView;
import takeoff.tasks.repository.TaskRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Answers status reads. Terminal records are served from the store alone;
 * everything else is merged with whatever the engine still knows.
 * Read-only: never writes back to the store.
 */
public class StatusReconciler {

    private static final Logger log = LoggerFactory.getLogger(StatusReconciler.class);

    private final TaskRecordRepository repository;
    private final ExecutionEngine engine;

    public StatusReconciler(TaskRecordRepository repository, ExecutionEngine engine) {
        this.repository = repository;
        this.engine = engine;
    }

    /**
     * @throws TaskNotFoundException if no record exists, even if the engine knows the id
     */
    public TaskView getStatus(String taskId) {
        if (taskId == null || taskId.isBlank()) {
            throw new IllegalArgumentException("taskId is required");
        }
        TaskRecord record = repository.findById(taskId)
                .orElseThrow(() -> new TaskNotFoundException(taskId));
        return reconcile(record);
    }

    /**
     * Build the view for an already loaded record. An unreachable engine
     * degrades to the durable view instead of failing the read.
     */
    public TaskView reconcile(TaskRecord record) {
        if (record.isTerminal()) {
            return TaskViewMerger.fromRecord(record);
        }

        Optional<LiveState> live;
        try {
            live = engine.liveState(record.taskId());
        } catch (EngineUnavailableException e) {
            log.warn("Live state unavailable for task {}, serving durable record: {}",
                    record.taskId(), e.getMessage());
            live = Optional.empty();
        } catch (RuntimeException e) {
            log.warn("Live state lookup failed for task {}, serving durable record", record.taskId(), e);
            live = Optional.empty();
        }
        return TaskViewMerger.merge(record, live);
    }
}
