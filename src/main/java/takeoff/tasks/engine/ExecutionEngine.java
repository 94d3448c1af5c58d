package takeoff.tasks.engine;

import takeoff.tasks.model.LiveState;

import java.util.Optional;

/**
 * The distributed worker runtime as seen from the tracking service: dispatch
 * work, peek at volatile live state, and ask for cooperative termination.
 */
public interface ExecutionEngine {

    /**
     * Queue work for execution.
     *
     * @param work the long-running operation
     * @return engine-assigned, globally unique task id
     * @throws takeoff.tasks.exception.EngineUnavailableException if the engine cannot accept work
     */
    String dispatch(TaskWork work);

    /**
     * Current live state of a task. Empty when the engine no longer (or never)
     * knew about the id, e.g. after result expiry or a restart.
     *
     * @param taskId the task id
     * @return live state if the engine has any
     * @throws takeoff.tasks.exception.EngineUnavailableException if the engine cannot be reached
     */
    Optional<LiveState> liveState(String taskId);

    /**
     * Request cooperative termination. The worker stops at its next checkpoint.
     *
     * @param taskId the task id
     * @throws takeoff.tasks.exception.EngineUnavailableException if the signal cannot be delivered
     */
    void revoke(String taskId);

    /**
     * Whether a termination request was recorded for the task.
     *
     * @param taskId the task id
     * @return true if revoked
     */
    boolean isRevoked(String taskId);
}
