package takeoff.tasks.model;

/**
 * Outcome of a lifecycle call made by a worker.
 */
public enum TransitionResult {
    /** The durable record was updated */
    APPLIED,

    /** The record is already at or past the requested non-terminal state (re-delivery) */
    ALREADY_APPLIED,

    /** The record is terminal; the write was dropped */
    STALE_WRITE,

    /** Progress lower than the stored value; the write was dropped */
    PROGRESS_REGRESSION,

    /** No durable record for the task id */
    NOT_FOUND;

    public boolean applied() {
        return this == APPLIED;
    }
}
