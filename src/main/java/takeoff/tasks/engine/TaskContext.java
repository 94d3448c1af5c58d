package takeoff.tasks.engine;

/**
 * Handle a running operation gets from the engine.
 */
public interface TaskContext {

    String taskId();

    /**
     * Report a checkpoint. Values lower than the last reported percent are ignored.
     *
     * @param percent 0..100
     * @param step    short stage label, may be null
     * @param detail  free text, may be null
     */
    void reportProgress(double percent, String step, String detail);

    default void reportProgress(double percent, String step) {
        reportProgress(percent, step, null);
    }

    /** Whether cancellation was requested for this task */
    boolean isCancelled();

    /**
     * Exit point for cooperative cancellation: call between expensive sub-steps.
     *
     * @throws TaskCancelledException if cancellation was requested
     */
    default void checkCancelled() {
        if (isCancelled()) {
            throw new TaskCancelledException(taskId());
        }
    }
}
