package takeoff.tasks.engine;

/**
 * Polling capability for cooperative cancellation. Long-running operations
 * call it between checkpoints instead of relying on signals or interrupts.
 */
@FunctionalInterface
public interface CancellationCheck {

    boolean isCancelled(String taskId);

    default CancellationCheck or(CancellationCheck other) {
        return taskId -> isCancelled(taskId) || other.isCancelled(taskId);
    }
}
