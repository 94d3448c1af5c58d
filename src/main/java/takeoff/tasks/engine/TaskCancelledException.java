package takeoff.tasks.engine;

/**
 * Thrown by an operation that noticed its cancellation flag and stopped.
 * Distinguishes a cancelled outcome from a failure.
 */
public class TaskCancelledException extends RuntimeException {

    private final String taskId;

    public TaskCancelledException(String taskId) {
        super("task cancelled: " + taskId);
        this.taskId = taskId;
    }

    public String taskId() {
        return taskId;
    }
}
