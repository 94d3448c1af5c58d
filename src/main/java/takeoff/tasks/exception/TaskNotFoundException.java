package takeoff.tasks.exception;

/**
 * No durable record exists for the task id.
 */
public class TaskNotFoundException extends TaskTrackingException {

    private final String taskId;

    public TaskNotFoundException(String taskId) {
        super("task not found: " + taskId);
        this.taskId = taskId;
    }

    public String taskId() {
        return taskId;
    }
}
