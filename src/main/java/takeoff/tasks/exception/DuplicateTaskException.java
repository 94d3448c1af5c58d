package takeoff.tasks.exception;

/**
 * A task id was registered twice. The engine guarantees unique ids, so this is
 * a bug in the caller.
 */
public class DuplicateTaskException extends TaskTrackingException {

    private final String taskId;

    public DuplicateTaskException(String taskId) {
        super("task already registered: " + taskId);
        this.taskId = taskId;
    }

    public DuplicateTaskException(String taskId, Throwable cause) {
        super("task already registered: " + taskId, cause);
        this.taskId = taskId;
    }

    public String taskId() {
        return taskId;
    }
}
