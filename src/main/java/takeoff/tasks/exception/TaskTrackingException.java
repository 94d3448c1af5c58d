package takeoff.tasks.exception;

/**
 * Base class for task tracking failures.
 */
public class TaskTrackingException extends RuntimeException {

    public TaskTrackingException(String message) {
        super(message);
    }

    public TaskTrackingException(String message, Throwable cause) {
        super(message, cause);
    }
}
