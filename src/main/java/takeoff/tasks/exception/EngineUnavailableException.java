package takeoff.tasks.exception;

/**
 * The execution engine could not be reached (stopped, restarting, timed out).
 * Callers degrade to the durable record instead of failing.
 */
public class EngineUnavailableException extends TaskTrackingException {

    public EngineUnavailableException(String message) {
        super(message);
    }

    public EngineUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
