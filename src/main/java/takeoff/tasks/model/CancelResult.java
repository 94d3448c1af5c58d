package takeoff.tasks.model;

/**
 * Result of a cancellation request.
 *
 * @param taskId          the task id
 * @param status          durable status after the call
 * @param message         human-readable outcome
 * @param changed         whether this call flipped the record to REVOKED
 * @param signalDelivered whether the engine accepted the termination signal
 */
public record CancelResult(
        String taskId,
        TaskStatus status,
        String message,
        boolean changed,
        boolean signalDelivered) {

    public static final String ALREADY_COMPLETED = "already completed";
    public static final String SIGNAL_SENT = "Cancellation signal sent";
    public static final String SIGNAL_NOT_DELIVERED = "Cancellation recorded; engine unreachable";

    public static CancelResult alreadyCompleted(String taskId, TaskStatus status) {
        return new CancelResult(taskId, status, ALREADY_COMPLETED, false, false);
    }

    public static CancelResult revoked(String taskId, boolean signalDelivered) {
        return new CancelResult(taskId, TaskStatus.REVOKED,
                signalDelivered ? SIGNAL_SENT : SIGNAL_NOT_DELIVERED, true, signalDelivered);
    }
}
