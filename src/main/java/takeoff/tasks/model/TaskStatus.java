package takeoff.tasks.model;

import java.util.Locale;

/**
 * Lifecycle status of a tracked task.
 *
 * PENDING -> STARTED -> PROGRESS (repeatable) -> SUCCESS | FAILURE | REVOKED.
 * PENDING and STARTED may be revoked directly. Terminal states have no exits.
 */
public enum TaskStatus {
    /** Registered, handed to the execution engine, not picked up yet */
    PENDING,
    /** A worker picked the task up */
    STARTED,
    /** The worker reported at least one progress checkpoint */
    PROGRESS,
    /** Completed successfully */
    SUCCESS,
    /** Completed with an error */
    FAILURE,
    /** Cancelled */
    REVOKED;

    public boolean isTerminal() {
        return this == SUCCESS || this == FAILURE || this == REVOKED;
    }

    /** Non-terminal: counted as running in listings */
    public boolean isRunning() {
        return !isTerminal();
    }

    /**
     * How far along the lifecycle this status is. All terminal states share the
     * highest rank.
     */
    public int rank() {
        return switch (this) {
            case PENDING -> 0;
            case STARTED -> 1;
            case PROGRESS -> 2;
            case SUCCESS, FAILURE, REVOKED -> 3;
        };
    }

    /**
     * Check whether a durable record may move from this status to the target.
     * PROGRESS may repeat; PENDING may skip straight to PROGRESS or a terminal
     * state when start signals are lost or never sent.
     */
    public boolean canTransitionTo(TaskStatus target) {
        if (target == null || isTerminal()) {
            return false;
        }
        return switch (target) {
            case PENDING -> false;
            case STARTED -> this == PENDING;
            case PROGRESS, SUCCESS, FAILURE, REVOKED -> true;
        };
    }

    public static TaskStatus parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("status is required");
        }
        try {
            return TaskStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown status: " + value);
        }
    }
}
