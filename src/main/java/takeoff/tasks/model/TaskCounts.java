package takeoff.tasks.model;

/**
 * Aggregate counts over the durable store for one query's filters.
 * running + completed + failed + cancelled == total.
 */
public record TaskCounts(
        int total,
        int running,
        int completed,
        int failed,
        int cancelled) {

    public static final TaskCounts EMPTY = new TaskCounts(0, 0, 0, 0, 0);

    /** Add one row with the given status */
    public TaskCounts plus(TaskStatus status) {
        return new TaskCounts(
                total + 1,
                running + (status.isRunning() ? 1 : 0),
                completed + (status == TaskStatus.SUCCESS ? 1 : 0),
                failed + (status == TaskStatus.FAILURE ? 1 : 0),
                cancelled + (status == TaskStatus.REVOKED ? 1 : 0));
    }
}
