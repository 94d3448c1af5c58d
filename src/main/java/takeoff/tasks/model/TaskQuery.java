package takeoff.tasks.model;

/**
 * Project-scoped listing request.
 *
 * @param projectId required project scope
 * @param status    optional status filter
 * @param taskType  optional task type filter
 * @param limit     page size, 1..{@link #MAX_LIMIT}
 * @param offset    rows to skip, non-negative
 */
public record TaskQuery(
        String projectId,
        TaskStatus status,
        String taskType,
        int limit,
        int offset) {

    public static final int DEFAULT_LIMIT = 20;
    public static final int MAX_LIMIT = 100;

    public TaskQuery {
        if (projectId == null || projectId.isBlank()) {
            throw new IllegalArgumentException("projectId is required");
        }
        if (limit < 1 || limit > MAX_LIMIT) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_LIMIT);
        }
        if (offset < 0) {
            throw new IllegalArgumentException("offset must be non-negative");
        }
        if (taskType != null && taskType.isBlank()) {
            taskType = null;
        }
    }

    public static TaskQuery forProject(String projectId) {
        return new TaskQuery(projectId, null, null, DEFAULT_LIMIT, 0);
    }

    public TaskQuery withStatus(TaskStatus status) {
        return new TaskQuery(projectId, status, taskType, limit, offset);
    }

    public TaskQuery withTaskType(String taskType) {
        return new TaskQuery(projectId, status, taskType, limit, offset);
    }

    public TaskQuery page(int limit, int offset) {
        return new TaskQuery(projectId, status, taskType, limit, offset);
    }
}
