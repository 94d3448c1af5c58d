package takeoff.tasks.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Everything known about a task at the moment it is handed to the engine.
 * Only taskId, taskType and taskName are required.
 */
public record TaskRegistration(
        String taskId,
        String taskType,
        String taskName,
        String projectId,
        EntityRef entity,
        String initiatedBy,
        String provider,
        JsonNode metadata) {

    public static TaskRegistration of(String taskId, String taskType, String taskName) {
        return new TaskRegistration(taskId, taskType, taskName, null, null, null, null, null);
    }

    public TaskRegistration withProject(String projectId) {
        return new TaskRegistration(taskId, taskType, taskName, projectId, entity, initiatedBy, provider, metadata);
    }

    public TaskRegistration withEntity(EntityRef entity) {
        return new TaskRegistration(taskId, taskType, taskName, projectId, entity, initiatedBy, provider, metadata);
    }

    public TaskRegistration withInitiatedBy(String initiatedBy) {
        return new TaskRegistration(taskId, taskType, taskName, projectId, entity, initiatedBy, provider, metadata);
    }

    public TaskRegistration withProvider(String provider) {
        return new TaskRegistration(taskId, taskType, taskName, projectId, entity, initiatedBy, provider, metadata);
    }

    public TaskRegistration withMetadata(JsonNode metadata) {
        return new TaskRegistration(taskId, taskType, taskName, projectId, entity, initiatedBy, provider, metadata);
    }

    public TaskRegistration withTaskId(String taskId) {
        return new TaskRegistration(taskId, taskType, taskName, projectId, entity, initiatedBy, provider, metadata);
    }

    public void validate() {
        if (taskId == null || taskId.isBlank()) {
            throw new IllegalArgumentException("taskId is required");
        }
        if (taskType == null || taskType.isBlank()) {
            throw new IllegalArgumentException("taskType is required");
        }
        if (taskName == null || taskName.isBlank()) {
            throw new IllegalArgumentException("taskName is required");
        }
    }
}
