package takeoff.tasks.api.internal.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import takeoff.tasks.model.EntityRef;
import takeoff.tasks.model.TaskRegistration;

/**
 * Request DTO for registering a task a remote worker has just dispatched.
 * POST /internal/v1/tasks
 */
public record RegisterTaskRequest(
        @JsonProperty("taskId") String taskId,
        @JsonProperty("taskType") String taskType,
        @JsonProperty("taskName") String taskName,
        @JsonProperty("projectId") String projectId,
        @JsonProperty("entityType") String entityType,
        @JsonProperty("entityId") String entityId,
        @JsonProperty("initiatedBy") String initiatedBy,
        @JsonProperty("provider") String provider,
        @JsonProperty("metadata") JsonNode metadata) {

    public void validate() {
        toRegistration().validate();
        if (metadata != null && !metadata.isNull() && !metadata.isObject()) {
            throw new IllegalArgumentException("metadata must be a JSON object");
        }
    }

    public TaskRegistration toRegistration() {
        EntityRef entity = entityType != null || entityId != null ? EntityRef.of(entityType, entityId) : null;
        return TaskRegistration.of(taskId, taskType, taskName)
                .withProject(projectId)
                .withEntity(entity)
                .withInitiatedBy(initiatedBy)
                .withProvider(provider)
                .withMetadata(metadata);
    }
}
