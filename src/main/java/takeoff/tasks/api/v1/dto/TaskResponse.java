package takeoff.tasks.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import takeoff.tasks.model.TaskView;

import java.time.Instant;

/**
 * Response DTO for a single task.
 * GET /api/v1/tasks/{taskId}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskResponse(
        @JsonProperty("taskId") String taskId,
        @JsonProperty("taskType") String taskType,
        @JsonProperty("taskName") String taskName,
        @JsonProperty("status") String status,
        @JsonProperty("progress") ProgressDto progress,
        @JsonProperty("result") JsonNode result,
        @JsonProperty("error") String error,
        @JsonProperty("createdAt") Instant createdAt,
        @JsonProperty("startedAt") Instant startedAt,
        @JsonProperty("completedAt") Instant completedAt,
        @JsonProperty("durationMs") Long durationMs,
        @JsonProperty("projectId") String projectId,
        @JsonProperty("entityType") String entityType,
        @JsonProperty("entityId") String entityId,
        @JsonProperty("initiatedBy") String initiatedBy,
        @JsonProperty("provider") String provider,
        @JsonProperty("metadata") JsonNode metadata,
        @JsonProperty("source") String source) {

    /**
     * Create from a merged view. The error trace is internal and is not exposed.
     */
    public static TaskResponse from(TaskView view) {
        return new TaskResponse(
                view.taskId(),
                view.taskType(),
                view.taskName(),
                view.status().name(),
                new ProgressDto(view.progressPercent(), view.progressStep(), view.progressDetail()),
                view.result(),
                view.error(),
                view.createdAt(),
                view.startedAt(),
                view.completedAt(),
                view.durationMs(),
                view.projectId(),
                view.entityType(),
                view.entityId(),
                view.initiatedBy(),
                view.provider(),
                view.metadata(),
                view.source().name());
    }
}
