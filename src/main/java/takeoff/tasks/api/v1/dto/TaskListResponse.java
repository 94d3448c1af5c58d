package takeoff.tasks.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import takeoff.tasks.model.TaskPage;

import java.util.List;

/**
 * Response DTO for a project task listing.
 * GET /api/v1/projects/{projectId}/tasks
 */
public record TaskListResponse(
        @JsonProperty("tasks") List<TaskResponse> tasks,
        @JsonProperty("total") int total,
        @JsonProperty("running") int running,
        @JsonProperty("completed") int completed,
        @JsonProperty("failed") int failed,
        @JsonProperty("cancelled") int cancelled) {

    public static TaskListResponse from(TaskPage page) {
        return new TaskListResponse(
                page.tasks().stream().map(TaskResponse::from).toList(),
                page.total(),
                page.running(),
                page.completed(),
                page.failed(),
                page.cancelled());
    }
}
