package takeoff.tasks.api.internal.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Cancellation flag for remote workers polling between checkpoints.
 * GET /internal/v1/tasks/{taskId}/cancelled
 */
public record CancelledResponse(
        @JsonProperty("taskId") String taskId,
        @JsonProperty("cancelled") boolean cancelled) {
}
