package takeoff.tasks.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import takeoff.tasks.model.CancelResult;

/**
 * Response DTO for a cancellation request.
 * POST /api/v1/tasks/{taskId}/cancel
 */
public record CancelTaskResponse(
        @JsonProperty("taskId") String taskId,
        @JsonProperty("status") String status,
        @JsonProperty("message") String message,
        @JsonProperty("signalDelivered") boolean signalDelivered) {

    public static CancelTaskResponse from(CancelResult result) {
        return new CancelTaskResponse(result.taskId(), result.status().name(), result.message(),
                result.signalDelivered());
    }
}
