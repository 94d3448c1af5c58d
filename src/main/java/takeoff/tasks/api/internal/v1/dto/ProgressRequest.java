package takeoff.tasks.api.internal.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request DTO for a progress checkpoint.
 * POST /internal/v1/tasks/{taskId}/progress
 */
public record ProgressRequest(
        @JsonProperty("percent") Double percent,
        @JsonProperty("step") String step,
        @JsonProperty("detail") String detail) {

    public void validate() {
        if (percent == null) {
            throw new IllegalArgumentException("percent is required");
        }
    }
}
