package takeoff.tasks.api.internal.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request DTO for reporting task failure.
 * POST /internal/v1/tasks/{taskId}/fail
 */
public record FailRequest(
        @JsonProperty("error") String error,
        @JsonProperty("trace") String trace) {

    public void validate() {
        if (error == null || error.isBlank()) {
            throw new IllegalArgumentException("error is required");
        }
    }
}
