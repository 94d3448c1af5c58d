package takeoff.tasks.api.internal.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Request DTO for reporting success. The body may be empty.
 * POST /internal/v1/tasks/{taskId}/complete
 */
public record CompleteRequest(
        @JsonProperty("result") JsonNode result) {

    public static CompleteRequest empty() {
        return new CompleteRequest(null);
    }
}
