package takeoff.tasks.api.internal.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Request DTO for merging keys into task metadata.
 * POST /internal/v1/tasks/{taskId}/metadata
 */
public record MetadataRequest(
        @JsonProperty("metadata") JsonNode metadata) {

    public void validate() {
        if (metadata == null || !metadata.isObject()) {
            throw new IllegalArgumentException("metadata must be a JSON object");
        }
    }

    public ObjectNode patch() {
        return (ObjectNode) metadata;
    }
}
