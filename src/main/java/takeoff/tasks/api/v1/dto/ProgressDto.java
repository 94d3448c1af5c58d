package takeoff.tasks.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Nested progress block of a task response.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProgressDto(
        @JsonProperty("percent") double percent,
        @JsonProperty("step") String step,
        @JsonProperty("detail") String detail) {
}
