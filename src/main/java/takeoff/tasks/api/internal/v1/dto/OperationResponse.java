package takeoff.tasks.api.internal.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import takeoff.tasks.model.TransitionResult;

import java.util.Locale;

/**
 * Generic response for worker hook operations.
 * {@code ok} is true when the stored record reflects the request. Dropped
 * writes are not errors; workers never retry them.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OperationResponse(
        @JsonProperty("ok") boolean ok,
        @JsonProperty("result") String result) {

    public static OperationResponse from(TransitionResult result) {
        boolean ok = result == TransitionResult.APPLIED || result == TransitionResult.ALREADY_APPLIED;
        return new OperationResponse(ok, result.name().toLowerCase(Locale.ROOT));
    }
}
