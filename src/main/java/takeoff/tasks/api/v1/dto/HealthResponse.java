package takeoff.tasks.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response DTO for health check.
 * GET /api/v1/health
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HealthResponse(
        @JsonProperty("status") String status,
        @JsonProperty("database") String database,
        @JsonProperty("engine") String engine,
        @JsonProperty("uptime") String uptime,
        @JsonProperty("version") String version,
        @JsonProperty("activeTasks") Integer activeTasks,
        @JsonProperty("liveEntries") Integer liveEntries) {
    public static HealthResponse healthy(String engine, String uptime, String version, int activeTasks,
            int liveEntries) {
        return new HealthResponse("healthy", "ok", engine, uptime, version, activeTasks, liveEntries);
    }

    public static HealthResponse unhealthy(String database) {
        return new HealthResponse("unhealthy", database, null, null, null, null, null);
    }
}
