package takeoff.tasks.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * Canonical answer to "what is happening to this task right now": the durable
 * record merged with the engine's live state.
 */
public record TaskView(
        String taskId,
        String taskType,
        String taskName,
        TaskStatus status,
        double progressPercent,
        String progressStep,
        String progressDetail,
        JsonNode result,
        String error,
        String errorTrace,
        Instant createdAt,
        Instant startedAt,
        Instant completedAt,
        Long durationMs,
        String projectId,
        String entityType,
        String entityId,
        String initiatedBy,
        String provider,
        JsonNode metadata,
        Source source) {

    /** Where the status and progress of this view came from. */
    public enum Source {
        /** Terminal durable record, returned as-is */
        DURABLE,
        /** Non-terminal record merged with live engine state */
        LIVE_MERGED,
        /** Non-terminal record; the engine had nothing to say or could not be reached */
        DURABLE_STALE
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }
}
