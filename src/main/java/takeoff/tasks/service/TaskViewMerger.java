package takeoff.tasks.service;

import com.fasterxml.jackson.databind.JsonNode;
import takeoff.tasks.model.LiveState;
import takeoff.tasks.model.TaskRecord;
import takeoff.tasks.model.TaskStatus;
import takeoff.tasks.model.TaskView;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Merges a durable record with live engine state into a {@link TaskView}.
 *
 * Rules:
 * - a terminal record wins outright;
 * - status is whichever source is further along the lifecycle;
 * - percent is the maximum of the two, so losing live state never moves the view backwards;
 * - step and detail travel with the percent they were reported with.
 */
public final class TaskViewMerger {

    private TaskViewMerger() {
    }

    public static TaskView merge(TaskRecord record, Optional<LiveState> live) {
        if (record.isTerminal()) {
            return fromRecord(record, TaskView.Source.DURABLE);
        }
        if (live.isEmpty()) {
            return fromRecord(record, TaskView.Source.DURABLE_STALE);
        }

        LiveState state = live.get();
        TaskStatus status = state.status().rank() > record.status().rank() ? state.status() : record.status();

        double percent = record.progressPercent();
        String step = record.progressStep();
        String detail = record.progressDetail();
        if (state.percent() > percent) {
            percent = state.percent();
            step = state.step();
            detail = state.detail();
        }
        if (status == TaskStatus.SUCCESS) {
            percent = 100.0;
        }

        JsonNode result = status == TaskStatus.SUCCESS ? state.result() : null;
        String error = status == TaskStatus.FAILURE ? state.error() : null;
        Instant completedAt = status.isTerminal() ? state.updatedAt() : null;
        Long durationMs = null;
        if (completedAt != null) {
            Instant from = record.startedAt() != null ? record.startedAt() : record.createdAt();
            if (from != null) {
                durationMs = Math.max(0L, Duration.between(from, completedAt).toMillis());
            }
        }

        return new TaskView(
                record.taskId(),
                record.taskType(),
                record.taskName(),
                status,
                percent,
                step,
                detail,
                result,
                error,
                null,
                record.createdAt(),
                record.startedAt(),
                completedAt,
                durationMs,
                record.projectId(),
                record.entityType(),
                record.entityId(),
                record.initiatedBy(),
                record.provider(),
                record.metadata(),
                TaskView.Source.LIVE_MERGED);
    }

    public static TaskView fromRecord(TaskRecord record) {
        return fromRecord(record, record.isTerminal() ? TaskView.Source.DURABLE : TaskView.Source.DURABLE_STALE);
    }

    private static TaskView fromRecord(TaskRecord record, TaskView.Source source) {
        return new TaskView(
                record.taskId(),
                record.taskType(),
                record.taskName(),
                record.status(),
                record.progressPercent(),
                record.progressStep(),
                record.progressDetail(),
                record.resultSummary(),
                record.errorMessage(),
                record.errorTrace(),
                record.createdAt(),
                record.startedAt(),
                record.completedAt(),
                record.durationMs(),
                record.projectId(),
                record.entityType(),
                record.entityId(),
                record.initiatedBy(),
                record.provider(),
                record.metadata(),
                source);
    }
}
