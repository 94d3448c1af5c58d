package takeoff.tasks.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import takeoff.tasks.model.TaskRecord;
import takeoff.tasks.model.TaskStatus;
import takeoff.tasks.model.TransitionResult;
import takeoff.tasks.util.Jsons;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Pure lifecycle transitions over a durable record. No I/O: the tracker runs
 * these inside the repository's row lock.
 *
 * Terminal records never change, except for {@code metadata}.
 */
public final class TaskTransitions {

    private TaskTransitions() {
    }

    /**
     * Result of applying a transition: the record to store (absent when the
     * write is dropped) and why.
     */
    public record Outcome(TransitionResult result, TaskRecord next) {

        static Outcome applied(TaskRecord next) {
            return new Outcome(TransitionResult.APPLIED, next);
        }

        static Outcome dropped(TransitionResult result) {
            return new Outcome(result, null);
        }

        public Optional<TaskRecord> record() {
            return Optional.ofNullable(next);
        }
    }

    /** PENDING -> STARTED; re-delivery on STARTED/PROGRESS is a no-op */
    public static Outcome start(TaskRecord current, Instant now) {
        if (current.isTerminal()) {
            return Outcome.dropped(TransitionResult.STALE_WRITE);
        }
        if (!current.status().canTransitionTo(TaskStatus.STARTED)) {
            return Outcome.dropped(TransitionResult.ALREADY_APPLIED);
        }
        return Outcome.applied(current.toBuilder()
                .status(TaskStatus.STARTED)
                .startedAt(current.startedAt() != null ? current.startedAt() : now)
                .build());
    }

    /**
     * Enter (or stay in) PROGRESS. Lower percent than stored is rejected; a
     * PENDING record is implicitly started.
     */
    public static Outcome progress(TaskRecord current, double percent, String step, String detail, Instant now) {
        if (current.isTerminal()) {
            return Outcome.dropped(TransitionResult.STALE_WRITE);
        }
        if (percent < current.progressPercent()) {
            return Outcome.dropped(TransitionResult.PROGRESS_REGRESSION);
        }
        return Outcome.applied(current.toBuilder()
                .status(TaskStatus.PROGRESS)
                .progressPercent(percent)
                .progressStep(step)
                .progressDetail(detail)
                .startedAt(current.startedAt() != null ? current.startedAt() : now)
                .build());
    }

    /** -> SUCCESS with progress 100 */
    public static Outcome complete(TaskRecord current, JsonNode resultSummary, Instant now) {
        if (current.isTerminal()) {
            return Outcome.dropped(TransitionResult.STALE_WRITE);
        }
        return Outcome.applied(current.toBuilder()
                .status(TaskStatus.SUCCESS)
                .progressPercent(100.0)
                .resultSummary(resultSummary)
                .completedAt(now)
                .durationMs(durationMs(current, now))
                .build());
    }

    /** -> FAILURE; progress keeps the last checkpoint */
    public static Outcome fail(TaskRecord current, String errorMessage, String errorTrace, Instant now) {
        if (current.isTerminal()) {
            return Outcome.dropped(TransitionResult.STALE_WRITE);
        }
        return Outcome.applied(current.toBuilder()
                .status(TaskStatus.FAILURE)
                .errorMessage(errorMessage)
                .errorTrace(errorTrace)
                .completedAt(now)
                .durationMs(durationMs(current, now))
                .build());
    }

    /** -> REVOKED from any non-terminal state */
    public static Outcome revoke(TaskRecord current, Instant now) {
        if (current.isTerminal()) {
            return Outcome.dropped(TransitionResult.STALE_WRITE);
        }
        return Outcome.applied(current.toBuilder()
                .status(TaskStatus.REVOKED)
                .completedAt(now)
                .durationMs(durationMs(current, now))
                .build());
    }

    /** Shallow merge into metadata; allowed in every state */
    public static Outcome mergeMetadata(TaskRecord current, ObjectNode patch) {
        ObjectNode merged = current.metadata() instanceof ObjectNode existing
                ? existing.deepCopy()
                : Jsons.mapper().createObjectNode();
        merged.setAll(patch);
        return Outcome.applied(current.toBuilder().metadata(merged).build());
    }

    /**
     * Wall time from start (or registration, if the task never reported a start)
     * to completion.
     */
    static Long durationMs(TaskRecord current, Instant completedAt) {
        Instant from = current.startedAt() != null ? current.startedAt() : current.createdAt();
        if (from == null) {
            return null;
        }
        return Math.max(0L, Duration.between(from, completedAt).toMillis());
    }
}
