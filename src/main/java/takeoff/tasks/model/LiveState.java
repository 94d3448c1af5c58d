package takeoff.tasks.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * What the execution engine currently reports for a task. Volatile: it may be
 * gone after the task finishes or after an engine restart.
 *
 * @param status    engine-side status
 * @param percent   last reported percent, 0 when nothing was reported
 * @param step      last reported step
 * @param detail    last reported detail
 * @param result    return value when the engine saw the task succeed
 * @param error     error text when the engine saw the task fail
 * @param updatedAt when the engine last touched this entry
 */
public record LiveState(
        TaskStatus status,
        double percent,
        String step,
        String detail,
        JsonNode result,
        String error,
        Instant updatedAt) {

    public static LiveState of(TaskStatus status) {
        return new LiveState(status, 0.0, null, null, null, null, Instant.now());
    }

    public LiveState withProgress(double percent, String step, String detail) {
        return new LiveState(TaskStatus.PROGRESS, percent, step, detail, result, error, Instant.now());
    }

    public LiveState withStatus(TaskStatus status) {
        return new LiveState(status, percent, step, detail, result, error, Instant.now());
    }

    public LiveState succeeded(JsonNode result) {
        return new LiveState(TaskStatus.SUCCESS, 100.0, step, detail, result, null, Instant.now());
    }

    public LiveState failed(String error) {
        return new LiveState(TaskStatus.FAILURE, percent, step, detail, null, error, Instant.now());
    }
}
