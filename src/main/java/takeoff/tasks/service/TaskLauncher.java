package takeoff.tasks.service;

import com.fasterxml.jackson.databind.JsonNode;
import takeoff.tasks.engine.CancellationCheck;
import takeoff.tasks.engine.ExecutionEngine;
import takeoff.tasks.engine.TaskCancelledException;
import takeoff.tasks.engine.TaskContext;
import takeoff.tasks.engine.TaskWork;
import takeoff.tasks.exception.EngineUnavailableException;
import takeoff.tasks.model.TaskRecord;
import takeoff.tasks.model.TaskRegistration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Dispatches work to the engine and wires the tracker into it, so that the
 * operation itself only reports progress and polls for cancellation.
 *
 * The durable record is registered right after dispatch; the worker waits
 * for that registration before touching the record.
 */
public class TaskLauncher {

    private static final Logger log = LoggerFactory.getLogger(TaskLauncher.class);

    private static final long REGISTRATION_WAIT_SECONDS = 30;

    private final ExecutionEngine engine;
    private final TaskTracker tracker;
    private final CancellationCheck durableCheck;

    public TaskLauncher(ExecutionEngine engine, TaskTracker tracker, CancellationCheck durableCheck) {
        this.engine = engine;
        this.tracker = tracker;
        this.durableCheck = durableCheck;
    }

    /**
     * Dispatch and register a task. Any task id on the registration is
     * replaced by the engine-assigned one.
     *
     * @return the registered PENDING record
     */
    public TaskRecord launch(TaskRegistration registration, TaskWork work) {
        CompletableFuture<Void> registered = new CompletableFuture<>();
        String taskId = engine.dispatch(ctx -> runTracked(ctx, work, registered));

        try {
            TaskRecord record = tracker.register(registration.withTaskId(taskId));
            registered.complete(null);
            return record;
        } catch (RuntimeException e) {
            registered.completeExceptionally(e);
            try {
                engine.revoke(taskId);
            } catch (EngineUnavailableException revokeError) {
                e.addSuppressed(revokeError);
            }
            throw e;
        }
    }

    private JsonNode runTracked(TaskContext engineCtx, TaskWork work, CompletableFuture<Void> registered)
            throws Exception {
        String taskId = engineCtx.taskId();
        try {
            registered.get(REGISTRATION_WAIT_SECONDS, TimeUnit.SECONDS);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Task " + taskId + " was never registered", e.getCause());
        } catch (TimeoutException e) {
            throw new IllegalStateException("Timed out waiting for registration of task " + taskId, e);
        }

        TaskContext ctx = new TrackedContext(engineCtx);
        try {
            ctx.checkCancelled();
            tracker.markStarted(taskId);

            JsonNode result = work.run(ctx);
            tracker.markCompleted(taskId, result);
            return result;
        } catch (TaskCancelledException e) {
            tracker.markRevoked(taskId);
            throw e;
        } catch (Throwable e) {
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            log.error("Task {} failed: {}", taskId, message, e);
            tracker.markFailed(taskId, message, stackTrace(e));
            throw e;
        }
    }

    private static String stackTrace(Throwable t) {
        StringWriter out = new StringWriter();
        t.printStackTrace(new PrintWriter(out));
        return out.toString();
    }

    /**
     * Writes progress to the store first, then to the engine.
     */
    private final class TrackedContext implements TaskContext {

        private final TaskContext engineCtx;

        private TrackedContext(TaskContext engineCtx) {
            this.engineCtx = engineCtx;
        }

        @Override
        public String taskId() {
            return engineCtx.taskId();
        }

        @Override
        public void reportProgress(double percent, String step, String detail) {
            tracker.updateProgress(taskId(), percent, step, detail);
            engineCtx.reportProgress(percent, step, detail);
        }

        @Override
        public boolean isCancelled() {
            return engineCtx.isCancelled() || durableCheck.isCancelled(taskId());
        }
    }
}
