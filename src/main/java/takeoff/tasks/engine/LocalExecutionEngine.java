package takeoff.tasks.engine;

import com.fasterxml.jackson.databind.JsonNode;
import takeoff.tasks.exception.EngineUnavailableException;
import takeoff.tasks.model.LiveState;
import takeoff.tasks.model.TaskStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-process execution engine backed by a fixed worker pool.
 *
 * Live state is held in memory only: it is lost on {@link #forgetAll()} (a
 * restart) and terminal entries expire after a TTL via
 * {@link #expireFinished(Duration)}. Revocation only sets a flag; workers
 * observe it at their next checkpoint.
 */
public class LocalExecutionEngine implements ExecutionEngine, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(LocalExecutionEngine.class);

    private final ExecutorService workers;
    private final Map<String, LiveState> live = new ConcurrentHashMap<>();
    private final Map<String, Instant> revoked = new ConcurrentHashMap<>();

    private volatile boolean available = true;

    public LocalExecutionEngine(int workerThreads) {
        AtomicInteger counter = new AtomicInteger(1);
        this.workers = Executors.newFixedThreadPool(workerThreads, r -> {
            Thread t = new Thread(r, "takeoff-worker-" + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        });
        log.info("Local execution engine started with {} workers", workerThreads);
    }

    @Override
    public String dispatch(TaskWork work) {
        ensureAvailable();
        String taskId = UUID.randomUUID().toString();
        live.put(taskId, LiveState.of(TaskStatus.PENDING));
        try {
            workers.submit(() -> execute(taskId, work));
        } catch (RejectedExecutionException e) {
            live.remove(taskId);
            throw new EngineUnavailableException("engine rejected task " + taskId, e);
        }
        log.debug("Dispatched task {}", taskId);
        return taskId;
    }

    @Override
    public Optional<LiveState> liveState(String taskId) {
        ensureAvailable();
        return Optional.ofNullable(live.get(taskId));
    }

    @Override
    public void revoke(String taskId) {
        ensureAvailable();
        revoked.put(taskId, Instant.now());
        log.info("Revoke requested for task {}", taskId);
    }

    @Override
    public boolean isRevoked(String taskId) {
        return revoked.containsKey(taskId);
    }

    /**
     * Drop live state of tasks that finished more than {@code ttl} ago, and
     * revoke flags older than {@code ttl} that have no live entry (tasks this
     * engine never ran, or lost on {@link #forgetAll()}).
     *
     * @return number of live entries expired
     */
    public int expireFinished(Duration ttl) {
        Instant cutoff = Instant.now().minus(ttl);
        int expired = 0;
        for (Map.Entry<String, LiveState> entry : live.entrySet()) {
            LiveState state = entry.getValue();
            if (state.status().isTerminal() && state.updatedAt().isBefore(cutoff)
                    && live.remove(entry.getKey(), state)) {
                revoked.remove(entry.getKey());
                expired++;
            }
        }
        int orphaned = 0;
        for (Map.Entry<String, Instant> flag : revoked.entrySet()) {
            if (!live.containsKey(flag.getKey()) && !flag.getValue().isAfter(cutoff)
                    && revoked.remove(flag.getKey(), flag.getValue())) {
                orphaned++;
            }
        }
        if (expired > 0 || orphaned > 0) {
            log.debug("Expired live state of {} finished tasks, {} orphaned revoke flags", expired, orphaned);
        }
        return expired;
    }

    /**
     * Lose all volatile state, as a broker restart would. Running workers keep
     * going and re-create their entries on the next report.
     */
    public void forgetAll() {
        int size = live.size();
        live.clear();
        revoked.clear();
        log.warn("Execution engine state cleared ({} live entries dropped)", size);
    }

    public boolean isAvailable() {
        return available;
    }

    public int liveCount() {
        return live.size();
    }

    public int revokedCount() {
        return revoked.size();
    }

    private void execute(String taskId, TaskWork work) {
        live.compute(taskId, (id, state) -> state == null
                ? LiveState.of(TaskStatus.STARTED)
                : state.withStatus(TaskStatus.STARTED));

        try {
            JsonNode result = work.run(new EngineContext(taskId));
            live.compute(taskId, (id, state) -> (state == null ? LiveState.of(TaskStatus.STARTED) : state)
                    .succeeded(result));
            log.debug("Task {} finished on engine", taskId);
        } catch (TaskCancelledException e) {
            live.compute(taskId, (id, state) -> (state == null ? LiveState.of(TaskStatus.STARTED) : state)
                    .withStatus(TaskStatus.REVOKED));
            log.info("Task {} stopped after cancellation", taskId);
        } catch (Throwable e) {
            String error = e.getMessage() != null ? e.getMessage() : e.toString();
            live.compute(taskId, (id, state) -> (state == null ? LiveState.of(TaskStatus.STARTED) : state)
                    .failed(error));
            log.warn("Task {} failed on engine: {}", taskId, error);
            if (e instanceof Error err) {
                throw err;
            }
        }
    }

    private void ensureAvailable() {
        if (!available) {
            throw new EngineUnavailableException("execution engine is not running");
        }
    }

    @Override
    public void close() {
        if (!available) {
            return;
        }
        available = false;
        workers.shutdown();

        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                workers.shutdownNow();
                log.warn("Execution engine forcefully stopped");
            } else {
                log.info("Execution engine stopped gracefully");
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Progress channel and cancellation flag handed to each operation.
     */
    private final class EngineContext implements TaskContext {

        private final String taskId;

        private EngineContext(String taskId) {
            this.taskId = taskId;
        }

        @Override
        public String taskId() {
            return taskId;
        }

        @Override
        public void reportProgress(double percent, String step, String detail) {
            live.compute(taskId, (id, state) -> {
                if (state == null) {
                    return LiveState.of(TaskStatus.STARTED).withProgress(percent, step, detail);
                }
                if (state.status().isTerminal() || percent < state.percent()) {
                    return state;
                }
                return state.withProgress(percent, step, detail);
            });
        }

        @Override
        public boolean isCancelled() {
            return revoked.containsKey(taskId);
        }
    }
}
