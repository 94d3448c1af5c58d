package takeoff.tasks.scheduler;

import takeoff.tasks.config.TrackerConfig;
import takeoff.tasks.engine.LocalExecutionEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Runs background housekeeping on a single thread:
 * - LiveStateJanitor: expires live state of finished tasks
 */
public class Scheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Scheduler.class);

    private final ScheduledExecutorService executor;
    private final LiveStateJanitor janitor;
    private final TrackerConfig config;

    private volatile boolean running = false;

    public Scheduler(LocalExecutionEngine engine, TrackerConfig config) {
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "takeoff-scheduler");
            t.setDaemon(true);
            return t;
        });
        this.janitor = new LiveStateJanitor(engine, config);
        this.config = config;
    }

    public void start() {
        if (running) {
            log.warn("Scheduler already running");
            return;
        }

        running = true;

        long sweepIntervalMs = config.liveStateSweepInterval().toMillis();
        executor.scheduleAtFixedRate(
                wrapRunnable("live-state-janitor", janitor),
                sweepIntervalMs,
                sweepIntervalMs,
                TimeUnit.MILLISECONDS);
        log.info("Live state janitor scheduled every {}ms (ttl {})", sweepIntervalMs, config.liveStateTtl());

        log.info("Scheduler started");
    }

    public void stop() {
        if (!running) {
            return;
        }

        running = false;
        executor.shutdown();

        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
                log.warn("Scheduler forcefully stopped");
            } else {
                log.info("Scheduler stopped gracefully");
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running;
    }

    /** For manual triggering in tests and admin paths */
    public LiveStateJanitor janitor() {
        return janitor;
    }

    private Runnable wrapRunnable(String name, Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (Exception e) {
                log.error("{} error", name, e);
            }
        };
    }
}
