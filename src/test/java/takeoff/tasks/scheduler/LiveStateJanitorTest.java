package takeoff.tasks.scheduler;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import takeoff.tasks.config.TrackerConfig;
import takeoff.tasks.engine.LocalExecutionEngine;
import takeoff.tasks.model.LiveState;
import takeoff.tasks.model.TaskStatus;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for live state expiry.
 */
class LiveStateJanitorTest {

    private LocalExecutionEngine engine;

    @BeforeEach
    void setup() {
        engine = new LocalExecutionEngine(2);
    }

    @AfterEach
    void teardown() {
        engine.close();
    }

    private void awaitSuccess(String taskId) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (engine.liveState(taskId).map(LiveState::status).orElse(null) != TaskStatus.SUCCESS) {
            assertTrue(System.currentTimeMillis() < deadline, "task did not finish");
            Thread.sleep(10);
        }
    }

    @Test
    void expiresFinishedTasksPastTtl() throws InterruptedException {
        TrackerConfig config = TrackerConfig.defaults().withLiveStateTtl(Duration.ofMillis(50));
        String taskId = engine.dispatch(ctx -> null);
        awaitSuccess(taskId);

        Thread.sleep(100);
        LiveStateJanitor janitor = new LiveStateJanitor(engine, config);
        assertEquals(1, janitor.sweep());
        assertTrue(engine.liveState(taskId).isEmpty());
    }

    @Test
    void keepsRecentAndRunningTasks() throws InterruptedException {
        TrackerConfig config = TrackerConfig.defaults().withLiveStateTtl(Duration.ofHours(1));
        CountDownLatch release = new CountDownLatch(1);
        String finished = engine.dispatch(ctx -> null);
        String running = engine.dispatch(ctx -> {
            release.await(5, TimeUnit.SECONDS);
            return null;
        });
        awaitSuccess(finished);

        LiveStateJanitor janitor = new LiveStateJanitor(engine, config);
        assertEquals(0, janitor.sweep());
        assertTrue(engine.liveState(finished).isPresent());
        assertTrue(engine.liveState(running).isPresent());
        release.countDown();
    }

    @Test
    void dropsRevokeFlagsWithoutLiveState() throws InterruptedException {
        for (int i = 0; i < 1000; i++) {
            engine.revoke("remote-" + i);
        }
        assertEquals(1000, engine.revokedCount());
        assertTrue(engine.isRevoked("remote-0"));

        Thread.sleep(20);
        LiveStateJanitor janitor = new LiveStateJanitor(engine,
                TrackerConfig.defaults().withLiveStateTtl(Duration.ofMillis(10)));
        assertEquals(0, janitor.sweep());
        assertEquals(0, engine.revokedCount());
        assertFalse(engine.isRevoked("remote-0"));
    }

    @Test
    void keepsRevokeFlagsOfRunningTasks() throws InterruptedException {
        CountDownLatch release = new CountDownLatch(1);
        String running = engine.dispatch(ctx -> {
            release.await(5, TimeUnit.SECONDS);
            return null;
        });
        engine.revoke(running);
        engine.revoke("remote-recent");

        Thread.sleep(20);
        LiveStateJanitor janitor = new LiveStateJanitor(engine,
                TrackerConfig.defaults().withLiveStateTtl(Duration.ofMillis(10)));
        janitor.sweep();
        assertTrue(engine.isRevoked(running));
        assertFalse(engine.isRevoked("remote-recent"));

        engine.revoke("remote-fresh");
        new LiveStateJanitor(engine, TrackerConfig.defaults().withLiveStateTtl(Duration.ofHours(1))).sweep();
        assertTrue(engine.isRevoked("remote-fresh"));
        release.countDown();
    }

    @Test
    void stoppedEngineIsSkipped() {
        engine.close();
        LiveStateJanitor janitor = new LiveStateJanitor(engine, TrackerConfig.defaults());
        assertEquals(0, janitor.sweep());
        assertDoesNotThrow(janitor::run);
    }

    @Test
    void schedulerStartsAndStops() {
        TrackerConfig config = TrackerConfig.defaults().withLiveStateSweepInterval(Duration.ofMillis(20));
        Scheduler scheduler = new Scheduler(engine, config);

        scheduler.start();
        assertTrue(scheduler.isRunning());
        scheduler.start();
        assertTrue(scheduler.isRunning());

        scheduler.close();
        assertFalse(scheduler.isRunning());
    }
}
