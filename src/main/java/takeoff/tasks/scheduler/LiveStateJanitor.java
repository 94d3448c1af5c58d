package takeoff.tasks.scheduler;

import takeoff.tasks.config.TrackerConfig;
import takeoff.tasks.engine.LocalExecutionEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Background task that expires live state of finished tasks.
 *
 * Once a task is terminal its durable record is authoritative, so the engine
 * only keeps the live entry for a grace period (the live-state TTL). After
 * that, reads are served from the store alone.
 */
public class LiveStateJanitor implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(LiveStateJanitor.class);

    private final LocalExecutionEngine engine;
    private final TrackerConfig config;

    public LiveStateJanitor(LocalExecutionEngine engine, TrackerConfig config) {
        this.engine = engine;
        this.config = config;
    }

    @Override
    public void run() {
        try {
            sweep();
        } catch (Exception e) {
            log.error("Live state janitor error", e);
        }
    }

    /**
     * @return number of live entries expired
     */
    public int sweep() {
        if (!engine.isAvailable()) {
            log.debug("Engine stopped, skipping live state sweep");
            return 0;
        }
        int expired = engine.expireFinished(config.liveStateTtl());
        if (expired > 0) {
            log.info("Live state janitor: {} expired, {} remaining", expired, engine.liveCount());
        }
        return expired;
    }
}
