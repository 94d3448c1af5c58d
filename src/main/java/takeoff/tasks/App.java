package takeoff.tasks;

import takeoff.tasks.config.Dependencies;
import takeoff.tasks.config.TrackerConfig;
import takeoff.tasks.server.TrackerNettyServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Headless entry point: wires dependencies from the environment, starts the
 * HTTP server and background scheduler, and blocks until shutdown.
 */
public final class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    private App() {
    }

    public static void main(String[] args) throws InterruptedException {
        TrackerConfig config = TrackerConfig.fromEnv();
        Dependencies deps = Dependencies.create(config);
        TrackerNettyServer server = new TrackerNettyServer(deps.routerHandler());
        CountDownLatch stopped = new CountDownLatch(1);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down task tracker");
            server.stop();
            deps.close();
            stopped.countDown();
        }, "takeoff-shutdown"));

        try {
            server.start(config.serverHost(), config.serverPort());
        } catch (IllegalStateException e) {
            log.error("Task tracker failed to start", e);
            deps.close();
            System.exit(1);
        }
        deps.startScheduler();

        stopped.await();
    }
}
