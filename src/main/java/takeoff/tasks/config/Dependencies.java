package takeoff.tasks.config;

import takeoff.tasks.api.internal.v1.TaskLifecycleController;
import takeoff.tasks.api.v1.HealthController;
import takeoff.tasks.api.v1.TaskController;
import takeoff.tasks.engine.CancellationCheck;
import takeoff.tasks.engine.LocalExecutionEngine;
import takeoff.tasks.repository.TaskRecordRepository;
import takeoff.tasks.scheduler.Scheduler;
import takeoff.tasks.server.RouterHandler;
import takeoff.tasks.service.CancellationCoordinator;
import takeoff.tasks.service.StatusReconciler;
import takeoff.tasks.service.TaskLauncher;
import takeoff.tasks.service.TaskQueryService;
import takeoff.tasks.service.TaskTracker;
import takeoff.tasks.store.Database;
import takeoff.tasks.store.InMemoryTaskRecordRepository;
import takeoff.tasks.store.JdbcTaskRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Manual dependency injection container.
 * Creates and wires all service dependencies.
 *
 * Usage:
 *
 * <pre>
 * Dependencies deps = Dependencies.create(TrackerConfig.fromEnv());
 * deps.startScheduler(); // start background tasks
 * TaskLauncher launcher = deps.launcher();
 * // ... use services ...
 * deps.close(); // cleanup
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final TrackerConfig config;
    private final Database database; // null with the in-memory store
    private final TaskRecordRepository repository;
    private final LocalExecutionEngine engine;
    private final TaskTracker tracker;
    private final StatusReconciler reconciler;
    private final CancellationCoordinator coordinator;
    private final TaskQueryService queryService;
    private final TaskLauncher launcher;

    // Controllers
    private final HealthController healthController;
    private final TaskController taskController;
    private final TaskLifecycleController lifecycleController;

    // Router (lazy-initialized)
    private RouterHandler routerHandler;

    // Scheduler (lazy-initialized)
    private Scheduler scheduler;

    private Dependencies(TrackerConfig config) {
        this.config = config;

        log.info("Initializing dependencies with config: {}", config);

        // Infrastructure
        if (config.storeType() == TrackerConfig.StoreType.JDBC) {
            this.database = new Database(config);
            this.repository = new JdbcTaskRecordRepository(database);
        } else {
            this.database = null;
            this.repository = new InMemoryTaskRecordRepository();
        }
        this.engine = new LocalExecutionEngine(config.workerThreads());

        // Services
        this.tracker = new TaskTracker(repository);
        this.reconciler = new StatusReconciler(repository, engine);
        this.coordinator = new CancellationCoordinator(repository, engine, tracker);
        this.queryService = new TaskQueryService(repository, reconciler);
        CancellationCheck durableCheck = coordinator.durableCheck();
        this.launcher = new TaskLauncher(engine, tracker, durableCheck);

        // Controllers (public API)
        this.healthController = new HealthController(
                () -> database == null || database.isHealthy(), engine, queryService);
        this.taskController = new TaskController(reconciler, coordinator, queryService);

        // Controllers (internal API)
        CancellationCheck engineCheck = engine::isRevoked;
        this.lifecycleController = new TaskLifecycleController(tracker, engineCheck.or(durableCheck));

        log.info("Dependencies initialized successfully");
    }

    public static Dependencies create(TrackerConfig config) {
        return new Dependencies(config);
    }

    public static Dependencies create() {
        return create(TrackerConfig.fromEnv());
    }

    // Getters
    public TrackerConfig config() {
        return config;
    }

    public TaskRecordRepository repository() {
        return repository;
    }

    public LocalExecutionEngine engine() {
        return engine;
    }

    public TaskTracker tracker() {
        return tracker;
    }

    public StatusReconciler reconciler() {
        return reconciler;
    }

    public CancellationCoordinator coordinator() {
        return coordinator;
    }

    public TaskQueryService queryService() {
        return queryService;
    }

    public TaskLauncher launcher() {
        return launcher;
    }

    /**
     * Get a fully configured RouterHandler with all controllers registered.
     * This is the main entry point for serving HTTP requests.
     */
    public RouterHandler routerHandler() {
        if (routerHandler == null) {
            routerHandler = new RouterHandler(config)
                    .registerController(healthController)
                    .registerController(taskController)
                    .registerController(lifecycleController);
            log.info("RouterHandler created with {} controllers", routerHandler.controllerCount());
        }
        return routerHandler;
    }

    public Scheduler scheduler() {
        if (scheduler == null) {
            scheduler = new Scheduler(engine, config);
        }
        return scheduler;
    }

    /**
     * Start background live-state expiry. Should be called after server startup.
     */
    public void startScheduler() {
        scheduler().start();
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");

        if (scheduler != null) {
            try {
                scheduler.stop();
            } catch (Exception e) {
                log.warn("Error stopping scheduler: {}", e.getMessage());
            }
        }

        try {
            engine.close();
        } catch (Exception e) {
            log.warn("Error stopping execution engine: {}", e.getMessage());
        }

        if (database != null) {
            try {
                database.close();
            } catch (Exception e) {
                log.warn("Error closing database: {}", e.getMessage());
            }
        }

        log.info("Dependencies closed");
    }
}
