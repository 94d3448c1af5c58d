package takeoff.tasks.config;

import java.time.Duration;

/**
 * Configuration holder for the task tracking service.
 * All settings have sensible defaults.
 */
public final class TrackerConfig {

    /** Which task record store backs the service */
    public enum StoreType {
        JDBC,
        MEMORY
    }

    // Database settings
    private String databaseUrl = "jdbc:h2:file:./data/takeoff-tasks;AUTO_SERVER=TRUE;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
    private int databasePoolSize = 10;
    private StoreType storeType = StoreType.JDBC;

    // Server settings
    private int serverPort = 8080;
    private String serverHost = "0.0.0.0";

    // Execution engine settings
    private int workerThreads = 4;
    private Duration liveStateTtl = Duration.ofHours(1);
    private Duration liveStateSweepInterval = Duration.ofMinutes(1);

    // Auth settings (optional)
    private String agentKey = null; // If set, workers must provide X-Takeoff-Key header

    private TrackerConfig() {
    }

    public static TrackerConfig defaults() {
        return new TrackerConfig();
    }

    public static TrackerConfig fromEnv() {
        TrackerConfig config = new TrackerConfig();

        // Override from environment variables
        String dbUrl = System.getenv("TAKEOFF_DB_URL");
        if (dbUrl != null && !dbUrl.isBlank()) {
            config.databaseUrl = dbUrl;
        }

        String store = System.getenv("TAKEOFF_STORE");
        if (store != null && !store.isBlank()) {
            config.storeType = StoreType.valueOf(store.trim().toUpperCase());
        }

        String port = System.getenv("TAKEOFF_PORT");
        if (port != null && !port.isBlank()) {
            config.serverPort = Integer.parseInt(port);
        }

        String workers = System.getenv("TAKEOFF_WORKER_THREADS");
        if (workers != null && !workers.isBlank()) {
            config.workerThreads = Integer.parseInt(workers);
        }

        String ttl = System.getenv("TAKEOFF_LIVE_STATE_TTL");
        if (ttl != null && !ttl.isBlank()) {
            config.liveStateTtl = Duration.ofSeconds(Long.parseLong(ttl));
        }

        String agentKey = System.getenv("TAKEOFF_AGENT_KEY");
        if (agentKey != null && !agentKey.isBlank()) {
            config.agentKey = agentKey;
        }

        return config;
    }

    // Getters
    public String databaseUrl() {
        return databaseUrl;
    }

    public int databasePoolSize() {
        return databasePoolSize;
    }

    public StoreType storeType() {
        return storeType;
    }

    public int serverPort() {
        return serverPort;
    }

    public String serverHost() {
        return serverHost;
    }

    public int workerThreads() {
        return workerThreads;
    }

    public Duration liveStateTtl() {
        return liveStateTtl;
    }

    public Duration liveStateSweepInterval() {
        return liveStateSweepInterval;
    }

    public String agentKey() {
        return agentKey;
    }

    public boolean hasAgentKey() {
        return agentKey != null && !agentKey.isBlank();
    }

    // Fluent setters for testing/customization
    public TrackerConfig withDatabaseUrl(String url) {
        this.databaseUrl = url;
        return this;
    }

    public TrackerConfig withStoreType(StoreType storeType) {
        this.storeType = storeType;
        return this;
    }

    public TrackerConfig withServerPort(int port) {
        this.serverPort = port;
        return this;
    }

    public TrackerConfig withWorkerThreads(int workerThreads) {
        this.workerThreads = workerThreads;
        return this;
    }

    public TrackerConfig withLiveStateTtl(Duration ttl) {
        this.liveStateTtl = ttl;
        return this;
    }

    public TrackerConfig withLiveStateSweepInterval(Duration interval) {
        this.liveStateSweepInterval = interval;
        return this;
    }

    public TrackerConfig withAgentKey(String key) {
        this.agentKey = key;
        return this;
    }

    @Override
    public String toString() {
        return "TrackerConfig{" +
                "store=" + storeType +
                ", databaseUrl='" + databaseUrl + '\'' +
                ", serverPort=" + serverPort +
                ", workerThreads=" + workerThreads +
                ", liveStateTtl=" + liveStateTtl +
                ", agentKeySet=" + hasAgentKey() +
                '}';
    }
}
