package takeoff.tasks.store;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import takeoff.tasks.config.TrackerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Database connection pool and schema management.
 * Uses HikariCP for connection pooling.
 */
public final class Database implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Database.class);

    private final HikariDataSource dataSource;

    public Database(TrackerConfig config) {
        this(config.databaseUrl(), config.databasePoolSize());
    }

    public Database(String jdbcUrl, int poolSize) {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setMaximumPoolSize(poolSize);
        hikariConfig.setMinimumIdle(2);
        hikariConfig.setConnectionTimeout(5000);
        hikariConfig.setIdleTimeout(300000);
        hikariConfig.setPoolName("takeoff-tasks-pool");
        hikariConfig.setAutoCommit(false);

        this.dataSource = new HikariDataSource(hikariConfig);

        log.info("Database pool initialized: {}", jdbcUrl);

        initSchema();
    }

    /**
     * Get a connection from the pool.
     * Caller is responsible for closing the connection.
     */
    public Connection getConnection() throws SQLException {
        return dataSource.getConnection();
    }

    public DataSource getDataSource() {
        return dataSource;
    }

    /**
     * Check if database is healthy.
     */
    public boolean isHealthy() {
        try (Connection conn = getConnection()) {
            return conn.isValid(2);
        } catch (SQLException e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return false;
        }
    }

    private void initSchema() {
        try (Connection conn = getConnection();
                Statement st = conn.createStatement()) {

            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS task_records (
                            task_id          VARCHAR(255) PRIMARY KEY,
                            project_id       VARCHAR(64),
                            task_type        VARCHAR(100) NOT NULL,
                            task_name        VARCHAR(255) NOT NULL,
                            status           VARCHAR(20) DEFAULT 'PENDING' NOT NULL,
                            progress_percent DOUBLE PRECISION DEFAULT 0,
                            progress_step    VARCHAR(255),
                            progress_detail  VARCHAR(2048),
                            entity_type      VARCHAR(64),
                            entity_id        VARCHAR(64),
                            result_summary   CLOB,
                            error_message    CLOB,
                            error_trace      CLOB,
                            created_at       TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            started_at       TIMESTAMP,
                            completed_at     TIMESTAMP,
                            duration_ms      BIGINT,
                            initiated_by     VARCHAR(255),
                            provider         VARCHAR(100),
                            metadata         CLOB
                        );
                    """);

            st.addBatch(
                    "CREATE INDEX IF NOT EXISTS ix_task_records_project_status ON task_records(project_id, status);");
            st.addBatch(
                    "CREATE INDEX IF NOT EXISTS ix_task_records_project_type ON task_records(project_id, task_type);");
            st.addBatch(
                    "CREATE INDEX IF NOT EXISTS ix_task_records_project_created ON task_records(project_id, created_at);");

            st.executeBatch();
            conn.commit();

            log.info("Database schema initialized");
        } catch (SQLException e) {
            throw new RuntimeException("Failed to initialize database schema", e);
        }
    }

    @Override
    public void close() {
        if (dataSource != null && !dataSource.isClosed()) {
            dataSource.close();
            log.info("Database pool closed");
        }
    }
}
