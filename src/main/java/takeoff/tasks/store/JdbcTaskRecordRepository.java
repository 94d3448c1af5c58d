package takeoff.tasks.store;

import takeoff.tasks.exception.DuplicateTaskException;
import takeoff.tasks.model.TaskCounts;
import takeoff.tasks.model.TaskQuery;
import takeoff.tasks.model.TaskRecord;
import takeoff.tasks.model.TaskStatus;
import takeoff.tasks.repository.TaskMutation;
import takeoff.tasks.repository.TaskRecordRepository;
import takeoff.tasks.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * JDBC implementation of TaskRecordRepository.
 * Uses SELECT ... FOR UPDATE for row-level read-modify-write.
 */
public class JdbcTaskRecordRepository implements TaskRecordRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcTaskRecordRepository.class);

    /** SQLState for unique/primary key violations (H2 and PostgreSQL) */
    private static final String UNIQUE_VIOLATION = "23505";

    private final Database db;

    public JdbcTaskRecordRepository(Database db) {
        this.db = db;
    }

    @Override
    public void insert(TaskRecord record) {
        String sql = """
                    INSERT INTO task_records (task_id, project_id, task_type, task_name, status, progress_percent,
                                              progress_step, progress_detail, entity_type, entity_id, result_summary,
                                              error_message, error_trace, created_at, started_at, completed_at,
                                              duration_ms, initiated_by, provider, metadata)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, record.taskId());
            ps.setString(2, record.projectId());
            ps.setString(3, record.taskType());
            ps.setString(4, record.taskName());
            ps.setString(5, record.status().name());
            ps.setDouble(6, record.progressPercent());
            ps.setString(7, record.progressStep());
            ps.setString(8, record.progressDetail());
            ps.setString(9, record.entityType());
            ps.setString(10, record.entityId());
            ps.setString(11, Jsons.write(record.resultSummary()));
            ps.setString(12, record.errorMessage());
            ps.setString(13, record.errorTrace());
            setTimestamp(ps, 14, record.createdAt() != null ? record.createdAt() : Instant.now());
            setTimestamp(ps, 15, record.startedAt());
            setTimestamp(ps, 16, record.completedAt());
            setLongOrNull(ps, 17, record.durationMs());
            ps.setString(18, record.initiatedBy());
            ps.setString(19, record.provider());
            ps.setString(20, Jsons.write(record.metadata()));

            try {
                ps.executeUpdate();
                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                if (UNIQUE_VIOLATION.equals(e.getSQLState())) {
                    throw new DuplicateTaskException(record.taskId(), e);
                }
                throw e;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to insert task record: " + record.taskId(), e);
        }
    }

    @Override
    public Optional<TaskRecord> findById(String taskId) {
        String sql = "SELECT * FROM task_records WHERE task_id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, taskId);
            try (ResultSet rs = ps.executeQuery()) {
                Optional<TaskRecord> found = rs.next() ? Optional.of(mapRow(rs)) : Optional.empty();
                conn.commit();
                return found;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find task record: " + taskId, e);
        }
    }

    @Override
    public Optional<TaskRecord> update(String taskId, TaskMutation mutation) {
        String selectSql = "SELECT * FROM task_records WHERE task_id = ? FOR UPDATE";

        String updateSql = """
                    UPDATE task_records
                    SET status = ?, progress_percent = ?, progress_step = ?, progress_detail = ?,
                        result_summary = ?, error_message = ?, error_trace = ?, started_at = ?,
                        completed_at = ?, duration_ms = ?, metadata = ?
                    WHERE task_id = ?
                """;

        try (Connection conn = db.getConnection()) {
            try {
                TaskRecord current;
                try (PreparedStatement selectPs = conn.prepareStatement(selectSql)) {
                    selectPs.setString(1, taskId);
                    try (ResultSet rs = selectPs.executeQuery()) {
                        if (!rs.next()) {
                            conn.rollback();
                            return Optional.empty();
                        }
                        current = mapRow(rs);
                    }
                }

                Optional<TaskRecord> next = mutation.apply(current);
                if (next.isEmpty()) {
                    // Write dropped: release the lock without touching the row
                    conn.rollback();
                    return Optional.of(current);
                }

                TaskRecord updated = next.get();
                try (PreparedStatement updatePs = conn.prepareStatement(updateSql)) {
                    updatePs.setString(1, updated.status().name());
                    updatePs.setDouble(2, updated.progressPercent());
                    updatePs.setString(3, updated.progressStep());
                    updatePs.setString(4, updated.progressDetail());
                    updatePs.setString(5, Jsons.write(updated.resultSummary()));
                    updatePs.setString(6, updated.errorMessage());
                    updatePs.setString(7, updated.errorTrace());
                    setTimestamp(updatePs, 8, updated.startedAt());
                    setTimestamp(updatePs, 9, updated.completedAt());
                    setLongOrNull(updatePs, 10, updated.durationMs());
                    updatePs.setString(11, Jsons.write(updated.metadata()));
                    updatePs.setString(12, taskId);
                    updatePs.executeUpdate();
                }

                conn.commit();
                log.debug("Task record {} updated: {} -> {}", taskId, current.status(), updated.status());
                return Optional.of(updated);

            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to update task record: " + taskId, e);
        }
    }

    @Override
    public List<TaskRecord> findPage(TaskQuery query) {
        StringBuilder sql = new StringBuilder("SELECT * FROM task_records");
        List<Object> params = new ArrayList<>();
        appendFilters(sql, params, query);
        sql.append(" ORDER BY created_at DESC, task_id LIMIT ? OFFSET ?");
        params.add(query.limit());
        params.add(query.offset());

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql.toString())) {

            bind(ps, params);
            List<TaskRecord> records = executeQuery(ps);
            conn.commit();
            return records;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list task records for project: " + query.projectId(), e);
        }
    }

    @Override
    public TaskCounts count(TaskQuery query) {
        StringBuilder sql = new StringBuilder("""
                    SELECT COUNT(*) AS total,
                           COALESCE(SUM(CASE WHEN status IN ('PENDING', 'STARTED', 'PROGRESS') THEN 1 ELSE 0 END), 0) AS running,
                           COALESCE(SUM(CASE WHEN status = 'SUCCESS' THEN 1 ELSE 0 END), 0) AS completed,
                           COALESCE(SUM(CASE WHEN status = 'FAILURE' THEN 1 ELSE 0 END), 0) AS failed,
                           COALESCE(SUM(CASE WHEN status = 'REVOKED' THEN 1 ELSE 0 END), 0) AS cancelled
                    FROM task_records
                """);
        List<Object> params = new ArrayList<>();
        appendFilters(sql, params, query);

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql.toString())) {

            bind(ps, params);
            try (ResultSet rs = ps.executeQuery()) {
                TaskCounts counts = TaskCounts.EMPTY;
                if (rs.next()) {
                    counts = new TaskCounts(
                            rs.getInt("total"),
                            rs.getInt("running"),
                            rs.getInt("completed"),
                            rs.getInt("failed"),
                            rs.getInt("cancelled"));
                }
                conn.commit();
                return counts;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count task records for project: " + query.projectId(), e);
        }
    }

    @Override
    public int countByStatus(TaskStatus status) {
        String sql = "SELECT COUNT(*) FROM task_records WHERE status = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, status.name());
            try (ResultSet rs = ps.executeQuery()) {
                int count = rs.next() ? rs.getInt(1) : 0;
                conn.commit();
                return count;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count task records by status: " + status, e);
        }
    }

    // ==================== Helper methods ====================

    private static void appendFilters(StringBuilder sql, List<Object> params, TaskQuery query) {
        sql.append(" WHERE project_id = ?");
        params.add(query.projectId());
        if (query.status() != null) {
            sql.append(" AND status = ?");
            params.add(query.status().name());
        }
        if (query.taskType() != null) {
            sql.append(" AND task_type = ?");
            params.add(query.taskType());
        }
    }

    private static void bind(PreparedStatement ps, List<Object> params) throws SQLException {
        for (int i = 0; i < params.size(); i++) {
            Object value = params.get(i);
            if (value instanceof Integer n) {
                ps.setInt(i + 1, n);
            } else {
                ps.setString(i + 1, (String) value);
            }
        }
    }

    private List<TaskRecord> executeQuery(PreparedStatement ps) throws SQLException {
        List<TaskRecord> records = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                records.add(mapRow(rs));
            }
        }
        return records;
    }

    private TaskRecord mapRow(ResultSet rs) throws SQLException {
        return TaskRecord.builder()
                .taskId(rs.getString("task_id"))
                .projectId(rs.getString("project_id"))
                .taskType(rs.getString("task_type"))
                .taskName(rs.getString("task_name"))
                .status(TaskStatus.valueOf(rs.getString("status")))
                .progressPercent(rs.getDouble("progress_percent"))
                .progressStep(rs.getString("progress_step"))
                .progressDetail(rs.getString("progress_detail"))
                .entityType(rs.getString("entity_type"))
                .entityId(rs.getString("entity_id"))
                .resultSummary(Jsons.parse(rs.getString("result_summary")))
                .errorMessage(rs.getString("error_message"))
                .errorTrace(rs.getString("error_trace"))
                .createdAt(getInstant(rs, "created_at"))
                .startedAt(getInstant(rs, "started_at"))
                .completedAt(getInstant(rs, "completed_at"))
                .durationMs(getLongOrNull(rs, "duration_ms"))
                .initiatedBy(rs.getString("initiated_by"))
                .provider(rs.getString("provider"))
                .metadata(Jsons.parse(rs.getString("metadata")))
                .build();
    }

    private static void setTimestamp(PreparedStatement ps, int index, Instant instant) throws SQLException {
        if (instant != null) {
            ps.setTimestamp(index, Timestamp.from(instant));
        } else {
            ps.setNull(index, Types.TIMESTAMP);
        }
    }

    private static void setLongOrNull(PreparedStatement ps, int index, Long value) throws SQLException {
        if (value != null) {
            ps.setLong(index, value);
        } else {
            ps.setNull(index, Types.BIGINT);
        }
    }

    private static Instant getInstant(ResultSet rs, String column) throws SQLException {
        Timestamp ts = rs.getTimestamp(column);
        return ts != null ? ts.toInstant() : null;
    }

    private static Long getLongOrNull(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : value;
    }
}
