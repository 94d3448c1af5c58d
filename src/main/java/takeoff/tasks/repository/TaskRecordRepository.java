package takeoff.tasks.repository;

import takeoff.tasks.model.TaskCounts;
import takeoff.tasks.model.TaskQuery;
import takeoff.tasks.model.TaskRecord;
import takeoff.tasks.model.TaskStatus;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for durable task records.
 * Implementations can use JDBC or in-memory storage.
 */
public interface TaskRecordRepository {

    /**
     * Insert a new record.
     *
     * @param record the record to insert
     * @throws takeoff.tasks.exception.DuplicateTaskException if the task id already exists
     */
    void insert(TaskRecord record);

    /**
     * Find a record by task id.
     *
     * @param taskId the task id
     * @return the record if found
     */
    Optional<TaskRecord> findById(String taskId);

    /**
     * Atomically read, transform and write one row. Concurrent updates of the
     * same row are serialized; whichever commits first wins and the mutation of
     * the other one sees its result.
     *
     * @param taskId   the task id
     * @param mutation transformation applied under the row lock
     * @return the row as stored after the call (unchanged if the mutation
     *         dropped the write), empty if the task does not exist
     */
    Optional<TaskRecord> update(String taskId, TaskMutation mutation);

    /**
     * One page of a project's records, newest first.
     *
     * @param query filters and paging
     * @return records ordered by created_at descending
     */
    List<TaskRecord> findPage(TaskQuery query);

    /**
     * Aggregate counts for a query's filters (limit and offset ignored).
     *
     * @param query filters
     * @return counts
     */
    TaskCounts count(TaskQuery query);

    /**
     * Count records in a status across all projects.
     *
     * @param status the status
     * @return count
     */
    int countByStatus(TaskStatus status);
}
