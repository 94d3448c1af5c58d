package takeoff.tasks.repository;

import takeoff.tasks.model.TaskRecord;

import java.util.Optional;

/**
 * Read-modify-write step applied to one row while it is locked.
 */
@FunctionalInterface
public interface TaskMutation {

    /**
     * @param current the row as currently stored
     * @return the row to store, or empty to drop the write and leave the row untouched
     */
    Optional<TaskRecord> apply(TaskRecord current);
}
