package takeoff.tasks.store;

import takeoff.tasks.exception.DuplicateTaskException;
import takeoff.tasks.model.TaskCounts;
import takeoff.tasks.model.TaskQuery;
import takeoff.tasks.model.TaskRecord;
import takeoff.tasks.model.TaskStatus;
import takeoff.tasks.repository.TaskMutation;
import takeoff.tasks.repository.TaskRecordRepository;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;

/**
 * In-memory task record store. Row-level atomicity comes from
 * {@link ConcurrentHashMap#compute}, which runs the mutation while holding the
 * entry's lock.
 */
public class InMemoryTaskRecordRepository implements TaskRecordRepository {

    private static final Comparator<TaskRecord> NEWEST_FIRST = Comparator
            .comparing(TaskRecord::createdAt, Comparator.nullsLast(Comparator.reverseOrder()))
            .thenComparing(TaskRecord::taskId);

    private final Map<String, TaskRecord> store = new ConcurrentHashMap<>();

    @Override
    public void insert(TaskRecord record) {
        TaskRecord toStore = record.createdAt() != null
                ? record
                : record.toBuilder().createdAt(Instant.now()).build();
        if (store.putIfAbsent(record.taskId(), toStore) != null) {
            throw new DuplicateTaskException(record.taskId());
        }
    }

    @Override
    public Optional<TaskRecord> findById(String taskId) {
        return Optional.ofNullable(store.get(taskId));
    }

    @Override
    public Optional<TaskRecord> update(String taskId, TaskMutation mutation) {
        TaskRecord stored = store.computeIfPresent(taskId,
                (id, current) -> mutation.apply(current).orElse(current));
        return Optional.ofNullable(stored);
    }

    @Override
    public List<TaskRecord> findPage(TaskQuery query) {
        return filtered(query)
                .sorted(NEWEST_FIRST)
                .skip(query.offset())
                .limit(query.limit())
                .toList();
    }

    @Override
    public TaskCounts count(TaskQuery query) {
        TaskCounts counts = TaskCounts.EMPTY;
        for (TaskRecord record : filtered(query).toList()) {
            counts = counts.plus(record.status());
        }
        return counts;
    }

    @Override
    public int countByStatus(TaskStatus status) {
        return (int) store.values().stream()
                .filter(r -> r.status() == status)
                .count();
    }

    private Stream<TaskRecord> filtered(TaskQuery query) {
        return store.values().stream()
                .filter(r -> query.projectId().equals(r.projectId()))
                .filter(r -> query.status() == null || query.status() == r.status())
                .filter(r -> query.taskType() == null || query.taskType().equals(r.taskType()));
    }
}
