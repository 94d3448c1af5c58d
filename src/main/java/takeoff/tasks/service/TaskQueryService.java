package takeoff.tasks.service;

import takeoff.tasks.model.TaskCounts;
import takeoff.tasks.model.TaskPage;
import takeoff.tasks.model.TaskQuery;
import takeoff.tasks.model.TaskRecord;
import takeoff.tasks.model.TaskStatus;
import takeoff.tasks.model.TaskView;
import takeoff.tasks.repository.TaskRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Paginated task listings per project. Rows still running are enriched with
 * live state; counts always come from the store.
 */
public class TaskQueryService {

    private static final Logger log = LoggerFactory.getLogger(TaskQueryService.class);

    private final TaskRecordRepository repository;
    private final StatusReconciler reconciler;

    public TaskQueryService(TaskRecordRepository repository, StatusReconciler reconciler) {
        this.repository = repository;
        this.reconciler = reconciler;
    }

    public TaskPage listTasks(TaskQuery query) {
        List<TaskRecord> records = repository.findPage(query);
        TaskCounts counts = repository.count(query);

        List<TaskView> views = records.stream()
                .map(reconciler::reconcile)
                .toList();

        log.debug("Listed {} of {} tasks for project {} (status={}, type={})",
                views.size(), counts.total(), query.projectId(), query.status(), query.taskType());
        return TaskPage.of(views, counts);
    }

    public TaskPage listTasks(String projectId, TaskStatus status, String taskType, int limit, int offset) {
        return listTasks(new TaskQuery(projectId, status, taskType, limit, offset));
    }

    /** Non-terminal records across all projects */
    public int countActive() {
        return repository.countByStatus(TaskStatus.PENDING)
                + repository.countByStatus(TaskStatus.STARTED)
                + repository.countByStatus(TaskStatus.PROGRESS);
    }
}
