package takeoff.tasks.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.QueryStringDecoder;
import takeoff.tasks.api.Controller;
import takeoff.tasks.api.v1.dto.CancelTaskResponse;
import takeoff.tasks.api.v1.dto.TaskListResponse;
import takeoff.tasks.api.v1.dto.TaskResponse;
import takeoff.tasks.exception.TaskNotFoundException;
import takeoff.tasks.model.CancelResult;
import takeoff.tasks.model.TaskPage;
import takeoff.tasks.model.TaskQuery;
import takeoff.tasks.model.TaskStatus;
import takeoff.tasks.model.TaskView;
import takeoff.tasks.service.CancellationCoordinator;
import takeoff.tasks.service.StatusReconciler;
import takeoff.tasks.service.TaskQueryService;
import takeoff.tasks.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for task status, cancellation and listings (public API).
 *
 * GET /api/v1/tasks/{taskId} - Current merged status
 * POST /api/v1/tasks/{taskId}/cancel - Cancel a task (idempotent)
 * GET /api/v1/projects/{projectId}/tasks - Paginated listing with counts
 */
public class TaskController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(TaskController.class);

    private static final Pattern TASK_BY_ID_PATTERN = Pattern.compile("^/api/v1/tasks/([^/]+)$");
    private static final Pattern CANCEL_PATTERN = Pattern.compile("^/api/v1/tasks/([^/]+)/cancel$");
    private static final Pattern PROJECT_TASKS_PATTERN = Pattern.compile("^/api/v1/projects/([^/]+)/tasks$");

    private final StatusReconciler reconciler;
    private final CancellationCoordinator coordinator;
    private final TaskQueryService queryService;

    public TaskController(StatusReconciler reconciler, CancellationCoordinator coordinator,
            TaskQueryService queryService) {
        this.reconciler = reconciler;
        this.coordinator = coordinator;
        this.queryService = queryService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (method.equals(HttpMethod.POST)) {
            return CANCEL_PATTERN.matcher(path).matches();
        }
        if (method.equals(HttpMethod.GET)) {
            return TASK_BY_ID_PATTERN.matcher(path).matches()
                    || PROJECT_TASKS_PATTERN.matcher(path).matches();
        }
        return false;
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            Matcher cancelMatcher = CANCEL_PATTERN.matcher(path);
            if (req.method().equals(HttpMethod.POST) && cancelMatcher.matches()) {
                return handleCancel(cancelMatcher.group(1));
            }

            Matcher taskMatcher = TASK_BY_ID_PATTERN.matcher(path);
            if (req.method().equals(HttpMethod.GET) && taskMatcher.matches()) {
                return handleGetTask(taskMatcher.group(1));
            }

            Matcher projectMatcher = PROJECT_TASKS_PATTERN.matcher(path);
            if (req.method().equals(HttpMethod.GET) && projectMatcher.matches()) {
                return handleListTasks(req, projectMatcher.group(1));
            }

            return ControllerResponse.notFound("unknown task endpoint");

        } catch (TaskNotFoundException e) {
            return ControllerResponse.notFound("task not found");
        } catch (IllegalArgumentException e) {
            return ControllerResponse.badRequest(e.getMessage());
        } catch (Exception e) {
            log.error("Task controller error", e);
            return ControllerResponse.error("internal error");
        }
    }

    /**
     * GET /api/v1/tasks/{taskId}
     */
    private ControllerResponse handleGetTask(String taskId) throws Exception {
        TaskView view = reconciler.getStatus(taskId);
        return ControllerResponse.json(Jsons.mapper().writeValueAsString(TaskResponse.from(view)));
    }

    /**
     * POST /api/v1/tasks/{taskId}/cancel
     */
    private ControllerResponse handleCancel(String taskId) throws Exception {
        CancelResult result = coordinator.cancel(taskId);
        return ControllerResponse.json(Jsons.mapper().writeValueAsString(CancelTaskResponse.from(result)));
    }

    /**
     * GET /api/v1/projects/{projectId}/tasks?status=&type=&limit=&offset=
     */
    private ControllerResponse handleListTasks(FullHttpRequest req, String projectId) throws Exception {
        Map<String, List<String>> params = new QueryStringDecoder(req.uri()).parameters();

        String status = param(params, "status");
        TaskQuery query = new TaskQuery(
                projectId,
                status != null ? TaskStatus.parse(status) : null,
                param(params, "type"),
                intParam(params, "limit", TaskQuery.DEFAULT_LIMIT),
                intParam(params, "offset", 0));

        TaskPage page = queryService.listTasks(query);
        return ControllerResponse.json(Jsons.mapper().writeValueAsString(TaskListResponse.from(page)));
    }

    private static String param(Map<String, List<String>> params, String name) {
        List<String> values = params.get(name);
        if (values == null || values.isEmpty() || values.get(0).isBlank()) {
            return null;
        }
        return values.get(0);
    }

    private static int intParam(Map<String, List<String>> params, String name, int defaultValue) {
        String value = param(params, name);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be an integer");
        }
    }
}
