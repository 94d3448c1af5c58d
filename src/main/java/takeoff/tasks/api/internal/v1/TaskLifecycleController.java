package takeoff.tasks.api.internal.v1;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import takeoff.tasks.api.Controller;
import takeoff.tasks.api.internal.v1.dto.*;
import takeoff.tasks.api.v1.dto.TaskResponse;
import takeoff.tasks.engine.CancellationCheck;
import takeoff.tasks.exception.DuplicateTaskException;
import takeoff.tasks.exception.TaskNotFoundException;
import takeoff.tasks.model.TaskRecord;
import takeoff.tasks.model.TransitionResult;
import takeoff.tasks.service.TaskTracker;
import takeoff.tasks.service.TaskViewMerger;
import takeoff.tasks.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Worker hooks for tasks executed outside this process (internal API).
 *
 * POST /internal/v1/tasks - Register a dispatched task
 * POST /internal/v1/tasks/{taskId}/started - Worker picked the task up
 * POST /internal/v1/tasks/{taskId}/progress - Progress checkpoint
 * POST /internal/v1/tasks/{taskId}/complete - Report success (idempotent)
 * POST /internal/v1/tasks/{taskId}/fail - Report failure (idempotent)
 * POST /internal/v1/tasks/{taskId}/metadata - Merge metadata keys
 * GET /internal/v1/tasks/{taskId}/cancelled - Poll the cancellation flag
 */
public class TaskLifecycleController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(TaskLifecycleController.class);

    private static final Pattern REGISTER_PATTERN = Pattern.compile("^/internal/v1/tasks$");
    private static final Pattern ACTION_PATTERN = Pattern
            .compile("^/internal/v1/tasks/([^/]+)/(started|progress|complete|fail|metadata)$");
    private static final Pattern CANCELLED_PATTERN = Pattern.compile("^/internal/v1/tasks/([^/]+)/cancelled$");

    private final TaskTracker tracker;
    private final CancellationCheck cancellationCheck;

    public TaskLifecycleController(TaskTracker tracker, CancellationCheck cancellationCheck) {
        this.tracker = tracker;
        this.cancellationCheck = cancellationCheck;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (method.equals(HttpMethod.POST)) {
            return REGISTER_PATTERN.matcher(path).matches() || ACTION_PATTERN.matcher(path).matches();
        }
        if (method.equals(HttpMethod.GET)) {
            return CANCELLED_PATTERN.matcher(path).matches();
        }
        return false;
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            if (req.method().equals(HttpMethod.POST) && REGISTER_PATTERN.matcher(path).matches()) {
                return handleRegister(req);
            }

            Matcher actionMatcher = ACTION_PATTERN.matcher(path);
            if (req.method().equals(HttpMethod.POST) && actionMatcher.matches()) {
                String taskId = actionMatcher.group(1);
                TransitionResult result = switch (actionMatcher.group(2)) {
                    case "started" -> tracker.markStarted(taskId);
                    case "progress" -> handleProgress(req, taskId);
                    case "complete" -> handleComplete(req, taskId);
                    case "fail" -> handleFail(req, taskId);
                    default -> handleMetadata(req, taskId);
                };
                return toResponse(result);
            }

            Matcher cancelledMatcher = CANCELLED_PATTERN.matcher(path);
            if (req.method().equals(HttpMethod.GET) && cancelledMatcher.matches()) {
                return handleCancelled(cancelledMatcher.group(1));
            }

            return ControllerResponse.notFound("unknown task endpoint");

        } catch (DuplicateTaskException e) {
            return ControllerResponse.conflict("task already registered: " + e.taskId());
        } catch (TaskNotFoundException e) {
            return ControllerResponse.notFound("task not found");
        } catch (JsonProcessingException e) {
            return ControllerResponse.badRequest("invalid JSON body");
        } catch (IllegalArgumentException e) {
            return ControllerResponse.badRequest(e.getMessage());
        } catch (Exception e) {
            log.error("Task lifecycle controller error", e);
            return ControllerResponse.error("internal error");
        }
    }

    /**
     * POST /internal/v1/tasks - 201 with the PENDING record, 409 on a reused id
     */
    private ControllerResponse handleRegister(FullHttpRequest req) throws Exception {
        RegisterTaskRequest request = Jsons.mapper().readValue(body(req), RegisterTaskRequest.class);
        request.validate();

        TaskRecord record = tracker.register(request.toRegistration());

        TaskResponse response = TaskResponse.from(TaskViewMerger.fromRecord(record));
        return ControllerResponse.json(HttpResponseStatus.CREATED, Jsons.mapper().writeValueAsString(response));
    }

    private TransitionResult handleProgress(FullHttpRequest req, String taskId) throws Exception {
        ProgressRequest request = Jsons.mapper().readValue(body(req), ProgressRequest.class);
        request.validate();
        return tracker.updateProgress(taskId, request.percent(), request.step(), request.detail());
    }

    private TransitionResult handleComplete(FullHttpRequest req, String taskId) throws Exception {
        String body = body(req);
        CompleteRequest request = body.isBlank()
                ? CompleteRequest.empty()
                : Jsons.mapper().readValue(body, CompleteRequest.class);
        return tracker.markCompleted(taskId, request.result());
    }

    private TransitionResult handleFail(FullHttpRequest req, String taskId) throws Exception {
        FailRequest request = Jsons.mapper().readValue(body(req), FailRequest.class);
        request.validate();
        return tracker.markFailed(taskId, request.error(), request.trace());
    }

    private TransitionResult handleMetadata(FullHttpRequest req, String taskId) throws Exception {
        MetadataRequest request = Jsons.mapper().readValue(body(req), MetadataRequest.class);
        request.validate();
        return tracker.updateMetadata(taskId, request.patch());
    }

    /**
     * GET /internal/v1/tasks/{taskId}/cancelled
     */
    private ControllerResponse handleCancelled(String taskId) throws Exception {
        if (tracker.findById(taskId).isEmpty()) {
            throw new TaskNotFoundException(taskId);
        }
        CancelledResponse response = new CancelledResponse(taskId, cancellationCheck.isCancelled(taskId));
        return ControllerResponse.json(Jsons.mapper().writeValueAsString(response));
    }

    private static ControllerResponse toResponse(TransitionResult result) throws Exception {
        String json = Jsons.mapper().writeValueAsString(OperationResponse.from(result));
        if (result == TransitionResult.NOT_FOUND) {
            return ControllerResponse.json(HttpResponseStatus.NOT_FOUND, json);
        }
        return ControllerResponse.json(json);
    }

    private static String body(FullHttpRequest req) {
        return req.content().toString(StandardCharsets.UTF_8);
    }
}
