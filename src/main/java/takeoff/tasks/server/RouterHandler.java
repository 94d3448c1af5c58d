package takeoff.tasks.server;

import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelHandler.Sharable;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.*;
import takeoff.tasks.api.Controller;
import takeoff.tasks.api.Controller.ControllerResponse;
import takeoff.tasks.config.TrackerConfig;
import takeoff.tasks.exception.DuplicateTaskException;
import takeoff.tasks.exception.EngineUnavailableException;
import takeoff.tasks.exception.TaskNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static io.netty.handler.codec.http.HttpHeaderNames.CONTENT_TYPE;
import static io.netty.handler.codec.http.HttpVersion.HTTP_1_1;

/**
 * Central router that dispatches HTTP requests to registered controllers.
 *
 * Only handles versioned API endpoints:
 * - /api/v1/* (public API)
 * - /internal/v1/* (worker hooks, optionally guarded by X-Takeoff-Key)
 *
 * All other endpoints return 404.
 *
 * This handler is @Sharable because it has no per-channel state.
 */
@Sharable
public class RouterHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

    private static final Logger log = LoggerFactory.getLogger(RouterHandler.class);

    static final String AGENT_KEY_HEADER = "X-Takeoff-Key";

    private final List<Controller> controllers = new ArrayList<>();
    private final TrackerConfig config;

    public RouterHandler(TrackerConfig config) {
        this.config = config;
    }

    /**
     * Register a controller to handle requests.
     * Controllers are checked in order of registration.
     */
    public RouterHandler registerController(Controller controller) {
        controllers.add(controller);
        log.debug("Registered controller: {}", controller.getClass().getSimpleName());
        return this;
    }

    public int controllerCount() {
        return controllers.size();
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest req) {
        String uri = req.uri();
        HttpMethod method = req.method();

        // Extract path without query string
        String path = uri.contains("?") ? uri.substring(0, uri.indexOf("?")) : uri;

        try {
            if (!checkAuth(req, path)) {
                log.warn("Auth failed for {} {}", method, path);
                write(ctx, ControllerResponse.forbidden("forbidden"));
                return;
            }

            for (Controller controller : controllers) {
                if (controller.matches(method, path)) {
                    write(ctx, controller.handle(ctx, req, path));
                    return;
                }
            }

            log.debug("No handler for: {} {}", method, path);
            write(ctx, ControllerResponse.notFound("not found"));

        } catch (TaskNotFoundException e) {
            write(ctx, ControllerResponse.notFound("task not found"));
        } catch (DuplicateTaskException e) {
            write(ctx, ControllerResponse.conflict("task already registered: " + e.taskId()));
        } catch (EngineUnavailableException e) {
            log.warn("Engine unavailable for {} {}: {}", method, path, e.getMessage());
            write(ctx, ControllerResponse.unavailable("execution engine unavailable"));
        } catch (IllegalArgumentException e) {
            log.warn("Validation error: {}", e.getMessage());
            write(ctx, ControllerResponse.badRequest(e.getMessage()));
        } catch (Exception e) {
            log.error("Handler error: {} {}", method, path, e);
            write(ctx, ControllerResponse.error("internal error"));
        }
    }

    /**
     * Only /internal/ endpoints require the agent key, and only when one is configured.
     */
    private boolean checkAuth(FullHttpRequest req, String path) {
        if (!config.hasAgentKey()) {
            return true;
        }
        if (!path.startsWith("/internal/")) {
            return true;
        }
        String providedKey = req.headers().get(AGENT_KEY_HEADER);
        return config.agentKey().equals(providedKey);
    }

    private void write(ChannelHandlerContext ctx, ControllerResponse response) {
        String body = response.body() != null ? response.body() : "";
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        FullHttpResponse httpResponse = new DefaultFullHttpResponse(HTTP_1_1, response.status(),
                Unpooled.wrappedBuffer(bytes));
        httpResponse.headers().set(CONTENT_TYPE, response.contentType() + "; charset=utf-8");
        httpResponse.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, bytes.length);
        ctx.writeAndFlush(httpResponse);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.error("Unhandled exception in channel: {}", cause.getMessage(), cause);
        try {
            write(ctx, ControllerResponse.error("channel error"));
        } finally {
            ctx.close();
        }
    }
}
