package takeoff.tasks.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import takeoff.tasks.api.Controller;
import takeoff.tasks.api.v1.dto.HealthResponse;
import takeoff.tasks.engine.LocalExecutionEngine;
import takeoff.tasks.service.TaskQueryService;
import takeoff.tasks.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.management.ManagementFactory;
import java.time.Duration;
import java.util.function.BooleanSupplier;

/**
 * Health check controller.
 * GET /api/v1/health
 */
public class HealthController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(HealthController.class);
    private static final String VERSION = "1.0.0";

    private final BooleanSupplier storeHealthy;
    private final LocalExecutionEngine engine;
    private final TaskQueryService queryService;

    public HealthController(BooleanSupplier storeHealthy, LocalExecutionEngine engine, TaskQueryService queryService) {
        this.storeHealthy = storeHealthy;
        this.engine = engine;
        this.queryService = queryService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/health".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            if (!storeHealthy.getAsBoolean()) {
                HealthResponse response = HealthResponse.unhealthy("connection failed");
                return ControllerResponse.json(HttpResponseStatus.SERVICE_UNAVAILABLE,
                        Jsons.mapper().writeValueAsString(response));
            }

            // A stopped engine degrades reads but does not make the service unhealthy
            HealthResponse response = HealthResponse.healthy(
                    engine.isAvailable() ? "ok" : "unavailable",
                    formatUptime(),
                    VERSION,
                    queryService.countActive(),
                    engine.liveCount());

            return ControllerResponse.json(Jsons.mapper().writeValueAsString(response));

        } catch (Exception e) {
            log.error("Health check failed", e);
            try {
                HealthResponse response = HealthResponse.unhealthy(e.getMessage());
                return ControllerResponse.json(HttpResponseStatus.SERVICE_UNAVAILABLE,
                        Jsons.mapper().writeValueAsString(response));
            } catch (Exception ex) {
                return ControllerResponse.error("health check failed");
            }
        }
    }

    private String formatUptime() {
        long uptimeMs = ManagementFactory.getRuntimeMXBean().getUptime();
        Duration duration = Duration.ofMillis(uptimeMs);
        long hours = duration.toHours();
        long minutes = duration.toMinutesPart();
        return hours + "h " + minutes + "m";
    }
}
