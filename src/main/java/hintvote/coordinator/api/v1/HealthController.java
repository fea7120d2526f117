package hintvote.coordinator.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import hintvote.coordinator.api.Controller;
import hintvote.coordinator.api.v1.dto.HealthResponse;
import hintvote.coordinator.registry.SessionRegistry;
import hintvote.coordinator.scheduler.DeadlineScheduler;
import hintvote.coordinator.server.RouterHandler;
import hintvote.coordinator.service.HintSessionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.management.ManagementFactory;
import java.time.Duration;

/**
 * Health check controller.
 * GET /api/v1/health
 */
public class HealthController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(HealthController.class);
    private static final String VERSION = "1.0.0";

    private final HintSessionService sessionService;
    private final SessionRegistry registry;
    private final DeadlineScheduler scheduler;

    public HealthController(HintSessionService sessionService, SessionRegistry registry, DeadlineScheduler scheduler) {
        this.sessionService = sessionService;
        this.registry = registry;
        this.scheduler = scheduler;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/health".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            // Vote expiry depends on the scheduler workers
            if (!scheduler.isRunning()) {
                HealthResponse response = HealthResponse.unhealthy("stopped");
                return ControllerResponse.json(HttpResponseStatus.SERVICE_UNAVAILABLE,
                        RouterHandler.mapper().writeValueAsString(response));
            }

            HealthResponse response = HealthResponse.healthy(
                    formatUptime(),
                    VERSION,
                    sessionService.count(),
                    registry.sizeResources(),
                    scheduler.pending());

            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));

        } catch (Exception e) {
            log.error("Health check failed", e);
            return ControllerResponse.error("health check failed");
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
