package hintvote.coordinator.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import hintvote.coordinator.api.Controller;
import hintvote.coordinator.api.v1.dto.ThreadResponse;
import hintvote.coordinator.server.RouterHandler;
import hintvote.coordinator.service.SessionOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Read-only view of one thread's owners and current envelope.
 * GET /api/v1/threads/{tid}
 */
public class ThreadController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(ThreadController.class);
    private static final Pattern THREAD_PATTERN = Pattern.compile("^/api/v1/threads/(\\d+)$");

    private final SessionOrchestrator orchestrator;

    public ThreadController(SessionOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && THREAD_PATTERN.matcher(path).matches();
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            Matcher matcher = THREAD_PATTERN.matcher(path);
            if (!matcher.matches()) {
                return ControllerResponse.notFound("unknown thread endpoint");
            }
            int tid = Integer.parseInt(matcher.group(1));
            List<Long> owners = orchestrator.ownersOf(tid);
            if (owners.isEmpty()) {
                return ControllerResponse.notFound("thread not tracked");
            }
            ThreadResponse response = ThreadResponse.from(tid, owners, orchestrator.envelopeOf(tid));
            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));

        } catch (NumberFormatException e) {
            return ControllerResponse.badRequest("invalid thread id");
        } catch (Exception e) {
            log.error("Thread controller error", e);
            return ControllerResponse.error("internal error");
        }
    }
}
