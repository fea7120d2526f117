package hintvote.coordinator.api.v1;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import hintvote.coordinator.api.Controller;
import hintvote.coordinator.api.v1.dto.CastVoteRequest;
import hintvote.coordinator.api.v1.dto.ReportDurationsRequest;
import hintvote.coordinator.api.v1.dto.SendHintRequest;
import hintvote.coordinator.api.v1.dto.SetModeRequest;
import hintvote.coordinator.api.v1.dto.SetThreadsRequest;
import hintvote.coordinator.api.v1.dto.UpdateTargetRequest;
import hintvote.coordinator.model.HintResult;
import hintvote.coordinator.model.VoteSlot;
import hintvote.coordinator.server.RouterHandler;
import hintvote.coordinator.service.HintSession;
import hintvote.coordinator.service.HintSessionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for operations on an open session.
 * POST /api/v1/sessions/{id}/threads - Replace threads
 * POST /api/v1/sessions/{id}/target - Update target duration
 * POST /api/v1/sessions/{id}/durations - Report actual durations
 * POST /api/v1/sessions/{id}/hints - Send a one-shot hint
 * POST /api/v1/sessions/{id}/modes - Toggle a mode
 * POST /api/v1/sessions/{id}/votes - Cast a vote
 */
public class SessionHintController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(SessionHintController.class);

    private static final Pattern OPERATION_PATTERN = Pattern
            .compile("^/api/v1/sessions/([^/]+)/(threads|target|durations|hints|modes|votes)$");

    private final HintSessionService sessionService;

    public SessionHintController(HintSessionService sessionService) {
        this.sessionService = sessionService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.POST) && OPERATION_PATTERN.matcher(path).matches();
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            Matcher matcher = OPERATION_PATTERN.matcher(path);
            if (!matcher.matches()) {
                return ControllerResponse.notFound("unknown session endpoint");
            }
            long sessionId = HintResponses.parseSessionId(matcher.group(1));
            Optional<HintSession> session = sessionService.find(sessionId);
            if (session.isEmpty()) {
                return HintResponses.of(HintResult.NOT_FOUND);
            }

            String body = req.content().toString(StandardCharsets.UTF_8);
            HintResult result = switch (matcher.group(2)) {
                case "threads" -> handleThreads(session.get(), body);
                case "target" -> handleTarget(session.get(), body);
                case "durations" -> handleDurations(session.get(), body);
                case "hints" -> handleHint(session.get(), body);
                case "modes" -> handleMode(session.get(), body);
                case "votes" -> handleVote(session.get(), body);
                default -> throw new IllegalArgumentException("unknown operation: " + matcher.group(2));
            };
            return HintResponses.of(result);

        } catch (JsonProcessingException e) {
            return ControllerResponse.badRequest("invalid JSON: " + e.getOriginalMessage());
        } catch (IllegalArgumentException e) {
            return ControllerResponse.badRequest(e.getMessage());
        } catch (Exception e) {
            log.error("Session hint controller error", e);
            return ControllerResponse.error("internal error");
        }
    }

    private HintResult handleThreads(HintSession session, String body) throws Exception {
        SetThreadsRequest request = RouterHandler.mapper().readValue(body, SetThreadsRequest.class);
        request.validate();
        return session.setThreads(request.threadIds());
    }

    private HintResult handleTarget(HintSession session, String body) throws Exception {
        UpdateTargetRequest request = RouterHandler.mapper().readValue(body, UpdateTargetRequest.class);
        return session.updateTargetWorkDuration(request.targetDurationNanos());
    }

    private HintResult handleDurations(HintSession session, String body) throws Exception {
        ReportDurationsRequest request = RouterHandler.mapper().readValue(body, ReportDurationsRequest.class);
        request.validate();
        return session.reportActualWorkDurations(request.toWorkDurations());
    }

    private HintResult handleHint(HintSession session, String body) throws Exception {
        SendHintRequest request = RouterHandler.mapper().readValue(body, SendHintRequest.class);
        request.validate();
        return session.sendHint(request.toHint());
    }

    private HintResult handleMode(HintSession session, String body) throws Exception {
        SetModeRequest request = RouterHandler.mapper().readValue(body, SetModeRequest.class);
        request.validate();
        return session.setMode(request.toMode(), request.enabled());
    }

    private HintResult handleVote(HintSession session, String body) throws Exception {
        CastVoteRequest request = RouterHandler.mapper().readValue(body, CastVoteRequest.class);
        request.validate();
        VoteSlot slot = request.toSlot();
        int lower = request.lower() != null ? request.lower() : 0;
        int upper = request.upper() != null ? request.upper() : 0;
        int magnitude = request.magnitude() != null ? request.magnitude() : 0;
        return session.castVote(slot, lower, upper, magnitude, request.durationNanos());
    }
}
