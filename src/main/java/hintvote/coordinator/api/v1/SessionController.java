package hintvote.coordinator.api.v1;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import hintvote.coordinator.api.Controller;
import hintvote.coordinator.api.v1.dto.CreateSessionRequest;
import hintvote.coordinator.api.v1.dto.CreateSessionResponse;
import hintvote.coordinator.api.v1.dto.SessionResponse;
import hintvote.coordinator.model.HintResult;
import hintvote.coordinator.model.SessionSnapshot;
import hintvote.coordinator.server.RouterHandler;
import hintvote.coordinator.service.HintSession;
import hintvote.coordinator.service.HintSessionService;
import hintvote.coordinator.service.SessionOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for session lifecycle.
 * POST /api/v1/sessions - Open a session
 * GET /api/v1/sessions - List sessions
 * GET /api/v1/sessions/{id} - Session details
 * POST /api/v1/sessions/{id}/close - Close a session
 * POST /api/v1/sessions/{id}/pause - Pause a session
 * POST /api/v1/sessions/{id}/resume - Resume a session
 */
public class SessionController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(SessionController.class);

    // Patterns for path matching
    private static final String COLLECTION = "/api/v1/sessions";
    private static final Pattern SESSION_PATTERN = Pattern.compile("^/api/v1/sessions/([^/]+)$");
    private static final Pattern LIFECYCLE_PATTERN = Pattern
            .compile("^/api/v1/sessions/([^/]+)/(close|pause|resume)$");

    private final HintSessionService sessionService;
    private final SessionOrchestrator orchestrator;

    public SessionController(HintSessionService sessionService) {
        this.sessionService = sessionService;
        this.orchestrator = sessionService.orchestrator();
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (method.equals(HttpMethod.GET)) {
            return COLLECTION.equals(path) || SESSION_PATTERN.matcher(path).matches();
        }
        if (method.equals(HttpMethod.POST)) {
            return COLLECTION.equals(path) || LIFECYCLE_PATTERN.matcher(path).matches();
        }
        return false;
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            if (COLLECTION.equals(path)) {
                return req.method().equals(HttpMethod.POST) ? handleCreate(req) : handleList();
            }

            Matcher sessionMatcher = SESSION_PATTERN.matcher(path);
            if (sessionMatcher.matches()) {
                return handleGet(HintResponses.parseSessionId(sessionMatcher.group(1)));
            }

            Matcher lifecycleMatcher = LIFECYCLE_PATTERN.matcher(path);
            if (lifecycleMatcher.matches()) {
                long sessionId = HintResponses.parseSessionId(lifecycleMatcher.group(1));
                return handleLifecycle(sessionId, lifecycleMatcher.group(2));
            }

            return ControllerResponse.notFound("unknown session endpoint");

        } catch (JsonProcessingException e) {
            return ControllerResponse.badRequest("invalid JSON: " + e.getOriginalMessage());
        } catch (IllegalArgumentException e) {
            return ControllerResponse.badRequest(e.getMessage());
        } catch (Exception e) {
            log.error("Session controller error", e);
            return ControllerResponse.error("internal error");
        }
    }

    /**
     * POST /api/v1/sessions - Open a session
     */
    private ControllerResponse handleCreate(FullHttpRequest req) throws Exception {
        String body = req.content().toString(StandardCharsets.UTF_8);
        CreateSessionRequest request = RouterHandler.mapper().readValue(body, CreateSessionRequest.class);

        // Validate
        request.validate();

        HintSession session = sessionService.createSession(
                request.toDescriptor(),
                request.threadIds(),
                request.targetDurationNanos());

        CreateSessionResponse response = CreateSessionResponse.from(session);
        return ControllerResponse.json(HttpResponseStatus.CREATED,
                RouterHandler.mapper().writeValueAsString(response));
    }

    /**
     * GET /api/v1/sessions - List sessions
     */
    private ControllerResponse handleList() throws Exception {
        List<SessionResponse> responses = orchestrator.dump().stream()
                .map(snapshot -> SessionResponse.from(snapshot, sessionService.find(snapshot.id()).orElse(null)))
                .toList();
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(responses));
    }

    /**
     * GET /api/v1/sessions/{id} - Session details
     */
    private ControllerResponse handleGet(long sessionId) throws Exception {
        Optional<SessionSnapshot> snapshot = orchestrator.findSession(sessionId);
        if (snapshot.isEmpty()) {
            return ControllerResponse.notFound("session not found");
        }
        SessionResponse response = SessionResponse.from(snapshot.get(),
                sessionService.find(sessionId).orElse(null));
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));
    }

    /**
     * POST /api/v1/sessions/{id}/close|pause|resume
     */
    private ControllerResponse handleLifecycle(long sessionId, String action) throws Exception {
        if ("close".equals(action)) {
            return HintResponses.of(sessionService.close(sessionId));
        }

        Optional<HintSession> session = sessionService.find(sessionId);
        if (session.isEmpty()) {
            return HintResponses.of(HintResult.NOT_FOUND);
        }
        HintResult result = "pause".equals(action) ? session.get().pause() : session.get().resume();
        return HintResponses.of(result);
    }
}
