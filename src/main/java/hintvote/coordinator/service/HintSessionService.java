package hintvote.coordinator.service;

import hintvote.coordinator.config.ControlProfile;
import hintvote.coordinator.model.HintResult;
import hintvote.coordinator.model.SessionDescriptor;
import hintvote.coordinator.model.WorkDuration;
import hintvote.coordinator.telemetry.TelemetrySink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Service layer for client sessions.
 * Tracks the live {@link HintSession} handles by id.
 */
public class HintSessionService {

    private static final Logger log = LoggerFactory.getLogger(HintSessionService.class);

    private final SessionOrchestrator orchestrator;
    private final ControlProfile profile;
    private final TelemetrySink telemetry;
    private final Map<Long, HintSession> sessions = new ConcurrentHashMap<>();

    public HintSessionService(SessionOrchestrator orchestrator, ControlProfile profile, TelemetrySink telemetry) {
        this.orchestrator = orchestrator;
        this.profile = profile;
        this.telemetry = telemetry;
    }

    /**
     * Open a session for a set of threads.
     */
    public HintSession createSession(SessionDescriptor descriptor, List<Integer> threadIds, long targetNanos) {
        if (threadIds == null || threadIds.isEmpty()) {
            throw new IllegalArgumentException("threadIds must not be empty");
        }
        if (!WorkDuration.isAcceptable(targetNanos)) {
            throw new IllegalArgumentException("targetDurationNanos must be in [0, " + WorkDuration.MAX_NANOS + "]");
        }
        HintSession session = HintSession.open(orchestrator, descriptor, threadIds, targetNanos, profile, telemetry);
        sessions.put(session.sessionId(), session);
        return session;
    }

    public Optional<HintSession> find(long sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    /**
     * Close a session and stop tracking it.
     */
    public HintResult close(long sessionId) {
        HintSession session = sessions.get(sessionId);
        if (session == null) {
            return HintResult.NOT_FOUND;
        }
        HintResult result = session.close();
        sessions.remove(sessionId, session);
        return result;
    }

    public List<HintSession> sessions() {
        List<HintSession> result = new ArrayList<>(sessions.values());
        result.sort(Comparator.comparingLong(HintSession::sessionId));
        return result;
    }

    public int count() {
        return sessions.size();
    }

    /**
     * Close every tracked session; used on shutdown.
     */
    public void closeAll() {
        for (HintSession session : sessions()) {
            close(session.sessionId());
        }
        log.info("All sessions closed");
    }

    public SessionOrchestrator orchestrator() {
        return orchestrator;
    }
}
