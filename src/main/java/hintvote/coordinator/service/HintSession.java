package hintvote.coordinator.service;

import hintvote.coordinator.config.ControlProfile;
import hintvote.coordinator.control.DurationController;
import hintvote.coordinator.control.PidTerms;
import hintvote.coordinator.model.ClampRange;
import hintvote.coordinator.model.HintResult;
import hintvote.coordinator.model.SessionDescriptor;
import hintvote.coordinator.model.SessionHint;
import hintvote.coordinator.model.SessionMode;
import hintvote.coordinator.model.VoteSlot;
import hintvote.coordinator.model.WorkDuration;
import hintvote.coordinator.telemetry.TelemetrySink;
import hintvote.coordinator.util.MonotonicClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Client-facing handle for one session.
 *
 * <p>
 * Holds the state the registry does not: the target duration, the current
 * control value and the PID loop. Every operation is serialized on this
 * object and then calls into the {@link SessionOrchestrator}; the orchestrator
 * never calls back, so the lock order is always session first, registry second.
 */
public class HintSession {

    private static final Logger log = LoggerFactory.getLogger(HintSession.class);

    private final long sessionId;
    private final String idString;
    private final SessionOrchestrator orchestrator;
    private final ControlProfile profile;
    private final DurationController controller;
    private final TelemetrySink telemetry;
    private final MonotonicClock clock;

    private boolean closed;
    private boolean active = true;
    private long targetNanos;
    private int controlValue;
    private long lastUpdatedNanos;
    private long updateCount;
    private List<Integer> threads;

    private HintSession(long sessionId, SessionDescriptor descriptor, List<Integer> threads, long targetNanos,
            SessionOrchestrator orchestrator, ControlProfile profile, TelemetrySink telemetry) {
        this.sessionId = sessionId;
        this.idString = descriptor.idString(sessionId);
        this.threads = List.copyOf(threads);
        this.targetNanos = targetNanos;
        this.orchestrator = orchestrator;
        this.profile = profile;
        this.controller = new DurationController(profile);
        this.telemetry = telemetry;
        this.clock = orchestrator.clock();
        this.controlValue = profile.uclampMinInit();
        this.lastUpdatedNanos = clock.nowNanos();
    }

    /**
     * Register a session and cast its start-up votes: a short load-reset boost
     * and the initial control value.
     */
    public static HintSession open(SessionOrchestrator orchestrator, SessionDescriptor descriptor,
            List<Integer> threads, long targetNanos, ControlProfile profile, TelemetrySink telemetry) {
        Objects.requireNonNull(orchestrator, "orchestrator");
        Objects.requireNonNull(profile, "profile");
        long id = orchestrator.createSession(descriptor, threads, targetNanos);
        HintSession session = new HintSession(id, descriptor, threads, targetNanos, orchestrator, profile,
                telemetry == null ? TelemetrySink.NONE : telemetry);
        session.castStartupVotes();
        return session;
    }

    private synchronized void castStartupVotes() {
        long now = clock.nowNanos();
        orchestrator.castVote(sessionId, VoteSlot.CPU_LOAD_RESET, profile.loadReset(), ClampRange.MAX,
                now, halfStaleNanos());
        orchestrator.castVote(sessionId, VoteSlot.CPU_DEFAULT, profile.uclampMinInit(), ClampRange.MAX,
                now, targetNanos);
    }

    public synchronized HintResult close() {
        if (closed) {
            log.warn("Session {} already closed", idString);
            return HintResult.ILLEGAL_STATE;
        }
        closed = true;
        orchestrator.closeSession(sessionId);
        return HintResult.OK;
    }

    public synchronized HintResult pause() {
        if (closed) {
            log.warn("pause: session {} is closed", idString);
            return HintResult.ILLEGAL_STATE;
        }
        if (!active) {
            return HintResult.ILLEGAL_STATE;
        }
        HintResult result = orchestrator.pause(sessionId);
        if (result == HintResult.OK) {
            active = false;
        }
        return result;
    }

    public synchronized HintResult resume() {
        if (closed) {
            log.warn("resume: session {} is closed", idString);
            return HintResult.ILLEGAL_STATE;
        }
        if (active) {
            return HintResult.ILLEGAL_STATE;
        }
        HintResult result = orchestrator.resume(sessionId);
        if (result == HintResult.OK) {
            active = true;
        }
        return result;
    }

    /**
     * Change the target duration. The value is scaled by the profile's target time factor.
     */
    public synchronized HintResult updateTargetWorkDuration(long targetDurationNanos) {
        if (closed) {
            return HintResult.ILLEGAL_STATE;
        }
        if (targetDurationNanos <= 0 || targetDurationNanos > WorkDuration.MAX_NANOS) {
            log.warn("Session {}: target duration must be in (0, {}], got {}", idString, WorkDuration.MAX_NANOS,
                    targetDurationNanos);
            return HintResult.ILLEGAL_ARGUMENT;
        }
        targetNanos = (long) (targetDurationNanos * profile.targetTimeFactor());
        telemetry.sample(idString, "target", targetNanos);
        return orchestrator.updateVoteDuration(sessionId, VoteSlot.CPU_DEFAULT, targetNanos);
    }

    /**
     * Feed a batch of measured durations through the control loop and cast the result.
     */
    public synchronized HintResult reportActualWorkDurations(List<WorkDuration> durations) {
        if (closed) {
            log.warn("report: session {} is closed", idString);
            return HintResult.ILLEGAL_STATE;
        }
        if (targetNanos == 0) {
            log.warn("report: session {} has no target duration yet", idString);
            return HintResult.ILLEGAL_STATE;
        }
        if (durations == null || durations.isEmpty()) {
            return HintResult.ILLEGAL_ARGUMENT;
        }
        for (WorkDuration duration : durations) {
            if (!WorkDuration.isAcceptable(duration.durationNanos())) {
                log.warn("report: session {} got out-of-range duration {}ns", idString, duration.durationNanos());
                return HintResult.ILLEGAL_ARGUMENT;
            }
        }
        if (!active) {
            log.warn("report: session {} is paused", idString);
            return HintResult.ILLEGAL_STATE;
        }

        updateCount++;
        long now = clock.nowNanos();
        boolean firstFrame = isStale(now);
        lastUpdatedNanos = now;
        telemetry.sample(idString, "batch_size", durations.size());
        telemetry.sample(idString, "actual_last", durations.get(durations.size() - 1).durationNanos());
        if (firstFrame) {
            orchestrator.updateSystemBoost();
        }

        orchestrator.disableBoosts(sessionId);

        int next = controller.update(durations, targetNanos, controlValue);
        PidTerms terms = controller.lastTerms();
        telemetry.sample(idString, "pid.err", terms.errorSum());
        telemetry.sample(idString, "pid.pOut", terms.pOut());
        telemetry.sample(idString, "pid.iOut", terms.iOut());
        telemetry.sample(idString, "pid.dOut", terms.dOut());
        telemetry.sample(idString, "pid.integral", controller.integralError());

        updateControlValue(next, true);
        return HintResult.OK;
    }

    public synchronized HintResult sendHint(SessionHint hint) {
        if (closed) {
            return HintResult.ILLEGAL_STATE;
        }
        if (targetNanos == 0) {
            log.warn("hint: session {} has no target duration yet", idString);
            return HintResult.ILLEGAL_STATE;
        }
        long now = clock.nowNanos();
        switch (hint) {
            case CPU_LOAD_UP -> {
                updateControlValue(controlValue, true);
                orchestrator.castVote(sessionId, VoteSlot.CPU_LOAD_UP, profile.loadUp(), ClampRange.MAX,
                        now, saturatedMultiply(targetNanos, 2));
            }
            case CPU_LOAD_DOWN -> updateControlValue(profile.uclampMinLow(), true);
            case CPU_LOAD_RESET -> {
                updateControlValue(Math.max(profile.uclampMinInit(), controlValue), false);
                orchestrator.castVote(sessionId, VoteSlot.CPU_LOAD_RESET, profile.loadReset(), ClampRange.MAX,
                        now, halfStaleNanos());
            }
            case CPU_LOAD_RESUME -> orchestrator.castVote(sessionId, VoteSlot.CPU_LOAD_RESUME, controlValue,
                    ClampRange.MAX, now, halfStaleNanos());
            // TODO: map GPU load hints onto GPU_CAPACITY votes once a capacity model exists
            case GPU_LOAD_UP, GPU_LOAD_DOWN, GPU_LOAD_RESET -> log.debug("Session {}: {} accepted", idString, hint);
        }
        telemetry.sample(idString, "hint." + hint.name().toLowerCase(), 1);
        lastUpdatedNanos = now;
        return HintResult.OK;
    }

    public synchronized HintResult setMode(SessionMode mode, boolean enabled) {
        if (closed) {
            return HintResult.ILLEGAL_STATE;
        }
        HintResult result = switch (mode) {
            case POWER_EFFICIENCY -> orchestrator.setPowerEfficient(sessionId, enabled);
        };
        if (result == HintResult.OK) {
            lastUpdatedNanos = clock.nowNanos();
        }
        return result;
    }

    /**
     * Replace the session's threads and restart from the initial control value.
     */
    public synchronized HintResult setThreads(List<Integer> threadIds) {
        if (closed) {
            return HintResult.ILLEGAL_STATE;
        }
        if (threadIds == null || threadIds.isEmpty()) {
            log.warn("Session {}: thread list must not be empty", idString);
            return HintResult.ILLEGAL_ARGUMENT;
        }
        threads = List.copyOf(threadIds);
        HintResult result = orchestrator.setMembers(sessionId, threads);
        if (result == HintResult.OK) {
            updateControlValue(profile.uclampMinInit(), true);
        }
        return result;
    }

    /**
     * Cast an arbitrary vote on behalf of the client, starting now.
     */
    public synchronized HintResult castVote(VoteSlot slot, int lower, int upper, int magnitude, long durationNanos) {
        if (closed) {
            return HintResult.ILLEGAL_STATE;
        }
        if (durationNanos < 0) {
            return HintResult.ILLEGAL_ARGUMENT;
        }
        long now = clock.nowNanos();
        return switch (slot.kind()) {
            case RANGE -> orchestrator.castVote(sessionId, slot, lower, upper, now, durationNanos);
            case CAPACITY -> orchestrator.castCapacity(sessionId, slot, magnitude, now, durationNanos);
        };
    }

    /**
     * True when nothing was reported for target times the stale factor.
     */
    public synchronized boolean isStale(long nowNanos) {
        return nowNanos - lastUpdatedNanos >= staleNanos();
    }

    private void updateControlValue(int value, boolean castVote) {
        controlValue = value;
        telemetry.sample(idString, "control", value);
        if (castVote) {
            long duration = Math.max(staleNanos(), saturatedMultiply(profile.reportingRateLimitNanos(), 2));
            orchestrator.castVote(sessionId, VoteSlot.CPU_DEFAULT, value, ClampRange.MAX, clock.nowNanos(), duration);
        }
    }

    private long staleNanos() {
        return (long) (targetNanos * profile.staleTimeFactor());
    }

    private long halfStaleNanos() {
        return (long) (targetNanos * profile.staleTimeFactor() / 2);
    }

    private static long saturatedMultiply(long value, long factor) {
        try {
            return Math.multiplyExact(value, factor);
        } catch (ArithmeticException e) {
            return value < 0 ? Long.MIN_VALUE : Long.MAX_VALUE;
        }
    }

    // Getters
    public long sessionId() {
        return sessionId;
    }

    public String idString() {
        return idString;
    }

    public synchronized long targetNanos() {
        return targetNanos;
    }

    public synchronized int controlValue() {
        return controlValue;
    }

    public synchronized boolean isActive() {
        return active;
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    public synchronized long updateCount() {
        return updateCount;
    }

    public synchronized List<Integer> threads() {
        return threads;
    }

    public synchronized boolean heuristicBoostActive() {
        return controller.heuristicBoostActive();
    }

    DurationController controller() {
        return controller;
    }
}
