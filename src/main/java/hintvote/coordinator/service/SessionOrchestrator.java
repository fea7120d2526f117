package hintvote.coordinator.service;

import hintvote.coordinator.arbiter.VoteArbiter;
import hintvote.coordinator.config.CoordinatorConfig;
import hintvote.coordinator.effector.ApplyResult;
import hintvote.coordinator.effector.Effector;
import hintvote.coordinator.model.ClampRange;
import hintvote.coordinator.model.HintResult;
import hintvote.coordinator.model.SessionDescriptor;
import hintvote.coordinator.model.SessionSnapshot;
import hintvote.coordinator.model.VoteKind;
import hintvote.coordinator.model.VoteSlot;
import hintvote.coordinator.registry.MembershipDelta;
import hintvote.coordinator.registry.SessionEntry;
import hintvote.coordinator.registry.SessionRegistry;
import hintvote.coordinator.scheduler.DeadlineScheduler;
import hintvote.coordinator.scheduler.DeadlineTimer;
import hintvote.coordinator.telemetry.TelemetrySink;
import hintvote.coordinator.util.MonotonicClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.OptionalLong;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Owns the session registry and the vote-expiry timer, and is the only
 * component that talks to the {@link Effector}.
 *
 * <p>
 * Registry state is mutated under the registry monitor; the monitor is
 * released before any effector call or timer scheduling. As a result a closing
 * session's constraint can stay visible on a thread for a moment after the
 * registry dropped it.
 *
 * <p>
 * Vote timeouts are never cancelled. When a timer fires it re-reads the slot:
 * if the vote was extended the timer is re-queued at the new deadline,
 * otherwise the vote is muted and its session's threads are recomputed.
 */
public class SessionOrchestrator implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SessionOrchestrator.class);

    /** Slots muted whenever a session reports fresh durations */
    private static final Set<VoteSlot> BOOST_SLOTS = EnumSet.of(
            VoteSlot.CPU_LOAD_UP,
            VoteSlot.CPU_LOAD_RESET,
            VoteSlot.CPU_LOAD_RESUME,
            VoteSlot.POWER_EFFICIENCY,
            VoteSlot.GPU_LOAD_UP,
            VoteSlot.GPU_LOAD_RESET);

    private final SessionRegistry registry;
    private final Effector effector;
    private final TelemetrySink telemetry;
    private final MonotonicClock clock;
    private final DeadlineTimer<VoteTimeout> timeouts;
    private final int appUidStart;
    private final boolean uclampMinOn;
    private final AtomicLong nextSessionId = new AtomicLong();

    public SessionOrchestrator(SessionRegistry registry,
            DeadlineScheduler scheduler,
            Effector effector,
            TelemetrySink telemetry,
            MonotonicClock clock,
            CoordinatorConfig config) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.effector = Objects.requireNonNull(effector, "effector");
        this.telemetry = Objects.requireNonNull(telemetry, "telemetry");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.appUidStart = config.appUidStart();
        this.uclampMinOn = config.controlProfile().uclampMinOn();
        this.timeouts = new DeadlineTimer<>(scheduler, this::onVoteExpiry);
    }

    // ==================== Session lifecycle ====================

    /**
     * Register a session. Its default vote starts muted at the full range.
     *
     * @return the new session id
     */
    public long createSession(SessionDescriptor descriptor, Collection<Integer> members, long targetNanos) {
        long now = clock.nowNanos();
        long id = nextSessionId.incrementAndGet();

        VoteArbiter arbiter = new VoteArbiter();
        arbiter.cast(VoteSlot.CPU_DEFAULT, false, ClampRange.MIN, ClampRange.MAX, now, targetNanos);

        SessionEntry entry = new SessionEntry(id, descriptor, descriptor.uid() >= appUidStart, arbiter);
        entry.setLastUpdatedNanos(now);
        registry.add(entry, List.of());
        setMembers(id, members);

        log.info("Session {} created with {} thread(s)", entry.idString(), members.size());
        return id;
    }

    /**
     * Release a session's constraint and forget it. The registry entry is
     * removed before the effector is touched, so a timer still queued for this
     * session finds nothing and does nothing.
     */
    public HintResult closeSession(long sessionId) {
        Optional<Boolean> marked = registry.withSession(sessionId, entry -> {
            entry.setActive(false);
            return Boolean.TRUE;
        });
        if (marked.isEmpty()) {
            log.debug("close: session {} not found", sessionId);
            return HintResult.NOT_FOUND;
        }

        List<Integer> former = registry.membersOf(sessionId);
        MembershipDelta delta = registry.replace(sessionId, List.of())
                .orElse(new MembershipDelta(List.of(), List.of()));
        registry.remove(sessionId);

        for (Integer resource : former) {
            applyEnvelope(resource);
        }
        for (Integer resource : delta.removed()) {
            effector.resetResource(resource);
        }
        applyCapacity();
        updateSystemBoost();

        log.info("Session {} closed", sessionId);
        return HintResult.OK;
    }

    /**
     * Replace a session's threads. Threads that lost their last owner are
     * reset; threads that gained their first owner are attached; every
     * affected thread is recomputed.
     */
    public HintResult setMembers(long sessionId, Collection<Integer> members) {
        List<Integer> previous = registry.membersOf(sessionId);
        Optional<MembershipDelta> replaced = registry.replace(sessionId, members);
        if (replaced.isEmpty()) {
            log.debug("setMembers: session {} not found", sessionId);
            return HintResult.NOT_FOUND;
        }
        MembershipDelta delta = replaced.get();

        for (Integer resource : delta.added()) {
            effector.attachResource(resource);
        }

        Set<Integer> affected = new LinkedHashSet<>(previous);
        affected.addAll(members);
        for (Integer resource : affected) {
            applyEnvelope(resource);
        }
        for (Integer resource : delta.removed()) {
            effector.resetResource(resource);
        }
        return HintResult.OK;
    }

    public HintResult pause(long sessionId) {
        return setSessionActive(sessionId, false);
    }

    public HintResult resume(long sessionId) {
        return setSessionActive(sessionId, true);
    }

    private HintResult setSessionActive(long sessionId, boolean active) {
        Optional<Boolean> changed = registry.withSession(sessionId, entry -> {
            if (entry.active() == active) {
                return Boolean.FALSE;
            }
            entry.setActive(active);
            return Boolean.TRUE;
        });
        if (changed.isEmpty()) {
            log.warn("{}: session {} not found", active ? "resume" : "pause", sessionId);
            return HintResult.NOT_FOUND;
        }
        if (!changed.get()) {
            log.warn("Session {} is already {}", sessionId, active ? "active" : "paused");
            return HintResult.ILLEGAL_STATE;
        }

        applySession(sessionId);
        applyCapacity();
        updateSystemBoost();
        return HintResult.OK;
    }

    // ==================== Votes ====================

    /**
     * Cast a range vote and recompute the session's threads. A timeout is
     * queued when the slot was not active, or when the new window ends earlier
     * than the one already queued; a later end is picked up when the earlier
     * timer fires.
     */
    public HintResult castVote(long sessionId, VoteSlot slot, int lower, int upper, long startNanos,
            long durationNanos) {
        if (!slot.accepts(VoteKind.RANGE)) {
            log.debug("castVote: slot {} does not take range votes", slot);
            return HintResult.ILLEGAL_ARGUMENT;
        }
        Optional<CastOutcome> outcome = registry.withSession(sessionId, entry -> {
            VoteArbiter arbiter = entry.arbiter();
            boolean wasActive = arbiter.isActive(slot);
            long previousExpiry = arbiter.expiryOf(slot);
            arbiter.cast(slot, lower, upper, startNanos, durationNanos);
            entry.setLastUpdatedNanos(startNanos);
            long expiry = arbiter.expiryOf(slot);
            return new CastOutcome(!wasActive || expiry < previousExpiry, expiry);
        });
        if (outcome.isEmpty()) {
            log.debug("castVote: session {} not found", sessionId);
            return HintResult.NOT_FOUND;
        }

        applySession(sessionId);
        scheduleIfNeeded(sessionId, slot, outcome.get());
        return HintResult.OK;
    }

    /**
     * Cast a capacity vote and re-apply the system-wide capacity.
     */
    public HintResult castCapacity(long sessionId, VoteSlot slot, int magnitude, long startNanos,
            long durationNanos) {
        if (!slot.accepts(VoteKind.CAPACITY)) {
            log.debug("castCapacity: slot {} does not take capacity votes", slot);
            return HintResult.ILLEGAL_ARGUMENT;
        }
        Optional<CastOutcome> outcome = registry.withSession(sessionId, entry -> {
            VoteArbiter arbiter = entry.arbiter();
            boolean wasActive = arbiter.isActive(slot);
            long previousExpiry = arbiter.expiryOf(slot);
            arbiter.castCapacity(slot, magnitude, startNanos, durationNanos);
            entry.setLastUpdatedNanos(startNanos);
            long expiry = arbiter.expiryOf(slot);
            return new CastOutcome(!wasActive || expiry < previousExpiry, expiry);
        });
        if (outcome.isEmpty()) {
            log.debug("castCapacity: session {} not found", sessionId);
            return HintResult.NOT_FOUND;
        }

        applyCapacity();
        scheduleIfNeeded(sessionId, slot, outcome.get());
        return HintResult.OK;
    }

    /**
     * Change a slot's duration without recomputing. A shorter window gets its
     * own timer so it does not outlive the one already queued.
     */
    public HintResult updateVoteDuration(long sessionId, VoteSlot slot, long durationNanos) {
        Optional<CastOutcome> outcome = registry.withSession(sessionId, entry -> {
            VoteArbiter arbiter = entry.arbiter();
            long previousExpiry = arbiter.expiryOf(slot);
            arbiter.extendDuration(slot, durationNanos);
            long expiry = arbiter.expiryOf(slot);
            return new CastOutcome(arbiter.isActive(slot) && expiry < previousExpiry, expiry);
        });
        if (outcome.isEmpty()) {
            log.debug("updateVoteDuration: session {} not found", sessionId);
            return HintResult.NOT_FOUND;
        }
        scheduleIfNeeded(sessionId, slot, outcome.get());
        return HintResult.OK;
    }

    /**
     * Mute every boost slot of a session, keeping the recorded bounds.
     */
    public HintResult disableBoosts(long sessionId) {
        Optional<Boolean> done = registry.withSession(sessionId, entry -> {
            for (VoteSlot slot : BOOST_SLOTS) {
                entry.arbiter().setActive(slot, false);
            }
            return Boolean.TRUE;
        });
        return done.isPresent() ? HintResult.OK : HintResult.NOT_FOUND;
    }

    public HintResult setPowerEfficient(long sessionId, boolean enabled) {
        Optional<Boolean> done = registry.withSession(sessionId, entry -> {
            entry.setPowerEfficient(enabled);
            return Boolean.TRUE;
        });
        return done.isPresent() ? HintResult.OK : HintResult.NOT_FOUND;
    }

    /**
     * Timer callback for a vote's window end.
     *
     * @return the new window end when the vote was extended since it was queued
     */
    OptionalLong onVoteExpiry(VoteTimeout timeout, long firedDeadlineNanos) {
        long now = clock.nowNanos();
        Optional<ExpiryDecision> decision = registry.withSession(timeout.sessionId(), entry -> {
            VoteArbiter arbiter = entry.arbiter();
            if (!arbiter.isActive(timeout.slot())) {
                return ExpiryDecision.NONE;
            }
            long expiry = arbiter.expiryOf(timeout.slot());
            if (expiry <= now) {
                arbiter.setActive(timeout.slot(), false);
                return ExpiryDecision.RECOMPUTE;
            }
            return new ExpiryDecision(false, OptionalLong.of(expiry));
        });
        if (decision.isEmpty()) {
            log.debug("Timeout for unknown session {} ({})", timeout.sessionId(), timeout.slot());
            return OptionalLong.empty();
        }

        ExpiryDecision d = decision.get();
        if (d.recompute()) {
            log.debug("Vote {} of session {} expired (queued for {})",
                    timeout.slot(), timeout.sessionId(), firedDeadlineNanos);
            if (timeout.slot().kind() == VoteKind.CAPACITY) {
                applyCapacity();
            } else {
                applySession(timeout.sessionId());
            }
            updateSystemBoost();
        }
        return d.reschedule();
    }

    // ==================== Applying ====================

    /**
     * Compute and apply one thread's envelope. A thread the effector no longer
     * finds is pruned from every owning session; the sessions stay valid. Any
     * other failure leaves membership alone so the next recompute retries.
     */
    public ApplyResult applyEnvelope(int resourceId) {
        long now = clock.nowNanos();
        ClampRange range = registry.envelopeFor(resourceId, now);
        int lower = uclampMinOn ? range.lower() : ClampRange.MIN;

        ApplyResult result = effector.applyEnvelope(resourceId, lower, range.upper());
        switch (result) {
            case OK -> telemetry.sample("tid-" + resourceId, "envelope.lower", lower);
            case NOT_FOUND -> {
                List<Long> pruned = registry.pruneDeadResource(resourceId);
                log.debug("Thread {} is gone, pruned from sessions {}", resourceId, pruned);
            }
            case ERROR -> log.warn("Failed to apply envelope [{}, {}] to thread {}", lower, range.upper(), resourceId);
        }
        return result;
    }

    /**
     * Apply the largest capacity request across active sessions, or 0 when none is in range.
     */
    public ApplyResult applyCapacity() {
        OptionalInt capacity = registry.capacity(clock.nowNanos());
        ApplyResult result = effector.applyCapacity(capacity.orElse(0));
        if (result != ApplyResult.OK) {
            log.warn("Failed to apply capacity {}: {}", capacity.orElse(0), result);
        }
        return result;
    }

    /**
     * The system-wide boost is on while no app session is active with a vote in range.
     */
    public void updateSystemBoost() {
        boolean anyAppActive = registry.isAnyAppSessionActive(clock.nowNanos());
        effector.setSystemBoost(!anyAppActive);
    }

    private void applySession(long sessionId) {
        for (Integer resource : registry.membersOf(sessionId)) {
            applyEnvelope(resource);
        }
    }

    private void scheduleIfNeeded(long sessionId, VoteSlot slot, CastOutcome outcome) {
        if (outcome.schedule()) {
            timeouts.schedule(new VoteTimeout(sessionId, slot), outcome.expiryNanos());
        }
    }

    // ==================== Read views ====================

    public Optional<SessionSnapshot> findSession(long sessionId) {
        return registry.findSession(sessionId, clock.nowNanos());
    }

    public List<SessionSnapshot> dump() {
        return registry.snapshot(clock.nowNanos());
    }

    public ClampRange envelopeOf(int resourceId) {
        return registry.envelopeFor(resourceId, clock.nowNanos());
    }

    public List<Long> ownersOf(int resourceId) {
        return registry.ownersOf(resourceId);
    }

    public SessionRegistry registry() {
        return registry;
    }

    public MonotonicClock clock() {
        return clock;
    }

    public int pendingTimeouts() {
        return timeouts.pending();
    }

    @Override
    public void close() {
        timeouts.close();
    }

    private record CastOutcome(boolean schedule, long expiryNanos) {
    }

    private record ExpiryDecision(boolean recompute, OptionalLong reschedule) {
        static final ExpiryDecision NONE = new ExpiryDecision(false, OptionalLong.empty());
        static final ExpiryDecision RECOMPUTE = new ExpiryDecision(true, OptionalLong.empty());
    }
}
