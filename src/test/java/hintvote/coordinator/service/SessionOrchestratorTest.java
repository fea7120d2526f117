package hintvote.coordinator.service;

import hintvote.coordinator.config.ControlProfile;
import hintvote.coordinator.config.CoordinatorConfig;
import hintvote.coordinator.model.ClampRange;
import hintvote.coordinator.model.HintResult;
import hintvote.coordinator.model.SessionDescriptor;
import hintvote.coordinator.model.SessionSnapshot;
import hintvote.coordinator.model.SessionTag;
import hintvote.coordinator.model.VoteSlot;
import hintvote.coordinator.model.VoteSnapshot;
import hintvote.coordinator.registry.SessionRegistry;
import hintvote.coordinator.scheduler.DeadlineScheduler;
import hintvote.coordinator.support.ManualClock;
import hintvote.coordinator.support.RecordingEffector;
import hintvote.coordinator.telemetry.TelemetrySink;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.OptionalLong;

import static org.junit.jupiter.api.Assertions.*;

/**
 * The scheduler is never started here: timeouts stay queued and expiry is
 * driven by calling the timer callback directly.
 */
class SessionOrchestratorTest {

    private static final long MS = 1_000_000L;
    private static final SessionDescriptor SYSTEM = new SessionDescriptor(500, 1_000, SessionTag.SURFACEFLINGER);
    private static final SessionDescriptor APP = new SessionDescriptor(600, 10_001, SessionTag.APP);

    private ManualClock clock;
    private RecordingEffector effector;
    private DeadlineScheduler scheduler;
    private SessionOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        clock = new ManualClock();
        effector = new RecordingEffector();
        scheduler = new DeadlineScheduler(1, "test-expiry", clock);
        orchestrator = newOrchestrator(CoordinatorConfig.defaults());
    }

    @AfterEach
    void tearDown() {
        orchestrator.close();
        scheduler.stop();
    }

    private SessionOrchestrator newOrchestrator(CoordinatorConfig config) {
        return new SessionOrchestrator(new SessionRegistry(), scheduler, effector, TelemetrySink.NONE, clock, config);
    }

    private VoteSnapshot vote(long sessionId, VoteSlot slot) {
        SessionSnapshot snapshot = orchestrator.findSession(sessionId).orElseThrow();
        return snapshot.votes().stream()
                .filter(v -> v.slot() == slot)
                .findFirst()
                .orElseThrow();
    }

    @Test
    void createAttachesThreadsUnconstrained() {
        long id = orchestrator.createSession(SYSTEM, List.of(10, 20), 16 * MS);

        assertEquals(List.of(10, 20), effector.attached());
        assertEquals(ClampRange.FULL, effector.envelope(10));
        assertEquals(ClampRange.FULL, effector.envelope(20));
        assertFalse(vote(id, VoteSlot.CPU_DEFAULT).active());
        assertEquals(0, orchestrator.pendingTimeouts());
    }

    @Test
    void sessionIdsAreUnique() {
        long first = orchestrator.createSession(SYSTEM, List.of(10), 16 * MS);
        long second = orchestrator.createSession(SYSTEM, List.of(10), 16 * MS);

        assertNotEquals(first, second);
        assertEquals(List.of(10), effector.attached());
    }

    @Test
    void castVoteAppliesToEveryMember() {
        long id = orchestrator.createSession(SYSTEM, List.of(10, 20), 16 * MS);

        assertEquals(HintResult.OK, orchestrator.castVote(id, VoteSlot.CPU_DEFAULT, 300, 1024, 0, 100 * MS));

        assertEquals(new ClampRange(300, 1024), effector.envelope(10));
        assertEquals(new ClampRange(300, 1024), effector.envelope(20));
        assertEquals(1, orchestrator.pendingTimeouts());
    }

    @Test
    void floorIsDroppedWhenMinClampIsOff() {
        orchestrator.close();
        orchestrator = newOrchestrator(CoordinatorConfig.defaults()
                .withControlProfile(ControlProfile.builder().uclampMinOn(false).build()));
        long id = orchestrator.createSession(SYSTEM, List.of(10), 16 * MS);

        orchestrator.castVote(id, VoteSlot.CPU_DEFAULT, 300, 800, 0, 100 * MS);

        assertEquals(new ClampRange(0, 800), effector.envelope(10));
    }

    @Test
    void sharedThreadTakesNarrowestEnvelope() {
        long first = orchestrator.createSession(SYSTEM, List.of(10), 16 * MS);
        long second = orchestrator.createSession(SYSTEM, List.of(10, 20), 16 * MS);
        orchestrator.castVote(first, VoteSlot.CPU_DEFAULT, 300, 1024, 0, 100 * MS);
        orchestrator.castVote(second, VoteSlot.CPU_DEFAULT, 500, 1024, 0, 100 * MS);

        assertEquals(500, effector.envelope(10).lower());

        assertEquals(HintResult.OK, orchestrator.closeSession(second));

        assertEquals(300, effector.envelope(10).lower());
        assertEquals(List.of(20), effector.reset());
        assertEquals(List.of(first), orchestrator.ownersOf(10));
    }

    @Test
    void vanishedThreadIsPrunedFromItsSessions() {
        long first = orchestrator.createSession(SYSTEM, List.of(10, 20), 16 * MS);
        long second = orchestrator.createSession(SYSTEM, List.of(20), 16 * MS);
        effector.markGone(20);

        assertEquals(HintResult.OK, orchestrator.castVote(first, VoteSlot.CPU_DEFAULT, 300, 1024, 0, 100 * MS));

        assertTrue(orchestrator.ownersOf(20).isEmpty());
        assertEquals(List.of(10), orchestrator.findSession(first).orElseThrow().members());
        assertTrue(orchestrator.findSession(second).orElseThrow().members().isEmpty());
        assertEquals(300, effector.envelope(10).lower());
    }

    @Test
    void failedApplyKeepsThreadForTheNextRecompute() {
        long first = orchestrator.createSession(SYSTEM, List.of(10, 20), 16 * MS);
        long second = orchestrator.createSession(SYSTEM, List.of(20), 16 * MS);
        effector.setFailing(20, true);

        assertEquals(HintResult.OK, orchestrator.castVote(first, VoteSlot.CPU_DEFAULT, 300, 1024, 0, 100 * MS));

        assertEquals(List.of(first, second), orchestrator.ownersOf(20).stream().sorted().toList());
        assertEquals(List.of(10, 20), orchestrator.findSession(first).orElseThrow().members());

        effector.setFailing(20, false);
        orchestrator.castVote(second, VoteSlot.CPU_DEFAULT, 400, 1024, 0, 100 * MS);

        assertEquals(400, effector.envelope(20).lower());
    }

    @Test
    void expiryMutesVoteAndRecomputes() {
        long id = orchestrator.createSession(SYSTEM, List.of(10), 16 * MS);
        orchestrator.castVote(id, VoteSlot.CPU_DEFAULT, 300, 1024, 0, 100 * MS);

        clock.set(150 * MS);
        OptionalLong next = orchestrator.onVoteExpiry(new VoteTimeout(id, VoteSlot.CPU_DEFAULT), 100 * MS);

        assertTrue(next.isEmpty());
        assertFalse(vote(id, VoteSlot.CPU_DEFAULT).active());
        assertEquals(ClampRange.FULL, effector.envelope(10));
        assertEquals(Boolean.TRUE, effector.lastBoost());
    }

    @Test
    void extendedVoteIsRequeuedAtItsNewEnd() {
        long id = orchestrator.createSession(SYSTEM, List.of(10), 16 * MS);
        orchestrator.castVote(id, VoteSlot.CPU_DEFAULT, 300, 1024, 0, 100 * MS);
        orchestrator.castVote(id, VoteSlot.CPU_DEFAULT, 300, 1024, 0, 500 * MS);
        assertEquals(1, orchestrator.pendingTimeouts());

        clock.set(150 * MS);
        OptionalLong next = orchestrator.onVoteExpiry(new VoteTimeout(id, VoteSlot.CPU_DEFAULT), 100 * MS);

        assertEquals(OptionalLong.of(500 * MS), next);
        assertTrue(vote(id, VoteSlot.CPU_DEFAULT).active());
        assertEquals(300, effector.envelope(10).lower());
    }

    @Test
    void shorterWindowGetsItsOwnTimeout() {
        long id = orchestrator.createSession(SYSTEM, List.of(10), 16 * MS);
        orchestrator.castVote(id, VoteSlot.CPU_LOAD_UP, 480, 1024, 0, 500 * MS);
        orchestrator.castVote(id, VoteSlot.CPU_LOAD_UP, 480, 1024, 0, 100 * MS);
        assertEquals(2, orchestrator.pendingTimeouts());

        orchestrator.updateVoteDuration(id, VoteSlot.CPU_LOAD_UP, 50 * MS);
        assertEquals(3, orchestrator.pendingTimeouts());

        orchestrator.updateVoteDuration(id, VoteSlot.CPU_LOAD_UP, 400 * MS);
        assertEquals(3, orchestrator.pendingTimeouts());
        assertEquals(HintResult.NOT_FOUND, orchestrator.updateVoteDuration(99, VoteSlot.CPU_LOAD_UP, MS));
    }

    @Test
    void expiryAfterCloseDoesNothing() {
        long id = orchestrator.createSession(SYSTEM, List.of(10), 16 * MS);
        orchestrator.castVote(id, VoteSlot.CPU_DEFAULT, 300, 1024, 0, 100 * MS);
        orchestrator.closeSession(id);
        int calls = effector.envelopeCalls();

        clock.set(150 * MS);
        assertTrue(orchestrator.onVoteExpiry(new VoteTimeout(id, VoteSlot.CPU_DEFAULT), 100 * MS).isEmpty());
        assertEquals(calls, effector.envelopeCalls());
    }

    @Test
    void pauseAndResumeToggleSessionAndSystemBoost() {
        long id = orchestrator.createSession(APP, List.of(10), 16 * MS);
        orchestrator.castVote(id, VoteSlot.CPU_DEFAULT, 300, 1024, 0, 1_000 * MS);

        assertEquals(HintResult.OK, orchestrator.pause(id));
        assertEquals(ClampRange.FULL, effector.envelope(10));
        assertEquals(Boolean.TRUE, effector.lastBoost());
        assertEquals(HintResult.ILLEGAL_STATE, orchestrator.pause(id));
        assertEquals(List.of(10), orchestrator.findSession(id).orElseThrow().members());

        assertEquals(HintResult.OK, orchestrator.resume(id));
        assertEquals(300, effector.envelope(10).lower());
        assertEquals(Boolean.FALSE, effector.lastBoost());
        assertEquals(HintResult.ILLEGAL_STATE, orchestrator.resume(id));

        assertEquals(HintResult.NOT_FOUND, orchestrator.pause(99));
        assertEquals(HintResult.NOT_FOUND, orchestrator.resume(99));
    }

    @Test
    void capacityVotesFollowTheirWindow() {
        long id = orchestrator.createSession(SYSTEM, List.of(10), 16 * MS);

        assertEquals(HintResult.OK, orchestrator.castCapacity(id, VoteSlot.GPU_CAPACITY, 300, 0, 100 * MS));
        assertEquals(300, effector.lastCapacity());

        clock.set(200 * MS);
        orchestrator.onVoteExpiry(new VoteTimeout(id, VoteSlot.GPU_CAPACITY), 100 * MS);
        assertEquals(0, effector.lastCapacity());
    }

    @Test
    void wrongKindIsRejected() {
        long id = orchestrator.createSession(SYSTEM, List.of(10), 16 * MS);

        assertEquals(HintResult.ILLEGAL_ARGUMENT,
                orchestrator.castVote(id, VoteSlot.GPU_CAPACITY, 0, 100, 0, MS));
        assertEquals(HintResult.ILLEGAL_ARGUMENT,
                orchestrator.castCapacity(id, VoteSlot.CPU_DEFAULT, 100, 0, MS));
        assertEquals(HintResult.NOT_FOUND,
                orchestrator.castVote(99, VoteSlot.CPU_DEFAULT, 0, 100, 0, MS));
    }

    @Test
    void setMembersAttachesAndResets() {
        long id = orchestrator.createSession(SYSTEM, List.of(10, 20), 16 * MS);
        orchestrator.castVote(id, VoteSlot.CPU_DEFAULT, 300, 1024, 0, 100 * MS);

        assertEquals(HintResult.OK, orchestrator.setMembers(id, List.of(20, 30)));

        assertTrue(effector.attached().contains(30));
        assertEquals(List.of(10), effector.reset());
        assertEquals(300, effector.envelope(30).lower());
        assertNull(effector.envelope(10));
        assertEquals(HintResult.NOT_FOUND, orchestrator.setMembers(99, List.of(1)));
    }

    @Test
    void closeResetsThreadsAndCapacity() {
        long id = orchestrator.createSession(APP, List.of(10, 20), 16 * MS);
        orchestrator.castCapacity(id, VoteSlot.GPU_CAPACITY, 300, 0, 100 * MS);

        assertEquals(HintResult.OK, orchestrator.closeSession(id));

        assertEquals(List.of(10, 20), effector.reset());
        assertEquals(0, effector.lastCapacity());
        assertEquals(Boolean.TRUE, effector.lastBoost());
        assertTrue(orchestrator.findSession(id).isEmpty());
        assertEquals(0, orchestrator.registry().sizeResources());
        assertEquals(HintResult.NOT_FOUND, orchestrator.closeSession(id));
    }

    @Test
    void disableBoostsKeepsDefaultVote() {
        long id = orchestrator.createSession(SYSTEM, List.of(10), 16 * MS);
        orchestrator.castVote(id, VoteSlot.CPU_DEFAULT, 200, 1024, 0, 100 * MS);
        orchestrator.castVote(id, VoteSlot.CPU_LOAD_UP, 480, 1024, 0, 100 * MS);

        assertEquals(HintResult.OK, orchestrator.disableBoosts(id));

        assertTrue(vote(id, VoteSlot.CPU_DEFAULT).active());
        assertFalse(vote(id, VoteSlot.CPU_LOAD_UP).active());
        assertEquals(480, vote(id, VoteSlot.CPU_LOAD_UP).lower());
        assertEquals(200, orchestrator.envelopeOf(10).lower());
    }

    @Test
    void powerEfficiencyIsRecorded() {
        long id = orchestrator.createSession(SYSTEM, List.of(10), 16 * MS);

        assertEquals(HintResult.OK, orchestrator.setPowerEfficient(id, true));
        assertTrue(orchestrator.findSession(id).orElseThrow().powerEfficient());
        assertEquals(HintResult.NOT_FOUND, orchestrator.setPowerEfficient(99, true));
    }

    @Test
    void dumpListsAllSessions() {
        orchestrator.createSession(SYSTEM, List.of(10), 16 * MS);
        orchestrator.createSession(APP, List.of(11), 16 * MS);

        List<SessionSnapshot> dump = orchestrator.dump();
        assertEquals(2, dump.size());
        assertFalse(dump.get(0).appSession());
        assertTrue(dump.get(1).appSession());
    }
}
