package hintvote.coordinator.registry;

import hintvote.coordinator.arbiter.VoteArbiter;
import hintvote.coordinator.model.ClampRange;
import hintvote.coordinator.model.SessionDescriptor;
import hintvote.coordinator.model.SessionSnapshot;
import hintvote.coordinator.model.SessionTag;
import hintvote.coordinator.model.VoteSlot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.OptionalInt;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class SessionRegistryTest {

    private static final long MS = 1_000_000L;

    private SessionRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new SessionRegistry();
    }

    private static SessionEntry entry(long id, boolean app) {
        return new SessionEntry(id, new SessionDescriptor(100, app ? 10_001 : 1_000, SessionTag.OTHER), app,
                new VoteArbiter());
    }

    private void assertIndexConsistent() {
        int memberships = 0;
        for (Long sessionId : registry.sessionIds()) {
            for (Integer resource : registry.membersOf(sessionId)) {
                assertTrue(registry.ownersOf(resource).contains(sessionId),
                        "thread " + resource + " should list session " + sessionId);
                memberships++;
            }
        }
        int ownerships = 0;
        for (Integer resource : registry.resourceIds()) {
            List<Long> owners = registry.ownersOf(resource);
            assertFalse(owners.isEmpty(), "unowned thread " + resource + " should not be indexed");
            for (Long sessionId : owners) {
                assertTrue(registry.membersOf(sessionId).contains(resource));
                ownerships++;
            }
        }
        assertEquals(memberships, ownerships);
    }

    @Test
    void addIndexesBothDirections() {
        assertTrue(registry.add(entry(1, false), List.of(10, 20)));
        assertTrue(registry.add(entry(2, false), List.of(20, 30)));

        assertEquals(2, registry.sizeSessions());
        assertEquals(3, registry.sizeResources());
        assertEquals(Set.of(1L, 2L), Set.copyOf(registry.ownersOf(20)));
        assertIndexConsistent();
    }

    @Test
    void duplicateAddIsRejected() {
        registry.add(entry(1, false), List.of(10));

        assertFalse(registry.add(entry(1, false), List.of(99)));
        assertEquals(List.of(10), registry.membersOf(1));
        assertTrue(registry.ownersOf(99).isEmpty());
    }

    @Test
    void replaceReportsDelta() {
        registry.add(entry(1, false), List.of(10, 20, 30));
        registry.add(entry(2, false), List.of(20));

        MembershipDelta delta = registry.replace(1, List.of(10, 40)).orElseThrow();

        assertEquals(List.of(40), delta.added());
        assertEquals(List.of(30), delta.removed());
        assertEquals(List.of(2L), registry.ownersOf(20));
        assertIndexConsistent();
    }

    @Test
    void replaceWithSameMembersIsEmptyDelta() {
        registry.add(entry(1, false), List.of(10, 20));

        MembershipDelta delta = registry.replace(1, List.of(20, 10)).orElseThrow();

        assertTrue(delta.isEmpty());
        assertIndexConsistent();
    }

    @Test
    void replaceUnknownSession() {
        assertTrue(registry.replace(42, List.of(1)).isEmpty());
    }

    @Test
    void removeDetachesEverything() {
        registry.add(entry(1, false), List.of(10, 20));
        registry.add(entry(2, false), List.of(20));

        assertTrue(registry.remove(1));
        assertFalse(registry.remove(1));
        assertFalse(registry.contains(1));
        assertTrue(registry.ownersOf(10).isEmpty());
        assertEquals(List.of(2L), registry.ownersOf(20));
        assertIndexConsistent();
    }

    @Test
    void pruneFromOneSessionLeavesOtherOwners() {
        registry.add(entry(1, false), List.of(20, 30));
        registry.add(entry(2, false), List.of(20));

        assertTrue(registry.pruneDeadResource(1, 20));
        assertFalse(registry.pruneDeadResource(1, 20));

        assertEquals(List.of(30), registry.membersOf(1));
        assertEquals(List.of(2L), registry.ownersOf(20));
        assertIndexConsistent();
    }

    @Test
    void pruneFromAllOwners() {
        registry.add(entry(1, false), List.of(20));
        registry.add(entry(2, false), List.of(20, 30));

        List<Long> pruned = registry.pruneDeadResource(20);

        assertEquals(Set.of(1L, 2L), Set.copyOf(pruned));
        assertTrue(registry.ownersOf(20).isEmpty());
        assertTrue(registry.contains(1));
        assertTrue(registry.membersOf(1).isEmpty());
        assertIndexConsistent();
    }

    @Test
    void envelopeSkipsInactiveSessions() {
        SessionEntry first = entry(1, false);
        SessionEntry second = entry(2, false);
        first.arbiter().cast(VoteSlot.CPU_DEFAULT, 300, 1024, 0, 100 * MS);
        second.arbiter().cast(VoteSlot.CPU_DEFAULT, 500, 1024, 0, 100 * MS);
        registry.add(first, List.of(7));
        registry.add(second, List.of(7));

        assertEquals(500, registry.envelopeFor(7, MS).lower());

        registry.withSession(2, e -> {
            e.setActive(false);
            return null;
        });
        assertEquals(300, registry.envelopeFor(7, MS).lower());
        assertEquals(ClampRange.FULL, registry.envelopeFor(8, MS));
    }

    @Test
    void capacityIsMaxOverActiveSessions() {
        SessionEntry first = entry(1, false);
        SessionEntry second = entry(2, false);
        first.arbiter().castCapacity(VoteSlot.GPU_CAPACITY, 100, 0, 100 * MS);
        second.arbiter().castCapacity(VoteSlot.GPU_CAPACITY, 250, 0, 100 * MS);
        registry.add(first, List.of(1));
        registry.add(second, List.of(2));

        assertEquals(OptionalInt.of(250), registry.capacity(MS));

        second.arbiter().setActive(VoteSlot.GPU_CAPACITY, false);
        assertEquals(OptionalInt.of(100), registry.capacity(MS));

        assertTrue(registry.capacity(200 * MS).isEmpty());
    }

    @Test
    void appSessionActiveUntilItsVotesRunOut() {
        SessionEntry app = entry(1, true);
        app.arbiter().cast(VoteSlot.CPU_DEFAULT, 200, 1024, 0, 500 * MS);
        SessionEntry system = entry(2, false);
        system.arbiter().cast(VoteSlot.CPU_DEFAULT, 200, 1024, 0, 5_000 * MS);
        registry.add(app, List.of(1));
        registry.add(system, List.of(2));

        assertTrue(registry.isAnyAppSessionActive(0));
        assertFalse(registry.isAnyAppSessionActive(501 * MS));
    }

    @Test
    void snapshotIsSortedAndDetached() {
        SessionEntry second = entry(2, false);
        second.arbiter().cast(VoteSlot.CPU_LOAD_UP, 480, 1024, 0, 100);
        registry.add(second, List.of(5));
        registry.add(entry(1, false), List.of(6));

        List<SessionSnapshot> snapshot = registry.snapshot(50);
        assertEquals(2, snapshot.size());
        assertEquals(1, snapshot.get(0).id());
        assertEquals(2, snapshot.get(1).id());

        SessionSnapshot view = snapshot.get(1);
        assertEquals("100-1000-2", view.idString());
        assertEquals(1, view.votes().size());
        assertEquals(VoteSlot.CPU_LOAD_UP, view.votes().get(0).slot());
        assertTrue(view.votes().get(0).inRange());

        registry.replace(2, List.of(9));
        assertEquals(List.of(5), view.members());
    }

    @Test
    void findSession() {
        registry.add(entry(3, true), List.of(1));

        assertTrue(registry.findSession(3, 0).orElseThrow().appSession());
        assertTrue(registry.findSession(4, 0).isEmpty());
        assertTrue(registry.withSession(4, e -> Boolean.TRUE).isEmpty());
    }
}
