package hintvote.coordinator.registry;

import hintvote.coordinator.model.ClampRange;
import hintvote.coordinator.model.SessionSnapshot;
import hintvote.coordinator.model.VoteSlot;
import hintvote.coordinator.model.VoteSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;
import java.util.function.Function;

/**
 * Two-way index between sessions and the resources (thread ids) they own.
 *
 * <p>
 * Every public method runs under this object's monitor, which also guards the
 * per-session {@link SessionEntry} and its vote arbiter. For each session
 * {@code s} and resource {@code r}: {@code r} is in the members of {@code s}
 * exactly when {@code s} is in the owners of {@code r}.
 */
public final class SessionRegistry {

    private static final Logger log = LoggerFactory.getLogger(SessionRegistry.class);

    private final Map<Long, SessionEntry> sessions = new HashMap<>();
    private final Map<Integer, Set<Long>> owners = new HashMap<>();

    /**
     * Register a session with its initial members.
     *
     * @return false, without any change, if the id is already registered
     */
    public synchronized boolean add(SessionEntry entry, Collection<Integer> members) {
        if (sessions.containsKey(entry.id())) {
            log.debug("Session {} already registered", entry.id());
            return false;
        }
        sessions.put(entry.id(), entry);
        attach(entry, members);
        return true;
    }

    /**
     * Replace a session's members with a new set.
     *
     * @return the resources that became owned or unowned, or empty if the
     *         session is unknown
     */
    public synchronized Optional<MembershipDelta> replace(long sessionId, Collection<Integer> newMembers) {
        SessionEntry entry = sessions.get(sessionId);
        if (entry == null) {
            log.debug("replace: session {} not found", sessionId);
            return Optional.empty();
        }

        Set<Integer> incoming = new LinkedHashSet<>(newMembers);
        List<Integer> added = new ArrayList<>();
        for (Integer resource : incoming) {
            if (!owners.containsKey(resource)) {
                added.add(resource);
            }
        }

        List<Integer> previous = new ArrayList<>(entry.members());
        detach(entry);
        attach(entry, incoming);

        List<Integer> removed = new ArrayList<>();
        for (Integer resource : previous) {
            if (!owners.containsKey(resource)) {
                removed.add(resource);
            }
        }
        return Optional.of(new MembershipDelta(added, removed));
    }

    /**
     * Detach a session from all its members and forget it.
     *
     * @return false if the session is unknown
     */
    public synchronized boolean remove(long sessionId) {
        SessionEntry entry = sessions.get(sessionId);
        if (entry == null) {
            return false;
        }
        detach(entry);
        sessions.remove(sessionId);
        return true;
    }

    /**
     * Drop one resource from one session, leaving other owners untouched.
     *
     * @return false if the session does not own the resource
     */
    public synchronized boolean pruneDeadResource(long sessionId, int resourceId) {
        SessionEntry entry = sessions.get(sessionId);
        if (entry == null || !entry.members().remove(resourceId)) {
            return false;
        }
        Set<Long> sessionIds = owners.get(resourceId);
        if (sessionIds != null) {
            sessionIds.remove(sessionId);
            if (sessionIds.isEmpty()) {
                owners.remove(resourceId);
            }
        }
        return true;
    }

    /**
     * Drop a resource from every session that owns it.
     *
     * @return the sessions it was pruned from
     */
    public synchronized List<Long> pruneDeadResource(int resourceId) {
        List<Long> pruned = new ArrayList<>();
        for (Long sessionId : ownersOf(resourceId)) {
            if (pruneDeadResource(sessionId, resourceId)) {
                pruned.add(sessionId);
            }
        }
        return pruned;
    }

    public synchronized Optional<SessionSnapshot> findSession(long sessionId, long nowNanos) {
        SessionEntry entry = sessions.get(sessionId);
        return entry == null ? Optional.empty() : Optional.of(snapshotOf(entry, nowNanos));
    }

    public synchronized boolean contains(long sessionId) {
        return sessions.containsKey(sessionId);
    }

    /**
     * Run {@code action} against a live session under the registry monitor.
     *
     * @return the action's result, or empty if the session is unknown
     */
    public synchronized <T> Optional<T> withSession(long sessionId, Function<SessionEntry, T> action) {
        SessionEntry entry = sessions.get(sessionId);
        if (entry == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(action.apply(entry));
    }

    public synchronized List<Long> ownersOf(int resourceId) {
        Set<Long> sessionIds = owners.get(resourceId);
        return sessionIds == null ? List.of() : List.copyOf(sessionIds);
    }

    public synchronized List<Integer> membersOf(long sessionId) {
        SessionEntry entry = sessions.get(sessionId);
        return entry == null ? List.of() : List.copyOf(entry.members());
    }

    /**
     * Envelope for one resource: the narrowest bound over the in-range votes
     * of its active owners. Unowned resources get {@link ClampRange#FULL}.
     */
    public synchronized ClampRange envelopeFor(int resourceId, long nowNanos) {
        ClampRange range = ClampRange.FULL;
        Set<Long> sessionIds = owners.get(resourceId);
        if (sessionIds == null) {
            return range;
        }
        for (Long sessionId : sessionIds) {
            SessionEntry entry = sessions.get(sessionId);
            if (entry == null || !entry.active()) {
                continue;
            }
            range = entry.arbiter().narrow(range, nowNanos);
        }
        return range.collapsed();
    }

    /**
     * Largest in-range capacity request among active sessions.
     */
    public synchronized OptionalInt capacity(long nowNanos) {
        int max = -1;
        for (SessionEntry entry : sessions.values()) {
            if (!entry.active()) {
                continue;
            }
            OptionalInt requested = entry.arbiter().capacity(VoteSlot.GPU_CAPACITY, nowNanos);
            if (requested.isPresent()) {
                max = Math.max(max, requested.getAsInt());
            }
        }
        return max < 0 ? OptionalInt.empty() : OptionalInt.of(max);
    }

    /**
     * Whether some app session is active and still has a vote in range.
     */
    public synchronized boolean isAnyAppSessionActive(long nowNanos) {
        for (SessionEntry entry : sessions.values()) {
            if (entry.appSession() && entry.active() && !entry.arbiter().allExpired(nowNanos)) {
                return true;
            }
        }
        return false;
    }

    public synchronized int sizeSessions() {
        return sessions.size();
    }

    public synchronized int sizeResources() {
        return owners.size();
    }

    public synchronized List<Long> sessionIds() {
        return List.copyOf(sessions.keySet());
    }

    public synchronized List<Integer> resourceIds() {
        return List.copyOf(owners.keySet());
    }

    public synchronized List<SessionSnapshot> snapshot(long nowNanos) {
        List<SessionSnapshot> result = new ArrayList<>(sessions.size());
        for (SessionEntry entry : sessions.values()) {
            result.add(snapshotOf(entry, nowNanos));
        }
        result.sort((a, b) -> Long.compare(a.id(), b.id()));
        return result;
    }

    private void attach(SessionEntry entry, Collection<Integer> members) {
        for (Integer resource : members) {
            if (entry.members().add(resource)) {
                owners.computeIfAbsent(resource, k -> new LinkedHashSet<>()).add(entry.id());
            }
        }
    }

    private void detach(SessionEntry entry) {
        for (Integer resource : entry.members()) {
            Set<Long> sessionIds = owners.get(resource);
            if (sessionIds == null) {
                continue;
            }
            sessionIds.remove(entry.id());
            if (sessionIds.isEmpty()) {
                owners.remove(resource);
            }
        }
        entry.members().clear();
    }

    private static SessionSnapshot snapshotOf(SessionEntry entry, long nowNanos) {
        List<VoteSnapshot> votes = new ArrayList<>(entry.arbiter().size());
        entry.arbiter().forEach((slot, vote) -> votes.add(VoteSnapshot.of(slot, vote, nowNanos)));
        return new SessionSnapshot(
                entry.id(),
                entry.idString(),
                entry.descriptor(),
                entry.active(),
                entry.appSession(),
                entry.powerEfficient(),
                entry.lastUpdatedNanos(),
                List.copyOf(entry.members()),
                votes);
    }
}
