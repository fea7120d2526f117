package hintvote.coordinator.model;

import java.util.List;

/**
 * Read-only view of a registered session.
 */
public record SessionSnapshot(
        long id,
        String idString,
        SessionDescriptor descriptor,
        boolean active,
        boolean appSession,
        boolean powerEfficient,
        long lastUpdatedNanos,
        List<Integer> members,
        List<VoteSnapshot> votes) {

    public SessionSnapshot {
        members = List.copyOf(members);
        votes = List.copyOf(votes);
    }
}
