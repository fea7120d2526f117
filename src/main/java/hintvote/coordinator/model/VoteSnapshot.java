package hintvote.coordinator.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Read-only view of one slot, taken under the registry monitor.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record VoteSnapshot(
        VoteSlot slot,
        boolean active,
        boolean inRange,
        Integer lower,
        Integer upper,
        Integer magnitude,
        long startNanos,
        long durationNanos) {

    public static VoteSnapshot of(VoteSlot slot, Vote vote, long nowNanos) {
        if (vote instanceof Vote.Range range) {
            return new VoteSnapshot(slot, vote.active(), vote.inRange(nowNanos),
                    range.lower(), range.upper(), null, vote.startNanos(), vote.durationNanos());
        }
        Vote.Capacity capacity = (Vote.Capacity) vote;
        return new VoteSnapshot(slot, vote.active(), vote.inRange(nowNanos),
                null, null, capacity.magnitude(), vote.startNanos(), vote.durationNanos());
    }
}
