package hintvote.coordinator.arbiter;

import hintvote.coordinator.model.ClampRange;
import hintvote.coordinator.model.Vote;
import hintvote.coordinator.model.VoteKind;
import hintvote.coordinator.model.VoteSlot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;
import java.util.OptionalInt;
import java.util.OptionalLong;
import java.util.function.BiConsumer;

/**
 * Per-session collection of time-windowed votes, one per {@link VoteSlot}.
 *
 * <p>
 * The arbiter computes the combined clamp envelope for a point in time: the
 * highest lower bound and the lowest upper bound over all votes in range. The
 * result is independent of insertion order. An absent slot is never an error,
 * it just contributes no constraint.
 *
 * <p>
 * Not thread-safe. Callers serialize access through the session registry.
 */
public final class VoteArbiter {

    private static final Logger log = LoggerFactory.getLogger(VoteArbiter.class);

    private final EnumMap<VoteSlot, Vote> votes = new EnumMap<>(VoteSlot.class);

    /**
     * Insert or overwrite a range vote. Bounds are clamped to
     * [{@link ClampRange#MIN}, {@link ClampRange#MAX}] and swapped when reversed.
     * Casting into a capacity slot is ignored.
     */
    public void cast(VoteSlot slot, int lower, int upper, long startNanos, long durationNanos) {
        cast(slot, true, lower, upper, startNanos, durationNanos);
    }

    /**
     * Insert or overwrite a range vote with an explicit initial active flag.
     */
    public void cast(VoteSlot slot, boolean active, int lower, int upper, long startNanos, long durationNanos) {
        if (!slot.accepts(VoteKind.RANGE)) {
            log.debug("Ignoring range vote for capacity slot {}", slot);
            return;
        }
        int lo = clamp(lower);
        int hi = clamp(upper);
        if (lo > hi) {
            int tmp = lo;
            lo = hi;
            hi = tmp;
        }
        votes.put(slot, new Vote.Range(active, lo, hi, startNanos, durationNanos));
    }

    /**
     * Insert or overwrite a capacity vote. Casting into a range slot is ignored.
     */
    public void castCapacity(VoteSlot slot, int magnitude, long startNanos, long durationNanos) {
        if (!slot.accepts(VoteKind.CAPACITY)) {
            log.debug("Ignoring capacity vote for range slot {}", slot);
            return;
        }
        votes.put(slot, new Vote.Capacity(true, Math.max(0, magnitude), startNanos, durationNanos));
    }

    /**
     * Remove a slot entirely.
     *
     * @return false if the slot was empty
     */
    public boolean revokeSlot(VoteSlot slot) {
        return votes.remove(slot) != null;
    }

    /**
     * Mute or unmute a slot without touching its bounds.
     *
     * @return false if the slot was empty
     */
    public boolean setActive(VoteSlot slot, boolean active) {
        Vote vote = votes.get(slot);
        if (vote == null) {
            return false;
        }
        vote.setActive(active);
        return true;
    }

    /**
     * Change a slot's duration while keeping its start. A shorter duration may
     * expire the vote retroactively. No-op for an empty slot.
     */
    public void extendDuration(VoteSlot slot, long durationNanos) {
        Vote vote = votes.get(slot);
        if (vote != null) {
            vote.setDurationNanos(durationNanos);
        }
    }

    public boolean isActive(VoteSlot slot) {
        Vote vote = votes.get(slot);
        return vote != null && vote.active();
    }

    /**
     * @return end of the slot's window, or 0 when the slot is empty
     */
    public long expiryOf(VoteSlot slot) {
        Vote vote = votes.get(slot);
        return vote == null ? 0L : vote.expiryNanos();
    }

    /**
     * Combined envelope of this arbiter alone.
     */
    public ClampRange envelope(long nowNanos) {
        return narrow(ClampRange.FULL, nowNanos).collapsed();
    }

    /**
     * Narrow an accumulated range by every range vote in range at {@code nowNanos}.
     * The result is not collapsed so several arbiters can be folded together.
     */
    public ClampRange narrow(ClampRange current, long nowNanos) {
        ClampRange result = current;
        for (Vote vote : votes.values()) {
            if (vote instanceof Vote.Range range && vote.inRange(nowNanos)) {
                result = result.intersect(range.lower(), range.upper());
            }
        }
        return result;
    }

    /**
     * Capacity requested by a slot, present only while that vote is in range.
     */
    public OptionalInt capacity(VoteSlot slot, long nowNanos) {
        Vote vote = votes.get(slot);
        if (vote instanceof Vote.Capacity capacity && vote.inRange(nowNanos)) {
            return OptionalInt.of(capacity.magnitude());
        }
        return OptionalInt.empty();
    }

    /**
     * Earliest window end among votes in range, used to decide when to re-check.
     */
    public OptionalLong earliestExpiry(long nowNanos) {
        long earliest = Long.MAX_VALUE;
        boolean found = false;
        for (Vote vote : votes.values()) {
            if (vote.inRange(nowNanos)) {
                earliest = Math.min(earliest, vote.expiryNanos());
                found = true;
            }
        }
        return found ? OptionalLong.of(earliest) : OptionalLong.empty();
    }

    /**
     * True when no vote is in range. A vote that has not started yet counts as
     * expired, so this answers "is anything constraining right now".
     */
    public boolean allExpired(long nowNanos) {
        for (Vote vote : votes.values()) {
            if (vote.inRange(nowNanos)) {
                return false;
            }
        }
        return true;
    }

    /**
     * True when at least one held vote is out of range.
     */
    public boolean anyExpired(long nowNanos) {
        for (Vote vote : votes.values()) {
            if (!vote.inRange(nowNanos)) {
                return true;
            }
        }
        return false;
    }

    public int size() {
        return votes.size();
    }

    /**
     * Visit every held vote in slot order.
     */
    public void forEach(BiConsumer<VoteSlot, Vote> visitor) {
        for (Map.Entry<VoteSlot, Vote> entry : votes.entrySet()) {
            visitor.accept(entry.getKey(), entry.getValue());
        }
    }

    private static int clamp(int value) {
        return Math.max(ClampRange.MIN, Math.min(ClampRange.MAX, value));
    }
}
