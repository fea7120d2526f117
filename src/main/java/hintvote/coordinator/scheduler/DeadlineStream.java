package hintvote.coordinator.scheduler;

import java.util.OptionalLong;

/**
 * Callback registered with a {@link DeadlineScheduler}.
 */
@FunctionalInterface
public interface DeadlineStream {

    /**
     * Called on a scheduler worker once {@code deadlineNanos} has passed.
     *
     * @param payloadId     reference to caller-held state
     * @param deadlineNanos deadline the entry was queued with
     * @return a new deadline to re-queue the same payload, or empty when done
     */
    OptionalLong onDeadline(long payloadId, long deadlineNanos);
}
