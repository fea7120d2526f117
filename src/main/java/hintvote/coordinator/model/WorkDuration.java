package hintvote.coordinator.model;

import java.util.concurrent.TimeUnit;

/**
 * One reported unit of work: when it finished and how long it took.
 */
public record WorkDuration(long timeStampNanos, long durationNanos) {

    /**
     * Longest accepted target or reported duration. Keeps every derived window
     * and the microsecond history inside their numeric ranges.
     */
    public static final long MAX_NANOS = TimeUnit.MINUTES.toNanos(10);

    public static boolean isAcceptable(long nanos) {
        return nanos >= 0 && nanos <= MAX_NANOS;
    }
}
