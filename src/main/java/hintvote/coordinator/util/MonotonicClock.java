package hintvote.coordinator.util;

/**
 * Source of monotonic time in nanoseconds.
 * Values are only meaningful relative to each other, never as wall-clock time.
 */
@FunctionalInterface
public interface MonotonicClock {

    /** Process-wide clock backed by {@link System#nanoTime()} */
    MonotonicClock SYSTEM = System::nanoTime;

    long nowNanos();
}
