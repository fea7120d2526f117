package hintvote.coordinator.model;

/**
 * A time-windowed constraint cast by a session into one of its slots.
 *
 * <p>
 * Bounds never change after construction. The {@code active} flag and the
 * duration are mutable so a slot can be muted or extended in place. Instances
 * are not thread-safe; they are only touched under the registry monitor.
 */
public abstract class Vote {

    private boolean active;
    private final long startNanos;
    private long durationNanos;

    protected Vote(boolean active, long startNanos, long durationNanos) {
        this.active = active;
        this.startNanos = startNanos;
        this.durationNanos = durationNanos;
    }

    public static Range range(int lower, int upper, long startNanos, long durationNanos) {
        return new Range(true, lower, upper, startNanos, durationNanos);
    }

    public static Capacity capacity(int magnitude, long startNanos, long durationNanos) {
        return new Capacity(true, magnitude, startNanos, durationNanos);
    }

    public abstract VoteKind kind();

    public boolean active() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }

    public long startNanos() {
        return startNanos;
    }

    public long durationNanos() {
        return durationNanos;
    }

    public void setDurationNanos(long durationNanos) {
        this.durationNanos = durationNanos;
    }

    /**
     * End of the window, saturated at {@link Long#MAX_VALUE}.
     */
    public long expiryNanos() {
        long end = startNanos + durationNanos;
        if (durationNanos > 0 && end < startNanos) {
            return Long.MAX_VALUE;
        }
        return end;
    }

    /**
     * Whether this vote constrains anything at {@code nowNanos}. Both window ends are inclusive.
     */
    public boolean inRange(long nowNanos) {
        return active && startNanos <= nowNanos && nowNanos <= expiryNanos();
    }

    /**
     * Clamp-bound vote applied to every member resource of the session.
     */
    public static final class Range extends Vote {
        private final int lower;
        private final int upper;

        public Range(boolean active, int lower, int upper, long startNanos, long durationNanos) {
            super(active, startNanos, durationNanos);
            this.lower = lower;
            this.upper = upper;
        }

        @Override
        public VoteKind kind() {
            return VoteKind.RANGE;
        }

        public int lower() {
            return lower;
        }

        public int upper() {
            return upper;
        }

        @Override
        public String toString() {
            return "Range{" + lower + ".." + upper + ", active=" + active() +
                    ", start=" + startNanos() + ", duration=" + durationNanos() + '}';
        }
    }

    /**
     * System-wide capacity request.
     */
    public static final class Capacity extends Vote {
        private final int magnitude;

        public Capacity(boolean active, int magnitude, long startNanos, long durationNanos) {
            super(active, startNanos, durationNanos);
            this.magnitude = magnitude;
        }

        @Override
        public VoteKind kind() {
            return VoteKind.CAPACITY;
        }

        public int magnitude() {
            return magnitude;
        }

        @Override
        public String toString() {
            return "Capacity{" + magnitude + ", active=" + active() +
                    ", start=" + startNanos() + ", duration=" + durationNanos() + '}';
        }
    }
}
