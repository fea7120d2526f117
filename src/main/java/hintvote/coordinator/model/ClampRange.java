package hintvote.coordinator.model;

/**
 * Combined (lower, upper) clamp bound for a resource.
 */
public record ClampRange(int lower, int upper) {

    /** Smallest clamp value a resource accepts */
    public static final int MIN = 0;
    /** Largest clamp value a resource accepts */
    public static final int MAX = 1024;

    /** Unconstrained envelope */
    public static final ClampRange FULL = new ClampRange(MIN, MAX);

    /**
     * Narrow this range by another bound pair.
     * The result may be inverted; call {@link #collapsed()} once all bounds are applied.
     */
    public ClampRange intersect(int otherLower, int otherUpper) {
        return new ClampRange(Math.max(lower, otherLower), Math.min(upper, otherUpper));
    }

    /**
     * Resolve an inverted range by letting the cap win.
     */
    public ClampRange collapsed() {
        return lower > upper ? new ClampRange(upper, upper) : this;
    }

    public boolean isFull() {
        return lower == MIN && upper == MAX;
    }
}
