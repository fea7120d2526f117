package hintvote.coordinator.model;

/**
 * Closed set of vote slots a session can hold.
 * Each slot stores at most one vote and accepts exactly one {@link VoteKind}.
 */
public enum VoteSlot {
    /** Control-loop output, always present while the session lives */
    CPU_DEFAULT(VoteKind.RANGE),
    /** Short boost requested by an explicit load-up hint */
    CPU_LOAD_UP(VoteKind.RANGE),
    /** Boost applied after a load reset or session creation */
    CPU_LOAD_RESET(VoteKind.RANGE),
    /** Restores the last control value after a resume hint */
    CPU_LOAD_RESUME(VoteKind.RANGE),
    /** Ceiling applied while the session runs in power-efficiency mode */
    POWER_EFFICIENCY(VoteKind.RANGE),
    GPU_LOAD_UP(VoteKind.RANGE),
    GPU_LOAD_DOWN(VoteKind.RANGE),
    GPU_LOAD_RESET(VoteKind.RANGE),
    /** Requested GPU capacity, aggregated across sessions */
    GPU_CAPACITY(VoteKind.CAPACITY);

    private final VoteKind kind;

    VoteSlot(VoteKind kind) {
        this.kind = kind;
    }

    public VoteKind kind() {
        return kind;
    }

    public boolean accepts(VoteKind candidate) {
        return kind == candidate;
    }
}
