package hintvote.coordinator.model;

/**
 * The shape of a vote's payload.
 */
public enum VoteKind {
    /** Lower/upper clamp bounds applied per resource */
    RANGE,
    /** Single magnitude aggregated system-wide by maximum */
    CAPACITY
}
