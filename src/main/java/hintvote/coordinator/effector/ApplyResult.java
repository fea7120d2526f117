package hintvote.coordinator.effector;

/**
 * Outcome of pushing a value to the system.
 */
public enum ApplyResult {
    /** Value applied */
    OK,

    /** Target resource no longer exists; callers prune it */
    NOT_FOUND,

    /** Write failed for another reason; logged and ignored */
    ERROR
}
