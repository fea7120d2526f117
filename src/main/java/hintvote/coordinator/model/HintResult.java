package hintvote.coordinator.model;

/**
 * Result of a session operation.
 */
public enum HintResult {
    /** Operation applied */
    OK,

    /** Session is unknown or already removed */
    NOT_FOUND,

    /**
     * Session is closed, or already in the requested state; nothing changed
     */
    ILLEGAL_STATE,

    /** Arguments rejected before any state change */
    ILLEGAL_ARGUMENT
}
