package hintvote.coordinator.model;

/**
 * Kind of client that owns a session.
 */
public enum SessionTag {
    OTHER,
    SURFACEFLINGER,
    HWUI,
    GAME,
    APP
}
