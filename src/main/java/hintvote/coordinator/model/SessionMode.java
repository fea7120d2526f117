package hintvote.coordinator.model;

/**
 * Persistent modes a session can toggle.
 */
public enum SessionMode {
    /** Prefer efficiency over latency */
    POWER_EFFICIENCY
}
