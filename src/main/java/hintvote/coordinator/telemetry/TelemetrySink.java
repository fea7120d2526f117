package hintvote.coordinator.telemetry;

/**
 * Fire-and-forget channel for named numeric samples.
 * Nothing in the coordinator reads these back.
 */
@FunctionalInterface
public interface TelemetrySink {

    /** Discards every sample */
    TelemetrySink NONE = (session, name, value) -> {
    };

    /**
     * @param session id string of the session the sample belongs to
     * @param name    sample name, e.g. {@code pid.pOut}
     * @param value   sample value
     */
    void sample(String session, String name, long value);
}
