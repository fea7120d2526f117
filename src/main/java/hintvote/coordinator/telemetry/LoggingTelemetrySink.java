package hintvote.coordinator.telemetry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes samples to the log at trace level.
 */
public class LoggingTelemetrySink implements TelemetrySink {

    private static final Logger log = LoggerFactory.getLogger(LoggingTelemetrySink.class);

    @Override
    public void sample(String session, String name, long value) {
        if (log.isTraceEnabled()) {
            log.trace("{} {}={}", session, name, value);
        }
    }
}
