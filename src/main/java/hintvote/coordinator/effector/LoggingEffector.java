package hintvote.coordinator.effector;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default effector: records every request in the log and reports success.
 */
public class LoggingEffector implements Effector {

    private static final Logger log = LoggerFactory.getLogger(LoggingEffector.class);

    @Override
    public ApplyResult applyEnvelope(int resourceId, int lower, int upper) {
        log.debug("Envelope for tid {}: [{}, {}]", resourceId, lower, upper);
        return ApplyResult.OK;
    }

    @Override
    public ApplyResult applyCapacity(int magnitude) {
        log.debug("Capacity request: {}", magnitude);
        return ApplyResult.OK;
    }

    @Override
    public void attachResource(int resourceId) {
        log.debug("Attach tid {}", resourceId);
    }

    @Override
    public void resetResource(int resourceId) {
        log.debug("Reset tid {}", resourceId);
    }

    @Override
    public void setSystemBoost(boolean enabled) {
        log.debug("System boost {}", enabled ? "enabled" : "disabled");
    }
}
