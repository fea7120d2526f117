package hintvote.coordinator.control;

import hintvote.coordinator.config.ControlProfile;
import hintvote.coordinator.model.WorkDuration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Per-session PID loop that turns reported work durations into a new clamp floor.
 *
 * <p>
 * Errors are measured in units of 100us. P and D look at trailing windows of
 * the reported batch; the integral persists for the session's lifetime and is
 * clamped on every sample. When heuristic boost is enabled, a
 * {@link WorkHistory} tracks missed cycles and raises the ceiling while the
 * workload keeps missing its target.
 *
 * <p>
 * Not thread-safe; owned by a single session.
 */
public final class DurationController {

    private static final Logger log = LoggerFactory.getLogger(DurationController.class);

    private static final long NANOS_PER_100US = 100_000L;
    private static final long FAR_OFF_TARGET_FACTOR = 20;

    private final ControlProfile profile;
    private final WorkHistory history;

    private long integralError;
    private long previousError;
    private boolean heuristicBoostActive;
    private PidTerms lastTerms = PidTerms.ZERO;

    public DurationController(ControlProfile profile) {
        this.profile = Objects.requireNonNull(profile, "profile");
        this.history = profile.heuristicBoostOn()
                ? new WorkHistory(profile.maxRecordsNum(), profile.jankCheckTimeFactor())
                : null;
        this.integralError = Math.max(profile.pidILowDivI(),
                Math.min(profile.pidIHighDivI(), profile.pidIInitDivI()));
    }

    /**
     * Ingest a batch and compute the next control value.
     *
     * @param durations non-empty batch, oldest first
     * @param targetNanos target duration per cycle
     * @param previous control value from the last update
     * @return next control value, within [uclampMinLow, ceiling]
     */
    public int update(List<WorkDuration> durations, long targetNanos, int previous) {
        if (durations.isEmpty()) {
            throw new IllegalArgumentException("durations must not be empty");
        }
        if (!profile.pidOn()) {
            return profile.uclampMinHigh();
        }

        if (history != null) {
            history.add(durations, targetNanos);
            updateHeuristicBoost(targetNanos);
        }

        lastTerms = computeTerms(durations, targetNanos);
        long output = lastTerms.output();

        int ceiling = heuristicBoostActive ? profile.hBoostUclampMin() : profile.uclampMinHigh();
        long next = Math.min(ceiling, previous + output);
        next = Math.max(profile.uclampMinLow(), next);
        return (int) next;
    }

    PidTerms computeTerms(List<WorkDuration> durations, long targetNanos) {
        int length = durations.size();
        int pStart = windowStart(profile.samplingWindowP(), length);
        int iStart = windowStart(profile.samplingWindowI(), length);
        int dStart = windowStart(profile.samplingWindowD(), length);
        long dt = Math.max(1, targetNanos / NANOS_PER_100US);

        long errSum = 0;
        long derivativeSum = 0;
        long iHigh = profile.pidIHighDivI();
        long iLow = profile.pidILowDivI();

        for (int i = Math.min(pStart, Math.min(iStart, dStart)); i < length; i++) {
            long actualNanos = durations.get(i).durationNanos();
            if (Math.abs(actualNanos) > saturatedMultiply(targetNanos, FAR_OFF_TARGET_FACTOR)) {
                log.warn("Actual duration {}ns is far from target {}ns", actualNanos, targetNanos);
            }
            long error = (actualNanos - targetNanos) / NANOS_PER_100US;
            if (i >= dStart) {
                derivativeSum += error - previousError;
            }
            if (i >= pStart) {
                errSum += error;
            }
            if (i >= iStart) {
                integralError = saturatedAdd(integralError, saturatedMultiply(error, dt));
                integralError = Math.min(iHigh, integralError);
                integralError = Math.max(iLow, integralError);
            }
            previousError = error;
        }

        double puActive = profile.pidPUnder();
        if (heuristicBoostActive) {
            puActive = profile.pidPUnder() * profile.hBoostPidPuFactor();
        }
        long pOut = (long) ((errSum > 0 ? profile.pidPOver() : puActive) * errSum / (length - pStart));
        long iOut = (long) (profile.pidI() * integralError);
        long dOut = (long) ((derivativeSum > 0 ? profile.pidDOver() : profile.pidDUnder())
                * derivativeSum / dt / (length - dStart));

        return new PidTerms(errSum / (length - pStart), pOut, iOut, dOut);
    }

    private static long saturatedMultiply(long a, long b) {
        try {
            return Math.multiplyExact(a, b);
        } catch (ArithmeticException e) {
            return (a < 0) == (b < 0) ? Long.MAX_VALUE : Long.MIN_VALUE;
        }
    }

    private static long saturatedAdd(long a, long b) {
        try {
            return Math.addExact(a, b);
        } catch (ArithmeticException e) {
            return a < 0 ? Long.MIN_VALUE : Long.MAX_VALUE;
        }
    }

    private void updateHeuristicBoost(long targetNanos) {
        OptionalInt max = history.maxDurationUs();
        OptionalInt avg = history.avgDurationUs();
        if (max.isEmpty() || avg.isEmpty()) {
            return;
        }
        double maxToAvgRatio = (double) max.getAsInt() / Math.max(1, avg.getAsInt());
        int missed = history.missedCycles();

        if (history.isLowFrameRate(profile.lowFrameRateThreshold())) {
            heuristicBoostActive = false;
        } else if (missed >= profile.hBoostOnMissedCycles()) {
            heuristicBoostActive = true;
        } else if (missed <= profile.hBoostOffMissedCycles()
                && maxToAvgRatio < profile.hBoostOffMaxAvgRatio()) {
            heuristicBoostActive = false;
        }
        log.trace("Heuristic boost {} (missed={}, max/avg={}, target={}ns)",
                heuristicBoostActive, missed, maxToAvgRatio, targetNanos);
    }

    // A window of 0, or one larger than the batch, covers the whole batch
    private static int windowStart(int window, int length) {
        return window == 0 || window > length ? 0 : length - window;
    }

    public long integralError() {
        return integralError;
    }

    public long previousError() {
        return previousError;
    }

    public boolean heuristicBoostActive() {
        return heuristicBoostActive;
    }

    public PidTerms lastTerms() {
        return lastTerms;
    }

    /**
     * History of reported cycles, or null when heuristic boost is off.
     */
    public WorkHistory history() {
        return history;
    }
}
