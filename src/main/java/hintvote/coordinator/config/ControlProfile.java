package hintvote.coordinator.config;

/**
 * Immutable tunables for the per-session control loop and the votes it casts.
 * Handed to each session at creation; never reloaded at runtime.
 */
public final class ControlProfile {
    // PID gains and integral bounds
    private final boolean pidOn;
    private final double pidPOver;
    private final double pidPUnder;
    private final double pidI;
    private final long pidIInit;
    private final long pidIHigh;
    private final long pidILow;
    private final double pidDOver;
    private final double pidDUnder;

    // Clamp floor/ceiling for the control value
    private final boolean uclampMinOn;
    private final int uclampMinInit;
    private final int uclampMinHigh;
    private final int uclampMinLow;

    // Trailing windows over a reported batch
    private final int samplingWindowP;
    private final int samplingWindowI;
    private final int samplingWindowD;

    private final long reportingRateLimitNanos;
    private final double targetTimeFactor;
    private final double staleTimeFactor;

    // Heuristic boost
    private final boolean heuristicBoostOn;
    private final int hBoostOnMissedCycles;
    private final double hBoostOffMaxAvgRatio;
    private final int hBoostOffMissedCycles;
    private final double hBoostPidPuFactor;
    private final int hBoostUclampMin;
    private final double jankCheckTimeFactor;
    private final int lowFrameRateThreshold;
    private final int maxRecordsNum;

    // Hint votes
    private final int loadUp;
    private final int loadReset;

    private ControlProfile(Builder b) {
        if (b.maxRecordsNum <= 0) {
            throw new IllegalArgumentException("maxRecordsNum must be positive");
        }
        if (b.uclampMinLow > b.uclampMinHigh) {
            throw new IllegalArgumentException("uclampMinLow must not exceed uclampMinHigh");
        }
        this.pidOn = b.pidOn;
        this.pidPOver = b.pidPOver;
        this.pidPUnder = b.pidPUnder;
        this.pidI = b.pidI;
        this.pidIInit = b.pidIInit;
        this.pidIHigh = b.pidIHigh;
        this.pidILow = b.pidILow;
        this.pidDOver = b.pidDOver;
        this.pidDUnder = b.pidDUnder;
        this.uclampMinOn = b.uclampMinOn;
        this.uclampMinInit = b.uclampMinInit;
        this.uclampMinHigh = b.uclampMinHigh;
        this.uclampMinLow = b.uclampMinLow;
        this.samplingWindowP = b.samplingWindowP;
        this.samplingWindowI = b.samplingWindowI;
        this.samplingWindowD = b.samplingWindowD;
        this.reportingRateLimitNanos = b.reportingRateLimitNanos;
        this.targetTimeFactor = b.targetTimeFactor;
        this.staleTimeFactor = b.staleTimeFactor;
        this.heuristicBoostOn = b.heuristicBoostOn;
        this.hBoostOnMissedCycles = b.hBoostOnMissedCycles;
        this.hBoostOffMaxAvgRatio = b.hBoostOffMaxAvgRatio;
        this.hBoostOffMissedCycles = b.hBoostOffMissedCycles;
        this.hBoostPidPuFactor = b.hBoostPidPuFactor;
        this.hBoostUclampMin = b.hBoostUclampMin;
        this.jankCheckTimeFactor = b.jankCheckTimeFactor;
        this.lowFrameRateThreshold = b.lowFrameRateThreshold;
        this.maxRecordsNum = b.maxRecordsNum;
        this.loadUp = b.loadUp;
        this.loadReset = b.loadReset;
    }

    public static ControlProfile defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .pidOn(pidOn)
                .pidPOver(pidPOver)
                .pidPUnder(pidPUnder)
                .pidI(pidI)
                .pidIInit(pidIInit)
                .pidIHigh(pidIHigh)
                .pidILow(pidILow)
                .pidDOver(pidDOver)
                .pidDUnder(pidDUnder)
                .uclampMinOn(uclampMinOn)
                .uclampMinInit(uclampMinInit)
                .uclampMinHigh(uclampMinHigh)
                .uclampMinLow(uclampMinLow)
                .samplingWindowP(samplingWindowP)
                .samplingWindowI(samplingWindowI)
                .samplingWindowD(samplingWindowD)
                .reportingRateLimitNanos(reportingRateLimitNanos)
                .targetTimeFactor(targetTimeFactor)
                .staleTimeFactor(staleTimeFactor)
                .heuristicBoostOn(heuristicBoostOn)
                .hBoostOnMissedCycles(hBoostOnMissedCycles)
                .hBoostOffMaxAvgRatio(hBoostOffMaxAvgRatio)
                .hBoostOffMissedCycles(hBoostOffMissedCycles)
                .hBoostPidPuFactor(hBoostPidPuFactor)
                .hBoostUclampMin(hBoostUclampMin)
                .jankCheckTimeFactor(jankCheckTimeFactor)
                .lowFrameRateThreshold(lowFrameRateThreshold)
                .maxRecordsNum(maxRecordsNum)
                .loadUp(loadUp)
                .loadReset(loadReset);
    }

    /**
     * Integral upper bound divided by the I gain, or 0 when I is 0.
     */
    public long pidIHighDivI() {
        return pidI == 0 ? 0 : (long) (pidIHigh / pidI);
    }

    /**
     * Integral lower bound divided by the I gain, or 0 when I is 0.
     */
    public long pidILowDivI() {
        return pidI == 0 ? 0 : (long) (pidILow / pidI);
    }

    public long pidIInitDivI() {
        return pidI == 0 ? 0 : (long) (pidIInit / pidI);
    }

    // Getters
    public boolean pidOn() {
        return pidOn;
    }

    public double pidPOver() {
        return pidPOver;
    }

    public double pidPUnder() {
        return pidPUnder;
    }

    public double pidI() {
        return pidI;
    }

    public long pidIInit() {
        return pidIInit;
    }

    public long pidIHigh() {
        return pidIHigh;
    }

    public long pidILow() {
        return pidILow;
    }

    public double pidDOver() {
        return pidDOver;
    }

    public double pidDUnder() {
        return pidDUnder;
    }

    public boolean uclampMinOn() {
        return uclampMinOn;
    }

    public int uclampMinInit() {
        return uclampMinInit;
    }

    public int uclampMinHigh() {
        return uclampMinHigh;
    }

    public int uclampMinLow() {
        return uclampMinLow;
    }

    public int samplingWindowP() {
        return samplingWindowP;
    }

    public int samplingWindowI() {
        return samplingWindowI;
    }

    public int samplingWindowD() {
        return samplingWindowD;
    }

    public long reportingRateLimitNanos() {
        return reportingRateLimitNanos;
    }

    public double targetTimeFactor() {
        return targetTimeFactor;
    }

    public double staleTimeFactor() {
        return staleTimeFactor;
    }

    public boolean heuristicBoostOn() {
        return heuristicBoostOn;
    }

    public int hBoostOnMissedCycles() {
        return hBoostOnMissedCycles;
    }

    public double hBoostOffMaxAvgRatio() {
        return hBoostOffMaxAvgRatio;
    }

    public int hBoostOffMissedCycles() {
        return hBoostOffMissedCycles;
    }

    public double hBoostPidPuFactor() {
        return hBoostPidPuFactor;
    }

    public int hBoostUclampMin() {
        return hBoostUclampMin;
    }

    public double jankCheckTimeFactor() {
        return jankCheckTimeFactor;
    }

    public int lowFrameRateThreshold() {
        return lowFrameRateThreshold;
    }

    public int maxRecordsNum() {
        return maxRecordsNum;
    }

    public int loadUp() {
        return loadUp;
    }

    public int loadReset() {
        return loadReset;
    }

    @Override
    public String toString() {
        return "ControlProfile{" +
                "pidOn=" + pidOn +
                ", P=" + pidPOver + "/" + pidPUnder +
                ", I=" + pidI + " [" + pidILow + ", " + pidIHigh + "]" +
                ", D=" + pidDOver + "/" + pidDUnder +
                ", uclampMin=" + uclampMinLow + ".." + uclampMinHigh + " init " + uclampMinInit +
                ", heuristicBoostOn=" + heuristicBoostOn +
                '}';
    }

    /**
     * Builder with the stock tuning as defaults.
     */
    public static final class Builder {
        private boolean pidOn = true;
        private double pidPOver = 2.0;
        private double pidPUnder = 1.0;
        private double pidI = 0.0;
        private long pidIInit = 200;
        private long pidIHigh = 512;
        private long pidILow = -30;
        private double pidDOver = 500.0;
        private double pidDUnder = 0.0;
        private boolean uclampMinOn = true;
        private int uclampMinInit = 162;
        private int uclampMinHigh = 480;
        private int uclampMinLow = 2;
        private int samplingWindowP = 1;
        private int samplingWindowI = 0;
        private int samplingWindowD = 1;
        private long reportingRateLimitNanos = 166_666_660L;
        private double targetTimeFactor = 1.0;
        private double staleTimeFactor = 15.0;
        private boolean heuristicBoostOn = true;
        private int hBoostOnMissedCycles = 8;
        private double hBoostOffMaxAvgRatio = 4.0;
        private int hBoostOffMissedCycles = 5;
        private double hBoostPidPuFactor = 0.5;
        private int hBoostUclampMin = 722;
        private double jankCheckTimeFactor = 1.2;
        private int lowFrameRateThreshold = 25;
        private int maxRecordsNum = 300;
        private int loadUp = 480;
        private int loadReset = 480;

        private Builder() {
        }

        public Builder pidOn(boolean pidOn) {
            this.pidOn = pidOn;
            return this;
        }

        public Builder pidPOver(double pidPOver) {
            this.pidPOver = pidPOver;
            return this;
        }

        public Builder pidPUnder(double pidPUnder) {
            this.pidPUnder = pidPUnder;
            return this;
        }

        public Builder pidI(double pidI) {
            this.pidI = pidI;
            return this;
        }

        public Builder pidIInit(long pidIInit) {
            this.pidIInit = pidIInit;
            return this;
        }

        public Builder pidIHigh(long pidIHigh) {
            this.pidIHigh = pidIHigh;
            return this;
        }

        public Builder pidILow(long pidILow) {
            this.pidILow = pidILow;
            return this;
        }

        public Builder pidDOver(double pidDOver) {
            this.pidDOver = pidDOver;
            return this;
        }

        public Builder pidDUnder(double pidDUnder) {
            this.pidDUnder = pidDUnder;
            return this;
        }

        public Builder uclampMinOn(boolean uclampMinOn) {
            this.uclampMinOn = uclampMinOn;
            return this;
        }

        public Builder uclampMinInit(int uclampMinInit) {
            this.uclampMinInit = uclampMinInit;
            return this;
        }

        public Builder uclampMinHigh(int uclampMinHigh) {
            this.uclampMinHigh = uclampMinHigh;
            return this;
        }

        public Builder uclampMinLow(int uclampMinLow) {
            this.uclampMinLow = uclampMinLow;
            return this;
        }

        public Builder samplingWindowP(int samplingWindowP) {
            this.samplingWindowP = samplingWindowP;
            return this;
        }

        public Builder samplingWindowI(int samplingWindowI) {
            this.samplingWindowI = samplingWindowI;
            return this;
        }

        public Builder samplingWindowD(int samplingWindowD) {
            this.samplingWindowD = samplingWindowD;
            return this;
        }

        public Builder reportingRateLimitNanos(long reportingRateLimitNanos) {
            this.reportingRateLimitNanos = reportingRateLimitNanos;
            return this;
        }

        public Builder targetTimeFactor(double targetTimeFactor) {
            this.targetTimeFactor = targetTimeFactor;
            return this;
        }

        public Builder staleTimeFactor(double staleTimeFactor) {
            this.staleTimeFactor = staleTimeFactor;
            return this;
        }

        public Builder heuristicBoostOn(boolean heuristicBoostOn) {
            this.heuristicBoostOn = heuristicBoostOn;
            return this;
        }

        public Builder hBoostOnMissedCycles(int hBoostOnMissedCycles) {
            this.hBoostOnMissedCycles = hBoostOnMissedCycles;
            return this;
        }

        public Builder hBoostOffMaxAvgRatio(double hBoostOffMaxAvgRatio) {
            this.hBoostOffMaxAvgRatio = hBoostOffMaxAvgRatio;
            return this;
        }

        public Builder hBoostOffMissedCycles(int hBoostOffMissedCycles) {
            this.hBoostOffMissedCycles = hBoostOffMissedCycles;
            return this;
        }

        public Builder hBoostPidPuFactor(double hBoostPidPuFactor) {
            this.hBoostPidPuFactor = hBoostPidPuFactor;
            return this;
        }

        public Builder hBoostUclampMin(int hBoostUclampMin) {
            this.hBoostUclampMin = hBoostUclampMin;
            return this;
        }

        public Builder jankCheckTimeFactor(double jankCheckTimeFactor) {
            this.jankCheckTimeFactor = jankCheckTimeFactor;
            return this;
        }

        public Builder lowFrameRateThreshold(int lowFrameRateThreshold) {
            this.lowFrameRateThreshold = lowFrameRateThreshold;
            return this;
        }

        public Builder maxRecordsNum(int maxRecordsNum) {
            this.maxRecordsNum = maxRecordsNum;
            return this;
        }

        public Builder loadUp(int loadUp) {
            this.loadUp = loadUp;
            return this;
        }

        public Builder loadReset(int loadReset) {
            this.loadReset = loadReset;
            return this;
        }

        public ControlProfile build() {
            return new ControlProfile(this);
        }
    }
}
