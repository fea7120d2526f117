package hintvote.coordinator.control;

import hintvote.coordinator.model.WorkDuration;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.OptionalInt;

/**
 * Fixed-capacity ring of recent work cycles.
 *
 * <p>
 * Alongside the ring, a deque holds ring indexes whose durations are strictly
 * decreasing from front to back, so the front is always the maximum of the
 * live records. When the ring evicts an index equal to the deque front, the
 * front is popped.
 */
public final class WorkHistory {

    private record CycleRecord(int startIntervalUs, int durationUs, boolean missed) {
    }

    private final int capacity;
    private final double jankCheckTimeFactor;
    private final CycleRecord[] records;
    private final Deque<Integer> maxIndexes = new ArrayDeque<>();

    private int latestIndex = -1;
    private int numFrames;
    private int missedCycles;
    private long sumDurationsUs;
    private long lastStartNanos;

    /**
     * @param capacity            number of cycles kept
     * @param jankCheckTimeFactor a cycle counts as missed when it runs longer
     *                            than target times this factor
     */
    public WorkHistory(int capacity, double jankCheckTimeFactor) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.capacity = capacity;
        this.jankCheckTimeFactor = jankCheckTimeFactor;
        this.records = new CycleRecord[capacity];
    }

    public void add(List<WorkDuration> durations, long targetNanos) {
        long missedThresholdUs = (long) (targetNanos / 1000 * jankCheckTimeFactor);
        for (WorkDuration duration : durations) {
            int durationUs = toMicros(duration.durationNanos());

            if (numFrames >= capacity) {
                evictOldest();
            }

            latestIndex = (latestIndex + 1) % capacity;

            long startNanos = duration.timeStampNanos() - duration.durationNanos();
            int startIntervalUs = numFrames > 0 ? toMicros(startNanos - lastStartNanos) : 0;
            lastStartNanos = startNanos;

            boolean missed = durationUs > missedThresholdUs;
            records[latestIndex] = new CycleRecord(startIntervalUs, durationUs, missed);
            numFrames++;
            if (missed) {
                missedCycles++;
            }

            while (!maxIndexes.isEmpty() && records[maxIndexes.peekLast()].durationUs() <= durationUs) {
                maxIndexes.pollLast();
            }
            maxIndexes.addLast(latestIndex);

            sumDurationsUs += durationUs;
        }
    }

    private static int toMicros(long nanos) {
        long micros = nanos / 1000;
        return (int) Math.max(Integer.MIN_VALUE, Math.min(Integer.MAX_VALUE, micros));
    }

    private void evictOldest() {
        int evicted = (latestIndex + 1) % capacity;
        CycleRecord oldest = records[evicted];
        sumDurationsUs -= oldest.durationUs();
        if (oldest.missed()) {
            missedCycles--;
        }
        numFrames--;
        if (!maxIndexes.isEmpty() && maxIndexes.peekFirst() == evicted) {
            maxIndexes.pollFirst();
        }
    }

    /**
     * Longest live cycle in microseconds.
     */
    public OptionalInt maxDurationUs() {
        if (maxIndexes.isEmpty()) {
            return OptionalInt.empty();
        }
        return OptionalInt.of(records[maxIndexes.peekFirst()].durationUs());
    }

    /**
     * Mean of the live cycles in microseconds, rounded down.
     */
    public OptionalInt avgDurationUs() {
        if (numFrames <= 0) {
            return OptionalInt.empty();
        }
        return OptionalInt.of((int) (sumDurationsUs / numFrames));
    }

    public int size() {
        return numFrames;
    }

    public int missedCycles() {
        return missedCycles;
    }

    /**
     * True when each of the last three cycles started at least one frame
     * period (at {@code fpsThreshold}) after the previous one.
     */
    public boolean isLowFrameRate(int fpsThreshold) {
        if (numFrames < 3 || fpsThreshold <= 0) {
            return false;
        }
        double cycleThresholdUs = 1_000_000.0 / fpsThreshold;
        int i1 = latestIndex;
        int i2 = i1 == 0 ? capacity - 1 : i1 - 1;
        int i3 = i2 == 0 ? capacity - 1 : i2 - 1;
        return records[i1].startIntervalUs() >= cycleThresholdUs
                && records[i2].startIntervalUs() >= cycleThresholdUs
                && records[i3].startIntervalUs() >= cycleThresholdUs;
    }
}
