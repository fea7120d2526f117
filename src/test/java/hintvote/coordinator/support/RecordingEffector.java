package hintvote.coordinator.support;

import hintvote.coordinator.effector.ApplyResult;
import hintvote.coordinator.effector.Effector;
import hintvote.coordinator.model.ClampRange;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Effector that remembers what it was asked to do.
 * Threads marked gone answer {@link ApplyResult#NOT_FOUND}, failing ones
 * {@link ApplyResult#ERROR}.
 */
public final class RecordingEffector implements Effector {

    private final Map<Integer, ClampRange> envelopes = new HashMap<>();
    private final List<Integer> capacities = new ArrayList<>();
    private final List<Integer> attached = new ArrayList<>();
    private final List<Integer> reset = new ArrayList<>();
    private final List<Boolean> boosts = new ArrayList<>();
    private final Set<Integer> gone = new HashSet<>();
    private final Set<Integer> failing = new HashSet<>();
    private int envelopeCalls;

    @Override
    public synchronized ApplyResult applyEnvelope(int resourceId, int lower, int upper) {
        envelopeCalls++;
        if (gone.contains(resourceId)) {
            return ApplyResult.NOT_FOUND;
        }
        if (failing.contains(resourceId)) {
            return ApplyResult.ERROR;
        }
        envelopes.put(resourceId, new ClampRange(lower, upper));
        return ApplyResult.OK;
    }

    @Override
    public synchronized ApplyResult applyCapacity(int magnitude) {
        capacities.add(magnitude);
        return ApplyResult.OK;
    }

    @Override
    public synchronized void attachResource(int resourceId) {
        attached.add(resourceId);
    }

    @Override
    public synchronized void resetResource(int resourceId) {
        reset.add(resourceId);
        envelopes.remove(resourceId);
    }

    @Override
    public synchronized void setSystemBoost(boolean enabled) {
        boosts.add(enabled);
    }

    public synchronized void markGone(int resourceId) {
        gone.add(resourceId);
    }

    public synchronized void setFailing(int resourceId, boolean failing) {
        if (failing) {
            this.failing.add(resourceId);
        } else {
            this.failing.remove(resourceId);
        }
    }

    /** Last envelope applied to a thread, or null if none or it was reset */
    public synchronized ClampRange envelope(int resourceId) {
        return envelopes.get(resourceId);
    }

    public synchronized Integer lastCapacity() {
        return capacities.isEmpty() ? null : capacities.get(capacities.size() - 1);
    }

    public synchronized Boolean lastBoost() {
        return boosts.isEmpty() ? null : boosts.get(boosts.size() - 1);
    }

    public synchronized List<Integer> attached() {
        return List.copyOf(attached);
    }

    public synchronized List<Integer> reset() {
        return List.copyOf(reset);
    }

    public synchronized int envelopeCalls() {
        return envelopeCalls;
    }
}
