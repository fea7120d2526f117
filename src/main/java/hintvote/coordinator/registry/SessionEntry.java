package hintvote.coordinator.registry;

import hintvote.coordinator.arbiter.VoteArbiter;
import hintvote.coordinator.model.SessionDescriptor;

import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Mutable per-session record held by {@link SessionRegistry}.
 * Every field is read and written under the registry monitor.
 */
public final class SessionEntry {
    private final long id;
    private final SessionDescriptor descriptor;
    private final boolean appSession;
    private final VoteArbiter arbiter;
    private final Set<Integer> members = new LinkedHashSet<>();
    private boolean active = true;
    private boolean powerEfficient;
    private long lastUpdatedNanos;

    public SessionEntry(long id, SessionDescriptor descriptor, boolean appSession, VoteArbiter arbiter) {
        this.id = id;
        this.descriptor = Objects.requireNonNull(descriptor, "descriptor is required");
        this.appSession = appSession;
        this.arbiter = Objects.requireNonNull(arbiter, "arbiter is required");
    }

    public long id() {
        return id;
    }

    public SessionDescriptor descriptor() {
        return descriptor;
    }

    public String idString() {
        return descriptor.idString(id);
    }

    public boolean appSession() {
        return appSession;
    }

    public VoteArbiter arbiter() {
        return arbiter;
    }

    public boolean active() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }

    public boolean powerEfficient() {
        return powerEfficient;
    }

    public void setPowerEfficient(boolean powerEfficient) {
        this.powerEfficient = powerEfficient;
    }

    public long lastUpdatedNanos() {
        return lastUpdatedNanos;
    }

    public void setLastUpdatedNanos(long lastUpdatedNanos) {
        this.lastUpdatedNanos = lastUpdatedNanos;
    }

    // Membership is owned by the registry so both index directions stay in step
    Set<Integer> members() {
        return members;
    }

    @Override
    public String toString() {
        return "SessionEntry{" + idString() + ", active=" + active + ", members=" + members + '}';
    }
}
