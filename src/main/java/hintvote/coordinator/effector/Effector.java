package hintvote.coordinator.effector;

/**
 * Applies arbitration results to the operating system.
 * This is the only place hardware or OS specifics enter; the coordinator
 * just computes the values.
 *
 * <p>
 * Implementations are called outside the registry lock and may be invoked
 * concurrently from client threads and scheduler workers.
 */
public interface Effector {

    /**
     * Apply a clamp envelope to one thread.
     *
     * @return {@link ApplyResult#NOT_FOUND} when the thread has gone away
     */
    ApplyResult applyEnvelope(int resourceId, int lower, int upper);

    /**
     * Apply the system-wide capacity request, the maximum across sessions.
     */
    ApplyResult applyCapacity(int magnitude);

    /**
     * Called once when a thread gains its first owning session.
     */
    void attachResource(int resourceId);

    /**
     * Called once when a thread loses its last owning session.
     * The thread should return to its unconstrained default.
     */
    void resetResource(int resourceId);

    /**
     * Toggle the coarse system-wide boost. It is enabled while no app session is active.
     */
    void setSystemBoost(boolean enabled);
}
