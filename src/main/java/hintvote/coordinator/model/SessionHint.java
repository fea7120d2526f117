package hintvote.coordinator.model;

/**
 * One-shot hints a client can send to its session.
 */
public enum SessionHint {
    /** Workload is about to increase */
    CPU_LOAD_UP,
    /** Workload is about to decrease */
    CPU_LOAD_DOWN,
    /** Workload changed shape, restart from the initial control value */
    CPU_LOAD_RESET,
    /** Workload resumes after a pause */
    CPU_LOAD_RESUME,
    GPU_LOAD_UP,
    GPU_LOAD_DOWN,
    GPU_LOAD_RESET
}
