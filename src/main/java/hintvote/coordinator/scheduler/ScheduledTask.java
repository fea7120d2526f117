package hintvote.coordinator.scheduler;

/**
 * Queue entry: fire {@code payloadId} on {@code streamId} no earlier than {@code deadlineNanos}.
 */
record ScheduledTask(long deadlineNanos, int streamId, long payloadId) {
}
