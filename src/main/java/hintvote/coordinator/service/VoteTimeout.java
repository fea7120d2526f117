package hintvote.coordinator.service;

import hintvote.coordinator.model.VoteSlot;

/**
 * Timer payload: re-check one slot of one session when its window should have closed.
 */
public record VoteTimeout(long sessionId, VoteSlot slot) {
}
