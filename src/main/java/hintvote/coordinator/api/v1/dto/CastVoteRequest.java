package hintvote.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import hintvote.coordinator.model.VoteSlot;

/**
 * Request DTO for casting a vote directly.
 * POST /api/v1/sessions/{id}/votes
 *
 * Range slots use lower/upper, the capacity slot uses magnitude.
 */
public record CastVoteRequest(
        @JsonProperty("slot") String slot,
        @JsonProperty("lower") Integer lower,
        @JsonProperty("upper") Integer upper,
        @JsonProperty("magnitude") Integer magnitude,
        @JsonProperty("durationNanos") long durationNanos) {

    public void validate() {
        VoteSlot voteSlot = toSlot();
        if (durationNanos <= 0) {
            throw new IllegalArgumentException("durationNanos must be positive");
        }
        switch (voteSlot.kind()) {
            case RANGE -> {
                if (lower == null || upper == null) {
                    throw new IllegalArgumentException("lower and upper are required for " + voteSlot);
                }
            }
            case CAPACITY -> {
                if (magnitude == null) {
                    throw new IllegalArgumentException("magnitude is required for " + voteSlot);
                }
            }
        }
    }

    public VoteSlot toSlot() {
        if (slot == null || slot.isBlank()) {
            throw new IllegalArgumentException("slot is required");
        }
        try {
            return VoteSlot.valueOf(slot.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown slot: " + slot);
        }
    }
}
