package hintvote.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request DTO for changing the target duration.
 * POST /api/v1/sessions/{id}/target
 */
public record UpdateTargetRequest(
        @JsonProperty("targetDurationNanos") long targetDurationNanos) {
}
