package hintvote.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import hintvote.coordinator.model.SessionMode;

/**
 * Request DTO for toggling a session mode.
 * POST /api/v1/sessions/{id}/modes
 */
public record SetModeRequest(
        @JsonProperty("mode") String mode,
        @JsonProperty("enabled") boolean enabled) {

    public void validate() {
        toMode();
    }

    public SessionMode toMode() {
        if (mode == null || mode.isBlank()) {
            throw new IllegalArgumentException("mode is required");
        }
        try {
            return SessionMode.valueOf(mode.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown mode: " + mode);
        }
    }
}
