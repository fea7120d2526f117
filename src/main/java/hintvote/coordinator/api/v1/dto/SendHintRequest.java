package hintvote.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import hintvote.coordinator.model.SessionHint;

/**
 * Request DTO for a one-shot hint.
 * POST /api/v1/sessions/{id}/hints
 */
public record SendHintRequest(
        @JsonProperty("hint") String hint) {

    public void validate() {
        toHint();
    }

    public SessionHint toHint() {
        if (hint == null || hint.isBlank()) {
            throw new IllegalArgumentException("hint is required");
        }
        try {
            return SessionHint.valueOf(hint.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown hint: " + hint);
        }
    }
}
