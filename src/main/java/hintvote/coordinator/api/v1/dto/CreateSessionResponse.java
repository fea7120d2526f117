package hintvote.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import hintvote.coordinator.service.HintSession;

/**
 * Response DTO for session creation.
 * POST /api/v1/sessions
 */
public record CreateSessionResponse(
        @JsonProperty("sessionId") long sessionId,
        @JsonProperty("idString") String idString) {

    public static CreateSessionResponse from(HintSession session) {
        return new CreateSessionResponse(session.sessionId(), session.idString());
    }
}
