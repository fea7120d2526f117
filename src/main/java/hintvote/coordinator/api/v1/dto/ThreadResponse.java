package hintvote.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import hintvote.coordinator.model.ClampRange;

import java.util.List;

/**
 * Response DTO for a thread's current envelope.
 * GET /api/v1/threads/{tid}
 */
public record ThreadResponse(
        @JsonProperty("tid") int tid,
        @JsonProperty("owners") List<Long> owners,
        @JsonProperty("lower") int lower,
        @JsonProperty("upper") int upper) {

    public static ThreadResponse from(int tid, List<Long> owners, ClampRange envelope) {
        return new ThreadResponse(tid, owners, envelope.lower(), envelope.upper());
    }
}
