package hintvote.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import hintvote.coordinator.model.SessionSnapshot;
import hintvote.coordinator.model.VoteSnapshot;
import hintvote.coordinator.service.HintSession;

import java.util.List;

/**
 * Response DTO for session state.
 * GET /api/v1/sessions and GET /api/v1/sessions/{id}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SessionResponse(
        @JsonProperty("sessionId") long sessionId,
        @JsonProperty("idString") String idString,
        @JsonProperty("tgid") int tgid,
        @JsonProperty("uid") int uid,
        @JsonProperty("tag") String tag,
        @JsonProperty("active") boolean active,
        @JsonProperty("appSession") boolean appSession,
        @JsonProperty("powerEfficient") boolean powerEfficient,
        @JsonProperty("threadIds") List<Integer> threadIds,
        @JsonProperty("targetDurationNanos") Long targetDurationNanos,
        @JsonProperty("controlValue") Integer controlValue,
        @JsonProperty("heuristicBoost") Boolean heuristicBoost,
        @JsonProperty("votes") List<VoteSnapshot> votes) {

    /**
     * @param snapshot registry view
     * @param session  client handle, may be null when the session is not tracked by the service
     */
    public static SessionResponse from(SessionSnapshot snapshot, HintSession session) {
        return new SessionResponse(
                snapshot.id(),
                snapshot.idString(),
                snapshot.descriptor().tgid(),
                snapshot.descriptor().uid(),
                snapshot.descriptor().tag().name(),
                snapshot.active(),
                snapshot.appSession(),
                snapshot.powerEfficient(),
                snapshot.members(),
                session != null ? session.targetNanos() : null,
                session != null ? session.controlValue() : null,
                session != null ? session.heuristicBoostActive() : null,
                snapshot.votes());
    }
}
