package hintvote.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import hintvote.coordinator.model.SessionDescriptor;
import hintvote.coordinator.model.SessionTag;
import hintvote.coordinator.model.WorkDuration;

import java.util.List;

/**
 * Request DTO for opening a session.
 * POST /api/v1/sessions
 */
public record CreateSessionRequest(
        @JsonProperty("tgid") int tgid,
        @JsonProperty("uid") int uid,
        @JsonProperty("threadIds") List<Integer> threadIds,
        @JsonProperty("targetDurationNanos") long targetDurationNanos,
        @JsonProperty("tag") String tag) {

    public void validate() {
        if (tgid <= 0) {
            throw new IllegalArgumentException("tgid must be positive");
        }
        if (uid < 0) {
            throw new IllegalArgumentException("uid must be non-negative");
        }
        if (threadIds == null || threadIds.isEmpty()) {
            throw new IllegalArgumentException("threadIds is required");
        }
        for (Integer tid : threadIds) {
            if (tid == null || tid <= 0) {
                throw new IllegalArgumentException("threadIds must be positive");
            }
        }
        if (!WorkDuration.isAcceptable(targetDurationNanos)) {
            throw new IllegalArgumentException("targetDurationNanos must be in [0, " + WorkDuration.MAX_NANOS + "]");
        }
        sessionTag();
    }

    /**
     * Parsed tag, {@link SessionTag#OTHER} when absent.
     */
    public SessionTag sessionTag() {
        if (tag == null || tag.isBlank()) {
            return SessionTag.OTHER;
        }
        try {
            return SessionTag.valueOf(tag.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown tag: " + tag);
        }
    }

    public SessionDescriptor toDescriptor() {
        return new SessionDescriptor(tgid, uid, sessionTag());
    }
}
