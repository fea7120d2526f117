package hintvote.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Request DTO for replacing a session's threads.
 * POST /api/v1/sessions/{id}/threads
 */
public record SetThreadsRequest(
        @JsonProperty("threadIds") List<Integer> threadIds) {

    public void validate() {
        if (threadIds == null || threadIds.isEmpty()) {
            throw new IllegalArgumentException("threadIds is required");
        }
        for (Integer tid : threadIds) {
            if (tid == null || tid <= 0) {
                throw new IllegalArgumentException("threadIds must be positive");
            }
        }
    }
}
