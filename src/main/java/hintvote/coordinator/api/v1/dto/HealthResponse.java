package hintvote.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response DTO for health check.
 * GET /api/v1/health
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HealthResponse(
        @JsonProperty("status") String status,
        @JsonProperty("scheduler") String scheduler,
        @JsonProperty("uptime") String uptime,
        @JsonProperty("version") String version,
        @JsonProperty("sessions") Integer sessions,
        @JsonProperty("threads") Integer threads,
        @JsonProperty("pendingTimeouts") Integer pendingTimeouts) {

    public static HealthResponse healthy(String uptime, String version, int sessions, int threads,
            int pendingTimeouts) {
        return new HealthResponse("healthy", "running", uptime, version, sessions, threads, pendingTimeouts);
    }

    public static HealthResponse unhealthy(String scheduler) {
        return new HealthResponse("unhealthy", scheduler, null, null, null, null, null);
    }
}
