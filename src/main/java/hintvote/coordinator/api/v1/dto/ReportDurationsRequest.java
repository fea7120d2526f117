package hintvote.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import hintvote.coordinator.model.WorkDuration;

import java.util.List;

/**
 * Request DTO for reporting measured work durations.
 * POST /api/v1/sessions/{id}/durations
 */
public record ReportDurationsRequest(
        @JsonProperty("durations") List<Entry> durations) {

    public record Entry(
            @JsonProperty("timeStampNanos") long timeStampNanos,
            @JsonProperty("durationNanos") long durationNanos) {
    }

    public void validate() {
        if (durations == null) {
            throw new IllegalArgumentException("durations is required");
        }
        for (Entry entry : durations) {
            if (entry == null) {
                throw new IllegalArgumentException("durations must not contain null entries");
            }
            if (!WorkDuration.isAcceptable(entry.durationNanos())) {
                throw new IllegalArgumentException("durationNanos must be in [0, " + WorkDuration.MAX_NANOS + "]");
            }
        }
    }

    public List<WorkDuration> toWorkDurations() {
        return durations.stream()
                .map(e -> new WorkDuration(e.timeStampNanos(), e.durationNanos()))
                .toList();
    }
}
