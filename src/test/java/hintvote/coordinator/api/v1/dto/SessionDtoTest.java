package hintvote.coordinator.api.v1.dto;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import hintvote.coordinator.model.HintResult;
import hintvote.coordinator.model.SessionHint;
import hintvote.coordinator.model.SessionTag;
import hintvote.coordinator.model.VoteSlot;
import hintvote.coordinator.model.WorkDuration;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SessionDtoTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void deserializeCreateSession() throws Exception {
        String json = """
                {
                  "tgid": 1200,
                  "uid": 10042,
                  "threadIds": [1201, 1202],
                  "targetDurationNanos": 16666666,
                  "tag": "game"
                }
                """;

        CreateSessionRequest req = mapper.readValue(json, CreateSessionRequest.class);
        req.validate();

        assertEquals(List.of(1201, 1202), req.threadIds());
        assertEquals(SessionTag.GAME, req.sessionTag());
        assertEquals(1200, req.toDescriptor().tgid());
        assertEquals(10042, req.toDescriptor().uid());
    }

    @Test
    void createSessionValidation() {
        assertThrows(IllegalArgumentException.class,
                () -> new CreateSessionRequest(1, 1, List.of(), 10, null).validate());
        assertThrows(IllegalArgumentException.class,
                () -> new CreateSessionRequest(0, 1, List.of(2), 10, null).validate());
        assertThrows(IllegalArgumentException.class,
                () -> new CreateSessionRequest(1, 1, List.of(2), -1, null).validate());
        assertThrows(IllegalArgumentException.class, () -> new CreateSessionRequest(
                1, 1, List.of(2), WorkDuration.MAX_NANOS + 1, null).validate());
        assertThrows(IllegalArgumentException.class,
                () -> new CreateSessionRequest(1, 1, List.of(2), 10, "browser").validate());

        assertEquals(SessionTag.OTHER, new CreateSessionRequest(1, 1, List.of(2), 10, null).sessionTag());
    }

    @Test
    void castVoteNeedsFieldsForItsKind() {
        new CastVoteRequest("cpu_load_up", 100, 1024, null, 1_000).validate();
        new CastVoteRequest("GPU_CAPACITY", null, null, 300, 1_000).validate();

        assertThrows(IllegalArgumentException.class,
                () -> new CastVoteRequest("CPU_LOAD_UP", null, 1024, null, 1_000).validate());
        assertThrows(IllegalArgumentException.class,
                () -> new CastVoteRequest("GPU_CAPACITY", 1, 2, null, 1_000).validate());
        assertThrows(IllegalArgumentException.class,
                () -> new CastVoteRequest("CPU_DEFAULT", 1, 2, null, 0).validate());
        assertThrows(IllegalArgumentException.class,
                () -> new CastVoteRequest("NOPE", 1, 2, null, 10).validate());

        assertEquals(VoteSlot.CPU_LOAD_UP, new CastVoteRequest(" cpu_load_up ", 1, 2, null, 1).toSlot());
    }

    @Test
    void reportDurationsConvertInOrder() throws Exception {
        String json = """
                {"durations": [
                  {"timeStampNanos": 1000, "durationNanos": 300},
                  {"timeStampNanos": 2000, "durationNanos": 400}
                ]}
                """;

        ReportDurationsRequest req = mapper.readValue(json, ReportDurationsRequest.class);
        req.validate();

        assertEquals(List.of(new WorkDuration(1000, 300), new WorkDuration(2000, 400)), req.toWorkDurations());
        assertThrows(IllegalArgumentException.class,
                () -> new ReportDurationsRequest(List.of(new ReportDurationsRequest.Entry(1, -1))).validate());
        assertThrows(IllegalArgumentException.class, () -> new ReportDurationsRequest(
                List.of(new ReportDurationsRequest.Entry(1, WorkDuration.MAX_NANOS + 1))).validate());
        assertThrows(IllegalArgumentException.class, () -> new ReportDurationsRequest(null).validate());
    }

    @Test
    void hintAndModeParsing() {
        assertEquals(SessionHint.CPU_LOAD_RESET, new SendHintRequest("cpu_load_reset").toHint());
        assertThrows(IllegalArgumentException.class, () -> new SendHintRequest("faster").toHint());
        assertThrows(IllegalArgumentException.class, () -> new SetModeRequest(null, true).toMode());
        assertThrows(IllegalArgumentException.class, () -> new SendHintRequest(" ").validate());
        assertThrows(IllegalArgumentException.class, () -> new SetModeRequest("turbo", true).validate());
        assertThrows(IllegalArgumentException.class, () -> new SetThreadsRequest(List.of(0)).validate());
    }

    @Test
    void operationResponseSerialization() throws Exception {
        JsonNode ok = mapper.readTree(mapper.writeValueAsString(OperationResponse.from(HintResult.OK)));
        assertTrue(ok.get("ok").asBoolean());
        assertEquals("OK", ok.get("result").asText());
        assertFalse(ok.has("error"));

        JsonNode missing = mapper.readTree(mapper.writeValueAsString(OperationResponse.from(HintResult.NOT_FOUND)));
        assertFalse(missing.get("ok").asBoolean());
        assertEquals("NOT_FOUND", missing.get("result").asText());
        assertEquals("session not found", missing.get("error").asText());
    }

    @Test
    void unhealthyResponseOmitsCounters() throws Exception {
        JsonNode node = mapper.readTree(mapper.writeValueAsString(HealthResponse.unhealthy("stopped")));

        assertEquals("unhealthy", node.get("status").asText());
        assertEquals("stopped", node.get("scheduler").asText());
        assertFalse(node.has("sessions"));
    }
}
