package hintvote.coordinator.api.v1;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.netty.handler.codec.http.HttpResponseStatus;
import hintvote.coordinator.api.Controller.ControllerResponse;
import hintvote.coordinator.api.v1.dto.OperationResponse;
import hintvote.coordinator.model.HintResult;
import hintvote.coordinator.server.RouterHandler;

/**
 * Maps session operation results onto HTTP responses.
 */
final class HintResponses {

    private HintResponses() {
    }

    static ControllerResponse of(HintResult result) throws JsonProcessingException {
        HttpResponseStatus status = switch (result) {
            case OK -> HttpResponseStatus.OK;
            case NOT_FOUND -> HttpResponseStatus.NOT_FOUND;
            case ILLEGAL_STATE -> HttpResponseStatus.CONFLICT;
            case ILLEGAL_ARGUMENT -> HttpResponseStatus.BAD_REQUEST;
        };
        return ControllerResponse.json(status,
                RouterHandler.mapper().writeValueAsString(OperationResponse.from(result)));
    }

    static long parseSessionId(String raw) {
        try {
            return Long.parseLong(raw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid session id: " + raw);
        }
    }
}
