package hintvote.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import hintvote.coordinator.model.HintResult;

/**
 * Generic response for session operations.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OperationResponse(
        @JsonProperty("ok") boolean ok,
        @JsonProperty("result") String result,
        @JsonProperty("error") String error) {

    /** Success response */
    public static OperationResponse success() {
        return new OperationResponse(true, HintResult.OK.name(), null);
    }

    /** Error response */
    public static OperationResponse error(String error) {
        return new OperationResponse(false, null, error);
    }

    public static OperationResponse from(HintResult result) {
        return switch (result) {
            case OK -> success();
            case NOT_FOUND -> new OperationResponse(false, result.name(), "session not found");
            case ILLEGAL_STATE -> new OperationResponse(false, result.name(), "illegal session state");
            case ILLEGAL_ARGUMENT -> new OperationResponse(false, result.name(), "illegal argument");
        };
    }
}
