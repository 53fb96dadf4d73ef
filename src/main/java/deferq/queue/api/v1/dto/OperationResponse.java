package deferq.queue.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Generic response for job actions (unlock, unfail, run).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OperationResponse(
        @JsonProperty("ok") boolean ok,
        @JsonProperty("message") String message,
        @JsonProperty("error") String error) {

    public static OperationResponse success(String message) {
        return new OperationResponse(true, message, null);
    }

    public static OperationResponse error(String error) {
        return new OperationResponse(false, null, error);
    }

    public static OperationResponse jobNotFound(long jobId) {
        return error("Job " + jobId + " does not exist.");
    }
}
