package deferq.queue.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import deferq.queue.model.Frequency;

import java.time.Instant;
import java.util.List;

/**
 * Request DTO for enqueueing a job.
 * POST /api/v1/jobs
 *
 * performAt is optional: the job is then performed as soon as possible.
 */
public record CreateJobRequest(
        @JsonProperty("name") String name,
        @JsonProperty("queue") String queue,
        @JsonProperty("frequency") String frequency,
        @JsonProperty("performAt") Instant performAt,
        @JsonProperty("args") List<Object> args) {

    /** Arguments, never null */
    public List<Object> argsOrEmpty() {
        return args != null ? args : List.of();
    }

    /** Validate the request */
    public void validate() {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name is required");
        }
        if (queue != null && queue.isBlank()) {
            throw new IllegalArgumentException("queue must not be blank");
        }
        if (frequency != null && !frequency.isBlank()) {
            Frequency.parse(frequency);
        }
    }
}
