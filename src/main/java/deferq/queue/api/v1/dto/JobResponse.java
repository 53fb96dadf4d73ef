package deferq.queue.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import deferq.queue.model.Job;

import java.time.Instant;
import java.util.List;

/**
 * Response DTO for job details.
 * GET /api/v1/jobs and GET /api/v1/jobs/{id}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobResponse(
        @JsonProperty("id") long id,
        @JsonProperty("name") String name,
        @JsonProperty("queue") String queue,
        @JsonProperty("args") List<Object> args,
        @JsonProperty("performAt") Instant performAt,
        @JsonProperty("frequency") String frequency,
        @JsonProperty("numberAttempts") int numberAttempts,
        @JsonProperty("statuses") List<String> statuses,
        @JsonProperty("lockedAt") Instant lockedAt,
        @JsonProperty("failedAt") Instant failedAt,
        @JsonProperty("lastError") String lastError,
        @JsonProperty("createdAt") Instant createdAt,
        @JsonProperty("updatedAt") Instant updatedAt) {

    /**
     * Create response from domain model.
     *
     * @param statuses status annotations (locked, failed, scheduled)
     */
    public static JobResponse from(Job job, List<String> statuses) {
        return new JobResponse(
                job.id(),
                job.name(),
                job.queue(),
                job.args(),
                job.performAt(),
                job.isRecurring() ? job.frequency() : null,
                job.numberAttempts(),
                statuses,
                job.lockedAt(),
                job.failedAt(),
                job.hasFailed() ? job.lastError() : null,
                job.createdAt(),
                job.updatedAt());
    }

    /** Compact version for list responses, without the error trace */
    public JobResponse compact() {
        return new JobResponse(id, name, queue, args, performAt, frequency, numberAttempts, statuses,
                lockedAt, failedAt, null, createdAt, updatedAt);
    }
}
