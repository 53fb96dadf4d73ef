package deferq.queue.repository;

import deferq.queue.model.Job;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for Job persistence.
 * Implementations can use JDBC, JPA, or in-memory storage.
 */
public interface JobRepository {

    /**
     * Store a new job.
     *
     * @param job the job to store, without id
     * @return the stored job with the id assigned by storage
     */
    Job create(Job job);

    /**
     * Find a job by ID.
     *
     * @param jobId the job ID
     * @return the job if found
     */
    Optional<Job> findById(long jobId);

    /**
     * Get all jobs ordered by id.
     */
    List<Job> findAll();

    /**
     * Count all jobs.
     */
    long count();

    /**
     * Count the jobs whose last run failed.
     */
    long countFailed();

    /**
     * Find the most overdue job eligible for execution.
     *
     * @param queue         the queue name, or "all" for every queue
     * @param now           jobs with perform_at after this instant are not eligible
     * @param lockedBefore  locks taken at or before this instant are considered stale
     * @param maxAttempts   one-shot jobs with more attempts are abandoned
     * @return id of the job with the smallest perform_at
     */
    Optional<Long> findNextJobId(String queue, Instant now, Instant lockedBefore, int maxAttempts);

    /**
     * Atomically lock a job: sets locked_at only if the job is not locked,
     * or if its lock was taken at or before {@code lockedBefore}.
     *
     * @return true if this caller won the lock
     */
    boolean lock(long jobId, Instant lockedAt, Instant lockedBefore);

    /**
     * Clear the lock of a job.
     *
     * @return true if a row changed
     */
    boolean unlock(long jobId);

    /**
     * Persist the scheduling state of a job: perform_at, number_attempts,
     * failed_at and last_error.
     *
     * @return true if updated
     */
    boolean update(Job job);

    /**
     * Delete a job.
     *
     * @return true if deleted
     */
    boolean delete(long jobId);
}
