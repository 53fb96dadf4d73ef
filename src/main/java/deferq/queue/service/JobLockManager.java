package deferq.queue.service;

import deferq.queue.model.Job;
import deferq.queue.repository.JobRepository;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Timeout-based mutual exclusion over a single job row.
 *
 * The lock is one conditional UPDATE evaluated by the database, never a
 * read-then-write from the application. A lock older than the timeout is
 * treated as abandoned and can be taken over.
 */
public class JobLockManager {

    private final JobRepository jobRepository;
    private final Clock clock;
    private final Duration defaultTimeout;

    public JobLockManager(JobRepository jobRepository, Clock clock, Duration defaultTimeout) {
        this.jobRepository = jobRepository;
        this.clock = clock;
        this.defaultTimeout = defaultTimeout;
    }

    /**
     * Try to lock the job with the default timeout.
     *
     * @return the job with its new locked_at, or empty if another worker holds it
     */
    public Optional<Job> lock(Job job) {
        return lock(job, defaultTimeout);
    }

    public Optional<Job> lock(Job job, Duration timeout) {
        Instant now = clock.instant();
        if (!jobRepository.lock(requireId(job), now, now.minus(timeout))) {
            return Optional.empty();
        }
        return Optional.of(job.toBuilder().lockedAt(now).build());
    }

    /**
     * Release the lock, whoever holds it.
     *
     * @return true if the row changed
     */
    public boolean unlock(Job job) {
        return jobRepository.unlock(requireId(job));
    }

    public boolean isLocked(Job job) {
        return isLocked(job, defaultTimeout);
    }

    public boolean isLocked(Job job, Duration timeout) {
        return job.isLocked(clock.instant(), timeout);
    }

    public Duration defaultTimeout() {
        return defaultTimeout;
    }

    private static long requireId(Job job) {
        if (job.id() == null) {
            throw new IllegalArgumentException("Job must be stored before it can be locked");
        }
        return job.id();
    }
}
