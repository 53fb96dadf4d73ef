package deferq.queue.service;

import deferq.queue.model.Frequency;
import deferq.queue.model.Job;
import deferq.queue.model.JobConfigurationException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;

/**
 * Computes the next perform_at of a job after a success (recurring jobs)
 * or a failure (exponential backoff, or the recurrence of recurring jobs).
 *
 * Pure computation: returns updated copies, persisting them is up to the
 * caller.
 */
public class JobScheduler {

    /** Upper bound of catch-up steps for calendar units (days and longer). */
    static final int MAX_CATCH_UP_STEPS = 100_000;

    private final Clock clock;
    private final ZoneId zone;

    public JobScheduler(Clock clock, ZoneId zone) {
        this.clock = clock;
        this.zone = zone;
    }

    /**
     * Move a recurring job to its next slot strictly after now. Missed slots
     * are skipped. Jobs without frequency are returned unchanged.
     *
     * @throws JobConfigurationException if the frequency does not go forward
     */
    public Job reschedule(Job job) {
        if (!job.isRecurring()) {
            return job;
        }

        Instant now = clock.instant();
        return job.toBuilder()
                .performAt(nextPerformAt(job, now))
                .updatedAt(now)
                .build();
    }

    /**
     * Record a failure and compute the retry date. The caller increments
     * number_attempts before calling this.
     *
     * @throws JobConfigurationException if the job is recurring and its
     *                                   frequency does not go forward
     */
    public Job fail(Job job, String error) {
        Instant now = clock.instant();

        Instant performAt;
        if (job.isRecurring()) {
            performAt = nextPerformAt(job, now);
        } else {
            performAt = now.plus(backoffDelay(job.numberAttempts()));
        }

        return job.toBuilder()
                .lastError(error)
                .failedAt(now)
                .performAt(performAt)
                .updatedAt(now)
                .build();
    }

    /**
     * Record a failure without moving perform_at, for jobs whose next date
     * cannot be computed.
     */
    public Job markFailed(Job job, String error) {
        Instant now = clock.instant();
        return job.toBuilder()
                .lastError(error)
                .failedAt(now)
                .updatedAt(now)
                .build();
    }

    /**
     * Retry delay of a one-shot job: attempts^4 + 5 seconds.
     */
    public static Duration backoffDelay(int numberAttempts) {
        long n = numberAttempts;
        return Duration.ofSeconds(n * n * n * n + 5);
    }

    private Instant nextPerformAt(Job job, Instant now) {
        Frequency frequency = parseFrequency(job);
        Instant performAt = job.performAt();

        if (performAt.isAfter(now)) {
            return performAt;
        }

        if (frequency.isTimeBased()) {
            long elapsed = Duration.between(performAt, now).getSeconds();
            long steps = elapsed / frequency.stepSeconds() + 1;
            Instant next = frequency.addTo(performAt, zone, steps);
            // sub-second remainder
            while (!next.isAfter(now)) {
                steps++;
                next = frequency.addTo(performAt, zone, steps);
            }
            return next;
        }

        // Calendar units are applied from the stored perform_at so month ends do not drift
        for (long steps = 1; steps <= MAX_CATCH_UP_STEPS; steps++) {
            Instant next = frequency.addTo(performAt, zone, steps);
            if (next.isAfter(now)) {
                return next;
            }
        }

        throw new JobConfigurationException(job.name() + " cannot catch up with its frequency ("
                + job.frequency() + ") since " + performAt);
    }

    private static Frequency parseFrequency(Job job) {
        Frequency frequency;
        try {
            frequency = Frequency.parse(job.frequency());
        } catch (IllegalArgumentException e) {
            throw new JobConfigurationException(job.name() + " has an invalid frequency: " + job.frequency(), e);
        }

        if (!frequency.isForward()) {
            throw new JobConfigurationException(job.name() + " has a frequency going backward");
        }

        return frequency;
    }
}
