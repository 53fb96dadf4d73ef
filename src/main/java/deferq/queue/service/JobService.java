package deferq.queue.service;

import deferq.queue.config.QueueConfig;
import deferq.queue.model.Frequency;
import deferq.queue.model.Job;
import deferq.queue.model.UnfailResult;
import deferq.queue.model.UnlockResult;
import deferq.queue.repository.JobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Service layer for job operations: enqueueing, eligibility and the
 * administrative actions (list, show, unlock, unfail).
 */
public class JobService {

    private static final Logger log = LoggerFactory.getLogger(JobService.class);

    private final JobRepository jobRepository;
    private final JobLockManager lockManager;
    private final QueueConfig config;
    private final Clock clock;

    public JobService(JobRepository jobRepository, JobLockManager lockManager, QueueConfig config, Clock clock) {
        this.jobRepository = jobRepository;
        this.lockManager = lockManager;
        this.config = config;
        this.clock = clock;
    }

    /**
     * Store a job to be executed by a worker as soon as possible.
     */
    public Job performAsap(String name, String queue, String frequency, List<?> args) {
        return performLater(clock.instant(), name, queue, frequency, args);
    }

    /**
     * Store a job to be executed by a worker at the given time.
     *
     * @param queue     null for the default queue
     * @param frequency null or empty for a one-shot job
     */
    public Job performLater(Instant performAt, String name, String queue, String frequency, List<?> args) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name is required");
        }
        if (performAt == null) {
            throw new IllegalArgumentException("performAt is required");
        }
        if (queue != null && (queue.isBlank() || Job.ALL_QUEUES.equals(queue))) {
            throw new IllegalArgumentException("invalid queue name: '" + queue + "'");
        }
        if (frequency != null && !frequency.isBlank()) {
            Frequency.parse(frequency);
        }

        Instant now = clock.instant();
        Job job = jobRepository.create(Job.builder()
                .name(name)
                .queue(queue != null ? queue : Job.DEFAULT_QUEUE)
                .frequency(frequency)
                .args(args)
                .performAt(performAt)
                .createdAt(now)
                .updatedAt(now)
                .build());

        log.info("Job #{} ({}) enqueued in {} for {}", job.id(), job.name(), job.queue(), job.performAt());
        return job;
    }

    /**
     * Id of the most overdue eligible job of a queue ("all" for any queue).
     * Read-only: another worker may pick the same id, the lock decides.
     */
    public Optional<Long> findNextJobId(String queue) {
        Instant now = clock.instant();
        return jobRepository.findNextJobId(queue, now, now.minus(config.lockTimeout()), config.maxAttempts());
    }

    /**
     * All jobs, ordered by id.
     */
    public List<Job> list() {
        return jobRepository.findAll();
    }

    public long count() {
        return jobRepository.count();
    }

    public long countFailed() {
        return jobRepository.countFailed();
    }

    public Optional<Job> show(long jobId) {
        return jobRepository.findById(jobId);
    }

    /**
     * Whether a job is currently held by a worker.
     */
    public boolean isLocked(Job job) {
        return lockManager.isLocked(job);
    }

    /**
     * Release the lock of a job, for instance after its worker crashed.
     */
    public UnlockResult unlock(long jobId) {
        Optional<Job> jobOpt = jobRepository.findById(jobId);
        if (jobOpt.isEmpty()) {
            return UnlockResult.NOT_FOUND;
        }

        Job job = jobOpt.get();
        if (!lockManager.isLocked(job)) {
            return UnlockResult.NOT_LOCKED;
        }

        lockManager.unlock(job);
        log.info("Job #{} lock released by hand", jobId);
        return UnlockResult.UNLOCKED;
    }

    /**
     * Discard the error of a job. Neither perform_at nor number_attempts
     * change.
     */
    public UnfailResult unfail(long jobId) {
        Optional<Job> jobOpt = jobRepository.findById(jobId);
        if (jobOpt.isEmpty()) {
            return UnfailResult.notFound();
        }

        Job job = jobOpt.get();
        if (!job.hasFailed()) {
            return UnfailResult.notFailed();
        }

        jobRepository.update(job.toBuilder()
                .lastError("")
                .failedAt(null)
                .updatedAt(clock.instant())
                .build());

        log.info("Job #{} is no longer failing", jobId);
        return UnfailResult.unfailed(job.lastError());
    }
}
