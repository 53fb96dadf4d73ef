package deferq.queue.worker;

import deferq.queue.config.QueueConfig;
import deferq.queue.model.Job;
import deferq.queue.model.JobConfigurationException;
import deferq.queue.model.JobRunReport;
import deferq.queue.model.JobRunStatus;
import deferq.queue.repository.JobRepository;
import deferq.queue.service.JobLockManager;
import deferq.queue.service.JobScheduler;
import deferq.queue.service.JobService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.Optional;

/**
 * Executes exactly one job end-to-end: lock, invoke, record the outcome,
 * then unlock or delete.
 *
 * Anything thrown by the handler, {@link Error}s included, never escapes: it
 * becomes a failure recorded on the job. Only a {@link JobConfigurationException} (a frequency that
 * cannot be applied) is re-thrown. The job then keeps its lock, so it is
 * retried once the lock goes stale instead of on every poll.
 */
public class JobRunner {

    private static final Logger log = LoggerFactory.getLogger(JobRunner.class);

    private final JobRepository jobRepository;
    private final JobLockManager lockManager;
    private final JobScheduler scheduler;
    private final JobHandlerRegistry handlers;
    private final JobService jobService;
    private final QueueConfig config;

    public JobRunner(JobRepository jobRepository,
            JobLockManager lockManager,
            JobScheduler scheduler,
            JobHandlerRegistry handlers,
            JobService jobService,
            QueueConfig config) {
        this.jobRepository = jobRepository;
        this.lockManager = lockManager;
        this.scheduler = scheduler;
        this.handlers = handlers;
        this.jobService = jobService;
        this.config = config;
    }

    /**
     * Run the given job, even if it is not its time yet.
     */
    public JobRunReport run(long jobId) {
        Optional<Job> found = jobRepository.findById(jobId);
        if (found.isEmpty()) {
            log.warn("Job {} does not exist", jobId);
            return JobRunReport.notFound(jobId);
        }

        Optional<Job> locked = lockManager.lock(found.get());
        if (locked.isEmpty()) {
            log.info("Job {} is locked by another worker", jobId);
            return JobRunReport.locked(found.get());
        }

        Job job = locked.get();
        long start = System.nanoTime();
        log.debug("Running job #{} ({}) with {} args", job.id(), job.name(), job.args().size());

        Throwable error = null;
        try {
            handlers.resolve(job.name()).perform(new JobContext(job, config, jobService), job.args());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            error = e;
        } catch (Throwable e) {
            // errors from handler code (AssertionError, StackOverflowError...) are failures too
            error = e;
        }

        JobRunStatus status;
        if (error == null) {
            onSuccess(job);
            status = JobRunStatus.DONE;
        } else {
            log.warn("Job #{} ({}) failed: {}", job.id(), job.name(), error.getMessage(), error);
            onFailure(job, error);
            status = JobRunStatus.FAILED;
        }

        double elapsed = (System.nanoTime() - start) / 1_000_000_000.0;
        JobRunReport report = new JobRunReport(job.id(), job.name(), status, elapsed);
        log.debug("{}", report.statusLine());
        return report;
    }

    private void onSuccess(Job job) {
        if (!job.isRecurring()) {
            jobRepository.delete(job.id());
            return;
        }

        try {
            jobRepository.update(scheduler.reschedule(job));
        } catch (JobConfigurationException e) {
            log.error("Job #{} ({}) cannot be rescheduled: {}", job.id(), job.name(), e.getMessage());
            throw e;
        }
        lockManager.unlock(job);
    }

    private void onFailure(Job job, Throwable error) {
        Job attempted = job.toBuilder()
                .numberAttempts(job.numberAttempts() + 1)
                .build();

        String description = describe(error);
        try {
            jobRepository.update(scheduler.fail(attempted, description));
        } catch (JobConfigurationException e) {
            log.error("Job #{} ({}) cannot be rescheduled: {}", job.id(), job.name(), e.getMessage());
            // keep the failure visible, perform_at stays where it was
            jobRepository.update(scheduler.markFailed(attempted, description));
            throw e;
        }
        lockManager.unlock(job);
    }

    private static String describe(Throwable error) {
        StringWriter out = new StringWriter();
        error.printStackTrace(new PrintWriter(out));
        return out.toString().stripTrailing();
    }
}
