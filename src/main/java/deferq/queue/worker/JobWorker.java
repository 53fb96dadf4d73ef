package deferq.queue.worker;

import deferq.queue.model.JobRunReport;
import deferq.queue.model.JobRunStatus;
import deferq.queue.service.JobService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Job worker: polls a queue for the next eligible job and runs it, in a loop.
 * Sleeps when there is nothing to do.
 *
 * Stops after {@code stopAfter} iterations when bounded, when {@link #stop()}
 * is called (e.g. from a shutdown hook on SIGTERM), or when its thread is
 * interrupted. A failing job or a lost lock race never stops the loop.
 */
public final class JobWorker implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(JobWorker.class);

    private final JobService jobService;
    private final JobRunner runner;
    private final Duration idleSleep;
    private final String queue;
    private final Integer stopAfter;
    private final Consumer<String> output;

    private final CountDownLatch finished = new CountDownLatch(1);
    private volatile boolean watching = false;

    /**
     * @param queue     queue to poll, trailing digits are ignored ("fetchers2" polls "fetchers")
     * @param stopAfter number of iterations before stopping, null to run until stopped
     * @param output    receives the start/stop markers and one status line per job
     */
    public JobWorker(JobService jobService,
            JobRunner runner,
            Duration idleSleep,
            String queue,
            Integer stopAfter,
            Consumer<String> output) {
        if (stopAfter != null && stopAfter <= 0) {
            throw new IllegalArgumentException("stopAfter must be positive");
        }
        this.jobService = jobService;
        this.runner = runner;
        this.idleSleep = idleSleep;
        this.queue = normalizeQueue(queue);
        this.stopAfter = stopAfter;
        this.output = output;
    }

    /**
     * Strip the worker index from a queue name: "fetchers12" becomes
     * "fetchers". A name made only of digits is kept as is.
     */
    public static String normalizeQueue(String queue) {
        if (queue == null || queue.isBlank()) {
            return "all";
        }
        String base = queue.replaceFirst("\\d+$", "");
        return base.isEmpty() ? queue : base;
    }

    @Override
    public void run() {
        watch();
    }

    /**
     * Run the loop in the current thread. A worker watches once.
     *
     * @return number of iterations done
     */
    public int watch() {
        watching = true;
        output.accept("[Job worker (" + queue + ") started]");
        log.info("Job worker ({}) started", queue);

        int iterations = 0;
        try {
            while (watching && !Thread.currentThread().isInterrupted()) {
                boolean worked = false;
                try {
                    worked = iterate();
                } catch (VirtualMachineError e) {
                    log.error("Job worker ({}) cannot go on", queue, e);
                    throw e;
                } catch (Throwable e) {
                    log.error("Job worker ({}) error", queue, e);
                }

                iterations++;
                if (stopAfter != null && iterations >= stopAfter) {
                    break;
                }

                if (!worked && watching && !sleep()) {
                    break;
                }
            }
        } finally {
            watching = false;
            output.accept("[Job worker (" + queue + ") stopped]");
            log.info("Job worker ({}) stopped after {} iterations", queue, iterations);
            finished.countDown();
        }
        return iterations;
    }

    /**
     * Ask the loop to end after the current job.
     */
    public void stop() {
        watching = false;
    }

    /**
     * Ask the loop to end, then wait for the current job to finish.
     *
     * @return true if the loop ended within the timeout
     */
    public boolean stopAndAwait(Duration timeout) {
        stop();
        try {
            return finished.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    public boolean isWatching() {
        return watching;
    }

    public String queue() {
        return queue;
    }

    /**
     * @return true if a job was found
     */
    private boolean iterate() {
        Optional<Long> jobId = jobService.findNextJobId(queue);
        if (jobId.isEmpty()) {
            return false;
        }

        JobRunReport report = runner.run(jobId.get());
        if (report.status() == JobRunStatus.LOCKED) {
            // Another worker picked the same job between select and lock
            log.debug("Job {} taken by another worker", jobId.get());
        }
        output.accept(report.statusLine());
        return true;
    }

    /**
     * @return false if interrupted
     */
    private boolean sleep() {
        if (idleSleep.isZero() || idleSleep.isNegative()) {
            return true;
        }
        try {
            Thread.sleep(idleSleep.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
