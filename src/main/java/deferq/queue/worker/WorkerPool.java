package deferq.queue.worker;

import deferq.queue.config.QueueConfig;
import deferq.queue.service.JobService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Runs several job workers in one process, one thread each, all polling the
 * same queue. Workers coordinate only through the job row locks, exactly as
 * separate processes do.
 */
public class WorkerPool implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(WorkerPool.class);

    private final JobService jobService;
    private final JobRunner runner;
    private final QueueConfig config;
    private final Consumer<String> output;
    private final List<JobWorker> workers = new ArrayList<>();

    private ExecutorService executor;
    private volatile boolean running = false;

    public WorkerPool(JobService jobService, JobRunner runner, QueueConfig config, Consumer<String> output) {
        this.jobService = jobService;
        this.runner = runner;
        this.config = config;
        this.output = output;
    }

    /**
     * Start the configured number of workers on the configured queue.
     */
    public synchronized void start() {
        if (running) {
            log.warn("Worker pool already running");
            return;
        }

        int count = Math.max(1, config.workerCount());
        AtomicInteger index = new AtomicInteger(1);
        executor = Executors.newFixedThreadPool(count, r -> {
            Thread t = new Thread(r, "deferq-worker-" + index.getAndIncrement());
            t.setDaemon(true);
            return t;
        });

        for (int i = 0; i < count; i++) {
            JobWorker worker = new JobWorker(jobService, runner, config.idleSleep(),
                    config.workerQueue(), null, output);
            workers.add(worker);
            executor.submit(worker);
        }

        running = true;
        log.info("Worker pool started with {} workers on queue {}", count, config.workerQueue());
    }

    /**
     * Stop the workers gracefully: each finishes its current job.
     */
    public synchronized void stop() {
        if (!running) {
            return;
        }

        running = false;
        workers.forEach(JobWorker::stop);
        executor.shutdown();

        try {
            long waitMs = Math.max(config.shutdownTimeout().toMillis(), config.idleSleep().toMillis() * 2);
            if (!executor.awaitTermination(waitMs, TimeUnit.MILLISECONDS)) {
                executor.shutdownNow();
                log.warn("Worker pool forcefully stopped");
            } else {
                log.info("Worker pool stopped gracefully");
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        workers.clear();
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running;
    }

    public int size() {
        return workers.size();
    }
}
