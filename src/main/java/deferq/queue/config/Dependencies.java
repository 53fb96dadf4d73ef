package deferq.queue.config;

import deferq.queue.api.v1.HealthController;
import deferq.queue.api.v1.JobController;
import deferq.queue.repository.JobRepository;
import deferq.queue.server.QueueHttpServer;
import deferq.queue.server.RouterHandler;
import deferq.queue.service.JobFormatter;
import deferq.queue.service.JobLockManager;
import deferq.queue.service.JobScheduler;
import deferq.queue.service.JobService;
import deferq.queue.store.Database;
import deferq.queue.store.JdbcJobRepository;
import deferq.queue.worker.JobHandlerRegistry;
import deferq.queue.worker.JobRunner;
import deferq.queue.worker.JobWorker;
import deferq.queue.worker.WorkerPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.function.Consumer;

/**
 * Manual dependency injection container.
 * Creates and wires all service dependencies.
 *
 * Usage:
 *
 * <pre>
 * Dependencies deps = Dependencies.create(QueueConfig.fromEnv());
 * deps.handlers().register("SendEmail", (ctx, args) -> ...);
 * deps.jobService().performAsap("SendEmail", null, null, List.of("alix@example.com"));
 * deps.worker("mailers", null, System.out::println).watch();
 * deps.close();
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final QueueConfig config;
    private final Clock clock;
    private final Database database;
    private final JobRepository jobRepository;
    private final JobLockManager lockManager;
    private final JobScheduler scheduler;
    private final JobService jobService;
    private final JobFormatter formatter;
    private final JobHandlerRegistry handlers;
    private final JobRunner jobRunner;

    // Controllers
    private final HealthController healthController;
    private final JobController jobController;

    // Lazy-initialized
    private RouterHandler routerHandler;
    private WorkerPool workerPool;
    private QueueHttpServer httpServer;

    private Dependencies(QueueConfig config, Clock clock, JobHandlerRegistry handlers) {
        this.config = config;
        this.clock = clock;
        this.handlers = handlers;

        log.info("Initializing dependencies with config: {}", config);

        // Infrastructure
        this.database = new Database(config);

        // Repositories
        this.jobRepository = new JdbcJobRepository(database, RouterHandler.mapper());

        // Services
        this.lockManager = new JobLockManager(jobRepository, clock, config.lockTimeout());
        this.scheduler = new JobScheduler(clock, config.timezone());
        this.jobService = new JobService(jobRepository, lockManager, config, clock);
        this.formatter = new JobFormatter(clock, config.timezone(), config.lockTimeout());
        this.jobRunner = new JobRunner(jobRepository, lockManager, scheduler, handlers, jobService, config);

        // Controllers
        this.healthController = new HealthController(database, jobService);
        this.jobController = new JobController(jobService, jobRunner, formatter);

        log.info("Dependencies initialized successfully");
    }

    /**
     * Create dependencies with the given config, the system clock and the
     * handlers found on the class path.
     */
    public static Dependencies create(QueueConfig config) {
        return create(config, Clock.systemUTC(), JobHandlerRegistry.discover());
    }

    public static Dependencies create(QueueConfig config, Clock clock, JobHandlerRegistry handlers) {
        return new Dependencies(config, clock, handlers);
    }

    /**
     * Create dependencies with environment-based config.
     */
    public static Dependencies create() {
        return create(QueueConfig.fromEnv());
    }

    // Getters
    public QueueConfig config() {
        return config;
    }

    public Clock clock() {
        return clock;
    }

    public Database database() {
        return database;
    }

    public JobRepository jobRepository() {
        return jobRepository;
    }

    public JobLockManager lockManager() {
        return lockManager;
    }

    public JobScheduler scheduler() {
        return scheduler;
    }

    public JobService jobService() {
        return jobService;
    }

    public JobFormatter formatter() {
        return formatter;
    }

    public JobHandlerRegistry handlers() {
        return handlers;
    }

    public JobRunner jobRunner() {
        return jobRunner;
    }

    public HealthController healthController() {
        return healthController;
    }

    public JobController jobController() {
        return jobController;
    }

    /**
     * A new single worker, to be run in the calling thread with {@link JobWorker#watch()}.
     */
    public JobWorker worker(String queue, Integer stopAfter, Consumer<String> output) {
        return new JobWorker(jobService, jobRunner, config.idleSleep(), queue, stopAfter, output);
    }

    /**
     * Get a fully configured RouterHandler with all controllers registered.
     */
    public RouterHandler routerHandler() {
        if (routerHandler == null) {
            routerHandler = new RouterHandler()
                    .registerController(healthController)
                    .registerController(jobController);
            log.info("RouterHandler created with {} controllers", 2);
        }
        return routerHandler;
    }

    /**
     * Get the worker pool (creates it if not yet created).
     */
    public WorkerPool workerPool(Consumer<String> output) {
        if (workerPool == null) {
            workerPool = new WorkerPool(jobService, jobRunner, config, output);
        }
        return workerPool;
    }

    /**
     * Get the HTTP server (creates it if not yet created).
     */
    public QueueHttpServer httpServer() {
        if (httpServer == null) {
            httpServer = new QueueHttpServer(config.serverHost(), config.serverPort(), routerHandler());
        }
        return httpServer;
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");

        // Stop workers and server first
        if (workerPool != null) {
            try {
                workerPool.stop();
            } catch (Exception e) {
                log.warn("Error stopping worker pool: {}", e.getMessage());
            }
        }
        if (httpServer != null) {
            try {
                httpServer.stop();
            } catch (Exception e) {
                log.warn("Error stopping server: {}", e.getMessage());
            }
        }

        // Close database
        try {
            database.close();
        } catch (Exception e) {
            log.warn("Error closing database: {}", e.getMessage());
        }

        log.info("Dependencies closed");
    }
}
