package deferq.queue.config;

import java.time.Duration;
import java.time.ZoneId;

/**
 * Configuration holder for the job queue.
 * All settings have sensible defaults.
 */
public final class QueueConfig {

    // Database settings
    private String databaseUrl = "jdbc:h2:file:./data/deferq;AUTO_SERVER=TRUE;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
    private int databasePoolSize = 10;

    // Server settings
    private int serverPort = 8080;
    private String serverHost = "0.0.0.0";

    // Queue settings
    private Duration lockTimeout = Duration.ofHours(1);
    private int maxAttempts = 25;
    private ZoneId timezone = ZoneId.systemDefault();

    // Worker settings
    private Duration idleSleep = Duration.ofSeconds(1);
    private int workerCount = 1;
    private String workerQueue = "all";
    private Duration shutdownTimeout = Duration.ofSeconds(30);

    private QueueConfig() {
    }

    public static QueueConfig defaults() {
        return new QueueConfig();
    }

    public static QueueConfig fromEnv() {
        QueueConfig config = new QueueConfig();

        // Override from environment variables
        String dbUrl = System.getenv("DEFERQ_DB_URL");
        if (dbUrl != null && !dbUrl.isBlank()) {
            config.databaseUrl = dbUrl;
        }

        String poolSize = System.getenv("DEFERQ_DB_POOL_SIZE");
        if (poolSize != null && !poolSize.isBlank()) {
            config.databasePoolSize = Integer.parseInt(poolSize);
        }

        String port = System.getenv("DEFERQ_PORT");
        if (port != null && !port.isBlank()) {
            config.serverPort = Integer.parseInt(port);
        }

        String timezone = System.getenv("DEFERQ_TIMEZONE");
        if (timezone != null && !timezone.isBlank()) {
            config.timezone = ZoneId.of(timezone);
        }

        String idleSleep = System.getenv("DEFERQ_IDLE_SLEEP_MS");
        if (idleSleep != null && !idleSleep.isBlank()) {
            config.idleSleep = Duration.ofMillis(Long.parseLong(idleSleep));
        }

        String workers = System.getenv("DEFERQ_WORKERS");
        if (workers != null && !workers.isBlank()) {
            config.workerCount = Integer.parseInt(workers);
        }

        String queue = System.getenv("DEFERQ_QUEUE");
        if (queue != null && !queue.isBlank()) {
            config.workerQueue = queue;
        }

        String shutdownTimeout = System.getenv("DEFERQ_SHUTDOWN_TIMEOUT_MS");
        if (shutdownTimeout != null && !shutdownTimeout.isBlank()) {
            config.shutdownTimeout = Duration.ofMillis(Long.parseLong(shutdownTimeout));
        }

        return config;
    }

    // Getters
    public String databaseUrl() {
        return databaseUrl;
    }

    public int databasePoolSize() {
        return databasePoolSize;
    }

    public int serverPort() {
        return serverPort;
    }

    public String serverHost() {
        return serverHost;
    }

    public Duration lockTimeout() {
        return lockTimeout;
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    public ZoneId timezone() {
        return timezone;
    }

    public Duration idleSleep() {
        return idleSleep;
    }

    public int workerCount() {
        return workerCount;
    }

    public String workerQueue() {
        return workerQueue;
    }

    /**
     * How long a stopping worker may take to finish its current job.
     */
    public Duration shutdownTimeout() {
        return shutdownTimeout;
    }

    // Fluent setters for testing/customization
    public QueueConfig withDatabaseUrl(String url) {
        this.databaseUrl = url;
        return this;
    }

    public QueueConfig withServerPort(int port) {
        this.serverPort = port;
        return this;
    }

    public QueueConfig withLockTimeout(Duration timeout) {
        this.lockTimeout = timeout;
        return this;
    }

    public QueueConfig withMaxAttempts(int attempts) {
        this.maxAttempts = attempts;
        return this;
    }

    public QueueConfig withTimezone(ZoneId zone) {
        this.timezone = zone;
        return this;
    }

    public QueueConfig withIdleSleep(Duration sleep) {
        this.idleSleep = sleep;
        return this;
    }

    public QueueConfig withWorkerCount(int count) {
        this.workerCount = count;
        return this;
    }

    public QueueConfig withWorkerQueue(String queue) {
        this.workerQueue = queue;
        return this;
    }

    public QueueConfig withShutdownTimeout(Duration timeout) {
        this.shutdownTimeout = timeout;
        return this;
    }

    @Override
    public String toString() {
        return "QueueConfig{" +
                "databaseUrl='" + databaseUrl + '\'' +
                ", serverPort=" + serverPort +
                ", timezone=" + timezone +
                ", idleSleep=" + idleSleep +
                ", workers=" + workerCount +
                ", queue='" + workerQueue + '\'' +
                '}';
    }
}
