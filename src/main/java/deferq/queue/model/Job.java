package deferq.queue.model;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable domain model representing a persisted unit of deferred work.
 * A job without frequency is one-shot; a job with a frequency is recurring.
 */
public final class Job {

    public static final String DEFAULT_QUEUE = "default";
    public static final String ALL_QUEUES = "all";

    private final Long id; // null until stored
    private final String name;
    private final List<Object> args;
    private final String queue;
    private final Instant performAt;
    private final int numberAttempts;
    private final String frequency; // "" for one-shot jobs
    private final Instant lockedAt;
    private final Instant failedAt;
    private final String lastError;
    private final Instant createdAt;
    private final Instant updatedAt;

    private Job(Builder builder) {
        this.id = builder.id;
        this.name = Objects.requireNonNull(builder.name, "name is required");
        this.args = Collections.unmodifiableList(new ArrayList<>(builder.args));
        this.queue = Objects.requireNonNull(builder.queue, "queue is required");
        this.performAt = Objects.requireNonNull(builder.performAt, "performAt is required");
        if (builder.numberAttempts < 0) {
            throw new IllegalArgumentException("numberAttempts must not be negative");
        }
        this.numberAttempts = builder.numberAttempts;
        this.frequency = builder.frequency == null ? "" : builder.frequency.trim();
        this.lockedAt = builder.lockedAt;
        this.failedAt = builder.failedAt;
        this.lastError = builder.lastError == null ? "" : builder.lastError;
        this.createdAt = builder.createdAt;
        this.updatedAt = builder.updatedAt;
    }

    // Getters
    public Long id() {
        return id;
    }

    public String name() {
        return name;
    }

    public List<Object> args() {
        return args;
    }

    public String queue() {
        return queue;
    }

    public Instant performAt() {
        return performAt;
    }

    public int numberAttempts() {
        return numberAttempts;
    }

    public String frequency() {
        return frequency;
    }

    public Instant lockedAt() {
        return lockedAt;
    }

    public Instant failedAt() {
        return failedAt;
    }

    public String lastError() {
        return lastError;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant updatedAt() {
        return updatedAt;
    }

    /** A recurring job is rescheduled instead of being deleted. */
    public boolean isRecurring() {
        return !frequency.isEmpty();
    }

    public boolean hasFailed() {
        return failedAt != null;
    }

    /**
     * Whether some worker holds this job. Locks older than the timeout are
     * considered abandoned.
     */
    public boolean isLocked(Instant now, Duration lockTimeout) {
        if (lockedAt == null) {
            return false;
        }
        return lockedAt.isAfter(now.minus(lockTimeout));
    }

    /** Create a builder from this job (for updates) */
    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .name(name)
                .args(args)
                .queue(queue)
                .performAt(performAt)
                .numberAttempts(numberAttempts)
                .frequency(frequency)
                .lockedAt(lockedAt)
                .failedAt(failedAt)
                .lastError(lastError)
                .createdAt(createdAt)
                .updatedAt(updatedAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Long id;
        private String name;
        private List<Object> args = List.of();
        private String queue = DEFAULT_QUEUE;
        private Instant performAt;
        private int numberAttempts = 0;
        private String frequency = "";
        private Instant lockedAt;
        private Instant failedAt;
        private String lastError = "";
        private Instant createdAt;
        private Instant updatedAt;

        public Builder id(Long id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder args(List<?> args) {
            this.args = args == null ? List.of() : new ArrayList<>(args);
            return this;
        }

        public Builder queue(String queue) {
            this.queue = queue;
            return this;
        }

        public Builder performAt(Instant performAt) {
            this.performAt = performAt;
            return this;
        }

        public Builder numberAttempts(int numberAttempts) {
            this.numberAttempts = numberAttempts;
            return this;
        }

        public Builder frequency(String frequency) {
            this.frequency = frequency;
            return this;
        }

        public Builder lockedAt(Instant lockedAt) {
            this.lockedAt = lockedAt;
            return this;
        }

        public Builder failedAt(Instant failedAt) {
            this.failedAt = failedAt;
            return this;
        }

        public Builder lastError(String lastError) {
            this.lastError = lastError;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Job build() {
            return new Job(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Job job))
            return false;
        return id != null && Objects.equals(id, job.id);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(id);
    }

    @Override
    public String toString() {
        return "Job{id=" + id + ", name='" + name + "', queue='" + queue + "', performAt=" + performAt + "}";
    }
}
