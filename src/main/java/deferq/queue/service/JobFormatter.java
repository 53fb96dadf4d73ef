package deferq.queue.service;

import deferq.queue.model.Job;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Plain-text views of jobs for the command line.
 */
public class JobFormatter {

    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ssxxx");

    private final Clock clock;
    private final ZoneId zone;
    private final Duration lockTimeout;

    public JobFormatter(Clock clock, ZoneId zone, Duration lockTimeout) {
        this.clock = clock;
        this.zone = zone;
        this.lockTimeout = lockTimeout;
    }

    /**
     * One line per job, e.g.
     * {@code job#1 app.CleanupJob at 2023-04-20 11:55:00+00:00, 0 attempts (locked)}
     */
    public String formatList(List<Job> jobs) {
        return jobs.stream().map(this::formatLine).collect(Collectors.joining("\n"));
    }

    public String formatLine(Job job) {
        StringBuilder line = new StringBuilder("job#").append(job.id()).append(' ').append(job.name());
        if (job.isRecurring()) {
            line.append(" scheduled each ").append(job.frequency())
                    .append(", next at ").append(format(job.performAt()));
        } else {
            line.append(" at ").append(format(job.performAt()))
                    .append(", ").append(job.numberAttempts()).append(" attempts");
        }

        for (String status : statuses(job)) {
            if (!"scheduled".equals(status)) {
                line.append(" (").append(status).append(')');
            }
        }
        return line.toString();
    }

    /**
     * Status annotations: "scheduled" for recurring jobs, "locked" while a
     * worker holds it, "failed" after a failure.
     */
    public List<String> statuses(Job job) {
        List<String> statuses = new ArrayList<>();
        if (job.isRecurring()) {
            statuses.add("scheduled");
        }
        if (job.isLocked(clock.instant(), lockTimeout)) {
            statuses.add("locked");
        }
        if (job.hasFailed()) {
            statuses.add("failed");
        }
        return statuses;
    }

    /**
     * Full detail of a job, one attribute per line, the last error last.
     */
    public String formatDetail(Job job) {
        StringBuilder out = new StringBuilder();
        out.append("id: ").append(job.id());
        out.append("\nname: ").append(job.name());

        if (job.args().isEmpty()) {
            out.append("\nargs: none");
        } else {
            out.append("\nargs: ").append(job.args().stream()
                    .map(JobFormatter::formatArg)
                    .collect(Collectors.joining(", ")));
        }

        out.append("\nperform: ").append(format(job.performAt()));
        out.append("\nattempts: ").append(job.numberAttempts());
        out.append("\nqueue: ").append(job.queue());
        out.append("\nrepeat: ").append(job.isRecurring() ? job.frequency() : "once");
        out.append("\ncreated: ").append(format(job.createdAt()));
        out.append("\nupdated: ").append(format(job.updatedAt()));

        if (job.lockedAt() != null) {
            out.append("\nlocked: ").append(format(job.lockedAt()));
        }

        if (job.hasFailed()) {
            out.append("\nfailed: ").append(format(job.failedAt()));
            out.append('\n').append(job.lastError());
        } else {
            out.append("\nfailed: never");
        }

        return out.toString();
    }

    public String format(Instant instant) {
        return instant == null ? "-" : DATE_FORMAT.format(instant.atZone(zone));
    }

    private static String formatArg(Object arg) {
        if (arg == null) {
            return "NULL";
        }
        if (arg instanceof String s) {
            return "'" + s.replace("'", "\\'") + "'";
        }
        return String.valueOf(arg);
    }
}
