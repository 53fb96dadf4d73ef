package deferq.queue.model;

import java.util.Locale;

/**
 * Report of a single run, printed one line per job by the worker.
 */
public record JobRunReport(long jobId, String jobName, JobRunStatus status, double elapsedSeconds) {

    public static JobRunReport notFound(long jobId) {
        return new JobRunReport(jobId, null, JobRunStatus.NOT_FOUND, 0);
    }

    public static JobRunReport locked(Job job) {
        return new JobRunReport(job.id(), job.name(), JobRunStatus.LOCKED, 0);
    }

    public boolean isSuccess() {
        return status == JobRunStatus.DONE;
    }

    /** HTTP-like code of the outcome: 200, 404 or 500. */
    public int code() {
        return switch (status) {
            case DONE -> 200;
            case NOT_FOUND -> 404;
            case FAILED, LOCKED -> 500;
        };
    }

    public String statusLine() {
        return switch (status) {
            case NOT_FOUND -> "Job " + jobId + " does not exist.";
            case LOCKED -> "Job " + jobId + " is locked by another worker.";
            case DONE, FAILED -> String.format(Locale.ROOT, "job#%d (%s): %s (in %.3f seconds)",
                    jobId, jobName, status == JobRunStatus.DONE ? "done" : "failed", elapsedSeconds);
        };
    }
}
