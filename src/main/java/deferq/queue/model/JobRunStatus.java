package deferq.queue.model;

/**
 * Outcome of running a single job.
 */
public enum JobRunStatus {
    /** Job performed successfully (deleted, or rescheduled if recurring) */
    DONE,

    /** Job raised an error, failure recorded and job rescheduled */
    FAILED,

    /** Job does not exist */
    NOT_FOUND,

    /** Another worker holds the lock */
    LOCKED
}
