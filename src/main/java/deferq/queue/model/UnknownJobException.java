package deferq.queue.model;

/**
 * No handler is registered under the job's name, and the name does not
 * resolve to a handler class.
 */
public class UnknownJobException extends RuntimeException {

    private final String jobName;

    public UnknownJobException(String jobName) {
        this(jobName, null);
    }

    public UnknownJobException(String jobName, Throwable cause) {
        super(jobName + " is not a registered job", cause);
        this.jobName = jobName;
    }

    public String jobName() {
        return jobName;
    }
}
