package deferq.queue.model;

/**
 * Raised when a job is declared in a way that cannot be scheduled, such as a
 * frequency going backward. This is a programming error, never a transient
 * condition.
 */
public class JobConfigurationException extends IllegalStateException {

    public JobConfigurationException(String message) {
        super(message);
    }

    public JobConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
