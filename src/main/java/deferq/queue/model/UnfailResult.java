package deferq.queue.model;

/**
 * Result of discarding the error of a job.
 *
 * @param outcome       what happened
 * @param previousError the error that was cleared, empty otherwise
 */
public record UnfailResult(Outcome outcome, String previousError) {

    public enum Outcome {
        UNFAILED,
        NOT_FAILED,
        NOT_FOUND
    }

    public static UnfailResult unfailed(String previousError) {
        return new UnfailResult(Outcome.UNFAILED, previousError);
    }

    public static UnfailResult notFailed() {
        return new UnfailResult(Outcome.NOT_FAILED, "");
    }

    public static UnfailResult notFound() {
        return new UnfailResult(Outcome.NOT_FOUND, "");
    }
}
