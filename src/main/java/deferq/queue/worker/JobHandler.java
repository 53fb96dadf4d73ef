package deferq.queue.worker;

import java.util.List;

/**
 * A unit of work that can be invoked by name with the arguments stored in
 * the job row.
 *
 * Any exception thrown marks the run as failed; the job is then retried with
 * a backoff, or at its next slot if it is recurring.
 */
@FunctionalInterface
public interface JobHandler {

    void perform(JobContext context, List<Object> args) throws Exception;
}
