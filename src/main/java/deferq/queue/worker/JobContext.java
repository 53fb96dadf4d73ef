package deferq.queue.worker;

import deferq.queue.config.QueueConfig;
import deferq.queue.model.Job;
import deferq.queue.service.JobService;

/**
 * What a handler gets besides its arguments: the job being run (locked by
 * the current worker), the queue configuration, and the job service to
 * enqueue follow-up work.
 */
public record JobContext(Job job, QueueConfig config, JobService jobService) {
}
