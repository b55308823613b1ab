package net.moznion.dispatchq.broker;

import java.util.List;

import net.moznion.dispatchq.Job;

public interface RetryableJobBroker {
    String STALLED_ERROR = "job stalled more than allowable limit";

    /**
     * Moves due retries of the queue back to its waiting set.
     *
     * @return number of jobs made visible again
     */
    int retry(String queueName);

    Job registerRetryJob(Job job, String error, long delayMillis);

    /**
     * Takes back jobs whose lease expired. A stalled job that already spent its last attempt, or whose
     * record can no longer be restored, is failed.
     *
     * @return the jobs taken back, either {@link net.moznion.dispatchq.JobStatus#QUEUED} again or
     * {@link net.moznion.dispatchq.JobStatus#FAILED}
     */
    List<Job> recoverStalledJobs(String queueName);
}
