package net.moznion.dispatchq.broker;

import java.util.Collection;
import java.util.Optional;

import net.moznion.dispatchq.Job;
import net.moznion.dispatchq.JobOptions;

/**
 * Storage and claim engine shared by producers and worker pools.
 * <p>
 * Every method may throw {@link net.moznion.dispatchq.exception.BrokerException} when the backend fails.
 */
public interface JobBroker extends RetryableJobBroker, QueueStatusDiscoverer, AutoCloseable {
    /**
     * Records a job durably before returning its id.
     *
     * @param options fully resolved options, see {@link net.moznion.dispatchq.queue.QueueSettingsRegistry#resolve}
     */
    String enqueue(String queueName, Object payload, JobOptions options);

    /**
     * Claims the next waiting job: increments its attempt, marks it processing and leases it
     * for {@code leaseMillis}. A job whose lease runs out is handed out again by
     * {@link #recoverStalledJobs(String)}.
     * <p>
     * The returned job may instead be {@link net.moznion.dispatchq.JobStatus#FAILED}: the broker failed it
     * while claiming because it had no attempts left or its record could not be restored.
     * Such a job must be reported, not processed.
     */
    Optional<Job> dequeue(String queueName, long leaseMillis);

    void extendLease(String queueName, Collection<String> ids, long leaseMillis);

    Job complete(Job job);

    Job fail(Job job, String error);

    /**
     * Returns a claimed job to the waiting set and gives its attempt back.
     */
    Job release(Job job);

    Optional<Job> getJob(String id);

    @Override
    void close();
}
