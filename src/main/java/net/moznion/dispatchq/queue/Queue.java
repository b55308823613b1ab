package net.moznion.dispatchq.queue;

import net.moznion.dispatchq.JobOptions;

/**
 * Producer side of the job queue.
 */
public interface Queue {
    default String enqueue(final String queueName, final Object payload) {
        return enqueue(queueName, payload, JobOptions.defaults());
    }

    /**
     * Records a job and returns its id once it is durable.
     *
     * @throws net.moznion.dispatchq.exception.BrokerUnavailableException when the job could not be recorded
     */
    String enqueue(String queueName, Object payload, JobOptions options);
}
