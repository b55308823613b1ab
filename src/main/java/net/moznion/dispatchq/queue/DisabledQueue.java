package net.moznion.dispatchq.queue;

import net.moznion.dispatchq.JobOptions;
import net.moznion.dispatchq.exception.BrokerUnavailableException;

/**
 * Stands in while the broker is unavailable so producers fail fast instead of losing jobs.
 */
public class DisabledQueue implements Queue {
    @Override
    public String enqueue(final String queueName, final Object payload, final JobOptions options) {
        throw new BrokerUnavailableException(
                "Job broker is not available, cannot enqueue [queueName=" + queueName + ']');
    }
}
