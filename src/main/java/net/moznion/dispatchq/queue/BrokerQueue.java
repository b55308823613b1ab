package net.moznion.dispatchq.queue;

import net.moznion.dispatchq.JobOptions;
import net.moznion.dispatchq.broker.JobBroker;

import lombok.extern.slf4j.Slf4j;

@Slf4j
public class BrokerQueue implements Queue {
    private final JobBroker jobBroker;
    private final QueueSettingsRegistry settingsRegistry;

    public BrokerQueue(final JobBroker jobBroker, final QueueSettingsRegistry settingsRegistry) {
        this.jobBroker = jobBroker;
        this.settingsRegistry = settingsRegistry;
    }

    @Override
    public String enqueue(final String queueName, final Object payload, final JobOptions options) {
        if (queueName == null || queueName.isEmpty()) {
            throw new IllegalArgumentException("queueName is required");
        }

        final JobOptions resolved = settingsRegistry.resolve(queueName, options);
        final String id = jobBroker.enqueue(queueName, payload, resolved);
        log.debug("Job enqueued [queueName={}, jobId={}, maxAttempts={}, priority={}]",
                  queueName, id, resolved.getMaxAttempts(), resolved.getPriority());
        return id;
    }
}
