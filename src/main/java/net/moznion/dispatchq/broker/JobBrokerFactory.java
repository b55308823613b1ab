package net.moznion.dispatchq.broker;

import net.moznion.dispatchq.queue.QueueSettingsRegistry;

@FunctionalInterface
public interface JobBrokerFactory {
    JobBroker create(QueueSettingsRegistry settingsRegistry);
}
