package net.moznion.dispatchq.queue;

import java.util.concurrent.ConcurrentHashMap;

import net.moznion.dispatchq.JobOptions;

public class QueueSettingsRegistry {
    private final ConcurrentHashMap<String, QueueSettings> settingsMap;
    private final QueueSettings fallback;

    public QueueSettingsRegistry() {
        this(QueueSettings.defaults());
    }

    public QueueSettingsRegistry(final QueueSettings fallback) {
        this.fallback = fallback;
        settingsMap = new ConcurrentHashMap<>();
    }

    /**
     * A registry that knows the email and plagiarism queues.
     */
    public static QueueSettingsRegistry withBuiltinQueues() {
        final QueueSettingsRegistry registry = new QueueSettingsRegistry();
        registry.register(QueueNames.EMAIL, QueueSettings.emailDispatch());
        registry.register(QueueNames.PLAGIARISM, QueueSettings.plagiarismCheck());
        return registry;
    }

    public QueueSettingsRegistry register(final String queueName, final QueueSettings settings) {
        if (settings.getMaxAttempts() < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1 [queueName=" + queueName + ']');
        }
        settingsMap.put(queueName, settings);
        return this;
    }

    public QueueSettings get(final String queueName) {
        return settingsMap.getOrDefault(queueName, fallback);
    }

    /**
     * Fills every absent option from the queue's settings.
     */
    public JobOptions resolve(final String queueName, final JobOptions options) {
        final QueueSettings settings = get(queueName);

        final int maxAttempts = options.getMaxAttempts() == null ? settings.getMaxAttempts()
                                                                 : options.getMaxAttempts();
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1: " + maxAttempts);
        }
        final int priority = options.getPriority() == null ? 0 : options.getPriority();
        if (priority < 0 || priority > JobOptions.MAX_PRIORITY) {
            throw new IllegalArgumentException(
                    "priority must be between 0 and " + JobOptions.MAX_PRIORITY + ": " + priority);
        }

        return JobOptions.builder()
                         .maxAttempts(maxAttempts)
                         .backoff(options.getBackoff() == null ? settings.getBackoff() : options.getBackoff())
                         .priority(priority)
                         .jobId(options.getJobId())
                         .build();
    }
}
