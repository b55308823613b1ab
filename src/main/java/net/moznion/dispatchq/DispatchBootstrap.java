package net.moznion.dispatchq;

import java.time.Duration;

import net.moznion.dispatchq.broker.RedisJobBroker;
import net.moznion.dispatchq.config.DispatchConfig;
import net.moznion.dispatchq.connection.RedisConnectionManager;
import net.moznion.dispatchq.event.LoggingEventSink;
import net.moznion.dispatchq.lifecycle.LifecycleController;
import net.moznion.dispatchq.lifecycle.LifecycleState;
import net.moznion.dispatchq.mail.EmailDispatchProcessor;
import net.moznion.dispatchq.mail.SmtpMailSender;
import net.moznion.dispatchq.queue.QueueNames;
import net.moznion.dispatchq.queue.QueueSettingsRegistry;
import net.moznion.dispatchq.worker.WorkerOptions;

import lombok.extern.slf4j.Slf4j;

/**
 * Wires the Redis backed controller with the email processor.
 * <p>
 * The plagiarism processor lives in the host application, which registers it on the returned controller
 * with {@link #plagiarismWorkerOptions()} before calling {@link LifecycleController#start()}.
 */
@Slf4j
public final class DispatchBootstrap {
    public static final Duration DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(30);

    private DispatchBootstrap() {
    }

    public static LifecycleController create(final DispatchConfig config) {
        final RedisConnectionManager connectionManager = new RedisConnectionManager(config.getConnectionOptions());
        final LifecycleController controller =
                new LifecycleController(connectionManager,
                                        registry -> new RedisJobBroker(connectionManager, registry),
                                        QueueSettingsRegistry.withBuiltinQueues());

        final EmailDispatchProcessor emailProcessor =
                new EmailDispatchProcessor(new SmtpMailSender(config.getSmtpSettings()), config.getEmailFrom());
        controller.register(QueueNames.EMAIL,
                            emailProcessor,
                            WorkerOptions.builder().concurrency(config.getEmailConcurrency()).build());
        controller.addEventSink(new LoggingEventSink());
        return controller;
    }

    /**
     * Two slots and at most 10 job starts a minute, to stay within the detection provider's quota.
     */
    public static WorkerOptions plagiarismWorkerOptions() {
        return WorkerOptions.builder()
                            .concurrency(2)
                            .rateLimitMax(10)
                            .rateLimitDurationMillis(60_000)
                            .build();
    }

    public static void main(final String[] args) throws InterruptedException {
        final DispatchConfig config = DispatchConfig.fromEnvironment();
        if (!config.isJobsEnabled()) {
            log.info("Background jobs are disabled by JOBS_ENABLED");
            return;
        }

        final LifecycleController controller = create(config);
        if (controller.start() == LifecycleState.DISABLED) {
            controller.stop(DEFAULT_SHUTDOWN_TIMEOUT);
            return;
        }
        controller.registerShutdownHook(DEFAULT_SHUTDOWN_TIMEOUT);
        controller.awaitTermination();
    }
}
