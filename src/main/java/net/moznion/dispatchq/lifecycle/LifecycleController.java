package net.moznion.dispatchq.lifecycle;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import net.moznion.dispatchq.broker.JobBroker;
import net.moznion.dispatchq.broker.JobBrokerFactory;
import net.moznion.dispatchq.connection.BrokerConnectionManager;
import net.moznion.dispatchq.event.EventSink;
import net.moznion.dispatchq.queue.BrokerQueue;
import net.moznion.dispatchq.queue.DisabledQueue;
import net.moznion.dispatchq.queue.Queue;
import net.moznion.dispatchq.queue.QueueSettingsRegistry;
import net.moznion.dispatchq.worker.Processor;
import net.moznion.dispatchq.worker.SimpleWorkerPool;
import net.moznion.dispatchq.worker.WorkerOptions;
import net.moznion.dispatchq.worker.WorkerPool;

import lombok.Value;
import lombok.extern.slf4j.Slf4j;

/**
 * Owns the broker connection, the queue handed to producers and one worker pool per registered queue.
 * <p>
 * Background processing is optional for the host: when the broker cannot be reached at {@link #start()},
 * the controller stays {@link LifecycleState#DISABLED} and {@link #getQueue()} rejects every job
 * with a {@link net.moznion.dispatchq.exception.BrokerUnavailableException}.
 */
@Slf4j
public class LifecycleController {
    private static final Queue DISABLED_QUEUE = new DisabledQueue();

    private final BrokerConnectionManager connectionManager;
    private final JobBrokerFactory jobBrokerFactory;
    private final QueueSettingsRegistry settingsRegistry;
    private final Map<String, Registration> registrations;
    private final List<EventSink> eventSinks;
    private final Map<String, WorkerPool> pools;
    private final CountDownLatch terminationLatch;

    private volatile LifecycleState state;
    private volatile Queue queue;
    private JobBroker jobBroker;

    public LifecycleController(final BrokerConnectionManager connectionManager,
                               final JobBrokerFactory jobBrokerFactory,
                               final QueueSettingsRegistry settingsRegistry) {
        this.connectionManager = connectionManager;
        this.jobBrokerFactory = jobBrokerFactory;
        this.settingsRegistry = settingsRegistry;
        registrations = new LinkedHashMap<>();
        eventSinks = new CopyOnWriteArrayList<>();
        pools = new LinkedHashMap<>();
        terminationLatch = new CountDownLatch(1);
        state = LifecycleState.NEW;
        queue = DISABLED_QUEUE;
    }

    public synchronized LifecycleController register(final String queueName,
                                                     final Processor processor,
                                                     final WorkerOptions options) {
        if (state != LifecycleState.NEW) {
            throw new IllegalStateException("Processors must be registered before start [state=" + state + ']');
        }
        if (queueName == null || queueName.isEmpty()) {
            throw new IllegalArgumentException("queueName is required");
        }
        options.validate();
        if (registrations.put(queueName, new Registration(processor, options)) != null) {
            log.warn("Processor is replaced [queueName={}]", queueName);
        }
        return this;
    }

    public LifecycleController addEventSink(final EventSink sink) {
        eventSinks.add(sink);
        synchronized (this) {
            pools.values().forEach(pool -> pool.addEventSink(sink));
        }
        return this;
    }

    /**
     * Connects to the broker and starts a pool per registered queue.
     *
     * @return the resulting state, {@link LifecycleState#RUNNING} or {@link LifecycleState#DISABLED}
     */
    public synchronized LifecycleState start() {
        if (state != LifecycleState.NEW) {
            log.warn("Lifecycle controller already started, start is ignored [state={}]", state);
            return state;
        }

        if (!connectionManager.connect()) {
            state = LifecycleState.DISABLED;
            log.warn("Job broker unavailable, background jobs are disabled [host={}, port={}]",
                     connectionManager.connectionOptions().getHost(),
                     connectionManager.connectionOptions().getPort());
            return state;
        }

        try {
            jobBroker = jobBrokerFactory.create(settingsRegistry);
            for (final Map.Entry<String, Registration> entry : registrations.entrySet()) {
                final WorkerPool pool = new SimpleWorkerPool(jobBroker);
                eventSinks.forEach(pool::addEventSink);
                pool.start(entry.getKey(), entry.getValue().getProcessor(), entry.getValue().getOptions());
                pools.put(entry.getKey(), pool);
            }
        } catch (RuntimeException e) {
            log.error("Lifecycle controller failed to start, rolling back [startedQueues={}]", pools.keySet(), e);
            rollbackStart();
            throw e;
        }

        queue = new BrokerQueue(jobBroker, settingsRegistry);
        state = LifecycleState.RUNNING;
        log.info("Lifecycle controller started [queues={}]", pools.keySet());
        return state;
    }

    // leaves the controller NEW with nothing running and the connection closed
    private void rollbackStart() {
        for (final WorkerPool pool : pools.values()) {
            try {
                pool.stop(Duration.ZERO);
            } catch (RuntimeException e) {
                log.warn("Failed to stop worker pool on rollback", e);
            }
        }
        pools.clear();

        if (jobBroker != null) {
            try {
                jobBroker.close();
            } catch (RuntimeException e) {
                log.warn("Failed to close job broker on rollback", e);
            }
            jobBroker = null;
        }
        connectionManager.close();
    }

    /**
     * The producer-side queue. Safe to call in any state.
     */
    public Queue getQueue() {
        return queue;
    }

    /**
     * Stops every pool in parallel within the shared {@code timeout}, then closes the broker and the connection.
     *
     * @return whether every in-flight job finished in time
     */
    public synchronized boolean stop(final Duration timeout) {
        if (state == LifecycleState.STOPPED) {
            return true;
        }
        final LifecycleState previous = state;
        state = LifecycleState.STOPPED;
        queue = DISABLED_QUEUE;

        boolean drained = true;
        try {
            if (previous == LifecycleState.RUNNING) {
                log.info("Lifecycle controller attempts to stop [queues={}, timeoutMillis={}]",
                         pools.keySet(), timeout.toMillis());
                final List<CompletableFuture<Boolean>> stops = new ArrayList<>(pools.size());
                for (final WorkerPool pool : pools.values()) {
                    stops.add(CompletableFuture.supplyAsync(() -> pool.stop(timeout)));
                }
                for (final CompletableFuture<Boolean> stop : stops) {
                    drained &= stop.join();
                }
                jobBroker.close();
            }
        } finally {
            connectionManager.close();
            terminationLatch.countDown();
        }

        log.info("Lifecycle controller stopped [drained={}]", drained);
        return drained;
    }

    /**
     * Stops the controller when the JVM shuts down.
     */
    public Thread registerShutdownHook(final Duration timeout) {
        final Thread hook = new Thread(() -> stop(timeout), "dispatchq-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);
        return hook;
    }

    public void awaitTermination() throws InterruptedException {
        terminationLatch.await();
    }

    public boolean awaitTermination(final long timeout, final TimeUnit unit) throws InterruptedException {
        return terminationLatch.await(timeout, unit);
    }

    public LifecycleState getState() {
        return state;
    }

    public synchronized Optional<WorkerPool> getPool(final String queueName) {
        return Optional.ofNullable(pools.get(queueName));
    }

    /**
     * The live broker, e.g. for queue statistics. Empty unless running.
     */
    public synchronized Optional<JobBroker> getJobBroker() {
        return state == LifecycleState.RUNNING ? Optional.of(jobBroker) : Optional.empty();
    }

    @Value
    private static class Registration {
        Processor processor;
        WorkerOptions options;
    }
}
