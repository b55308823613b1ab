package net.moznion.dispatchq.worker;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

import net.moznion.dispatchq.Job;
import net.moznion.dispatchq.broker.JobBroker;
import net.moznion.dispatchq.event.EventDispatcher;
import net.moznion.dispatchq.event.EventSink;

import lombok.extern.slf4j.Slf4j;

@Slf4j
public class SimpleWorkerPool implements WorkerPool {
    private static final long MIN_DISPATCHER_DRAIN_MILLIS = 1000;

    private final JobBroker jobBroker;
    private final Clock clock;
    private final List<EventSink> eventSinks;
    private final ConcurrentHashMap<String, Job> inFlight;

    // guarded by this
    private String queueName;
    private Processor processor;
    private List<SimpleWorker> workers;
    private SimpleMaintenanceWorker maintenanceWorker;
    private EventDispatcher eventDispatcher;
    private volatile boolean running;

    public SimpleWorkerPool(final JobBroker jobBroker) {
        this(jobBroker, Clock.systemUTC());
    }

    public SimpleWorkerPool(final JobBroker jobBroker, final Clock clock) {
        this.jobBroker = jobBroker;
        this.clock = clock;
        eventSinks = new CopyOnWriteArrayList<>();
        inFlight = new ConcurrentHashMap<>();
        workers = new ArrayList<>();
        running = false;
    }

    @Override
    public synchronized void start(final String queueName, final Processor processor, final WorkerOptions options) {
        if (running) {
            log.warn("Worker pool already running, start is ignored [queueName={}]", this.queueName);
            return;
        }
        options.validate();

        this.queueName = queueName;
        this.processor = processor;

        eventDispatcher = new EventDispatcher(queueName);
        eventSinks.forEach(eventDispatcher::addSink);

        final RateLimiter rateLimiter = options.isRateLimited()
                                        ? new RateLimiter(options.getRateLimitMax(),
                                                          options.getRateLimitDurationMillis(),
                                                          clock)
                                        : null;

        workers = new ArrayList<>(options.getConcurrency());
        for (int i = 0; i < options.getConcurrency(); i++) {
            final SimpleWorker worker =
                    new SimpleWorker(queueName, jobBroker, processor, options, inFlight, rateLimiter, eventDispatcher);
            workers.add(worker);
            newThread(worker, "dispatchq-" + queueName + "-worker-" + (i + 1)).start();
        }

        maintenanceWorker = new SimpleMaintenanceWorker(queueName, jobBroker, options, inFlight, eventDispatcher);
        newThread(maintenanceWorker, "dispatchq-" + queueName + "-maintenance").start();

        running = true;
        log.info("Worker pool started [queueName={}, concurrency={}, rateLimitMax={}]",
                 queueName, options.getConcurrency(), options.getRateLimitMax());
    }

    @Override
    public synchronized boolean stop(final Duration timeout) {
        if (!running) {
            log.info("Worker pool is not running [queueName={}]", queueName);
            return true;
        }
        running = false;

        log.info("Worker pool attempts to stop [queueName={}, timeoutMillis={}]", queueName, timeout.toMillis());
        final long deadline = clock.millis() + timeout.toMillis();
        workers.forEach(SimpleWorker::shutdown);

        boolean drained = true;
        try {
            for (final SimpleWorker worker : workers) {
                if (!worker.join(deadline - clock.millis())) {
                    drained = false;
                }
            }
        } catch (InterruptedException e) {
            log.warn("Interrupted while waiting for workers [queueName={}]", queueName);
            Thread.currentThread().interrupt();
            drained = false;
        }

        // leases of abandoned jobs are no longer extended from here on
        maintenanceWorker.shutdown();
        if (!drained) {
            log.warn("Worker pool stopped with jobs in flight, they are left to lease expiry " +
                     "[queueName={}, inFlight={}]", queueName, inFlight.keySet());
        }

        if (processor instanceof AutoCloseable) {
            try {
                ((AutoCloseable) processor).close();
            } catch (Exception e) {
                log.warn("Failed to close processor [queueName={}]", queueName, e);
            }
        }

        try {
            eventDispatcher.close(Math.max(MIN_DISPATCHER_DRAIN_MILLIS, deadline - clock.millis()));
        } catch (InterruptedException e) {
            log.warn("Interrupted while draining events [queueName={}]", queueName);
            Thread.currentThread().interrupt();
        }

        log.info("Worker pool stopped [queueName={}, drained={}]", queueName, drained);
        return drained;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int inFlightCount() {
        return inFlight.size();
    }

    @Override
    public synchronized void addEventSink(final EventSink sink) {
        eventSinks.add(sink);
        if (running) {
            eventDispatcher.addSink(sink);
        }
    }

    private static Thread newThread(final Runnable runnable, final String name) {
        final Thread thread = new Thread(runnable, name);
        thread.setDaemon(true);
        return thread;
    }
}
