package net.moznion.dispatchq.worker;

import java.time.Duration;

import net.moznion.dispatchq.event.EventSink;

/**
 * Consumes one queue with a fixed number of slots.
 */
public interface WorkerPool {
    /**
     * Spawns the slots and the maintenance thread. Calling it on a running pool only logs a warning.
     */
    void start(String queueName, Processor processor, WorkerOptions options);

    /**
     * Stops claiming at once and waits up to {@code timeout} for in-flight jobs.
     * Jobs still running afterwards are left to lease expiry.
     *
     * @return whether every in-flight job finished in time
     */
    boolean stop(Duration timeout);

    boolean isRunning();

    int inFlightCount();

    void addEventSink(EventSink sink);
}
