package net.moznion.dispatchq.worker;

import net.moznion.dispatchq.Job;

/**
 * Business logic of a queue. Returning normally completes the job; throwing anything fails the attempt.
 * <p>
 * One processor instance is shared by every slot of a pool, so implementations must be thread-safe.
 * A processor that is also {@link AutoCloseable} is closed when its pool stops.
 */
@FunctionalInterface
public interface Processor {
    void process(Job job) throws Exception;
}
