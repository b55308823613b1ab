package net.moznion.dispatchq.event;

/**
 * Receives the outcome of jobs processed by a worker pool.
 * <p>
 * Callbacks run on the pool's event dispatcher thread, one at a time and in emission order.
 * Whatever a callback throws is logged and does not reach the pool.
 */
public interface EventSink {
    default void onCompleted(final CompletedEvent event) {
    }

    default void onFailed(final FailedEvent event) {
    }

    default void onPoolError(final PoolErrorEvent event) {
    }
}
