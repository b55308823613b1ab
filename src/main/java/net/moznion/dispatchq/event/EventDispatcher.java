package net.moznion.dispatchq.event;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.BiConsumer;

import lombok.extern.slf4j.Slf4j;

/**
 * Delivers events to sinks on a single thread so that workers never wait on a sink.
 */
@Slf4j
public class EventDispatcher {
    private final String queueName;
    private final List<EventSink> sinks;
    private final ExecutorService executor;

    public EventDispatcher(final String queueName) {
        this.queueName = queueName;
        sinks = new CopyOnWriteArrayList<>();
        executor = Executors.newSingleThreadExecutor(runnable -> {
            final Thread thread = new Thread(runnable, "dispatchq-" + queueName + "-events");
            thread.setDaemon(true);
            return thread;
        });
    }

    public void addSink(final EventSink sink) {
        sinks.add(sink);
    }

    public void completed(final CompletedEvent event) {
        dispatch("completed", event, EventSink::onCompleted);
    }

    public void failed(final FailedEvent event) {
        dispatch("failed", event, EventSink::onFailed);
    }

    public void poolError(final PoolErrorEvent event) {
        dispatch("poolError", event, EventSink::onPoolError);
    }

    /**
     * Delivers the events already accepted, then stops the dispatcher thread.
     *
     * @return whether every pending event was delivered within the timeout
     */
    public boolean close(final long timeoutMillis) throws InterruptedException {
        executor.shutdown();
        final boolean terminated = executor.awaitTermination(timeoutMillis, TimeUnit.MILLISECONDS);
        if (!terminated) {
            log.warn("Event dispatcher did not drain in time [queueName={}, timeoutMillis={}]",
                     queueName, timeoutMillis);
            executor.shutdownNow();
        }
        return terminated;
    }

    private <E> void dispatch(final String eventName, final E event, final BiConsumer<EventSink, E> callback) {
        try {
            executor.execute(() -> {
                for (final EventSink sink : sinks) {
                    try {
                        callback.accept(sink, event);
                    } catch (RuntimeException e) {
                        log.error("Event sink threw [queueName={}, event={}, sink={}]",
                                  queueName, eventName, sink.getClass().getName(), e);
                    }
                }
            });
        } catch (RejectedExecutionException e) {
            log.debug("Event dropped after dispatcher closed [queueName={}, event={}, payload={}]",
                      queueName, eventName, event);
        }
    }
}
