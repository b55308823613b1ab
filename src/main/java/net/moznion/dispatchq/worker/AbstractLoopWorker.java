package net.moznion.dispatchq.worker;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import lombok.extern.slf4j.Slf4j;

/**
 * Thread bookkeeping shared by the pool's workers: a loop that runs until {@link #shutdown()} and
 * an idle wait that wakes up as soon as shutdown is requested.
 */
@Slf4j
abstract class AbstractLoopWorker implements Worker {
    private final AtomicReference<Thread> threadRef;
    private final CountDownLatch shutdownLatch;

    private volatile boolean isShuttingDown;

    AbstractLoopWorker() {
        threadRef = new AtomicReference<>(null);
        shutdownLatch = new CountDownLatch(1);
        isShuttingDown = false;
    }

    @Override
    public void run() {
        final Thread thread = Thread.currentThread();
        threadRef.set(thread);
        log.info("Worker started [threadName={}]", thread.getName());
        try {
            loop();
        } finally {
            log.info("Worker shutdown [threadName={}]", thread.getName());
        }
    }

    @Override
    public boolean join(final long timeoutMillis) throws InterruptedException {
        final Thread thread = threadRef.get();
        if (thread == null || !thread.isAlive()) {
            return true;
        }
        if (timeoutMillis > 0) {
            thread.join(timeoutMillis);
        }
        return !thread.isAlive();
    }

    @Override
    public void shutdown() {
        isShuttingDown = true;
        shutdownLatch.countDown();
    }

    protected abstract void loop();

    protected boolean isShuttingDown() {
        return isShuttingDown;
    }

    /**
     * Waits for {@code millis} or until shutdown is requested. An interrupt counts as a shutdown request.
     */
    protected void idle(final long millis) {
        try {
            shutdownLatch.await(millis, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            log.warn("Interrupted while idle, shutting down [threadName={}]", Thread.currentThread().getName());
            Thread.currentThread().interrupt();
            shutdown();
        }
    }
}
