package net.moznion.dispatchq.worker;

public interface Worker extends Runnable {
    /**
     * @return whether the worker finished within {@code timeoutMillis}
     */
    boolean join(long timeoutMillis) throws InterruptedException;

    void shutdown();
}
