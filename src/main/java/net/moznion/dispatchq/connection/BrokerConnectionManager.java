package net.moznion.dispatchq.connection;

/**
 * Owns the connection to the queue backend for the lifetime of the process.
 */
public interface BrokerConnectionManager extends AutoCloseable {
    /**
     * Checks the backend once. An unreachable backend is reported, not thrown.
     *
     * @return whether the backend answered
     */
    boolean connect();

    /**
     * Outcome of the last check; never blocks.
     */
    boolean isAvailable();

    ConnectionOptions connectionOptions();

    @Override
    void close();
}
