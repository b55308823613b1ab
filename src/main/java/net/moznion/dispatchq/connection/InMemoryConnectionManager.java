package net.moznion.dispatchq.connection;

import lombok.extern.slf4j.Slf4j;

/**
 * Connection manager for {@link net.moznion.dispatchq.broker.InMemoryJobBroker}, whose availability is fixed
 * at construction.
 */
@Slf4j
public class InMemoryConnectionManager implements BrokerConnectionManager {
    private final boolean reachable;
    private final ConnectionOptions options;

    private volatile boolean available;

    public InMemoryConnectionManager(final boolean reachable) {
        this.reachable = reachable;
        options = ConnectionOptions.builder().host("in-memory").port(0).build();
        available = false;
    }

    @Override
    public boolean connect() {
        if (!reachable) {
            log.warn("In-memory broker is configured as unreachable, background jobs are disabled");
        }
        available = reachable;
        return available;
    }

    @Override
    public boolean isAvailable() {
        return available;
    }

    @Override
    public ConnectionOptions connectionOptions() {
        return options;
    }

    @Override
    public void close() {
        available = false;
    }
}
