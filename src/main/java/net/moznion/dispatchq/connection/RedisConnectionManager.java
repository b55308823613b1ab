package net.moznion.dispatchq.connection;

import net.moznion.dispatchq.exception.BrokerUnavailableException;

import lombok.extern.slf4j.Slf4j;
import redis.clients.jedis.Jedis;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.JedisPoolConfig;
import redis.clients.jedis.exceptions.JedisException;

@Slf4j
public class RedisConnectionManager implements BrokerConnectionManager {
    private final ConnectionOptions options;

    private volatile JedisPool jedisPool;
    private volatile boolean available;

    public RedisConnectionManager(final ConnectionOptions options) {
        this.options = options;
        available = false;
    }

    @Override
    public synchronized boolean connect() {
        if (available) {
            return true;
        }

        final JedisPoolConfig poolConfig = new JedisPoolConfig();
        poolConfig.setMaxTotal(options.getPoolSize());

        final JedisPool pool = new JedisPool(poolConfig,
                                             options.getHost(),
                                             options.getPort(),
                                             options.getTimeoutMillis(),
                                             options.hasPassword() ? options.getPassword() : null);
        try (final Jedis jedis = pool.getResource()) {
            jedis.ping();
        } catch (JedisException e) {
            log.warn("Redis is not reachable, background jobs are disabled [host={}, port={}, cause={}]",
                     options.getHost(), options.getPort(), e.getMessage());
            pool.close();
            return false;
        }

        jedisPool = pool;
        available = true;
        log.info("Connected to Redis [host={}, port={}, namespace={}]",
                 options.getHost(), options.getPort(), options.getNamespace());
        return true;
    }

    @Override
    public boolean isAvailable() {
        return available;
    }

    @Override
    public ConnectionOptions connectionOptions() {
        return options;
    }

    public JedisPool getJedisPool() {
        final JedisPool pool = jedisPool;
        if (!available || pool == null) {
            throw new BrokerUnavailableException(
                    "Redis is not connected [host=" + options.getHost() + ", port=" + options.getPort() + ']');
        }
        return pool;
    }

    @Override
    public synchronized void close() {
        available = false;
        if (jedisPool != null) {
            jedisPool.close();
            jedisPool = null;
            log.info("Redis connection closed [host={}, port={}]", options.getHost(), options.getPort());
        }
    }
}
