package net.moznion.dispatchq.broker;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

import net.moznion.dispatchq.Job;
import net.moznion.dispatchq.JobOptions;
import net.moznion.dispatchq.JobStatus;
import net.moznion.dispatchq.backoff.BackoffPolicy;
import net.moznion.dispatchq.backoff.BackoffStrategy;
import net.moznion.dispatchq.connection.RedisConnectionManager;
import net.moznion.dispatchq.exception.BrokerException;
import net.moznion.dispatchq.exception.BrokerUnavailableException;
import net.moznion.dispatchq.exception.InvalidPayloadException;
import net.moznion.dispatchq.queue.QueueSettingsRegistry;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import redis.clients.jedis.Jedis;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.Transaction;
import redis.clients.jedis.exceptions.JedisConnectionException;
import redis.clients.jedis.exceptions.JedisException;
import redis.clients.jedis.params.ZAddParams;

/**
 * Durable broker on top of Redis.
 * <p>
 * Key layout, with {@code ns} being the configured namespace:
 * <ul>
 * <li>{@code ns|id} job id counter, {@code ns|seq} waiting order counter</li>
 * <li>{@code ns|job|<id>} the job record as JSON</li>
 * <li>{@code ns|queue|<name>|waiting} sorted set scored by priority, then enqueue order</li>
 * <li>{@code ns|queue|<name>|delayed} sorted set scored by the epoch millis a retry becomes due</li>
 * <li>{@code ns|queue|<name>|active} sorted set scored by the epoch millis a lease expires</li>
 * <li>{@code ns|queue|<name>|rank} hash of job id to its waiting score</li>
 * <li>{@code ns|queue|<name>|completed} and {@code |failed} lists of finished job ids, newest first</li>
 * </ul>
 */
@Slf4j
public class RedisJobBroker implements JobBroker {
    private static final String UNREADABLE_ERROR = "job record could not be restored";

    // 2^31 enqueue positions per priority lane; the largest score stays below 2^53, so doubles hold it exactly
    private static final long PRIORITY_STRIDE = 1L << 31;

    private static final String ENQUEUE_SCRIPT =
            "if redis.call('SET', KEYS[1], ARGV[1], 'NX') then\n" +
            "  redis.call('HSET', KEYS[3], ARGV[3], ARGV[2])\n" +
            "  redis.call('ZADD', KEYS[2], ARGV[2], ARGV[3])\n" +
            "  return 1\n" +
            "end\n" +
            "return 0";

    private static final String CLAIM_SCRIPT =
            "local ids = redis.call('ZRANGE', KEYS[1], 0, 0)\n" +
            "if #ids == 0 then return false end\n" +
            "redis.call('ZREM', KEYS[1], ids[1])\n" +
            "redis.call('ZADD', KEYS[2], ARGV[1], ids[1])\n" +
            "return ids[1]";

    private static final String PROMOTE_SCRIPT =
            "local ids = redis.call('ZRANGEBYSCORE', KEYS[1], '-inf', ARGV[1])\n" +
            "for _, id in ipairs(ids) do\n" +
            "  redis.call('ZREM', KEYS[1], id)\n" +
            "  local score = redis.call('HGET', KEYS[3], id) or '0'\n" +
            "  redis.call('ZADD', KEYS[2], score, id)\n" +
            "end\n" +
            "return #ids";

    private final JedisPool jedisPool;
    private final String namespace;
    private final QueueSettingsRegistry settingsRegistry;
    private final Clock clock;
    private final ObjectMapper mapper;

    private volatile boolean closed;

    public RedisJobBroker(final RedisConnectionManager connectionManager,
                          final QueueSettingsRegistry settingsRegistry) {
        this(connectionManager.getJedisPool(),
             connectionManager.connectionOptions().getNamespace(),
             settingsRegistry,
             Clock.systemUTC());
    }

    public RedisJobBroker(final JedisPool jedisPool,
                          final String namespace,
                          final QueueSettingsRegistry settingsRegistry,
                          final Clock clock) {
        this.jedisPool = jedisPool;
        this.namespace = namespace;
        this.settingsRegistry = settingsRegistry;
        this.clock = clock;
        mapper = new ObjectMapper();
        closed = false;
    }

    @Override
    public String enqueue(final String queueName, final Object payload, final JobOptions options) {
        final JsonNode serializedPayload;
        try {
            serializedPayload = mapper.valueToTree(payload);
        } catch (IllegalArgumentException e) {
            throw new InvalidPayloadException(queueName, "payload is not serializable: " + e.getMessage());
        }
        // a payload that cannot be read back would be lost at claim time
        if (payload != null) {
            try {
                mapper.treeToValue(serializedPayload, payload.getClass());
            } catch (JsonProcessingException | IllegalArgumentException e) {
                throw new InvalidPayloadException(queueName, "payload cannot be restored as " +
                                                             payload.getClass().getName() + ": " + e.getMessage());
            }
        }

        return withJedis(jedis -> {
            final String id = options.getJobIdIfPresent()
                                     .orElseGet(() -> String.valueOf(jedis.incr(getIdPodKey())));
            final long now = clock.millis();
            final JobRecord record = new JobRecord(id,
                                                   queueName,
                                                   payload == null ? null : payload.getClass().getName(),
                                                   serializedPayload,
                                                   0,
                                                   options.getMaxAttempts(),
                                                   options.getBackoff().getStrategy().name(),
                                                   options.getBackoff().getBaseDelayMillis(),
                                                   options.getBackoff().getFactor(),
                                                   options.getBackoff().getMaxDelayMillis(),
                                                   options.getPriority(),
                                                   JobStatus.QUEUED.name(),
                                                   null,
                                                   now,
                                                   now);
            final long score = waitingScore(jedis, options.getPriority());

            final Object created = jedis.eval(ENQUEUE_SCRIPT,
                                              Arrays.asList(getJobKey(id),
                                                            getWaitingKey(queueName),
                                                            getRankKey(queueName)),
                                              Arrays.asList(serialize(record), String.valueOf(score), id));
            if (Long.valueOf(0L).equals(created)) {
                log.info("Duplicated job is ignored [queueName={}, jobId={}]", queueName, id);
            }
            return id;
        });
    }

    @Override
    public Optional<Job> dequeue(final String queueName, final long leaseMillis) {
        return withJedis(jedis -> {
            while (true) {
                final Instant now = clock.instant();
                final Object claimedId = jedis.eval(CLAIM_SCRIPT,
                                                    Arrays.asList(getWaitingKey(queueName),
                                                                  getActiveKey(queueName)),
                                                    Collections.singletonList(
                                                            String.valueOf(now.toEpochMilli() + leaseMillis)));
                if (claimedId == null) {
                    return Optional.<Job>empty();
                }

                final String id = claimedId.toString();
                final Optional<Job> maybeJob = loadTaken(jedis, queueName, id, now);
                if (!maybeJob.isPresent()) {
                    log.warn("Claimed job is gone or already finished [queueName={}, jobId={}]", queueName, id);
                    jedis.zrem(getActiveKey(queueName), id);
                    continue;
                }

                final Job job = maybeJob.get();
                if (job.getStatus() == JobStatus.FAILED) {
                    return maybeJob;
                }
                if (!job.hasAttemptsLeft()) {
                    return Optional.of(markFailed(jedis, job, job.getLastErrorIfPresent().orElse(STALLED_ERROR), now));
                }

                final Job claimed = job.claimed(now);
                store(jedis, claimed);
                return Optional.of(claimed);
            }
        });
    }

    @Override
    public void extendLease(final String queueName, final Collection<String> ids, final long leaseMillis) {
        if (ids.isEmpty()) {
            return;
        }
        withJedis(jedis -> {
            final double deadline = clock.millis() + leaseMillis;
            for (final String id : ids) {
                jedis.zadd(getActiveKey(queueName), deadline, id, ZAddParams.zAddParams().xx());
            }
            return null;
        });
    }

    @Override
    public Job complete(final Job job) {
        return withJedis(jedis -> {
            final Job current = current(jedis, job);
            if (current.getStatus().isTerminal()) {
                log.warn("Job already finished [queueName={}, jobId={}, status={}]",
                         current.getQueueName(), current.getId(), current.getStatus());
                return current;
            }

            final Job completed = current.completed(clock.instant());
            final String queueName = completed.getQueueName();
            final Transaction tx = jedis.multi();
            forget(tx, queueName, completed.getId());
            tx.set(getJobKey(completed.getId()), serialize(toRecord(completed)));
            tx.lpush(getCompletedKey(queueName), completed.getId());
            tx.exec();

            trim(jedis, getCompletedKey(queueName), settingsRegistry.get(queueName).getRemoveOnComplete());
            return completed;
        });
    }

    @Override
    public Job fail(final Job job, final String error) {
        return withJedis(jedis -> {
            final Job current = current(jedis, job);
            if (current.getStatus().isTerminal()) {
                log.warn("Job already finished [queueName={}, jobId={}, status={}]",
                         current.getQueueName(), current.getId(), current.getStatus());
                return current;
            }
            return markFailed(jedis, current, error, clock.instant());
        });
    }

    @Override
    public Job release(final Job job) {
        return withJedis(jedis -> {
            final Job current = current(jedis, job);
            final String queueName = current.getQueueName();
            if (jedis.zrem(getActiveKey(queueName), current.getId()) == 0) {
                return current;
            }

            final Job released = current.released(clock.instant());
            final double score = rankOf(jedis, released);
            final Transaction tx = jedis.multi();
            tx.set(getJobKey(released.getId()), serialize(toRecord(released)));
            tx.zadd(getWaitingKey(queueName), score, released.getId());
            tx.exec();
            return released;
        });
    }

    @Override
    public Optional<Job> getJob(final String id) {
        return withJedis(jedis -> load(jedis, id));
    }

    @Override
    public int retry(final String queueName) {
        return withJedis(jedis -> {
            final Object promoted = jedis.eval(PROMOTE_SCRIPT,
                                               Arrays.asList(getDelayedKey(queueName),
                                                             getWaitingKey(queueName),
                                                             getRankKey(queueName)),
                                               Collections.singletonList(String.valueOf(clock.millis())));
            return promoted == null ? 0 : ((Long) promoted).intValue();
        });
    }

    @Override
    public Job registerRetryJob(final Job job, final String error, final long delayMillis) {
        return withJedis(jedis -> {
            final Job current = current(jedis, job);
            if (!current.hasAttemptsLeft()) {
                throw new IllegalStateException("Job " + current.getId() + " has no attempts left");
            }

            final Instant now = clock.instant();
            final Job retrying = current.retrying(error, now);
            final String queueName = retrying.getQueueName();
            final Transaction tx = jedis.multi();
            tx.zrem(getActiveKey(queueName), retrying.getId());
            tx.set(getJobKey(retrying.getId()), serialize(toRecord(retrying)));
            tx.zadd(getDelayedKey(queueName), now.toEpochMilli() + delayMillis, retrying.getId());
            tx.exec();
            return retrying;
        });
    }

    @Override
    public List<Job> recoverStalledJobs(final String queueName) {
        return withJedis(jedis -> {
            final Instant now = clock.instant();
            final List<String> stalledIds =
                    jedis.zrangeByScore(getActiveKey(queueName), "-inf", String.valueOf(now.toEpochMilli()));

            final List<Job> recovered = new ArrayList<>(stalledIds.size());
            for (final String id : stalledIds) {
                // whoever removes the entry owns the recovery
                if (jedis.zrem(getActiveKey(queueName), id) == 0) {
                    continue;
                }

                final Optional<Job> maybeJob = loadTaken(jedis, queueName, id, now);
                if (!maybeJob.isPresent()) {
                    continue;
                }

                final Job job = maybeJob.get();
                if (job.getStatus() == JobStatus.FAILED) {
                    recovered.add(job);
                } else if (job.hasAttemptsLeft()) {
                    final Job requeued = job.requeued(now);
                    final double score = rankOf(jedis, requeued);
                    final Transaction tx = jedis.multi();
                    tx.set(getJobKey(id), serialize(toRecord(requeued)));
                    tx.zadd(getWaitingKey(queueName), score, id);
                    tx.exec();
                    recovered.add(requeued);
                    log.warn("Stalled job is requeued [queueName={}, jobId={}, attempt={}]",
                             queueName, id, job.getAttempt());
                } else {
                    recovered.add(markFailed(jedis, job, STALLED_ERROR, now));
                    log.warn("Stalled job is failed [queueName={}, jobId={}, attempt={}]",
                             queueName, id, job.getAttempt());
                }
            }
            return recovered;
        });
    }

    @Override
    public long getNumberOfWaitingJobs(final String queueName) {
        return withJedis(jedis -> jedis.zcard(getWaitingKey(queueName)));
    }

    @Override
    public long getNumberOfRetryWaitingJobs(final String queueName) {
        return withJedis(jedis -> jedis.zcard(getDelayedKey(queueName)));
    }

    @Override
    public long getNumberOfActiveJobs(final String queueName) {
        return withJedis(jedis -> jedis.zcard(getActiveKey(queueName)));
    }

    @Override
    public long getNumberOfCompletedJobs(final String queueName) {
        return withJedis(jedis -> jedis.llen(getCompletedKey(queueName)));
    }

    @Override
    public long getNumberOfFailedJobs(final String queueName) {
        return withJedis(jedis -> jedis.llen(getFailedKey(queueName)));
    }

    /**
     * The pool belongs to the connection manager; closing the broker only stops this handle.
     */
    @Override
    public void close() {
        closed = true;
    }

    private Job markFailed(final Jedis jedis, final Job job, final String error, final Instant now) {
        final Job failed = job.failed(error, now);
        storeFailed(jedis, failed.getQueueName(), failed.getId(), serialize(toRecord(failed)));
        return failed;
    }

    /**
     * Moves a job to the failed list. A {@code null} record leaves the stored record untouched.
     */
    private void storeFailed(final Jedis jedis, final String queueName, final String id, final String record) {
        final Transaction tx = jedis.multi();
        forget(tx, queueName, id);
        if (record != null) {
            tx.set(getJobKey(id), record);
        }
        tx.lpush(getFailedKey(queueName), id);
        tx.exec();

        trim(jedis, getFailedKey(queueName), settingsRegistry.get(queueName).getRemoveOnFail());
    }

    private void forget(final Transaction tx, final String queueName, final String id) {
        tx.zrem(getActiveKey(queueName), id);
        tx.zrem(getWaitingKey(queueName), id);
        tx.zrem(getDelayedKey(queueName), id);
        tx.hdel(getRankKey(queueName), id);
    }

    private void trim(final Jedis jedis, final String finishedKey, final int keep) {
        if (keep < 0) {
            return;
        }

        final List<String> expiredIds = jedis.lrange(finishedKey, keep, -1);
        if (expiredIds.isEmpty()) {
            return;
        }

        final String[] expiredKeys = expiredIds.stream().map(this::getJobKey).toArray(String[]::new);
        final Transaction tx = jedis.multi();
        tx.del(expiredKeys);
        tx.ltrim(finishedKey, 0, keep - 1L);
        tx.exec();
    }

    private double rankOf(final Jedis jedis, final Job job) {
        final String rank = jedis.hget(getRankKey(job.getQueueName()), job.getId());
        if (rank != null) {
            return Double.parseDouble(rank);
        }

        final long score = waitingScore(jedis, job.getPriority());
        jedis.hset(getRankKey(job.getQueueName()), job.getId(), String.valueOf(score));
        return score;
    }

    private long waitingScore(final Jedis jedis, final int priority) {
        return priority * PRIORITY_STRIDE + jedis.incr(getSequenceKey()) % PRIORITY_STRIDE;
    }

    private Job current(final Jedis jedis, final Job job) {
        return load(jedis, job.getId())
                .orElseThrow(() -> new IllegalArgumentException("Unknown job [jobId=" + job.getId() + ']'));
    }

    private Optional<Job> load(final Jedis jedis, final String id) {
        final String serialized = jedis.get(getJobKey(id));
        if (serialized == null) {
            return Optional.empty();
        }
        final JobRecord record = deserialize(serialized);
        try {
            return Optional.of(toJob(record));
        } catch (BrokerException e) {
            // a record failed for its payload stays inspectable
            if (JobStatus.FAILED.name().equals(record.getStatus())) {
                return Optional.of(toJobWithoutPayload(record));
            }
            throw e;
        }
    }

    /**
     * Loads a job that was just taken out of a queue set by a claim or a stall recovery.
     * A record that cannot be restored is failed on the spot and returned as such, since nothing
     * else would ever pick it up again. Empty when the record is gone or already finished.
     */
    private Optional<Job> loadTaken(final Jedis jedis, final String queueName, final String id, final Instant now) {
        final String serialized = jedis.get(getJobKey(id));
        if (serialized == null) {
            return Optional.empty();
        }

        final JobRecord record;
        final Job withoutPayload;
        try {
            record = deserialize(serialized);
            withoutPayload = toJobWithoutPayload(record);
        } catch (RuntimeException e) {
            log.error("Job record is unreadable, failing it [queueName={}, jobId={}]", queueName, id, e);
            storeFailed(jedis, queueName, id, null);
            return Optional.of(Job.builder()
                                  .id(id)
                                  .queueName(queueName)
                                  .status(JobStatus.FAILED)
                                  .lastError(UNREADABLE_ERROR)
                                  .createdAt(now)
                                  .updatedAt(now)
                                  .build());
        }
        if (withoutPayload.getStatus().isTerminal()) {
            return Optional.empty();
        }

        final Job job;
        try {
            job = toJob(record);
        } catch (BrokerException e) {
            log.error("Job payload cannot be restored, failing it [queueName={}, jobId={}, payloadClass={}]",
                      queueName, id, record.getPayloadClass(), e);
            final Job failed = withoutPayload.failed(UNREADABLE_ERROR + ": " + e.getMessage(), now);
            record.setStatus(failed.getStatus().name());
            record.setLastError(failed.getLastError());
            record.setUpdatedAt(now.toEpochMilli());
            storeFailed(jedis, queueName, id, serialize(record));
            return Optional.of(failed);
        }
        return Optional.of(job);
    }
    private void store(final Jedis jedis, final Job job) {
        jedis.set(getJobKey(job.getId()), serialize(toRecord(job)));
    }

    private <R> R withJedis(final Function<Jedis, R> action) {
        if (closed) {
            throw new BrokerUnavailableException("Redis job broker is closed");
        }

        try (final Jedis jedis = jedisPool.getResource()) {
            return action.apply(jedis);
        } catch (JedisConnectionException e) {
            throw new BrokerUnavailableException("Redis is not reachable", e);
        } catch (JedisException e) {
            throw new BrokerException("Redis command failed", e);
        }
    }

    private String serialize(final JobRecord record) {
        try {
            return mapper.writeValueAsString(record);
        } catch (JsonProcessingException e) {
            throw new BrokerException("Failed to serialize job [jobId=" + record.getId() + ']', e);
        }
    }

    private JobRecord deserialize(final String serialized) {
        try {
            return mapper.readValue(serialized, JobRecord.class);
        } catch (IOException e) {
            throw new BrokerException("Failed to deserialize job record", e);
        }
    }

    private JobRecord toRecord(final Job job) {
        final Object payload = job.getPayload();
        final BackoffPolicy backoff = job.getBackoff();
        return new JobRecord(job.getId(),
                             job.getQueueName(),
                             payload == null ? null : payload.getClass().getName(),
                             mapper.valueToTree(payload),
                             job.getAttempt(),
                             job.getMaxAttempts(),
                             backoff.getStrategy().name(),
                             backoff.getBaseDelayMillis(),
                             backoff.getFactor(),
                             backoff.getMaxDelayMillis(),
                             job.getPriority(),
                             job.getStatus().name(),
                             job.getLastError(),
                             job.getCreatedAt().toEpochMilli(),
                             job.getUpdatedAt().toEpochMilli());
    }

    private Job toJob(final JobRecord record) {
        final Object payload;
        if (record.getPayloadClass() == null) {
            payload = null;
        } else {
            try {
                payload = mapper.treeToValue(record.getPayload(), Class.forName(record.getPayloadClass()));
            } catch (ClassNotFoundException | JsonProcessingException | IllegalArgumentException e) {
                throw new BrokerException("Failed to restore payload [jobId=" + record.getId() +
                                          ", payloadClass=" + record.getPayloadClass() + ']', e);
            }
        }
        return toJobWithoutPayload(record).toBuilder().payload(payload).build();
    }

    private Job toJobWithoutPayload(final JobRecord record) {
        return Job.builder()
                  .id(record.getId())
                  .queueName(record.getQueueName())
                  .attempt(record.getAttempt())
                  .maxAttempts(record.getMaxAttempts())
                  .backoff(new BackoffPolicy(BackoffStrategy.valueOf(record.getBackoffStrategy()),
                                             record.getBackoffBaseDelayMillis(),
                                             record.getBackoffFactor(),
                                             record.getBackoffMaxDelayMillis()))
                  .priority(record.getPriority())
                  .status(JobStatus.valueOf(record.getStatus()))
                  .lastError(record.getLastError())
                  .createdAt(Instant.ofEpochMilli(record.getCreatedAt()))
                  .updatedAt(Instant.ofEpochMilli(record.getUpdatedAt()))
                  .build();
    }

    private String getIdPodKey() {
        return namespace + "|id";
    }

    private String getSequenceKey() {
        return namespace + "|seq";
    }

    private String getJobKey(final String id) {
        return namespace + "|job|" + id;
    }

    private String getWaitingKey(final String queueName) {
        return namespace + "|queue|" + queueName + "|waiting";
    }

    private String getDelayedKey(final String queueName) {
        return namespace + "|queue|" + queueName + "|delayed";
    }

    private String getActiveKey(final String queueName) {
        return namespace + "|queue|" + queueName + "|active";
    }

    private String getRankKey(final String queueName) {
        return namespace + "|queue|" + queueName + "|rank";
    }

    private String getCompletedKey(final String queueName) {
        return namespace + "|queue|" + queueName + "|completed";
    }

    private String getFailedKey(final String queueName) {
        return namespace + "|queue|" + queueName + "|failed";
    }

    @Data
    @AllArgsConstructor
    @NoArgsConstructor
    private static class JobRecord {
        private String id;
        private String queueName;
        private String payloadClass;
        private JsonNode payload;
        private int attempt;
        private int maxAttempts;
        private String backoffStrategy;
        private long backoffBaseDelayMillis;
        private double backoffFactor;
        private long backoffMaxDelayMillis;
        private int priority;
        private String status;
        private String lastError;
        private long createdAt;
        private long updatedAt;
    }
}
