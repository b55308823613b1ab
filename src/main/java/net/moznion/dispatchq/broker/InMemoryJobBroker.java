package net.moznion.dispatchq.broker;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Optional;
import java.util.TreeSet;
import java.util.concurrent.atomic.AtomicLong;

import net.moznion.dispatchq.Job;
import net.moznion.dispatchq.JobOptions;
import net.moznion.dispatchq.JobStatus;
import net.moznion.dispatchq.exception.BrokerUnavailableException;
import net.moznion.dispatchq.queue.QueueSettings;
import net.moznion.dispatchq.queue.QueueSettingsRegistry;

import lombok.Value;
import lombok.extern.slf4j.Slf4j;

/**
 * Process-local broker. Jobs live as long as the process, so it suits tests and single-node development.
 */
@Slf4j
public class InMemoryJobBroker implements JobBroker {
    private final QueueSettingsRegistry settingsRegistry;
    private final Clock clock;
    private final AtomicLong idPod;
    private final AtomicLong sequence;

    // guarded by this
    private final Map<String, Job> jobs;
    private final Map<String, QueueState> queues;
    private boolean closed;

    public InMemoryJobBroker(final QueueSettingsRegistry settingsRegistry) {
        this(settingsRegistry, Clock.systemUTC());
    }

    public InMemoryJobBroker(final QueueSettingsRegistry settingsRegistry, final Clock clock) {
        this.settingsRegistry = settingsRegistry;
        this.clock = clock;
        idPod = new AtomicLong();
        sequence = new AtomicLong();
        jobs = new HashMap<>();
        queues = new HashMap<>();
        closed = false;
    }

    @Override
    public synchronized String enqueue(final String queueName, final Object payload, final JobOptions options) {
        ensureOpen();

        final String id = options.getJobIdIfPresent()
                                 .orElseGet(() -> String.valueOf(idPod.incrementAndGet()));
        if (jobs.containsKey(id)) {
            log.info("Duplicated job is ignored [queueName={}, jobId={}]", queueName, id);
            return id;
        }

        final Instant now = clock.instant();
        final Job job = Job.builder()
                           .id(id)
                           .queueName(queueName)
                           .payload(payload)
                           .attempt(0)
                           .maxAttempts(options.getMaxAttempts())
                           .backoff(options.getBackoff())
                           .priority(options.getPriority())
                           .status(JobStatus.QUEUED)
                           .createdAt(now)
                           .updatedAt(now)
                           .build();
        jobs.put(id, job);

        final QueueState queue = queue(queueName);
        final WaitingEntry entry = new WaitingEntry(job.getPriority(), sequence.incrementAndGet(), id);
        queue.ranks.put(id, entry);
        queue.waiting.add(entry);
        return id;
    }

    @Override
    public synchronized Optional<Job> dequeue(final String queueName, final long leaseMillis) {
        ensureOpen();

        final QueueState queue = queue(queueName);
        final Instant now = clock.instant();
        WaitingEntry entry;
        while ((entry = queue.waiting.pollFirst()) != null) {
            final Job job = jobs.get(entry.getId());
            if (job == null) {
                queue.ranks.remove(entry.getId());
                continue;
            }
            if (!job.hasAttemptsLeft()) {
                return Optional.of(markFailed(queue, job, job.getLastErrorIfPresent().orElse(STALLED_ERROR), now));
            }

            final Job claimed = job.claimed(now);
            jobs.put(claimed.getId(), claimed);
            queue.active.put(claimed.getId(), now.toEpochMilli() + leaseMillis);
            return Optional.of(claimed);
        }
        return Optional.empty();
    }

    @Override
    public synchronized void extendLease(final String queueName,
                                         final Collection<String> ids,
                                         final long leaseMillis) {
        ensureOpen();

        final QueueState queue = queue(queueName);
        final long deadline = clock.millis() + leaseMillis;
        for (final String id : ids) {
            queue.active.computeIfPresent(id, (key, current) -> deadline);
        }
    }

    @Override
    public synchronized Job complete(final Job job) {
        ensureOpen();

        final Job current = current(job);
        if (current.getStatus().isTerminal()) {
            log.warn("Job already finished [queueName={}, jobId={}, status={}]",
                     current.getQueueName(), current.getId(), current.getStatus());
            return current;
        }

        final QueueState queue = queue(current.getQueueName());
        forget(queue, current.getId());
        final Job completed = current.completed(clock.instant());
        jobs.put(completed.getId(), completed);
        queue.completed.addLast(completed.getId());
        trim(queue.completed, settingsRegistry.get(completed.getQueueName()).getRemoveOnComplete());
        return completed;
    }

    @Override
    public synchronized Job fail(final Job job, final String error) {
        ensureOpen();

        final Job current = current(job);
        if (current.getStatus().isTerminal()) {
            log.warn("Job already finished [queueName={}, jobId={}, status={}]",
                     current.getQueueName(), current.getId(), current.getStatus());
            return current;
        }
        return markFailed(queue(current.getQueueName()), current, error, clock.instant());
    }

    @Override
    public synchronized Job release(final Job job) {
        ensureOpen();

        final Job current = current(job);
        final QueueState queue = queue(current.getQueueName());
        if (queue.active.remove(current.getId()) == null) {
            return current;
        }

        final Job released = current.released(clock.instant());
        jobs.put(released.getId(), released);
        queue.waiting.add(rankOf(queue, released));
        return released;
    }

    @Override
    public synchronized Optional<Job> getJob(final String id) {
        ensureOpen();
        return Optional.ofNullable(jobs.get(id));
    }

    @Override
    public synchronized int retry(final String queueName) {
        ensureOpen();

        final QueueState queue = queue(queueName);
        final long now = clock.millis();
        int promoted = 0;
        final Iterator<Entry<String, Long>> iterator = queue.delayed.entrySet().iterator();
        while (iterator.hasNext()) {
            final Entry<String, Long> delayed = iterator.next();
            if (delayed.getValue() > now) {
                continue;
            }
            iterator.remove();

            final Job job = jobs.get(delayed.getKey());
            if (job == null) {
                continue;
            }
            queue.waiting.add(rankOf(queue, job));
            promoted++;
        }
        return promoted;
    }

    @Override
    public synchronized Job registerRetryJob(final Job job, final String error, final long delayMillis) {
        ensureOpen();

        final Job current = current(job);
        if (!current.hasAttemptsLeft()) {
            throw new IllegalStateException("Job " + current.getId() + " has no attempts left");
        }

        final QueueState queue = queue(current.getQueueName());
        queue.active.remove(current.getId());
        final Instant now = clock.instant();
        final Job retrying = current.retrying(error, now);
        jobs.put(retrying.getId(), retrying);
        queue.delayed.put(retrying.getId(), now.toEpochMilli() + delayMillis);
        return retrying;
    }

    @Override
    public synchronized List<Job> recoverStalledJobs(final String queueName) {
        ensureOpen();

        final QueueState queue = queue(queueName);
        final Instant now = clock.instant();
        final List<String> stalledIds = new ArrayList<>();
        for (final Entry<String, Long> active : queue.active.entrySet()) {
            if (active.getValue() <= now.toEpochMilli()) {
                stalledIds.add(active.getKey());
            }
        }

        final List<Job> recovered = new ArrayList<>(stalledIds.size());
        for (final String id : stalledIds) {
            queue.active.remove(id);
            final Job job = jobs.get(id);
            if (job == null) {
                continue;
            }

            if (job.hasAttemptsLeft()) {
                final Job requeued = job.requeued(now);
                jobs.put(id, requeued);
                queue.waiting.add(rankOf(queue, requeued));
                recovered.add(requeued);
                log.warn("Stalled job is requeued [queueName={}, jobId={}, attempt={}]",
                         queueName, id, job.getAttempt());
            } else {
                recovered.add(markFailed(queue, job, STALLED_ERROR, now));
                log.warn("Stalled job is failed [queueName={}, jobId={}, attempt={}]",
                         queueName, id, job.getAttempt());
            }
        }
        return recovered;
    }

    @Override
    public synchronized long getNumberOfWaitingJobs(final String queueName) {
        return queue(queueName).waiting.size();
    }

    @Override
    public synchronized long getNumberOfRetryWaitingJobs(final String queueName) {
        return queue(queueName).delayed.size();
    }

    @Override
    public synchronized long getNumberOfActiveJobs(final String queueName) {
        return queue(queueName).active.size();
    }

    @Override
    public synchronized long getNumberOfCompletedJobs(final String queueName) {
        return queue(queueName).completed.size();
    }

    @Override
    public synchronized long getNumberOfFailedJobs(final String queueName) {
        return queue(queueName).failed.size();
    }

    @Override
    public synchronized void close() {
        closed = true;
    }

    private Job markFailed(final QueueState queue, final Job job, final String error, final Instant now) {
        forget(queue, job.getId());
        final Job failed = job.failed(error, now);
        jobs.put(failed.getId(), failed);
        queue.failed.addLast(failed.getId());
        trim(queue.failed, settingsRegistry.get(failed.getQueueName()).getRemoveOnFail());
        return failed;
    }

    private void forget(final QueueState queue, final String id) {
        queue.active.remove(id);
        queue.delayed.remove(id);
        final WaitingEntry entry = queue.ranks.remove(id);
        if (entry != null) {
            queue.waiting.remove(entry);
        }
    }

    private void trim(final Deque<String> finishedIds, final int keep) {
        if (keep < 0) {
            return;
        }
        while (finishedIds.size() > keep) {
            jobs.remove(finishedIds.pollFirst());
        }
    }

    private WaitingEntry rankOf(final QueueState queue, final Job job) {
        return queue.ranks.computeIfAbsent(
                job.getId(), id -> new WaitingEntry(job.getPriority(), sequence.incrementAndGet(), id));
    }

    private Job current(final Job job) {
        final Job current = jobs.get(job.getId());
        if (current == null) {
            throw new IllegalArgumentException("Unknown job [jobId=" + job.getId() + ']');
        }
        return current;
    }

    private QueueState queue(final String queueName) {
        return queues.computeIfAbsent(queueName, name -> new QueueState());
    }

    private void ensureOpen() {
        if (closed) {
            throw new BrokerUnavailableException("In-memory job broker is closed");
        }
    }

    @Value
    private static class WaitingEntry {
        int priority;
        long sequence;
        String id;
    }

    private static class QueueState {
        private final TreeSet<WaitingEntry> waiting =
                new TreeSet<>(Comparator.comparingInt(WaitingEntry::getPriority)
                                        .thenComparingLong(WaitingEntry::getSequence));
        private final Map<String, WaitingEntry> ranks = new HashMap<>();
        private final Map<String, Long> delayed = new HashMap<>();
        private final Map<String, Long> active = new HashMap<>();
        private final Deque<String> completed = new ArrayDeque<>();
        private final Deque<String> failed = new ArrayDeque<>();
    }
}
