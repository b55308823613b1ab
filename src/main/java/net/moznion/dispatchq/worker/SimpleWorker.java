package net.moznion.dispatchq.worker;

import java.util.Map;
import java.util.Optional;

import net.moznion.dispatchq.Job;
import net.moznion.dispatchq.JobStatus;
import net.moznion.dispatchq.broker.JobBroker;
import net.moznion.dispatchq.event.CompletedEvent;
import net.moznion.dispatchq.event.EventDispatcher;
import net.moznion.dispatchq.event.FailedEvent;
import net.moznion.dispatchq.event.PoolErrorEvent;

import lombok.extern.slf4j.Slf4j;

/**
 * One slot of a pool: claims a job, runs the processor, reports the outcome, and only then claims again.
 */
@Slf4j
public class SimpleWorker extends AbstractLoopWorker {
    private final String queueName;
    private final JobBroker jobBroker;
    private final Processor processor;
    private final WorkerOptions options;
    private final Map<String, Job> inFlight;
    private final RateLimiter rateLimiter;
    private final EventDispatcher eventDispatcher;

    SimpleWorker(final String queueName,
                 final JobBroker jobBroker,
                 final Processor processor,
                 final WorkerOptions options,
                 final Map<String, Job> inFlight,
                 final RateLimiter rateLimiter,
                 final EventDispatcher eventDispatcher) {
        this.queueName = queueName;
        this.jobBroker = jobBroker;
        this.processor = processor;
        this.options = options;
        this.inFlight = inFlight;
        this.rateLimiter = rateLimiter;
        this.eventDispatcher = eventDispatcher;
    }

    @Override
    protected void loop() {
        while (!isShuttingDown()) {
            try {
                if (!step()) {
                    break;
                }
            } catch (RuntimeException e) {
                reportPoolError("Unexpected error in worker", e);
                idle(options.getPollIntervalMillis());
            }
        }
    }

    /**
     * Runs one claim cycle.
     *
     * @return false when the slot has to leave its loop
     */
    private boolean step() {
        if (rateLimiter != null && !rateLimiter.tryAcquire()) {
            idle(Math.max(1, Math.min(options.getPollIntervalMillis(), rateLimiter.millisUntilNextWindow())));
            return true;
        }

        final Optional<Job> maybeJob;
        try {
            maybeJob = jobBroker.dequeue(queueName, options.getLeaseMillis());
        } catch (RuntimeException e) {
            refundPermit();
            reportPoolError("Failed to claim a job", e);
            idle(options.getPollIntervalMillis());
            return true;
        }

        if (!maybeJob.isPresent()) {
            // queue is empty
            refundPermit();
            idle(options.getPollIntervalMillis());
            return true;
        }

        final Job job = maybeJob.get();
        if (job.getStatus() == JobStatus.FAILED) {
            // failed by the broker while claiming; nothing to run
            refundPermit();
            log.warn("Job failed on claim [queueName={}, jobId={}, attempt={}, error={}]",
                     queueName, job.getId(), job.getAttempt(), job.getLastError());
            eventDispatcher.failed(
                    new FailedEvent(job.getId(), queueName, job.getAttempt(), job.getLastError(), null));
            return true;
        }
        if (isShuttingDown()) {
            release(job);
            return false;
        }
        handle(job);
        return true;
    }

    private void handle(final Job job) {
        inFlight.put(job.getId(), job);
        try {
            try {
                processor.process(job);
            } catch (VirtualMachineError e) {
                throw e;
            } catch (Throwable e) {
                onFailure(job, e);
                return;
            }
            onSuccess(job);
        } finally {
            inFlight.remove(job.getId());
        }
    }

    private void onSuccess(final Job job) {
        try {
            jobBroker.complete(job);
        } catch (RuntimeException e) {
            reportPoolError("Failed to mark job as completed [jobId=" + job.getId() + ']', e);
            return;
        }
        eventDispatcher.completed(new CompletedEvent(job.getId(), queueName));
    }

    private void onFailure(final Job job, final Throwable cause) {
        final String error = errorMessageOf(cause);

        if (job.hasAttemptsLeft()) {
            final long delayMillis = job.getBackoff().delayFor(job.getAttempt());
            try {
                jobBroker.registerRetryJob(job, error, delayMillis);
            } catch (RuntimeException e) {
                reportPoolError("Failed to schedule retry [jobId=" + job.getId() + ']', e);
                return;
            }
            log.info("Job failed, retry scheduled [queueName={}, jobId={}, attempt={}, maxAttempts={}, " +
                     "delayMillis={}, error={}]",
                     queueName, job.getId(), job.getAttempt(), job.getMaxAttempts(), delayMillis, error);
            return;
        }

        try {
            jobBroker.fail(job, error);
        } catch (RuntimeException e) {
            reportPoolError("Failed to mark job as failed [jobId=" + job.getId() + ']', e);
            return;
        }
        eventDispatcher.failed(new FailedEvent(job.getId(), queueName, job.getAttempt(), error, cause));
    }

    private void release(final Job job) {
        try {
            jobBroker.release(job);
            log.info("Job released on shutdown [queueName={}, jobId={}]", queueName, job.getId());
        } catch (RuntimeException e) {
            reportPoolError("Failed to release job on shutdown [jobId=" + job.getId() + ']', e);
        }
    }

    private void refundPermit() {
        if (rateLimiter != null) {
            rateLimiter.refund();
        }
    }

    private void reportPoolError(final String message, final RuntimeException e) {
        log.warn("{} [queueName={}, cause={}]", message, queueName, e.getMessage());
        eventDispatcher.poolError(new PoolErrorEvent(queueName, message + ": " + errorMessageOf(e), e));
    }

    static String errorMessageOf(final Throwable e) {
        final String message = e.getMessage();
        return message == null || message.isEmpty() ? e.getClass().getName() : message;
    }
}
