package net.moznion.dispatchq.worker;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import net.moznion.dispatchq.Job;
import net.moznion.dispatchq.JobStatus;
import net.moznion.dispatchq.broker.JobBroker;
import net.moznion.dispatchq.event.EventDispatcher;
import net.moznion.dispatchq.event.FailedEvent;
import net.moznion.dispatchq.event.PoolErrorEvent;

import lombok.extern.slf4j.Slf4j;

/**
 * Periodic housekeeping of a pool: keeps leases of running jobs alive, hands stalled jobs out again
 * (reporting the ones that ran out of attempts), and moves retries whose delay elapsed back to the waiting set.
 */
@Slf4j
public class SimpleMaintenanceWorker extends AbstractLoopWorker {
    private final String queueName;
    private final JobBroker jobBroker;
    private final WorkerOptions options;
    private final Map<String, Job> inFlight;
    private final EventDispatcher eventDispatcher;

    SimpleMaintenanceWorker(final String queueName,
                            final JobBroker jobBroker,
                            final WorkerOptions options,
                            final Map<String, Job> inFlight,
                            final EventDispatcher eventDispatcher) {
        this.queueName = queueName;
        this.jobBroker = jobBroker;
        this.options = options;
        this.inFlight = inFlight;
        this.eventDispatcher = eventDispatcher;
    }

    @Override
    protected void loop() {
        while (!isShuttingDown()) {
            runOnce();
            idle(options.getMaintenanceIntervalMillis());
        }
    }

    void runOnce() {
        final List<String> runningIds = new ArrayList<>(inFlight.keySet());
        if (!runningIds.isEmpty()) {
            try {
                jobBroker.extendLease(queueName, runningIds, options.getLeaseMillis());
            } catch (RuntimeException e) {
                reportPoolError("Failed to extend leases", e);
            }
        }

        try {
            final List<Job> recovered = jobBroker.recoverStalledJobs(queueName);
            if (!recovered.isEmpty()) {
                log.warn("Recovered stalled jobs [queueName={}, count={}]", queueName, recovered.size());
            }
            for (final Job job : recovered) {
                if (job.getStatus() == JobStatus.FAILED) {
                    eventDispatcher.failed(
                            new FailedEvent(job.getId(), queueName, job.getAttempt(), job.getLastError(), null));
                }
            }
        } catch (RuntimeException e) {
            reportPoolError("Failed to recover stalled jobs", e);
        }

        try {
            final int promoted = jobBroker.retry(queueName);
            if (promoted > 0) {
                log.debug("Retry jobs promoted [queueName={}, count={}]", queueName, promoted);
            }
        } catch (RuntimeException e) {
            reportPoolError("Failed to promote retry jobs", e);
        }
    }

    private void reportPoolError(final String message, final RuntimeException e) {
        log.warn("{} [queueName={}, cause={}]", message, queueName, e.getMessage());
        eventDispatcher.poolError(
                new PoolErrorEvent(queueName, message + ": " + SimpleWorker.errorMessageOf(e), e));
    }
}
