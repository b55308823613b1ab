package net.moznion.dispatchq;

import java.time.Instant;
import java.util.Optional;

import net.moznion.dispatchq.backoff.BackoffPolicy;

import lombok.Builder;
import lombok.Value;

/**
 * A unit of work held by a {@link net.moznion.dispatchq.broker.JobBroker}.
 * <p>
 * Instances are immutable. State transitions return a new {@code Job}; only {@code attempt},
 * {@code status}, {@code lastError} and {@code updatedAt} ever differ between two values of the same job.
 */
@Value
@Builder(toBuilder = true)
public class Job {
    String id;
    String queueName;
    Object payload;
    int attempt;
    int maxAttempts;
    BackoffPolicy backoff;
    int priority;
    JobStatus status;
    String lastError;
    Instant createdAt;
    Instant updatedAt;

    public <T> T getPayload(final Class<T> payloadClass) {
        if (!payloadClass.isInstance(payload)) {
            throw new ClassCastException("Job " + id + " carries " +
                                         (payload == null ? "no payload" : payload.getClass().getName()) +
                                         ", not " + payloadClass.getName());
        }
        return payloadClass.cast(payload);
    }

    public Optional<String> getLastErrorIfPresent() {
        return Optional.ofNullable(lastError);
    }

    public boolean hasAttemptsLeft() {
        return attempt < maxAttempts;
    }

    public Job claimed(final Instant now) {
        if (!hasAttemptsLeft()) {
            throw new IllegalStateException(
                    "Job " + id + " has no attempts left [attempt=" + attempt + ", maxAttempts=" + maxAttempts + ']');
        }
        return toBuilder().attempt(attempt + 1)
                          .status(JobStatus.PROCESSING)
                          .updatedAt(now)
                          .build();
    }

    public Job retrying(final String error, final Instant now) {
        return toBuilder().status(JobStatus.QUEUED)
                          .lastError(error)
                          .updatedAt(now)
                          .build();
    }

    public Job completed(final Instant now) {
        return toBuilder().status(JobStatus.COMPLETED)
                          .lastError(null)
                          .updatedAt(now)
                          .build();
    }

    public Job failed(final String error, final Instant now) {
        return toBuilder().status(JobStatus.FAILED)
                          .lastError(error)
                          .updatedAt(now)
                          .build();
    }

    /**
     * Back to the waiting set without spending an attempt; used for jobs claimed after shutdown began.
     */
    public Job released(final Instant now) {
        return toBuilder().attempt(Math.max(0, attempt - 1))
                          .status(JobStatus.QUEUED)
                          .updatedAt(now)
                          .build();
    }

    /**
     * Back to the waiting set after its lease expired. The attempt stays spent.
     */
    public Job requeued(final Instant now) {
        return toBuilder().status(JobStatus.QUEUED)
                          .updatedAt(now)
                          .build();
    }
}
