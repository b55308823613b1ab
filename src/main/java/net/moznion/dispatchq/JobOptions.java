package net.moznion.dispatchq;

import java.util.Optional;

import net.moznion.dispatchq.backoff.BackoffPolicy;

import lombok.Builder;
import lombok.Value;

/**
 * Per-job overrides given at enqueue time. Absent values fall back to the queue's settings.
 */
@Value
@Builder
public class JobOptions {
    /**
     * Largest accepted priority. Lower values are claimed first; 0 is the default lane.
     */
    public static final int MAX_PRIORITY = 2_097_152;

    private static final JobOptions DEFAULTS = JobOptions.builder().build();

    Integer maxAttempts;
    BackoffPolicy backoff;
    Integer priority;
    /**
     * Caller-chosen id. Enqueueing twice with the same id yields one job while the first is retained.
     */
    String jobId;

    public static JobOptions defaults() {
        return DEFAULTS;
    }

    public Optional<String> getJobIdIfPresent() {
        return Optional.ofNullable(jobId);
    }
}
