package net.moznion.dispatchq.worker;

import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class WorkerOptions {
    /**
     * Number of slots; at most this many jobs of the queue run at once in this pool.
     */
    @Builder.Default
    int concurrency = 1;
    /**
     * How long an idle slot waits before polling an empty queue again.
     */
    @Builder.Default
    long pollIntervalMillis = 1000;
    @Builder.Default
    long leaseMillis = 30_000;
    @Builder.Default
    long maintenanceIntervalMillis = 1000;
    /**
     * Job starts allowed per {@link #rateLimitDurationMillis} across all slots; {@code 0} disables the limit.
     */
    @Builder.Default
    int rateLimitMax = 0;
    @Builder.Default
    long rateLimitDurationMillis = 60_000;

    public static WorkerOptions defaults() {
        return builder().build();
    }

    public boolean isRateLimited() {
        return rateLimitMax > 0;
    }

    public void validate() {
        if (concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be >= 1: " + concurrency);
        }
        if (pollIntervalMillis < 1) {
            throw new IllegalArgumentException("pollIntervalMillis must be >= 1: " + pollIntervalMillis);
        }
        if (maintenanceIntervalMillis < 1) {
            throw new IllegalArgumentException(
                    "maintenanceIntervalMillis must be >= 1: " + maintenanceIntervalMillis);
        }
        if (leaseMillis <= maintenanceIntervalMillis) {
            throw new IllegalArgumentException("leaseMillis must be longer than maintenanceIntervalMillis [lease="
                                               + leaseMillis + ", maintenance=" + maintenanceIntervalMillis + ']');
        }
        if (rateLimitMax < 0 || (rateLimitMax > 0 && rateLimitDurationMillis < 1)) {
            throw new IllegalArgumentException("invalid rate limit [max=" + rateLimitMax +
                                               ", durationMillis=" + rateLimitDurationMillis + ']');
        }
    }
}
