package net.moznion.dispatchq.queue;

import net.moznion.dispatchq.backoff.BackoffPolicy;

import lombok.Builder;
import lombok.Value;

/**
 * Defaults applied to every job of one queue, plus how many finished jobs the broker retains.
 */
@Value
@Builder(toBuilder = true)
public class QueueSettings {
    private static final QueueSettings DEFAULTS =
            QueueSettings.builder()
                         .maxAttempts(3)
                         .backoff(BackoffPolicy.exponential(5_000L).withMaxDelayMillis(300_000L))
                         .removeOnComplete(100)
                         .removeOnFail(200)
                         .build();

    // 3 s -> 6 s
    private static final QueueSettings EMAIL =
            DEFAULTS.toBuilder()
                    .backoff(BackoffPolicy.exponential(3_000L))
                    .build();

    // 5 s -> 10 s; finished checks are kept longer for inspection
    private static final QueueSettings PLAGIARISM =
            DEFAULTS.toBuilder()
                    .backoff(BackoffPolicy.exponential(5_000L))
                    .removeOnComplete(200)
                    .removeOnFail(500)
                    .build();

    int maxAttempts;
    BackoffPolicy backoff;
    int removeOnComplete;
    int removeOnFail;

    public static QueueSettings defaults() {
        return DEFAULTS;
    }

    public static QueueSettings emailDispatch() {
        return EMAIL;
    }

    public static QueueSettings plagiarismCheck() {
        return PLAGIARISM;
    }
}
