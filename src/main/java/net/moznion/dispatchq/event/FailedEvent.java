package net.moznion.dispatchq.event;

import java.util.Optional;

import lombok.Value;

/**
 * A job that exhausted its attempts.
 */
@Value
public class FailedEvent {
    String jobId;
    String queueName;
    int attempt;
    String errorMessage;
    Throwable cause;

    public Optional<Throwable> getCauseIfPresent() {
        return Optional.ofNullable(cause);
    }
}
