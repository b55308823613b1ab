package net.moznion.dispatchq.event;

import java.util.Optional;

import lombok.Value;

/**
 * An infrastructure error that is not attributable to a single job, e.g. the broker went away while claiming.
 */
@Value
public class PoolErrorEvent {
    String queueName;
    String errorMessage;
    Throwable cause;

    public Optional<Throwable> getCauseIfPresent() {
        return Optional.ofNullable(cause);
    }
}
