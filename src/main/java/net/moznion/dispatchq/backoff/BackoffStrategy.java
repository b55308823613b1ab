package net.moznion.dispatchq.backoff;

public enum BackoffStrategy {
    FIXED,
    EXPONENTIAL
}
