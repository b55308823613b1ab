package net.moznion.dispatchq.event;

import lombok.extern.slf4j.Slf4j;

@Slf4j
public class LoggingEventSink implements EventSink {
    @Override
    public void onCompleted(final CompletedEvent event) {
        log.info("COMPLETED: queueName={}, jobId={}", event.getQueueName(), event.getJobId());
    }

    @Override
    public void onFailed(final FailedEvent event) {
        if (event.getCause() == null) {
            log.error("FAILED: queueName={}, jobId={}, attempt={}, error={}",
                      event.getQueueName(), event.getJobId(), event.getAttempt(), event.getErrorMessage());
        } else {
            log.error("FAILED: queueName={}, jobId={}, attempt={}, error={}",
                      event.getQueueName(), event.getJobId(), event.getAttempt(), event.getErrorMessage(),
                      event.getCause());
        }
    }

    @Override
    public void onPoolError(final PoolErrorEvent event) {
        if (event.getCause() == null) {
            log.error("POOL_ERROR: queueName={}, error={}", event.getQueueName(), event.getErrorMessage());
        } else {
            log.error("POOL_ERROR: queueName={}, error={}", event.getQueueName(), event.getErrorMessage(),
                      event.getCause());
        }
    }
}
