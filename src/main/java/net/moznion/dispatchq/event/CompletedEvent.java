package net.moznion.dispatchq.event;

import lombok.Value;

@Value
public class CompletedEvent {
    String jobId;
    String queueName;
}
