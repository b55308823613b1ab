package net.moznion.dispatchq.exception;

import lombok.Getter;

public class InvalidPayloadException extends RuntimeException {
    private static final long serialVersionUID = -1508837762401945367L;

    @Getter
    private final String queueName;

    public InvalidPayloadException(final String queueName, final String message) {
        super(queueName + ": " + message);
        this.queueName = queueName;
    }
}
