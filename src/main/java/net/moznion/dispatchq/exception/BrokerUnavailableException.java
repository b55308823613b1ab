package net.moznion.dispatchq.exception;

public class BrokerUnavailableException extends BrokerException {
    private static final long serialVersionUID = 4711306928853129542L;

    public BrokerUnavailableException(final String message) {
        super(message);
    }

    public BrokerUnavailableException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
