package net.moznion.dispatchq.exception;

/**
 * Infrastructure failure of the job broker, as opposed to a failure of a job's own work.
 */
public class BrokerException extends RuntimeException {
    private static final long serialVersionUID = -3196587034431880952L;

    public BrokerException(final String message) {
        super(message);
    }

    public BrokerException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
