package tore.relay.exception;

/**
 * Exception thrown when the relay job queue storage is unavailable
 */
public class EnqueueException extends RuntimeException {

    public EnqueueException(String message) {
        super(message);
    }

    public EnqueueException(String message, Throwable cause) {
        super(message, cause);
    }
}
