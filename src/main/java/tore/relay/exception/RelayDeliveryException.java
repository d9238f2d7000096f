package tore.relay.exception;

/**
 * Exception thrown when the downstream service is unreachable or answers with a non-2xx status.
 * Drives the queue retry policy.
 */
public class RelayDeliveryException extends RuntimeException {

    /** HTTP status, or -1 when no response was received. */
    private final int statusCode;

    public RelayDeliveryException(int statusCode, String message) {
        super(message);
        this.statusCode = statusCode;
    }

    public RelayDeliveryException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public boolean hasResponse() {
        return statusCode >= 0;
    }
}
