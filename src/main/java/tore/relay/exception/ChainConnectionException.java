package tore.relay.exception;

/**
 * Exception thrown when the chain node cannot be reached or answers with an RPC error
 */
public class ChainConnectionException extends RuntimeException {

    private final String operation;

    public ChainConnectionException(String operation, String message) {
        super(message);
        this.operation = operation;
    }

    public ChainConnectionException(String operation, String message, Throwable cause) {
        super(message, cause);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
