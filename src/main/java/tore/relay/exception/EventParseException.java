package tore.relay.exception;

/**
 * A single log could not be decoded against its event descriptor.
 */
public class EventParseException extends RuntimeException {

    private final String transactionHash;

    public EventParseException(String transactionHash, String message) {
        super(message);
        this.transactionHash = transactionHash;
    }

    public EventParseException(String transactionHash, String message, Throwable cause) {
        super(message, cause);
        this.transactionHash = transactionHash;
    }

    public String getTransactionHash() {
        return transactionHash;
    }
}
