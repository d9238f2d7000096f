package tore.relay.exception;

/**
 * Thrown when required relay configuration is missing or invalid.
 * This is the only error that is allowed to stop the application.
 */
public class RelayConfigurationException extends RuntimeException {

    private final String property;

    public RelayConfigurationException(String property, String message) {
        super(message);
        this.property = property;
    }

    public RelayConfigurationException(String property, String message, Throwable cause) {
        super(message, cause);
        this.property = property;
    }

    public String getProperty() {
        return property;
    }
}
