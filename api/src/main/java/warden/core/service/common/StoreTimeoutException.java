package warden.core.service.common;

/**
 * A store call did not answer within the configured operation timeout.
 */
public class StoreTimeoutException extends RuntimeException {

    private final String component;
    private final String operation;

    public StoreTimeoutException(String component, String operation) {
        super("Store operation timeout: " + operation + " in " + component);
        this.component = component;
        this.operation = operation;
    }

    public String getComponent() {
        return component;
    }

    public String getOperation() {
        return operation;
    }
}
