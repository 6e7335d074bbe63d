package warden.core.model.common;

/**
 * Behaviour of a component when its backing store cannot be reached or does not
 * answer within the configured operation timeout.
 */
public enum FailurePolicy {

    /** Allow the request and log the degradation. */
    FAIL_OPEN,

    /** Deny the request with a generic error. */
    FAIL_CLOSED;

    public boolean allowsOnFailure() {
        return this == FAIL_OPEN;
    }
}
