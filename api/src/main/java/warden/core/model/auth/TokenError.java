package warden.core.model.auth;

/**
 * Reasons a presented token is refused. Declared in the order verification
 * checks them.
 */
public enum TokenError {
    MALFORMED,
    EXPIRED,
    WRONG_TYPE,
    REVOKED
}
