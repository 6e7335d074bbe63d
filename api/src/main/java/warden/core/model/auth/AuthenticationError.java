package warden.core.model.auth;

/**
 * Reasons a login or refresh is refused.
 *
 * <p>An unknown account and a wrong password both map to
 * {@link #INVALID_CREDENTIALS}.
 */
public enum AuthenticationError {
    INVALID_CREDENTIALS,
    ACCOUNT_LOCKED,
    ACCOUNT_NOT_VERIFIED,
    ACCOUNT_SUSPENDED,
    SERVICE_UNAVAILABLE
}
