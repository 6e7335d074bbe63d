package warden.core.model.auth;

import warden.core.model.session.SessionError;

/**
 * Outcome of a login or refresh attempt.
 */
public sealed interface AuthenticationResult {

    record Authenticated(String principalId, TokenPair tokens) implements AuthenticationResult {}

    /**
     * @param retryAfterSeconds hint for {@link AuthenticationError#ACCOUNT_LOCKED}, otherwise 0
     */
    record Rejected(AuthenticationError error, long retryAfterSeconds) implements AuthenticationResult {}

    /**
     * The presented refresh token failed verification.
     */
    record TokenRejected(TokenError error) implements AuthenticationResult {}

    /**
     * The refresh token verified but has no usable session.
     */
    record SessionRejected(SessionError error) implements AuthenticationResult {}

    static AuthenticationResult rejected(AuthenticationError error) {
        return new Rejected(error, 0);
    }

    static AuthenticationResult locked(long retryAfterSeconds) {
        return new Rejected(AuthenticationError.ACCOUNT_LOCKED, retryAfterSeconds);
    }

    default boolean isAuthenticated() {
        return this instanceof Authenticated;
    }
}
