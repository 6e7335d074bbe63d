package warden.core.model.auth;

/**
 * Outcome of verifying a bearer token.
 */
public sealed interface TokenVerificationResult {

    record Valid(TokenClaims claims) implements TokenVerificationResult {}

    record Invalid(TokenError error) implements TokenVerificationResult {}

    static TokenVerificationResult valid(TokenClaims claims) {
        return new Valid(claims);
    }

    static TokenVerificationResult invalid(TokenError error) {
        return new Invalid(error);
    }

    default boolean isValid() {
        return this instanceof Valid;
    }
}
