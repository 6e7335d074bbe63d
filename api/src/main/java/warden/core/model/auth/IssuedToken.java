package warden.core.model.auth;

import java.time.Instant;

/**
 * A signed token string together with the claims it carries.
 */
public record IssuedToken(String value, TokenClaims claims) {

    public Instant expiresAt() {
        return claims.expiresAt();
    }

    public TokenType type() {
        return claims.tokenType();
    }
}
