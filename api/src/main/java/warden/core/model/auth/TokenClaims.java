package warden.core.model.auth;

import java.time.Instant;
import java.util.Objects;

/**
 * Claim set embedded in a signed token.
 *
 * <p>{@code issuedAt} and {@code expiresAt} are filled in by the issuer; a claim
 * set built with {@link #forSubject} carries placeholders until it is issued.
 *
 * @param subjectId     principal identifier
 * @param principalKind user or API key
 * @param role          role or tier of the principal
 * @param issuedAt      issue time, second precision
 * @param expiresAt     absolute expiry, second precision
 * @param tokenType     access or refresh
 * @param tokenId       unique token identifier (jti)
 */
public record TokenClaims(
        String subjectId,
        PrincipalKind principalKind,
        String role,
        Instant issuedAt,
        Instant expiresAt,
        TokenType tokenType,
        String tokenId) {

    public TokenClaims {
        Objects.requireNonNull(subjectId, "subjectId cannot be null");
        Objects.requireNonNull(principalKind, "principalKind cannot be null");
        Objects.requireNonNull(tokenType, "tokenType cannot be null");
        if (subjectId.isBlank()) {
            throw new IllegalArgumentException("subjectId cannot be blank");
        }
        role = role == null ? "" : role;
    }

    /**
     * Creates an unissued claim set for the given subject.
     */
    public static TokenClaims forSubject(String subjectId, PrincipalKind kind, String role, TokenType type) {
        return new TokenClaims(subjectId, kind, role, null, null, type, null);
    }

    public TokenClaims issued(Instant issuedAt, Instant expiresAt, String tokenId) {
        return new TokenClaims(subjectId, principalKind, role, issuedAt, expiresAt, tokenType, tokenId);
    }

    /**
     * Whether two claim sets describe the same identity and purpose, ignoring
     * issue metadata.
     */
    public boolean sameIdentity(TokenClaims other) {
        return other != null
                && subjectId.equals(other.subjectId)
                && principalKind == other.principalKind
                && role.equals(other.role)
                && tokenType == other.tokenType;
    }
}
