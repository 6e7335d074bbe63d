package warden.core.service.auth;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;
import org.jose4j.jwa.AlgorithmConstraints;
import org.jose4j.jws.AlgorithmIdentifiers;
import org.jose4j.jws.JsonWebSignature;
import org.jose4j.jwt.JwtClaims;
import org.jose4j.jwt.MalformedClaimException;
import org.jose4j.jwt.NumericDate;
import org.jose4j.jwt.consumer.InvalidJwtException;
import org.jose4j.keys.HmacKey;
import org.jose4j.lang.JoseException;

import warden.core.config.ResiliencyConfig;
import warden.core.config.TokenConfig;
import warden.core.model.auth.IssuedToken;
import warden.core.model.auth.PrincipalKind;
import warden.core.model.auth.TokenClaims;
import warden.core.model.auth.TokenError;
import warden.core.model.auth.TokenType;
import warden.core.model.auth.TokenVerificationResult;
import warden.core.port.out.Metrics;
import warden.core.port.out.TokenRevocationRepository;
import warden.core.service.common.StoreCallGuard;
import warden.core.util.SecureHash;

/**
 * Issues, verifies and revokes HS256-signed bearer tokens.
 *
 * <p>Verification runs the checks cheapest first and stops at the first failure:
 * <ol>
 *   <li>signature and structure ({@link TokenError#MALFORMED})</li>
 *   <li>expiry ({@link TokenError#EXPIRED})</li>
 *   <li>token type ({@link TokenError#WRONG_TYPE})</li>
 *   <li>revocation list ({@link TokenError#REVOKED})</li>
 * </ol>
 *
 * <p>Revocations are stored by token id with an expiry equal to the token's
 * remaining lifetime. A revocation lookup that times out or fails is treated as
 * revoked.
 */
@ApplicationScoped
public class TokenAuthority {

    private static final Logger LOG = Logger.getLogger(TokenAuthority.class);

    static final int MIN_SECRET_BYTES = 32;
    static final String CLAIM_TYPE = "type";
    static final String CLAIM_KIND = "kind";
    static final String CLAIM_ROLE = "role";

    private final TokenConfig config;
    private final TokenRevocationRepository revocations;
    private final RevocationCache revocationCache;
    private final StoreCallGuard storeGuard;
    private final Clock clock;
    private final HmacKey signingKey;

    @Inject
    public TokenAuthority(
            TokenConfig config,
            TokenRevocationRepository revocations,
            ResiliencyConfig resiliency,
            Metrics metrics,
            Clock clock) {
        this.config = config;
        this.revocations = revocations;
        this.clock = clock;
        this.storeGuard = new StoreCallGuard(resiliency.store().operationTimeout(), metrics, "token-authority");
        this.revocationCache = config.revocationCache().enabled()
                ? new RevocationCache(config.revocationCache().maxSize(), clock)
                : null;

        final var secret = config.secret().getBytes(StandardCharsets.UTF_8);
        if (secret.length < MIN_SECRET_BYTES) {
            throw new IllegalStateException(
                    "warden.token.secret must be at least " + MIN_SECRET_BYTES + " bytes, got " + secret.length);
        }
        this.signingKey = new HmacKey(secret);
    }

    /**
     * Sign a token carrying {@code claims} that expires {@code ttl} from now.
     */
    public IssuedToken issue(TokenClaims claims, Duration ttl) {
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive");
        }
        final var issuedAt = Instant.ofEpochSecond(clock.instant().getEpochSecond());
        final var expiresAt = issuedAt.plusSeconds(Math.max(1, ttl.toSeconds()));

        final var jwt = new JwtClaims();
        jwt.setIssuer(config.issuer());
        jwt.setSubject(claims.subjectId());
        jwt.setIssuedAt(NumericDate.fromSeconds(issuedAt.getEpochSecond()));
        jwt.setExpirationTime(NumericDate.fromSeconds(expiresAt.getEpochSecond()));
        jwt.setGeneratedJwtId();
        jwt.setClaim(CLAIM_KIND, claims.principalKind().claimValue());
        jwt.setClaim(CLAIM_ROLE, claims.role());
        jwt.setClaim(CLAIM_TYPE, claims.tokenType().claimValue());

        try {
            final var jws = new JsonWebSignature();
            jws.setPayload(jwt.toJson());
            jws.setKey(signingKey);
            jws.setAlgorithmHeaderValue(AlgorithmIdentifiers.HMAC_SHA256);
            final var value = jws.getCompactSerialization();
            return new IssuedToken(value, claims.issued(issuedAt, expiresAt, jwt.getJwtId()));
        } catch (JoseException | MalformedClaimException e) {
            throw new TokenIssuanceException("Failed to sign token: " + e.getMessage(), e);
        }
    }

    public IssuedToken issueAccessToken(String subjectId, PrincipalKind kind, String role) {
        return issue(TokenClaims.forSubject(subjectId, kind, role, TokenType.ACCESS), config.accessTtl());
    }

    public IssuedToken issueRefreshToken(String subjectId, PrincipalKind kind, String role, boolean rememberMe) {
        return issue(TokenClaims.forSubject(subjectId, kind, role, TokenType.REFRESH), refreshTtl(rememberMe));
    }

    public Duration accessTtl() {
        return config.accessTtl();
    }

    public Duration refreshTtl(boolean rememberMe) {
        return rememberMe ? config.rememberMeRefreshTtl() : config.refreshTtl();
    }

    /**
     * Verify a token and check that it is of the expected type.
     */
    public Uni<TokenVerificationResult> verify(String token, TokenType expectedType) {
        final var parsed = parse(token);
        if (parsed.isEmpty()) {
            return Uni.createFrom().item(TokenVerificationResult.invalid(TokenError.MALFORMED));
        }
        final var claims = parsed.get();
        if (!clock.instant().isBefore(claims.expiresAt())) {
            return Uni.createFrom().item(TokenVerificationResult.invalid(TokenError.EXPIRED));
        }
        if (claims.tokenType() != expectedType) {
            return Uni.createFrom().item(TokenVerificationResult.invalid(TokenError.WRONG_TYPE));
        }
        return isRevoked(claims)
                .map(revoked -> revoked
                        ? TokenVerificationResult.invalid(TokenError.REVOKED)
                        : TokenVerificationResult.valid(claims));
    }

    /**
     * Add a token to the revocation list until it would have expired.
     *
     * @return true if recorded; false for a malformed token or one already expired
     */
    public Uni<Boolean> revoke(String token) {
        final var parsed = parse(token);
        if (parsed.isEmpty()) {
            LOG.debugf("Ignoring revocation of malformed token %s", SecureHash.forLog(token));
            return Uni.createFrom().item(false);
        }
        final var claims = parsed.get();
        if (!clock.instant().isBefore(claims.expiresAt())) {
            return Uni.createFrom().item(false);
        }
        return storeGuard
                .withTimeout(revocations.revoke(claims.tokenId(), claims.expiresAt()), "revoke")
                .invoke(() -> {
                    if (revocationCache != null) {
                        revocationCache.markRevoked(claims.tokenId(), claims.expiresAt());
                    }
                    LOG.infof("Revoked %s token for subject %s", claims.tokenType().claimValue(), claims.subjectId());
                })
                .replaceWith(true);
    }

    private Uni<Boolean> isRevoked(TokenClaims claims) {
        if (revocationCache != null && revocationCache.isKnownRevoked(claims.tokenId())) {
            return Uni.createFrom().item(true);
        }
        return storeGuard
                .withFallback(revocations.isRevoked(claims.tokenId()), "isRevoked", () -> true)
                .invoke(revoked -> {
                    if (revoked && revocationCache != null) {
                        revocationCache.markRevoked(claims.tokenId(), claims.expiresAt());
                    }
                });
    }

    /**
     * Signature-checked claims, or empty if the token is not a well-formed token
     * signed with this authority's key. Neither expiry nor revocation is evaluated
     * here; use {@link #verify} before trusting a token.
     */
    public Optional<TokenClaims> readClaims(String token) {
        return parse(token);
    }

    private Optional<TokenClaims> parse(String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        try {
            final var jws = new JsonWebSignature();
            jws.setAlgorithmConstraints(new AlgorithmConstraints(
                    AlgorithmConstraints.ConstraintType.PERMIT, AlgorithmIdentifiers.HMAC_SHA256));
            jws.setCompactSerialization(token);
            jws.setKey(signingKey);
            if (!jws.verifySignature()) {
                return Optional.empty();
            }
            final var jwt = JwtClaims.parse(jws.getPayload());
            if (jwt.getSubject() == null
                    || jwt.getExpirationTime() == null
                    || jwt.getIssuedAt() == null
                    || jwt.getJwtId() == null) {
                return Optional.empty();
            }
            return Optional.of(new TokenClaims(
                    jwt.getSubject(),
                    PrincipalKind.fromClaim(jwt.getStringClaimValue(CLAIM_KIND)),
                    jwt.getStringClaimValue(CLAIM_ROLE),
                    Instant.ofEpochSecond(jwt.getIssuedAt().getValue()),
                    Instant.ofEpochSecond(jwt.getExpirationTime().getValue()),
                    TokenType.fromClaim(jwt.getStringClaimValue(CLAIM_TYPE)),
                    jwt.getJwtId()));
        } catch (JoseException | InvalidJwtException | MalformedClaimException e) {
            LOG.debugf("Rejected malformed token %s: %s", SecureHash.forLog(token), e.getMessage());
            return Optional.empty();
        } catch (IllegalArgumentException e) {
            LOG.debugf("Rejected token %s with invalid claims: %s", SecureHash.forLog(token), e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Signing failed, which indicates a configuration problem.
     */
    public static class TokenIssuanceException extends RuntimeException {

        public TokenIssuanceException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
