package warden.core.port.out;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import warden.mock.MutableClock;

/**
 * Contract every {@link TokenRevocationRepository} implementation must satisfy.
 */
public abstract class TokenRevocationRepositoryContractTest {

    protected static final Duration TIMEOUT = Duration.ofSeconds(1);

    protected MutableClock clock;
    protected TokenRevocationRepository repository;

    protected abstract TokenRevocationRepository createRepository(MutableClock clock);

    @BeforeEach
    void setUpRepository() {
        clock = MutableClock.at("2024-03-01T12:00:00Z");
        repository = createRepository(clock);
    }

    @Test
    @DisplayName("Contract: an unknown token id is not revoked")
    void unknownIdIsNotRevoked() {
        assertFalse(repository.isRevoked("jti-unknown").await().atMost(TIMEOUT));
    }

    @Test
    @DisplayName("Contract: a revoked id is reported until the token expires")
    void revokedIdIsReportedUntilExpiry() {
        repository.revoke("jti-1", clock.instant().plus(Duration.ofMinutes(30)))
                .await().atMost(TIMEOUT);

        assertTrue(repository.isRevoked("jti-1").await().atMost(TIMEOUT));

        clock.advance(Duration.ofMinutes(30));

        assertFalse(repository.isRevoked("jti-1").await().atMost(TIMEOUT));
    }

    @Test
    @DisplayName("Contract: revocation is per token id")
    void revocationIsPerId() {
        repository.revoke("jti-1", clock.instant().plus(Duration.ofMinutes(30)))
                .await().atMost(TIMEOUT);

        assertFalse(repository.isRevoked("jti-2").await().atMost(TIMEOUT));
    }

    @Test
    @DisplayName("Contract: revoking twice is harmless")
    void revokeIsIdempotent() {
        final var expiresAt = clock.instant().plus(Duration.ofMinutes(30));
        repository.revoke("jti-1", expiresAt).await().atMost(TIMEOUT);
        repository.revoke("jti-1", expiresAt).await().atMost(TIMEOUT);

        assertTrue(repository.isRevoked("jti-1").await().atMost(TIMEOUT));
    }
}
