package warden.core.port.out;

import java.time.Instant;

import io.smallrye.mutiny.Uni;

/**
 * Port for the token denylist.
 *
 * <p>Entries are keyed by token id and expire when the token itself would
 * have expired.
 */
public interface TokenRevocationRepository {

    /**
     * Revoke a token.
     *
     * @param tokenId   the token's jti claim
     * @param expiresAt when the entry may be discarded
     */
    Uni<Void> revoke(String tokenId, Instant expiresAt);

    /**
     * Check whether a token has been revoked.
     */
    Uni<Boolean> isRevoked(String tokenId);
}
