package warden.adapter.out.storage.memory;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import io.smallrye.mutiny.Uni;

import warden.core.port.out.TokenRevocationRepository;

/**
 * In-memory implementation of {@link TokenRevocationRepository}.
 *
 * <p>This implementation is intended for development and testing only.
 * Revocations are lost on restart and not shared across instances.
 */
public class InMemoryTokenRevocationRepository implements TokenRevocationRepository {

    private final ConcurrentMap<String, Instant> revokedTokens = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryTokenRevocationRepository(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Uni<Void> revoke(String tokenId, Instant expiresAt) {
        return Uni.createFrom().item(() -> {
            revokedTokens.put(tokenId, expiresAt);
            return null;
        });
    }

    @Override
    public Uni<Boolean> isRevoked(String tokenId) {
        return Uni.createFrom().item(() -> {
            final var expiresAt = revokedTokens.get(tokenId);
            return expiresAt != null && clock.instant().isBefore(expiresAt);
        });
    }

    public void sweepExpired() {
        final var now = clock.instant();
        revokedTokens.values().removeIf(expiresAt -> !now.isBefore(expiresAt));
    }

    public int size() {
        return revokedTokens.size();
    }
}
