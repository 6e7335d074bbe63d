package warden.adapter.out.storage.redis;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.quarkus.redis.datasource.keys.ReactiveKeyCommands;
import io.quarkus.redis.datasource.value.ReactiveValueCommands;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.port.out.TokenRevocationRepository;

/**
 * Redis implementation of {@link TokenRevocationRepository}.
 *
 * <p>Each entry expires with the token it revokes.
 *
 * <p>Key format: {@code {prefix}revoked:{jti}}
 */
public class RedisTokenRevocationRepository implements TokenRevocationRepository {

    private static final Logger LOG = Logger.getLogger(RedisTokenRevocationRepository.class);

    private static final String REVOKED_VALUE = "1";

    private final ReactiveValueCommands<String, String> valueCommands;
    private final ReactiveKeyCommands<String> keyCommands;
    private final String keyPrefix;
    private final Clock clock;

    public RedisTokenRevocationRepository(ReactiveRedisDataSource redisDataSource, String keyPrefix, Clock clock) {
        this.valueCommands = redisDataSource.value(String.class, String.class);
        this.keyCommands = redisDataSource.key(String.class);
        this.keyPrefix = keyPrefix + "revoked:";
        this.clock = clock;
    }

    @Override
    public Uni<Void> revoke(String tokenId, Instant expiresAt) {
        final var ttlSeconds = (Duration.between(clock.instant(), expiresAt).toMillis() + 999) / 1000;
        if (ttlSeconds <= 0) {
            LOG.debugf("Skipping revocation for already-expired token: %s", tokenId);
            return Uni.createFrom().voidItem();
        }
        return valueCommands
                .setex(keyPrefix + tokenId, ttlSeconds, REVOKED_VALUE)
                .replaceWithVoid()
                .invoke(() -> LOG.debugf("Revoked token %s (TTL: %ds)", tokenId, ttlSeconds));
    }

    @Override
    public Uni<Boolean> isRevoked(String tokenId) {
        return keyCommands.exists(keyPrefix + tokenId);
    }
}
