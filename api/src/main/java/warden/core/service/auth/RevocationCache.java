package warden.core.service.auth;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;

/**
 * Local cache of token ids known to be revoked.
 *
 * <p>Only positive answers are cached, each until its token would have expired,
 * so a hit never needs a store round trip and a miss always asks the store.
 */
public class RevocationCache {

    private final Cache<String, Instant> revoked;
    private final Clock clock;

    public RevocationCache(long maxSize, Clock clock) {
        this.clock = clock;
        this.revoked = Caffeine.newBuilder()
                .maximumSize(maxSize)
                .expireAfter(new UntilTokenExpiry())
                .build();
    }

    public void markRevoked(String tokenId, Instant expiresAt) {
        if (clock.instant().isBefore(expiresAt)) {
            revoked.put(tokenId, expiresAt);
        }
    }

    public boolean isKnownRevoked(String tokenId) {
        return revoked.getIfPresent(tokenId) != null;
    }

    public long size() {
        revoked.cleanUp();
        return revoked.estimatedSize();
    }

    private class UntilTokenExpiry implements Expiry<String, Instant> {

        @Override
        public long expireAfterCreate(String key, Instant expiresAt, long currentTime) {
            return Math.max(0, Duration.between(clock.instant(), expiresAt).toNanos());
        }

        @Override
        public long expireAfterUpdate(String key, Instant expiresAt, long currentTime, long currentDuration) {
            return expireAfterCreate(key, expiresAt, currentTime);
        }

        @Override
        public long expireAfterRead(String key, Instant expiresAt, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
