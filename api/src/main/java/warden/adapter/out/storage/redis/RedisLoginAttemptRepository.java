package warden.adapter.out.storage.redis;

import java.time.Instant;
import java.util.Map;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.quarkus.redis.datasource.hash.ReactiveHashCommands;
import io.quarkus.redis.datasource.keys.KeyScanArgs;
import io.quarkus.redis.datasource.keys.ReactiveKeyCommands;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.model.lockout.LockoutPolicy;
import warden.core.model.lockout.LoginAttemptState;
import warden.core.port.out.LoginAttemptRepository;

/**
 * Redis implementation of {@link LoginAttemptRepository}.
 *
 * <p>State lives in one hash per principal. Every mutation is a Lua script,
 * so the compare-and-increment in {@link #recordFailure} cannot interleave with
 * another failure for the same principal.
 *
 * <p>Key format: {@code {prefix}lockout:{principalId}} (hash with failedCount,
 * lockedUntil, lastFailureAt as epoch milliseconds)
 */
public class RedisLoginAttemptRepository implements LoginAttemptRepository {

    private static final Logger LOG = Logger.getLogger(RedisLoginAttemptRepository.class);

    private static final String FIELD_FAILED_COUNT = "failedCount";
    private static final String FIELD_LOCKED_UNTIL = "lockedUntil";
    private static final String FIELD_LAST_FAILURE_AT = "lastFailureAt";

    /**
     * Applies one failure.
     *
     * <ol>
     *   <li>KEYS[1] - the lockout key</li>
     *   <li>ARGV[1] - now in milliseconds</li>
     *   <li>ARGV[2] - lockout threshold</li>
     *   <li>ARGV[3] - lock duration in milliseconds</li>
     *   <li>ARGV[4] - attempt retention in milliseconds</li>
     * </ol>
     *
     * <p>Returns [failed_count, locked_until or -1]
     */
    private static final String RECORD_FAILURE_SCRIPT =
            """
            local now = tonumber(ARGV[1])
            local threshold = tonumber(ARGV[2])
            local lock_ms = tonumber(ARGV[3])
            local retention_ms = tonumber(ARGV[4])

            local data = redis.call('HMGET', KEYS[1], 'failedCount', 'lockedUntil', 'lastFailureAt')
            local count = tonumber(data[1]) or 0
            local locked_until = tonumber(data[2])
            local last_failure = tonumber(data[3])

            -- An elapsed lock or a stale count starts a new cycle
            if (locked_until and now >= locked_until)
                    or (not locked_until and last_failure and now >= last_failure + retention_ms) then
                count = 0
                locked_until = nil
            end

            count = count + 1
            if not locked_until and count >= threshold then
                locked_until = now + lock_ms
            end

            redis.call('DEL', KEYS[1])
            local expire_at = now + retention_ms
            if locked_until then
                redis.call('HSET', KEYS[1], 'failedCount', count, 'lockedUntil', locked_until, 'lastFailureAt', now)
                if locked_until > expire_at then
                    expire_at = locked_until
                end
            else
                redis.call('HSET', KEYS[1], 'failedCount', count, 'lastFailureAt', now)
            end
            redis.call('PEXPIREAT', KEYS[1], expire_at)

            return {count, locked_until or -1}
            """;

    /**
     * KEYS[1] lockout key, ARGV[1] now in milliseconds. Returns 1 if an elapsed lock was removed.
     */
    private static final String RELEASE_SCRIPT =
            """
            local locked_until = tonumber(redis.call('HGET', KEYS[1], 'lockedUntil'))
            if locked_until and tonumber(ARGV[1]) >= locked_until then
                redis.call('DEL', KEYS[1])
                return 1
            end
            return 0
            """;

    /**
     * KEYS[1] lockout key, ARGV[1] now in milliseconds. Returns 0 if a lock is in force.
     */
    private static final String RESET_SCRIPT =
            """
            local locked_until = tonumber(redis.call('HGET', KEYS[1], 'lockedUntil'))
            if locked_until and tonumber(ARGV[1]) < locked_until then
                return 0
            end
            redis.call('DEL', KEYS[1])
            return 1
            """;

    private final ReactiveRedisDataSource redisDataSource;
    private final ReactiveHashCommands<String, String, String> hashCommands;
    private final ReactiveKeyCommands<String> keyCommands;
    private final String keyPrefix;

    public RedisLoginAttemptRepository(ReactiveRedisDataSource redisDataSource, String keyPrefix) {
        this.redisDataSource = redisDataSource;
        this.hashCommands = redisDataSource.hash(String.class, String.class, String.class);
        this.keyCommands = redisDataSource.key(String.class);
        this.keyPrefix = keyPrefix + "lockout:";
    }

    @Override
    public Uni<LoginAttemptState> find(String principalId) {
        return hashCommands.hgetall(keyPrefix + principalId).map(fields -> toState(principalId, fields));
    }

    @Override
    public Uni<LoginAttemptState> recordFailure(String principalId, LockoutPolicy policy, Instant now) {
        return redisDataSource
                .execute(
                        "EVAL",
                        RECORD_FAILURE_SCRIPT,
                        "1", // numkeys
                        keyPrefix + principalId, // KEYS[1]
                        String.valueOf(now.toEpochMilli()), // ARGV[1]
                        String.valueOf(policy.threshold()), // ARGV[2]
                        String.valueOf(policy.lockDuration().toMillis()), // ARGV[3]
                        String.valueOf(policy.attemptRetention().toMillis()) // ARGV[4]
                        )
                .map(response -> {
                    final var count = (int) RedisResponses.toLong(response.get(0));
                    final var lockedUntil = RedisResponses.toLong(response.get(1));
                    return new LoginAttemptState(
                            principalId, count, lockedUntil < 0 ? null : Instant.ofEpochMilli(lockedUntil), now);
                })
                .invoke(state ->
                        LOG.debugf("Recorded failed login for %s: count=%d", principalId, state.failedCount()));
    }

    @Override
    public Uni<Boolean> releaseElapsedLock(String principalId, Instant now) {
        return redisDataSource
                .execute("EVAL", RELEASE_SCRIPT, "1", keyPrefix + principalId, String.valueOf(now.toEpochMilli()))
                .map(response -> RedisResponses.toLong(response) == 1);
    }

    @Override
    public Uni<LoginAttemptState> resetIfUnlocked(String principalId, Instant now) {
        return redisDataSource
                .execute("EVAL", RESET_SCRIPT, "1", keyPrefix + principalId, String.valueOf(now.toEpochMilli()))
                .flatMap(response -> RedisResponses.toLong(response) == 1
                        ? Uni.createFrom().item(LoginAttemptState.unlocked(principalId))
                        : find(principalId));
    }

    @Override
    public Uni<Void> clear(String principalId) {
        return keyCommands
                .del(keyPrefix + principalId)
                .replaceWithVoid()
                .invoke(() -> LOG.debugf("Cleared login attempts for %s", principalId));
    }

    @Override
    public Multi<LoginAttemptState> streamLocked(Instant now) {
        final var args = new KeyScanArgs().match(keyPrefix + "*").count(1000);
        return keyCommands
                .scan(args)
                .toMulti()
                .onItem()
                .transformToUniAndMerge(key -> find(key.substring(keyPrefix.length())))
                .select()
                .where(state -> state.isLockedAt(now));
    }

    private LoginAttemptState toState(String principalId, Map<String, String> fields) {
        if (fields == null || fields.isEmpty()) {
            return LoginAttemptState.unlocked(principalId);
        }
        final var count = fields.get(FIELD_FAILED_COUNT);
        return new LoginAttemptState(
                principalId,
                count != null ? Integer.parseInt(count) : 0,
                toInstant(fields.get(FIELD_LOCKED_UNTIL)),
                toInstant(fields.get(FIELD_LAST_FAILURE_AT)));
    }

    private static Instant toInstant(String millis) {
        return millis != null ? Instant.ofEpochMilli(Long.parseLong(millis)) : null;
    }
}
