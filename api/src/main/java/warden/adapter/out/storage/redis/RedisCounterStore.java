package warden.adapter.out.storage.redis;

import java.time.Duration;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.quarkus.redis.datasource.keys.ReactiveKeyCommands;
import io.quarkus.redis.datasource.value.ReactiveValueCommands;
import io.smallrye.mutiny.Uni;

import warden.core.port.out.CounterStore;

/**
 * Redis implementation of {@link CounterStore}.
 *
 * <p>INCR and the first PEXPIRE run in one Lua script so a counter can never be
 * left without a TTL.
 *
 * <p>Key format: {@code {prefix}counter:{key}}
 */
public class RedisCounterStore implements CounterStore {

    /**
     * KEYS[1] counter key, ARGV[1] TTL in milliseconds. Returns the new value.
     */
    private static final String INCREMENT_SCRIPT =
            """
            local value = redis.call('INCR', KEYS[1])
            if value == 1 then
                redis.call('PEXPIRE', KEYS[1], ARGV[1])
            end
            return value
            """;

    private final ReactiveRedisDataSource redisDataSource;
    private final ReactiveValueCommands<String, String> valueCommands;
    private final ReactiveKeyCommands<String> keyCommands;
    private final String keyPrefix;

    public RedisCounterStore(ReactiveRedisDataSource redisDataSource, String keyPrefix) {
        this.redisDataSource = redisDataSource;
        this.valueCommands = redisDataSource.value(String.class, String.class);
        this.keyCommands = redisDataSource.key(String.class);
        this.keyPrefix = keyPrefix + "counter:";
    }

    @Override
    public Uni<Long> incrementAndGet(String key, Duration ttl) {
        return redisDataSource
                .execute(
                        "EVAL",
                        INCREMENT_SCRIPT,
                        "1", // numkeys
                        keyPrefix + key, // KEYS[1]
                        String.valueOf(Math.max(1, ttl.toMillis())) // ARGV[1]
                        )
                .map(RedisResponses::toLong);
    }

    @Override
    public Uni<Long> get(String key) {
        return valueCommands.get(keyPrefix + key).map(value -> value != null ? Long.parseLong(value) : 0L);
    }

    @Override
    public Uni<Void> delete(String key) {
        return keyCommands.del(keyPrefix + key).replaceWithVoid();
    }
}
