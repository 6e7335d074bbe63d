package warden.adapter.out.storage.redis;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.quarkus.redis.datasource.hash.ReactiveHashCommands;
import io.quarkus.redis.datasource.keys.KeyScanArgs;
import io.quarkus.redis.datasource.keys.ReactiveKeyCommands;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;

import warden.core.model.threat.BlockEntry;
import warden.core.model.threat.BlockSubject;
import warden.core.port.out.BlockListRepository;

/**
 * Redis implementation of {@link BlockListRepository}.
 *
 * <p>Blocks are hashes that expire at the block's end via PEXPIREAT.
 *
 * <p>Key format: {@code {prefix}block:ip:{address}} or {@code {prefix}block:principal:{id}}
 */
public class RedisBlockListRepository implements BlockListRepository {

    private static final String FIELD_REASON = "reason";
    private static final String FIELD_CREATED_AT = "createdAt";
    private static final String FIELD_EXPIRES_AT = "expiresAt";

    /**
     * KEYS[1] block key, ARGV[1] reason, ARGV[2] created-at ms, ARGV[3] expires-at ms.
     */
    private static final String PUT_SCRIPT =
            """
            redis.call('DEL', KEYS[1])
            redis.call('HSET', KEYS[1], 'reason', ARGV[1], 'createdAt', ARGV[2], 'expiresAt', ARGV[3])
            redis.call('PEXPIREAT', KEYS[1], ARGV[3])
            return 1
            """;

    private final ReactiveRedisDataSource redisDataSource;
    private final ReactiveHashCommands<String, String, String> hashCommands;
    private final ReactiveKeyCommands<String> keyCommands;
    private final String keyPrefix;
    private final Clock clock;

    public RedisBlockListRepository(ReactiveRedisDataSource redisDataSource, String keyPrefix, Clock clock) {
        this.redisDataSource = redisDataSource;
        this.hashCommands = redisDataSource.hash(String.class, String.class, String.class);
        this.keyCommands = redisDataSource.key(String.class);
        this.keyPrefix = keyPrefix + "block:";
        this.clock = clock;
    }

    @Override
    public Uni<Void> put(BlockEntry entry) {
        return redisDataSource
                .execute(
                        "EVAL",
                        PUT_SCRIPT,
                        "1",
                        keyPrefix + entry.subject().key(),
                        entry.reason(),
                        String.valueOf(entry.createdAt().toEpochMilli()),
                        String.valueOf(entry.expiresAt().toEpochMilli()))
                .replaceWithVoid();
    }

    @Override
    public Uni<Optional<BlockEntry>> find(BlockSubject subject) {
        return hashCommands
                .hgetall(keyPrefix + subject.key())
                .map(fields -> toEntry(subject, fields).filter(entry -> entry.isActiveAt(clock.instant())));
    }

    @Override
    public Uni<Boolean> remove(BlockSubject subject) {
        return keyCommands.del(keyPrefix + subject.key()).map(deleted -> deleted > 0);
    }

    @Override
    public Multi<BlockEntry> streamActive() {
        final var args = new KeyScanArgs().match(keyPrefix + "*").count(1000);
        return keyCommands
                .scan(args)
                .toMulti()
                .onItem()
                .transformToUniAndMerge(key -> find(BlockSubject.parse(key.substring(keyPrefix.length()))))
                .select()
                .where(Optional::isPresent)
                .map(Optional::get);
    }

    private Optional<BlockEntry> toEntry(BlockSubject subject, Map<String, String> fields) {
        if (fields == null || fields.isEmpty() || fields.get(FIELD_EXPIRES_AT) == null) {
            return Optional.empty();
        }
        final var createdAt = fields.get(FIELD_CREATED_AT);
        final var expiresAt = Instant.ofEpochMilli(Long.parseLong(fields.get(FIELD_EXPIRES_AT)));
        return Optional.of(new BlockEntry(
                subject,
                fields.get(FIELD_REASON),
                createdAt != null ? Instant.ofEpochMilli(Long.parseLong(createdAt)) : expiresAt,
                expiresAt));
    }
}
