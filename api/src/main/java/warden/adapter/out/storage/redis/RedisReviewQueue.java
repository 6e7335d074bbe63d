package warden.adapter.out.storage.redis;

import java.util.List;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.smallrye.mutiny.Uni;

import warden.core.port.out.ReviewQueue;

/**
 * Redis list backed {@link ReviewQueue}.
 *
 * <p>Key format: {@code {prefix}review-queue}
 */
public class RedisReviewQueue implements ReviewQueue {

    private final ReactiveRedisDataSource redisDataSource;
    private final String queueKey;

    public RedisReviewQueue(ReactiveRedisDataSource redisDataSource, String keyPrefix) {
        this.redisDataSource = redisDataSource;
        this.queueKey = keyPrefix + "review-queue";
    }

    @Override
    public Uni<Void> enqueue(String alertId) {
        return redisDataSource.execute("RPUSH", queueKey, alertId).replaceWithVoid();
    }

    @Override
    public Uni<List<String>> pending(int limit) {
        if (limit <= 0) {
            return Uni.createFrom().item(List.of());
        }
        return redisDataSource
                .execute("LRANGE", queueKey, "0", String.valueOf(limit - 1))
                .map(RedisResponses::toStrings);
    }

    @Override
    public Uni<Void> remove(String alertId) {
        return redisDataSource.execute("LREM", queueKey, "0", alertId).replaceWithVoid();
    }
}
