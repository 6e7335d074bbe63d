package warden.adapter.out.storage.redis;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.quarkus.redis.datasource.hash.ReactiveHashCommands;
import io.quarkus.redis.datasource.value.ReactiveValueCommands;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.model.session.DeviceInfo;
import warden.core.model.session.Session;
import warden.core.port.out.SessionRepository;

/**
 * Redis implementation of {@link SessionRepository}.
 *
 * <p>Each session is a hash that expires with the session. A string index maps
 * the refresh-token digest to the session id and a set per principal lists its
 * session ids.
 *
 * <p>Key format:
 * <ul>
 *   <li>Session: {@code {prefix}session:{id}}</li>
 *   <li>Refresh index: {@code {prefix}session-refresh:{sha256}}</li>
 *   <li>Principal index: {@code {prefix}session-principal:{principalId}}</li>
 * </ul>
 */
public class RedisSessionRepository implements SessionRepository {

    private static final Logger LOG = Logger.getLogger(RedisSessionRepository.class);

    /**
     * Inserts a session unless another active session holds the same refresh digest.
     *
     * <ol>
     *   <li>KEYS[1] - session key</li>
     *   <li>KEYS[2] - refresh index key</li>
     *   <li>KEYS[3] - principal index key</li>
     *   <li>ARGV[1] - session id</li>
     *   <li>ARGV[2] - session key prefix</li>
     *   <li>ARGV[3] - expires-at in milliseconds</li>
     *   <li>ARGV[4] - created-at in milliseconds</li>
     *   <li>ARGV[5..] - hash field/value pairs</li>
     * </ol>
     *
     * <p>Returns 1 on success, 0 on a duplicate active session.
     */
    private static final String SAVE_SCRIPT =
            """
            local existing = redis.call('GET', KEYS[2])
            if existing and existing ~= ARGV[1] then
                if redis.call('HGET', ARGV[2] .. existing, 'active') == '1' then
                    return 0
                end
            end

            redis.call('DEL', KEYS[1])
            redis.call('HSET', KEYS[1], unpack(ARGV, 5))
            redis.call('PEXPIREAT', KEYS[1], ARGV[3])
            redis.call('SET', KEYS[2], ARGV[1])
            redis.call('PEXPIREAT', KEYS[2], ARGV[3])
            redis.call('SADD', KEYS[3], ARGV[1])

            -- The principal index lives as long as its longest session
            local ttl = redis.call('PTTL', KEYS[3])
            local expires_at = tonumber(ARGV[3])
            local index_expiry = -1
            if ttl > 0 then
                index_expiry = tonumber(ARGV[4]) + ttl
            end
            if index_expiry < expires_at then
                redis.call('PEXPIREAT', KEYS[3], ARGV[3])
            end
            return 1
            """;

    /**
     * KEYS[1] session key, ARGV[1] ended-at ms. Returns 1 if the session was active.
     */
    private static final String DEACTIVATE_SCRIPT =
            """
            if redis.call('HGET', KEYS[1], 'active') ~= '1' then
                return 0
            end
            redis.call('HSET', KEYS[1], 'active', '0', 'endedAt', ARGV[1])
            return 1
            """;

    private final ReactiveRedisDataSource redisDataSource;
    private final ReactiveHashCommands<String, String, String> hashCommands;
    private final ReactiveValueCommands<String, String> valueCommands;
    private final String sessionPrefix;
    private final String refreshPrefix;
    private final String principalPrefix;

    public RedisSessionRepository(ReactiveRedisDataSource redisDataSource, String keyPrefix) {
        this.redisDataSource = redisDataSource;
        this.hashCommands = redisDataSource.hash(String.class, String.class, String.class);
        this.valueCommands = redisDataSource.value(String.class, String.class);
        this.sessionPrefix = keyPrefix + "session:";
        this.refreshPrefix = keyPrefix + "session-refresh:";
        this.principalPrefix = keyPrefix + "session-principal:";
    }

    @Override
    public Uni<Session> save(Session session) {
        final var args = new ArrayList<String>();
        args.add(SAVE_SCRIPT);
        args.add("3");
        args.add(sessionPrefix + session.id());
        args.add(refreshPrefix + session.refreshTokenHash());
        args.add(principalPrefix + session.principalId());
        args.add(session.id());
        args.add(sessionPrefix);
        args.add(String.valueOf(session.expiresAt().toEpochMilli()));
        args.add(String.valueOf(session.createdAt().toEpochMilli()));
        serialize(session).forEach((field, value) -> {
            args.add(field);
            args.add(value);
        });

        return redisDataSource
                .execute("EVAL", args.toArray(new String[0]))
                .map(response -> {
                    if (RedisResponses.toLong(response) != 1) {
                        throw new IllegalStateException("An active session already holds this refresh token");
                    }
                    LOG.debugf("Session saved in Redis: %s", session.id());
                    return session;
                });
    }

    @Override
    public Uni<Optional<Session>> findById(String sessionId) {
        return hashCommands.hgetall(sessionPrefix + sessionId).map(this::deserialize);
    }

    @Override
    public Uni<Optional<Session>> findByRefreshTokenHash(String refreshTokenHash) {
        return valueCommands.get(refreshPrefix + refreshTokenHash).flatMap(sessionId -> {
            if (sessionId == null) {
                return Uni.createFrom().item(Optional.<Session>empty());
            }
            return findById(sessionId);
        });
    }

    @Override
    public Uni<List<Session>> findActiveByPrincipal(String principalId) {
        return sessionIds(principalId)
                .onItem()
                .transformToUniAndConcatenate(this::findById)
                .select()
                .where(session -> session.isPresent() && session.get().active())
                .map(Optional::get)
                .collect()
                .asList();
    }

    @Override
    public Uni<Boolean> deactivate(String sessionId, Instant endedAt) {
        return redisDataSource
                .execute(
                        "EVAL",
                        DEACTIVATE_SCRIPT,
                        "1",
                        sessionPrefix + sessionId,
                        String.valueOf(endedAt.toEpochMilli()))
                .map(response -> RedisResponses.toLong(response) == 1);
    }

    @Override
    public Uni<Integer> deactivateAllForPrincipal(String principalId, Instant endedAt) {
        return sessionIds(principalId)
                .onItem()
                .transformToUniAndMerge(sessionId -> deactivate(sessionId, endedAt))
                .select()
                .where(Boolean::booleanValue)
                .collect()
                .asList()
                .map(List::size);
    }

    private Multi<String> sessionIds(String principalId) {
        return redisDataSource
                .execute("SMEMBERS", principalPrefix + principalId)
                .map(RedisResponses::toStrings)
                .onItem()
                .transformToMulti(ids -> Multi.createFrom().iterable(ids));
    }

    private Map<String, String> serialize(Session session) {
        final var fields = new LinkedHashMap<String, String>();
        fields.put("id", session.id());
        fields.put("principalId", session.principalId());
        fields.put("refreshTokenHash", session.refreshTokenHash());
        fields.put("userAgent", session.deviceInfo().userAgent());
        fields.put("acceptLanguage", session.deviceInfo().acceptLanguage());
        fields.put("fingerprint", session.deviceInfo().fingerprint());
        fields.put("ipAddress", session.ipAddress());
        fields.put("rememberMe", session.rememberMe() ? "1" : "0");
        fields.put("createdAt", String.valueOf(session.createdAt().toEpochMilli()));
        fields.put("expiresAt", String.valueOf(session.expiresAt().toEpochMilli()));
        fields.put("active", session.active() ? "1" : "0");
        if (session.endedAt() != null) {
            fields.put("endedAt", String.valueOf(session.endedAt().toEpochMilli()));
        }
        return fields;
    }

    private Optional<Session> deserialize(Map<String, String> fields) {
        if (fields == null || fields.isEmpty() || fields.get("id") == null) {
            return Optional.empty();
        }
        final var endedAt = fields.get("endedAt");
        return Optional.of(new Session(
                fields.get("id"),
                fields.get("principalId"),
                fields.get("refreshTokenHash"),
                new DeviceInfo(fields.get("userAgent"), fields.get("acceptLanguage"), fields.get("fingerprint")),
                fields.get("ipAddress"),
                "1".equals(fields.get("rememberMe")),
                Instant.ofEpochMilli(Long.parseLong(fields.get("createdAt"))),
                Instant.ofEpochMilli(Long.parseLong(fields.get("expiresAt"))),
                "1".equals(fields.get("active")),
                endedAt != null ? Instant.ofEpochMilli(Long.parseLong(endedAt)) : null));
    }
}
