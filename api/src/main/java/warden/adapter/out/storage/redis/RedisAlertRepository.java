package warden.adapter.out.storage.redis;

import java.time.Duration;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Optional;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.quarkus.redis.datasource.value.ReactiveValueCommands;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.model.threat.AlertStatus;
import warden.core.model.threat.SecurityAlert;
import warden.core.port.out.AlertRepository;

/**
 * Redis implementation of {@link AlertRepository}.
 *
 * <p>Alerts are stored as JSON. A sorted set scored by detection time keeps
 * them ordered for listing, and status changes go through a Lua
 * compare-and-set on the stored status.
 *
 * <p>Key format:
 * <ul>
 *   <li>Alert: {@code {prefix}alert:{id}}</li>
 *   <li>Index: {@code {prefix}alerts}</li>
 *   <li>Daily sequence: {@code {prefix}alert-seq:{yyyyMMdd}}</li>
 * </ul>
 */
public class RedisAlertRepository implements AlertRepository {

    private static final Logger LOG = Logger.getLogger(RedisAlertRepository.class);

    private static final Duration SEQUENCE_TTL = Duration.ofDays(2);

    /**
     * KEYS[1] sequence key, ARGV[1] TTL in seconds.
     */
    private static final String SEQUENCE_SCRIPT =
            """
            local value = redis.call('INCR', KEYS[1])
            if value == 1 then
                redis.call('EXPIRE', KEYS[1], ARGV[1])
            end
            return value
            """;

    /**
     * KEYS[1] alert key, KEYS[2] index key, ARGV[1] alert id, ARGV[2] score, ARGV[3] JSON.
     * Returns 0 if the alert already exists.
     */
    private static final String CREATE_SCRIPT =
            """
            if redis.call('SETNX', KEYS[1], ARGV[3]) == 0 then
                return 0
            end
            redis.call('ZADD', KEYS[2], ARGV[2], ARGV[1])
            return 1
            """;

    /**
     * KEYS[1] alert key, ARGV[1] expected status, ARGV[2] replacement JSON.
     * Returns 1 if replaced.
     */
    private static final String REPLACE_IF_STATUS_SCRIPT =
            """
            local current = redis.call('GET', KEYS[1])
            if not current then
                return 0
            end
            if cjson.decode(current)['status'] ~= ARGV[1] then
                return 0
            end
            redis.call('SET', KEYS[1], ARGV[2])
            return 1
            """;

    private final ReactiveRedisDataSource redisDataSource;
    private final ReactiveValueCommands<String, String> valueCommands;
    private final ObjectMapper objectMapper;
    private final String alertPrefix;
    private final String indexKey;
    private final String sequencePrefix;

    public RedisAlertRepository(ReactiveRedisDataSource redisDataSource, ObjectMapper objectMapper, String keyPrefix) {
        this.redisDataSource = redisDataSource;
        this.valueCommands = redisDataSource.value(String.class, String.class);
        this.objectMapper = objectMapper;
        this.alertPrefix = keyPrefix + "alert:";
        this.indexKey = keyPrefix + "alerts";
        this.sequencePrefix = keyPrefix + "alert-seq:";
    }

    @Override
    public Uni<Long> nextSequence(LocalDate day) {
        return redisDataSource
                .execute(
                        "EVAL",
                        SEQUENCE_SCRIPT,
                        "1",
                        sequencePrefix + day.format(DateTimeFormatter.BASIC_ISO_DATE),
                        String.valueOf(SEQUENCE_TTL.toSeconds()))
                .map(RedisResponses::toLong);
    }

    @Override
    public Uni<SecurityAlert> create(SecurityAlert alert) {
        return Uni.createFrom()
                .item(() -> serialize(alert))
                .flatMap(json -> redisDataSource.execute(
                        "EVAL",
                        CREATE_SCRIPT,
                        "2",
                        alertPrefix + alert.id(),
                        indexKey,
                        alert.id(),
                        String.valueOf(alert.detectedAt().toEpochMilli()),
                        json))
                .map(response -> {
                    if (RedisResponses.toLong(response) != 1) {
                        throw new IllegalStateException("Alert already exists: " + alert.id());
                    }
                    return alert;
                });
    }

    @Override
    public Uni<Optional<SecurityAlert>> findById(String alertId) {
        return valueCommands.get(alertPrefix + alertId).map(json -> {
            if (json == null) {
                return Optional.<SecurityAlert>empty();
            }
            return Optional.of(deserialize(json));
        });
    }

    @Override
    public Uni<Boolean> replaceIfStatus(SecurityAlert updated, AlertStatus expected) {
        return Uni.createFrom()
                .item(() -> serialize(updated))
                .flatMap(json -> redisDataSource.execute(
                        "EVAL", REPLACE_IF_STATUS_SCRIPT, "1", alertPrefix + updated.id(), expected.name(), json))
                .map(response -> RedisResponses.toLong(response) == 1);
    }

    @Override
    public Multi<SecurityAlert> streamAll() {
        return redisDataSource
                .execute("ZREVRANGE", indexKey, "0", "-1")
                .map(RedisResponses::toStrings)
                .onItem()
                .transformToMulti(ids -> Multi.createFrom().iterable(ids))
                .onItem()
                .transformToUniAndConcatenate(this::findById)
                .select()
                .where(Optional::isPresent)
                .map(Optional::get);
    }

    private String serialize(SecurityAlert alert) {
        try {
            return objectMapper.writeValueAsString(alert);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize alert " + alert.id(), e);
        }
    }

    private SecurityAlert deserialize(String json) {
        try {
            return objectMapper.readValue(json, SecurityAlert.class);
        } catch (JsonProcessingException e) {
            LOG.warnf("Unreadable alert record: %s", e.getMessage());
            throw new IllegalStateException("Failed to deserialize alert", e);
        }
    }
}
