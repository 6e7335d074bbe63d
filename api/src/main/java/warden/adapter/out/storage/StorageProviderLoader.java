package warden.adapter.out.storage;

import java.time.Clock;
import java.util.Locale;

import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import org.jboss.logging.Logger;

import warden.adapter.out.storage.memory.InMemoryStorage;
import warden.adapter.out.storage.redis.RedisAlertRepository;
import warden.adapter.out.storage.redis.RedisBlockListRepository;
import warden.adapter.out.storage.redis.RedisCounterStore;
import warden.adapter.out.storage.redis.RedisLoginAttemptRepository;
import warden.adapter.out.storage.redis.RedisReviewQueue;
import warden.adapter.out.storage.redis.RedisSessionRepository;
import warden.adapter.out.storage.redis.RedisTokenRevocationRepository;
import warden.core.config.LockoutConfig;
import warden.core.config.StorageConfig;
import warden.core.model.lockout.LockoutPolicy;
import warden.core.port.out.AlertRepository;
import warden.core.port.out.BlockListRepository;
import warden.core.port.out.CounterStore;
import warden.core.port.out.LoginAttemptRepository;
import warden.core.port.out.ReviewQueue;
import warden.core.port.out.SessionRepository;
import warden.core.port.out.TokenRevocationRepository;

/**
 * CDI producer for every storage port.
 *
 * <p>Selects the backend from {@code warden.storage.backend}:
 * <ul>
 *   <li>{@code redis} - shared state across instances, used when a
 *       ReactiveRedisDataSource is available</li>
 *   <li>{@code memory} - process-local fallback, always available</li>
 * </ul>
 */
@ApplicationScoped
public class StorageProviderLoader {

    private static final Logger LOG = Logger.getLogger(StorageProviderLoader.class);

    private final StorageConfig config;
    private final LockoutConfig lockoutConfig;
    private final Clock clock;
    private final Instance<ReactiveRedisDataSource> redisDataSource;
    private final Instance<ObjectMapper> objectMapper;

    private volatile Backend backend;

    @Inject
    public StorageProviderLoader(
            StorageConfig config,
            LockoutConfig lockoutConfig,
            Clock clock,
            Instance<ReactiveRedisDataSource> redisDataSource,
            Instance<ObjectMapper> objectMapper) {
        this.config = config;
        this.lockoutConfig = lockoutConfig;
        this.clock = clock;
        this.redisDataSource = redisDataSource;
        this.objectMapper = objectMapper;
    }

    @Produces
    @ApplicationScoped
    public CounterStore counterStore() {
        final var selected = backend();
        return selected.memory() != null
                ? selected.memory().counterStore()
                : new RedisCounterStore(selected.redis(), config.keyPrefix());
    }

    @Produces
    @ApplicationScoped
    public BlockListRepository blockListRepository() {
        final var selected = backend();
        return selected.memory() != null
                ? selected.memory().blockListRepository()
                : new RedisBlockListRepository(selected.redis(), config.keyPrefix(), clock);
    }

    @Produces
    @ApplicationScoped
    public TokenRevocationRepository tokenRevocationRepository() {
        final var selected = backend();
        return selected.memory() != null
                ? selected.memory().tokenRevocationRepository()
                : new RedisTokenRevocationRepository(selected.redis(), config.keyPrefix(), clock);
    }

    @Produces
    @ApplicationScoped
    public SessionRepository sessionRepository() {
        final var selected = backend();
        return selected.memory() != null
                ? selected.memory().sessionRepository()
                : new RedisSessionRepository(selected.redis(), config.keyPrefix());
    }

    @Produces
    @ApplicationScoped
    public LoginAttemptRepository loginAttemptRepository() {
        final var selected = backend();
        return selected.memory() != null
                ? selected.memory().loginAttemptRepository()
                : new RedisLoginAttemptRepository(selected.redis(), config.keyPrefix());
    }

    @Produces
    @ApplicationScoped
    public AlertRepository alertRepository() {
        final var selected = backend();
        return selected.memory() != null
                ? selected.memory().alertRepository()
                : new RedisAlertRepository(selected.redis(), objectMapper.get(), config.keyPrefix());
    }

    @Produces
    @ApplicationScoped
    public ReviewQueue reviewQueue() {
        final var selected = backend();
        return selected.memory() != null
                ? selected.memory().reviewQueue()
                : new RedisReviewQueue(selected.redis(), config.keyPrefix());
    }

    /**
     * Name of the backend in use, for health reporting.
     */
    public String backendName() {
        return backend().memory() != null ? "memory" : "redis";
    }

    @PreDestroy
    void shutdown() {
        final var current = backend;
        if (current != null && current.memory() != null) {
            current.memory().shutdown();
        }
    }

    private Backend backend() {
        var current = backend;
        if (current == null) {
            synchronized (this) {
                current = backend;
                if (current == null) {
                    current = selectBackend();
                    backend = current;
                }
            }
        }
        return current;
    }

    private Backend selectBackend() {
        final var requested = config.backend().trim().toLowerCase(Locale.ROOT);
        if ("redis".equals(requested)) {
            if (redisDataSource.isResolvable()) {
                LOG.infov("Using storage backend: redis (key prefix {0})", config.keyPrefix());
                return new Backend(null, redisDataSource.get());
            }
            LOG.warn("Redis storage requested but ReactiveRedisDataSource not available, using in-memory storage");
        } else if (!"memory".equals(requested)) {
            LOG.warnv("Unknown storage backend {0}, using in-memory storage", config.backend());
        }

        LOG.info("Using storage backend: memory");
        final var policy = new LockoutPolicy(
                lockoutConfig.threshold(), lockoutConfig.lockDuration(), lockoutConfig.attemptRetention());
        return new Backend(new InMemoryStorage(clock, policy, config.cleanupInterval()), null);
    }

    private record Backend(InMemoryStorage memory, ReactiveRedisDataSource redis) {}
}
