package warden.core.service.ratelimit;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.config.RateLimitingConfig;
import warden.core.config.ResiliencyConfig;
import warden.core.model.common.FailurePolicy;
import warden.core.model.ratelimit.RateLimitDecision;
import warden.core.model.ratelimit.RateLimitTiers;
import warden.core.model.ratelimit.RateWindowKey;
import warden.core.model.ratelimit.WindowKind;
import warden.core.port.out.CounterStore;
import warden.core.port.out.Metrics;
import warden.core.service.common.StoreCallGuard;

/**
 * Fixed-window rate limiter evaluating minute, hour and day windows together.
 *
 * <p>Each call increments all three window counters first and only then compares
 * the post-increment counts with the limits. A rejected request keeps the quota
 * it consumed in every window, and two concurrent requests can never both see a
 * count below the limit.
 *
 * <p>Counters live for the window duration plus the configured grace period.
 * When the counter store fails, the rate-limit failure policy decides; the
 * default lets the request through.
 */
@ApplicationScoped
public class MultiWindowRateLimiter {

    private static final Logger LOG = Logger.getLogger(MultiWindowRateLimiter.class);

    private final CounterStore counters;
    private final RateLimitingConfig config;
    private final FailurePolicy failurePolicy;
    private final StoreCallGuard storeGuard;
    private final Metrics metrics;
    private final Clock clock;

    @Inject
    public MultiWindowRateLimiter(
            CounterStore counters,
            RateLimitingConfig config,
            ResiliencyConfig resiliency,
            Metrics metrics,
            Clock clock) {
        this.counters = counters;
        this.config = config;
        this.failurePolicy = resiliency.store().rateLimitFailurePolicy();
        this.storeGuard = new StoreCallGuard(resiliency.store().operationTimeout(), metrics, "rate-limiter");
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Consume one request of quota for {@code identifier} on {@code resource}.
     *
     * @param identifier principal or API key identifier
     * @param resource   logical resource being accessed
     * @param limits     per-window ceilings for the caller's tier
     */
    public Uni<RateLimitDecision> checkAndConsume(String identifier, String resource, RateLimitTiers limits) {
        if (!config.enabled()) {
            return Uni.createFrom().item(RateLimitDecision.allowed(Map.of()));
        }

        final var now = clock.instant();
        final var increments = new ArrayList<Uni<WindowCount>>(WindowKind.values().length);
        for (var window : WindowKind.values()) {
            final var key = new RateWindowKey(identifier, resource, window, window.bucketOf(now));
            increments.add(counters.incrementAndGet(key.toCacheKey(), ttlFor(window))
                    .map(count -> new WindowCount(window, count)));
        }

        final var decision = Uni.join()
                .all(increments)
                .andFailFast()
                .map(counts -> evaluate(identifier, resource, limits, counts));

        return storeGuard.withPolicy(
                decision,
                "checkAndConsume",
                failurePolicy,
                RateLimitDecision::degraded,
                RateLimitDecision.Unavailable::new);
    }

    /**
     * Current counts without consuming quota. Windows with no requests report 0.
     */
    public Uni<Map<WindowKind, Long>> usage(String identifier, String resource) {
        final var now = clock.instant();
        final var reads = new ArrayList<Uni<WindowCount>>(WindowKind.values().length);
        for (var window : WindowKind.values()) {
            final var key = new RateWindowKey(identifier, resource, window, window.bucketOf(now));
            reads.add(counters.get(key.toCacheKey()).map(count -> new WindowCount(window, count)));
        }
        return storeGuard.withTimeout(
                Uni.join().all(reads).andFailFast().map(MultiWindowRateLimiter::toMap), "usage");
    }

    Duration ttlFor(WindowKind window) {
        return window.duration().plus(config.grace());
    }

    private RateLimitDecision evaluate(
            String identifier, String resource, RateLimitTiers limits, List<WindowCount> counts) {
        RateLimitDecision.Limited binding = null;
        // minute, hour, day: the shortest exceeded window is reported
        for (var windowCount : counts) {
            final var window = windowCount.window();
            final var limit = limits.limitFor(window);
            if (windowCount.count() > limit) {
                binding = new RateLimitDecision.Limited(window, window.seconds(), windowCount.count(), limit);
                break;
            }
        }

        if (binding == null) {
            return RateLimitDecision.allowed(toMap(counts));
        }
        LOG.debugf(
                "Rate limit exceeded for %s on %s: window=%s count=%d limit=%d",
                identifier, resource, binding.window().wireName(), binding.count(), binding.limit());
        metrics.recordRateLimitRejection(resource, binding.window());
        return binding;
    }

    private static Map<WindowKind, Long> toMap(List<WindowCount> counts) {
        final var map = new EnumMap<WindowKind, Long>(WindowKind.class);
        counts.forEach(c -> map.put(c.window(), c.count()));
        return map;
    }

    private record WindowCount(WindowKind window, long count) {}
}
