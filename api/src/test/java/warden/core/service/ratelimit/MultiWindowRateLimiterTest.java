package warden.core.service.ratelimit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.Executors;

import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import warden.adapter.out.storage.memory.InMemoryCounterStore;
import warden.core.model.common.FailurePolicy;
import warden.core.model.ratelimit.RateLimitDecision;
import warden.core.model.ratelimit.RateLimitTiers;
import warden.core.model.ratelimit.WindowKind;
import warden.core.port.out.CounterStore;
import warden.core.port.out.Metrics;
import warden.mock.MutableClock;
import warden.mock.TestConfigs;

@DisplayName("MultiWindowRateLimiter")
class MultiWindowRateLimiterTest {

    private static final Duration WAIT = Duration.ofSeconds(1);
    private static final RateLimitTiers FREE = new RateLimitTiers(60, 1000, 5000);

    private MutableClock clock;
    private InMemoryCounterStore counters;
    private Metrics metrics;
    private MultiWindowRateLimiter limiter;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2024-03-01T12:00:45Z");
        counters = new InMemoryCounterStore(clock);
        metrics = mock(Metrics.class);
        limiter = newLimiter(counters, true, FailurePolicy.FAIL_OPEN);
    }

    private MultiWindowRateLimiter newLimiter(CounterStore store, boolean enabled, FailurePolicy policy) {
        return new MultiWindowRateLimiter(
                store,
                TestConfigs.rateLimiting(enabled, Map.of("free", TestConfigs.tier(60, 1000, 5000))),
                TestConfigs.resiliency(policy, FailurePolicy.FAIL_OPEN, FailurePolicy.FAIL_CLOSED),
                metrics,
                clock);
    }

    private RateLimitDecision consume(String identifier, RateLimitTiers tiers) {
        return limiter.checkAndConsume(identifier, "api", tiers).await().atMost(WAIT);
    }

    @Nested
    @DisplayName("Single window")
    class SingleWindowTests {

        @Test
        @DisplayName("should allow exactly the per-minute limit and reject the next request")
        void shouldRejectAfterLimit() {
            for (int i = 1; i <= 60; i++) {
                assertTrue(consume("user-1", FREE).isAllowed(), "request " + i + " should pass");
            }

            var rejected = consume("user-1", FREE);

            var limited = assertInstanceOf(RateLimitDecision.Limited.class, rejected);
            assertEquals(WindowKind.MINUTE, limited.window());
            assertEquals(60, limited.retryAfterSeconds());
            assertEquals(61, limited.count());
            assertEquals(60, limited.limit());
            verify(metrics).recordRateLimitRejection("api", WindowKind.MINUTE);
        }

        @Test
        @DisplayName("should report post-increment counts for every window")
        void shouldReportCounts() {
            consume("user-1", FREE);
            var second = consume("user-1", FREE);

            var allowed = assertInstanceOf(RateLimitDecision.Allowed.class, second);
            assertEquals(2L, allowed.counts().get(WindowKind.MINUTE));
            assertEquals(2L, allowed.counts().get(WindowKind.HOUR));
            assertEquals(2L, allowed.counts().get(WindowKind.DAY));
            assertFalse(allowed.degraded());
        }

        @Test
        @DisplayName("should allow again in the next minute bucket")
        void shouldResetInNextMinute() {
            for (int i = 0; i < 61; i++) {
                consume("user-1", FREE);
            }

            clock.advance(Duration.ofSeconds(15));

            assertTrue(consume("user-1", FREE).isAllowed());
        }

        @Test
        @DisplayName("should charge rejected requests against the quota")
        void shouldChargeRejectedRequests() {
            for (int i = 0; i < 65; i++) {
                consume("user-1", FREE);
            }

            var usage = limiter.usage("user-1", "api").await().atMost(WAIT);

            assertEquals(65L, usage.get(WindowKind.MINUTE));
            assertEquals(65L, usage.get(WindowKind.HOUR));
        }

        @Test
        @DisplayName("should keep identifiers and resources apart")
        void shouldIsolateKeys() {
            var tight = new RateLimitTiers(1, 1000, 5000);
            consume("user-1", tight);

            assertTrue(consume("user-2", tight).isAllowed());
            assertTrue(limiter.checkAndConsume("user-1", "other", tight).await().atMost(WAIT).isAllowed());
            assertFalse(consume("user-1", tight).isAllowed());
        }
    }

    @Nested
    @DisplayName("Several windows")
    class MultiWindowTests {

        @Test
        @DisplayName("should report the minute window first when several are exceeded")
        void shouldReportShortestExceededWindow() {
            var tiers = new RateLimitTiers(2, 2, 100);
            consume("user-1", tiers);
            consume("user-1", tiers);

            var rejected = consume("user-1", tiers);

            var limited = assertInstanceOf(RateLimitDecision.Limited.class, rejected);
            assertEquals(WindowKind.MINUTE, limited.window());
            assertEquals(60, limited.retryAfterSeconds());
        }

        @Test
        @DisplayName("should report the full hour when only the hour window is exceeded")
        void shouldReportHourLength() {
            var tiers = new RateLimitTiers(100, 2, 100);
            consume("user-1", tiers);
            consume("user-1", tiers);

            var limited = assertInstanceOf(RateLimitDecision.Limited.class, consume("user-1", tiers));

            assertEquals(WindowKind.HOUR, limited.window());
            assertEquals(3600, limited.retryAfterSeconds());
        }

        @Test
        @DisplayName("should keep rejecting on the hour window after the minute rolls over")
        void shouldRejectOnHourWindow() {
            var tiers = new RateLimitTiers(5, 5, 100);
            for (int i = 0; i < 5; i++) {
                consume("user-1", tiers);
            }

            clock.advance(Duration.ofMinutes(1));
            var rejected = consume("user-1", tiers);

            assertEquals(WindowKind.HOUR, assertInstanceOf(RateLimitDecision.Limited.class, rejected).window());
        }

        @Test
        @DisplayName("should give counters the window length plus grace as lifetime")
        void shouldApplyGrace() {
            assertEquals(Duration.ofMinutes(2), limiter.ttlFor(WindowKind.MINUTE));
            assertEquals(Duration.ofMinutes(61), limiter.ttlFor(WindowKind.HOUR));
        }
    }

    @Nested
    @DisplayName("Concurrency")
    class ConcurrencyTests {

        @Test
        @DisplayName("should admit at most the limit when twice the limit arrive concurrently")
        void shouldNotOverAdmit() throws Exception {
            var tiers = new RateLimitTiers(50, 1000, 5000);
            var executor = Executors.newFixedThreadPool(16);
            try {
                var tasks = new ArrayList<Callable<Boolean>>();
                for (int i = 0; i < 100; i++) {
                    tasks.add(() -> consume("user-1", tiers).isAllowed());
                }
                var allowed = 0;
                for (var future : executor.invokeAll(tasks)) {
                    if (future.get()) {
                        allowed++;
                    }
                }

                assertEquals(50, allowed);
            } finally {
                executor.shutdownNow();
            }
        }
    }

    @Nested
    @DisplayName("Configuration and failures")
    class FailureTests {

        @Test
        @DisplayName("should allow everything without counting when disabled")
        void shouldSkipWhenDisabled() {
            var disabled = newLimiter(counters, false, FailurePolicy.FAIL_OPEN);

            var decision = disabled.checkAndConsume("user-1", "api", new RateLimitTiers(1, 1, 1))
                    .await()
                    .atMost(WAIT);

            assertTrue(decision.isAllowed());
            assertEquals(0, counters.size());
        }

        @Test
        @DisplayName("should allow a degraded request when the store fails and the policy fails open")
        void shouldFailOpen() {
            var failing = mock(CounterStore.class);
            when(failing.incrementAndGet(anyString(), any()))
                    .thenReturn(Uni.createFrom().failure(new RuntimeException("down")));
            var open = newLimiter(failing, true, FailurePolicy.FAIL_OPEN);

            var decision = open.checkAndConsume("user-1", "api", FREE).await().atMost(WAIT);

            assertTrue(assertInstanceOf(RateLimitDecision.Allowed.class, decision).degraded());
            verify(metrics).recordStoreDegradation("rate-limiter", "checkAndConsume", "failure");
        }

        @Test
        @DisplayName("should deny when the store fails and the policy fails closed")
        void shouldFailClosed() {
            var failing = mock(CounterStore.class);
            when(failing.incrementAndGet(anyString(), any()))
                    .thenReturn(Uni.createFrom().failure(new RuntimeException("down")));
            var closed = newLimiter(failing, true, FailurePolicy.FAIL_CLOSED);

            var decision = closed.checkAndConsume("user-1", "api", FREE).await().atMost(WAIT);

            assertInstanceOf(RateLimitDecision.Unavailable.class, decision);
        }

        @Test
        @DisplayName("should fall back when the store does not answer in time")
        void shouldFallBackOnTimeout() {
            var hanging = mock(CounterStore.class);
            when(hanging.incrementAndGet(anyString(), any())).thenReturn(Uni.createFrom().nothing());
            var open = newLimiter(hanging, true, FailurePolicy.FAIL_OPEN);

            var decision = open.checkAndConsume("user-1", "api", FREE).await().atMost(WAIT);

            assertTrue(assertInstanceOf(RateLimitDecision.Allowed.class, decision).degraded());
            verify(metrics).recordStoreDegradation("rate-limiter", "checkAndConsume", "timeout");
        }
    }
}
