package warden.adapter.out.telemetry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import warden.core.model.ratelimit.WindowKind;
import warden.core.model.threat.AlertSeverity;
import warden.core.model.threat.ThreatCategory;

@DisplayName("MicrometerMetrics")
class MicrometerMetricsTest {

    private SimpleMeterRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
    }

    @Nested
    @DisplayName("When enabled")
    class EnabledTests {

        private MicrometerMetrics metrics;

        @BeforeEach
        void setUp() {
            metrics = new MicrometerMetrics(registry, () -> true);
        }

        @Test
        @DisplayName("should tag rate-limit rejections with resource and window")
        void shouldCountRateLimitRejections() {
            metrics.recordRateLimitRejection("api", WindowKind.HOUR);
            metrics.recordRateLimitRejection("api", WindowKind.HOUR);

            final var counter = registry.find("warden.ratelimit.rejections")
                    .tag("resource", "api")
                    .tag("window", "hour")
                    .counter();

            assertEquals(2.0, counter.count());
        }

        @Test
        @DisplayName("should tag alerts with severity and category")
        void shouldCountAlerts() {
            metrics.recordAlertCreated(AlertSeverity.CRITICAL, ThreatCategory.CODE_INJECTION);

            final var counter = registry.find("warden.alerts.created")
                    .tag("severity", AlertSeverity.CRITICAL.wireName())
                    .tag("category", "code_injection")
                    .counter();

            assertEquals(1.0, counter.count());
        }

        @Test
        @DisplayName("should replace missing tag values with unknown")
        void shouldDefaultNullTags() {
            metrics.recordStoreDegradation("rate-limiter", null, "timeout");

            final var counter = registry.find("warden.store.degradations")
                    .tag("operation", "unknown")
                    .counter();

            assertEquals(1.0, counter.count());
            assertTrue(metrics.isEnabled());
        }
    }

    @Test
    @DisplayName("should register nothing when disabled")
    void shouldBeNoOpWhenDisabled() {
        final var metrics = new MicrometerMetrics(registry, () -> false);

        metrics.recordLockout();
        metrics.recordLogin("success");
        metrics.recordBlock("manual");

        assertFalse(metrics.isEnabled());
        assertNull(registry.find("warden.lockout.transitions").counter());
        assertTrue(registry.getMeters().isEmpty());
    }
}
