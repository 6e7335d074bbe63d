package warden.adapter.out.telemetry;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

import warden.core.config.TelemetryConfig;
import warden.core.model.ratelimit.WindowKind;
import warden.core.model.threat.AlertSeverity;
import warden.core.model.threat.ThreatCategory;
import warden.core.port.out.Metrics;

/**
 * Records security metrics using Micrometer.
 *
 * <p>All methods are no-ops when metrics are disabled, so callers never
 * check configuration themselves.
 *
 * <p>Metrics recorded:
 * <ul>
 *   <li>{@code warden.ratelimit.rejections} - Rejected requests by resource and window</li>
 *   <li>{@code warden.lockout.transitions} - Accounts locked</li>
 *   <li>{@code warden.threat.detections} - Pattern and volume detections by category</li>
 *   <li>{@code warden.threat.blocks} - Blocks placed by reason</li>
 *   <li>{@code warden.alerts.created} - Alerts by severity and category</li>
 *   <li>{@code warden.logins} - Login attempts by outcome</li>
 *   <li>{@code warden.store.degradations} - Store timeouts and failures</li>
 * </ul>
 */
@ApplicationScoped
public class MicrometerMetrics implements Metrics {

    private final MeterRegistry registry;
    private final boolean enabled;

    @Inject
    public MicrometerMetrics(MeterRegistry registry, TelemetryConfig config) {
        this.registry = registry;
        this.enabled = config != null && config.metricsEnabled();
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public void recordRateLimitRejection(String resource, WindowKind window) {
        if (!enabled) {
            return;
        }

        Counter.builder("warden.ratelimit.rejections")
                .description("Requests rejected by the rate limiter")
                .tag("resource", nullSafe(resource))
                .tag("window", window.wireName())
                .register(registry)
                .increment();
    }

    @Override
    public void recordLockout() {
        if (!enabled) {
            return;
        }

        Counter.builder("warden.lockout.transitions")
                .description("Accounts locked after repeated login failures")
                .register(registry)
                .increment();
    }

    @Override
    public void recordThreatDetection(ThreatCategory category) {
        if (!enabled) {
            return;
        }

        Counter.builder("warden.threat.detections")
                .description("Threat detections")
                .tag("category", category.wireName())
                .register(registry)
                .increment();
    }

    @Override
    public void recordBlock(String reason) {
        if (!enabled) {
            return;
        }

        Counter.builder("warden.threat.blocks")
                .description("Sources and principals blocked")
                .tag("reason", nullSafe(reason))
                .register(registry)
                .increment();
    }

    @Override
    public void recordAlertCreated(AlertSeverity severity, ThreatCategory category) {
        if (!enabled) {
            return;
        }

        Counter.builder("warden.alerts.created")
                .description("Security alerts raised")
                .tag("severity", severity.wireName())
                .tag("category", category.wireName())
                .register(registry)
                .increment();
    }

    @Override
    public void recordStoreDegradation(String component, String operation, String outcome) {
        if (!enabled) {
            return;
        }

        Counter.builder("warden.store.degradations")
                .description("Store calls that timed out or failed")
                .tag("component", nullSafe(component))
                .tag("operation", nullSafe(operation))
                .tag("outcome", nullSafe(outcome))
                .register(registry)
                .increment();
    }

    @Override
    public void recordLogin(String outcome) {
        if (!enabled) {
            return;
        }

        Counter.builder("warden.logins")
                .description("Login attempts")
                .tag("outcome", nullSafe(outcome))
                .register(registry)
                .increment();
    }

    private static String nullSafe(String value) {
        return value != null ? value : "unknown";
    }
}
