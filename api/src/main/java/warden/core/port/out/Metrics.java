package warden.core.port.out;

import warden.core.model.ratelimit.WindowKind;
import warden.core.model.threat.AlertSeverity;
import warden.core.model.threat.ThreatCategory;

/**
 * Port interface for recording security metrics.
 *
 * <p>Implementations handle the actual metric recording (e.g., Micrometer).
 */
public interface Metrics {

    boolean isEnabled();

    /**
     * Record a request rejected by the rate limiter.
     */
    void recordRateLimitRejection(String resource, WindowKind window);

    /**
     * Record an account lock transition.
     */
    void recordLockout();

    /**
     * Record a pattern or volume detection.
     */
    void recordThreatDetection(ThreatCategory category);

    /**
     * Record an automatic or manual block.
     */
    void recordBlock(String reason);

    void recordAlertCreated(AlertSeverity severity, ThreatCategory category);

    /**
     * Record a store call that timed out or failed.
     *
     * @param component component name, e.g. {@code rate-limiter}
     * @param operation operation name
     * @param outcome   {@code timeout} or {@code failure}
     */
    void recordStoreDegradation(String component, String operation, String outcome);

    /**
     * Record the outcome of a login attempt.
     */
    void recordLogin(String outcome);
}
