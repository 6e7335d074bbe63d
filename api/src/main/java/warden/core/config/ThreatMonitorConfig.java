package warden.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration for threat detection and automated response.
 *
 * <p>Configuration prefix: {@code warden.threat}
 */
@ConfigMapping(prefix = "warden.threat")
public interface ThreatMonitorConfig {

    @WithDefault("true")
    boolean enabled();

    /**
     * Requests per source within {@link #volumeWindow()} above which a
     * denial-of-service alert is raised.
     */
    @WithDefault("200")
    long volumeThreshold();

    @WithDefault("PT1M")
    Duration volumeWindow();

    /**
     * Threat score above which a source is blocked.
     */
    @WithDefault("10")
    long scoreThreshold();

    @WithDefault("PT24H")
    Duration scoreWindow();

    /**
     * Lifetime of automatic blocks.
     */
    @WithDefault("PT1H")
    Duration blockDuration();

    /**
     * Failed logins per source within an hour above which a brute-force alert is raised.
     */
    @WithDefault("10")
    long failedLoginAlertThreshold();

    /**
     * Progressive delay applied to brute-force sources.
     */
    DelayConfig responseDelay();

    interface DelayConfig {

        @WithDefault("PT5S")
        Duration step();

        @WithDefault("PT60S")
        Duration max();

        @WithDefault("PT1H")
        Duration retention();
    }
}
