package warden.core.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

@ConfigMapping(prefix = "warden.telemetry")
public interface TelemetryConfig {

    @WithDefault("true")
    boolean metricsEnabled();
}
