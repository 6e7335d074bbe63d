package warden.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import warden.core.model.common.FailurePolicy;

/**
 * Timeouts and failure policies for store calls.
 *
 * <p>Configuration prefix: {@code warden.resiliency}
 */
@ConfigMapping(prefix = "warden.resiliency")
public interface ResiliencyConfig {

    StoreConfig store();

    interface StoreConfig {

        /**
         * Upper bound for any single store call.
         */
        @WithDefault("PT0.2S")
        Duration operationTimeout();

        /**
         * Applied by the rate limiter when counters are unreachable.
         */
        @WithDefault("fail-open")
        FailurePolicy rateLimitFailurePolicy();

        /**
         * Applied by the threat monitor when counters or the block list are unreachable.
         */
        @WithDefault("fail-open")
        FailurePolicy threatFailurePolicy();

        /**
         * Applied by the login guard when lockout state is unreachable.
         */
        @WithDefault("fail-closed")
        FailurePolicy lockoutFailurePolicy();
    }
}
