package warden.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration for account lockout.
 *
 * <p>Configuration prefix: {@code warden.lockout}
 */
@ConfigMapping(prefix = "warden.lockout")
public interface LockoutConfig {

    /**
     * Consecutive failed logins that lock an account.
     */
    @WithDefault("5")
    int threshold();

    /**
     * Duration of a lock.
     */
    @WithDefault("PT30M")
    Duration lockDuration();

    /**
     * How long an unlocked failure count survives without further failures.
     */
    @WithDefault("PT24H")
    Duration attemptRetention();
}
