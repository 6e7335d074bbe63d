package warden.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration for token issuance and verification.
 *
 * <p>Configuration prefix: {@code warden.token}
 */
@ConfigMapping(prefix = "warden.token")
public interface TokenConfig {

    /**
     * HMAC-SHA256 signing secret. Must be at least 32 bytes.
     */
    String secret();

    /**
     * Value of the {@code iss} claim.
     */
    @WithDefault("warden")
    String issuer();

    /**
     * Access token lifetime.
     */
    @WithDefault("PT30M")
    Duration accessTtl();

    /**
     * Refresh token and session lifetime.
     */
    @WithDefault("P7D")
    Duration refreshTtl();

    /**
     * Refresh token and session lifetime when the user asked to be remembered.
     */
    @WithDefault("P30D")
    Duration rememberMeRefreshTtl();

    /**
     * Local cache of confirmed revocations.
     */
    RevocationCacheConfig revocationCache();

    interface RevocationCacheConfig {

        @WithDefault("true")
        boolean enabled();

        @WithDefault("10000")
        long maxSize();
    }
}
