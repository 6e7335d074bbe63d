package warden.core.config;

import java.time.Duration;
import java.util.Map;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration for multi-window rate limiting.
 *
 * <p>Configuration prefix: {@code warden.rate-limit}
 *
 * <pre>
 * warden.rate-limit.tiers.free.per-minute=60
 * warden.rate-limit.tiers.free.per-hour=1000
 * warden.rate-limit.tiers.free.per-day=5000
 * </pre>
 */
@ConfigMapping(prefix = "warden.rate-limit")
public interface RateLimitingConfig {

    @WithDefault("true")
    boolean enabled();

    /**
     * Added to each window's duration to form the counter TTL.
     */
    @WithDefault("PT1M")
    Duration grace();

    /**
     * Tier applied when a principal's tier is unknown or absent.
     */
    @WithDefault("free")
    String defaultTier();

    /**
     * Named tiers.
     */
    Map<String, TierConfig> tiers();

    interface TierConfig {

        long perMinute();

        long perHour();

        long perDay();
    }
}
