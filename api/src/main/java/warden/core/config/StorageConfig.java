package warden.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Storage backend selection.
 *
 * <p>Configuration prefix: {@code warden.storage}
 */
@ConfigMapping(prefix = "warden.storage")
public interface StorageConfig {

    /**
     * {@code memory} or {@code redis}.
     */
    @WithDefault("memory")
    String backend();

    /**
     * Sweep interval of the in-memory stores.
     */
    @WithDefault("PT1M")
    Duration cleanupInterval();

    /**
     * Prefix applied to every Redis key.
     */
    @WithDefault("warden:")
    String keyPrefix();
}
