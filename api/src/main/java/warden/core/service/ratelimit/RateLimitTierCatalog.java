package warden.core.service.ratelimit;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import warden.core.config.RateLimitingConfig;
import warden.core.model.ratelimit.RateLimitTiers;

/**
 * Named rate-limit tiers from configuration.
 *
 * <p>Tier names are case-insensitive. Unknown or absent names resolve to the
 * configured default tier, which must exist.
 */
@ApplicationScoped
public class RateLimitTierCatalog {

    private static final Logger LOG = Logger.getLogger(RateLimitTierCatalog.class);

    private final Map<String, RateLimitTiers> tiers;
    private final String defaultTier;

    @Inject
    public RateLimitTierCatalog(RateLimitingConfig config) {
        final var loaded = new HashMap<String, RateLimitTiers>();
        config.tiers().forEach((name, tier) ->
                loaded.put(normalize(name), new RateLimitTiers(tier.perMinute(), tier.perHour(), tier.perDay())));
        this.tiers = Map.copyOf(loaded);
        this.defaultTier = normalize(config.defaultTier());

        if (!tiers.containsKey(defaultTier)) {
            throw new IllegalStateException("Default rate-limit tier '" + defaultTier + "' is not configured");
        }
        LOG.infof("Loaded rate-limit tiers %s (default %s)", tiers.keySet(), defaultTier);
    }

    public RateLimitTiers resolve(String tierName) {
        if (tierName == null || tierName.isBlank()) {
            return tiers.get(defaultTier);
        }
        final var tier = tiers.get(normalize(tierName));
        if (tier == null) {
            LOG.debugf("Unknown rate-limit tier %s, using %s", tierName, defaultTier);
            return tiers.get(defaultTier);
        }
        return tier;
    }

    public RateLimitTiers defaultTiers() {
        return tiers.get(defaultTier);
    }

    public Set<String> names() {
        return tiers.keySet();
    }

    private static String normalize(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }
}
