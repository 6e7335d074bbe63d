package warden.core.service.ratelimit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import warden.core.model.ratelimit.RateLimitTiers;
import warden.mock.TestConfigs;

@DisplayName("RateLimitTierCatalog")
class RateLimitTierCatalogTest {

    private RateLimitTierCatalog catalog;

    @BeforeEach
    void setUp() {
        catalog = new RateLimitTierCatalog(TestConfigs.rateLimiting(
                true,
                Map.of(
                        "free", TestConfigs.tier(60, 1000, 5000),
                        "Enterprise", TestConfigs.tier(1000, 20000, 100000))));
    }

    @Test
    @DisplayName("should resolve tier names case-insensitively")
    void shouldResolveCaseInsensitively() {
        assertEquals(new RateLimitTiers(1000, 20000, 100000), catalog.resolve("enterprise"));
        assertEquals(new RateLimitTiers(1000, 20000, 100000), catalog.resolve(" ENTERPRISE "));
    }

    @Test
    @DisplayName("should fall back to the default tier for unknown or missing names")
    void shouldFallBackToDefault() {
        var free = new RateLimitTiers(60, 1000, 5000);

        assertEquals(free, catalog.resolve("platinum"));
        assertEquals(free, catalog.resolve(null));
        assertEquals(free, catalog.resolve(""));
        assertEquals(free, catalog.defaultTiers());
    }

    @Test
    @DisplayName("should refuse a configuration without the default tier")
    void shouldRequireDefaultTier() {
        var config = TestConfigs.rateLimiting(true, Map.of("starter", TestConfigs.tier(100, 2000, 10000)));

        assertThrows(IllegalStateException.class, () -> new RateLimitTierCatalog(config));
    }
}
