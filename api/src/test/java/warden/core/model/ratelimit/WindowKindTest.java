package warden.core.model.ratelimit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;

import java.time.Instant;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("WindowKind")
class WindowKindTest {

    private static final Instant NOW = Instant.parse("2024-03-01T12:34:56Z");

    @Test
    @DisplayName("should report the full window length regardless of the instant")
    void shouldReportWindowLength() {
        assertEquals(60, WindowKind.MINUTE.seconds());
        assertEquals(3600, WindowKind.HOUR.seconds());
        assertEquals(86400, WindowKind.DAY.seconds());
    }

    @Test
    @DisplayName("should place instants in the same bucket until the boundary")
    void shouldBucketInstants() {
        var bucket = WindowKind.MINUTE.bucketOf(NOW);

        assertEquals(bucket, WindowKind.MINUTE.bucketOf(Instant.parse("2024-03-01T12:34:00Z")));
        assertNotEquals(bucket, WindowKind.MINUTE.bucketOf(Instant.parse("2024-03-01T12:35:00Z")));
    }

    @Test
    @DisplayName("should put the identifier last in the cache key")
    void shouldFormatCacheKey() {
        var key = new RateWindowKey("ip:10.0.0.1", "api", WindowKind.HOUR, 475000);

        assertEquals("ratelimit:api:hour:475000:ip:10.0.0.1", key.toCacheKey());
    }
}
