package warden.core.model.ratelimit;

import java.time.Duration;
import java.time.Instant;

/**
 * Fixed bucket granularities evaluated together by the rate limiter.
 */
public enum WindowKind {
    MINUTE("minute", Duration.ofMinutes(1)),
    HOUR("hour", Duration.ofHours(1)),
    DAY("day", Duration.ofDays(1));

    private final String wireName;
    private final Duration duration;

    WindowKind(String wireName, Duration duration) {
        this.wireName = wireName;
        this.duration = duration;
    }

    public String wireName() {
        return wireName;
    }

    public Duration duration() {
        return duration;
    }

    /**
     * Bucket number containing {@code now}: epoch seconds floored to the window.
     */
    public long bucketOf(Instant now) {
        return Math.floorDiv(now.getEpochSecond(), duration.getSeconds());
    }

    /**
     * Window length in seconds, reported as the retry hint when the window is exceeded.
     */
    public long seconds() {
        return duration.getSeconds();
    }
}
