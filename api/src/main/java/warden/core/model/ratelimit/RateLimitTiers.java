package warden.core.model.ratelimit;

/**
 * Per-window ceilings for one tier.
 */
public record RateLimitTiers(long perMinute, long perHour, long perDay) {

    public RateLimitTiers {
        if (perMinute < 1 || perHour < 1 || perDay < 1) {
            throw new IllegalArgumentException(
                    "limits must be positive, got " + perMinute + "/" + perHour + "/" + perDay);
        }
    }

    public long limitFor(WindowKind window) {
        return switch (window) {
            case MINUTE -> perMinute;
            case HOUR -> perHour;
            case DAY -> perDay;
        };
    }
}
