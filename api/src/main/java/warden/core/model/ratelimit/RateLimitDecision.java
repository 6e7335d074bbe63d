package warden.core.model.ratelimit;

import java.util.Map;

/**
 * Result of {@code checkAndConsume}.
 */
public sealed interface RateLimitDecision {

    /**
     * @param counts   post-increment count per window; empty when degraded
     * @param degraded true when the store failed and the fail-open policy applied
     */
    record Allowed(Map<WindowKind, Long> counts, boolean degraded) implements RateLimitDecision {}

    /**
     * Rejection for the window whose reset lies furthest away among the exceeded ones.
     */
    record Limited(WindowKind window, long retryAfterSeconds, long count, long limit) implements RateLimitDecision {}

    /**
     * The store failed and the fail-closed policy applied.
     */
    record Unavailable() implements RateLimitDecision {}

    static RateLimitDecision allowed(Map<WindowKind, Long> counts) {
        return new Allowed(Map.copyOf(counts), false);
    }

    static RateLimitDecision degraded() {
        return new Allowed(Map.of(), true);
    }

    default boolean isAllowed() {
        return this instanceof Allowed;
    }
}
