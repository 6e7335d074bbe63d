package warden.core.model.lockout;

import java.time.Duration;

/**
 * Lockout parameters.
 *
 * @param threshold        consecutive failures that lock the account
 * @param lockDuration     how long a lock lasts
 * @param attemptRetention how long an idle, unlocked failure count is remembered
 */
public record LockoutPolicy(int threshold, Duration lockDuration, Duration attemptRetention) {

    public static final LockoutPolicy DEFAULT = new LockoutPolicy(5, Duration.ofMinutes(30), Duration.ofHours(24));

    public LockoutPolicy {
        if (threshold < 1) {
            throw new IllegalArgumentException("threshold must be positive, got " + threshold);
        }
        if (lockDuration == null || lockDuration.isNegative() || lockDuration.isZero()) {
            throw new IllegalArgumentException("lockDuration must be positive");
        }
        if (attemptRetention == null || attemptRetention.compareTo(lockDuration) < 0) {
            throw new IllegalArgumentException("attemptRetention must be at least lockDuration");
        }
    }
}
