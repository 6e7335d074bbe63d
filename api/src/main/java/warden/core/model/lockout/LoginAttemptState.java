package warden.core.model.lockout;

import java.time.Duration;
import java.time.Instant;

/**
 * Failed-login bookkeeping for one principal.
 *
 * <p>{@code lockedUntil} is non-null only once {@code failedCount} has reached the
 * lockout threshold in the current unlock cycle. A lock whose time has passed is
 * still recorded until the next check reverts it.
 *
 * @param principalId   principal identifier
 * @param failedCount   consecutive failures in this cycle
 * @param lockedUntil   end of the lock, or null when unlocked
 * @param lastFailureAt time of the most recent failure, or null
 */
public record LoginAttemptState(String principalId, int failedCount, Instant lockedUntil, Instant lastFailureAt) {

    public static LoginAttemptState unlocked(String principalId) {
        return new LoginAttemptState(principalId, 0, null, null);
    }

    public boolean isLockRecorded() {
        return lockedUntil != null;
    }

    public boolean isLockedAt(Instant now) {
        return lockedUntil != null && now.isBefore(lockedUntil);
    }

    public boolean isLockElapsedAt(Instant now) {
        return lockedUntil != null && !now.isBefore(lockedUntil);
    }

    /**
     * Whole seconds until the lock ends, rounded up, at least 1 while locked.
     */
    public long retryAfterSeconds(Instant now) {
        if (!isLockedAt(now)) {
            return 0;
        }
        final var millis = Duration.between(now, lockedUntil).toMillis();
        return Math.max(1, (millis + 999) / 1000);
    }

    /**
     * Applies one failed attempt. An elapsed lock or a stale count starts a fresh
     * cycle first; the lock transition only happens once per cycle.
     */
    public LoginAttemptState afterFailure(LockoutPolicy policy, Instant now) {
        var base = this;
        if (isLockElapsedAt(now) || isStale(policy, now)) {
            base = unlocked(principalId);
        }
        final var count = base.failedCount + 1;
        var until = base.lockedUntil;
        if (until == null && count >= policy.threshold()) {
            until = now.plus(policy.lockDuration());
        }
        return new LoginAttemptState(principalId, count, until, now);
    }

    private boolean isStale(LockoutPolicy policy, Instant now) {
        return lockedUntil == null
                && lastFailureAt != null
                && !now.isBefore(lastFailureAt.plus(policy.attemptRetention()));
    }
}
