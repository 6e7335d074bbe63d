package warden.core.model.lockout;

/**
 * Result of checking whether a principal may attempt to log in.
 */
public sealed interface LockoutDecision {

    record Allowed(int failedCount) implements LockoutDecision {}

    record Locked(long retryAfterSeconds) implements LockoutDecision {}

    /**
     * Lockout state could not be read and the configured policy denies.
     */
    record Unavailable() implements LockoutDecision {}

    static LockoutDecision allowed(int failedCount) {
        return new Allowed(failedCount);
    }

    static LockoutDecision locked(long retryAfterSeconds) {
        return new Locked(retryAfterSeconds);
    }

    static LockoutDecision unavailable() {
        return new Unavailable();
    }

    default boolean isAllowed() {
        return this instanceof Allowed;
    }
}
