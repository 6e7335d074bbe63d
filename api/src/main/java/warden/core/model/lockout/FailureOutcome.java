package warden.core.model.lockout;

/**
 * Effect of recording a failed login.
 *
 * @param state       state after the failure
 * @param lockedNow   true if this failure caused the lock transition
 * @param recorded    false when the store was unavailable and nothing was recorded
 */
public record FailureOutcome(LoginAttemptState state, boolean lockedNow, boolean recorded) {

    public static FailureOutcome unrecorded(String principalId) {
        return new FailureOutcome(LoginAttemptState.unlocked(principalId), false, false);
    }
}
