package warden.core.port.out;

import java.time.Instant;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;

import warden.core.model.lockout.LockoutPolicy;
import warden.core.model.lockout.LoginAttemptState;

/**
 * Port for per-principal failed-login state.
 *
 * <p>Every mutating operation is atomic per principal. In particular
 * {@link #recordFailure} is a single compare-and-increment, so two concurrent
 * failures can never both skip the lock transition.
 */
public interface LoginAttemptRepository {

    /**
     * Read the current state.
     *
     * @return the state, {@link LoginAttemptState#unlocked} when nothing is recorded
     */
    Uni<LoginAttemptState> find(String principalId);

    /**
     * Apply one failed attempt as described by
     * {@link LoginAttemptState#afterFailure(LockoutPolicy, Instant)}.
     *
     * @return the state after the failure
     */
    Uni<LoginAttemptState> recordFailure(String principalId, LockoutPolicy policy, Instant now);

    /**
     * Revert an elapsed lock to {@code Unlocked(0)}.
     *
     * @return true if an elapsed lock was released by this call
     */
    Uni<Boolean> releaseElapsedLock(String principalId, Instant now);

    /**
     * Reset the failed count if no lock is in force.
     *
     * @return the state after the call; unchanged if a lock is in force
     */
    Uni<LoginAttemptState> resetIfUnlocked(String principalId, Instant now);

    /**
     * Remove all state for a principal, lifting any lock.
     */
    Uni<Void> clear(String principalId);

    /**
     * Stream principals whose lock is in force at {@code now}.
     */
    Multi<LoginAttemptState> streamLocked(Instant now);
}
