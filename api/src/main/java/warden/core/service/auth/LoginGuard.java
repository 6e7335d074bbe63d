package warden.core.service.auth;

import java.time.Clock;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.config.LockoutConfig;
import warden.core.config.ResiliencyConfig;
import warden.core.model.common.FailurePolicy;
import warden.core.model.lockout.FailureOutcome;
import warden.core.model.lockout.LockoutDecision;
import warden.core.model.lockout.LockoutPolicy;
import warden.core.model.lockout.LoginAttemptState;
import warden.core.port.out.LoginAttemptRepository;
import warden.core.port.out.Metrics;
import warden.core.service.common.StoreCallGuard;

/**
 * Per-principal account lockout.
 *
 * <p>States: {@code Unlocked(n)} to {@code Locked(until)} after {@code threshold}
 * consecutive failures, and back to {@code Unlocked(0)} on the first check made
 * once {@code until} has passed. There is no background unlock job.
 *
 * <p>Callers must call {@link #checkAccess} before verifying a password so that a
 * locked principal never reaches {@link #recordSuccess}.
 *
 * <p>When lockout state cannot be read, the configured lockout failure policy
 * decides. The default {@link FailurePolicy#FAIL_CLOSED} denies with
 * {@link LockoutDecision.Unavailable}.
 */
@ApplicationScoped
public class LoginGuard {

    private static final Logger LOG = Logger.getLogger(LoginGuard.class);

    private final LoginAttemptRepository repository;
    private final LockoutPolicy policy;
    private final FailurePolicy failurePolicy;
    private final StoreCallGuard storeGuard;
    private final Metrics metrics;
    private final Clock clock;

    @Inject
    public LoginGuard(
            LoginAttemptRepository repository,
            LockoutConfig config,
            ResiliencyConfig resiliency,
            Metrics metrics,
            Clock clock) {
        this.repository = repository;
        this.policy = new LockoutPolicy(config.threshold(), config.lockDuration(), config.attemptRetention());
        this.failurePolicy = resiliency.store().lockoutFailurePolicy();
        this.storeGuard = new StoreCallGuard(resiliency.store().operationTimeout(), metrics, "login-guard");
        this.metrics = metrics;
        this.clock = clock;
    }

    public LockoutPolicy policy() {
        return policy;
    }

    /**
     * Decide whether the principal may attempt to authenticate.
     *
     * <p>An elapsed lock is released by this call, so the result is
     * {@code Allowed(0)}.
     */
    public Uni<LockoutDecision> checkAccess(String principalId) {
        final var now = clock.instant();
        final Uni<LockoutDecision> check = repository.find(principalId).flatMap(state -> {
            if (state.isLockedAt(now)) {
                return Uni.createFrom().item(LockoutDecision.locked(state.retryAfterSeconds(now)));
            }
            if (state.isLockElapsedAt(now)) {
                return repository.releaseElapsedLock(principalId, now).map(released -> {
                    if (released) {
                        LOG.infof("Lock on principal %s elapsed, failed count reset", principalId);
                    }
                    return LockoutDecision.allowed(0);
                });
            }
            return Uni.createFrom().item(LockoutDecision.allowed(state.failedCount()));
        });

        return storeGuard.withPolicy(
                check,
                "checkAccess",
                failurePolicy,
                () -> LockoutDecision.allowed(0),
                LockoutDecision::unavailable);
    }

    /**
     * Record a failed password check with a single atomic compare-and-increment.
     *
     * <p>If the store cannot be written the failure is not recorded and
     * {@link FailureOutcome#recorded()} is false.
     */
    public Uni<FailureOutcome> recordFailure(String principalId) {
        final var now = clock.instant();
        final var update = repository.recordFailure(principalId, policy, now).map(state -> {
            // Only the increment that reaches the threshold performs the lock transition.
            final var lockedNow = state.isLockRecorded() && state.failedCount() == policy.threshold();
            if (lockedNow) {
                LOG.infof(
                        "Principal %s locked until %s after %d failed attempts",
                        principalId, state.lockedUntil(), state.failedCount());
                metrics.recordLockout();
            } else {
                LOG.debugf("Failed attempt %d for principal %s", state.failedCount(), principalId);
            }
            return new FailureOutcome(state, lockedNow, true);
        });

        return storeGuard.withFallback(update, "recordFailure", () -> FailureOutcome.unrecorded(principalId));
    }

    /**
     * Reset the failed count after a successful authentication. Has no effect on
     * a principal whose lock is in force.
     */
    public Uni<Void> recordSuccess(String principalId) {
        return storeGuard.withTimeoutSilent(
                repository.resetIfUnlocked(principalId, clock.instant()).replaceWithVoid(), "recordSuccess");
    }

    /**
     * Current state, with elapsed locks reported as unlocked.
     */
    public Uni<LoginAttemptState> status(String principalId) {
        final var now = clock.instant();
        return storeGuard.withTimeout(repository.find(principalId), "status").map(state -> state.isLockElapsedAt(now)
                ? LoginAttemptState.unlocked(principalId)
                : state);
    }

    /**
     * Operator override: lift any lock and reset the counter.
     */
    public Uni<Void> unlock(String principalId) {
        return storeGuard
                .withTimeout(repository.clear(principalId), "unlock")
                .invoke(() -> LOG.infof("Principal %s unlocked by operator", principalId));
    }

    public Multi<LoginAttemptState> lockedPrincipals() {
        return repository.streamLocked(clock.instant());
    }
}
