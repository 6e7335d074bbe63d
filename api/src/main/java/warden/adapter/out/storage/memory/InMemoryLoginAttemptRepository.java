package warden.adapter.out.storage.memory;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;

import warden.core.model.lockout.LockoutPolicy;
import warden.core.model.lockout.LoginAttemptState;
import warden.core.port.out.LoginAttemptRepository;

/**
 * In-memory implementation of {@link LoginAttemptRepository}.
 *
 * <p>Every mutation goes through {@link ConcurrentMap#compute} so each principal's
 * state changes atomically.
 *
 * <p><strong>Warning:</strong> Lockouts are not shared across instances.
 */
public class InMemoryLoginAttemptRepository implements LoginAttemptRepository {

    private final ConcurrentMap<String, LoginAttemptState> attempts = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryLoginAttemptRepository(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Uni<LoginAttemptState> find(String principalId) {
        return Uni.createFrom()
                .item(() -> attempts.getOrDefault(principalId, LoginAttemptState.unlocked(principalId)));
    }

    @Override
    public Uni<LoginAttemptState> recordFailure(String principalId, LockoutPolicy policy, Instant now) {
        return Uni.createFrom().item(() -> attempts.compute(principalId, (id, existing) -> {
            final var current = existing == null ? LoginAttemptState.unlocked(id) : existing;
            return current.afterFailure(policy, now);
        }));
    }

    @Override
    public Uni<Boolean> releaseElapsedLock(String principalId, Instant now) {
        return Uni.createFrom().item(() -> {
            final var released = new boolean[1];
            attempts.computeIfPresent(principalId, (id, existing) -> {
                if (existing.isLockElapsedAt(now)) {
                    released[0] = true;
                    return null;
                }
                return existing;
            });
            return released[0];
        });
    }

    @Override
    public Uni<LoginAttemptState> resetIfUnlocked(String principalId, Instant now) {
        return Uni.createFrom().item(() -> {
            final var after = attempts.computeIfPresent(
                    principalId, (id, existing) -> existing.isLockedAt(now) ? existing : null);
            return after == null ? LoginAttemptState.unlocked(principalId) : after;
        });
    }

    @Override
    public Uni<Void> clear(String principalId) {
        return Uni.createFrom().item(() -> {
            attempts.remove(principalId);
            return null;
        });
    }

    @Override
    public Multi<LoginAttemptState> streamLocked(Instant now) {
        return Multi.createFrom().iterable(attempts.values()).filter(state -> state.isLockedAt(now));
    }

    /**
     * Remove elapsed locks and failure counts older than {@code policy.attemptRetention()}.
     */
    public void sweepExpired(LockoutPolicy policy) {
        final var now = clock.instant();
        attempts.values().removeIf(state -> {
            if (state.isLockRecorded()) {
                return state.isLockElapsedAt(now);
            }
            return state.lastFailureAt() == null
                    || !now.isBefore(state.lastFailureAt().plus(policy.attemptRetention()));
        });
    }

    public int size() {
        return attempts.size();
    }
}
