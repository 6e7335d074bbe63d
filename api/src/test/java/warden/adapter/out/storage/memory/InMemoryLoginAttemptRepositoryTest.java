package warden.adapter.out.storage.memory;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import warden.core.model.lockout.LockoutPolicy;
import warden.mock.MutableClock;

@DisplayName("InMemoryLoginAttemptRepository")
class InMemoryLoginAttemptRepositoryTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(1);
    private static final LockoutPolicy POLICY = new LockoutPolicy(2, Duration.ofMinutes(30), Duration.ofHours(24));

    private MutableClock clock;
    private InMemoryLoginAttemptRepository repository;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2024-03-01T12:00:00Z");
        repository = new InMemoryLoginAttemptRepository(clock);
    }

    private void fail(String principalId) {
        repository.recordFailure(principalId, POLICY, clock.instant()).await().atMost(TIMEOUT);
    }

    @Test
    @DisplayName("should report an unlocked state for an unknown principal")
    void shouldDefaultToUnlocked() {
        final var state = repository.find("alice").await().atMost(TIMEOUT);

        assertEquals(0, state.failedCount());
        assertFalse(state.isLockRecorded());
    }

    @Test
    @DisplayName("should release a lock only once it has elapsed")
    void shouldReleaseElapsedLock() {
        fail("alice");
        fail("alice");

        assertFalse(repository.releaseElapsedLock("alice", clock.instant()).await().atMost(TIMEOUT));

        clock.advance(Duration.ofMinutes(30));

        assertTrue(repository.releaseElapsedLock("alice", clock.instant()).await().atMost(TIMEOUT));
        assertEquals(0, repository.find("alice").await().atMost(TIMEOUT).failedCount());
    }

    @Test
    @DisplayName("should keep an active lock on reset")
    void shouldKeepActiveLockOnReset() {
        fail("alice");
        fail("alice");
        fail("bob");

        assertTrue(repository.resetIfUnlocked("alice", clock.instant()).await().atMost(TIMEOUT)
                .isLockedAt(clock.instant()));
        assertEquals(0, repository.resetIfUnlocked("bob", clock.instant()).await().atMost(TIMEOUT)
                .failedCount());
    }

    @Test
    @DisplayName("should stream only principals locked right now")
    void shouldStreamLocked() {
        fail("alice");
        fail("alice");
        fail("bob");

        final var locked = repository.streamLocked(clock.instant()).collect().asList().await().atMost(TIMEOUT);

        assertEquals(1, locked.size());
        assertEquals("alice", locked.get(0).principalId());
    }

    @Test
    @DisplayName("should sweep elapsed locks and stale counts")
    void shouldSweep() {
        fail("alice");
        fail("alice");
        fail("bob");
        clock.advance(Duration.ofHours(1));
        fail("carol");

        repository.sweepExpired(POLICY);

        assertEquals(2, repository.size());

        clock.advance(Duration.ofHours(24));
        repository.sweepExpired(POLICY);

        assertEquals(0, repository.size());
    }
}
