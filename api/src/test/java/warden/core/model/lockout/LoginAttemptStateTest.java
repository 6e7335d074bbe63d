package warden.core.model.lockout;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.Instant;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("LoginAttemptState")
class LoginAttemptStateTest {

    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");
    private static final LockoutPolicy POLICY = new LockoutPolicy(3, Duration.ofMinutes(30), Duration.ofHours(24));

    @Test
    @DisplayName("should set the lock only when the count reaches the threshold")
    void shouldLockAtThreshold() {
        var state = LoginAttemptState.unlocked("alice")
                .afterFailure(POLICY, NOW)
                .afterFailure(POLICY, NOW);

        assertFalse(state.isLockRecorded());

        var locked = state.afterFailure(POLICY, NOW);

        assertEquals(3, locked.failedCount());
        assertEquals(NOW.plus(Duration.ofMinutes(30)), locked.lockedUntil());
    }

    @Test
    @DisplayName("should start a new cycle after an elapsed lock")
    void shouldStartNewCycleAfterLock() {
        var locked = new LoginAttemptState("alice", 3, NOW, NOW.minusSeconds(60));

        var next = locked.afterFailure(POLICY, NOW);

        assertEquals(1, next.failedCount());
        assertNull(next.lockedUntil());
    }

    @Test
    @DisplayName("should forget a stale count past the retention period")
    void shouldForgetStaleCount() {
        var state = new LoginAttemptState("alice", 2, null, NOW.minus(Duration.ofHours(24)));

        assertEquals(1, state.afterFailure(POLICY, NOW).failedCount());
    }

    @Test
    @DisplayName("should round the retry hint up to whole seconds")
    void shouldRoundRetryUp() {
        var state = new LoginAttemptState("alice", 3, NOW.plusMillis(1500), NOW);

        assertEquals(2, state.retryAfterSeconds(NOW));
        assertEquals(0, state.retryAfterSeconds(NOW.plusSeconds(2)));
        assertTrue(state.isLockElapsedAt(NOW.plusMillis(1500)));
    }

    @Test
    @DisplayName("should refuse a retention shorter than the lock")
    void shouldValidatePolicy() {
        assertThrows(
                IllegalArgumentException.class,
                () -> new LockoutPolicy(3, Duration.ofHours(2), Duration.ofHours(1)));
        assertThrows(
                IllegalArgumentException.class,
                () -> new LockoutPolicy(0, Duration.ofMinutes(1), Duration.ofHours(1)));
    }
}
