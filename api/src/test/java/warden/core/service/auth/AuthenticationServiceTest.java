package warden.core.service.auth;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.Optional;

import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import warden.adapter.out.storage.memory.InMemoryStorage;
import warden.core.model.auth.AuthenticationError;
import warden.core.model.auth.AuthenticationResult;
import warden.core.model.auth.ClientContext;
import warden.core.model.auth.PrincipalKind;
import warden.core.model.auth.TokenError;
import warden.core.model.auth.TokenType;
import warden.core.model.lockout.LockoutPolicy;
import warden.core.model.principal.Principal;
import warden.core.model.principal.PrincipalStatus;
import warden.core.model.session.DeviceInfo;
import warden.core.model.session.SessionError;
import warden.core.port.out.Metrics;
import warden.core.port.out.PasswordVerifier;
import warden.core.port.out.SecurityNotifications;
import warden.core.service.session.SessionIdGenerator;
import warden.core.service.session.SessionStore;
import warden.core.service.threat.AlertResponder;
import warden.core.service.threat.AlertService;
import warden.core.service.threat.BlockListService;
import warden.core.service.threat.ThreatMonitor;
import warden.mock.MutableClock;
import warden.mock.TestConfigs;
import warden.spi.PrincipalDirectory;

@DisplayName("AuthenticationService")
class AuthenticationServiceTest {

    private static final Duration WAIT = Duration.ofSeconds(5);
    private static final ClientContext CLIENT =
            new ClientContext("203.0.113.5", new DeviceInfo("curl/8.0", "en", "abcd"));

    private MutableClock clock;
    private PrincipalDirectory directory;
    private PasswordVerifier passwordVerifier;
    private TokenAuthority tokenAuthority;
    private SessionStore sessionStore;
    private AuthenticationService service;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2024-03-01T12:00:00Z");
        var storage = new InMemoryStorage(clock, LockoutPolicy.DEFAULT, Duration.ofHours(1));
        var metrics = mock(Metrics.class);
        var notifications = mock(SecurityNotifications.class);
        var resiliency = TestConfigs.resiliency();

        directory = mock(PrincipalDirectory.class);
        passwordVerifier = mock(PasswordVerifier.class);
        tokenAuthority = new TokenAuthority(
                TestConfigs.token(), storage.tokenRevocationRepository(), resiliency, metrics, clock);
        sessionStore = new SessionStore(
                storage.sessionRepository(), new SessionIdGenerator(), TestConfigs.token(), resiliency, metrics, clock);
        var loginGuard = new LoginGuard(
                storage.loginAttemptRepository(),
                TestConfigs.lockout(5, Duration.ofMinutes(30)),
                resiliency,
                metrics,
                clock);
        var blockList = new BlockListService(storage.blockListRepository(), notifications, resiliency, metrics, clock);
        var alerts = new AlertService(
                storage.alertRepository(),
                storage.reviewQueue(),
                new AlertResponder(notifications, storage.reviewQueue()),
                notifications,
                resiliency,
                metrics,
                clock);
        var threatMonitor = new ThreatMonitor(
                TestConfigs.threat(), storage.counterStore(), blockList, alerts, resiliency, metrics, clock);

        service = new AuthenticationService(
                directory,
                passwordVerifier,
                loginGuard,
                tokenAuthority,
                sessionStore,
                threatMonitor,
                notifications,
                resiliency,
                metrics,
                clock);

        givenPrincipal("alice", "alice@example.com", PrincipalStatus.ACTIVE);
        when(passwordVerifier.matches("correct-horse", "hash-alice")).thenReturn(true);
    }

    private void givenPrincipal(String id, String email, PrincipalStatus status) {
        var principal = new Principal(id, PrincipalKind.USER, "professional", status, "hash-" + id);
        when(directory.getPrincipalByEmail(email)).thenReturn(Uni.createFrom().item(Optional.of(principal)));
        when(directory.getPrincipalById(id)).thenReturn(Uni.createFrom().item(Optional.of(principal)));
    }

    private AuthenticationResult login(String email, String password) {
        return service.login(email, password, false, CLIENT).await().atMost(WAIT);
    }

    @Nested
    @DisplayName("login()")
    class LoginTests {

        @Test
        @DisplayName("should issue tokens backed by a new session")
        void shouldIssueTokens() {
            var result = login("alice@example.com", "correct-horse");

            var authenticated = assertInstanceOf(AuthenticationResult.Authenticated.class, result);
            var tokens = authenticated.tokens();
            assertEquals("alice", authenticated.principalId());
            assertEquals(1800, tokens.expiresInSeconds());
            assertEquals("bearer", tokens.tokenType());
            assertTrue(tokenAuthority.verify(tokens.accessToken(), TokenType.ACCESS).await().atMost(WAIT).isValid());

            var sessions = sessionStore.listActive("alice").await().atMost(WAIT);
            assertEquals(1, sessions.size());
            assertEquals(tokens.sessionId(), sessions.get(0).id());
            assertEquals("203.0.113.5", sessions.get(0).ipAddress());
            assertEquals("curl/8.0", sessions.get(0).deviceInfo().userAgent());
        }

        @Test
        @DisplayName("should answer INVALID_CREDENTIALS for an unknown account")
        void shouldRejectUnknownAccount() {
            when(directory.getPrincipalByEmail("nobody@example.com"))
                    .thenReturn(Uni.createFrom().item(Optional.empty()));

            var result = login("nobody@example.com", "whatever");

            assertEquals(
                    AuthenticationError.INVALID_CREDENTIALS,
                    assertInstanceOf(AuthenticationResult.Rejected.class, result).error());
        }

        @Test
        @DisplayName("should lock the account on the fifth wrong password and refuse even the right one")
        void shouldLockAfterRepeatedFailures() {
            for (int i = 0; i < 5; i++) {
                var result = login("alice@example.com", "wrong");
                assertEquals(
                        AuthenticationError.INVALID_CREDENTIALS,
                        ((AuthenticationResult.Rejected) result).error());
            }

            var locked = login("alice@example.com", "correct-horse");

            var rejected = assertInstanceOf(AuthenticationResult.Rejected.class, locked);
            assertEquals(AuthenticationError.ACCOUNT_LOCKED, rejected.error());
            assertEquals(1800, rejected.retryAfterSeconds());
            verify(passwordVerifier, never()).matches("correct-horse", "hash-alice");
        }

        @Test
        @DisplayName("should accept the right password once the lock has elapsed")
        void shouldAcceptAfterLockElapses() {
            for (int i = 0; i < 5; i++) {
                login("alice@example.com", "wrong");
            }
            clock.advance(Duration.ofMinutes(30));

            var result = login("alice@example.com", "correct-horse");

            assertTrue(result.isAuthenticated());
        }

        @Test
        @DisplayName("should check account status after the lockout check and before the password")
        void shouldRejectSuspendedAccount() {
            givenPrincipal("carol", "carol@example.com", PrincipalStatus.SUSPENDED);

            var result = login("carol@example.com", "anything");

            assertEquals(
                    AuthenticationError.ACCOUNT_SUSPENDED,
                    assertInstanceOf(AuthenticationResult.Rejected.class, result).error());
            verify(passwordVerifier, never()).matches(anyString(), anyString());
        }

        @Test
        @DisplayName("should answer SERVICE_UNAVAILABLE when the directory fails")
        void shouldReportUnavailableDirectory() {
            when(directory.getPrincipalByEmail("dave@example.com"))
                    .thenReturn(Uni.createFrom().failure(new RuntimeException("directory down")));

            var result = login("dave@example.com", "whatever");

            assertEquals(
                    AuthenticationError.SERVICE_UNAVAILABLE,
                    assertInstanceOf(AuthenticationResult.Rejected.class, result).error());
        }
    }

    @Nested
    @DisplayName("refresh()")
    class RefreshTests {

        @Test
        @DisplayName("should issue a new access token and keep the refresh token")
        void shouldRefresh() {
            var tokens = ((AuthenticationResult.Authenticated) login("alice@example.com", "correct-horse")).tokens();
            clock.advance(Duration.ofMinutes(1));

            var result = service.refresh(tokens.refreshToken()).await().atMost(WAIT);

            var refreshed = assertInstanceOf(AuthenticationResult.Authenticated.class, result).tokens();
            assertEquals(tokens.refreshToken(), refreshed.refreshToken());
            assertEquals(tokens.sessionId(), refreshed.sessionId());
            assertNotEquals(tokens.accessToken(), refreshed.accessToken());
        }

        @Test
        @DisplayName("should refuse an access token presented as refresh token")
        void shouldRefuseAccessToken() {
            var tokens = ((AuthenticationResult.Authenticated) login("alice@example.com", "correct-horse")).tokens();

            var result = service.refresh(tokens.accessToken()).await().atMost(WAIT);

            assertEquals(
                    TokenError.WRONG_TYPE,
                    assertInstanceOf(AuthenticationResult.TokenRejected.class, result).error());
        }

        @Test
        @DisplayName("should refuse a refresh token whose principal has been suspended")
        void shouldRefuseSuspendedPrincipal() {
            var tokens = ((AuthenticationResult.Authenticated) login("alice@example.com", "correct-horse")).tokens();
            givenPrincipal("alice", "alice@example.com", PrincipalStatus.SUSPENDED);

            var result = service.refresh(tokens.refreshToken()).await().atMost(WAIT);

            assertEquals(
                    AuthenticationError.ACCOUNT_SUSPENDED,
                    assertInstanceOf(AuthenticationResult.Rejected.class, result).error());
        }
    }

    @Nested
    @DisplayName("logout()")
    class LogoutTests {

        @Test
        @DisplayName("should end the session so the refresh token stops working")
        void shouldEndSession() {
            var tokens = ((AuthenticationResult.Authenticated) login("alice@example.com", "correct-horse")).tokens();

            var ended = service.logout(tokens.refreshToken()).await().atMost(WAIT);
            var result = service.refresh(tokens.refreshToken()).await().atMost(WAIT);

            assertTrue(ended);
            assertEquals(
                    SessionError.NOT_FOUND,
                    assertInstanceOf(AuthenticationResult.SessionRejected.class, result).error());
        }

        @Test
        @DisplayName("should be a no-op the second time")
        void shouldBeIdempotent() {
            var tokens = ((AuthenticationResult.Authenticated) login("alice@example.com", "correct-horse")).tokens();

            service.logout(tokens.refreshToken()).await().atMost(WAIT);
            var second = service.logout(tokens.refreshToken()).await().atMost(WAIT);

            assertFalse(second);
        }

        @Test
        @DisplayName("should end every session on revokeAllSessions()")
        void shouldRevokeAllSessions() {
            login("alice@example.com", "correct-horse");
            login("alice@example.com", "correct-horse");

            var count = service.revokeAllSessions("alice").await().atMost(WAIT);

            assertEquals(2, count);
            assertTrue(sessionStore.listActive("alice").await().atMost(WAIT).isEmpty());
            verify(directory, times(2)).getPrincipalByEmail("alice@example.com");
        }
    }
}
