package warden.core.service.gateway;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.Map;

import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import warden.core.model.gateway.GuardDecision;
import warden.core.model.ratelimit.RateLimitDecision;
import warden.core.model.ratelimit.RateLimitTiers;
import warden.core.model.ratelimit.WindowKind;
import warden.core.model.threat.BlockSubject;
import warden.core.model.threat.InspectedRequest;
import warden.core.model.threat.ThreatAssessment;
import warden.core.model.threat.ThreatCategory;
import warden.core.model.threat.ThreatError;
import warden.core.service.ratelimit.MultiWindowRateLimiter;
import warden.core.service.threat.ThreatMonitor;
import warden.mock.MutableClock;

@DisplayName("RequestGuard")
class RequestGuardTest {

    private static final Duration WAIT = Duration.ofSeconds(1);
    private static final RateLimitTiers TIERS = new RateLimitTiers(60, 1000, 5000);
    private static final InspectedRequest REQUEST = InspectedRequest.of("198.51.100.7", "GET", "/api/orders", "");

    private MutableClock clock;
    private ThreatMonitor threatMonitor;
    private MultiWindowRateLimiter rateLimiter;
    private RequestGuard guard;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2024-03-01T12:00:00Z");
        threatMonitor = mock(ThreatMonitor.class);
        rateLimiter = mock(MultiWindowRateLimiter.class);
        guard = new RequestGuard(threatMonitor, rateLimiter, clock);

        when(threatMonitor.inspect(any())).thenReturn(Uni.createFrom().item(ThreatAssessment.clean()));
        when(threatMonitor.checkPrincipal(anyString())).thenReturn(Uni.createFrom().item(ThreatAssessment.clean()));
        when(rateLimiter.checkAndConsume(anyString(), anyString(), any()))
                .thenReturn(Uni.createFrom().item(RateLimitDecision.allowed(Map.of())));
    }

    private GuardDecision admit(String identifier) {
        return guard.admit(REQUEST, identifier, "api", TIERS).await().atMost(WAIT);
    }

    @Test
    @DisplayName("should admit an anonymous clean request without consuming quota")
    void shouldAdmitAnonymous() {
        var decision = admit(null);

        assertTrue(decision.isProceed());
        verify(threatMonitor, never()).checkPrincipal(anyString());
        verify(rateLimiter, never()).checkAndConsume(anyString(), anyString(), any());
    }

    @Test
    @DisplayName("should consume quota for an identified caller")
    void shouldRateLimitIdentifiedCaller() {
        when(rateLimiter.checkAndConsume("user-1", "api", TIERS)).thenReturn(Uni.createFrom().item(
                new RateLimitDecision.Limited(WindowKind.MINUTE, 42, 61, 60)));

        var decision = admit("user-1");

        var limited = assertInstanceOf(GuardDecision.RateLimited.class, decision);
        assertEquals(WindowKind.MINUTE, limited.window());
        assertEquals(42, limited.retryAfterSeconds());
    }

    @Test
    @DisplayName("should reject a blocked principal before inspecting the request")
    void shouldRejectBlockedPrincipal() {
        when(threatMonitor.checkPrincipal("key-9")).thenReturn(Uni.createFrom().item(new ThreatAssessment.Blocked(
                BlockSubject.principal("key-9"), clock.instant().plus(Duration.ofMinutes(5)))));

        var decision = admit("key-9");

        var rejected = assertInstanceOf(GuardDecision.ThreatRejected.class, decision);
        assertEquals(ThreatError.SOURCE_BLOCKED, rejected.error());
        assertNull(rejected.category());
        assertEquals(300, rejected.retryAfterSeconds());
        verify(threatMonitor, never()).inspect(any());
        verify(rateLimiter, never()).checkAndConsume(anyString(), anyString(), any());
    }

    @Test
    @DisplayName("should stop at a detection without consuming quota")
    void shouldStopAtDetection() {
        when(threatMonitor.inspect(REQUEST)).thenReturn(Uni.createFrom().item(new ThreatAssessment.Detected(
                ThreatError.PATTERN_MATCHED, ThreatCategory.SQL_INJECTION, "SEC-20240301-000001")));

        var decision = admit("user-1");

        var rejected = assertInstanceOf(GuardDecision.ThreatRejected.class, decision);
        assertEquals(ThreatCategory.SQL_INJECTION, rejected.category());
        verify(rateLimiter, never()).checkAndConsume(anyString(), anyString(), any());
    }

    @Test
    @DisplayName("should deny when a fail-closed stage is unavailable")
    void shouldDenyWhenUnavailable() {
        when(threatMonitor.inspect(REQUEST)).thenReturn(Uni.createFrom().item(new ThreatAssessment.Unavailable()));

        var decision = admit(null);

        assertEquals("threat-monitor", assertInstanceOf(GuardDecision.Unavailable.class, decision).stage());
    }

    @Test
    @DisplayName("should admit a degraded request")
    void shouldAdmitDegraded() {
        when(threatMonitor.inspect(REQUEST)).thenReturn(Uni.createFrom().item(ThreatAssessment.degraded()));
        when(rateLimiter.checkAndConsume("user-1", "api", TIERS))
                .thenReturn(Uni.createFrom().item(RateLimitDecision.degraded()));

        assertTrue(admit("user-1").isProceed());
    }
}
