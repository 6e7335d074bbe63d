package warden.core.service.threat;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import warden.adapter.out.storage.memory.InMemoryStorage;
import warden.core.model.common.FailurePolicy;
import warden.core.model.lockout.LockoutPolicy;
import warden.core.model.threat.AlertStatus;
import warden.core.model.threat.BlockSubject;
import warden.core.model.threat.InspectedRequest;
import warden.core.model.threat.ThreatAssessment;
import warden.core.model.threat.ThreatCategory;
import warden.core.model.threat.ThreatError;
import warden.core.port.out.BlockListRepository;
import warden.core.port.out.Metrics;
import warden.core.port.out.SecurityNotifications;
import warden.mock.MutableClock;
import warden.mock.TestConfigs;

@DisplayName("ThreatMonitor")
class ThreatMonitorTest {

    private static final Duration WAIT = Duration.ofSeconds(1);
    private static final String SOURCE = "198.51.100.7";

    private MutableClock clock;
    private InMemoryStorage storage;
    private Metrics metrics;
    private SecurityNotifications notifications;
    private BlockListService blockList;
    private AlertService alerts;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2024-03-01T12:00:00Z");
        storage = new InMemoryStorage(clock, LockoutPolicy.DEFAULT, Duration.ofHours(1));
        metrics = mock(Metrics.class);
        notifications = mock(SecurityNotifications.class);
        blockList = new BlockListService(
                storage.blockListRepository(), notifications, TestConfigs.resiliency(), metrics, clock);
        alerts = new AlertService(
                storage.alertRepository(),
                storage.reviewQueue(),
                new AlertResponder(notifications, storage.reviewQueue()),
                notifications,
                TestConfigs.resiliency(),
                metrics,
                clock);
    }

    private ThreatMonitor monitor(TestConfigs.Threat config) {
        return new ThreatMonitor(
                config, storage.counterStore(), blockList, alerts, TestConfigs.resiliency(), metrics, clock);
    }

    private static InspectedRequest get(String path, String query) {
        return InspectedRequest.of(SOURCE, "GET", path, query);
    }

    private ThreatAssessment inspect(ThreatMonitor monitor, InspectedRequest request) {
        return monitor.inspect(request).await().atMost(WAIT);
    }

    @Nested
    @DisplayName("Pattern detection")
    class PatternTests {

        @Test
        @DisplayName("should let an ordinary request through")
        void shouldPassCleanRequest() {
            var result = inspect(monitor(TestConfigs.threat()), get("/api/orders", "page=2&sort=date"));

            assertEquals(ThreatAssessment.clean(), result);
        }

        @Test
        @DisplayName("should detect SQL injection, raise an alert and block the source")
        void shouldDetectSqlInjection() {
            var monitor = monitor(TestConfigs.threat());

            var result = inspect(monitor, get("/api/users", "id=1 UNION SELECT password FROM users"));

            var detected = assertInstanceOf(ThreatAssessment.Detected.class, result);
            assertEquals(ThreatError.PATTERN_MATCHED, detected.error());
            assertEquals(ThreatCategory.SQL_INJECTION, detected.category());
            assertEquals("SEC-20240301-000001", detected.alertId());

            var alert = alerts.findAlert(detected.alertId()).await().atMost(WAIT).orElseThrow();
            assertEquals(AlertStatus.OPEN, alert.status());
            assertEquals(SOURCE, alert.source());

            var next = inspect(monitor, get("/api/orders", ""));
            assertInstanceOf(ThreatAssessment.Blocked.class, next);
        }

        @Test
        @DisplayName("should detect URL-encoded script injection")
        void shouldDetectEncodedScript() {
            var request = get("/search", "q=%3Cscript%3Ealert(1)%3C%2Fscript%3E");

            var result = inspect(monitor(TestConfigs.threat()), request);

            assertEquals(
                    ThreatCategory.SCRIPT_INJECTION,
                    assertInstanceOf(ThreatAssessment.Detected.class, result).category());
        }

        @Test
        @DisplayName("should detect path traversal without blocking straight away")
        void shouldNotBlockPathTraversalImmediately() {
            var monitor = monitor(TestConfigs.threat());

            var result = inspect(monitor, get("/files/../../etc/passwd", ""));
            var next = inspect(monitor, get("/api/orders", ""));

            assertEquals(
                    ThreatCategory.PATH_TRAVERSAL,
                    assertInstanceOf(ThreatAssessment.Detected.class, result).category());
            assertTrue(next.isClean());
            assertEquals(1L, monitor.threatScore(SOURCE).await().atMost(WAIT));
        }

        @Test
        @DisplayName("should inspect header values but not credentials")
        void shouldSkipCredentialHeaders() {
            var monitor = monitor(TestConfigs.threat());
            var withAuthorization = new InspectedRequest(
                    SOURCE, "GET", "/api", "", Map.of("Authorization", List.of("Bearer select-drop-union")));
            var withAgent = new InspectedRequest(
                    "203.0.113.9", "GET", "/api", "", Map.of("User-Agent", List.of("<script>x</script>")));

            assertTrue(inspect(monitor, withAuthorization).isClean());
            assertInstanceOf(ThreatAssessment.Detected.class, inspect(monitor, withAgent));
        }

        @Test
        @DisplayName("should let a CORS preflight naming DELETE through without blocking")
        void shouldIgnoreProtocolHeaders() {
            var monitor = monitor(TestConfigs.threat());
            var preflight = new InspectedRequest(
                    SOURCE,
                    "OPTIONS",
                    "/admin/blocks",
                    "",
                    Map.of(
                            "Access-Control-Request-Method", List.of("DELETE"),
                            "Access-Control-Request-Headers", List.of("authorization, content-type"),
                            "Origin", List.of("https://console.example.com")));

            assertTrue(inspect(monitor, preflight).isClean());
            assertTrue(blockList.find(BlockSubject.ip(SOURCE)).await().atMost(WAIT).isEmpty());
            assertEquals(0L, monitor.threatScore(SOURCE).await().atMost(WAIT));
        }

        @Test
        @DisplayName("should block once the threat score passes the threshold")
        void shouldBlockOnScore() {
            var monitor = monitor(TestConfigs.threat().withScoreThreshold(2));

            inspect(monitor, get("/a/../b", ""));
            inspect(monitor, get("/a/../c", ""));
            assertTrue(inspect(monitor, get("/ok", "")).isClean());

            inspect(monitor, get("/a/../d", ""));
            var blocked = inspect(monitor, get("/ok", ""));

            var entry = assertInstanceOf(ThreatAssessment.Blocked.class, blocked);
            assertEquals(BlockSubject.ip(SOURCE), entry.subject());
            assertEquals(clock.instant().plus(Duration.ofHours(1)), entry.until());
        }
    }

    @Nested
    @DisplayName("Volume detection")
    class VolumeTests {

        @Test
        @DisplayName("should flag the request that crosses the volume threshold and block the source")
        void shouldDetectVolume() {
            var monitor = monitor(TestConfigs.threat().withVolumeThreshold(3));

            for (int i = 0; i < 3; i++) {
                assertTrue(inspect(monitor, get("/api", "")).isClean());
            }
            var fourth = inspect(monitor, get("/api", ""));
            var fifth = inspect(monitor, get("/api", ""));

            var detected = assertInstanceOf(ThreatAssessment.Detected.class, fourth);
            assertEquals(ThreatError.VOLUME_EXCEEDED, detected.error());
            assertNotNull(detected.alertId());
            assertInstanceOf(ThreatAssessment.Blocked.class, fifth);
        }

        @Test
        @DisplayName("should count each source separately")
        void shouldCountPerSource() {
            var monitor = monitor(TestConfigs.threat().withVolumeThreshold(1));

            inspect(monitor, get("/api", ""));

            assertTrue(inspect(monitor, InspectedRequest.of("203.0.113.1", "GET", "/api", "")).isClean());
        }
    }

    @Nested
    @DisplayName("Failed logins")
    class FailedLoginTests {

        @Test
        @DisplayName("should raise one brute-force alert and start delaying the source")
        void shouldRaiseBruteForceAlert() {
            var monitor = monitor(TestConfigs.threat().withFailedLoginAlertThreshold(3));

            for (int i = 0; i < 6; i++) {
                monitor.recordFailedLogin(SOURCE).await().atMost(WAIT);
            }

            var alertList = alerts.listAlerts(null, 10).await().atMost(WAIT);
            assertEquals(1, alertList.size());
            assertEquals(ThreatCategory.BRUTE_FORCE, alertList.get(0).category());
            assertEquals(Duration.ofSeconds(5), monitor.responseDelay(SOURCE).await().atMost(WAIT));
            assertEquals(Duration.ZERO, monitor.responseDelay("203.0.113.1").await().atMost(WAIT));
        }

        @Test
        @DisplayName("should queue medium-severity lockout alerts for review")
        void shouldQueueLockoutAlert() {
            var monitor = monitor(TestConfigs.threat());

            monitor.reportLockout("alice", SOURCE, 5).await().atMost(WAIT);

            assertEquals(List.of("SEC-20240301-000001"), alerts.pendingReview(10).await().atMost(WAIT));
        }
    }

    @Nested
    @DisplayName("Block list")
    class BlockListTests {

        @Test
        @DisplayName("should reject a blocked principal")
        void shouldRejectBlockedPrincipal() {
            var monitor = monitor(TestConfigs.threat());
            blockList.block(BlockSubject.principal("key-9"), "manual", Duration.ofMinutes(10))
                    .await()
                    .atMost(WAIT);

            var result = monitor.checkPrincipal("key-9").await().atMost(WAIT);

            assertInstanceOf(ThreatAssessment.Blocked.class, result);
            assertTrue(monitor.checkPrincipal("key-10").await().atMost(WAIT).isClean());
        }

        @Test
        @DisplayName("should let the source through again once the block expires")
        void shouldExpireBlock() {
            var monitor = monitor(TestConfigs.threat());
            inspect(monitor, get("/api", "q=drop table users"));

            clock.advance(Duration.ofHours(1));

            assertTrue(inspect(monitor, get("/api", "")).isClean());
        }

        @Test
        @DisplayName("should apply the threat failure policy when the block list fails")
        void shouldApplyFailurePolicy() {
            var failing = mock(BlockListRepository.class);
            when(failing.find(any())).thenReturn(Uni.createFrom().failure(new RuntimeException("down")));
            var failingBlockList = new BlockListService(
                    failing, notifications, TestConfigs.resiliency(), metrics, clock);
            var open = new ThreatMonitor(
                    TestConfigs.threat(),
                    storage.counterStore(),
                    failingBlockList,
                    alerts,
                    TestConfigs.resiliency(),
                    metrics,
                    clock);
            var failClosed = TestConfigs.resiliency(
                    FailurePolicy.FAIL_OPEN, FailurePolicy.FAIL_CLOSED, FailurePolicy.FAIL_CLOSED);
            var closed = new ThreatMonitor(
                    TestConfigs.threat(),
                    storage.counterStore(),
                    failingBlockList,
                    alerts,
                    failClosed,
                    metrics,
                    clock);

            assertTrue(inspect(open, get("/api", "")).isClean());
            assertInstanceOf(ThreatAssessment.Unavailable.class, inspect(closed, get("/api", "")));
        }

        @Test
        @DisplayName("should skip inspection when disabled")
        void shouldSkipWhenDisabled() {
            var monitor = monitor(TestConfigs.threat().disabled());

            assertTrue(inspect(monitor, get("/api", "q=drop table users")).isClean());
        }
    }
}
