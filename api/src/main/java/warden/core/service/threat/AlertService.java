package warden.core.service.threat;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.UnaryOperator;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.config.ResiliencyConfig;
import warden.core.model.threat.AlertSeverity;
import warden.core.model.threat.AlertStatus;
import warden.core.model.threat.AlertTransitionResult;
import warden.core.model.threat.SecurityAlert;
import warden.core.model.threat.SecurityDashboard;
import warden.core.model.threat.ThreatCategory;
import warden.core.port.in.AlertManagement;
import warden.core.port.out.AlertRepository;
import warden.core.port.out.Metrics;
import warden.core.port.out.ReviewQueue;
import warden.core.port.out.SecurityNotifications;
import warden.core.service.common.StoreCallGuard;
import warden.spi.AuditEntry;
import warden.spi.AuditOutcome;

/**
 * Creation and lifecycle of security alerts.
 *
 * <p>Alert ids have the form {@code SEC-yyyyMMdd-NNNNNN}, using the UTC date and
 * a per-day sequence. Status changes are compare-and-set against the status the
 * caller observed, so two operators racing on the same alert cannot both win.
 */
@ApplicationScoped
public class AlertService implements AlertManagement {

    private static final Logger LOG = Logger.getLogger(AlertService.class);
    private static final DateTimeFormatter ID_DATE = DateTimeFormatter.BASIC_ISO_DATE;
    private static final int DASHBOARD_RECENT = 10;

    private final AlertRepository repository;
    private final ReviewQueue reviewQueue;
    private final AlertResponder responder;
    private final SecurityNotifications notifications;
    private final StoreCallGuard storeGuard;
    private final Metrics metrics;
    private final Clock clock;

    @Inject
    public AlertService(
            AlertRepository repository,
            ReviewQueue reviewQueue,
            AlertResponder responder,
            SecurityNotifications notifications,
            ResiliencyConfig resiliency,
            Metrics metrics,
            Clock clock) {
        this.repository = repository;
        this.reviewQueue = reviewQueue;
        this.responder = responder;
        this.notifications = notifications;
        this.storeGuard = new StoreCallGuard(resiliency.store().operationTimeout(), metrics, "alert-service");
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Create an open alert and run the severity handler for it.
     *
     * @param source      originating address or principal
     * @param target      affected resource or principal, may be null
     * @param description what was observed
     */
    public Uni<SecurityAlert> raise(ThreatCategory category, String source, String target, String description) {
        final var now = clock.instant();
        final var day = LocalDate.ofInstant(now, ZoneOffset.UTC);

        final var created = repository.nextSequence(day).flatMap(sequence -> {
            final var alert = SecurityAlert.open(formatId(day, sequence), category, source, target, description, now);
            return repository.create(alert);
        });

        return storeGuard.withTimeout(created, "raise").call(alert -> {
            metrics.recordAlertCreated(alert.severity(), alert.category());
            notifications.audit(new AuditEntry(
                    null,
                    "alert_created",
                    "security_alert",
                    alert.id(),
                    Map.of(
                            "category", alert.category().wireName(),
                            "severity", alert.severity().wireName(),
                            "source", alert.source()),
                    now,
                    AuditOutcome.SUCCESS));
            return storeGuard.withTimeoutSilent(responder.respond(alert), "respond");
        });
    }

    @Override
    public Uni<AlertTransitionResult> acknowledge(String alertId, String assignee) {
        final var now = clock.instant();
        return transition(alertId, AlertStatus.INVESTIGATING, alert -> alert.acknowledged(assignee, now))
                .call(result -> result instanceof AlertTransitionResult.Success
                        ? storeGuard.withTimeoutSilent(reviewQueue.remove(alertId), "dequeue")
                        : Uni.createFrom().voidItem());
    }

    @Override
    public Uni<AlertTransitionResult> resolve(String alertId, String notes, boolean falsePositive) {
        final var now = clock.instant();
        final var target = falsePositive ? AlertStatus.FALSE_POSITIVE : AlertStatus.RESOLVED;
        return transition(alertId, target, alert -> alert.resolved(notes, falsePositive, now));
    }

    @Override
    public Uni<Optional<SecurityAlert>> findAlert(String alertId) {
        return storeGuard.withTimeout(repository.findById(alertId), "findAlert");
    }

    @Override
    public Uni<List<SecurityAlert>> listAlerts(AlertStatus status, int limit) {
        final var stream = status == null
                ? repository.streamAll()
                : repository.streamAll().filter(alert -> alert.status() == status);
        return storeGuard.withTimeout(
                stream.select().first(Math.max(0, limit)).collect().asList(), "listAlerts");
    }

    @Override
    public Uni<SecurityDashboard> dashboard() {
        return storeGuard
                .withTimeout(repository.streamAll().collect().asList(), "dashboard")
                .map(AlertService::summarize);
    }

    @Override
    public Uni<List<String>> pendingReview(int limit) {
        return storeGuard.withTimeout(reviewQueue.pending(limit), "pendingReview");
    }

    private Uni<AlertTransitionResult> transition(
            String alertId, AlertStatus target, UnaryOperator<SecurityAlert> change) {
        final var result = repository.findById(alertId).flatMap(found -> {
            if (found.isEmpty()) {
                return Uni.createFrom().item(AlertTransitionResult.notFound());
            }
            final var current = found.get();
            if (!current.status().canTransitionTo(target)) {
                return Uni.createFrom().item(AlertTransitionResult.invalidTransition(current.status()));
            }
            final var updated = change.apply(current);
            return repository.replaceIfStatus(updated, current.status()).flatMap(replaced -> {
                if (replaced) {
                    LOG.infof(
                            "Alert %s moved %s -> %s",
                            alertId, current.status().wireName(), updated.status().wireName());
                    return Uni.createFrom().item(AlertTransitionResult.success(updated));
                }
                // Lost a race with another operator; report what won.
                return repository.findById(alertId).map(latest -> latest.isEmpty()
                        ? AlertTransitionResult.notFound()
                        : AlertTransitionResult.invalidTransition(latest.get().status()));
            });
        });
        return storeGuard.withTimeout(result, "transition");
    }

    static String formatId(LocalDate day, long sequence) {
        return String.format("SEC-%s-%06d", day.format(ID_DATE), sequence);
    }

    static SecurityDashboard summarize(List<SecurityAlert> alerts) {
        final var active = alerts.stream().filter(a -> a.status().isActive()).count();
        final var critical = alerts.stream()
                .filter(a -> a.status().isActive())
                .filter(a -> a.severity() == AlertSeverity.CRITICAL)
                .count();

        final var byCategory = new EnumMap<ThreatCategory, Long>(ThreatCategory.class);
        alerts.forEach(a -> byCategory.merge(a.category(), 1L, Long::sum));

        final var meanAckHours = alerts.stream()
                .filter(a -> a.acknowledgedAt() != null)
                .mapToLong(a -> Duration.between(a.detectedAt(), a.acknowledgedAt()).toSeconds())
                .average()
                .orElse(0) / 3600.0;

        final var recent = alerts.stream()
                .sorted(Comparator.comparing(SecurityAlert::detectedAt).reversed())
                .limit(DASHBOARD_RECENT)
                .toList();

        return new SecurityDashboard(active, critical, byCategory, meanAckHours, recent);
    }
}
