package warden.core.service.threat;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.model.threat.SecurityAlert;
import warden.core.port.out.ReviewQueue;
import warden.core.port.out.SecurityNotifications;
import warden.spi.NotificationChannel;

/**
 * Severity-dispatched handling of new alerts.
 *
 * <ul>
 *   <li>critical: urgent e-mail, SMS and escalation</li>
 *   <li>high: e-mail</li>
 *   <li>medium: review queue</li>
 *   <li>low: log only</li>
 * </ul>
 *
 * Every alert is logged. Notifications are fire-and-forget.
 */
@ApplicationScoped
public class AlertResponder {

    private static final Logger LOG = Logger.getLogger(AlertResponder.class);

    private final SecurityNotifications notifications;
    private final ReviewQueue reviewQueue;

    @Inject
    public AlertResponder(SecurityNotifications notifications, ReviewQueue reviewQueue) {
        this.notifications = notifications;
        this.reviewQueue = reviewQueue;
    }

    public Uni<Void> respond(SecurityAlert alert) {
        final var summary = summarize(alert);
        switch (alert.severity()) {
            case CRITICAL -> {
                LOG.errorf("CRITICAL security alert %s", summary);
                notifications.notify(NotificationChannel.EMAIL, alert.severity(), "URGENT: " + summary);
                notifications.notify(NotificationChannel.SMS, alert.severity(), "URGENT: " + summary);
                notifications.notify(NotificationChannel.ESCALATION, alert.severity(), summary);
                return Uni.createFrom().voidItem();
            }
            case HIGH -> {
                LOG.warnf("HIGH security alert %s", summary);
                notifications.notify(NotificationChannel.EMAIL, alert.severity(), summary);
                return Uni.createFrom().voidItem();
            }
            case MEDIUM -> {
                LOG.infof("MEDIUM security alert %s queued for review", summary);
                return reviewQueue.enqueue(alert.id());
            }
            default -> {
                LOG.infof("LOW security alert %s", summary);
                return Uni.createFrom().voidItem();
            }
        }
    }

    static String summarize(SecurityAlert alert) {
        return String.format(
                "%s [%s] source=%s target=%s risk=%.1f: %s",
                alert.id(),
                alert.category().wireName(),
                alert.source(),
                alert.target() == null ? "-" : alert.target(),
                alert.riskScore(),
                alert.description());
    }
}
