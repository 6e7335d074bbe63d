package warden.adapter.out.notify;

import org.jboss.logging.Logger;

import warden.core.model.threat.AlertSeverity;
import warden.spi.NotificationChannel;
import warden.spi.NotificationDispatcher;

/**
 * Notification dispatcher that logs notifications using JBoss Logging.
 *
 * <p>This is a built-in dispatcher with priority 0 that always runs. Log levels
 * follow the alert severity:
 * <ul>
 *   <li>LOW → DEBUG level</li>
 *   <li>MEDIUM → INFO level</li>
 *   <li>HIGH → WARN level</li>
 *   <li>CRITICAL → ERROR level</li>
 * </ul>
 */
public class LoggingNotificationDispatcher implements NotificationDispatcher {

    private static final Logger LOG = Logger.getLogger("warden.notify");

    @Override
    public String name() {
        return "logging";
    }

    @Override
    public void notify(NotificationChannel channel, AlertSeverity severity, String message) {
        final var line = String.format("NOTIFY[%s] severity=%s %s", channel, severity.wireName(), message);
        if (severity == AlertSeverity.CRITICAL) {
            LOG.error(line);
        } else if (severity == AlertSeverity.HIGH) {
            LOG.warn(line);
        } else if (severity == AlertSeverity.MEDIUM) {
            LOG.info(line);
        } else {
            LOG.debug(line);
        }
    }
}
