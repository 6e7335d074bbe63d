package warden.core.port.out;

import warden.core.model.threat.AlertSeverity;
import warden.spi.AuditEntry;
import warden.spi.NotificationChannel;

/**
 * Port for fire-and-forget calls to the external audit sink and notification
 * dispatcher. Calls return immediately; delivery failures are logged by the
 * implementation and never reach the caller.
 */
public interface SecurityNotifications {

    void notify(NotificationChannel channel, AlertSeverity severity, String message);

    void audit(AuditEntry entry);
}
