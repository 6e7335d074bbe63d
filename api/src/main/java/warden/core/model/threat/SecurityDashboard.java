package warden.core.model.threat;

import java.util.List;
import java.util.Map;

/**
 * Operator overview of alerts.
 *
 * @param activeAlerts                open or investigating alerts
 * @param criticalAlerts              active alerts of critical severity
 * @param alertsByCategory            alert count per category, all statuses
 * @param meanAcknowledgeHours        mean detection-to-acknowledge time, 0 when none acknowledged
 * @param recentAlerts                most recent alerts, newest first
 */
public record SecurityDashboard(
        long activeAlerts,
        long criticalAlerts,
        Map<ThreatCategory, Long> alertsByCategory,
        double meanAcknowledgeHours,
        List<SecurityAlert> recentAlerts) {}
