package warden.core.model.threat;

import java.time.Instant;

/**
 * A security alert and its lifecycle timestamps.
 */
public record SecurityAlert(
        String id,
        AlertSeverity severity,
        ThreatCategory category,
        AlertStatus status,
        String source,
        String target,
        String description,
        double riskScore,
        Instant detectedAt,
        Instant acknowledgedAt,
        Instant resolvedAt,
        String assignee,
        String resolutionNotes) {

    public static SecurityAlert open(
            String id, ThreatCategory category, String source, String target, String description, Instant now) {
        return new SecurityAlert(
                id,
                category.severity(),
                category,
                AlertStatus.OPEN,
                source,
                target,
                description,
                category.riskScore(),
                now,
                null,
                null,
                null,
                null);
    }

    public SecurityAlert acknowledged(String assignee, Instant now) {
        return new SecurityAlert(
                id,
                severity,
                category,
                AlertStatus.INVESTIGATING,
                source,
                target,
                description,
                riskScore,
                detectedAt,
                now,
                null,
                assignee,
                null);
    }

    public SecurityAlert resolved(String notes, boolean falsePositive, Instant now) {
        return new SecurityAlert(
                id,
                severity,
                category,
                falsePositive ? AlertStatus.FALSE_POSITIVE : AlertStatus.RESOLVED,
                source,
                target,
                description,
                riskScore,
                detectedAt,
                acknowledgedAt,
                now,
                assignee,
                notes);
    }
}
