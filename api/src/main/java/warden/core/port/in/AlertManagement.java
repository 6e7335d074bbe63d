package warden.core.port.in;

import java.util.List;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import warden.core.model.threat.AlertStatus;
import warden.core.model.threat.AlertTransitionResult;
import warden.core.model.threat.SecurityAlert;
import warden.core.model.threat.SecurityDashboard;

/**
 * Inbound port for operators working with security alerts.
 */
public interface AlertManagement {

    /**
     * Take ownership of an open alert (open to investigating).
     *
     * @return success, or a failure carrying NOT_FOUND or INVALID_TRANSITION
     */
    Uni<AlertTransitionResult> acknowledge(String alertId, String assignee);

    /**
     * Close an alert under investigation as resolved or as a false positive.
     *
     * @return success, or a failure carrying NOT_FOUND or INVALID_TRANSITION
     */
    Uni<AlertTransitionResult> resolve(String alertId, String notes, boolean falsePositive);

    Uni<Optional<SecurityAlert>> findAlert(String alertId);

    /**
     * List alerts, newest first.
     *
     * @param status only alerts in this status; null for all
     * @param limit  maximum number of alerts returned
     */
    Uni<List<SecurityAlert>> listAlerts(AlertStatus status, int limit);

    Uni<SecurityDashboard> dashboard();

    /**
     * Ids of medium-severity alerts waiting for review, oldest first.
     */
    Uni<List<String>> pendingReview(int limit);
}
