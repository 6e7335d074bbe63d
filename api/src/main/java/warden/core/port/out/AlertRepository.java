package warden.core.port.out;

import java.time.LocalDate;
import java.util.Optional;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;

import warden.core.model.threat.AlertStatus;
import warden.core.model.threat.SecurityAlert;

/**
 * Port for security alert persistence.
 */
public interface AlertRepository {

    /**
     * Next value of the per-day alert sequence, starting at 1.
     */
    Uni<Long> nextSequence(LocalDate day);

    /**
     * Store a new alert.
     */
    Uni<SecurityAlert> create(SecurityAlert alert);

    Uni<Optional<SecurityAlert>> findById(String alertId);

    /**
     * Replace an alert only if its stored status still equals {@code expected}.
     *
     * @return true if the alert was replaced
     */
    Uni<Boolean> replaceIfStatus(SecurityAlert updated, AlertStatus expected);

    /**
     * Stream all alerts, newest first.
     */
    Multi<SecurityAlert> streamAll();
}
