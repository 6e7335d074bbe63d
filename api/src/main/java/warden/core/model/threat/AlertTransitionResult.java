package warden.core.model.threat;

/**
 * Result of acknowledging or resolving an alert.
 */
public sealed interface AlertTransitionResult {

    record Success(SecurityAlert alert) implements AlertTransitionResult {}

    /**
     * @param current status at the time of the attempt; null for {@link AlertError#NOT_FOUND}
     */
    record Failure(AlertError error, AlertStatus current) implements AlertTransitionResult {}

    static AlertTransitionResult success(SecurityAlert alert) {
        return new Success(alert);
    }

    static AlertTransitionResult notFound() {
        return new Failure(AlertError.NOT_FOUND, null);
    }

    static AlertTransitionResult invalidTransition(AlertStatus current) {
        return new Failure(AlertError.INVALID_TRANSITION, current);
    }
}
