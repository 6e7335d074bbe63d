package warden.core.model.threat;

import java.util.Locale;

/**
 * Alert lifecycle: OPEN to INVESTIGATING to RESOLVED or FALSE_POSITIVE.
 * Transitions only move forward and terminal states have no exits.
 */
public enum AlertStatus {
    OPEN,
    INVESTIGATING,
    RESOLVED,
    FALSE_POSITIVE;

    public boolean isTerminal() {
        return this == RESOLVED || this == FALSE_POSITIVE;
    }

    public boolean isActive() {
        return !isTerminal();
    }

    public boolean canTransitionTo(AlertStatus target) {
        return switch (this) {
            case OPEN -> target == INVESTIGATING;
            case INVESTIGATING -> target == RESOLVED || target == FALSE_POSITIVE;
            case RESOLVED, FALSE_POSITIVE -> false;
        };
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
