package warden.core.model.threat;

import java.time.Instant;

/**
 * Result of inspecting a request.
 */
public sealed interface ThreatAssessment {

    /**
     * @param degraded true when a store failure was ignored under the fail-open policy
     */
    record Clean(boolean degraded) implements ThreatAssessment {}

    /**
     * A pattern or volume detection. {@code alertId} is null when the detection was
     * folded into an alert already raised for the same source in the current window.
     */
    record Detected(ThreatError error, ThreatCategory category, String alertId) implements ThreatAssessment {}

    record Blocked(BlockSubject subject, Instant until) implements ThreatAssessment {

        public ThreatError error() {
            return ThreatError.SOURCE_BLOCKED;
        }
    }

    /**
     * A store failed and the fail-closed threat policy applied.
     */
    record Unavailable() implements ThreatAssessment {}

    static ThreatAssessment clean() {
        return new Clean(false);
    }

    static ThreatAssessment degraded() {
        return new Clean(true);
    }

    default boolean isClean() {
        return this instanceof Clean;
    }
}
