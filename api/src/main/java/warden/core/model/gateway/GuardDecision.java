package warden.core.model.gateway;

import warden.core.model.ratelimit.WindowKind;
import warden.core.model.threat.ThreatCategory;
import warden.core.model.threat.ThreatError;

/**
 * Outcome of the inbound request pipeline. The first rejecting stage wins.
 */
public sealed interface GuardDecision {

    record Proceed() implements GuardDecision {}

    record ThreatRejected(ThreatError error, ThreatCategory category, long retryAfterSeconds)
            implements GuardDecision {}

    record RateLimited(WindowKind window, long retryAfterSeconds) implements GuardDecision {}

    /**
     * A fail-closed store policy denied the request.
     */
    record Unavailable(String stage) implements GuardDecision {}

    static GuardDecision proceed() {
        return new Proceed();
    }

    default boolean isProceed() {
        return this instanceof Proceed;
    }
}
