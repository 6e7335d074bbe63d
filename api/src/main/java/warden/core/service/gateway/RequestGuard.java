package warden.core.service.gateway;

import java.time.Clock;
import java.time.Duration;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;

import warden.core.model.gateway.GuardDecision;
import warden.core.model.ratelimit.RateLimitDecision;
import warden.core.model.ratelimit.RateLimitTiers;
import warden.core.model.threat.InspectedRequest;
import warden.core.model.threat.ThreatAssessment;
import warden.core.service.ratelimit.MultiWindowRateLimiter;
import warden.core.service.threat.ThreatMonitor;

/**
 * Admission checks run on every inbound request, strictly in order:
 * <ol>
 *   <li>block list for the caller's principal, when known</li>
 *   <li>block list for the source address, pattern table, request volume</li>
 *   <li>multi-window rate limit, when the caller is identified</li>
 * </ol>
 * The first rejecting stage ends the pipeline. Lockout and token checks follow
 * in the authentication flow.
 */
@ApplicationScoped
public class RequestGuard {

    private final ThreatMonitor threatMonitor;
    private final MultiWindowRateLimiter rateLimiter;
    private final Clock clock;

    @Inject
    public RequestGuard(ThreatMonitor threatMonitor, MultiWindowRateLimiter rateLimiter, Clock clock) {
        this.threatMonitor = threatMonitor;
        this.rateLimiter = rateLimiter;
        this.clock = clock;
    }

    /**
     * @param request    the inbound request
     * @param identifier principal or API key id, null for anonymous requests
     * @param resource   rate-limit resource name
     * @param tiers      limits for the caller's tier
     */
    public Uni<GuardDecision> admit(
            InspectedRequest request, String identifier, String resource, RateLimitTiers tiers) {
        final Uni<ThreatAssessment> principalCheck = identifier == null
                ? Uni.createFrom().item(ThreatAssessment.clean())
                : threatMonitor.checkPrincipal(identifier);

        return principalCheck
                .flatMap(assessment -> assessment.isClean()
                        ? threatMonitor.inspect(request)
                        : Uni.createFrom().item(assessment))
                .flatMap(assessment -> {
                    if (!assessment.isClean()) {
                        return Uni.createFrom().item(fromThreat(assessment));
                    }
                    if (identifier == null) {
                        return Uni.createFrom().item(GuardDecision.proceed());
                    }
                    return rateLimiter.checkAndConsume(identifier, resource, tiers).map(RequestGuard::fromRateLimit);
                });
    }

    private GuardDecision fromThreat(ThreatAssessment assessment) {
        if (assessment instanceof ThreatAssessment.Blocked blocked) {
            final var remaining = Duration.between(clock.instant(), blocked.until()).toSeconds();
            return new GuardDecision.ThreatRejected(blocked.error(), null, Math.max(1, remaining));
        }
        if (assessment instanceof ThreatAssessment.Detected detected) {
            return new GuardDecision.ThreatRejected(detected.error(), detected.category(), 0);
        }
        if (assessment instanceof ThreatAssessment.Unavailable) {
            return new GuardDecision.Unavailable("threat-monitor");
        }
        return GuardDecision.proceed();
    }

    private static GuardDecision fromRateLimit(RateLimitDecision decision) {
        if (decision instanceof RateLimitDecision.Limited limited) {
            return new GuardDecision.RateLimited(limited.window(), limited.retryAfterSeconds());
        }
        if (decision instanceof RateLimitDecision.Unavailable) {
            return new GuardDecision.Unavailable("rate-limiter");
        }
        return GuardDecision.proceed();
    }
}
