package warden.core.service.threat;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.config.ResiliencyConfig;
import warden.core.config.ThreatMonitorConfig;
import warden.core.model.common.FailurePolicy;
import warden.core.model.threat.BlockSubject;
import warden.core.model.threat.InspectedRequest;
import warden.core.model.threat.SecurityAlert;
import warden.core.model.threat.ThreatAssessment;
import warden.core.model.threat.ThreatCategory;
import warden.core.model.threat.ThreatError;
import warden.core.model.threat.ThreatRule;
import warden.core.port.out.CounterStore;
import warden.core.port.out.Metrics;
import warden.core.service.common.StoreCallGuard;

/**
 * Request inspection and automated threat response.
 *
 * <p>{@link #inspect} runs three checks in order and stops at the first hit:
 * <ol>
 *   <li>active block on the source address</li>
 *   <li>the pattern table ({@link ThreatRule#DEFAULT_RULES})</li>
 *   <li>request volume per source over the volume window</li>
 * </ol>
 *
 * <p>Every detection raises an alert and increments the source's threat score.
 * A score above the configured threshold, or a detection in a category that
 * blocks immediately, blocks the source for the configured block duration.
 *
 * <p>Pattern detection needs no store and always rejects. Block-list and
 * counter failures go through the threat failure policy, which by default lets
 * the request through.
 */
@ApplicationScoped
public class ThreatMonitor {

    private static final Logger LOG = Logger.getLogger(ThreatMonitor.class);
    private static final Duration FAILED_LOGIN_WINDOW = Duration.ofHours(1);

    private final ThreatMonitorConfig config;
    private final CounterStore counters;
    private final BlockListService blockList;
    private final AlertService alerts;
    private final FailurePolicy failurePolicy;
    private final StoreCallGuard storeGuard;
    private final Metrics metrics;
    private final Clock clock;
    private final List<ThreatRule> rules;

    @Inject
    public ThreatMonitor(
            ThreatMonitorConfig config,
            CounterStore counters,
            BlockListService blockList,
            AlertService alerts,
            ResiliencyConfig resiliency,
            Metrics metrics,
            Clock clock) {
        this.config = config;
        this.counters = counters;
        this.blockList = blockList;
        this.alerts = alerts;
        this.failurePolicy = resiliency.store().threatFailurePolicy();
        this.storeGuard = new StoreCallGuard(resiliency.store().operationTimeout(), metrics, "threat-monitor");
        this.metrics = metrics;
        this.clock = clock;
        this.rules = ThreatRule.DEFAULT_RULES;
    }

    public Uni<ThreatAssessment> inspect(InspectedRequest request) {
        if (!config.enabled()) {
            return Uni.createFrom().item(ThreatAssessment.clean());
        }
        final var source = BlockSubject.ip(request.sourceIp());

        return checkBlocked(source).flatMap(blocked -> {
            if (blocked.isPresent()) {
                return Uni.createFrom().item(blocked.get());
            }
            final var match = ThreatRule.firstMatch(rules, request.inspectableValues());
            if (match.isPresent()) {
                return onPatternMatch(request, source, match.get().category());
            }
            return checkVolume(request, source);
        });
    }

    /**
     * Block-list check for an authenticated principal or API key.
     */
    public Uni<ThreatAssessment> checkPrincipal(String principalId) {
        if (!config.enabled()) {
            return Uni.createFrom().item(ThreatAssessment.clean());
        }
        return checkBlocked(BlockSubject.principal(principalId)).map(found -> found.orElse(ThreatAssessment.clean()));
    }

    /**
     * Count a failed login from {@code sourceIp}. Crossing the failed-login
     * threshold within an hour raises a brute-force alert once per hour.
     */
    public Uni<Void> recordFailedLogin(String sourceIp) {
        if (!config.enabled()) {
            return Uni.createFrom().voidItem();
        }
        final var source = BlockSubject.ip(sourceIp);
        final var bucket = Math.floorDiv(clock.instant().getEpochSecond(), FAILED_LOGIN_WINDOW.getSeconds());
        final Uni<Void> work = counters.incrementAndGet(
                        "threat:failed-login:" + bucket + ":" + sourceIp, FAILED_LOGIN_WINDOW)
                .flatMap(count -> {
                    if (count != config.failedLoginAlertThreshold() + 1) {
                        return Uni.createFrom().voidItem();
                    }
                    final var description = "More than " + config.failedLoginAlertThreshold()
                            + " failed logins from " + sourceIp + " within an hour";
                    return raiseQuietly(ThreatCategory.BRUTE_FORCE, sourceIp, null, description)
                            .call(() -> escalate(source, ThreatCategory.BRUTE_FORCE))
                            .call(() -> counters.incrementAndGet(
                                    delayKey(sourceIp), config.responseDelay().retention()))
                            .replaceWithVoid();
                });
        return storeGuard.withTimeoutSilent(work, "recordFailedLogin");
    }

    /**
     * Report that a principal was locked out after repeated failures.
     */
    public Uni<Void> reportLockout(String principalId, String sourceIp, int failedCount) {
        if (!config.enabled()) {
            return Uni.createFrom().voidItem();
        }
        final var description = "Account locked after " + failedCount + " failed login attempts";
        return raiseQuietly(ThreatCategory.BRUTE_FORCE, sourceIp, principalId, description)
                .replaceWithVoid();
    }

    /**
     * Progressive delay for a source flagged for brute force: one step per
     * detection, capped at the configured maximum. Zero when unflagged or when
     * the store is unavailable.
     */
    public Uni<Duration> responseDelay(String sourceIp) {
        final var step = config.responseDelay().step();
        final var max = config.responseDelay().max();
        return storeGuard.withFallback(
                counters.get(delayKey(sourceIp)).map(steps -> {
                    final var delay = step.multipliedBy(steps);
                    return delay.compareTo(max) > 0 ? max : delay;
                }),
                "responseDelay",
                () -> Duration.ZERO);
    }

    private Uni<Optional<ThreatAssessment>> checkBlocked(BlockSubject source) {
        final Uni<Optional<ThreatAssessment>> lookup = blockList.find(source).map(found -> found.map(
                entry -> (ThreatAssessment) new ThreatAssessment.Blocked(entry.subject(), entry.expiresAt())));
        return storeGuard.withPolicy(
                lookup,
                "blockCheck",
                failurePolicy,
                Optional::empty,
                () -> Optional.of(new ThreatAssessment.Unavailable()));
    }

    private Uni<ThreatAssessment> onPatternMatch(
            InspectedRequest request, BlockSubject source, ThreatCategory category) {
        LOG.warnf(
                "Detected %s from %s on %s %s",
                category.wireName(), request.sourceIp(), request.method(), request.path());
        metrics.recordThreatDetection(category);
        final var description = "Request matched " + category.wireName() + " pattern";
        return raiseQuietly(category, request.sourceIp(), request.path(), description)
                .call(() -> escalate(source, category))
                .map(alertId -> new ThreatAssessment.Detected(ThreatError.PATTERN_MATCHED, category, alertId));
    }

    private Uni<ThreatAssessment> checkVolume(InspectedRequest request, BlockSubject source) {
        final var window = config.volumeWindow();
        final var bucket = Math.floorDiv(clock.instant().getEpochSecond(), window.getSeconds());
        final var threshold = config.volumeThreshold();

        final Uni<ThreatAssessment> volume = counters.incrementAndGet(
                        "threat:volume:" + bucket + ":" + request.sourceIp(), window)
                .flatMap(count -> {
                    if (count <= threshold) {
                        return Uni.createFrom().item(ThreatAssessment.clean());
                    }
                    if (count > threshold + 1) {
                        return Uni.createFrom().item(new ThreatAssessment.Detected(
                                ThreatError.VOLUME_EXCEEDED, ThreatCategory.DENIAL_OF_SERVICE, null));
                    }
                    LOG.warnf("Request volume from %s exceeded %d per %s", request.sourceIp(), threshold, window);
                    metrics.recordThreatDetection(ThreatCategory.DENIAL_OF_SERVICE);
                    final var description = "More than " + threshold + " requests within " + window;
                    return raiseQuietly(
                                    ThreatCategory.DENIAL_OF_SERVICE, request.sourceIp(), request.path(), description)
                            .call(() -> escalate(source, ThreatCategory.DENIAL_OF_SERVICE))
                            .map(alertId -> new ThreatAssessment.Detected(
                                    ThreatError.VOLUME_EXCEEDED, ThreatCategory.DENIAL_OF_SERVICE, alertId));
                });

        return storeGuard.withPolicy(
                volume, "volumeCheck", failurePolicy, ThreatAssessment::degraded, ThreatAssessment.Unavailable::new);
    }

    /**
     * Increment the threat score and block the source when warranted.
     */
    private Uni<Void> escalate(BlockSubject source, ThreatCategory category) {
        final Uni<Void> work = counters.incrementAndGet(scoreKey(source), config.scoreWindow())
                .flatMap(score -> {
                    if (category.blocksImmediately()) {
                        return blockList.block(source, category.wireName(), config.blockDuration()).replaceWithVoid();
                    }
                    if (score > config.scoreThreshold()) {
                        LOG.infof("Threat score of %s reached %d", source.key(), score);
                        return blockList.block(source, "threat_score_exceeded", config.blockDuration())
                                .replaceWithVoid();
                    }
                    return Uni.createFrom().voidItem();
                });
        return storeGuard.withTimeoutSilent(work, "escalate");
    }

    /**
     * Raise an alert; a failure is logged and yields a null alert id so the
     * detection itself still stands.
     */
    private Uni<String> raiseQuietly(ThreatCategory category, String source, String target, String description) {
        return alerts.raise(category, source, target, description)
                .map(SecurityAlert::id)
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.warnf("Could not raise %s alert for %s: %s", category.wireName(), source, error.getMessage());
                    return null;
                });
    }

    public Uni<Long> threatScore(String sourceIp) {
        return storeGuard.withTimeout(counters.get(scoreKey(BlockSubject.ip(sourceIp))), "threatScore");
    }

    private static String scoreKey(BlockSubject subject) {
        return "threat:score:" + subject.key();
    }

    private static String delayKey(String sourceIp) {
        return "threat:delay:" + sourceIp;
    }
}
