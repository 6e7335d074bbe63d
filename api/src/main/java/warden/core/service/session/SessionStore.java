package warden.core.service.session;

import java.time.Clock;
import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.config.ResiliencyConfig;
import warden.core.config.TokenConfig;
import warden.core.model.session.DeviceInfo;
import warden.core.model.session.Session;
import warden.core.model.session.SessionValidationResult;
import warden.core.port.out.Metrics;
import warden.core.port.out.SessionRepository;
import warden.core.service.common.StoreCallGuard;
import warden.core.util.SecureHash;

/**
 * Durable refresh-token sessions.
 *
 * <p>The raw refresh token is never persisted; sessions are looked up by its
 * SHA-256 digest. Store calls are fail-fast: a timeout or connection failure
 * surfaces as a failed {@link Uni}.
 */
@ApplicationScoped
public class SessionStore {

    private static final Logger LOG = Logger.getLogger(SessionStore.class);

    private final SessionRepository repository;
    private final SessionIdGenerator idGenerator;
    private final TokenConfig tokenConfig;
    private final StoreCallGuard storeGuard;
    private final Clock clock;

    @Inject
    public SessionStore(
            SessionRepository repository,
            SessionIdGenerator idGenerator,
            TokenConfig tokenConfig,
            ResiliencyConfig resiliency,
            Metrics metrics,
            Clock clock) {
        this.repository = repository;
        this.idGenerator = idGenerator;
        this.tokenConfig = tokenConfig;
        this.clock = clock;
        this.storeGuard = new StoreCallGuard(resiliency.store().operationTimeout(), metrics, "session-store");
    }

    /**
     * Record a new session for a freshly issued refresh token.
     *
     * @param rememberMe extends the session lifetime from the refresh TTL to the
     *                   remember-me TTL
     */
    public Uni<Session> create(
            String principalId, String refreshToken, DeviceInfo deviceInfo, String ipAddress, boolean rememberMe) {
        final var now = clock.instant();
        final var lifetime = rememberMe ? tokenConfig.rememberMeRefreshTtl() : tokenConfig.refreshTtl();
        final var session = new Session(
                idGenerator.generate(),
                principalId,
                SecureHash.sha256(refreshToken),
                deviceInfo,
                ipAddress,
                rememberMe,
                now,
                now.plus(lifetime),
                true,
                null);

        return storeGuard
                .withTimeout(repository.save(session), "create")
                .invoke(saved -> LOG.debugf(
                        "Created session %s for principal %s (expires %s)",
                        SecureHash.forLog(saved.id()), principalId, saved.expiresAt()));
    }

    /**
     * Look up the active session holding {@code refreshToken}.
     *
     * <p>An unknown digest or a deactivated session is {@code NOT_FOUND}; an
     * active session past its expiry is {@code EXPIRED}.
     */
    public Uni<SessionValidationResult> validate(String refreshToken) {
        if (refreshToken == null || refreshToken.isBlank()) {
            return Uni.createFrom().item(SessionValidationResult.notFound());
        }
        final var hash = SecureHash.sha256(refreshToken);
        return storeGuard
                .withTimeout(repository.findByRefreshTokenHash(hash), "validate")
                .map(found -> {
                    if (found.isEmpty() || !found.get().active()) {
                        return SessionValidationResult.notFound();
                    }
                    final var session = found.get();
                    if (session.isExpired(clock.instant())) {
                        return SessionValidationResult.expired();
                    }
                    return SessionValidationResult.valid(session);
                });
    }

    /**
     * Deactivate a session. Revoking an inactive or unknown session is a no-op.
     *
     * @return true if the session was active before this call
     */
    public Uni<Boolean> revoke(String sessionId) {
        if (!idGenerator.isWellFormed(sessionId)) {
            return Uni.createFrom().item(false);
        }
        return storeGuard
                .withTimeout(repository.deactivate(sessionId, clock.instant()), "revoke")
                .invoke(changed -> {
                    if (changed) {
                        LOG.debugf("Revoked session %s", SecureHash.forLog(sessionId));
                    }
                });
    }

    /**
     * Deactivate the session holding {@code refreshToken}, expired or not.
     *
     * @return true if an active session was deactivated
     */
    public Uni<Boolean> revokeByToken(String refreshToken) {
        if (refreshToken == null || refreshToken.isBlank()) {
            return Uni.createFrom().item(false);
        }
        final var hash = SecureHash.sha256(refreshToken);
        return storeGuard
                .withTimeout(repository.findByRefreshTokenHash(hash), "revokeByToken")
                .flatMap(found -> found.isPresent() && found.get().active()
                        ? revoke(found.get().id())
                        : Uni.createFrom().item(false));
    }

    /**
     * Deactivate all active sessions of a principal, forcing re-authentication
     * everywhere.
     *
     * @return number of sessions deactivated
     */
    public Uni<Integer> revokeAll(String principalId) {
        return storeGuard
                .withTimeout(repository.deactivateAllForPrincipal(principalId, clock.instant()), "revokeAll")
                .invoke(count -> LOG.infof("Revoked %d session(s) for principal %s", count, principalId));
    }

    public Uni<List<Session>> listActive(String principalId) {
        final var now = clock.instant();
        return storeGuard
                .withTimeout(repository.findActiveByPrincipal(principalId), "listActive")
                .map(sessions ->
                        sessions.stream().filter(s -> s.isUsable(now)).toList());
    }
}
