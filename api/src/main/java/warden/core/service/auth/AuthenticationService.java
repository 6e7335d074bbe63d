package warden.core.service.auth;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.infrastructure.Infrastructure;
import org.jboss.logging.Logger;

import warden.core.config.ResiliencyConfig;
import warden.core.model.auth.AuthenticationError;
import warden.core.model.auth.AuthenticationResult;
import warden.core.model.auth.ClientContext;
import warden.core.model.auth.TokenClaims;
import warden.core.model.auth.TokenPair;
import warden.core.model.auth.TokenType;
import warden.core.model.auth.TokenVerificationResult;
import warden.core.model.lockout.LockoutDecision;
import warden.core.model.principal.Principal;
import warden.core.model.principal.PrincipalStatus;
import warden.core.model.session.SessionValidationResult;
import warden.core.port.in.AuthenticationUseCase;
import warden.core.port.out.Metrics;
import warden.core.port.out.PasswordVerifier;
import warden.core.port.out.SecurityNotifications;
import warden.core.service.common.StoreCallGuard;
import warden.core.service.session.SessionStore;
import warden.core.service.threat.ThreatMonitor;
import warden.core.util.SecureHash;
import warden.spi.AuditEntry;
import warden.spi.AuditOutcome;
import warden.spi.PrincipalDirectory;

/**
 * Login, refresh and logout flows.
 *
 * <p>Login order: principal lookup, lockout check, account status, password,
 * then token issuance and session creation. A locked principal is rejected
 * before its password is looked at. Store failures end the flow with
 * {@link AuthenticationError#SERVICE_UNAVAILABLE}.
 */
@ApplicationScoped
public class AuthenticationService implements AuthenticationUseCase {

    private static final Logger LOG = Logger.getLogger(AuthenticationService.class);

    private final PrincipalDirectory directory;
    private final PasswordVerifier passwordVerifier;
    private final LoginGuard loginGuard;
    private final TokenAuthority tokenAuthority;
    private final SessionStore sessionStore;
    private final ThreatMonitor threatMonitor;
    private final SecurityNotifications notifications;
    private final StoreCallGuard storeGuard;
    private final Metrics metrics;
    private final Clock clock;

    @Inject
    public AuthenticationService(
            PrincipalDirectory directory,
            PasswordVerifier passwordVerifier,
            LoginGuard loginGuard,
            TokenAuthority tokenAuthority,
            SessionStore sessionStore,
            ThreatMonitor threatMonitor,
            SecurityNotifications notifications,
            ResiliencyConfig resiliency,
            Metrics metrics,
            Clock clock) {
        this.directory = directory;
        this.passwordVerifier = passwordVerifier;
        this.loginGuard = loginGuard;
        this.tokenAuthority = tokenAuthority;
        this.sessionStore = sessionStore;
        this.threatMonitor = threatMonitor;
        this.notifications = notifications;
        this.storeGuard = new StoreCallGuard(resiliency.store().operationTimeout(), metrics, "principal-directory");
        this.metrics = metrics;
        this.clock = clock;
    }

    @Override
    public Uni<AuthenticationResult> login(String email, String password, boolean rememberMe, ClientContext client) {
        final var context = client == null ? ClientContext.unknown() : client;
        return storeGuard
                .withTimeout(directory.getPrincipalByEmail(email), "getPrincipalByEmail")
                .flatMap(found -> {
                    if (found.isEmpty()) {
                        audit(null, "login", AuditOutcome.FAILURE, Map.of("reason", "unknown_account"));
                        return rejectCredentials(context);
                    }
                    return loginKnown(found.get(), password, rememberMe, context);
                })
                .onFailure()
                .recoverWithItem(error -> unavailable("login", error));
    }

    private Uni<AuthenticationResult> loginKnown(
            Principal principal, String password, boolean rememberMe, ClientContext context) {
        return loginGuard.checkAccess(principal.id()).flatMap(decision -> {
            if (decision instanceof LockoutDecision.Locked locked) {
                audit(principal.id(), "login", AuditOutcome.FAILURE, Map.of("reason", "account_locked"));
                metrics.recordLogin("locked");
                return Uni.createFrom().item(AuthenticationResult.locked(locked.retryAfterSeconds()));
            }
            if (decision instanceof LockoutDecision.Unavailable) {
                metrics.recordLogin("unavailable");
                return Uni.createFrom().item(AuthenticationResult.rejected(AuthenticationError.SERVICE_UNAVAILABLE));
            }
            final var statusError = statusError(principal.status());
            if (statusError.isPresent()) {
                audit(principal.id(), "login", AuditOutcome.FAILURE, Map.of("reason", principal.status().name()));
                metrics.recordLogin("status");
                return Uni.createFrom().item(AuthenticationResult.rejected(statusError.get()));
            }
            return verifyPassword(password, principal.passwordHash()).flatMap(matches -> matches
                    ? completeLogin(principal, rememberMe, context)
                    : onWrongPassword(principal, context));
        });
    }

    private Uni<AuthenticationResult> onWrongPassword(Principal principal, ClientContext context) {
        return loginGuard.recordFailure(principal.id()).flatMap(outcome -> {
            final var failedAttempts = String.valueOf(outcome.state().failedCount());
            audit(
                    principal.id(),
                    "login",
                    AuditOutcome.FAILURE,
                    Map.of("reason", "invalid_password", "failed_attempts", failedAttempts));
            if (!outcome.lockedNow()) {
                return rejectCredentials(context);
            }
            audit(
                    principal.id(),
                    "account_locked",
                    AuditOutcome.SUCCESS,
                    Map.of("locked_until", String.valueOf(outcome.state().lockedUntil())));
            return threatMonitor
                    .reportLockout(principal.id(), context.ipAddress(), outcome.state().failedCount())
                    .flatMap(ignored -> rejectCredentials(context));
        });
    }

    private Uni<AuthenticationResult> completeLogin(Principal principal, boolean rememberMe, ClientContext context) {
        final var access = tokenAuthority.issueAccessToken(principal.id(), principal.kind(), principal.role());
        final var refresh =
                tokenAuthority.issueRefreshToken(principal.id(), principal.kind(), principal.role(), rememberMe);

        return loginGuard
                .recordSuccess(principal.id())
                .flatMap(ignored -> sessionStore.create(
                        principal.id(), refresh.value(), context.deviceInfo(), context.ipAddress(), rememberMe))
                .map(session -> {
                    audit(
                            principal.id(),
                            "login",
                            AuditOutcome.SUCCESS,
                            Map.of("session", SecureHash.forLog(session.id()), "ip", context.ipAddress()));
                    metrics.recordLogin("success");
                    LOG.debugf("Principal %s logged in", principal.id());
                    return (AuthenticationResult) new AuthenticationResult.Authenticated(
                            principal.id(),
                            new TokenPair(
                                    access.value(),
                                    refresh.value(),
                                    tokenAuthority.accessTtl().toSeconds(),
                                    session.id()));
                });
    }

    @Override
    public Uni<AuthenticationResult> refresh(String refreshToken) {
        return tokenAuthority
                .verify(refreshToken, TokenType.REFRESH)
                .flatMap(verification -> {
                    if (verification instanceof TokenVerificationResult.Invalid invalid) {
                        final AuthenticationResult rejected = new AuthenticationResult.TokenRejected(invalid.error());
                        return Uni.createFrom().item(rejected);
                    }
                    final var claims = ((TokenVerificationResult.Valid) verification).claims();
                    return refreshSession(refreshToken, claims);
                })
                .onFailure()
                .recoverWithItem(error -> unavailable("refresh", error));
    }

    private Uni<AuthenticationResult> refreshSession(String refreshToken, TokenClaims claims) {
        return sessionStore.validate(refreshToken).flatMap(validation -> {
            if (validation instanceof SessionValidationResult.Invalid invalid) {
                final AuthenticationResult rejected = new AuthenticationResult.SessionRejected(invalid.error());
                return Uni.createFrom().item(rejected);
            }
            final var session = ((SessionValidationResult.Valid) validation).session();
            return storeGuard
                    .withTimeout(directory.getPrincipalById(claims.subjectId()), "getPrincipalById")
                    .map(found -> {
                        if (found.isEmpty()) {
                            return AuthenticationResult.rejected(AuthenticationError.INVALID_CREDENTIALS);
                        }
                        final var principal = found.get();
                        final var statusError = statusError(principal.status());
                        if (statusError.isPresent()) {
                            return AuthenticationResult.rejected(statusError.get());
                        }
                        final var access =
                                tokenAuthority.issueAccessToken(principal.id(), principal.kind(), principal.role());
                        final var tokens = new TokenPair(
                                access.value(), refreshToken, tokenAuthority.accessTtl().toSeconds(), session.id());
                        return new AuthenticationResult.Authenticated(principal.id(), tokens);
                    });
        });
    }

    @Override
    public Uni<Boolean> logout(String refreshToken) {
        return sessionStore.revokeByToken(refreshToken).invoke(ended -> {
            if (ended) {
                final var subject = tokenAuthority.readClaims(refreshToken).map(TokenClaims::subjectId).orElse(null);
                audit(subject, "logout", AuditOutcome.SUCCESS, Map.of());
            }
        });
    }

    @Override
    public Uni<Integer> revokeAllSessions(String principalId) {
        return sessionStore.revokeAll(principalId).invoke(count -> audit(
                principalId, "sessions_revoked", AuditOutcome.SUCCESS, Map.of("count", String.valueOf(count))));
    }

    private Uni<Boolean> verifyPassword(String password, String passwordHash) {
        if (password == null || passwordHash == null) {
            return Uni.createFrom().item(false);
        }
        // bcrypt is deliberately slow; keep it off the event loop.
        return Uni.createFrom()
                .item(() -> passwordVerifier.matches(password, passwordHash))
                .runSubscriptionOn(Infrastructure.getDefaultWorkerPool());
    }

    private Uni<AuthenticationResult> rejectCredentials(ClientContext context) {
        metrics.recordLogin("invalid_credentials");
        return threatMonitor
                .recordFailedLogin(context.ipAddress())
                .replaceWith(AuthenticationResult.rejected(AuthenticationError.INVALID_CREDENTIALS));
    }

    private AuthenticationResult unavailable(String flow, Throwable error) {
        LOG.warnf("%s failed on a store error: %s", flow, error.getMessage());
        metrics.recordLogin("unavailable");
        return AuthenticationResult.rejected(AuthenticationError.SERVICE_UNAVAILABLE);
    }

    private static Optional<AuthenticationError> statusError(PrincipalStatus status) {
        return switch (status) {
            case ACTIVE -> Optional.empty();
            case PENDING_VERIFICATION -> Optional.of(AuthenticationError.ACCOUNT_NOT_VERIFIED);
            case SUSPENDED -> Optional.of(AuthenticationError.ACCOUNT_SUSPENDED);
        };
    }

    private void audit(String actorId, String action, AuditOutcome outcome, Map<String, String> metadata) {
        notifications.audit(new AuditEntry(actorId, action, "principal", actorId, metadata, clock.instant(), outcome));
    }
}
