package warden.adapter.in.rest;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.model.lockout.LoginAttemptState;
import warden.core.service.auth.LoginGuard;

/**
 * REST resource for account lockout administration.
 *
 * <p>
 * Provides endpoints for listing locked accounts, checking the lockout state of
 * a principal and lifting a lock.
 */
@Path("/admin/lockouts")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
public class LockoutResource {

    private static final Logger LOG = Logger.getLogger(LockoutResource.class);

    private final LoginGuard loginGuard;
    private final Clock clock;

    @Inject
    public LockoutResource(LoginGuard loginGuard, Clock clock) {
        this.loginGuard = loginGuard;
        this.clock = clock;
    }

    /**
     * List currently locked principals.
     *
     * @param limit maximum number of entries to return
     */
    @GET
    public Uni<Response> listLockouts(@QueryParam("limit") Integer limit) {
        final var effectiveLimit = limit != null && limit > 0 ? limit : 100;

        return loginGuard
                .lockedPrincipals()
                .select()
                .first(effectiveLimit)
                .collect()
                .asList()
                .map(lockouts -> {
                    final var response = lockouts.stream().map(this::format).toList();
                    return Response.ok(Map.of("lockouts", response, "count", response.size(), "limit", effectiveLimit))
                            .build();
                });
    }

    @GET
    @Path("/{principalId}")
    public Uni<Response> getLockoutStatus(@PathParam("principalId") String principalId) {
        return loginGuard.status(principalId).map(state -> Response.ok(format(state)).build());
    }

    /**
     * Lift any lock and reset the failed count.
     *
     * @return 204 No Content on success
     */
    @DELETE
    @Path("/{principalId}")
    public Uni<Response> clearLockout(@PathParam("principalId") String principalId) {
        LOG.infof("Clearing lockout: principal=%s", principalId);
        return loginGuard.unlock(principalId).map(v -> Response.noContent().build());
    }

    private Map<String, Object> format(LoginAttemptState state) {
        final var now = clock.instant();
        final var response = new LinkedHashMap<String, Object>();
        response.put("principal_id", state.principalId());
        response.put("locked", state.isLockedAt(now));
        response.put("failed_attempts", state.failedCount());
        response.put("max_attempts", loginGuard.policy().threshold());
        if (state.isLockedAt(now)) {
            response.put("locked_until", state.lockedUntil().toString());
            response.put("retry_after_seconds", state.retryAfterSeconds(now));
        }
        if (state.lastFailureAt() != null) {
            response.put("last_failure_at", state.lastFailureAt().toString());
        }
        response.put("checked_at", now.toString());
        return response;
    }
}
