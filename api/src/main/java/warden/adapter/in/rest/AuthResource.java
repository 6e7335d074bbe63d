package warden.adapter.in.rest;

import java.time.Duration;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.adapter.in.dto.LoginRequest;
import warden.adapter.in.dto.RefreshTokenRequest;
import warden.adapter.in.dto.TokenResponse;
import warden.adapter.in.http.RequestGuardFilter;
import warden.core.model.auth.AuthenticationError;
import warden.core.model.auth.AuthenticationResult;
import warden.core.model.auth.ClientContext;
import warden.core.model.session.DeviceInfo;
import warden.core.port.in.AuthenticationUseCase;
import warden.core.service.threat.ThreatMonitor;
import warden.core.util.SecureHash;

/**
 * REST resource for the login, refresh and logout flows.
 *
 * <p>Failed logins are answered after the progressive delay the threat monitor
 * holds for the source address.
 */
@Path("/auth")
@ApplicationScoped
@Consumes(MediaType.APPLICATION_JSON)
@Produces(MediaType.APPLICATION_JSON)
public class AuthResource {

    private static final Logger LOG = Logger.getLogger(AuthResource.class);

    private static final int FINGERPRINT_HEX_CHARS = 16;

    private final AuthenticationUseCase authentication;
    private final ThreatMonitor threatMonitor;

    @Inject
    public AuthResource(AuthenticationUseCase authentication, ThreatMonitor threatMonitor) {
        this.authentication = authentication;
        this.threatMonitor = threatMonitor;
    }

    @POST
    @Path("/login")
    public Uni<Response> login(LoginRequest request, @Context ContainerRequestContext requestContext) {
        if (request == null || isBlank(request.email()) || isBlank(request.password())) {
            return Uni.createFrom().item(RejectionResponses.error(400, "email_and_password_required"));
        }

        final var client = clientContext(requestContext);
        final var rememberMe = Boolean.TRUE.equals(request.rememberMe());

        return authentication
                .login(request.email(), request.password(), rememberMe, client)
                .flatMap(result -> {
                    if (result instanceof AuthenticationResult.Authenticated authenticated) {
                        return Uni.createFrom()
                                .item(Response.ok(TokenResponse.from(authenticated.tokens()))
                                        .build());
                    }
                    final var response = RejectionResponses.forAuthentication(result);
                    if (!isInvalidCredentials(result)) {
                        return Uni.createFrom().item(response);
                    }
                    return threatMonitor.responseDelay(client.ipAddress()).flatMap(delay -> delayed(response, delay));
                });
    }

    @POST
    @Path("/refresh")
    public Uni<Response> refresh(RefreshTokenRequest request) {
        if (request == null || isBlank(request.refreshToken())) {
            return Uni.createFrom().item(RejectionResponses.error(400, "refresh_token_required"));
        }

        return authentication.refresh(request.refreshToken()).map(result -> {
            if (result instanceof AuthenticationResult.Authenticated authenticated) {
                return Response.ok(TokenResponse.from(authenticated.tokens())).build();
            }
            return RejectionResponses.forAuthentication(result);
        });
    }

    /**
     * End the session of a refresh token. Answers 204 whether or not a session
     * was active.
     */
    @POST
    @Path("/logout")
    public Uni<Response> logout(RefreshTokenRequest request) {
        if (request == null || isBlank(request.refreshToken())) {
            return Uni.createFrom().item(RejectionResponses.error(400, "refresh_token_required"));
        }

        return authentication
                .logout(request.refreshToken())
                .map(ended -> Response.noContent().build())
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.warnf("Logout failed: %s", error.getMessage());
                    return RejectionResponses.unavailable();
                });
    }

    private static ClientContext clientContext(ContainerRequestContext requestContext) {
        final var ip = (String) requestContext.getProperty(RequestGuardFilter.CLIENT_IP_PROPERTY);
        final var userAgent = requestContext.getHeaderString("User-Agent");
        final var fingerprint =
                userAgent != null ? SecureHash.truncatedSha256(userAgent, FINGERPRINT_HEX_CHARS) : null;
        return new ClientContext(
                ip != null ? ip : "unknown",
                new DeviceInfo(userAgent, requestContext.getHeaderString("Accept-Language"), fingerprint));
    }

    private static boolean isInvalidCredentials(AuthenticationResult result) {
        return result instanceof AuthenticationResult.Rejected rejected
                && rejected.error() == AuthenticationError.INVALID_CREDENTIALS;
    }

    private static Uni<Response> delayed(Response response, Duration delay) {
        if (delay.isZero() || delay.isNegative()) {
            return Uni.createFrom().item(response);
        }
        return Uni.createFrom().item(response).onItem().delayIt().by(delay);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
