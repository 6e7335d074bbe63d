package warden.adapter.in.http;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import jakarta.inject.Inject;
import jakarta.ws.rs.Priorities;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.core.Response;

import io.smallrye.mutiny.Uni;
import io.vertx.core.http.HttpServerRequest;
import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.server.ServerRequestFilter;

import warden.adapter.in.rest.RejectionResponses;
import warden.core.model.auth.TokenClaims;
import warden.core.model.auth.TokenType;
import warden.core.model.auth.TokenVerificationResult;
import warden.core.model.threat.InspectedRequest;
import warden.core.service.auth.TokenAuthority;
import warden.core.service.gateway.RequestGuard;
import warden.core.service.ratelimit.RateLimitTierCatalog;
import warden.core.util.SecureHash;

/**
 * Pre-matching filter that runs every request through the guard pipeline.
 *
 * <p>Order: block list, pattern inspection, request volume, rate limit, then
 * bearer token verification. The rate-limit identity is the token subject when a
 * bearer token is present and the client address otherwise; its tier comes from
 * the token's role. Tokens are verified only after the cheaper checks pass.
 *
 * <p>{@code /admin} paths additionally require a valid access token with the
 * {@code admin} role. Health and metrics endpoints under {@code /q} are skipped.
 */
public class RequestGuardFilter {

    private static final Logger LOG = Logger.getLogger(RequestGuardFilter.class);

    public static final String CLIENT_IP_PROPERTY = "warden.client.ip";
    public static final String CLAIMS_PROPERTY = "warden.claims";

    private static final String ADMIN_PATH_PREFIX = "/admin";
    private static final String ADMIN_ROLE = "admin";
    private static final String BEARER_PREFIX = "Bearer ";

    private final RequestGuard requestGuard;
    private final TokenAuthority tokenAuthority;
    private final RateLimitTierCatalog tierCatalog;

    @Inject
    public RequestGuardFilter(
            RequestGuard requestGuard, TokenAuthority tokenAuthority, RateLimitTierCatalog tierCatalog) {
        this.requestGuard = requestGuard;
        this.tokenAuthority = tokenAuthority;
        this.tierCatalog = tierCatalog;
    }

    /**
     * @return Uni with null to continue, or a Response to abort
     */
    @ServerRequestFilter(preMatching = true, priority = Priorities.AUTHENTICATION - 200)
    public Uni<Response> filter(ContainerRequestContext requestContext, HttpServerRequest httpRequest) {
        final var uri = requestContext.getUriInfo().getRequestUri();
        final var path = uri.getRawPath() != null ? uri.getRawPath() : "/";
        if (path.startsWith("/q/")) {
            return Uni.createFrom().nullItem();
        }

        final var ip = ClientIpResolver.resolve(
                requestContext.getHeaderString("Forwarded"),
                requestContext.getHeaderString("X-Forwarded-For"),
                remoteHost(httpRequest));
        requestContext.setProperty(CLIENT_IP_PROPERTY, ip);

        final var bearer = bearerToken(requestContext);
        final Optional<TokenClaims> unverified =
                bearer == null ? Optional.empty() : tokenAuthority.readClaims(bearer);
        final var identifier = unverified.map(TokenClaims::subjectId).orElse("ip:" + ip);
        final var tiers = unverified
                .map(claims -> tierCatalog.resolve(claims.role()))
                .orElseGet(tierCatalog::defaultTiers);

        final var inspected = new InspectedRequest(
                ip, requestContext.getMethod(), path, uri.getRawQuery(), headers(requestContext));

        return requestGuard
                .admit(inspected, identifier, resourceOf(path), tiers)
                .flatMap(decision -> {
                    if (!decision.isProceed()) {
                        LOG.debugf(
                                "Request rejected: decision=%s source=%s path=%s",
                                decision, SecureHash.forLog(ip), path);
                        return Uni.createFrom().item(RejectionResponses.forGuard(decision));
                    }
                    return authorize(requestContext, path, bearer);
                });
    }

    private Uni<Response> authorize(ContainerRequestContext requestContext, String path, String bearer) {
        final var adminPath = path.startsWith(ADMIN_PATH_PREFIX);
        if (bearer == null) {
            return adminPath
                    ? Uni.createFrom().item(RejectionResponses.error(401, "authentication_required"))
                    : Uni.createFrom().nullItem();
        }

        return tokenAuthority.verify(bearer, TokenType.ACCESS).map(result -> {
            if (result instanceof TokenVerificationResult.Invalid invalid) {
                return RejectionResponses.forToken(invalid.error());
            }
            final var claims = ((TokenVerificationResult.Valid) result).claims();
            requestContext.setProperty(CLAIMS_PROPERTY, claims);
            if (adminPath && !ADMIN_ROLE.equals(claims.role())) {
                return RejectionResponses.error(403, "forbidden");
            }
            return null;
        });
    }

    /**
     * Rate-limit resource of a path: its first segment, e.g. {@code auth} for
     * {@code /auth/login}.
     */
    static String resourceOf(String path) {
        final var trimmed = path.startsWith("/") ? path.substring(1) : path;
        final var slash = trimmed.indexOf('/');
        final var segment = slash >= 0 ? trimmed.substring(0, slash) : trimmed;
        return segment.isEmpty() ? "root" : segment;
    }

    private static String bearerToken(ContainerRequestContext requestContext) {
        final var auth = requestContext.getHeaderString("Authorization");
        if (auth == null || !auth.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            return null;
        }
        final var token = auth.substring(BEARER_PREFIX.length()).trim();
        return token.isEmpty() ? null : token;
    }

    private static Map<String, List<String>> headers(ContainerRequestContext requestContext) {
        final var headers = new LinkedHashMap<String, List<String>>();
        requestContext.getHeaders().forEach((name, values) -> headers.put(name, List.copyOf(values)));
        return headers;
    }

    private static String remoteHost(HttpServerRequest httpRequest) {
        if (httpRequest == null || httpRequest.remoteAddress() == null) {
            return null;
        }
        return httpRequest.remoteAddress().host();
    }
}
