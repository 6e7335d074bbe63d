package warden.adapter.in.rest;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import warden.core.model.auth.AuthenticationError;
import warden.core.model.auth.AuthenticationResult;
import warden.core.model.auth.TokenError;
import warden.core.model.gateway.GuardDecision;
import warden.core.model.threat.AlertError;
import warden.core.model.threat.AlertTransitionResult;
import warden.core.model.threat.ThreatError;

/**
 * Maps typed rejections to HTTP responses with flat JSON bodies.
 */
public final class RejectionResponses {

    private static final String RETRY_AFTER = "Retry-After";

    private RejectionResponses() {}

    public static Response forGuard(GuardDecision decision) {
        if (decision instanceof GuardDecision.RateLimited limited) {
            final var body = new LinkedHashMap<String, Object>();
            body.put("limited", true);
            body.put("window", limited.window().wireName());
            body.put("retry_after_seconds", limited.retryAfterSeconds());
            return json(429, body).header(RETRY_AFTER, limited.retryAfterSeconds()).build();
        }
        if (decision instanceof GuardDecision.ThreatRejected rejected) {
            final var body = new LinkedHashMap<String, Object>();
            body.put("error", wire(rejected.error()));
            if (rejected.category() != null) {
                body.put("category", rejected.category().wireName());
            }
            if (rejected.retryAfterSeconds() > 0) {
                body.put("retry_after_seconds", rejected.retryAfterSeconds());
            }
            final var status = rejected.error() == ThreatError.VOLUME_EXCEEDED ? 429 : 403;
            final var builder = json(status, body);
            if (rejected.retryAfterSeconds() > 0) {
                builder.header(RETRY_AFTER, rejected.retryAfterSeconds());
            }
            return builder.build();
        }
        if (decision instanceof GuardDecision.Unavailable) {
            return unavailable();
        }
        throw new IllegalArgumentException("Not a rejection: " + decision);
    }

    public static Response forAuthentication(AuthenticationResult result) {
        if (result instanceof AuthenticationResult.Rejected rejected) {
            return forAuthenticationError(rejected.error(), rejected.retryAfterSeconds());
        }
        if (result instanceof AuthenticationResult.TokenRejected tokenRejected) {
            return forToken(tokenRejected.error());
        }
        if (result instanceof AuthenticationResult.SessionRejected sessionRejected) {
            return error(401, "session_" + wire(sessionRejected.error()));
        }
        throw new IllegalArgumentException("Not a rejection: " + result);
    }

    public static Response forToken(TokenError error) {
        return json(401, Map.of("error", "token_" + wire(error)))
                .header("WWW-Authenticate", "Bearer")
                .build();
    }

    public static Response forAlertFailure(AlertTransitionResult.Failure failure) {
        if (failure.error() == AlertError.NOT_FOUND) {
            return error(404, "alert_not_found");
        }
        final var body = new LinkedHashMap<String, Object>();
        body.put("error", wire(failure.error()));
        body.put("status", failure.current() != null ? failure.current().wireName() : null);
        return json(409, body).build();
    }

    public static Response error(int status, String error) {
        return json(status, Map.of("error", error)).build();
    }

    public static Response unavailable() {
        return error(503, "service_unavailable");
    }

    private static Response forAuthenticationError(AuthenticationError error, long retryAfterSeconds) {
        if (error == AuthenticationError.ACCOUNT_LOCKED) {
            final var body = new LinkedHashMap<String, Object>();
            body.put("locked", true);
            body.put("retry_after_seconds", retryAfterSeconds);
            return json(423, body).header(RETRY_AFTER, retryAfterSeconds).build();
        }
        if (error == AuthenticationError.INVALID_CREDENTIALS) {
            return error(401, wire(error));
        }
        if (error == AuthenticationError.SERVICE_UNAVAILABLE) {
            return unavailable();
        }
        return error(403, wire(error));
    }

    private static Response.ResponseBuilder json(int status, Object body) {
        return Response.status(status).type(MediaType.APPLICATION_JSON).entity(body);
    }

    private static String wire(Enum<?> value) {
        return value.name().toLowerCase(Locale.ROOT);
    }
}
