package warden.adapter.in.rest;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.adapter.in.dto.AcknowledgeAlertRequest;
import warden.adapter.in.dto.AlertDto;
import warden.adapter.in.dto.ResolveAlertRequest;
import warden.adapter.in.http.RequestGuardFilter;
import warden.core.model.auth.TokenClaims;
import warden.core.model.threat.AlertStatus;
import warden.core.model.threat.AlertTransitionResult;
import warden.core.model.threat.SecurityDashboard;
import warden.core.port.in.AlertManagement;

/**
 * REST resource for security alert administration.
 *
 * <p>
 * Provides endpoints for:
 * <ul>
 * <li>Listing alerts, optionally by status</li>
 * <li>The operator dashboard</li>
 * <li>Acknowledging and resolving alerts</li>
 * <li>The review queue of medium-severity alerts</li>
 * </ul>
 */
@Path("/admin/alerts")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
public class AlertResource {

    private static final Logger LOG = Logger.getLogger(AlertResource.class);

    private static final int DEFAULT_LIMIT = 100;

    private final AlertManagement alerts;

    @Inject
    public AlertResource(AlertManagement alerts) {
        this.alerts = alerts;
    }

    /**
     * List alerts, newest first.
     *
     * @param status optional status filter, e.g. {@code open}
     * @param limit  maximum number of alerts to return
     */
    @GET
    public Uni<Response> listAlerts(@QueryParam("status") String status, @QueryParam("limit") Integer limit) {
        final AlertStatus filter;
        try {
            filter = status == null || status.isBlank() ? null : AlertStatus.valueOf(status.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return Uni.createFrom().item(RejectionResponses.error(400, "unknown_status"));
        }

        final var effectiveLimit = limit != null && limit > 0 ? limit : DEFAULT_LIMIT;
        return alerts.listAlerts(filter, effectiveLimit).map(list -> {
            final var response = list.stream().map(AlertDto::from).toList();
            return Response.ok(Map.of("alerts", response, "count", response.size(), "limit", effectiveLimit))
                    .build();
        });
    }

    @GET
    @Path("/dashboard")
    public Uni<Response> dashboard() {
        return alerts.dashboard().map(dashboard -> Response.ok(toBody(dashboard)).build());
    }

    /**
     * Ids of medium-severity alerts awaiting review, oldest first.
     */
    @GET
    @Path("/review-queue")
    public Uni<Response> reviewQueue(@QueryParam("limit") Integer limit) {
        final var effectiveLimit = limit != null && limit > 0 ? limit : DEFAULT_LIMIT;
        return alerts.pendingReview(effectiveLimit)
                .map(ids -> Response.ok(Map.of("alert_ids", ids, "count", ids.size())).build());
    }

    @GET
    @Path("/{id}")
    public Uni<Response> getAlert(@PathParam("id") String alertId) {
        return alerts.findAlert(alertId)
                .map(alert -> alert.map(a -> Response.ok(AlertDto.from(a)).build())
                        .orElseGet(() -> RejectionResponses.error(404, "alert_not_found")));
    }

    @POST
    @Path("/{id}/acknowledge")
    @Consumes(MediaType.APPLICATION_JSON)
    public Uni<Response> acknowledge(
            @PathParam("id") String alertId,
            AcknowledgeAlertRequest request,
            @Context ContainerRequestContext requestContext) {
        final var assignee = request != null && request.assignee() != null && !request.assignee().isBlank()
                ? request.assignee()
                : caller(requestContext);
        LOG.infof("Acknowledging alert %s, assignee=%s", alertId, assignee);
        return alerts.acknowledge(alertId, assignee).map(AlertResource::toResponse);
    }

    @POST
    @Path("/{id}/resolve")
    @Consumes(MediaType.APPLICATION_JSON)
    public Uni<Response> resolve(@PathParam("id") String alertId, ResolveAlertRequest request) {
        final var notes = request != null ? request.notes() : null;
        final var falsePositive = request != null && Boolean.TRUE.equals(request.falsePositive());
        LOG.infof("Resolving alert %s, falsePositive=%s", alertId, falsePositive);
        return alerts.resolve(alertId, notes, falsePositive).map(AlertResource::toResponse);
    }

    private static Response toResponse(AlertTransitionResult result) {
        if (result instanceof AlertTransitionResult.Success success) {
            return Response.ok(AlertDto.from(success.alert())).build();
        }
        return RejectionResponses.forAlertFailure((AlertTransitionResult.Failure) result);
    }

    private static Map<String, Object> toBody(SecurityDashboard dashboard) {
        final var byCategory = new LinkedHashMap<String, Long>();
        dashboard.alertsByCategory().forEach((category, count) -> byCategory.put(category.wireName(), count));

        final var body = new LinkedHashMap<String, Object>();
        body.put("active_alerts", dashboard.activeAlerts());
        body.put("critical_alerts", dashboard.criticalAlerts());
        body.put("alerts_by_category", byCategory);
        body.put("mean_acknowledge_hours", dashboard.meanAcknowledgeHours());
        body.put("recent_alerts", dashboard.recentAlerts().stream().map(AlertDto::from).toList());
        return body;
    }

    private static String caller(ContainerRequestContext requestContext) {
        final var claims = (TokenClaims) requestContext.getProperty(RequestGuardFilter.CLAIMS_PROPERTY);
        return claims != null ? claims.subjectId() : "unknown";
    }
}
