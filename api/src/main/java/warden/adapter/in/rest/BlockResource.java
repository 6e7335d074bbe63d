package warden.adapter.in.rest;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.adapter.in.dto.BlockRequest;
import warden.core.config.ThreatMonitorConfig;
import warden.core.model.threat.BlockEntry;
import warden.core.model.threat.BlockSubject;
import warden.core.service.threat.BlockListService;

/**
 * REST resource for manual block management.
 */
@Path("/admin/blocks")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
public class BlockResource {

    private static final Logger LOG = Logger.getLogger(BlockResource.class);

    private final BlockListService blockList;
    private final ThreatMonitorConfig config;

    @Inject
    public BlockResource(BlockListService blockList, ThreatMonitorConfig config) {
        this.blockList = blockList;
        this.config = config;
    }

    @GET
    public Uni<Response> listBlocks() {
        return blockList.activeBlocks().map(blocks -> {
            final var response = blocks.stream().map(BlockResource::format).toList();
            return Response.ok(Map.of("blocks", response, "count", response.size())).build();
        });
    }

    @POST
    @Consumes(MediaType.APPLICATION_JSON)
    public Uni<Response> block(BlockRequest request) {
        if (request == null || request.value() == null || request.value().isBlank()) {
            return Uni.createFrom().item(RejectionResponses.error(400, "value_required"));
        }
        final var subject = subject(request.kind(), request.value());
        if (subject == null) {
            return Uni.createFrom().item(RejectionResponses.error(400, "unknown_kind"));
        }
        if (request.durationSeconds() != null && request.durationSeconds() <= 0) {
            return Uni.createFrom().item(RejectionResponses.error(400, "duration_must_be_positive"));
        }

        final var duration = request.durationSeconds() != null
                ? Duration.ofSeconds(request.durationSeconds())
                : config.blockDuration();
        final var reason = request.reason() != null && !request.reason().isBlank() ? request.reason() : "manual";

        return blockList
                .block(subject, reason, duration)
                .map(entry -> Response.status(201).entity(format(entry)).build());
    }

    @DELETE
    @Path("/{kind}/{value}")
    public Uni<Response> unblock(@PathParam("kind") String kind, @PathParam("value") String value) {
        final var subject = subject(kind, value);
        if (subject == null) {
            return Uni.createFrom().item(RejectionResponses.error(400, "unknown_kind"));
        }
        LOG.infof("Removing block: %s", subject.key());
        return blockList.unblock(subject).map(removed -> removed
                ? Response.noContent().build()
                : RejectionResponses.error(404, "block_not_found"));
    }

    private static BlockSubject subject(String kind, String value) {
        if (kind == null) {
            return null;
        }
        return switch (kind.toLowerCase(Locale.ROOT)) {
            case "ip" -> BlockSubject.ip(value);
            case "principal" -> BlockSubject.principal(value);
            default -> null;
        };
    }

    private static Map<String, Object> format(BlockEntry entry) {
        final var response = new LinkedHashMap<String, Object>();
        response.put("kind", entry.subject().kind().name().toLowerCase(Locale.ROOT));
        response.put("value", entry.subject().value());
        response.put("reason", entry.reason());
        response.put("created_at", entry.createdAt().toString());
        response.put("expires_at", entry.expiresAt().toString());
        return response;
    }
}
