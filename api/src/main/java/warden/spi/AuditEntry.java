package warden.spi;

import java.time.Instant;
import java.util.Map;

/**
 * One audit record.
 *
 * @param actorId      acting principal, null when unknown
 * @param action       what happened, e.g. {@code login} or {@code alert_created}
 * @param resourceType kind of resource acted on
 * @param resourceId   resource identifier, may be null
 * @param metadata     additional detail; never contains secrets
 * @param timestamp    when it happened
 * @param outcome      success or failure
 */
public record AuditEntry(
        String actorId,
        String action,
        String resourceType,
        String resourceId,
        Map<String, String> metadata,
        Instant timestamp,
        AuditOutcome outcome) {

    public AuditEntry {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }
}
