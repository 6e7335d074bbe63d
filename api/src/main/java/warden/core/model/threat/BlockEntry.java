package warden.core.model.threat;

import java.time.Instant;

/**
 * An active block, consulted before any other request processing.
 */
public record BlockEntry(BlockSubject subject, String reason, Instant createdAt, Instant expiresAt) {

    public boolean isActiveAt(Instant now) {
        return now.isBefore(expiresAt);
    }
}
