package warden.core.model.session;

import java.time.Instant;
import java.util.Objects;

/**
 * Durable record of a refresh-token session.
 *
 * <p>Only the SHA-256 digest of the refresh token is stored. A session is usable
 * while {@code active} is true and {@code expiresAt} lies in the future.
 */
public record Session(
        String id,
        String principalId,
        String refreshTokenHash,
        DeviceInfo deviceInfo,
        String ipAddress,
        boolean rememberMe,
        Instant createdAt,
        Instant expiresAt,
        boolean active,
        Instant endedAt) {

    public Session {
        Objects.requireNonNull(id, "id cannot be null");
        Objects.requireNonNull(principalId, "principalId cannot be null");
        Objects.requireNonNull(refreshTokenHash, "refreshTokenHash cannot be null");
        Objects.requireNonNull(createdAt, "createdAt cannot be null");
        Objects.requireNonNull(expiresAt, "expiresAt cannot be null");
        deviceInfo = deviceInfo == null ? DeviceInfo.empty() : deviceInfo;
        ipAddress = ipAddress == null ? "unknown" : ipAddress;
    }

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }

    public boolean isUsable(Instant now) {
        return active && !isExpired(now);
    }

    /**
     * Returns a deactivated copy. Already inactive sessions are returned unchanged
     * so the original end time is kept.
     */
    public Session deactivate(Instant now) {
        if (!active) {
            return this;
        }
        return new Session(
                id, principalId, refreshTokenHash, deviceInfo, ipAddress, rememberMe, createdAt, expiresAt, false, now);
    }
}
