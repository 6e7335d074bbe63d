package warden.core.port.out;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import warden.core.model.session.Session;

/**
 * Port for refresh-token session persistence.
 */
public interface SessionRepository {

    /**
     * Persist a new session.
     *
     * <p>Fails with {@link IllegalStateException} if an active session already
     * holds the same refresh-token hash.
     */
    Uni<Session> save(Session session);

    Uni<Optional<Session>> findById(String sessionId);

    /**
     * Find a session by the digest of its refresh token, active or not.
     */
    Uni<Optional<Session>> findByRefreshTokenHash(String refreshTokenHash);

    /**
     * List active sessions for a principal.
     */
    Uni<List<Session>> findActiveByPrincipal(String principalId);

    /**
     * Deactivate a session.
     *
     * @return true if the session was active before this call
     */
    Uni<Boolean> deactivate(String sessionId, Instant endedAt);

    /**
     * Deactivate every active session of a principal.
     *
     * @return number of sessions deactivated
     */
    Uni<Integer> deactivateAllForPrincipal(String principalId, Instant endedAt);
}
