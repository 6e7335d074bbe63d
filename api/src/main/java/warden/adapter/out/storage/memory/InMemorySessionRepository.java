package warden.adapter.out.storage.memory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import io.smallrye.mutiny.Uni;

import warden.core.model.session.Session;
import warden.core.port.out.SessionRepository;

/**
 * In-memory implementation of {@link SessionRepository}.
 *
 * <p>Keeps a refresh-hash index and a per-principal index next to the sessions.
 * Mutations that touch more than one map are serialized on this instance.
 */
public class InMemorySessionRepository implements SessionRepository {

    private final ConcurrentMap<String, Session> sessions = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, String> idByRefreshHash = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Set<String>> idsByPrincipal = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemorySessionRepository(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Uni<Session> save(Session session) {
        return Uni.createFrom().item(() -> {
            synchronized (this) {
                final var existingId = idByRefreshHash.get(session.refreshTokenHash());
                if (existingId != null && !existingId.equals(session.id())) {
                    final var existing = sessions.get(existingId);
                    if (existing != null && existing.active()) {
                        throw new IllegalStateException("An active session already holds this refresh token");
                    }
                }
                sessions.put(session.id(), session);
                idByRefreshHash.put(session.refreshTokenHash(), session.id());
                idsByPrincipal
                        .computeIfAbsent(session.principalId(), k -> ConcurrentHashMap.newKeySet())
                        .add(session.id());
                return session;
            }
        });
    }

    @Override
    public Uni<Optional<Session>> findById(String sessionId) {
        return Uni.createFrom().item(() -> Optional.ofNullable(sessions.get(sessionId)));
    }

    @Override
    public Uni<Optional<Session>> findByRefreshTokenHash(String refreshTokenHash) {
        return Uni.createFrom().item(() -> Optional.ofNullable(idByRefreshHash.get(refreshTokenHash))
                .map(sessions::get));
    }

    @Override
    public Uni<List<Session>> findActiveByPrincipal(String principalId) {
        return Uni.createFrom().item(() -> idsByPrincipal.getOrDefault(principalId, Set.of()).stream()
                .map(sessions::get)
                .filter(session -> session != null && session.active())
                .toList());
    }

    @Override
    public Uni<Boolean> deactivate(String sessionId, Instant endedAt) {
        return Uni.createFrom().item(() -> {
            final var wasActive = new boolean[1];
            sessions.computeIfPresent(sessionId, (id, session) -> {
                wasActive[0] = session.active();
                return session.deactivate(endedAt);
            });
            return wasActive[0];
        });
    }

    @Override
    public Uni<Integer> deactivateAllForPrincipal(String principalId, Instant endedAt) {
        return Uni.createFrom().item(() -> {
            var count = 0;
            for (var sessionId : idsByPrincipal.getOrDefault(principalId, Set.of())) {
                final var wasActive = new boolean[1];
                sessions.computeIfPresent(sessionId, (id, session) -> {
                    wasActive[0] = session.active();
                    return session.deactivate(endedAt);
                });
                if (wasActive[0]) {
                    count++;
                }
            }
            return count;
        });
    }

    /**
     * Drop sessions past their expiry together with their index entries.
     */
    public synchronized void sweepExpired() {
        final var now = clock.instant();
        sessions.values().removeIf(session -> {
            if (!session.isExpired(now)) {
                return false;
            }
            idByRefreshHash.remove(session.refreshTokenHash(), session.id());
            final var ids = idsByPrincipal.get(session.principalId());
            if (ids != null) {
                ids.remove(session.id());
            }
            return true;
        });
        idsByPrincipal.values().removeIf(Set::isEmpty);
    }

    public int size() {
        return sessions.size();
    }
}
