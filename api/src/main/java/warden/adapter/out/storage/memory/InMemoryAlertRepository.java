package warden.adapter.out.storage.memory;

import java.time.LocalDate;
import java.util.Comparator;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;

import warden.core.model.threat.AlertStatus;
import warden.core.model.threat.SecurityAlert;
import warden.core.port.out.AlertRepository;

/**
 * In-memory implementation of {@link AlertRepository}. Alerts are never
 * evicted; use the Redis backend for long-running deployments.
 */
public class InMemoryAlertRepository implements AlertRepository {

    private static final Comparator<SecurityAlert> NEWEST_FIRST = Comparator.comparing(SecurityAlert::detectedAt)
            .thenComparing(SecurityAlert::id)
            .reversed();

    private final ConcurrentMap<String, SecurityAlert> alerts = new ConcurrentHashMap<>();
    private final ConcurrentMap<LocalDate, AtomicLong> sequences = new ConcurrentHashMap<>();

    @Override
    public Uni<Long> nextSequence(LocalDate day) {
        return Uni.createFrom()
                .item(() -> sequences.computeIfAbsent(day, d -> new AtomicLong()).incrementAndGet());
    }

    @Override
    public Uni<SecurityAlert> create(SecurityAlert alert) {
        return Uni.createFrom().item(() -> {
            if (alerts.putIfAbsent(alert.id(), alert) != null) {
                throw new IllegalStateException("Alert already exists: " + alert.id());
            }
            return alert;
        });
    }

    @Override
    public Uni<Optional<SecurityAlert>> findById(String alertId) {
        return Uni.createFrom().item(() -> Optional.ofNullable(alerts.get(alertId)));
    }

    @Override
    public Uni<Boolean> replaceIfStatus(SecurityAlert updated, AlertStatus expected) {
        return Uni.createFrom().item(() -> {
            final var replaced = new boolean[1];
            alerts.computeIfPresent(updated.id(), (id, current) -> {
                if (current.status() != expected) {
                    return current;
                }
                replaced[0] = true;
                return updated;
            });
            return replaced[0];
        });
    }

    @Override
    public Multi<SecurityAlert> streamAll() {
        return Multi.createFrom()
                .iterable(() -> alerts.values().stream().sorted(NEWEST_FIRST).iterator());
    }
}
