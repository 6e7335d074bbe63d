package warden.adapter.out.storage.memory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.port.out.CounterStore;

/**
 * In-memory implementation of {@link CounterStore}.
 *
 * <p>Atomicity comes from {@link ConcurrentMap#compute}. Counters are local to
 * this process, so limits are enforced per instance.
 *
 * <p><strong>Warning:</strong> Do not use in production with multiple instances.
 */
public class InMemoryCounterStore implements CounterStore {

    private static final Logger LOG = Logger.getLogger(InMemoryCounterStore.class);

    private final ConcurrentMap<String, CounterEntry> counters = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryCounterStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Uni<Long> incrementAndGet(String key, Duration ttl) {
        return Uni.createFrom().item(() -> {
            final var now = clock.instant();
            final var entry = counters.compute(key, (k, existing) -> {
                if (existing == null || existing.isExpired(now)) {
                    return new CounterEntry(1, now.plus(ttl));
                }
                return new CounterEntry(existing.value() + 1, existing.expiresAt());
            });
            return entry.value();
        });
    }

    @Override
    public Uni<Long> get(String key) {
        return Uni.createFrom().item(() -> {
            final var entry = counters.get(key);
            if (entry == null || entry.isExpired(clock.instant())) {
                return 0L;
            }
            return entry.value();
        });
    }

    @Override
    public Uni<Void> delete(String key) {
        return Uni.createFrom().item(() -> {
            counters.remove(key);
            return null;
        });
    }

    /**
     * Remove expired counters.
     */
    public void sweepExpired() {
        final var now = clock.instant();
        final var before = counters.size();
        counters.entrySet().removeIf(entry -> entry.getValue().isExpired(now));
        final var removed = before - counters.size();
        if (removed > 0) {
            LOG.debugf("Swept %d expired counters", removed);
        }
    }

    /**
     * Number of tracked counters, expired or not (for testing).
     */
    public int size() {
        return counters.size();
    }

    private record CounterEntry(long value, Instant expiresAt) {

        boolean isExpired(Instant now) {
            return !now.isBefore(expiresAt);
        }
    }
}
