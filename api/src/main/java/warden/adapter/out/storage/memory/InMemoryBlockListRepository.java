package warden.adapter.out.storage.memory;

import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;

import warden.core.model.threat.BlockEntry;
import warden.core.model.threat.BlockSubject;
import warden.core.port.out.BlockListRepository;

/**
 * In-memory implementation of {@link BlockListRepository}. Expired entries are
 * hidden on read and removed by {@link #sweepExpired()}.
 */
public class InMemoryBlockListRepository implements BlockListRepository {

    private final ConcurrentMap<BlockSubject, BlockEntry> blocks = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryBlockListRepository(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Uni<Void> put(BlockEntry entry) {
        return Uni.createFrom().item(() -> {
            blocks.put(entry.subject(), entry);
            return null;
        });
    }

    @Override
    public Uni<Optional<BlockEntry>> find(BlockSubject subject) {
        return Uni.createFrom().item(() -> Optional.ofNullable(blocks.get(subject))
                .filter(entry -> entry.isActiveAt(clock.instant())));
    }

    @Override
    public Uni<Boolean> remove(BlockSubject subject) {
        return Uni.createFrom().item(() -> {
            final var removed = blocks.remove(subject);
            return removed != null && removed.isActiveAt(clock.instant());
        });
    }

    @Override
    public Multi<BlockEntry> streamActive() {
        final var now = clock.instant();
        return Multi.createFrom().iterable(blocks.values()).filter(entry -> entry.isActiveAt(now));
    }

    public void sweepExpired() {
        final var now = clock.instant();
        blocks.values().removeIf(entry -> !entry.isActiveAt(now));
    }
}
