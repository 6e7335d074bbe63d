package warden.adapter.out.storage.memory;

import java.util.List;
import java.util.concurrent.ConcurrentLinkedQueue;

import io.smallrye.mutiny.Uni;

import warden.core.port.out.ReviewQueue;

/**
 * In-memory FIFO implementation of {@link ReviewQueue}.
 */
public class InMemoryReviewQueue implements ReviewQueue {

    private final ConcurrentLinkedQueue<String> queue = new ConcurrentLinkedQueue<>();

    @Override
    public Uni<Void> enqueue(String alertId) {
        return Uni.createFrom().item(() -> {
            queue.add(alertId);
            return null;
        });
    }

    @Override
    public Uni<List<String>> pending(int limit) {
        return Uni.createFrom().item(() -> queue.stream().limit(limit).toList());
    }

    @Override
    public Uni<Void> remove(String alertId) {
        return Uni.createFrom().item(() -> {
            queue.removeIf(alertId::equals);
            return null;
        });
    }
}
