package warden.core.port.out;

import java.util.List;

import io.smallrye.mutiny.Uni;

/**
 * Port for the queue of alerts awaiting human review.
 */
public interface ReviewQueue {

    Uni<Void> enqueue(String alertId);

    /**
     * Pending alert ids, oldest first.
     */
    Uni<List<String>> pending(int limit);

    /**
     * Remove an alert from the queue once an operator has picked it up.
     */
    Uni<Void> remove(String alertId);
}
