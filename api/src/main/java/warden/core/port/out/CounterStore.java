package warden.core.port.out;

import java.time.Duration;

import io.smallrye.mutiny.Uni;

/**
 * Port for atomic, self-expiring counters.
 *
 * <p>Backs rate-limit windows, threat scores and request-volume counters.
 * Implementations must make {@link #incrementAndGet} a single atomic
 * increment-and-read so concurrent callers observe distinct values.
 */
public interface CounterStore {

    /**
     * Atomically increment a counter and return its new value.
     *
     * <p>The TTL is applied when the increment creates the counter; later
     * increments leave the original expiry in place.
     *
     * @param key the counter key
     * @param ttl lifetime of a newly created counter
     * @return the post-increment value
     */
    Uni<Long> incrementAndGet(String key, Duration ttl);

    /**
     * Read a counter without changing it.
     *
     * @return the current value, 0 when absent or expired
     */
    Uni<Long> get(String key);

    /**
     * Remove a counter.
     */
    Uni<Void> delete(String key);
}
