package warden.core.service.common;

import java.time.Duration;
import java.util.function.Supplier;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.model.common.FailurePolicy;
import warden.core.port.out.Metrics;

/**
 * Applies the store timeout and a component's failure policy to store calls.
 *
 * <h2>Operation Modes</h2>
 * <ul>
 *   <li>{@link #withTimeout} - Fail-fast: fails with {@link StoreTimeoutException} on
 *       timeout and propagates other failures.</li>
 *   <li>{@link #withPolicy} - Resolves timeouts and failures through a
 *       {@link FailurePolicy}, picking the open or closed fallback.</li>
 *   <li>{@link #withFallback} - Returns a fixed fallback on timeout or failure.</li>
 *   <li>{@link #withTimeoutSilent} - Fire-and-forget: logs and ignores timeout or failure.</li>
 * </ul>
 *
 * <p>Every degradation is logged at WARN and recorded as
 * {@code warden.store.degradations}.
 */
public class StoreCallGuard {

    private static final Logger LOG = Logger.getLogger(StoreCallGuard.class);

    private final Duration timeout;
    private final Metrics metrics;
    private final String component;

    /**
     * @param timeout   bound for each store call
     * @param metrics   metrics sink (may be null)
     * @param component component name for logging and metrics
     */
    public StoreCallGuard(Duration timeout, Metrics metrics, String component) {
        this.timeout = timeout;
        this.metrics = metrics;
        this.component = component;
    }

    public Duration timeout() {
        return timeout;
    }

    public <T> Uni<T> withTimeout(Uni<T> operation, String operationName) {
        return operation.ifNoItem().after(timeout).failWith(() -> {
            LOG.warnv("Store operation timeout: {0} in {1} after {2}", operationName, component, timeout);
            record(operationName, "timeout");
            return new StoreTimeoutException(component, operationName);
        });
    }

    /**
     * Resolve timeouts and failures through {@code policy}.
     *
     * @param whenOpen   result used under {@link FailurePolicy#FAIL_OPEN}
     * @param whenClosed result used under {@link FailurePolicy#FAIL_CLOSED}
     */
    public <T> Uni<T> withPolicy(
            Uni<T> operation,
            String operationName,
            FailurePolicy policy,
            Supplier<T> whenOpen,
            Supplier<T> whenClosed) {
        return withFallback(operation, operationName, policy.allowsOnFailure() ? whenOpen : whenClosed);
    }

    public <T> Uni<T> withFallback(Uni<T> operation, String operationName, Supplier<T> fallback) {
        return operation
                .ifNoItem()
                .after(timeout)
                .recoverWithItem(() -> {
                    LOG.warnv(
                            "Store operation timeout (fallback): {0} in {1} after {2}",
                            operationName, component, timeout);
                    record(operationName, "timeout");
                    return fallback.get();
                })
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.warnv(
                            "Store operation failure (fallback): {0} in {1}: {2}",
                            operationName, component, error.getMessage());
                    record(operationName, "failure");
                    return fallback.get();
                });
    }

    public Uni<Void> withTimeoutSilent(Uni<Void> operation, String operationName) {
        return withFallback(operation, operationName, () -> null);
    }

    private void record(String operationName, String outcome) {
        if (metrics != null) {
            metrics.recordStoreDegradation(component, operationName, outcome);
        }
    }
}
