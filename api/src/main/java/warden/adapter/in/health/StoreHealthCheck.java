package warden.adapter.in.health;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

import warden.adapter.out.storage.StorageProviderLoader;
import warden.core.config.ResiliencyConfig;

/**
 * Readiness check describing the state stores.
 *
 * <p>Reports the active storage backend, the store operation timeout and the
 * failure policy of each component. Always UP once configuration has loaded;
 * store outages are handled by the failure policies and surface through the
 * {@code warden.store.degradations} metric.
 */
@Readiness
@ApplicationScoped
public class StoreHealthCheck implements HealthCheck {

    private final StorageProviderLoader storage;
    private final ResiliencyConfig resiliency;

    @Inject
    public StoreHealthCheck(StorageProviderLoader storage, ResiliencyConfig resiliency) {
        this.storage = storage;
        this.resiliency = resiliency;
    }

    @Override
    public HealthCheckResponse call() {
        final var store = resiliency.store();
        return HealthCheckResponse.named("warden-stores")
                .withData("backend", storage.backendName())
                .withData("operation-timeout-ms", store.operationTimeout().toMillis())
                .withData("rate-limit-failure-policy", store.rateLimitFailurePolicy().name())
                .withData("threat-failure-policy", store.threatFailurePolicy().name())
                .withData("lockout-failure-policy", store.lockoutFailurePolicy().name())
                .up()
                .build();
    }
}
