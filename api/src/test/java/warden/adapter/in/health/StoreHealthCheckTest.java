package warden.adapter.in.health;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import org.eclipse.microprofile.health.HealthCheckResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import warden.adapter.out.storage.StorageProviderLoader;
import warden.mock.TestConfigs;

@DisplayName("StoreHealthCheck")
class StoreHealthCheckTest {

    private StoreHealthCheck healthCheck;

    @BeforeEach
    void setUp() {
        final var storage = mock(StorageProviderLoader.class);
        when(storage.backendName()).thenReturn("redis");
        healthCheck = new StoreHealthCheck(storage, TestConfigs.resiliency());
    }

    @Test
    @DisplayName("should report UP under its name")
    void shouldReportUp() {
        final HealthCheckResponse response = healthCheck.call();

        assertEquals(HealthCheckResponse.Status.UP, response.getStatus());
        assertEquals("warden-stores", response.getName());
    }

    @Test
    @DisplayName("should describe the backend and failure policies")
    void shouldIncludeStoreData() {
        final var data = healthCheck.call().getData().orElseThrow();

        assertEquals("redis", data.get("backend"));
        assertEquals(200L, data.get("operation-timeout-ms"));
        assertEquals("FAIL_OPEN", data.get("rate-limit-failure-policy"));
        assertEquals("FAIL_OPEN", data.get("threat-failure-policy"));
        assertEquals("FAIL_CLOSED", data.get("lockout-failure-policy"));
    }
}
