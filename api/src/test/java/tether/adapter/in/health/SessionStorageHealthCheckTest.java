package tether.adapter.in.health;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.Optional;

import io.smallrye.mutiny.Uni;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import tether.core.model.common.StorageHealth;
import tether.core.model.common.StorageHealthReport;
import tether.core.port.in.TokenStorage;
import tether.core.service.session.CacheStoreProviderRegistry;
import tether.core.service.session.DurableStorageProviderRegistry;
import tether.spi.CacheStoreProvider;
import tether.spi.DurableStorageProvider;

@DisplayName("SessionStorageHealthCheck")
class SessionStorageHealthCheckTest {

    private TokenStorage tokenStorage;
    private SessionStorageHealthCheck healthCheck;

    @BeforeEach
    void setUp() {
        tokenStorage = mock(TokenStorage.class);

        var cacheProvider = mock(CacheStoreProvider.class);
        when(cacheProvider.name()).thenReturn("redis");
        when(cacheProvider.healthCheck()).thenReturn(Optional.of(HealthCheckResponse.named("redis-session-cache")
                .up()
                .withData("timeoutMs", 1000L)
                .build()));
        var cacheRegistry = mock(CacheStoreProviderRegistry.class);
        when(cacheRegistry.getSelectedProvider()).thenReturn(cacheProvider);

        var durableProvider = mock(DurableStorageProvider.class);
        when(durableProvider.name()).thenReturn("memory");
        when(durableProvider.healthCheck()).thenReturn(Optional.empty());
        var durableRegistry = mock(DurableStorageProviderRegistry.class);
        when(durableRegistry.getSelectedProvider()).thenReturn(durableProvider);

        healthCheck = new SessionStorageHealthCheck(tokenStorage, cacheRegistry, durableRegistry);
    }

    private HealthCheckResponse call() {
        return healthCheck.call().await().atMost(Duration.ofSeconds(5));
    }

    @Test
    @DisplayName("should be UP with provider and layer data when both layers are healthy")
    void up() {
        when(tokenStorage.getStorageHealth()).thenReturn(Uni.createFrom().item(new StorageHealthReport(
                StorageHealth.healthy("redis", 3), StorageHealth.healthy("memory", 0))));

        var response = call();
        var data = response.getData().orElseThrow();

        assertEquals("session-storage", response.getName());
        assertEquals(HealthCheckResponse.Status.UP, response.getStatus());
        assertEquals("healthy", data.get("status"));
        assertEquals("redis", data.get("cache.provider"));
        assertEquals("memory", data.get("durable.provider"));
        assertEquals(3L, data.get("cache.latencyMs"));
        assertEquals(1000L, data.get("cache.timeoutMs"));
    }

    @Test
    @DisplayName("should be DOWN when a layer fails its probe")
    void down() {
        when(tokenStorage.getStorageHealth()).thenReturn(Uni.createFrom().item(new StorageHealthReport(
                StorageHealth.unhealthy("redis", "connection refused"), StorageHealth.healthy("memory", 0))));

        var response = call();
        var data = response.getData().orElseThrow();

        assertEquals(HealthCheckResponse.Status.DOWN, response.getStatus());
        assertEquals("degraded", data.get("status"));
        assertEquals(false, data.get("cache.healthy"));
        assertEquals("connection refused", data.get("cache.message"));
        assertFalse(data.containsKey("cache.latencyMs"));
    }
}
