package tether.core.service.session;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

import jakarta.enterprise.inject.Instance;

import org.eclipse.microprofile.health.HealthCheckResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import tether.adapter.out.storage.memory.InMemoryCacheStore;
import tether.core.port.out.CacheStore;
import tether.spi.CacheStoreProvider;
import tether.testing.TestSessionStoreConfig;

@DisplayName("CacheStoreProviderRegistry")
@ExtendWith(MockitoExtension.class)
class CacheStoreProviderRegistryTest {

    @Mock
    private Instance<CacheStoreProvider> providers;

    private TestSessionStoreConfig config;
    private CacheStoreProviderRegistry registry;

    @BeforeEach
    void setUp() {
        config = new TestSessionStoreConfig();
        registry = new CacheStoreProviderRegistry(providers, config);
    }

    private void register(CacheStoreProvider... available) {
        when(providers.stream()).thenAnswer(invocation -> Stream.of(available));
    }

    @Nested
    @DisplayName("Provider selection")
    class ProviderSelection {

        @Test
        @DisplayName("should select the configured provider over a higher priority one")
        void configured() {
            config.cacheProvider = "memory";
            register(new StubProvider("redis", 100, true), new StubProvider("memory", 0, true));

            assertEquals("memory", registry.getSelectedProvider().name());
        }

        @Test
        @DisplayName("should fall back to the highest priority provider when the configured one is missing")
        void highestPriority() {
            config.cacheProvider = "hazelcast";
            register(new StubProvider("memory", 0, true), new StubProvider("redis", 100, true));

            assertEquals("redis", registry.getSelectedProvider().name());
        }

        @Test
        @DisplayName("should skip unavailable providers")
        void unavailable() {
            config.cacheProvider = "redis";
            register(new StubProvider("redis", 100, false), new StubProvider("memory", 0, true));

            assertEquals("memory", registry.getSelectedProvider().name());
        }

        @Test
        @DisplayName("should throw when no provider is available")
        void none() {
            register();

            assertThrows(IllegalStateException.class, registry::getSelectedProvider);
        }
    }

    @Nested
    @DisplayName("Store creation")
    class StoreCreation {

        @Test
        @DisplayName("should create the store once")
        void createsOnce() {
            var provider = new StubProvider("memory", 0, true);
            register(provider);

            CacheStore first = registry.getStore();
            CacheStore second = registry.getStore();

            assertSame(first, second);
            assertEquals(1, provider.created.get());
        }
    }

    @Test
    @DisplayName("should list only available providers")
    void availableProviders() {
        register(new StubProvider("redis", 100, false), new StubProvider("memory", 0, true));

        List<CacheStoreProvider> available = registry.getAvailableProviders();

        assertEquals(List.of("memory"), available.stream().map(CacheStoreProvider::name).toList());
    }

    private static final class StubProvider implements CacheStoreProvider {

        private final String name;
        private final int priority;
        private final boolean available;
        private final AtomicInteger created = new AtomicInteger();

        StubProvider(String name, int priority, boolean available) {
            this.name = name;
            this.priority = priority;
            this.available = available;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public int priority() {
            return priority;
        }

        @Override
        public boolean isAvailable() {
            return available;
        }

        @Override
        public CacheStore createStore() {
            created.incrementAndGet();
            return new InMemoryCacheStore();
        }

        @Override
        public Optional<HealthCheckResponse> healthCheck() {
            return Optional.empty();
        }
    }
}
