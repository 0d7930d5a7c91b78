package tether.core.service.session;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.when;

import java.util.Optional;
import java.util.stream.Stream;

import jakarta.enterprise.inject.Instance;

import org.eclipse.microprofile.health.HealthCheckResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import tether.adapter.out.storage.memory.InMemoryDurableSessionRepository;
import tether.core.port.out.DurableSessionRepository;
import tether.spi.DurableStorageProvider;
import tether.spi.StorageProviderException;
import tether.testing.TestSessionStoreConfig;

@DisplayName("DurableStorageProviderRegistry")
@ExtendWith(MockitoExtension.class)
class DurableStorageProviderRegistryTest {

    @Mock
    private Instance<DurableStorageProvider> providers;

    private TestSessionStoreConfig config;
    private DurableStorageProviderRegistry registry;

    @BeforeEach
    void setUp() {
        config = new TestSessionStoreConfig();
        registry = new DurableStorageProviderRegistry(providers, config);
    }

    private void register(DurableStorageProvider... available) {
        when(providers.stream()).thenAnswer(invocation -> Stream.of(available));
    }

    @Test
    @DisplayName("should use the configured provider")
    void configured() {
        config.durableProvider = "cassandra";
        var cassandra = new StubProvider("cassandra", 10, false);
        register(new StubProvider("memory", 0, false), cassandra);

        var repository = registry.getRepository();

        assertSame(cassandra.repository, repository);
        assertEquals("cassandra", registry.getSelectedProvider().name());
    }

    @Test
    @DisplayName("should fall back when the configured provider fails to start")
    void fallsBack() {
        config.durableProvider = "cassandra";
        register(new StubProvider("cassandra", 10, true), new StubProvider("memory", 0, false));

        registry.getRepository();

        assertEquals("memory", registry.getSelectedProvider().name());
    }

    @Test
    @DisplayName("should prefer the highest priority provider when nothing is configured")
    void priority() {
        config.durableProvider = "";
        register(new StubProvider("memory", 0, false), new StubProvider("cassandra", 10, false));

        assertEquals("cassandra", registry.getSelectedProvider().name());
    }

    @Test
    @DisplayName("should throw when every provider fails")
    void allFail() {
        register(new StubProvider("memory", 0, true));

        assertThrows(IllegalStateException.class, registry::getRepository);
    }

    private static final class StubProvider implements DurableStorageProvider {

        private final String name;
        private final int priority;
        private final boolean failing;
        private final DurableSessionRepository repository = new InMemoryDurableSessionRepository();

        StubProvider(String name, int priority, boolean failing) {
            this.name = name;
            this.priority = priority;
            this.failing = failing;
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
            return true;
        }

        @Override
        public DurableSessionRepository createRepository() {
            if (failing) {
                throw new StorageProviderException("Cannot reach " + name);
            }
            return repository;
        }

        @Override
        public Optional<HealthCheckResponse> healthCheck() {
            return Optional.empty();
        }
    }
}
