package tether.adapter.out.storage.memory;

import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;

import org.eclipse.microprofile.health.HealthCheckResponse;
import org.jboss.logging.Logger;

import tether.core.port.out.DurableSessionRepository;
import tether.spi.DurableStorageProvider;

/**
 * In-memory durable session provider.
 *
 * <p>Always available and the fallback when Cassandra is not configured or unreachable.
 */
@ApplicationScoped
public class InMemoryDurableStorageProvider implements DurableStorageProvider {

    private static final Logger LOG = Logger.getLogger(InMemoryDurableStorageProvider.class);
    private static final int PRIORITY = 0;

    private InMemoryDurableSessionRepository repository;

    @Override
    public String name() {
        return "memory";
    }

    @Override
    public int priority() {
        return PRIORITY;
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public synchronized DurableSessionRepository createRepository() {
        if (repository == null) {
            LOG.info("Durable sessions are held in memory and will not survive a restart");
            repository = new InMemoryDurableSessionRepository();
        }
        return repository;
    }

    @Override
    public Optional<HealthCheckResponse> healthCheck() {
        return Optional.of(HealthCheckResponse.named("session-durable-memory")
                .up()
                .withData("type", "in-memory")
                .withData("sessions", repository != null ? repository.getSessionCount() : 0)
                .build());
    }
}
