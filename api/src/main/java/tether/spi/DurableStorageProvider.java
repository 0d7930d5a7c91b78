package tether.spi;

import java.util.Optional;

import org.eclipse.microprofile.health.HealthCheckResponse;

import tether.core.port.out.DurableSessionRepository;

/**
 * SPI for the durable session layer.
 *
 * <p>Built-in providers:
 * <ul>
 *   <li>cassandra (priority: 10) - Apache Cassandra</li>
 *   <li>memory (priority: 0) - In-process rows (development and tests only)</li>
 * </ul>
 *
 * <p>Selected the same way as {@link CacheStoreProvider}, through
 * {@code tether.session.durable.provider}.
 */
public interface DurableStorageProvider {

    String name();

    int priority();

    boolean isAvailable();

    /**
     * Create the repository. Repeated calls return the same instance.
     *
     * @throws StorageProviderException if the backend cannot be reached
     */
    DurableSessionRepository createRepository();

    Optional<HealthCheckResponse> healthCheck();
}
