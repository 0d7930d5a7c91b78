package tether.spi;

import java.util.Optional;

import org.eclipse.microprofile.health.HealthCheckResponse;

import tether.core.port.out.CacheStore;

/**
 * SPI for the cache that holds sessions, their indexes and transaction journals.
 *
 * <p>Built-in providers:
 * <ul>
 *   <li>redis (priority: 100) - Redis-based cache</li>
 *   <li>memory (priority: 0) - In-process cache (development and tests only)</li>
 * </ul>
 *
 * <p>Provider selection order:
 * <ol>
 *   <li>Configured provider (tether.session.cache.provider)</li>
 *   <li>Highest priority available provider</li>
 *   <li>Memory fallback (always available)</li>
 * </ol>
 */
public interface CacheStoreProvider {

    /**
     * Provider name used in {@code tether.session.cache.provider}.
     */
    String name();

    /**
     * Priority for automatic selection; higher is preferred.
     */
    int priority();

    /**
     * Check if this provider is available and ready to use.
     */
    boolean isAvailable();

    /**
     * Create the cache store. Repeated calls return the same instance.
     */
    CacheStore createStore();

    /**
     * Health of the backend for the readiness endpoint, or empty if not supported.
     */
    Optional<HealthCheckResponse> healthCheck();
}
