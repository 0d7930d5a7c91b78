package tether.adapter.out.storage;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;

import tether.core.port.out.CacheStore;
import tether.core.port.out.DurableSessionRepository;
import tether.core.service.session.CacheStoreProviderRegistry;
import tether.core.service.session.DurableStorageProviderRegistry;

/**
 * CDI producer for the two session storage layers.
 *
 * <p>Delegates to the provider registries, which select a backend based on
 * configuration and availability. Custom backends implement
 * {@link tether.spi.CacheStoreProvider} or {@link tether.spi.DurableStorageProvider}
 * and register as CDI beans.
 */
@ApplicationScoped
public class SessionStorageProducer {

    private final CacheStoreProviderRegistry cacheRegistry;
    private final DurableStorageProviderRegistry durableRegistry;

    @Inject
    public SessionStorageProducer(
            CacheStoreProviderRegistry cacheRegistry, DurableStorageProviderRegistry durableRegistry) {
        this.cacheRegistry = cacheRegistry;
        this.durableRegistry = durableRegistry;
    }

    @Produces
    @ApplicationScoped
    public CacheStore cacheStore() {
        return cacheRegistry.getStore();
    }

    @Produces
    @ApplicationScoped
    public DurableSessionRepository durableSessionRepository() {
        return durableRegistry.getRepository();
    }
}
