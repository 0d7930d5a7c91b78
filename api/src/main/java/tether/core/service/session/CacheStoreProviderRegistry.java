package tether.core.service.session;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;

import io.quarkus.runtime.StartupEvent;
import org.jboss.logging.Logger;

import tether.core.config.SessionStoreConfig;
import tether.core.port.out.CacheStore;
import tether.spi.CacheStoreProvider;

/**
 * Registry for cache store providers.
 *
 * <p>Selection order:
 * <ol>
 *   <li>Configured provider (tether.session.cache.provider)</li>
 *   <li>Highest priority available provider</li>
 *   <li>Memory fallback (always available)</li>
 * </ol>
 */
@ApplicationScoped
public class CacheStoreProviderRegistry {

    private static final Logger LOG = Logger.getLogger(CacheStoreProviderRegistry.class);

    private final Instance<CacheStoreProvider> providers;
    private final SessionStoreConfig config;

    private CacheStoreProvider selectedProvider;
    private CacheStore store;

    @Inject
    public CacheStoreProviderRegistry(Instance<CacheStoreProvider> providers, SessionStoreConfig config) {
        this.providers = providers;
        this.config = config;
    }

    /**
     * Select the provider at startup, on a worker thread, instead of on the first request.
     */
    void onStart(@Observes StartupEvent event) {
        getSelectedProvider();
        LOG.infof("Session cache provider initialized: %s", selectedProvider.name());
    }

    public synchronized CacheStore getStore() {
        if (store == null) {
            store = getSelectedProvider().createStore();
        }
        return store;
    }

    public synchronized CacheStoreProvider getSelectedProvider() {
        if (selectedProvider == null) {
            selectedProvider = selectProvider();
        }
        return selectedProvider;
    }

    private CacheStoreProvider selectProvider() {
        final String configuredProvider = config.cache().provider();
        final List<CacheStoreProvider> availableProviders = getAvailableProviders().stream()
                .sorted(Comparator.comparingInt(CacheStoreProvider::priority).reversed())
                .toList();

        LOG.debugf(
                "Available session cache providers: %s",
                availableProviders.stream().map(CacheStoreProvider::name).toList());

        final Optional<CacheStoreProvider> configured = availableProviders.stream()
                .filter(p -> p.name().equals(configuredProvider))
                .findFirst();
        if (configured.isPresent()) {
            LOG.infof("Using configured session cache provider: %s", configuredProvider);
            return configured.get();
        }

        if (!configuredProvider.equals("memory")) {
            LOG.warnf("Configured session cache provider '%s' is not available, falling back", configuredProvider);
        }

        if (!availableProviders.isEmpty()) {
            final var provider = availableProviders.get(0);
            LOG.infof("Using session cache provider: %s (priority: %d)", provider.name(), provider.priority());
            return provider;
        }

        throw new IllegalStateException("No session cache providers available");
    }

    /**
     * Available providers, for health checks.
     */
    public List<CacheStoreProvider> getAvailableProviders() {
        return providers.stream().filter(CacheStoreProvider::isAvailable).toList();
    }
}
