package tether.core.service.session;

import java.util.Comparator;
import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;

import io.quarkus.runtime.StartupEvent;
import org.jboss.logging.Logger;

import tether.core.config.SessionStoreConfig;
import tether.core.port.out.DurableSessionRepository;
import tether.spi.DurableStorageProvider;
import tether.spi.StorageProviderException;

/**
 * Registry for durable session storage providers.
 *
 * <p>Uses the configured provider (tether.session.durable.provider) when it is
 * available and can be created, otherwise the highest priority provider that can.
 */
@ApplicationScoped
public class DurableStorageProviderRegistry {

    private static final Logger LOG = Logger.getLogger(DurableStorageProviderRegistry.class);

    private final Instance<DurableStorageProvider> providers;
    private final SessionStoreConfig config;

    private DurableStorageProvider selectedProvider;
    private DurableSessionRepository repository;

    @Inject
    public DurableStorageProviderRegistry(Instance<DurableStorageProvider> providers, SessionStoreConfig config) {
        this.providers = providers;
        this.config = config;
    }

    void onStart(@Observes StartupEvent event) {
        getRepository();
        LOG.infof("Durable session provider initialized: %s", selectedProvider.name());
    }

    public synchronized DurableSessionRepository getRepository() {
        if (repository == null) {
            selectAndCreate();
        }
        return repository;
    }

    public synchronized DurableStorageProvider getSelectedProvider() {
        if (selectedProvider == null) {
            selectAndCreate();
        }
        return selectedProvider;
    }

    private void selectAndCreate() {
        final String configuredProvider = config.durable().provider();
        final List<DurableStorageProvider> candidates = providers.stream()
                .filter(DurableStorageProvider::isAvailable)
                .sorted(Comparator.comparing((DurableStorageProvider p) -> !p.name().equals(configuredProvider))
                        .thenComparing(Comparator.comparingInt(DurableStorageProvider::priority).reversed()))
                .toList();

        for (DurableStorageProvider candidate : candidates) {
            try {
                repository = candidate.createRepository();
                selectedProvider = candidate;
                if (!candidate.name().equals(configuredProvider)) {
                    LOG.warnf(
                            "Configured durable provider '%s' is not usable, using %s",
                            configuredProvider, candidate.name());
                }
                return;
            } catch (StorageProviderException e) {
                LOG.warnv("Durable provider {0} failed to start: {1}", candidate.name(), e.getMessage());
            }
        }
        throw new IllegalStateException("No durable session providers available");
    }

    public List<DurableStorageProvider> getAvailableProviders() {
        return providers.stream().filter(DurableStorageProvider::isAvailable).toList();
    }
}
