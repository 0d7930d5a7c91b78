package tether.adapter.out.storage.memory;

import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.eclipse.microprofile.health.HealthCheckResponse;
import org.jboss.logging.Logger;

import tether.core.port.out.CacheStore;
import tether.spi.CacheStoreProvider;

/**
 * In-memory cache provider.
 *
 * <p>Always available; used when Redis is not configured or unreachable.
 *
 * <p><strong>Warning:</strong> sessions, indexes and transaction journals live in
 * one process only. Not recommended for production.
 */
@ApplicationScoped
public class InMemoryCacheStoreProvider implements CacheStoreProvider {

    private static final Logger LOG = Logger.getLogger(InMemoryCacheStoreProvider.class);
    private static final int PRIORITY = 0;

    private final Clock clock;
    private final AtomicBoolean warningLogged = new AtomicBoolean(false);
    private InMemoryCacheStore store;

    @Inject
    public InMemoryCacheStoreProvider(Clock clock) {
        this.clock = clock;
    }

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
    public synchronized CacheStore createStore() {
        if (warningLogged.compareAndSet(false, true)) {
            LOG.warn("========================================================================");
            LOG.warn("  WARNING: Session cache is in-memory only!");
            LOG.warn("  Sessions and rollback journals are lost on restart and not shared.");
            LOG.warn("  Configure tether.session.cache.provider=redis for production.");
            LOG.warn("========================================================================");
        }
        if (store == null) {
            store = new InMemoryCacheStore(clock, true);
        }
        return store;
    }

    @Override
    public Optional<HealthCheckResponse> healthCheck() {
        return Optional.of(HealthCheckResponse.named("session-cache-memory")
                .up()
                .withData("type", "in-memory")
                .withData("entries", store != null ? store.size() : 0)
                .build());
    }

    @PreDestroy
    void shutdown() {
        if (store != null) {
            store.shutdown();
        }
    }
}
