package tether.adapter.out.storage.memory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import tether.core.model.common.StorageHealth;
import tether.core.port.out.CacheStore;

/**
 * In-memory implementation of CacheStore.
 *
 * <p>This implementation is intended for development and testing only.
 * Entries are lost on restart and not shared across instances.
 *
 * <p>Expired entries are invisible to reads as soon as their TTL passes and are
 * removed from memory by a periodic sweep.
 */
public class InMemoryCacheStore implements CacheStore {

    private static final Logger LOG = Logger.getLogger(InMemoryCacheStore.class);

    private final ConcurrentMap<String, Entry> entries = new ConcurrentHashMap<>();
    private final Clock clock;
    private final ScheduledExecutorService cleanupExecutor;

    public InMemoryCacheStore() {
        this(Clock.systemUTC(), true);
    }

    /**
     * Create a store on a given clock.
     *
     * @param clock        clock used for expiry
     * @param sweepExpired whether to start the background sweep
     */
    public InMemoryCacheStore(Clock clock, boolean sweepExpired) {
        this.clock = clock;
        if (sweepExpired) {
            this.cleanupExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "cache-cleanup");
                t.setDaemon(true);
                return t;
            });
            cleanupExecutor.scheduleAtFixedRate(this::removeExpired, 1, 1, TimeUnit.MINUTES);
        } else {
            this.cleanupExecutor = null;
        }
    }

    @Override
    public Uni<Optional<String>> get(String key) {
        return Uni.createFrom().item(() -> live(key).map(Entry::value));
    }

    @Override
    public Uni<Boolean> set(String key, String value, Duration ttl) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            return Uni.createFrom().failure(new IllegalArgumentException("TTL must be positive: " + ttl));
        }
        return Uni.createFrom().item(() -> {
            entries.put(key, new Entry(value, clock.instant().plus(ttl)));
            return true;
        });
    }

    @Override
    public Uni<Boolean> delete(String key) {
        return Uni.createFrom().item(() -> {
            final Entry removed = entries.remove(key);
            return removed != null && !removed.isExpired(clock.instant());
        });
    }

    @Override
    public Uni<Optional<Duration>> remainingTtl(String key) {
        return Uni.createFrom()
                .item(() -> live(key).map(entry -> Duration.between(clock.instant(), entry.expiresAt())));
    }

    @Override
    public Uni<StorageHealth> check() {
        return Uni.createFrom().item(StorageHealth.healthy("memory", 0));
    }

    /**
     * Number of entries held, including expired ones not yet swept.
     */
    public int size() {
        return entries.size();
    }

    /**
     * Stop the background sweep.
     */
    public void shutdown() {
        if (cleanupExecutor != null) {
            cleanupExecutor.shutdown();
        }
    }

    void removeExpired() {
        final Instant now = clock.instant();
        final int before = entries.size();
        entries.entrySet().removeIf(e -> e.getValue().isExpired(now));
        final int removed = before - entries.size();
        if (removed > 0) {
            LOG.debugf("Swept %d expired cache entries", removed);
        }
    }

    private Optional<Entry> live(String key) {
        final Entry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.isExpired(clock.instant())) {
            entries.remove(key, entry);
            return Optional.empty();
        }
        return Optional.of(entry);
    }

    private record Entry(String value, Instant expiresAt) {

        boolean isExpired(Instant now) {
            return !now.isBefore(expiresAt);
        }
    }
}
