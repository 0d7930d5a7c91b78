package tether.adapter.out.storage.memory;

import java.time.Duration;

import org.junit.jupiter.api.AfterEach;

import tether.core.port.out.CacheStore;
import tether.core.port.out.CacheStoreContractTest;
import tether.testing.MutableClock;

/**
 * Runs the CacheStore contract against InMemoryCacheStore on a mutable clock.
 */
class InMemoryCacheStoreContractTest extends CacheStoreContractTest {

    private final MutableClock clock = MutableClock.startingAt("2024-05-01T10:00:00Z");
    private InMemoryCacheStore store;

    @AfterEach
    void tearDown() {
        if (store != null) {
            store.shutdown();
        }
    }

    @Override
    protected CacheStore createStore() {
        store = new InMemoryCacheStore(clock, false);
        return store;
    }

    @Override
    protected void elapse(Duration duration) {
        clock.advance(duration);
    }
}
