package tether.adapter.out.storage.memory;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import tether.testing.MutableClock;

@DisplayName("InMemoryCacheStore")
class InMemoryCacheStoreTest {

    private MutableClock clock;
    private InMemoryCacheStore store;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-05-01T10:00:00Z");
        store = new InMemoryCacheStore(clock, false);
    }

    @Test
    @DisplayName("sweep should drop expired entries and keep live ones")
    void sweepRemovesExpired() {
        store.set("short", "a", Duration.ofSeconds(10)).await().indefinitely();
        store.set("long", "b", Duration.ofHours(1)).await().indefinitely();
        clock.advance(Duration.ofMinutes(1));

        store.removeExpired();

        assertEquals(1, store.size());
        assertTrue(store.get("long").await().indefinitely().isPresent());
    }

    @Test
    @DisplayName("entry should expire exactly at its deadline")
    void expiresAtDeadline() {
        store.set("key", "value", Duration.ofSeconds(30)).await().indefinitely();

        clock.advance(Duration.ofSeconds(30));

        assertTrue(store.get("key").await().indefinitely().isEmpty());
    }
}
