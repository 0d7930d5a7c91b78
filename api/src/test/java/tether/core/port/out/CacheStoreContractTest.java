package tether.core.port.out;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.UUID;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Contract tests for CacheStore implementations.
 *
 * <p>Extend this class and implement {@link #createStore()} and {@link #elapse(Duration)}
 * to check a custom cache backend against the behaviour the session layer relies on.
 */
public abstract class CacheStoreContractTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    /**
     * Fresh store with no leftover entries.
     */
    protected abstract CacheStore createStore();

    /**
     * Let {@code duration} pass for the store under test.
     */
    protected abstract void elapse(Duration duration);

    private CacheStore store;

    @BeforeEach
    void setUpContract() {
        store = createStore();
    }

    private String key() {
        return "contract:" + UUID.randomUUID();
    }

    @Nested
    @DisplayName("get() and set()")
    class GetAndSetTests {

        @Test
        @DisplayName("set() then get() should return the value")
        void setThenGet() {
            var key = key();

            var written = store.set(key, "value", Duration.ofMinutes(1)).await().atMost(TIMEOUT);

            assertTrue(written);
            assertEquals("value", store.get(key).await().atMost(TIMEOUT).orElseThrow());
        }

        @Test
        @DisplayName("get() of an unknown key should be empty")
        void unknownKey() {
            assertTrue(store.get(key()).await().atMost(TIMEOUT).isEmpty());
        }

        @Test
        @DisplayName("set() should overwrite the previous value")
        void overwrite() {
            var key = key();
            store.set(key, "first", Duration.ofMinutes(1)).await().atMost(TIMEOUT);

            store.set(key, "second", Duration.ofMinutes(1)).await().atMost(TIMEOUT);

            assertEquals("second", store.get(key).await().atMost(TIMEOUT).orElseThrow());
        }

        @Test
        @DisplayName("set() should reject a non-positive TTL")
        void rejectsZeroTtl() {
            assertThrows(
                    IllegalArgumentException.class,
                    () -> store.set(key(), "value", Duration.ZERO).await().atMost(TIMEOUT));
        }
    }

    @Nested
    @DisplayName("expiry")
    class ExpiryTests {

        @Test
        @DisplayName("entry should disappear once its TTL has passed")
        void expires() {
            var key = key();
            store.set(key, "value", Duration.ofSeconds(2)).await().atMost(TIMEOUT);

            elapse(Duration.ofSeconds(3));

            assertTrue(store.get(key).await().atMost(TIMEOUT).isEmpty());
        }

        @Test
        @DisplayName("remainingTtl() should not exceed the TTL written")
        void remainingTtl() {
            var key = key();
            store.set(key, "value", Duration.ofMinutes(10)).await().atMost(TIMEOUT);

            var remaining = store.remainingTtl(key).await().atMost(TIMEOUT).orElseThrow();

            assertTrue(remaining.compareTo(Duration.ofMinutes(10)) <= 0);
            assertTrue(remaining.compareTo(Duration.ofMinutes(9)) > 0);
        }

        @Test
        @DisplayName("remainingTtl() of an unknown key should be empty")
        void remainingTtlUnknown() {
            assertTrue(store.remainingTtl(key()).await().atMost(TIMEOUT).isEmpty());
        }
    }

    @Nested
    @DisplayName("delete()")
    class DeleteTests {

        @Test
        @DisplayName("delete() should remove the entry and report it")
        void deleteExisting() {
            var key = key();
            store.set(key, "value", Duration.ofMinutes(1)).await().atMost(TIMEOUT);

            assertTrue(store.delete(key).await().atMost(TIMEOUT));
            assertTrue(store.get(key).await().atMost(TIMEOUT).isEmpty());
        }

        @Test
        @DisplayName("delete() of an unknown key should return false")
        void deleteUnknown() {
            assertFalse(store.delete(key()).await().atMost(TIMEOUT));
        }
    }

    @Test
    @DisplayName("check() should report a healthy store")
    void healthy() {
        assertTrue(store.check().await().atMost(TIMEOUT).healthy());
    }
}
