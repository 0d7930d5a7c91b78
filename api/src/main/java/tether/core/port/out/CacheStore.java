package tether.core.port.out;

import java.time.Duration;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

/**
 * Port for the key-value cache that holds sessions and their indexes.
 *
 * <p>Every operation is atomic for its single key; nothing is atomic across keys.
 * Substrate errors surface as failed {@link Uni}s.
 */
public interface CacheStore extends StorageHealthIndicator {

    /**
     * Read a value.
     *
     * @param key cache key
     * @return the value, or empty on a miss
     */
    Uni<Optional<String>> get(String key);

    /**
     * Write a value with a TTL.
     *
     * @param key   cache key
     * @param value value
     * @param ttl   time until the entry expires, must be positive
     * @return true if the value was written
     */
    Uni<Boolean> set(String key, String value, Duration ttl);

    /**
     * Delete a value.
     *
     * @param key cache key
     * @return true if an entry was removed
     */
    Uni<Boolean> delete(String key);

    /**
     * Remaining lifetime of an entry.
     *
     * @param key cache key
     * @return remaining TTL, or empty if the key is absent
     */
    Uni<Optional<Duration>> remainingTtl(String key);
}
