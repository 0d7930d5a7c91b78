package tether.adapter.out.storage.redis;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.quarkus.redis.datasource.keys.ReactiveKeyCommands;
import io.quarkus.redis.datasource.value.ReactiveValueCommands;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import tether.core.model.common.StorageHealth;
import tether.core.port.out.CacheStore;

/**
 * Redis implementation of CacheStore.
 *
 * <p>Values are plain strings written with PSETEX so every key carries its own TTL
 * and Redis expires it. Keys are used as given; the session layer prefixes them.
 */
public class RedisCacheStore implements CacheStore {

    private static final Logger LOG = Logger.getLogger(RedisCacheStore.class);

    private final ReactiveValueCommands<String, String> valueCommands;
    private final ReactiveKeyCommands<String> keyCommands;
    private final RedisTimeoutHelper timeoutHelper;
    private final String healthKey;

    public RedisCacheStore(ReactiveRedisDataSource redisDataSource, RedisTimeoutHelper timeoutHelper, String keyPrefix) {
        this.valueCommands = redisDataSource.value(String.class, String.class);
        this.keyCommands = redisDataSource.key(String.class);
        this.timeoutHelper = timeoutHelper;
        this.healthKey = keyPrefix + "health";
    }

    @Override
    public Uni<Optional<String>> get(String key) {
        return timeoutHelper.withTimeout(valueCommands.get(key).map(Optional::ofNullable), "get");
    }

    @Override
    public Uni<Boolean> set(String key, String value, Duration ttl) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            return Uni.createFrom().failure(new IllegalArgumentException("TTL must be positive: " + ttl));
        }
        final var operation = valueCommands.psetex(key, ttl.toMillis(), value).replaceWith(true);
        return timeoutHelper.withTimeout(operation, "set");
    }

    @Override
    public Uni<Boolean> delete(String key) {
        return timeoutHelper.withTimeout(keyCommands.del(key).map(removed -> removed > 0), "delete");
    }

    @Override
    public Uni<Optional<Duration>> remainingTtl(String key) {
        final var operation = keyCommands.pttl(key).map(millis -> {
            if (millis == -2) {
                return Optional.<Duration>empty();
            }
            if (millis == -1) {
                LOG.debugf("Key without expiry found in session cache: %s", key);
                return Optional.of(ChronoUnit.FOREVER.getDuration());
            }
            return Optional.of(Duration.ofMillis(millis));
        });
        return timeoutHelper.withTimeout(operation, "remainingTtl");
    }

    @Override
    public Uni<StorageHealth> check() {
        final long start = System.nanoTime();
        final var probe = keyCommands
                .exists(healthKey)
                .map(ignored -> StorageHealth.healthy("redis", (System.nanoTime() - start) / 1_000_000));
        return timeoutHelper.withTimeoutFallback(
                probe, "check", () -> StorageHealth.unhealthy("redis", "Redis did not answer"));
    }
}
