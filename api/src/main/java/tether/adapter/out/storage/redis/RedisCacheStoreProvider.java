package tether.adapter.out.storage.redis;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.jboss.logging.Logger;

import tether.core.config.ResiliencyConfig;
import tether.core.config.SessionStoreConfig;
import tether.core.port.out.CacheStore;
import tether.core.port.out.SessionMetrics;
import tether.spi.CacheStoreProvider;

/**
 * Redis cache provider, the recommended cache for production.
 */
@ApplicationScoped
public class RedisCacheStoreProvider implements CacheStoreProvider {

    private static final Logger LOG = Logger.getLogger(RedisCacheStoreProvider.class);
    private static final int PRIORITY = 100;

    private final ReactiveRedisDataSource redisDataSource;
    private final SessionStoreConfig sessionConfig;
    private final ResiliencyConfig resiliencyConfig;
    private final SessionMetrics metrics;

    private RedisCacheStore store;
    private final AtomicBoolean available = new AtomicBoolean(false);
    private final CountDownLatch checkLatch = new CountDownLatch(1);

    @Inject
    public RedisCacheStoreProvider(
            ReactiveRedisDataSource redisDataSource,
            SessionStoreConfig sessionConfig,
            ResiliencyConfig resiliencyConfig,
            SessionMetrics metrics) {
        this.redisDataSource = redisDataSource;
        this.sessionConfig = sessionConfig;
        this.resiliencyConfig = resiliencyConfig;
        this.metrics = metrics;
    }

    @PostConstruct
    void checkAvailability() {
        redisDataSource
                .key(String.class)
                .exists(sessionConfig.keyPrefix() + "health")
                .ifNoItem()
                .after(Duration.ofSeconds(5))
                .fail()
                .subscribe()
                .with(
                        result -> {
                            available.set(true);
                            checkLatch.countDown();
                            LOG.info("Redis session cache is available");
                        },
                        error -> {
                            available.set(false);
                            checkLatch.countDown();
                            LOG.warnf("Redis session cache is not available: %s", error.getMessage());
                        });
    }

    @Override
    public String name() {
        return "redis";
    }

    @Override
    public int priority() {
        return PRIORITY;
    }

    @Override
    public boolean isAvailable() {
        try {
            if (!checkLatch.await(6, TimeUnit.SECONDS)) {
                LOG.warn("Redis availability check timed out");
                return false;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
        return available.get();
    }

    @Override
    public synchronized CacheStore createStore() {
        if (store == null) {
            final var timeoutHelper = new RedisTimeoutHelper(
                    resiliencyConfig.redis().operationTimeout(), metrics, "session-cache");
            store = new RedisCacheStore(redisDataSource, timeoutHelper, sessionConfig.keyPrefix());
            LOG.infof("Created Redis session cache with prefix: %s", sessionConfig.keyPrefix());
        }
        return store;
    }

    @Override
    public Optional<HealthCheckResponse> healthCheck() {
        final var builder = HealthCheckResponse.named("session-cache-redis")
                .withData("type", "redis")
                .withData("keyPrefix", sessionConfig.keyPrefix());
        if (available.get()) {
            return Optional.of(builder.up().build());
        }
        return Optional.of(builder.down()
                .withData("error", "Redis not available or check not completed")
                .build());
    }
}
