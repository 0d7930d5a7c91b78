package tether.adapter.out.storage.redis;

import java.time.Duration;
import java.util.function.Supplier;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import tether.core.port.out.SessionMetrics;

/**
 * Applies the configured timeout to Redis operations.
 *
 * <ul>
 *   <li>{@link #withTimeout} fails fast with {@link RedisTimeoutException}. Session
 *       reads and writes use it so the session layer sees the failure.</li>
 *   <li>{@link #withTimeoutFallback} returns a fallback on timeout or failure. Health
 *       probes use it.</li>
 * </ul>
 */
public class RedisTimeoutHelper {

    private static final Logger LOG = Logger.getLogger(RedisTimeoutHelper.class);
    private static final String BACKEND = "redis";

    private final Duration timeout;
    private final SessionMetrics metrics;
    private final String storeName;

    /**
     * @param timeout   timeout for each operation
     * @param metrics   metrics sink, may be null
     * @param storeName store name used in logs
     */
    public RedisTimeoutHelper(Duration timeout, SessionMetrics metrics, String storeName) {
        this.timeout = timeout;
        this.metrics = metrics;
        this.storeName = storeName;
    }

    public <T> Uni<T> withTimeout(Uni<T> operation, String operationName) {
        return operation
                .ifNoItem()
                .after(timeout)
                .failWith(() -> {
                    LOG.warnv("Redis operation timeout: {0} in {1} after {2}", operationName, storeName, timeout);
                    if (metrics != null) {
                        metrics.recordStorageTimeout(BACKEND, operationName);
                    }
                    return new RedisTimeoutException(operationName, storeName);
                })
                .onFailure(e -> !(e instanceof RedisTimeoutException))
                .invoke(e -> {
                    if (metrics != null) {
                        metrics.recordStorageFailure(BACKEND, operationName);
                    }
                });
    }

    public <T> Uni<T> withTimeoutFallback(Uni<T> operation, String operationName, Supplier<T> fallback) {
        return withTimeout(operation, operationName).onFailure().recoverWithItem(error -> {
            LOG.debugv("Redis operation {0} in {1} fell back: {2}", operationName, storeName, error.getMessage());
            return fallback.get();
        });
    }

    public Duration timeout() {
        return timeout;
    }

    /**
     * A Redis operation did not answer within the configured timeout.
     */
    public static class RedisTimeoutException extends RuntimeException {
        private final String operation;

        public RedisTimeoutException(String operation, String store) {
            super("Redis operation timeout: " + operation + " in " + store);
            this.operation = operation;
        }

        public String getOperation() {
            return operation;
        }
    }
}
