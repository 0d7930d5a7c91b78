package tether.adapter.out.telemetry;

import java.util.concurrent.TimeUnit;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import tether.core.config.SessionStoreConfig;
import tether.core.model.transaction.OperationType;
import tether.core.model.transaction.TransactionState;
import tether.core.port.out.SessionMetrics;

/**
 * Micrometer implementation of SessionMetrics.
 *
 * <p>Records:
 * <ul>
 *   <li>{@code tether.session.stored} - Session writes by provider and outcome</li>
 *   <li>{@code tether.session.lookups} - Lookups by layer and hit/miss</li>
 *   <li>{@code tether.session.revoked} - Revocations by provider</li>
 *   <li>{@code tether.session.inconsistencies} - Cache and durable layers out of step</li>
 *   <li>{@code tether.session.bulk.affected} / {@code tether.session.bulk.failed} - Bulk operation results</li>
 *   <li>{@code tether.session.transactions} - Finished transactions by state, with duration</li>
 *   <li>{@code tether.session.cleanup.removed} - Sessions expired or purged by cleanup</li>
 *   <li>{@code tether.storage.timeouts} / {@code tether.storage.failures} - Backend errors</li>
 * </ul>
 */
@ApplicationScoped
public class MicrometerSessionMetrics implements SessionMetrics {

    private final MeterRegistry registry;
    private final boolean enabled;

    @Inject
    public MicrometerSessionMetrics(MeterRegistry registry, SessionStoreConfig config) {
        this.registry = registry;
        this.enabled = config == null || config.metrics().enabled();
    }

    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public void recordSessionStored(String provider, boolean success) {
        if (!enabled) {
            return;
        }
        Counter.builder("tether.session.stored")
                .description("Session writes")
                .tag("provider", nullSafe(provider))
                .tag("outcome", success ? "success" : "failure")
                .register(registry)
                .increment();
    }

    @Override
    public void recordSessionLookup(String layer, boolean hit) {
        if (!enabled) {
            return;
        }
        Counter.builder("tether.session.lookups")
                .description("Session lookups")
                .tag("layer", nullSafe(layer))
                .tag("result", hit ? "hit" : "miss")
                .register(registry)
                .increment();
    }

    @Override
    public void recordSessionRevoked(String provider) {
        if (!enabled) {
            return;
        }
        Counter.builder("tether.session.revoked")
                .description("Revoked sessions")
                .tag("provider", nullSafe(provider))
                .register(registry)
                .increment();
    }

    @Override
    public void recordStorageInconsistency(String operation) {
        if (!enabled) {
            return;
        }
        Counter.builder("tether.session.inconsistencies")
                .description("Operations that left the cache and durable layers out of step")
                .tag("operation", nullSafe(operation))
                .register(registry)
                .increment();
    }

    @Override
    public void recordBulkOperation(OperationType type, int affected, int failed) {
        if (!enabled) {
            return;
        }
        final String operation = type.name().toLowerCase();
        Counter.builder("tether.session.bulk.affected")
                .description("Sessions changed by bulk operations")
                .tag("operation", operation)
                .register(registry)
                .increment(affected);
        if (failed > 0) {
            Counter.builder("tether.session.bulk.failed")
                    .description("Sessions a bulk operation failed to change")
                    .tag("operation", operation)
                    .register(registry)
                    .increment(failed);
        }
    }

    @Override
    public void recordTransactionFinished(TransactionState state, long durationMs) {
        if (!enabled) {
            return;
        }
        Timer.builder("tether.session.transactions")
                .description("Finished session transactions")
                .tag("state", state.name().toLowerCase())
                .register(registry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }

    @Override
    public void recordCleanup(String kind, int removed) {
        if (!enabled) {
            return;
        }
        Counter.builder("tether.session.cleanup.removed")
                .description("Sessions removed by cleanup")
                .tag("kind", nullSafe(kind))
                .register(registry)
                .increment(removed);
    }

    @Override
    public void recordStorageTimeout(String backend, String operation) {
        if (!enabled) {
            return;
        }
        Counter.builder("tether.storage.timeouts")
                .description("Storage operations that timed out")
                .tag("backend", nullSafe(backend))
                .tag("operation", nullSafe(operation))
                .register(registry)
                .increment();
    }

    @Override
    public void recordStorageFailure(String backend, String operation) {
        if (!enabled) {
            return;
        }
        Counter.builder("tether.storage.failures")
                .description("Storage operations that failed")
                .tag("backend", nullSafe(backend))
                .tag("operation", nullSafe(operation))
                .register(registry)
                .increment();
    }

    private static String nullSafe(String value) {
        return value != null ? value : "unknown";
    }
}
