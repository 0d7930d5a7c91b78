package tether.adapter.in.health;

import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.health.api.AsyncHealthCheck;
import io.smallrye.mutiny.Uni;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.HealthCheckResponseBuilder;
import org.eclipse.microprofile.health.Readiness;

import tether.core.model.common.StorageHealth;
import tether.core.port.in.TokenStorage;
import tether.core.service.session.CacheStoreProviderRegistry;
import tether.core.service.session.DurableStorageProviderRegistry;

/**
 * Readiness check for the session cache and the durable session layer.
 *
 * <p>DOWN when either layer fails its probe. Each layer's provider, latency and
 * message are reported as data.
 */
@Readiness
@ApplicationScoped
public class SessionStorageHealthCheck implements AsyncHealthCheck {

    private final TokenStorage tokenStorage;
    private final CacheStoreProviderRegistry cacheRegistry;
    private final DurableStorageProviderRegistry durableRegistry;

    @Inject
    public SessionStorageHealthCheck(
            TokenStorage tokenStorage,
            CacheStoreProviderRegistry cacheRegistry,
            DurableStorageProviderRegistry durableRegistry) {
        this.tokenStorage = tokenStorage;
        this.cacheRegistry = cacheRegistry;
        this.durableRegistry = durableRegistry;
    }

    @Override
    public Uni<HealthCheckResponse> call() {
        return tokenStorage.getStorageHealth().map(report -> {
            final HealthCheckResponseBuilder builder = HealthCheckResponse.named("session-storage")
                    .withData("status", report.overall())
                    .withData("cache.provider", cacheRegistry.getSelectedProvider().name())
                    .withData("durable.provider", durableRegistry.getSelectedProvider().name());
            describe(builder, "cache", report.cache());
            describe(builder, "durable", report.persistent());
            copyProviderData(builder, "cache", cacheRegistry.getSelectedProvider().healthCheck());
            copyProviderData(builder, "durable", durableRegistry.getSelectedProvider().healthCheck());
            return builder.status(report.healthy()).build();
        });
    }

    private static void describe(HealthCheckResponseBuilder builder, String layer, StorageHealth health) {
        builder.withData(layer + ".healthy", health.healthy());
        builder.withData(layer + ".message", health.message() != null ? health.message() : "");
        if (health.latencyMs() >= 0) {
            builder.withData(layer + ".latencyMs", health.latencyMs());
        }
    }

    private static void copyProviderData(
            HealthCheckResponseBuilder builder, String layer, Optional<HealthCheckResponse> response) {
        response.flatMap(HealthCheckResponse::getData).ifPresent(data -> data.forEach((key, value) -> {
            final String name = layer + "." + key;
            if (value instanceof Boolean flag) {
                builder.withData(name, flag);
            } else if (value instanceof Number number) {
                builder.withData(name, number.longValue());
            } else {
                builder.withData(name, String.valueOf(value));
            }
        }));
    }
}
