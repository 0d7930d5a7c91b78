package tether.core.service.session;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.quarkus.scheduler.Scheduled;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import tether.core.config.SessionStoreConfig;
import tether.core.port.in.TokenStorage;

/**
 * Periodic cleanup of the durable session layer.
 *
 * <p>Marks sessions past their refresh window as expired and drops their cache
 * entries, then purges revoked or expired rows older than the retention window.
 * Disabled with {@code tether.session.cleanup.enabled=false}.
 */
@ApplicationScoped
public class SessionMaintenanceService {

    private static final Logger LOG = Logger.getLogger(SessionMaintenanceService.class);

    private final TokenStorage tokenStorage;
    private final SessionStoreConfig config;

    @Inject
    public SessionMaintenanceService(TokenStorage tokenStorage, SessionStoreConfig config) {
        this.tokenStorage = tokenStorage;
        this.config = config;
    }

    @Scheduled(
            every = "${tether.session.cleanup.interval:15m}",
            delayed = "1m",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    public Uni<Void> runCleanup() {
        if (!config.cleanup().enabled()) {
            return Uni.createFrom().voidItem();
        }

        LOG.debug("Running session cleanup...");

        return tokenStorage
                .cleanupExpiredSessions()
                .flatMap(expired -> tokenStorage.purgeRevokedSessions().map(purged -> {
                    LOG.debugf("Session cleanup finished: %d expired, %d purged", expired, purged);
                    return purged;
                }))
                .replaceWithVoid()
                .onFailure()
                .invoke(e -> LOG.error("Session cleanup failed", e));
    }
}
