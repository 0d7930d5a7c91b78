package tether.adapter.out.storage.memory;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import tether.core.model.common.StorageHealth;
import tether.core.model.session.DurableSession;
import tether.core.model.session.SessionStatus;
import tether.core.port.out.DurableSessionRepository;

/**
 * In-memory implementation of DurableSessionRepository.
 *
 * <p>Rows are lost on restart. Token lookups scan all rows, which is fine for
 * development and tests but not for production volumes.
 */
public class InMemoryDurableSessionRepository implements DurableSessionRepository {

    private static final Logger LOG = Logger.getLogger(InMemoryDurableSessionRepository.class);

    private final ConcurrentMap<String, DurableSession> sessions = new ConcurrentHashMap<>();

    @Override
    public Uni<DurableSession> create(DurableSession session) {
        return Uni.createFrom().item(() -> {
            final DurableSession existing = sessions.putIfAbsent(session.id(), session);
            if (existing != null) {
                throw new IllegalStateException("Durable session already exists: " + session.id());
            }
            LOG.debugf("Durable session created: %s for user %s", session.id(), session.user().uuid());
            return session;
        });
    }

    @Override
    public Uni<DurableSession> update(DurableSession session) {
        return Uni.createFrom().item(() -> {
            if (sessions.replace(session.id(), session) == null) {
                throw new IllegalStateException("Durable session not found: " + session.id());
            }
            return session;
        });
    }

    @Override
    public Uni<Optional<DurableSession>> findById(String id) {
        return Uni.createFrom().item(() -> Optional.ofNullable(sessions.get(id)));
    }

    @Override
    public Uni<Optional<DurableSession>> findByAccessToken(String accessToken) {
        return Uni.createFrom().item(() -> sessions.values().stream()
                .filter(s -> Objects.equals(s.accessToken(), accessToken))
                .findFirst());
    }

    @Override
    public Uni<Optional<DurableSession>> findByRefreshToken(String refreshToken) {
        if (refreshToken == null) {
            return Uni.createFrom().item(Optional.empty());
        }
        return Uni.createFrom().item(() -> sessions.values().stream()
                .filter(s -> refreshToken.equals(s.refreshToken()))
                .findFirst());
    }

    @Override
    public Uni<List<DurableSession>> findActiveByUser(String userUuid) {
        return Uni.createFrom().item(() -> sessions.values().stream()
                .filter(s -> s.status() == SessionStatus.ACTIVE)
                .filter(s -> s.user().uuid().equals(userUuid))
                .sorted(Comparator.comparing(DurableSession::createdAt))
                .toList());
    }

    @Override
    public Uni<List<DurableSession>> findExpiredActive(Instant now) {
        return Uni.createFrom().item(() -> sessions.values().stream()
                .filter(s -> s.status() == SessionStatus.ACTIVE)
                .filter(s -> s.refreshExpiresAt() != null && !s.refreshExpiresAt().isAfter(now))
                .sorted(Comparator.comparing(DurableSession::createdAt))
                .toList());
    }

    @Override
    public Uni<Boolean> delete(String id) {
        return Uni.createFrom().item(() -> sessions.remove(id) != null);
    }

    @Override
    public Uni<Integer> purgeFinishedBefore(Instant cutoff) {
        return Uni.createFrom().item(() -> {
            final int before = sessions.size();
            sessions.values()
                    .removeIf(s -> s.finishedAt().map(f -> f.isBefore(cutoff)).orElse(false));
            return before - sessions.size();
        });
    }

    @Override
    public Uni<StorageHealth> check() {
        return Uni.createFrom().item(StorageHealth.healthy("memory", 0));
    }

    public int getSessionCount() {
        return sessions.size();
    }
}
