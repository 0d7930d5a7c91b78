package tether.core.port.out;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import tether.core.model.session.DurableSession;

/**
 * Port for the durable session layer that sits beside the cache.
 */
public interface DurableSessionRepository extends StorageHealthIndicator {

    Uni<DurableSession> create(DurableSession session);

    /**
     * Replace a stored row.
     *
     * @param session the new row, matched by id
     * @return the stored row
     */
    Uni<DurableSession> update(DurableSession session);

    Uni<Optional<DurableSession>> findById(String id);

    Uni<Optional<DurableSession>> findByAccessToken(String accessToken);

    Uni<Optional<DurableSession>> findByRefreshToken(String refreshToken);

    /**
     * Active rows of one user.
     */
    Uni<List<DurableSession>> findActiveByUser(String userUuid);

    /**
     * Active rows whose refresh window ended before {@code now}.
     */
    Uni<List<DurableSession>> findExpiredActive(Instant now);

    /**
     * Delete a row.
     *
     * @return true if a row was removed
     */
    Uni<Boolean> delete(String id);

    /**
     * Delete revoked or expired rows that finished before {@code cutoff}.
     *
     * @return number of rows removed
     */
    Uni<Integer> purgeFinishedBefore(Instant cutoff);
}
