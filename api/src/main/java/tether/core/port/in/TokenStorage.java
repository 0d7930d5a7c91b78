package tether.core.port.in;

import java.util.Optional;

import io.smallrye.mutiny.Uni;

import tether.core.model.common.StorageHealthReport;
import tether.core.model.session.SessionRecord;
import tether.core.model.session.SessionRequest;
import tether.core.model.session.TokenPair;

/**
 * Port for session storage that spans the cache and the durable layer.
 *
 * <p>Writes go to the durable layer first and the cache second; reads go to the cache
 * first and fall back to the durable layer. A write that reaches only one layer is
 * reported as a failure and as a storage inconsistency, never repaired implicitly.
 */
public interface TokenStorage {

    /**
     * Store a new session in both layers.
     *
     * @param request session input
     * @param tokens  tokens the session is keyed by
     * @return true only if both layers accepted the session
     */
    Uni<Boolean> storeSession(SessionRequest request, TokenPair tokens);

    /**
     * Rotate the tokens of a session.
     *
     * <p>After success the previous access and refresh tokens no longer resolve.
     *
     * @param identifier current refresh or access token
     * @param newTokens  replacement tokens
     * @return true if both layers were rotated
     */
    Uni<Boolean> updateSessionTokens(String identifier, TokenPair newTokens);

    Uni<Optional<SessionRecord>> getSessionByAccessToken(String accessToken);

    Uni<Optional<SessionRecord>> getSessionByRefreshToken(String refreshToken);

    /**
     * Revoke one session in both layers.
     *
     * @param identifier refresh or access token
     * @return true if both layers were updated
     */
    Uni<Boolean> revokeSession(String identifier);

    Uni<Boolean> revokeAllUserSessions(String userUuid);

    /**
     * Expire durable rows whose refresh window has ended and drop their cache entries.
     *
     * @return number of rows expired
     */
    Uni<Integer> cleanupExpiredSessions();

    /**
     * Delete durable rows revoked or expired longer ago than the retention window.
     *
     * @return number of rows deleted
     */
    Uni<Integer> purgeRevokedSessions();

    /**
     * Compare both layers' view of one session.
     *
     * @param identifier refresh or access token
     * @return true if the layers agree, including when neither knows the session
     */
    Uni<Boolean> validateStorageConsistency(String identifier);

    /**
     * Rewrite the cache entry of a session from the durable layer.
     *
     * @param identifier refresh or access token
     * @return true if the cache now matches the durable row
     */
    Uni<Boolean> resyncSession(String identifier);

    Uni<StorageHealthReport> getStorageHealth();
}
