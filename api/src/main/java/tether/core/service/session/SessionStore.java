package tether.core.service.session;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import tether.core.model.session.AuthProvider;
import tether.core.model.session.SessionRecord;
import tether.core.model.session.SessionRequest;
import tether.core.model.session.SessionStatus;
import tether.core.model.session.SessionUser;
import tether.core.model.session.TokenPair;
import tether.core.port.out.CacheStore;
import tether.core.port.out.SessionMetrics;
import tether.core.port.out.TokenIssuer;
import tether.core.service.session.SessionRecordCodec.SessionCodecException;
import tether.core.util.KeyedMutex;

/**
 * Primary CRUD surface over cached sessions.
 *
 * <p>The record is always written before its index entries and deleted before them.
 * An index entry left behind by a failure between the two steps expires with the
 * record's TTL and is filtered out of queries in the meantime.
 *
 * <p>Conditional writes compare the stored {@link SessionRecord#version()} with the
 * version the caller read and are serialized per session within this process.
 * Writers in other processes are not serialized; between them the cache keeps
 * last-write-wins semantics.
 */
@ApplicationScoped
public class SessionStore {

    private static final Logger LOG = Logger.getLogger(SessionStore.class);

    private final CacheStore cache;
    private final SessionIndex index;
    private final SessionKeys keys;
    private final SessionRecordCodec codec;
    private final ProviderTtlPolicy ttlPolicy;
    private final TokenIssuer tokenIssuer;
    private final SessionMetrics metrics;
    private final Clock clock;
    private final KeyedMutex mutex = new KeyedMutex();

    @Inject
    public SessionStore(
            CacheStore cache,
            SessionIndex index,
            SessionKeys keys,
            SessionRecordCodec codec,
            ProviderTtlPolicy ttlPolicy,
            TokenIssuer tokenIssuer,
            SessionMetrics metrics,
            Clock clock) {
        this.cache = cache;
        this.index = index;
        this.keys = keys;
        this.codec = codec;
        this.ttlPolicy = ttlPolicy;
        this.tokenIssuer = tokenIssuer;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Store a session keyed by an access token.
     *
     * @param user        user snapshot
     * @param accessToken access token the session id is derived from
     * @param provider    issuing provider
     * @param ttlOverride explicit TTL, or null for the provider TTL
     * @return false if the record could not be written
     */
    public Uni<Boolean> storeSession(SessionUser user, String accessToken, AuthProvider provider, Duration ttlOverride) {
        return storeSession(user, new TokenPair(accessToken, null, 0), provider, ttlOverride);
    }

    public Uni<Boolean> storeSession(SessionUser user, TokenPair tokens, AuthProvider provider, Duration ttlOverride) {
        return storeSession(new SessionRequest(user, provider, ttlOverride, null, null, false, null), tokens);
    }

    public Uni<Boolean> storeSession(SessionRequest request, TokenPair tokens) {
        return create(request, tokens).map(Optional::isPresent);
    }

    /**
     * Store a session and return the record written.
     *
     * <p>Index updates after a successful record write are best effort; their failure
     * is logged and does not fail the call.
     *
     * @return the stored record, or empty if the record write failed
     */
    public Uni<Optional<SessionRecord>> create(SessionRequest request, TokenPair tokens) {
        final var record = newRecord(request, tokens);
        return save(record)
                .map(saved -> saved ? Optional.of(record) : Optional.<SessionRecord>empty())
                .invoke(result -> metrics.recordSessionStored(request.provider().key(), result.isPresent()));
    }

    /**
     * Store a new session unless one already exists for the same access token.
     *
     * @return the stored record, or empty if the record write failed
     * @throws SessionVersionConflictException (as a failed Uni) if a session with the same id exists
     */
    public Uni<Optional<SessionRecord>> createIfAbsent(SessionRequest request, TokenPair tokens) {
        final var record = newRecord(request, tokens);
        return mutex.withLock(record.id(), () -> getSession(record.id()).flatMap(current -> {
                    if (current.isPresent()) {
                        return Uni.createFrom().<Boolean>failure(new SessionVersionConflictException(
                                record.id(), "already exists at version " + current.get().version()));
                    }
                    return writeRecord(record);
                }))
                .flatMap(written -> written
                        ? indexBestEffort(record).replaceWith(Optional.of(record))
                        : Uni.createFrom().item(Optional.<SessionRecord>empty()))
                .invoke(result -> metrics.recordSessionStored(request.provider().key(), result.isPresent()));
    }

    private SessionRecord newRecord(SessionRequest request, TokenPair tokens) {
        final var ttl = ttlPolicy.resolve(request.provider(), request.ttlOverride());
        final var now = clock.instant();
        return new SessionRecord(
                tokenIssuer.sessionIdFor(tokens.accessToken()),
                tokens.accessToken(),
                tokens.refreshToken(),
                request.provider(),
                request.user(),
                now,
                now,
                SessionStatus.ACTIVE,
                ttl.toSeconds(),
                request.ipAddress(),
                request.userAgent(),
                Map.of(),
                1);
    }

    /**
     * Write a record as-is and index it, replacing whatever the cache holds for its id.
     *
     * @return false if the record write failed
     */
    public Uni<Boolean> save(SessionRecord record) {
        return mutex.withLock(record.id(), () -> writeRecord(record))
                .onFailure()
                .recoverWithItem(e -> {
                    LOG.warnf("Failed to write session %s: %s", record.id(), e.getMessage());
                    return false;
                })
                .flatMap(written -> {
                    if (!written) {
                        return Uni.createFrom().item(false);
                    }
                    LOG.debugf(
                            "Stored session %s (provider=%s, ttl=%ds)",
                            record.id(), record.provider().key(), record.ttlSeconds());
                    return indexBestEffort(record).replaceWith(true);
                });
    }

    public Uni<Optional<SessionRecord>> getSession(String sessionId) {
        return cache.get(keys.session(sessionId)).map(value -> value.flatMap(v -> decode(sessionId, v)));
    }

    public Uni<Optional<SessionRecord>> getSessionByAccessToken(String accessToken) {
        return getSession(tokenIssuer.sessionIdFor(accessToken))
                .map(found -> found.filter(r -> accessToken.equals(r.accessToken())));
    }

    public Uni<Optional<SessionRecord>> getSessionByRefreshToken(String refreshToken) {
        return cache.get(keys.refreshMapping(refreshToken)).flatMap(sessionId -> {
            if (sessionId.isEmpty()) {
                return Uni.createFrom().item(Optional.<SessionRecord>empty());
            }
            return getSession(sessionId.get()).map(found -> found.filter(r -> refreshToken.equals(r.refreshToken())));
        });
    }

    /**
     * Destroy the session of an access token.
     *
     * @return true if a session was destroyed; false if none existed or the cache failed
     */
    public Uni<Boolean> destroySession(String accessToken) {
        return getSessionByAccessToken(accessToken)
                .flatMap(found -> found.map(this::removeSession).orElseGet(() -> Uni.createFrom().item(false)))
                .onFailure()
                .recoverWithItem(e -> {
                    LOG.warnf("Failed to destroy session: %s", e.getMessage());
                    return false;
                });
    }

    /**
     * Delete a session and its index entries regardless of version.
     *
     * <p>Cache failures on the record delete propagate; index cleanup is best effort.
     *
     * @return true if the record existed
     */
    public Uni<Boolean> removeSession(SessionRecord record) {
        return mutex.withLock(record.id(), () -> cache.delete(keys.session(record.id())))
                .flatMap(deleted -> unindexBestEffort(record).replaceWith(deleted));
    }

    /**
     * Delete a session only if it still has the version the caller read.
     *
     * @param expected the record as read by the caller
     * @return true if deleted; false if the session is gone or was changed meanwhile
     */
    public Uni<Boolean> removeIfUnchanged(SessionRecord expected) {
        return mutex.withLock(expected.id(), () -> getSession(expected.id()).flatMap(current -> {
                    if (current.isEmpty() || current.get().version() != expected.version()) {
                        return Uni.createFrom().item(false);
                    }
                    return cache.delete(keys.session(expected.id())).replaceWith(true);
                }))
                .flatMap(deleted -> deleted
                        ? unindexBestEffort(expected).replaceWith(true)
                        : Uni.createFrom().item(false));
    }

    /**
     * Replace a session if it still has {@code expectedVersion}.
     *
     * <p>The new record is written with the next version and its own TTL. When the
     * provider changed, the entry in the previous provider's index is removed.
     *
     * @param updated         the new record content
     * @param expectedVersion version the caller read
     * @return the record as written, or empty if the session is gone or was changed meanwhile
     */
    public Uni<Optional<SessionRecord>> replaceSession(SessionRecord updated, long expectedVersion) {
        return mutex.withLock(updated.id(), () -> getSession(updated.id()).flatMap(current -> {
            if (current.isEmpty() || current.get().version() != expectedVersion) {
                return Uni.createFrom().item(Optional.<SessionRecord>empty());
            }
            final var previous = current.get();
            final var next = updated.withVersion(expectedVersion + 1);
            return writeRecord(next).flatMap(written -> {
                if (!written) {
                    return Uni.createFrom()
                            .<Optional<SessionRecord>>failure(
                                    new IllegalStateException("Cache rejected write of session " + next.id()));
                }
                return reindex(previous, next).replaceWith(Optional.of(next));
            });
        }));
    }

    /**
     * Put a session back to an earlier state.
     *
     * <p>The write only happens while the session is in the state the caller left it in:
     * absent when {@code expectedVersion} is null, otherwise at that version. A session
     * that already equals {@code original} is left alone, so replaying a restore twice is
     * harmless.
     *
     * @param original        state to restore, written with its own TTL and version
     * @param expectedVersion version the session should currently have, or null if it should be absent
     * @return true if written, false if it was already restored
     * @throws SessionVersionConflictException (as a failed Uni) if somebody else changed the session
     */
    public Uni<Boolean> restoreSession(SessionRecord original, Long expectedVersion) {
        return mutex.withLock(original.id(), () -> getSession(original.id()).flatMap(current -> {
            if (current.isPresent() && current.get().equals(original)) {
                return indexBestEffort(original).replaceWith(false);
            }
            if (expectedVersion == null && current.isPresent()) {
                return Uni.createFrom().<Boolean>failure(new SessionVersionConflictException(
                        original.id(), "was recreated at version " + current.get().version()));
            }
            if (expectedVersion != null && current.isEmpty()) {
                return Uni.createFrom()
                        .<Boolean>failure(new SessionVersionConflictException(original.id(), "no longer exists"));
            }
            if (expectedVersion != null && current.get().version() != expectedVersion) {
                return Uni.createFrom().<Boolean>failure(new SessionVersionConflictException(
                        original.id(),
                        "is at version " + current.get().version() + ", expected " + expectedVersion));
            }
            return writeRecord(original).flatMap(written -> {
                if (!written) {
                    return Uni.createFrom()
                            .<Boolean>failure(
                                    new IllegalStateException("Cache rejected write of session " + original.id()));
                }
                final Uni<Void> cleanup = current.map(previous -> reindex(previous, original))
                        .orElseGet(() -> indexBestEffort(original));
                return cleanup.replaceWith(true);
            });
        }));
    }

    /**
     * Delete a session created earlier if it still has {@code expectedVersion}.
     *
     * @return true if deleted, false if it was already gone
     * @throws SessionVersionConflictException (as a failed Uni) if somebody else changed the session
     */
    public Uni<Boolean> discardSession(String sessionId, long expectedVersion) {
        return mutex.withLock(sessionId, () -> getSession(sessionId).flatMap(current -> {
            if (current.isEmpty()) {
                return Uni.createFrom().item(false);
            }
            if (current.get().version() != expectedVersion) {
                return Uni.createFrom().<Boolean>failure(new SessionVersionConflictException(
                        sessionId, "is at version " + current.get().version() + ", expected " + expectedVersion));
            }
            final var record = current.get();
            return cache.delete(keys.session(sessionId))
                    .flatMap(deleted -> unindexBestEffort(record).replaceWith(true));
        }));
    }

    /**
     * Destroy every cached session of a user.
     *
     * @return number of sessions destroyed
     */
    public Uni<Integer> destroyUserSessions(String userUuid) {
        return index.userSessionIds(userUuid)
                .onItem()
                .transformToMulti(ids -> Multi.createFrom().iterable(ids))
                .onItem()
                .transformToUniAndConcatenate(id -> getSession(id)
                        .flatMap(found -> found.map(this::removeSession).orElseGet(() -> Uni.createFrom().item(false)))
                        .onFailure()
                        .recoverWithItem(e -> {
                            LOG.warnf("Failed to destroy session %s of user: %s", id, e.getMessage());
                            return false;
                        }))
                .filter(Boolean::booleanValue)
                .collect()
                .asList()
                .map(List::size);
    }

    public Uni<List<SessionRecord>> listByProvider(AuthProvider provider) {
        return index.query().whereProvider(provider).get();
    }

    public SessionQuery query() {
        return index.query();
    }

    public Duration getProviderTtl(AuthProvider provider) {
        return ttlPolicy.ttlFor(provider);
    }

    public Duration resolveTtl(AuthProvider provider, Duration override) {
        return ttlPolicy.resolve(provider, override);
    }

    public String sessionIdFor(String accessToken) {
        return tokenIssuer.sessionIdFor(accessToken);
    }

    private Uni<Boolean> writeRecord(SessionRecord record) {
        return cache.set(keys.session(record.id()), codec.encode(record), record.ttl());
    }

    private Uni<Void> index(SessionRecord record) {
        final Uni<Void> refresh = record.refreshToken() == null
                ? Uni.createFrom().voidItem()
                : cache.set(keys.refreshMapping(record.refreshToken()), record.id(), record.ttl())
                        .replaceWithVoid();
        return refresh.chain(() -> index.indexByProvider(record.provider(), record.id(), record.ttl()))
                .chain(() -> index.indexByUser(record.user().uuid(), record.id(), record.ttl()));
    }

    private Uni<Void> indexBestEffort(SessionRecord record) {
        return index(record).onFailure().recoverWithItem(e -> {
            LOG.warnf("Failed to index session %s, entry will be missing from queries: %s", record.id(),
                    e.getMessage());
            return null;
        });
    }

    private Uni<Void> reindex(SessionRecord previous, SessionRecord next) {
        Uni<Void> cleanup = Uni.createFrom().voidItem();
        if (previous.provider() != next.provider()) {
            cleanup = cleanup.chain(() -> index.removeFromProviderIndex(previous.provider(), previous.id()));
        }
        if (previous.refreshToken() != null && !previous.refreshToken().equals(next.refreshToken())) {
            cleanup = cleanup.chain(() -> cache.delete(keys.refreshMapping(previous.refreshToken()))
                    .replaceWithVoid());
        }
        return cleanup.chain(() -> index(next)).onFailure().recoverWithItem(e -> {
            LOG.warnf("Failed to reindex session %s: %s", next.id(), e.getMessage());
            return null;
        });
    }

    private Uni<Void> unindexBestEffort(SessionRecord record) {
        final Uni<Void> refresh = record.refreshToken() == null
                ? Uni.createFrom().voidItem()
                : cache.delete(keys.refreshMapping(record.refreshToken())).replaceWithVoid();
        return refresh.chain(() -> index.removeFromProviderIndex(record.provider(), record.id()))
                .chain(() -> index.removeFromUserIndex(record.user().uuid(), record.id()))
                .onFailure()
                .recoverWithItem(e -> {
                    LOG.warnf("Failed to unindex session %s, stale entries expire with their TTL: %s",
                            record.id(), e.getMessage());
                    return null;
                });
    }

    private Optional<SessionRecord> decode(String sessionId, String value) {
        try {
            return Optional.of(codec.decode(value));
        } catch (SessionCodecException e) {
            LOG.warnf("Ignoring corrupt session entry %s: %s", sessionId, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Thrown when a conditional write finds that the session was changed by another writer.
     */
    public static class SessionVersionConflictException extends RuntimeException {

        private final String sessionId;

        public SessionVersionConflictException(String sessionId, String detail) {
            super("Session " + sessionId + " " + detail);
            this.sessionId = sessionId;
        }

        public String sessionId() {
            return sessionId;
        }
    }
}
