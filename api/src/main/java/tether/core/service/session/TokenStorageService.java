package tether.core.service.session;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import tether.core.config.SessionStoreConfig;
import tether.core.model.common.StorageHealth;
import tether.core.model.common.StorageHealthReport;
import tether.core.model.session.DurableSession;
import tether.core.model.session.SessionRecord;
import tether.core.model.session.SessionRequest;
import tether.core.model.session.SessionStatus;
import tether.core.model.session.TokenPair;
import tether.core.port.in.TokenStorage;
import tether.core.port.out.CacheStore;
import tether.core.port.out.DurableSessionRepository;
import tether.core.port.out.SessionMetrics;
import tether.core.port.out.StorageHealthIndicator;
import tether.core.util.SecureHash;

/**
 * Keeps the session cache and the durable session layer in step.
 *
 * <p>Writes are durable-first so success is never reported for a session that only
 * lives in the cache. Reads are cache-first and repopulate the cache from active,
 * unexpired durable rows. When an operation reaches one layer but not the other it
 * returns false, logs a warning and records an inconsistency metric; it never
 * repairs the other layer on its own. {@link #resyncSession(String)} is the explicit
 * repair.
 */
@ApplicationScoped
public class TokenStorageService implements TokenStorage {

    private static final Logger LOG = Logger.getLogger(TokenStorageService.class);

    private final SessionStore store;
    private final DurableSessionRepository durable;
    private final CacheStore cache;
    private final SessionStoreConfig config;
    private final SessionMetrics metrics;
    private final Clock clock;

    @Inject
    public TokenStorageService(
            SessionStore store,
            DurableSessionRepository durable,
            CacheStore cache,
            SessionStoreConfig config,
            SessionMetrics metrics,
            Clock clock) {
        this.store = store;
        this.durable = durable;
        this.cache = cache;
        this.config = config;
        this.metrics = metrics;
        this.clock = clock;
    }

    @Override
    public Uni<Boolean> storeSession(SessionRequest request, TokenPair tokens) {
        final var now = clock.instant();
        final var row = new DurableSession(
                UUID.randomUUID().toString(),
                request.user(),
                request.provider(),
                tokens.accessToken(),
                tokens.refreshToken(),
                accessExpiry(tokens, now),
                refreshExpiry(tokens, request.rememberMe(), now),
                SessionStatus.ACTIVE,
                now,
                now,
                null,
                request.ipAddress(),
                request.userAgent(),
                request.rememberMe());

        return durable.create(row)
                .replaceWith(true)
                .onFailure()
                .recoverWithItem(e -> {
                    LOG.warnf("Durable write failed for user %s: %s", request.user().uuid(), e.getMessage());
                    return false;
                })
                .flatMap(stored -> {
                    if (!stored) {
                        return Uni.createFrom().item(false);
                    }
                    return store.create(request, tokens).flatMap(cached -> {
                        if (cached.isPresent()) {
                            LOG.debugf("Stored session %s in both layers", row.id());
                            return Uni.createFrom().item(true);
                        }
                        LOG.warnf("Cache write failed for session %s, removing durable row", row.id());
                        return durable.delete(row.id())
                                .onFailure()
                                .recoverWithItem(e -> {
                                    reportInconsistency("storeSession", row.id(), e.getMessage());
                                    return false;
                                })
                                .replaceWith(false);
                    });
                });
    }

    @Override
    public Uni<Boolean> updateSessionTokens(String identifier, TokenPair newTokens) {
        return resolveDurable(identifier).flatMap(row -> {
            if (row.isEmpty() || !row.get().isUsable(clock.instant())) {
                LOG.debugf("No usable durable session for token %s", fingerprint(identifier));
                return Uni.createFrom().item(false);
            }
            final var now = clock.instant();
            final var current = row.get();
            final var rotated = current.withTokens(
                    newTokens, accessExpiry(newTokens, now), refreshExpiry(newTokens, current.rememberMe(), now), now);

            return durable.update(rotated)
                    .replaceWith(true)
                    .onFailure()
                    .recoverWithItem(e -> {
                        LOG.warnf("Durable token rotation failed for %s: %s", current.id(), e.getMessage());
                        return false;
                    })
                    .flatMap(updated -> updated ? rotateCached(identifier, rotated) : Uni.createFrom().item(false));
        });
    }

    private Uni<Boolean> rotateCached(String identifier, DurableSession rotated) {
        return resolveCached(identifier)
                .flatMap(previous -> {
                    final var replacement = previous.map(old -> new SessionRecord(
                                    store.sessionIdFor(rotated.accessToken()),
                                    rotated.accessToken(),
                                    rotated.refreshToken(),
                                    old.provider(),
                                    old.user(),
                                    old.createdAt(),
                                    clock.instant(),
                                    old.status(),
                                    old.ttlSeconds(),
                                    old.ipAddress(),
                                    old.userAgent(),
                                    old.attributes(),
                                    1))
                            .orElseGet(() -> toCacheRecord(rotated, rotated.accessExpiresAt()));

                    // Old entry first: it may share the refresh token or the id with the replacement.
                    final Uni<Boolean> cleared = previous.map(store::removeSession)
                            .orElseGet(() -> Uni.createFrom().item(true));
                    return cleared.chain(() -> store.save(replacement));
                })
                .onFailure()
                .recoverWithItem(e -> {
                    LOG.warnf("Cache token rotation failed for %s: %s", rotated.id(), e.getMessage());
                    return false;
                })
                .invoke(ok -> {
                    if (!ok) {
                        reportInconsistency("updateSessionTokens", rotated.id(), "cache not rotated");
                    }
                });
    }

    @Override
    public Uni<Optional<SessionRecord>> getSessionByAccessToken(String accessToken) {
        return readThrough(
                store.getSessionByAccessToken(accessToken),
                () -> durable.findByAccessToken(accessToken),
                row -> row.isAccessValid(clock.instant()),
                DurableSession::accessExpiresAt);
    }

    @Override
    public Uni<Optional<SessionRecord>> getSessionByRefreshToken(String refreshToken) {
        return readThrough(
                store.getSessionByRefreshToken(refreshToken),
                () -> durable.findByRefreshToken(refreshToken),
                row -> row.isUsable(clock.instant()),
                DurableSession::refreshExpiresAt);
    }

    /**
     * Cache-first lookup falling back to durable rows accepted by {@code servable}; the
     * repopulated cache copy expires no later than {@code cacheUntil}.
     */
    private Uni<Optional<SessionRecord>> readThrough(
            Uni<Optional<SessionRecord>> cached,
            Supplier<Uni<Optional<DurableSession>>> fallback,
            Predicate<DurableSession> servable,
            Function<DurableSession, Instant> cacheUntil) {
        return cached.onFailure()
                .recoverWithItem(e -> {
                    LOG.warnf("Cache lookup failed, falling back to durable layer: %s", e.getMessage());
                    return Optional.empty();
                })
                .flatMap(hit -> {
                    if (hit.isPresent() && hit.get().isActive()) {
                        metrics.recordSessionLookup("cache", true);
                        return Uni.createFrom().item(hit);
                    }
                    metrics.recordSessionLookup("cache", false);
                    return fallback.get().flatMap(row -> {
                        if (row.isEmpty() || !servable.test(row.get())) {
                            metrics.recordSessionLookup("durable", false);
                            return Uni.createFrom().item(Optional.<SessionRecord>empty());
                        }
                        metrics.recordSessionLookup("durable", true);
                        final var record = toCacheRecord(row.get(), cacheUntil.apply(row.get()));
                        return store.save(record).map(ignored -> Optional.of(record));
                    });
                });
    }

    @Override
    public Uni<Boolean> revokeSession(String identifier) {
        return Uni.combine()
                .all()
                .unis(resolveDurable(identifier), resolveCached(identifier))
                .asTuple()
                .flatMap(found -> {
                    final var row = found.getItem1();
                    final var cached = found.getItem2();
                    if (row.isEmpty() && cached.isEmpty()) {
                        return Uni.createFrom().item(false);
                    }

                    final Uni<Boolean> durableRevoked = row.filter(r -> r.status() == SessionStatus.ACTIVE)
                            .map(r -> durable.update(r.revoked(clock.instant()))
                                    .replaceWith(true)
                                    .onFailure()
                                    .recoverWithItem(e -> {
                                        LOG.warnf("Durable revoke failed for %s: %s", r.id(), e.getMessage());
                                        return false;
                                    }))
                            .orElseGet(() -> Uni.createFrom().item(true));

                    return durableRevoked.flatMap(durableOk -> removeCached(cached).map(cacheOk -> {
                        final var provider = row.map(r -> r.provider().key())
                                .or(() -> cached.map(r -> r.provider().key()))
                                .orElse("unknown");
                        if (durableOk && cacheOk) {
                            metrics.recordSessionRevoked(provider);
                            return true;
                        }
                        reportInconsistency(
                                "revokeSession",
                                row.map(DurableSession::id).orElse(fingerprint(identifier)),
                                "durable=" + durableOk + ", cache=" + cacheOk);
                        return false;
                    }));
                });
    }

    @Override
    public Uni<Boolean> revokeAllUserSessions(String userUuid) {
        final Uni<Boolean> durableRevoked = durable.findActiveByUser(userUuid)
                .onItem()
                .transformToMulti(rows -> Multi.createFrom().iterable(rows))
                .onItem()
                .transformToUniAndConcatenate(row -> durable.update(row.revoked(clock.instant()))
                        .replaceWith(true)
                        .onFailure()
                        .recoverWithItem(e -> {
                            LOG.warnf("Durable revoke failed for %s: %s", row.id(), e.getMessage());
                            return false;
                        }))
                .collect()
                .asList()
                .map(results -> !results.contains(false))
                .onFailure()
                .recoverWithItem(e -> {
                    LOG.warnf("Durable lookup failed for user %s: %s", userUuid, e.getMessage());
                    return false;
                });

        return durableRevoked.flatMap(durableOk -> store.destroyUserSessions(userUuid)
                .map(count -> {
                    LOG.debugf("Destroyed %d cached sessions of user %s", count, userUuid);
                    return true;
                })
                .onFailure()
                .recoverWithItem(e -> {
                    LOG.warnf("Cache revoke failed for user %s: %s", userUuid, e.getMessage());
                    return false;
                })
                .map(cacheOk -> {
                    if (!(durableOk && cacheOk)) {
                        reportInconsistency(
                                "revokeAllUserSessions", userUuid, "durable=" + durableOk + ", cache=" + cacheOk);
                    }
                    return durableOk && cacheOk;
                }));
    }

    @Override
    public Uni<Integer> cleanupExpiredSessions() {
        final var now = clock.instant();
        return durable.findExpiredActive(now)
                .onItem()
                .transformToMulti(rows -> Multi.createFrom().iterable(rows))
                .onItem()
                .transformToUniAndConcatenate(row -> durable.update(row.expired(now))
                        .flatMap(ignored -> store.getSessionByAccessToken(row.accessToken()))
                        .flatMap(this::removeCached)
                        .replaceWith(true)
                        .onFailure()
                        .recoverWithItem(e -> {
                            LOG.warnf("Failed to expire session %s: %s", row.id(), e.getMessage());
                            return false;
                        }))
                .filter(Boolean::booleanValue)
                .collect()
                .asList()
                .map(expired -> {
                    final int count = expired.size();
                    if (count > 0) {
                        LOG.infof("Expired %d durable sessions past their refresh window", count);
                    }
                    metrics.recordCleanup("expired", count);
                    return count;
                });
    }

    @Override
    public Uni<Integer> purgeRevokedSessions() {
        final var cutoff = clock.instant().minus(config.cleanup().revokedRetention());
        return durable.purgeFinishedBefore(cutoff).invoke(count -> {
            if (count > 0) {
                LOG.infof("Purged %d revoked or expired sessions finished before %s", count, cutoff);
            }
            metrics.recordCleanup("purged", count);
        });
    }

    @Override
    public Uni<Boolean> validateStorageConsistency(String identifier) {
        return Uni.combine()
                .all()
                .unis(resolveDurable(identifier), resolveCached(identifier))
                .asTuple()
                .map(found -> {
                    final var row = found.getItem1().filter(r -> r.isUsable(clock.instant()));
                    final var cached = found.getItem2();
                    if (row.isEmpty() && cached.isEmpty()) {
                        return true;
                    }
                    if (row.isEmpty() || cached.isEmpty()) {
                        reportInconsistency(
                                "validateStorageConsistency",
                                fingerprint(identifier),
                                row.isEmpty() ? "missing from durable layer" : "missing from cache");
                        return false;
                    }
                    final var r = row.get();
                    final var c = cached.get();
                    final boolean consistent = r.accessToken().equals(c.accessToken())
                            && Objects.equals(r.refreshToken(), c.refreshToken())
                            && r.provider() == c.provider()
                            && r.user().uuid().equals(c.user().uuid());
                    if (!consistent) {
                        reportInconsistency("validateStorageConsistency", r.id(), "layers hold different tokens");
                    }
                    return consistent;
                })
                .onFailure()
                .recoverWithItem(e -> {
                    LOG.warnf("Consistency check failed for %s: %s", fingerprint(identifier), e.getMessage());
                    return false;
                });
    }

    @Override
    public Uni<Boolean> resyncSession(String identifier) {
        return Uni.combine()
                .all()
                .unis(resolveDurable(identifier), resolveCached(identifier))
                .asTuple()
                .flatMap(found -> {
                    final var row = found.getItem1().filter(r -> r.isUsable(clock.instant()));
                    final var cached = found.getItem2();
                    if (row.isEmpty()) {
                        LOG.infof("Resync of %s: dropping cache entry without durable session", fingerprint(identifier));
                        return removeCached(cached);
                    }
                    final var record = toCacheRecord(row.get(), row.get().refreshExpiresAt());
                    final Uni<Boolean> drop = cached.filter(c -> !c.id().equals(record.id()))
                            .map(store::removeSession)
                            .orElseGet(() -> Uni.createFrom().item(true));
                    LOG.infof("Resync of %s: rewriting cache from durable layer", row.get().id());
                    return drop.flatMap(ignored -> store.save(record));
                })
                .onFailure()
                .recoverWithItem(e -> {
                    LOG.warnf("Resync failed for %s: %s", fingerprint(identifier), e.getMessage());
                    return false;
                });
    }

    @Override
    public Uni<StorageHealthReport> getStorageHealth() {
        return Uni.combine()
                .all()
                .unis(safeCheck(cache, "cache"), safeCheck(durable, "persistent"))
                .asTuple()
                .map(health -> new StorageHealthReport(health.getItem1(), health.getItem2()));
    }

    private Uni<StorageHealth> safeCheck(StorageHealthIndicator indicator, String name) {
        return indicator.check().onFailure().recoverWithItem(e -> StorageHealth.unhealthy(name, e.getMessage()));
    }

    private Uni<Optional<DurableSession>> resolveDurable(String identifier) {
        return durable.findByRefreshToken(identifier)
                .flatMap(found -> found.isPresent()
                        ? Uni.createFrom().item(found)
                        : durable.findByAccessToken(identifier));
    }

    private Uni<Optional<SessionRecord>> resolveCached(String identifier) {
        return store.getSessionByRefreshToken(identifier)
                .flatMap(found -> found.isPresent()
                        ? Uni.createFrom().item(found)
                        : store.getSessionByAccessToken(identifier));
    }

    private Uni<Boolean> removeCached(Optional<SessionRecord> cached) {
        return cached.map(record -> store.removeSession(record)
                        .replaceWith(true)
                        .onFailure()
                        .recoverWithItem(e -> {
                            LOG.warnf("Cache delete failed for %s: %s", record.id(), e.getMessage());
                            return false;
                        }))
                .orElseGet(() -> Uni.createFrom().item(true));
    }

    /**
     * Cache copy of a durable row; the TTL is the provider TTL capped at {@code validUntil}.
     */
    private SessionRecord toCacheRecord(DurableSession row, Instant validUntil) {
        final var now = clock.instant();
        var ttl = store.getProviderTtl(row.provider());
        if (validUntil != null) {
            final var remaining = Duration.between(now, validUntil);
            if (remaining.compareTo(ttl) < 0) {
                ttl = remaining.toSeconds() > 0 ? remaining : Duration.ofSeconds(1);
            }
        }
        return new SessionRecord(
                store.sessionIdFor(row.accessToken()),
                row.accessToken(),
                row.refreshToken(),
                row.provider(),
                row.user(),
                row.createdAt(),
                row.updatedAt(),
                SessionStatus.ACTIVE,
                ttl.toSeconds(),
                row.ipAddress(),
                row.userAgent(),
                Map.of(),
                1);
    }

    private Instant accessExpiry(TokenPair tokens, Instant now) {
        return tokens.expiresIn() > 0
                ? now.plusSeconds(tokens.expiresIn())
                : now.plus(config.tokens().accessLifetime());
    }

    private Instant refreshExpiry(TokenPair tokens, boolean rememberMe, Instant now) {
        if (tokens.refreshToken() == null) {
            return accessExpiry(tokens, now);
        }
        return now.plus(rememberMe ? config.tokens().rememberMeLifetime() : config.tokens().refreshLifetime());
    }

    private void reportInconsistency(String operation, String subject, String detail) {
        LOG.warnf("Storage inconsistency in %s for %s: %s", operation, subject, detail);
        metrics.recordStorageInconsistency(operation);
    }

    private static String fingerprint(String token) {
        return SecureHash.truncatedSha256(token, 12);
    }
}
