package tether.core.service.session;

import java.time.Clock;
import java.time.Duration;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import tether.core.model.session.AuthProvider;
import tether.core.model.session.SessionRecord;
import tether.core.port.out.CacheStore;
import tether.core.service.session.SessionRecordCodec.SessionCodecException;
import tether.core.util.KeyedMutex;

/**
 * Secondary indexes of sessions by provider and by user.
 *
 * <p>Each index is one cache entry mapping session id to the epoch second its entry
 * expires. Members past their expiry are dropped whenever the entry is read or
 * rewritten, and the entry itself carries the TTL of its longest-lived member, so an
 * index never needs a separate sweep.
 *
 * <p>Rewrites of the same index entry are serialized within this process.
 */
@ApplicationScoped
public class SessionIndex {

    private static final Logger LOG = Logger.getLogger(SessionIndex.class);

    private final CacheStore cache;
    private final SessionKeys keys;
    private final SessionRecordCodec codec;
    private final Clock clock;
    private final KeyedMutex mutex = new KeyedMutex();

    @Inject
    public SessionIndex(CacheStore cache, SessionKeys keys, SessionRecordCodec codec, Clock clock) {
        this.cache = cache;
        this.keys = keys;
        this.codec = codec;
        this.clock = clock;
    }

    /**
     * Add a session to its provider's index. The entry expires after {@code ttl}.
     */
    public Uni<Void> indexByProvider(AuthProvider provider, String sessionId, Duration ttl) {
        return addMember(keys.providerIndex(provider), sessionId, ttl);
    }

    public Uni<Void> removeFromProviderIndex(AuthProvider provider, String sessionId) {
        return removeMember(keys.providerIndex(provider), sessionId);
    }

    /**
     * Add a session to its user's index. The entry expires after {@code ttl}.
     */
    public Uni<Void> indexByUser(String userUuid, String sessionId, Duration ttl) {
        return addMember(keys.userIndex(userUuid), sessionId, ttl);
    }

    public Uni<Void> removeFromUserIndex(String userUuid, String sessionId) {
        return removeMember(keys.userIndex(userUuid), sessionId);
    }

    /**
     * Ids currently indexed under a provider, expired members excluded.
     */
    public Uni<Set<String>> providerSessionIds(AuthProvider provider) {
        return liveMembers(keys.providerIndex(provider));
    }

    public Uni<Set<String>> userSessionIds(String userUuid) {
        return liveMembers(keys.userIndex(userUuid));
    }

    /**
     * Ids indexed under any of the given providers, in provider order.
     */
    public Uni<Set<String>> providerSessionIds(Collection<AuthProvider> providers) {
        return Multi.createFrom()
                .iterable(providers)
                .onItem()
                .transformToUniAndConcatenate(this::providerSessionIds)
                .collect()
                .<Set<String>>in(LinkedHashSet::new, Set::addAll);
    }

    public Uni<Set<String>> userSessionIds(Collection<String> userUuids) {
        return Multi.createFrom()
                .iterable(userUuids)
                .onItem()
                .transformToUniAndConcatenate(this::userSessionIds)
                .collect()
                .<Set<String>>in(LinkedHashSet::new, Set::addAll);
    }

    /**
     * Start a query over indexed sessions.
     */
    public SessionQuery query() {
        return new SessionQuery(this, clock);
    }

    /**
     * Load a session record for query evaluation. Corrupt entries count as misses.
     */
    Uni<Optional<SessionRecord>> hydrate(String sessionId) {
        return cache.get(keys.session(sessionId)).map(value -> value.flatMap(v -> {
            try {
                return Optional.of(codec.decode(v));
            } catch (SessionCodecException e) {
                LOG.warnf("Skipping corrupt session entry %s: %s", sessionId, e.getMessage());
                return Optional.empty();
            }
        }));
    }

    private Uni<Void> addMember(String indexKey, String sessionId, Duration ttl) {
        return mutex.withLock(indexKey, () -> readMembers(indexKey).flatMap(members -> {
            final long now = clock.instant().getEpochSecond();
            members.values().removeIf(expiry -> expiry <= now);
            members.put(sessionId, now + Math.max(1, ttl.toSeconds()));
            return writeMembers(indexKey, members, now);
        }));
    }

    private Uni<Void> removeMember(String indexKey, String sessionId) {
        return mutex.withLock(indexKey, () -> readMembers(indexKey).flatMap(members -> {
            if (!members.containsKey(sessionId)) {
                return Uni.createFrom().voidItem();
            }
            final long now = clock.instant().getEpochSecond();
            members.remove(sessionId);
            members.values().removeIf(expiry -> expiry <= now);
            return writeMembers(indexKey, members, now);
        }));
    }

    private Uni<Set<String>> liveMembers(String indexKey) {
        return readMembers(indexKey).map(members -> {
            final long now = clock.instant().getEpochSecond();
            final var live = new LinkedHashSet<String>();
            members.forEach((id, expiry) -> {
                if (expiry > now) {
                    live.add(id);
                }
            });
            return live;
        });
    }

    private Uni<Map<String, Long>> readMembers(String indexKey) {
        return cache.get(indexKey).map(value -> {
            if (value.isEmpty()) {
                return new HashMap<String, Long>();
            }
            try {
                return new HashMap<>(codec.decodeIndex(value.get()));
            } catch (SessionCodecException e) {
                LOG.warnf("Discarding corrupt index %s: %s", indexKey, e.getMessage());
                return new HashMap<String, Long>();
            }
        });
    }

    private Uni<Void> writeMembers(String indexKey, Map<String, Long> members, long now) {
        if (members.isEmpty()) {
            return cache.delete(indexKey).replaceWithVoid();
        }
        final long latest = members.values().stream().mapToLong(Long::longValue).max().orElse(now + 1);
        final var ttl = Duration.ofSeconds(Math.max(1, latest - now));
        return cache.set(indexKey, codec.encodeIndex(members), ttl).flatMap(written -> {
            if (!written) {
                return Uni.createFrom().<Void>failure(new IllegalStateException("Cache rejected write of " + indexKey));
            }
            return Uni.createFrom().voidItem();
        });
    }
}
