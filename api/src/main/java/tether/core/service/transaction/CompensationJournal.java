package tether.core.service.transaction;

import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import tether.core.config.SessionStoreConfig;
import tether.core.model.transaction.Compensation;
import tether.core.port.out.CacheStore;
import tether.core.service.session.SessionKeys;
import tether.core.service.session.SessionRecordCodec;

/**
 * Cache-backed log of the compensations a transaction has pending.
 *
 * <p>A transaction writes its pending list before each forward step, so a process that
 * dies mid-transaction leaves enough behind to roll it back later. The journal holds
 * the whole list under one key; writes replace it.
 */
@ApplicationScoped
public class CompensationJournal {

    private static final Logger LOG = Logger.getLogger(CompensationJournal.class);

    private final CacheStore cache;
    private final SessionKeys keys;
    private final SessionRecordCodec codec;
    private final SessionStoreConfig.TransactionConfig config;

    @Inject
    public CompensationJournal(
            CacheStore cache, SessionKeys keys, SessionRecordCodec codec, SessionStoreConfig config) {
        this.cache = cache;
        this.keys = keys;
        this.codec = codec;
        this.config = config.transaction();
    }

    public boolean isEnabled() {
        return config.journalEnabled();
    }

    /**
     * Replace the journal of a transaction.
     *
     * @return true once written, or immediately when journaling is disabled
     */
    public Uni<Boolean> record(String transactionId, List<Compensation> pending) {
        if (!isEnabled()) {
            return Uni.createFrom().item(true);
        }
        final var key = keys.transactionJournal(transactionId);
        if (pending.isEmpty()) {
            return cache.delete(key).replaceWith(true);
        }
        return cache.set(key, codec.encodeJournal(pending), config.journalTtl());
    }

    /**
     * Load the pending compensations of a transaction, in order of application.
     */
    public Uni<List<Compensation>> load(String transactionId) {
        return cache.get(keys.transactionJournal(transactionId))
                .map(value -> value.map(codec::decodeJournal).orElse(List.of()));
    }

    public Uni<Void> clear(String transactionId) {
        if (!isEnabled()) {
            return Uni.createFrom().voidItem();
        }
        return cache.delete(keys.transactionJournal(transactionId))
                .replaceWithVoid()
                .onFailure()
                .recoverWithItem(e -> {
                    LOG.warnf("Failed to clear journal of transaction %s, it expires on its own: %s",
                            transactionId, e.getMessage());
                    return null;
                });
    }
}
