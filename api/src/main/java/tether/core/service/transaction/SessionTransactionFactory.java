package tether.core.service.transaction;

import java.time.Clock;
import java.util.Optional;
import java.util.UUID;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import tether.core.config.SessionStoreConfig;
import tether.core.port.out.SessionMetrics;
import tether.core.port.out.TokenIssuer;
import tether.core.service.session.SessionStore;

/**
 * Creates session transactions and reopens journaled ones.
 */
@ApplicationScoped
public class SessionTransactionFactory {

    private static final Logger LOG = Logger.getLogger(SessionTransactionFactory.class);

    private final SessionStore store;
    private final TokenIssuer tokenIssuer;
    private final CompensationJournal journal;
    private final SessionMetrics metrics;
    private final SessionStoreConfig config;
    private final Clock clock;

    @Inject
    public SessionTransactionFactory(
            SessionStore store,
            TokenIssuer tokenIssuer,
            CompensationJournal journal,
            SessionMetrics metrics,
            SessionStoreConfig config,
            Clock clock) {
        this.store = store;
        this.tokenIssuer = tokenIssuer;
        this.journal = journal;
        this.metrics = metrics;
        this.config = config;
        this.clock = clock;
    }

    /**
     * New idle transaction with a random id.
     */
    public SessionTransaction create() {
        return newTransaction("tx_" + UUID.randomUUID().toString().replace("-", ""));
    }

    /**
     * Reopen a transaction whose process ended before it committed or rolled back.
     *
     * <p>The returned transaction is active and holds the journaled compensations; the
     * caller is expected to roll it back.
     *
     * @param transactionId id of the interrupted transaction
     * @return the reopened transaction, or empty if nothing was journaled under the id
     */
    public Uni<Optional<SessionTransaction>> recover(String transactionId) {
        if (!journal.isEnabled()) {
            LOG.warnf("Cannot recover transaction %s: journaling is disabled", transactionId);
            return Uni.createFrom().item(Optional.empty());
        }
        return journal.load(transactionId).map(pending -> {
            if (pending.isEmpty()) {
                return Optional.<SessionTransaction>empty();
            }
            final var transaction = newTransaction(transactionId);
            transaction.resume(pending);
            return Optional.of(transaction);
        });
    }

    private SessionTransaction newTransaction(String id) {
        return new SessionTransaction(
                id, store, tokenIssuer, config.tokens().accessLifetime(), journal, metrics, clock);
    }
}
