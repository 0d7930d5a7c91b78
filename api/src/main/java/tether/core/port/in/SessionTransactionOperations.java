package tether.core.port.in;

import java.util.List;

import io.smallrye.mutiny.Uni;

import tether.core.model.session.AuthProvider;
import tether.core.model.session.SessionCriteria;
import tether.core.model.session.SessionRequest;
import tether.core.model.session.SessionUpdate;
import tether.core.model.transaction.RollbackResult;
import tether.core.model.transaction.TransactionState;
import tether.core.model.transaction.TransactionStats;

/**
 * Port for bulk session mutations with begin/commit/rollback semantics.
 *
 * <p>An instance is single-use and owned by one caller. State transitions are checked
 * when the method is called and misuse throws {@link InvalidTransactionStateException}
 * immediately. Failures of individual sessions never throw; they lower the returned
 * count and are listed in {@link #getErrors()}.
 */
public interface SessionTransactionOperations {

    String id();

    TransactionState state();

    /**
     * Move from {@code IDLE} to {@code ACTIVE}.
     *
     * @throws InvalidTransactionStateException if the transaction is not idle
     */
    void begin();

    /**
     * Destroy every session matching the criteria.
     *
     * @return number of sessions destroyed
     */
    Uni<Integer> invalidateSessionsWhere(SessionCriteria criteria);

    /**
     * Merge an update into every session matching the criteria.
     *
     * @return number of sessions rewritten
     */
    Uni<Integer> updateSessionsWhere(SessionCriteria criteria, SessionUpdate update);

    /**
     * Create sessions, issuing tokens where a request carries none.
     *
     * @return ids of the sessions actually created
     */
    Uni<List<String>> createSessions(List<SessionRequest> requests);

    /**
     * Move every session of one provider to another, applying the target provider's TTL.
     *
     * @return number of sessions migrated
     */
    Uni<Integer> migrateSessions(AuthProvider from, AuthProvider to);

    /**
     * Finalize the transaction and discard its compensations.
     *
     * @throws InvalidTransactionStateException if the transaction is not active
     */
    Uni<Void> commit();

    /**
     * Replay compensations in reverse order of application.
     *
     * @return the terminal state and any compensation failures
     * @throws InvalidTransactionStateException if the transaction is not active
     */
    Uni<RollbackResult> rollback();

    TransactionStats getStats();

    List<String> getErrors();

    boolean hasErrors();

    List<String> getRollbackErrors();

    /**
     * Thrown when a transaction method is called in a state that does not allow it.
     */
    class InvalidTransactionStateException extends RuntimeException {

        private final TransactionState state;

        public InvalidTransactionStateException(String transactionId, String operation, TransactionState state) {
            super("Cannot " + operation + " transaction " + transactionId + " in state " + state);
            this.state = state;
        }

        public TransactionState state() {
            return state;
        }
    }
}
