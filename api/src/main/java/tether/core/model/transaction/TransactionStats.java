package tether.core.model.transaction;

import java.time.Duration;
import java.util.List;

/**
 * Snapshot of a transaction for audit trails and debugging.
 */
public record TransactionStats(
        String transactionId,
        TransactionState state,
        int operationsCount,
        int errorsCount,
        int rollbackErrorsCount,
        int pendingCompensations,
        Duration duration,
        List<OperationRecord> operations) {

    public TransactionStats {
        operations = List.copyOf(operations);
    }

    public boolean active() {
        return state == TransactionState.ACTIVE;
    }

    public boolean committed() {
        return state == TransactionState.COMMITTED;
    }

    public boolean rolledBack() {
        return state.isRolledBack();
    }
}
