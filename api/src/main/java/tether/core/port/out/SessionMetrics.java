package tether.core.port.out;

import tether.core.model.transaction.OperationType;
import tether.core.model.transaction.TransactionState;

/**
 * Port for recording session store metrics.
 */
public interface SessionMetrics {

    void recordSessionStored(String provider, boolean success);

    void recordSessionLookup(String layer, boolean hit);

    void recordSessionRevoked(String provider);

    /**
     * Record that the cache and durable layers disagree after an operation.
     *
     * @param operation operation that left the layers out of step
     */
    void recordStorageInconsistency(String operation);

    void recordBulkOperation(OperationType type, int affected, int failed);

    void recordTransactionFinished(TransactionState state, long durationMs);

    void recordCleanup(String kind, int removed);

    /**
     * Record a storage operation that did not answer within its timeout.
     *
     * @param backend   storage backend, e.g. redis
     * @param operation operation name
     */
    void recordStorageTimeout(String backend, String operation);

    void recordStorageFailure(String backend, String operation);
}
