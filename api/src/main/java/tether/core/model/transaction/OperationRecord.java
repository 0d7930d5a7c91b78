package tether.core.model.transaction;

import java.time.Instant;
import java.util.Map;

/**
 * Audit entry for one bulk operation applied inside a transaction.
 *
 * @param type        operation kind
 * @param parameters  parameters rendered for display
 * @param affected    number of sessions actually changed
 * @param failed      number of matched sessions that could not be changed
 * @param executedAt  completion time
 */
public record OperationRecord(
        OperationType type, Map<String, String> parameters, int affected, int failed, Instant executedAt) {

    public OperationRecord {
        parameters = Map.copyOf(parameters);
    }
}
