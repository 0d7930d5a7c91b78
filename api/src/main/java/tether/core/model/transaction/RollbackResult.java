package tether.core.model.transaction;

import java.util.List;

/**
 * Outcome of a rollback.
 *
 * @param state   terminal state reached
 * @param applied compensations applied or found already applied
 * @param errors  compensation failures
 */
public record RollbackResult(TransactionState state, int applied, List<String> errors) {

    public RollbackResult {
        errors = List.copyOf(errors);
    }

    public boolean clean() {
        return errors.isEmpty();
    }
}
