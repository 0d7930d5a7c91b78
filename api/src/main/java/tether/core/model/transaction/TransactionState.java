package tether.core.model.transaction;

/**
 * State of a session transaction.
 *
 * <p>{@code IDLE -> ACTIVE -> COMMITTED}, or {@code ACTIVE -> ROLLING_BACK} followed by
 * {@code ROLLED_BACK} when every compensation applied and {@code ROLLED_BACK_WITH_ERRORS}
 * when at least one failed.
 */
public enum TransactionState {
    IDLE,
    ACTIVE,
    ROLLING_BACK,
    COMMITTED,
    ROLLED_BACK,
    ROLLED_BACK_WITH_ERRORS;

    public boolean isFinal() {
        return this == COMMITTED || this == ROLLED_BACK || this == ROLLED_BACK_WITH_ERRORS;
    }

    public boolean isRolledBack() {
        return this == ROLLED_BACK || this == ROLLED_BACK_WITH_ERRORS;
    }
}
