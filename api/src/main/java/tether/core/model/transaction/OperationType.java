package tether.core.model.transaction;

public enum OperationType {
    INVALIDATE,
    UPDATE,
    CREATE,
    MIGRATE
}
