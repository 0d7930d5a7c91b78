package tether.core.service.transaction;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;
import java.util.function.Supplier;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import tether.core.model.session.AuthProvider;
import tether.core.model.session.SessionCriteria;
import tether.core.model.session.SessionRecord;
import tether.core.model.session.SessionRequest;
import tether.core.model.session.SessionUpdate;
import tether.core.model.session.TokenPair;
import tether.core.model.transaction.Compensation;
import tether.core.model.transaction.OperationRecord;
import tether.core.model.transaction.OperationType;
import tether.core.model.transaction.RollbackResult;
import tether.core.model.transaction.TransactionState;
import tether.core.model.transaction.TransactionStats;
import tether.core.port.in.SessionTransactionOperations;
import tether.core.port.out.SessionMetrics;
import tether.core.port.out.TokenIssuer;
import tether.core.service.session.SessionQuery;
import tether.core.service.session.SessionStore;

/**
 * Bulk session mutations with compensation-based rollback.
 *
 * <p>Each forward step is preceded by its compensation: the pending list is journaled,
 * the compensation is pushed, and only then the session is changed. A step that fails
 * takes its compensation back off the stack. Rollback replays the stack last-in,
 * first-out, so a session touched by several operations ends in the state it had
 * before the first of them.
 *
 * <p>Sessions are processed one at a time. Instances are single-use and not shared;
 * create them through {@link SessionTransactionFactory}.
 */
public class SessionTransaction implements SessionTransactionOperations {

    private static final Logger LOG = Logger.getLogger(SessionTransaction.class);
    private static final String CHANGED_OR_EXPIRED = "session changed or expired";

    private final String id;
    private final SessionStore store;
    private final TokenIssuer tokenIssuer;
    private final Duration accessLifetime;
    private final CompensationJournal journal;
    private final SessionMetrics metrics;
    private final Clock clock;

    private final List<Compensation> compensations = new CopyOnWriteArrayList<>();
    private final List<OperationRecord> operations = new CopyOnWriteArrayList<>();
    private final List<String> errors = new CopyOnWriteArrayList<>();
    private final List<String> rollbackErrors = new CopyOnWriteArrayList<>();

    private volatile TransactionState state = TransactionState.IDLE;
    private volatile Instant startedAt;
    private volatile Instant finishedAt;

    SessionTransaction(
            String id,
            SessionStore store,
            TokenIssuer tokenIssuer,
            Duration accessLifetime,
            CompensationJournal journal,
            SessionMetrics metrics,
            Clock clock) {
        this.id = id;
        this.store = store;
        this.tokenIssuer = tokenIssuer;
        this.accessLifetime = accessLifetime;
        this.journal = journal;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Reopen a transaction from its journal so it can be rolled back.
     */
    void resume(List<Compensation> pending) {
        compensations.addAll(pending);
        state = TransactionState.ACTIVE;
        startedAt = clock.instant();
        LOG.infof("Transaction %s resumed with %d pending compensations", id, pending.size());
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public TransactionState state() {
        return state;
    }

    @Override
    public void begin() {
        requireState(TransactionState.IDLE, "begin");
        state = TransactionState.ACTIVE;
        startedAt = clock.instant();
        LOG.debugf("Transaction %s started", id);
    }

    @Override
    public Uni<Integer> invalidateSessionsWhere(SessionCriteria criteria) {
        requireState(TransactionState.ACTIVE, "invalidate sessions in");
        return runBulk(
                        OperationType.INVALIDATE,
                        Map.of("criteria", criteria.toString()),
                        toQuery(criteria).get(),
                        record -> new Step(
                                new Compensation.RestoreSession(record, null),
                                () -> store.removeIfUnchanged(record),
                                "invalidate session " + record.id(),
                                CHANGED_OR_EXPIRED))
                .map(List::size);
    }

    @Override
    public Uni<Integer> updateSessionsWhere(SessionCriteria criteria, SessionUpdate update) {
        requireState(TransactionState.ACTIVE, "update sessions in");
        return runBulk(
                        OperationType.UPDATE,
                        Map.of("criteria", criteria.toString(), "updates", update.toString()),
                        toQuery(criteria).get(),
                        record -> {
                            final var merged = update.applyTo(record).withTtl(store.getProviderTtl(record.provider()));
                            return new Step(
                                    new Compensation.RestoreSession(record, record.version() + 1),
                                    () -> store.replaceSession(merged, record.version())
                                            .map(Optional::isPresent),
                                    "update session " + record.id(),
                                    CHANGED_OR_EXPIRED);
                        })
                .map(List::size);
    }

    @Override
    public Uni<List<String>> createSessions(List<SessionRequest> requests) {
        requireState(TransactionState.ACTIVE, "create sessions in");
        final var pending = List.copyOf(requests);
        return runBulk(
                OperationType.CREATE,
                Map.of("count", Integer.toString(pending.size())),
                Uni.createFrom().item(pending),
                request -> {
                    final TokenPair tokens = request.tokens() != null
                            ? request.tokens()
                            : tokenIssuer.issue(request.user(), accessLifetime);
                    return new Step(
                            new Compensation.DeleteSession(
                                    store.sessionIdFor(tokens.accessToken()), tokens.accessToken(), 1),
                            () -> store.createIfAbsent(request, tokens).map(Optional::isPresent),
                            "create session for user " + request.user().uuid(),
                            "cache rejected write");
                });
    }

    @Override
    public Uni<Integer> migrateSessions(AuthProvider from, AuthProvider to) {
        requireState(TransactionState.ACTIVE, "migrate sessions in");
        final var targetTtl = store.getProviderTtl(to);
        final Uni<List<SessionRecord>> matched = from == to
                ? Uni.createFrom().item(List.<SessionRecord>of())
                : store.query().whereProvider(from).get();
        return runBulk(
                        OperationType.MIGRATE,
                        Map.of("from", from.key(), "to", to.key()),
                        matched,
                        record -> new Step(
                                new Compensation.RestoreSession(record, record.version() + 1),
                                () -> store.replaceSession(record.withProvider(to, targetTtl), record.version())
                                        .map(Optional::isPresent),
                                "migrate session " + record.id(),
                                CHANGED_OR_EXPIRED))
                .map(List::size);
    }

    @Override
    public Uni<Void> commit() {
        requireState(TransactionState.ACTIVE, "commit");
        state = TransactionState.COMMITTED;
        finishedAt = clock.instant();
        compensations.clear();
        metrics.recordTransactionFinished(state, elapsed().toMillis());
        LOG.infof("Transaction %s committed after %d operations", id, operations.size());
        return journal.clear(id);
    }

    @Override
    public Uni<RollbackResult> rollback() {
        requireState(TransactionState.ACTIVE, "roll back");
        state = TransactionState.ROLLING_BACK;

        final var replay = new ArrayList<>(compensations);
        Collections.reverse(replay);
        final var failed = new ArrayList<Compensation>();

        return Multi.createFrom()
                .iterable(replay)
                .onItem()
                .transformToUniAndConcatenate(compensation -> apply(compensation).invoke(applied -> {
                    if (!applied) {
                        failed.add(0, compensation);
                    }
                }))
                .filter(Boolean::booleanValue)
                .collect()
                .asList()
                .flatMap(applied -> {
                    state = rollbackErrors.isEmpty()
                            ? TransactionState.ROLLED_BACK
                            : TransactionState.ROLLED_BACK_WITH_ERRORS;
                    finishedAt = clock.instant();
                    compensations.clear();
                    metrics.recordTransactionFinished(state, elapsed().toMillis());
                    if (rollbackErrors.isEmpty()) {
                        LOG.infof("Transaction %s rolled back %d compensations", id, applied.size());
                    } else {
                        LOG.warnf(
                                "Transaction %s rolled back with %d failed compensations: %s",
                                id, rollbackErrors.size(), rollbackErrors);
                    }
                    final var result = new RollbackResult(state, applied.size(), rollbackErrors);
                    // Failed compensations stay journaled so the rollback can be retried.
                    final Uni<Void> journaled = failed.isEmpty()
                            ? journal.clear(id)
                            : journal.record(id, failed)
                                    .replaceWithVoid()
                                    .onFailure()
                                    .recoverWithItem(e -> {
                                        LOG.warnf("Failed to journal unapplied compensations of %s: %s",
                                                id, e.getMessage());
                                        return null;
                                    });
                    return journaled.replaceWith(result);
                });
    }

    @Override
    public TransactionStats getStats() {
        return new TransactionStats(
                id,
                state,
                operations.size(),
                errors.size(),
                rollbackErrors.size(),
                compensations.size(),
                elapsed(),
                operations);
    }

    @Override
    public List<String> getErrors() {
        return List.copyOf(errors);
    }

    @Override
    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    @Override
    public List<String> getRollbackErrors() {
        return List.copyOf(rollbackErrors);
    }

    /**
     * Apply one step per item, in order.
     *
     * @return ids of the sessions whose step succeeded
     */
    private <T> Uni<List<String>> runBulk(
            OperationType type, Map<String, String> parameters, Uni<List<T>> items, Function<T, Step> stepFor) {
        final int errorsBefore = errors.size();
        final var label = type.name().toLowerCase(Locale.ROOT);
        return items.onFailure()
                .recoverWithItem(e -> {
                    errors.add(label + " selection failed: " + e.getMessage());
                    return List.of();
                })
                .onItem()
                .transformToMulti(list -> Multi.createFrom().iterable(list))
                .onItem()
                .transformToUniAndConcatenate(item -> {
                    final Step step;
                    try {
                        step = stepFor.apply(item);
                    } catch (RuntimeException e) {
                        errors.add(label + " failed: " + e.getMessage());
                        return Uni.createFrom().item(Optional.<String>empty());
                    }
                    final var sessionId = step.compensation().sessionId();
                    return applyStep(step).map(ok -> ok ? Optional.of(sessionId) : Optional.<String>empty());
                })
                .filter(Optional::isPresent)
                .map(Optional::get)
                .collect()
                .asList()
                .invoke(done -> {
                    final int failures = errors.size() - errorsBefore;
                    operations.add(new OperationRecord(type, parameters, done.size(), failures, clock.instant()));
                    metrics.recordBulkOperation(type, done.size(), failures);
                    LOG.infof(
                            "Transaction %s: %s affected %d sessions (%d failed) %s",
                            id, type, done.size(), failures, parameters);
                });
    }

    private Uni<Boolean> applyStep(Step step) {
        final var pending = new ArrayList<>(compensations);
        pending.add(step.compensation());
        return journal.record(id, pending)
                .onFailure()
                .recoverWithItem(e -> {
                    LOG.warnf("Journal write failed in transaction %s: %s", id, e.getMessage());
                    return false;
                })
                .flatMap(journaled -> {
                    if (!journaled) {
                        errors.add("Skipped " + step.description() + ": compensation could not be journaled");
                        return Uni.createFrom().item(false);
                    }
                    compensations.add(step.compensation());
                    return step.forward()
                            .get()
                            .onFailure()
                            .recoverWithItem(e -> {
                                errors.add("Failed to " + step.description() + ": " + e.getMessage());
                                return null;
                            })
                            .flatMap(ok -> {
                                if (Boolean.TRUE.equals(ok)) {
                                    return Uni.createFrom().item(true);
                                }
                                if (ok != null) {
                                    errors.add("Failed to " + step.description() + ": " + step.rejection());
                                }
                                compensations.remove(compensations.size() - 1);
                                return journal.record(id, compensations)
                                        .onFailure()
                                        .recoverWithItem(true)
                                        .replaceWith(false);
                            });
                });
    }

    private Uni<Boolean> apply(Compensation compensation) {
        final Uni<Boolean> replay;
        if (compensation instanceof Compensation.RestoreSession restore) {
            replay = store.restoreSession(restore.original(), restore.expectedVersion());
        } else if (compensation instanceof Compensation.DeleteSession delete) {
            replay = store.discardSession(delete.sessionId(), delete.expectedVersion());
        } else {
            replay = Uni.createFrom().failure(new IllegalStateException("Unknown compensation " + compensation));
        }
        return replay.replaceWith(true).onFailure().recoverWithItem(e -> {
            rollbackErrors.add("Failed to compensate session " + compensation.sessionId() + ": " + e.getMessage());
            return false;
        });
    }

    private SessionQuery toQuery(SessionCriteria criteria) {
        final var query = store.query();
        narrow(query, criteria);
        return query;
    }

    private static void narrow(SessionQuery query, SessionCriteria criteria) {
        if (criteria instanceof SessionCriteria.ByProvider byProvider) {
            query.whereProvider(byProvider.provider());
        } else if (criteria instanceof SessionCriteria.ByIdleOlderThan idle) {
            query.whereLastActivityOlderThan(idle.idle());
        } else if (criteria instanceof SessionCriteria.ByUserRole role) {
            query.whereUserRole(role.role());
        } else if (criteria instanceof SessionCriteria.ByUser user) {
            query.whereUser(user.userUuid());
        } else if (criteria instanceof SessionCriteria.FieldEquals field) {
            query.whereField(field.field(), field.value());
        } else if (criteria instanceof SessionCriteria.Custom custom) {
            query.where(custom.description(), custom.predicate());
        } else if (criteria instanceof SessionCriteria.AllOf all) {
            all.criteria().forEach(c -> narrow(query, c));
        } else {
            throw new IllegalArgumentException("Unsupported criteria " + criteria);
        }
    }

    private void requireState(TransactionState required, String operation) {
        if (state != required) {
            throw new InvalidTransactionStateException(id, operation, state);
        }
    }

    private Duration elapsed() {
        if (startedAt == null) {
            return Duration.ZERO;
        }
        return Duration.between(startedAt, finishedAt != null ? finishedAt : clock.instant());
    }

    /**
     * One forward mutation and its compensation.
     *
     * @param rejection reason recorded when the forward step reports false
     */
    private record Step(
            Compensation compensation, Supplier<Uni<Boolean>> forward, String description, String rejection) {}
}
