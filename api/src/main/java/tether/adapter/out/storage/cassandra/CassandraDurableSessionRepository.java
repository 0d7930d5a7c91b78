package tether.adapter.out.storage.cassandra;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

import com.datastax.oss.driver.api.core.CqlSession;
import com.datastax.oss.driver.api.core.cql.AsyncResultSet;
import com.datastax.oss.driver.api.core.cql.BoundStatement;
import com.datastax.oss.driver.api.core.cql.PreparedStatement;
import com.datastax.oss.driver.api.core.cql.Row;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.infrastructure.Infrastructure;
import io.vertx.core.Context;
import io.vertx.core.Vertx;
import org.jboss.logging.Logger;

import tether.core.model.common.StorageHealth;
import tether.core.model.session.AuthProvider;
import tether.core.model.session.DurableSession;
import tether.core.model.session.SessionStatus;
import tether.core.model.session.SessionUser;
import tether.core.port.out.DurableSessionRepository;
import tether.core.util.SecureHash;

/**
 * Cassandra implementation of DurableSessionRepository.
 *
 * <p>Tokens are looked up through secondary indexes on their SHA-256 hashes. The user
 * is stored as JSON so the permission set survives unchanged.
 *
 * <h2>Schema</h2>
 * See {@code db/cassandra/V2__create_sessions.cql}.
 */
public class CassandraDurableSessionRepository implements DurableSessionRepository {

    private static final Logger LOG = Logger.getLogger(CassandraDurableSessionRepository.class);

    private final CqlSession session;
    private final ObjectMapper objectMapper;
    private final Duration queryTimeout;
    private final PreparedStatement insertStmt;
    private final PreparedStatement updateStmt;
    private final PreparedStatement selectByIdStmt;
    private final PreparedStatement selectByAccessStmt;
    private final PreparedStatement selectByRefreshStmt;
    private final PreparedStatement selectByUserStmt;
    private final PreparedStatement selectByStatusStmt;
    private final PreparedStatement deleteStmt;

    public CassandraDurableSessionRepository(CqlSession session, ObjectMapper objectMapper, Duration queryTimeout) {
        this.session = session;
        this.objectMapper = objectMapper;
        this.queryTimeout = queryTimeout;
        this.insertStmt = session.prepare(
                """
                INSERT INTO sessions (id, user_uuid, user_data, provider, access_token, refresh_token,
                    access_token_hash, refresh_token_hash, access_expires_at, refresh_expires_at, status,
                    created_at, updated_at, revoked_at, ip_address, user_agent, remember_me)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                IF NOT EXISTS
                """);
        this.updateStmt = session.prepare(
                """
                UPDATE sessions SET user_uuid = ?, user_data = ?, provider = ?, access_token = ?,
                    refresh_token = ?, access_token_hash = ?, refresh_token_hash = ?, access_expires_at = ?,
                    refresh_expires_at = ?, status = ?, created_at = ?, updated_at = ?, revoked_at = ?,
                    ip_address = ?, user_agent = ?, remember_me = ?
                WHERE id = ?
                IF EXISTS
                """);
        this.selectByIdStmt = session.prepare("SELECT * FROM sessions WHERE id = ?");
        this.selectByAccessStmt = session.prepare("SELECT * FROM sessions WHERE access_token_hash = ?");
        this.selectByRefreshStmt = session.prepare("SELECT * FROM sessions WHERE refresh_token_hash = ?");
        this.selectByUserStmt = session.prepare("SELECT * FROM sessions WHERE user_uuid = ?");
        this.selectByStatusStmt = session.prepare("SELECT * FROM sessions WHERE status = ?");
        this.deleteStmt = session.prepare("DELETE FROM sessions WHERE id = ? IF EXISTS");
    }

    @Override
    public Uni<DurableSession> create(DurableSession row) {
        return execute(() -> insertStmt.bind(
                        row.id(),
                        row.user().uuid(),
                        writeUser(row.user()),
                        row.provider().key(),
                        row.accessToken(),
                        row.refreshToken(),
                        hash(row.accessToken()),
                        hash(row.refreshToken()),
                        row.accessExpiresAt(),
                        row.refreshExpiresAt(),
                        row.status().key(),
                        row.createdAt(),
                        row.updatedAt(),
                        row.revokedAt(),
                        row.ipAddress(),
                        row.userAgent(),
                        row.rememberMe()))
                .map(rs -> {
                    if (!rs.wasApplied()) {
                        throw new IllegalStateException("Durable session already exists: " + row.id());
                    }
                    return row;
                });
    }

    @Override
    public Uni<DurableSession> update(DurableSession row) {
        return execute(() -> updateStmt.bind(
                        row.user().uuid(),
                        writeUser(row.user()),
                        row.provider().key(),
                        row.accessToken(),
                        row.refreshToken(),
                        hash(row.accessToken()),
                        hash(row.refreshToken()),
                        row.accessExpiresAt(),
                        row.refreshExpiresAt(),
                        row.status().key(),
                        row.createdAt(),
                        row.updatedAt(),
                        row.revokedAt(),
                        row.ipAddress(),
                        row.userAgent(),
                        row.rememberMe(),
                        row.id()))
                .map(rs -> {
                    if (!rs.wasApplied()) {
                        throw new IllegalStateException("Durable session not found: " + row.id());
                    }
                    return row;
                });
    }

    @Override
    public Uni<Optional<DurableSession>> findById(String id) {
        return execute(() -> selectByIdStmt.bind(id)).map(this::firstRow);
    }

    @Override
    public Uni<Optional<DurableSession>> findByAccessToken(String accessToken) {
        return execute(() -> selectByAccessStmt.bind(hash(accessToken))).map(this::firstRow);
    }

    @Override
    public Uni<Optional<DurableSession>> findByRefreshToken(String refreshToken) {
        if (refreshToken == null) {
            return Uni.createFrom().item(Optional.empty());
        }
        return execute(() -> selectByRefreshStmt.bind(hash(refreshToken))).map(this::firstRow);
    }

    @Override
    public Uni<List<DurableSession>> findActiveByUser(String userUuid) {
        return queryAll(() -> selectByUserStmt.bind(userUuid))
                .map(rows -> rows.stream()
                        .filter(s -> s.status() == SessionStatus.ACTIVE)
                        .toList());
    }

    @Override
    public Uni<List<DurableSession>> findExpiredActive(Instant now) {
        return queryAll(() -> selectByStatusStmt.bind(SessionStatus.ACTIVE.key()))
                .map(rows -> rows.stream()
                        .filter(s -> s.refreshExpiresAt() != null && !s.refreshExpiresAt().isAfter(now))
                        .toList());
    }

    @Override
    public Uni<Boolean> delete(String id) {
        return execute(() -> deleteStmt.bind(id)).map(AsyncResultSet::wasApplied);
    }

    @Override
    public Uni<Integer> purgeFinishedBefore(Instant cutoff) {
        return Multi.createFrom()
                .items(SessionStatus.REVOKED, SessionStatus.EXPIRED)
                .onItem()
                .transformToUniAndConcatenate(status -> queryAll(() -> selectByStatusStmt.bind(status.key())))
                .onItem()
                .transformToIterable(rows -> rows)
                .filter(s -> s.finishedAt().map(f -> f.isBefore(cutoff)).orElse(false))
                .onItem()
                .transformToUniAndConcatenate(s -> delete(s.id()))
                .filter(Boolean::booleanValue)
                .collect()
                .asList()
                .map(List::size);
    }

    @Override
    public Uni<StorageHealth> check() {
        if (session.isClosed()) {
            return Uni.createFrom().item(StorageHealth.unhealthy("cassandra", "Session closed"));
        }
        final long start = System.currentTimeMillis();
        return Uni.createFrom()
                .completionStage(() -> session.executeAsync("SELECT release_version FROM system.local")
                        .toCompletableFuture())
                .emitOn(getContextExecutor())
                .map(rs -> StorageHealth.healthy("cassandra", System.currentTimeMillis() - start))
                .onFailure()
                .recoverWithItem(e -> StorageHealth.unhealthy("cassandra", e.getMessage()));
    }

    private Uni<AsyncResultSet> execute(Supplier<BoundStatement> statement) {
        final Executor executor = getContextExecutor();
        return Uni.createFrom()
                .completionStage(() -> session.executeAsync(statement.get().setTimeout(queryTimeout))
                        .toCompletableFuture())
                .emitOn(executor);
    }

    private Uni<List<DurableSession>> queryAll(Supplier<BoundStatement> statement) {
        final Executor executor = getContextExecutor();
        return Uni.createFrom()
                .completionStage(() -> session.executeAsync(statement.get().setTimeout(queryTimeout))
                        .thenCompose(rs -> collectPages(rs, new ArrayList<>())))
                .emitOn(executor);
    }

    private CompletionStage<List<DurableSession>> collectPages(AsyncResultSet rs, List<DurableSession> into) {
        for (Row row : rs.currentPage()) {
            into.add(fromRow(row));
        }
        if (rs.hasMorePages()) {
            return rs.fetchNextPage().thenCompose(next -> collectPages(next, into));
        }
        return CompletableFuture.completedFuture(into);
    }

    private Optional<DurableSession> firstRow(AsyncResultSet rs) {
        final Row row = rs.one();
        return row != null ? Optional.of(fromRow(row)) : Optional.empty();
    }

    private DurableSession fromRow(Row row) {
        return new DurableSession(
                row.getString("id"),
                readUser(row.getString("user_data")),
                AuthProvider.fromKey(row.getString("provider")),
                row.getString("access_token"),
                row.getString("refresh_token"),
                row.getInstant("access_expires_at"),
                row.getInstant("refresh_expires_at"),
                SessionStatus.fromKey(row.getString("status")),
                row.getInstant("created_at"),
                row.getInstant("updated_at"),
                row.getInstant("revoked_at"),
                row.getString("ip_address"),
                row.getString("user_agent"),
                row.getBoolean("remember_me"));
    }

    private String writeUser(SessionUser user) {
        try {
            return objectMapper.writeValueAsString(user);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize session user " + user.uuid(), e);
        }
    }

    private SessionUser readUser(String json) {
        try {
            return objectMapper.readValue(json, SessionUser.class);
        } catch (JsonProcessingException e) {
            LOG.warnf("Corrupt user data in durable session row: %s", e.getMessage());
            throw new IllegalStateException("Corrupt user data in durable session row", e);
        }
    }

    private static String hash(String token) {
        return token != null ? SecureHash.sha256Hex(token) : null;
    }

    /**
     * Resume on the Vert.x context when there is one; the driver completes its
     * futures on Netty I/O threads.
     */
    private Executor getContextExecutor() {
        final Context context = Vertx.currentContext();
        if (context != null) {
            return command -> context.runOnContext(v -> command.run());
        }
        return Infrastructure.getDefaultWorkerPool();
    }
}
