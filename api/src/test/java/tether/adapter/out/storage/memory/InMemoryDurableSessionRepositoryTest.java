package tether.adapter.out.storage.memory;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import tether.core.model.session.AuthProvider;
import tether.core.model.session.DurableSession;
import tether.core.model.session.SessionStatus;
import tether.core.model.session.SessionUser;

@DisplayName("InMemoryDurableSessionRepository")
class InMemoryDurableSessionRepositoryTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    private InMemoryDurableSessionRepository repository;

    @BeforeEach
    void setUp() {
        repository = new InMemoryDurableSessionRepository();
    }

    private DurableSession createTestSession(String id, String userUuid, Instant createdAt) {
        return new DurableSession(
                id,
                SessionUser.of(userUuid, "member"),
                AuthProvider.JWT,
                "access-" + id,
                "refresh-" + id,
                createdAt.plus(Duration.ofHours(1)),
                createdAt.plus(Duration.ofDays(7)),
                SessionStatus.ACTIVE,
                createdAt,
                createdAt,
                null,
                "192.168.1.1",
                "Mozilla/5.0",
                false);
    }

    private DurableSession save(DurableSession session) {
        return repository.create(session).await().indefinitely();
    }

    @Nested
    @DisplayName("create and update")
    class WriteTests {

        @Test
        @DisplayName("should reject a duplicate id")
        void duplicate() {
            save(createTestSession("session-1", "user-1", NOW));

            assertThrows(IllegalStateException.class, () -> save(createTestSession("session-1", "user-2", NOW)));
        }

        @Test
        @DisplayName("should reject an update of a missing row")
        void updateMissing() {
            var uni = repository.update(createTestSession("session-1", "user-1", NOW));

            assertThrows(IllegalStateException.class, () -> uni.await().indefinitely());
        }

        @Test
        @DisplayName("should replace the stored row")
        void update() {
            var session = save(createTestSession("session-1", "user-1", NOW));

            repository.update(session.revoked(NOW.plusSeconds(60))).await().indefinitely();

            var stored = repository.findById("session-1").await().indefinitely().orElseThrow();
            assertEquals(SessionStatus.REVOKED, stored.status());
            assertEquals(NOW.plusSeconds(60), stored.revokedAt());
        }
    }

    @Nested
    @DisplayName("lookups")
    class LookupTests {

        @Test
        @DisplayName("should find rows by either token")
        void byToken() {
            save(createTestSession("session-1", "user-1", NOW));

            assertTrue(repository.findByAccessToken("access-session-1").await().indefinitely().isPresent());
            assertTrue(repository.findByRefreshToken("refresh-session-1").await().indefinitely().isPresent());
            assertFalse(repository.findByRefreshToken(null).await().indefinitely().isPresent());
            assertFalse(repository.findByAccessToken("access-other").await().indefinitely().isPresent());
        }

        @Test
        @DisplayName("should list a user's active rows oldest first")
        void activeByUser() {
            save(createTestSession("session-2", "user-1", NOW.plusSeconds(10)));
            save(createTestSession("session-1", "user-1", NOW));
            var revoked = save(createTestSession("session-3", "user-1", NOW.plusSeconds(20)));
            repository.update(revoked.revoked(NOW)).await().indefinitely();
            save(createTestSession("session-4", "user-2", NOW));

            var rows = repository.findActiveByUser("user-1").await().indefinitely();

            assertEquals(List.of("session-1", "session-2"), rows.stream().map(DurableSession::id).toList());
        }

        @Test
        @DisplayName("should list active rows whose refresh window has ended")
        void expiredActive() {
            save(createTestSession("old", "user-1", NOW.minus(Duration.ofDays(8))));
            save(createTestSession("edge", "user-1", NOW.minus(Duration.ofDays(7))));
            save(createTestSession("fresh", "user-1", NOW));

            var rows = repository.findExpiredActive(NOW).await().indefinitely();

            assertEquals(List.of("old", "edge"), rows.stream().map(DurableSession::id).toList());
        }
    }

    @Nested
    @DisplayName("removal")
    class RemovalTests {

        @Test
        @DisplayName("delete should report whether a row existed")
        void delete() {
            save(createTestSession("session-1", "user-1", NOW));

            assertTrue(repository.delete("session-1").await().indefinitely());
            assertFalse(repository.delete("session-1").await().indefinitely());
        }

        @Test
        @DisplayName("purge should remove only rows finished before the cutoff")
        void purge() {
            var oldRevoked = save(createTestSession("old-revoked", "user-1", NOW));
            repository.update(oldRevoked.revoked(NOW.minus(Duration.ofDays(40)))).await().indefinitely();
            var recentRevoked = save(createTestSession("recent-revoked", "user-1", NOW));
            repository.update(recentRevoked.revoked(NOW.minus(Duration.ofDays(1)))).await().indefinitely();
            var oldExpired = save(createTestSession("old-expired", "user-1", NOW));
            repository.update(oldExpired.expired(NOW.minus(Duration.ofDays(31)))).await().indefinitely();
            save(createTestSession("active", "user-1", NOW.minus(Duration.ofDays(90))));

            var purged = repository.purgeFinishedBefore(NOW.minus(Duration.ofDays(30))).await().indefinitely();

            assertEquals(2, purged);
            assertEquals(2, repository.getSessionCount());
            assertTrue(repository.findById("recent-revoked").await().indefinitely().isPresent());
            assertTrue(repository.findById("active").await().indefinitely().isPresent());
        }
    }
}
