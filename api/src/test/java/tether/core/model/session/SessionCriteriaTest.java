package tether.core.model.session;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Duration;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("SessionCriteria")
class SessionCriteriaTest {

    @Nested
    @DisplayName("fromMap")
    class FromMapTests {

        @Test
        @DisplayName("a single key should not be wrapped")
        void singleKey() {
            assertEquals(
                    new SessionCriteria.ByProvider(AuthProvider.SAML),
                    SessionCriteria.fromMap(Map.of("provider", "SAML")));
        }

        @Test
        @DisplayName("several keys should combine with AND")
        void severalKeys() {
            var criteria = SessionCriteria.fromMap(Map.of(
                    "provider", "jwt", "idle_time", ">300", "user_role", "admin", "tenant", "acme"));

            var all = assertInstanceOf(SessionCriteria.AllOf.class, criteria);
            assertEquals(
                    Set.of(
                            new SessionCriteria.ByProvider(AuthProvider.JWT),
                            new SessionCriteria.ByIdleOlderThan(Duration.ofSeconds(300)),
                            new SessionCriteria.ByUserRole("admin"),
                            new SessionCriteria.FieldEquals("tenant", "acme")),
                    Set.copyOf(all.criteria()));
        }

        @Test
        @DisplayName("idle time should accept a plain number of seconds")
        void plainIdle() {
            assertEquals(
                    new SessionCriteria.ByIdleOlderThan(Duration.ofMinutes(10)),
                    SessionCriteria.fromMap(Map.of("idle_time", "600")));
        }

        @Test
        @DisplayName("an unknown provider should be rejected")
        void unknownProvider() {
            assertThrows(IllegalArgumentException.class, () -> SessionCriteria.fromMap(Map.of("provider", "kerberos")));
        }

        @Test
        @DisplayName("a malformed idle time should be rejected")
        void malformedIdle() {
            assertThrows(IllegalArgumentException.class, () -> SessionCriteria.fromMap(Map.of("idle_time", ">soon")));
        }

        @Test
        @DisplayName("an empty map should match everything")
        void empty() {
            var all = assertInstanceOf(SessionCriteria.AllOf.class, SessionCriteria.fromMap(Map.of()));

            assertEquals(0, all.criteria().size());
        }
    }

    @Test
    @DisplayName("a negative idle duration should be rejected")
    void negativeIdle() {
        assertThrows(IllegalArgumentException.class, () -> SessionCriteria.idleLongerThan(Duration.ofSeconds(-1)));
    }
}
