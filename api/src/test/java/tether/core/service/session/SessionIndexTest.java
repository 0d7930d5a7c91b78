package tether.core.service.session;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import tether.core.model.session.AuthProvider;
import tether.testing.SessionStack;

@DisplayName("SessionIndex")
class SessionIndexTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private SessionStack stack;
    private SessionIndex index;

    @BeforeEach
    void setUp() {
        stack = new SessionStack();
        index = stack.index;
    }

    private Duration indexTtl(AuthProvider provider) {
        return stack.cache.remainingTtl(stack.keys.providerIndex(provider))
                .await()
                .atMost(TIMEOUT)
                .orElseThrow();
    }

    @Test
    @DisplayName("the index entry should live as long as its longest-lived member")
    void entryTtl() {
        index.indexByProvider(AuthProvider.SAML, "short", Duration.ofHours(1)).await().atMost(TIMEOUT);
        index.indexByProvider(AuthProvider.SAML, "long", Duration.ofHours(8)).await().atMost(TIMEOUT);

        assertEquals(Duration.ofHours(8), indexTtl(AuthProvider.SAML));
    }

    @Test
    @DisplayName("expired members should not be returned")
    void expiredMembers() {
        index.indexByProvider(AuthProvider.SAML, "short", Duration.ofHours(1)).await().atMost(TIMEOUT);
        index.indexByProvider(AuthProvider.SAML, "long", Duration.ofHours(8)).await().atMost(TIMEOUT);

        stack.clock.advance(Duration.ofHours(2));

        assertEquals(Set.of("long"), index.providerSessionIds(AuthProvider.SAML).await().atMost(TIMEOUT));
    }

    @Test
    @DisplayName("removing the last member should delete the index entry")
    void removeLast() {
        index.indexByUser("user-1", "session-1", Duration.ofHours(1)).await().atMost(TIMEOUT);

        index.removeFromUserIndex("user-1", "session-1").await().atMost(TIMEOUT);

        assertTrue(stack.cache.get(stack.keys.userIndex("user-1")).await().atMost(TIMEOUT).isEmpty());
    }

    @Test
    @DisplayName("a corrupt index entry should read as empty and be rewritten")
    void corruptEntry() {
        stack.cache.set(stack.keys.userIndex("user-1"), "not json", Duration.ofHours(1))
                .await()
                .atMost(TIMEOUT);

        assertTrue(index.userSessionIds("user-1").await().atMost(TIMEOUT).isEmpty());

        index.indexByUser("user-1", "session-1", Duration.ofHours(1)).await().atMost(TIMEOUT);
        assertEquals(Set.of("session-1"), index.userSessionIds("user-1").await().atMost(TIMEOUT));
    }

    @Test
    @DisplayName("ids of several providers should be combined")
    void severalProviders() {
        index.indexByProvider(AuthProvider.JWT, "a", Duration.ofHours(1)).await().atMost(TIMEOUT);
        index.indexByProvider(AuthProvider.OAUTH, "b", Duration.ofHours(1)).await().atMost(TIMEOUT);
        index.indexByProvider(AuthProvider.LDAP, "c", Duration.ofHours(1)).await().atMost(TIMEOUT);

        var ids = index.providerSessionIds(List.of(AuthProvider.JWT, AuthProvider.OAUTH))
                .await()
                .atMost(TIMEOUT);

        assertEquals(Set.of("a", "b"), ids);
    }
}
