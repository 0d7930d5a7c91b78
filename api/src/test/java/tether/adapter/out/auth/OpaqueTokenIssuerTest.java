package tether.adapter.out.auth;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import tether.core.model.session.SessionUser;
import tether.core.util.SecureHash;

@DisplayName("OpaqueTokenIssuer")
class OpaqueTokenIssuerTest {

    private final OpaqueTokenIssuer issuer = new OpaqueTokenIssuer();
    private final SessionUser user = SessionUser.of("user-1", "member");

    @Test
    @DisplayName("should issue 256-bit tokens in their encodings")
    void tokenShape() {
        var tokens = issuer.issue(user, Duration.ofMinutes(15));

        assertTrue(tokens.accessToken().matches("[A-Za-z0-9_-]{43}"));
        assertTrue(tokens.refreshToken().matches("[0-9a-f]{64}"));
        assertEquals(900, tokens.expiresIn());
    }

    @Test
    @DisplayName("every pair should be fresh")
    void unique() {
        var first = issuer.issue(user, Duration.ofHours(1));
        var second = issuer.issue(user, Duration.ofHours(1));

        assertNotEquals(first.accessToken(), second.accessToken());
        assertNotEquals(first.refreshToken(), second.refreshToken());
    }

    @Test
    @DisplayName("the session id should be the SHA-256 of the access token")
    void sessionId() {
        assertEquals(SecureHash.sha256Hex("token-1"), issuer.sessionIdFor("token-1"));
    }
}
