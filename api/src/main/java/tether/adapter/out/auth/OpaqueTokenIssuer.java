package tether.adapter.out.auth;

import java.security.SecureRandom;
import java.time.Duration;
import java.util.Base64;
import java.util.HexFormat;

import jakarta.enterprise.context.ApplicationScoped;

import tether.core.model.session.SessionUser;
import tether.core.model.session.TokenPair;
import tether.core.port.out.TokenIssuer;
import tether.core.util.SecureHash;

/**
 * Issues opaque random tokens.
 *
 * <p>Access tokens are 32 bytes (256 bits) of random data encoded as URL-safe
 * Base64; refresh tokens are 32 random bytes in hex. A session id is the SHA-256
 * hex digest of its access token, so the raw token never appears in a cache key.
 */
@ApplicationScoped
public class OpaqueTokenIssuer implements TokenIssuer {

    private static final int TOKEN_BYTES = 32;
    private static final SecureRandom SECURE_RANDOM = new SecureRandom();
    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();

    @Override
    public TokenPair issue(SessionUser user, Duration accessLifetime) {
        return new TokenPair(ENCODER.encodeToString(randomBytes()), HexFormat.of().formatHex(randomBytes()),
                accessLifetime.toSeconds());
    }

    @Override
    public String sessionIdFor(String token) {
        return SecureHash.sha256Hex(token);
    }

    private static byte[] randomBytes() {
        final byte[] bytes = new byte[TOKEN_BYTES];
        SECURE_RANDOM.nextBytes(bytes);
        return bytes;
    }
}
