package tether.core.model.session;

import java.time.Duration;

/**
 * Input for creating a session.
 *
 * @param user        user snapshot
 * @param provider    issuing provider
 * @param ttlOverride explicit cache TTL, or null for the provider default
 * @param ipAddress   client address (may be null)
 * @param userAgent   client user agent (may be null)
 * @param rememberMe  extend the refresh lifetime
 * @param tokens      pre-issued tokens, or null to issue a fresh pair
 */
public record SessionRequest(
        SessionUser user,
        AuthProvider provider,
        Duration ttlOverride,
        String ipAddress,
        String userAgent,
        boolean rememberMe,
        TokenPair tokens) {

    public SessionRequest {
        if (user == null) {
            throw new IllegalArgumentException("User cannot be null");
        }
        if (provider == null) {
            provider = AuthProvider.JWT;
        }
    }

    public static SessionRequest of(SessionUser user, AuthProvider provider) {
        return new SessionRequest(user, provider, null, null, null, false, null);
    }

    public SessionRequest withTokens(TokenPair newTokens) {
        return new SessionRequest(user, provider, ttlOverride, ipAddress, userAgent, rememberMe, newTokens);
    }

    public SessionRequest withTtlOverride(Duration ttl) {
        return new SessionRequest(user, provider, ttl, ipAddress, userAgent, rememberMe, tokens);
    }

    public SessionRequest withClient(String ip, String agent) {
        return new SessionRequest(user, provider, ttlOverride, ip, agent, rememberMe, tokens);
    }

    public SessionRequest withRememberMe(boolean remember) {
        return new SessionRequest(user, provider, ttlOverride, ipAddress, userAgent, remember, tokens);
    }
}
