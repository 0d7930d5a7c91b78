package tether.core.port.out;

import java.time.Duration;

import tether.core.model.session.SessionUser;
import tether.core.model.session.TokenPair;

/**
 * Port for issuing credentials and mapping them to session ids.
 */
public interface TokenIssuer {

    /**
     * Issue a fresh access/refresh pair.
     *
     * @param user           user the tokens belong to
     * @param accessLifetime lifetime reported as {@link TokenPair#expiresIn()}
     * @return the token pair
     */
    TokenPair issue(SessionUser user, Duration accessLifetime);

    /**
     * Derive the session id of a token. The same token always yields the same id.
     *
     * @param token access or refresh token
     * @return the session id
     */
    String sessionIdFor(String token);
}
