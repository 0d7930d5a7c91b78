package tether.core.service.session;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import tether.core.config.SessionStoreConfig;
import tether.core.model.session.AuthProvider;
import tether.core.util.SecureHash;

/**
 * Cache key layout of the session store.
 */
@ApplicationScoped
public class SessionKeys {

    private final String prefix;

    @Inject
    public SessionKeys(SessionStoreConfig config) {
        this(config.keyPrefix());
    }

    public SessionKeys(String prefix) {
        this.prefix = prefix == null ? "" : prefix;
    }

    public String session(String sessionId) {
        return prefix + "session:" + sessionId;
    }

    /**
     * Refresh-token lookup key; holds the id of the session the token belongs to.
     */
    public String refreshMapping(String refreshToken) {
        return prefix + "session_refresh:" + SecureHash.sha256Hex(refreshToken);
    }

    public String providerIndex(AuthProvider provider) {
        return prefix + "index:provider:" + provider.key();
    }

    public String userIndex(String userUuid) {
        return prefix + "index:user:" + userUuid;
    }

    public String transactionJournal(String transactionId) {
        return prefix + "tx:" + transactionId;
    }
}
