package tether.core.model.session;

import java.util.Locale;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Authentication mechanism that issued a session.
 *
 * <p>The provider decides the default cache TTL of the session and is the key of
 * the provider index.
 */
public enum AuthProvider {
    JWT("jwt"),
    API_KEY("api_key"),
    OAUTH("oauth"),
    SOCIAL("social"),
    SAML("saml"),
    LDAP("ldap");

    private final String key;

    AuthProvider(String key) {
        this.key = key;
    }

    /**
     * Stable lower-case key used in cache keys, criteria maps and serialized records.
     */
    @JsonValue
    public String key() {
        return key;
    }

    /**
     * Resolve a provider from its key.
     *
     * @param key provider key, case-insensitive
     * @return the matching provider
     * @throws IllegalArgumentException if the key is unknown
     */
    @JsonCreator
    public static AuthProvider fromKey(String key) {
        return find(key).orElseThrow(() -> new IllegalArgumentException("Unknown auth provider: " + key));
    }

    public static Optional<AuthProvider> find(String key) {
        if (key == null || key.isBlank()) {
            return Optional.empty();
        }
        final var normalized = key.trim().toLowerCase(Locale.ROOT);
        for (AuthProvider provider : values()) {
            if (provider.key.equals(normalized)) {
                return Optional.of(provider);
            }
        }
        return Optional.empty();
    }
}
