package tether.core.service.session;

import java.time.Duration;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import tether.core.config.SessionStoreConfig;
import tether.core.model.session.AuthProvider;

/**
 * Resolves the cache TTL of a session from its provider.
 */
@ApplicationScoped
public class ProviderTtlPolicy {

    private final SessionStoreConfig.ProviderTtlConfig ttl;

    @Inject
    public ProviderTtlPolicy(SessionStoreConfig config) {
        this.ttl = config.ttl();
    }

    /**
     * Configured TTL for a provider.
     *
     * <p>For {@link AuthProvider#API_KEY} this is only the fallback; API key sessions
     * normally pass the remaining lifetime of the key as an override.
     */
    public Duration ttlFor(AuthProvider provider) {
        return switch (provider) {
            case JWT -> ttl.jwt();
            case API_KEY -> ttl.apiKey();
            case OAUTH -> ttl.oauth();
            case SOCIAL -> ttl.social();
            case SAML -> ttl.saml();
            case LDAP -> ttl.ldap();
        };
    }

    /**
     * TTL to apply when storing a session.
     *
     * @param provider provider of the session
     * @param override explicit TTL, ignored when null or not positive
     * @return the override if usable, otherwise the provider TTL
     */
    public Duration resolve(AuthProvider provider, Duration override) {
        if (override != null && !override.isZero() && !override.isNegative()) {
            return override.toSeconds() > 0 ? override : Duration.ofSeconds(1);
        }
        return ttlFor(provider);
    }
}
