package tether.core.config;

import java.time.Duration;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for the session store.
 *
 * <p>Configuration prefix: {@code tether.session}
 */
@ConfigMapping(prefix = "tether.session")
public interface SessionStoreConfig {

    /**
     * Prefix applied to every cache key written by the store.
     *
     * @return Key prefix (default: tether:)
     */
    @WithDefault("tether:")
    String keyPrefix();

    /**
     * Per-provider cache TTLs.
     */
    ProviderTtlConfig ttl();

    /**
     * Token lifetimes used when the store issues tokens itself.
     */
    TokenConfig tokens();

    /**
     * Cache layer selection.
     */
    CacheConfig cache();

    /**
     * Durable layer selection.
     */
    DurableConfig durable();

    /**
     * Background cleanup.
     */
    CleanupConfig cleanup();

    /**
     * Transaction settings.
     */
    TransactionConfig transaction();

    /**
     * Metrics recording.
     */
    MetricsConfig metrics();

    interface ProviderTtlConfig {

        @WithDefault("PT1H")
        Duration jwt();

        /**
         * Fallback for API key sessions stored without the key's own lifetime.
         */
        @WithDefault("PT24H")
        Duration apiKey();

        @WithDefault("PT2H")
        Duration oauth();

        @WithDefault("PT1H")
        Duration social();

        @WithDefault("PT8H")
        Duration saml();

        @WithDefault("PT8H")
        Duration ldap();
    }

    interface TokenConfig {

        /**
         * @return Access token lifetime (default: 1 hour)
         */
        @WithDefault("PT1H")
        Duration accessLifetime();

        /**
         * @return Refresh token lifetime (default: 7 days)
         */
        @WithDefault("P7D")
        Duration refreshLifetime();

        /**
         * @return Refresh token lifetime for remember-me sessions (default: 30 days)
         */
        @WithDefault("P30D")
        Duration rememberMeLifetime();
    }

    interface CacheConfig {

        /**
         * Preferred cache provider.
         *
         * <p>Falls back to the highest priority available provider, and finally to
         * in-memory storage, when the configured one is unavailable.
         *
         * @return Provider name (default: redis)
         */
        @WithDefault("redis")
        String provider();
    }

    interface DurableConfig {

        /**
         * @return Provider name (default: memory)
         */
        @WithDefault("memory")
        String provider();

        CassandraConfig cassandra();
    }

    interface CassandraConfig {

        /**
         * @return Comma-separated host:port pairs (default: localhost:9042)
         */
        @WithDefault("localhost:9042")
        String contactPoints();

        @WithDefault("datacenter1")
        String datacenter();

        @WithDefault("tether")
        String keyspace();

        Optional<String> username();

        Optional<String> password();

        /**
         * Run the bundled schema scripts at startup.
         */
        @WithDefault("false")
        boolean runMigrations();
    }

    interface CleanupConfig {

        @WithDefault("true")
        boolean enabled();

        /**
         * Interval between cleanup runs, in scheduler syntax.
         *
         * @return Interval (default: 15m)
         */
        @WithDefault("15m")
        String interval();

        /**
         * How long revoked or expired durable rows are kept before purge.
         *
         * @return Retention window (default: 30 days)
         */
        @WithDefault("P30D")
        Duration revokedRetention();
    }

    interface TransactionConfig {

        /**
         * Persist each transaction's compensations to the cache before applying the
         * forward step, so a transaction interrupted by a restart can still be rolled back.
         */
        @WithDefault("true")
        boolean journalEnabled();

        /**
         * @return Lifetime of an orphaned journal (default: 24 hours)
         */
        @WithDefault("PT24H")
        Duration journalTtl();
    }

    interface MetricsConfig {

        @WithDefault("true")
        boolean enabled();
    }
}
