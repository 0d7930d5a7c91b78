package tether.testing;

import java.time.Duration;
import java.util.Optional;

import tether.core.config.SessionStoreConfig;

/**
 * SessionStoreConfig with the production defaults, adjustable per test.
 */
public class TestSessionStoreConfig implements SessionStoreConfig {

    public String keyPrefix = "tether:";
    public String cacheProvider = "memory";
    public String durableProvider = "memory";
    public boolean journalEnabled = true;
    public boolean cleanupEnabled = true;
    public boolean metricsEnabled = true;
    public Duration revokedRetention = Duration.ofDays(30);
    public Duration accessLifetime = Duration.ofHours(1);
    public Duration refreshLifetime = Duration.ofDays(7);
    public Duration rememberMeLifetime = Duration.ofDays(30);

    @Override
    public String keyPrefix() {
        return keyPrefix;
    }

    @Override
    public ProviderTtlConfig ttl() {
        return new ProviderTtlConfig() {
            @Override
            public Duration jwt() {
                return Duration.ofHours(1);
            }

            @Override
            public Duration apiKey() {
                return Duration.ofHours(24);
            }

            @Override
            public Duration oauth() {
                return Duration.ofHours(2);
            }

            @Override
            public Duration social() {
                return Duration.ofHours(1);
            }

            @Override
            public Duration saml() {
                return Duration.ofHours(8);
            }

            @Override
            public Duration ldap() {
                return Duration.ofHours(8);
            }
        };
    }

    @Override
    public TokenConfig tokens() {
        return new TokenConfig() {
            @Override
            public Duration accessLifetime() {
                return accessLifetime;
            }

            @Override
            public Duration refreshLifetime() {
                return refreshLifetime;
            }

            @Override
            public Duration rememberMeLifetime() {
                return rememberMeLifetime;
            }
        };
    }

    @Override
    public CacheConfig cache() {
        return () -> cacheProvider;
    }

    @Override
    public DurableConfig durable() {
        return new DurableConfig() {
            @Override
            public String provider() {
                return durableProvider;
            }

            @Override
            public CassandraConfig cassandra() {
                return new CassandraConfig() {
                    @Override
                    public String contactPoints() {
                        return "localhost:9042";
                    }

                    @Override
                    public String datacenter() {
                        return "datacenter1";
                    }

                    @Override
                    public String keyspace() {
                        return "tether";
                    }

                    @Override
                    public Optional<String> username() {
                        return Optional.empty();
                    }

                    @Override
                    public Optional<String> password() {
                        return Optional.empty();
                    }

                    @Override
                    public boolean runMigrations() {
                        return false;
                    }
                };
            }
        };
    }

    @Override
    public CleanupConfig cleanup() {
        return new CleanupConfig() {
            @Override
            public boolean enabled() {
                return cleanupEnabled;
            }

            @Override
            public String interval() {
                return "15m";
            }

            @Override
            public Duration revokedRetention() {
                return revokedRetention;
            }
        };
    }

    @Override
    public TransactionConfig transaction() {
        return new TransactionConfig() {
            @Override
            public boolean journalEnabled() {
                return journalEnabled;
            }

            @Override
            public Duration journalTtl() {
                return Duration.ofHours(24);
            }
        };
    }

    @Override
    public MetricsConfig metrics() {
        return () -> metricsEnabled;
    }
}
