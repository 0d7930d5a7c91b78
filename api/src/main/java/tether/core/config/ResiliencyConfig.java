package tether.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for storage timeouts.
 *
 * <p>Configuration prefix: {@code tether.resiliency}
 */
@ConfigMapping(prefix = "tether.resiliency")
public interface ResiliencyConfig {

    /**
     * Redis timeout configuration.
     */
    RedisConfig redis();

    /**
     * Cassandra timeout configuration.
     */
    CassandraConfig cassandra();

    interface RedisConfig {

        /**
         * Maximum time to wait for a single Redis operation.
         *
         * @return Operation timeout (default: 1 second)
         */
        @WithDefault("PT1S")
        Duration operationTimeout();
    }

    interface CassandraConfig {

        /**
         * Maximum time to wait for a Cassandra query.
         *
         * @return Query timeout (default: 5 seconds)
         */
        @WithDefault("PT5S")
        Duration queryTimeout();
    }
}
