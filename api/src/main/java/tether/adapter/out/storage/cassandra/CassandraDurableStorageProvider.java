package tether.adapter.out.storage.cassandra;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.util.Optional;

import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import com.datastax.oss.driver.api.core.CqlSession;
import com.datastax.oss.driver.api.core.CqlSessionBuilder;
import com.datastax.oss.driver.api.core.DriverException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.jboss.logging.Logger;

import tether.core.config.ResiliencyConfig;
import tether.core.config.SessionStoreConfig;
import tether.core.port.out.DurableSessionRepository;
import tether.spi.DurableStorageProvider;
import tether.spi.StorageProviderException;

/**
 * Cassandra durable session provider.
 *
 * <p>Configuration properties:
 * <ul>
 *   <li>tether.session.durable.cassandra.contact-points - Comma-separated host:port pairs</li>
 *   <li>tether.session.durable.cassandra.datacenter - Local datacenter name</li>
 *   <li>tether.session.durable.cassandra.keyspace - Keyspace name</li>
 *   <li>tether.session.durable.cassandra.username / password - Optional credentials</li>
 *   <li>tether.session.durable.cassandra.run-migrations - Apply CQL scripts on startup</li>
 * </ul>
 *
 * <p>Only offered when {@code tether.session.durable.provider=cassandra}, so a
 * default deployment never tries to reach a cluster.
 */
@ApplicationScoped
public class CassandraDurableStorageProvider implements DurableStorageProvider {

    private static final Logger LOG = Logger.getLogger(CassandraDurableStorageProvider.class);
    private static final int PRIORITY = 10;

    private final SessionStoreConfig config;
    private final ResiliencyConfig resiliencyConfig;

    private CqlSession session;
    private CassandraDurableSessionRepository repository;

    @Inject
    public CassandraDurableStorageProvider(SessionStoreConfig config, ResiliencyConfig resiliencyConfig) {
        this.config = config;
        this.resiliencyConfig = resiliencyConfig;
    }

    @Override
    public String name() {
        return "cassandra";
    }

    @Override
    public int priority() {
        return PRIORITY;
    }

    @Override
    public boolean isAvailable() {
        return name().equals(config.durable().provider());
    }

    @Override
    public synchronized DurableSessionRepository createRepository() {
        if (repository != null) {
            return repository;
        }
        final var cassandra = config.durable().cassandra();
        if (cassandra.runMigrations()) {
            runMigrations(cassandra);
        }

        session = buildSession(cassandra, cassandra.keyspace());
        final ObjectMapper objectMapper = new ObjectMapper()
                .registerModule(new Jdk8Module())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        try {
            repository = new CassandraDurableSessionRepository(
                    session, objectMapper, resiliencyConfig.cassandra().queryTimeout());
        } catch (RuntimeException e) {
            session.close();
            session = null;
            throw new StorageProviderException("Failed to prepare Cassandra session statements", e);
        }
        LOG.infof("Created Cassandra durable session repository in keyspace %s", cassandra.keyspace());
        return repository;
    }

    private void runMigrations(SessionStoreConfig.CassandraConfig cassandra) {
        LOG.info("Running Cassandra migrations...");
        try (CqlSession noKeyspace = buildSession(cassandra, null)) {
            new CassandraMigrationRunner(noKeyspace, cassandra.keyspace()).runKeyspaceMigration();
        } catch (IOException | DriverException e) {
            throw new StorageProviderException("Keyspace migration failed", e);
        }
        try (CqlSession keyspaceSession = buildSession(cassandra, cassandra.keyspace())) {
            new CassandraMigrationRunner(keyspaceSession, cassandra.keyspace()).runMigrations();
        } catch (IOException | DriverException e) {
            throw new StorageProviderException("Cassandra migrations failed", e);
        }
        LOG.info("Cassandra migrations completed");
    }

    private CqlSession buildSession(SessionStoreConfig.CassandraConfig cassandra, String keyspace) {
        final CqlSessionBuilder builder = CqlSession.builder().withLocalDatacenter(cassandra.datacenter());
        if (keyspace != null) {
            builder.withKeyspace(keyspace);
        }
        for (String contactPoint : cassandra.contactPoints().split(",")) {
            final String[] parts = contactPoint.trim().split(":");
            final int port = parts.length > 1 ? Integer.parseInt(parts[1]) : 9042;
            builder.addContactPoint(new InetSocketAddress(parts[0], port));
        }
        cassandra.username().ifPresent(username -> {
            final String password = cassandra.password()
                    .orElseThrow(() ->
                            new StorageProviderException("Cassandra password required when username is specified"));
            builder.withAuthCredentials(username, password);
        });

        try {
            return builder.build();
        } catch (RuntimeException e) {
            throw new StorageProviderException("Failed to connect to Cassandra", e);
        }
    }

    @Override
    public Optional<HealthCheckResponse> healthCheck() {
        final var builder = HealthCheckResponse.named("session-durable-cassandra")
                .withData("type", "cassandra")
                .withData("keyspace", config.durable().cassandra().keyspace());
        if (session != null && !session.isClosed()) {
            return Optional.of(builder.up().build());
        }
        return Optional.of(builder.down().withData("error", "Session not initialized or closed").build());
    }

    @PreDestroy
    void close() {
        if (session != null) {
            session.close();
        }
    }
}
