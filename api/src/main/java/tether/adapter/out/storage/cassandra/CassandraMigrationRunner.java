package tether.adapter.out.storage.cassandra;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import com.datastax.oss.driver.api.core.CqlSession;
import org.jboss.logging.Logger;

/**
 * Applies the CQL scripts under {@code db/cassandra/} in version order.
 *
 * <p>Scripts are named {@code V{version}__{description}.cql}. V1 creates the keyspace
 * and runs on a session without one; later versions are recorded in
 * {@code schema_migrations} and applied once.
 */
public class CassandraMigrationRunner {

    private static final Logger LOG = Logger.getLogger(CassandraMigrationRunner.class);
    private static final String MIGRATIONS_PATH = "db/cassandra/";
    private static final Pattern MIGRATION_PATTERN = Pattern.compile("V(\\d+)__.*\\.cql");
    private static final String DEFAULT_KEYSPACE = "tether";

    static final List<String> MIGRATIONS = List.of("V1__create_keyspace.cql", "V2__create_sessions.cql");

    private final CqlSession session;
    private final String keyspace;

    public CassandraMigrationRunner(CqlSession session, String keyspace) {
        this.session = session;
        this.keyspace = keyspace;
    }

    /**
     * Create the keyspace if missing. Expects a session not bound to a keyspace.
     */
    public void runKeyspaceMigration() throws IOException {
        final String content = readMigrationFile(MIGRATIONS.get(0))
                .replace("EXISTS " + DEFAULT_KEYSPACE, "EXISTS " + keyspace);
        LOG.info("Ensuring keyspace exists...");
        for (String statement : statements(content)) {
            session.execute(statement);
        }
    }

    /**
     * Apply pending migrations after V1. Expects a session bound to the keyspace.
     *
     * @return number of migrations applied
     */
    public int runMigrations() throws IOException {
        session.execute(
                """
                CREATE TABLE IF NOT EXISTS %s.schema_migrations (
                    version int PRIMARY KEY,
                    script_name text,
                    applied_at timestamp
                )
                """
                        .formatted(keyspace));

        final Set<Integer> applied = session.execute("SELECT version FROM %s.schema_migrations".formatted(keyspace))
                .all()
                .stream()
                .map(row -> row.getInt("version"))
                .collect(Collectors.toSet());

        int count = 0;
        for (Migration migration : discoverMigrations()) {
            if (migration.version() > 1 && !applied.contains(migration.version())) {
                applyMigration(migration);
                count++;
            }
        }

        if (count > 0) {
            LOG.infov("Applied {0} migration(s)", count);
        } else {
            LOG.debug("No pending migrations");
        }
        return count;
    }

    List<Migration> discoverMigrations() throws IOException {
        final List<Migration> migrations = new ArrayList<>();
        for (String filename : MIGRATIONS) {
            final Matcher matcher = MIGRATION_PATTERN.matcher(filename);
            if (matcher.matches()) {
                migrations.add(
                        new Migration(Integer.parseInt(matcher.group(1)), filename, readMigrationFile(filename)));
            }
        }
        migrations.sort(Comparator.comparingInt(Migration::version));
        return migrations;
    }

    static List<String> statements(String content) {
        final List<String> statements = new ArrayList<>();
        for (String statement : content.split(";")) {
            final String trimmed = statement.lines()
                    .filter(line -> !line.trim().startsWith("--"))
                    .collect(Collectors.joining("\n"))
                    .trim();
            if (!trimmed.isEmpty() && !trimmed.toUpperCase().startsWith("USE ")) {
                statements.add(trimmed);
            }
        }
        return statements;
    }

    private String readMigrationFile(String filename) throws IOException {
        final String path = MIGRATIONS_PATH + filename;
        try (InputStream is = getClass().getClassLoader().getResourceAsStream(path)) {
            if (is == null) {
                throw new IOException("Migration file not found: " + path);
            }
            return new String(is.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    private void applyMigration(Migration migration) {
        LOG.infov("Applying migration V{0}: {1}", migration.version(), migration.filename());
        for (String statement : statements(migration.content())) {
            session.execute(statement);
        }
        session.execute(
                "INSERT INTO %s.schema_migrations (version, script_name, applied_at) VALUES (?, ?, ?)"
                        .formatted(keyspace),
                migration.version(),
                migration.filename(),
                Instant.now());
        LOG.infov("Migration V{0} applied", migration.version());
    }

    record Migration(int version, String filename, String content) {}
}
