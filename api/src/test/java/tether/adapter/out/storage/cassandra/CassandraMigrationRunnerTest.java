package tether.adapter.out.storage.cassandra;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

import java.io.IOException;
import java.util.List;

import com.datastax.oss.driver.api.core.CqlSession;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

@DisplayName("CassandraMigrationRunner")
class CassandraMigrationRunnerTest {

    @Nested
    @DisplayName("statements")
    class Statements {

        @Test
        @DisplayName("should split on semicolons and drop comments and blanks")
        void split() {
            var content = """
                    -- header comment
                    CREATE TABLE a (id text PRIMARY KEY);

                    -- second
                    CREATE INDEX IF NOT EXISTS a_idx ON a (id);
                    ;
                    """;

            assertEquals(
                    List.of("CREATE TABLE a (id text PRIMARY KEY)", "CREATE INDEX IF NOT EXISTS a_idx ON a (id)"),
                    CassandraMigrationRunner.statements(content));
        }

        @Test
        @DisplayName("should skip USE statements")
        void skipUse() {
            assertEquals(
                    List.of("SELECT now() FROM system.local"),
                    CassandraMigrationRunner.statements("use tether;\nSELECT now() FROM system.local;"));
        }
    }

    @Test
    @DisplayName("should find the bundled migrations in version order")
    void discover() throws IOException {
        var migrations = new CassandraMigrationRunner(mock(CqlSession.class), "tether").discoverMigrations();

        assertEquals(List.of(1, 2), migrations.stream().map(CassandraMigrationRunner.Migration::version).toList());
        assertEquals(5, CassandraMigrationRunner.statements(migrations.get(1).content()).size());
    }

    @Test
    @DisplayName("the keyspace migration should use the configured keyspace")
    void keyspace() throws IOException {
        var session = mock(CqlSession.class);
        var statement = ArgumentCaptor.forClass(String.class);

        new CassandraMigrationRunner(session, "sessions_test").runKeyspaceMigration();

        verify(session).execute(statement.capture());
        assertTrue(statement.getValue().startsWith("CREATE KEYSPACE IF NOT EXISTS sessions_test"));
    }
}
