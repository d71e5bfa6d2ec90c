package com.missioncontrol.core.store;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.Statement;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class SchemaMigratorTest {

    private DataSource dataSource;

    @BeforeEach
    void setUp() {
        dataSource = H2Databases.newDataSource();
    }

    private int count(String sql) throws Exception {
        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery(sql)) {
            rs.next();
            return rs.getInt(1);
        }
    }

    @Test
    @DisplayName("first run applies every migration in order")
    void appliesAllMigrations() {
        var migrator = new SchemaMigrator(dataSource);

        List<String> applied = migrator.migrate();

        assertEquals(List.of("001", "002", "003"), applied);
        assertEquals(Set.of("001", "002", "003"), migrator.appliedIds());
    }

    @Test
    @DisplayName("second run is a no-op")
    void idempotent() throws Exception {
        var migrator = new SchemaMigrator(dataSource);
        migrator.migrate();

        assertTrue(migrator.migrate().isEmpty());
        assertEquals(1, count("SELECT COUNT(*) FROM workspaces WHERE id = 'default'"));
        assertEquals(3, count("SELECT COUNT(*) FROM schema_migrations"));
    }

    @Test
    @DisplayName("seeds the default workspace")
    void seedsDefaultWorkspace() throws Exception {
        new SchemaMigrator(dataSource).migrate();

        assertEquals(1, count("SELECT COUNT(*) FROM workspaces WHERE slug = 'default'"));
    }

    @Test
    @DisplayName("only steps missing from the ledger are applied")
    void appliesOnlyNewSteps() {
        var first = List.of(Migration.of("001", "one", "CREATE TABLE a (id INT)"));
        new SchemaMigrator(dataSource, first).migrate();

        var extended = List.of(
                Migration.of("001", "one", "CREATE TABLE a (id INT)"),
                Migration.of("002", "two", "CREATE TABLE b (id INT)"));

        assertEquals(List.of("002"), new SchemaMigrator(dataSource, extended).migrate());
    }

    @Test
    @DisplayName("a failing step rolls back and is not recorded")
    void failingStepNotRecorded() {
        var migrations = List.of(
                Migration.of("001", "ok", "CREATE TABLE a (id INT)"),
                Migration.of("002", "broken", "CREATE TABLE b (id INT)", "THIS IS NOT SQL"));
        var migrator = new SchemaMigrator(dataSource, migrations);

        assertThrows(StoreException.class, migrator::migrate);
        assertEquals(Set.of("001"), migrator.appliedIds());
    }
}
