package com.missioncontrol.core.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Applies the ordered list of {@link Migration}s at startup.
 * <p>
 * Applied ids are recorded in the {@code schema_migrations} ledger table; a step whose id is
 * already there is skipped, so running the migrator repeatedly is a no-op after the first
 * run. Each step and its ledger row commit together.
 */
public class SchemaMigrator {

    private static final Logger log = LoggerFactory.getLogger(SchemaMigrator.class);

    private static final String LEDGER_TABLE = "schema_migrations";

    private static final String CREATE_LEDGER_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                id         VARCHAR(16) PRIMARY KEY,
                name       VARCHAR(255) NOT NULL,
                applied_at TIMESTAMP WITH TIME ZONE DEFAULT CURRENT_TIMESTAMP
            )
            """.formatted(LEDGER_TABLE);

    private static final String SELECT_APPLIED_SQL = """
            SELECT id FROM %s ORDER BY id
            """.formatted(LEDGER_TABLE);

    private static final String INSERT_APPLIED_SQL = """
            INSERT INTO %s (id, name) VALUES (?, ?)
            """.formatted(LEDGER_TABLE);

    /** Never remove or reorder entries; append new steps at the end. */
    public static final List<Migration> MIGRATIONS = List.of(
            Migration.of("001", "initial_schema",
                    """
                    CREATE TABLE IF NOT EXISTS workspaces (
                        id          VARCHAR(64) PRIMARY KEY,
                        name        VARCHAR(255) NOT NULL,
                        slug        VARCHAR(255) NOT NULL UNIQUE,
                        description TEXT,
                        created_at  TIMESTAMP WITH TIME ZONE DEFAULT CURRENT_TIMESTAMP
                    )
                    """,
                    """
                    CREATE TABLE IF NOT EXISTS tasks (
                        id              VARCHAR(64) PRIMARY KEY,
                        title           VARCHAR(500) NOT NULL,
                        description     TEXT,
                        status          VARCHAR(32) NOT NULL,
                        priority        VARCHAR(16) NOT NULL,
                        workspace_id    VARCHAR(64) NOT NULL,
                        parent_task_id  VARCHAR(64) REFERENCES tasks(id),
                        source          VARCHAR(16) NOT NULL,
                        tags            TEXT NOT NULL,
                        approval_status VARCHAR(16),
                        approved_at     TIMESTAMP WITH TIME ZONE,
                        approved_by     VARCHAR(255),
                        color           VARCHAR(32),
                        sort_order      INTEGER NOT NULL DEFAULT 0,
                        agent_id        VARCHAR(255),
                        session_key     VARCHAR(255),
                        created_at      TIMESTAMP WITH TIME ZONE NOT NULL,
                        updated_at      TIMESTAMP WITH TIME ZONE NOT NULL
                    )
                    """,
                    """
                    CREATE TABLE IF NOT EXISTS task_activities (
                        id            VARCHAR(64) PRIMARY KEY,
                        task_id       VARCHAR(64) NOT NULL REFERENCES tasks(id),
                        agent_id      VARCHAR(255),
                        activity_type VARCHAR(32) NOT NULL,
                        message       TEXT NOT NULL,
                        metadata      TEXT,
                        created_at    TIMESTAMP WITH TIME ZONE NOT NULL
                    )
                    """),
            Migration.of("002", "seed_default_workspace",
                    """
                    INSERT INTO workspaces (id, name, slug, description)
                    SELECT 'default', 'Default Workspace', 'default', 'Default workspace'
                    WHERE NOT EXISTS (SELECT 1 FROM workspaces WHERE id = 'default')
                    """),
            Migration.of("003", "add_task_indexes",
                    "CREATE INDEX IF NOT EXISTS idx_tasks_workspace ON tasks(workspace_id)",
                    "CREATE INDEX IF NOT EXISTS idx_tasks_parent ON tasks(parent_task_id, sort_order)",
                    "CREATE INDEX IF NOT EXISTS idx_activities_task ON task_activities(task_id, created_at)")
    );

    private final DataSource dataSource;
    private final List<Migration> migrations;

    public SchemaMigrator(DataSource dataSource) {
        this(dataSource, MIGRATIONS);
    }

    SchemaMigrator(DataSource dataSource, List<Migration> migrations) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
        this.migrations = List.copyOf(migrations);
    }

    /**
     * Applies every migration not yet in the ledger.
     *
     * @return ids applied by this call, in order
     */
    public List<String> migrate() {
        List<String> applied = new ArrayList<>();
        try (Connection conn = dataSource.getConnection()) {
            try (Statement stmt = conn.createStatement()) {
                stmt.execute(CREATE_LEDGER_SQL);
            }
            Set<String> done = appliedIds(conn);
            for (Migration migration : migrations) {
                if (done.contains(migration.id())) {
                    continue;
                }
                apply(conn, migration);
                applied.add(migration.id());
            }
        } catch (SQLException e) {
            throw new StoreException("Schema migration failed", e);
        }

        if (applied.isEmpty()) {
            log.info("Schema up to date ({} migrations)", migrations.size());
        } else {
            log.info("Applied {} migration(s): {}", applied.size(), applied);
        }
        return applied;
    }

    /** Ids currently recorded in the ledger. */
    public Set<String> appliedIds() {
        try (Connection conn = dataSource.getConnection()) {
            return appliedIds(conn);
        } catch (SQLException e) {
            throw new StoreException("Failed to read migration ledger", e);
        }
    }

    private Set<String> appliedIds(Connection conn) throws SQLException {
        Set<String> ids = new LinkedHashSet<>();
        try (PreparedStatement stmt = conn.prepareStatement(SELECT_APPLIED_SQL);
             ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                ids.add(rs.getString("id"));
            }
        }
        return ids;
    }

    private void apply(Connection conn, Migration migration) throws SQLException {
        log.info("Applying migration {} ({})", migration.id(), migration.name());
        boolean autoCommit = conn.getAutoCommit();
        conn.setAutoCommit(false);
        try {
            try (Statement stmt = conn.createStatement()) {
                for (String sql : migration.statements()) {
                    stmt.execute(sql);
                }
            }
            try (PreparedStatement stmt = conn.prepareStatement(INSERT_APPLIED_SQL)) {
                stmt.setString(1, migration.id());
                stmt.setString(2, migration.name());
                stmt.executeUpdate();
            }
            conn.commit();
        } catch (SQLException e) {
            conn.rollback();
            throw e;
        } finally {
            conn.setAutoCommit(autoCommit);
        }
    }
}
