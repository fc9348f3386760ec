package io.taskpatrol.storage;

import io.taskpatrol.config.TaskPatrolConfig;
import io.taskpatrol.util.Hashing;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.Set;

public final class Database {
    private static final Logger logger = LoggerFactory.getLogger(Database.class);
    private static final String MIGRATION_SCHEMA_VERSION = "taskpatrol.schema.migration.v1";
    private static final int BUSY_TIMEOUT_MS = 5_000;
    private static final Map<String, String> EXPECTED_PRAGMAS = Map.of(
            "journal_mode", "wal",
            "synchronous", "1",
            "foreign_keys", "1");
    private static final List<MigrationStep> MIGRATIONS = List.of(
            new MigrationStep(
                    "20261001_001_execution_history_indexes",
                    "Reverse-chronological execution history index",
                    List.of("CREATE INDEX IF NOT EXISTS idx_executions_task_history ON executions(task_id, queued_at_ms DESC, execution_id DESC)"))
    );

    private final TaskPatrolConfig config;
    private final Clock clock;
    private final String jdbcUrl;
    private final Properties connectionProperties;

    public Database(TaskPatrolConfig config) {
        this(config, Clock.systemUTC());
    }

    public Database(TaskPatrolConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;
        this.jdbcUrl = "jdbc:sqlite:" + config.dbFile().toString();
        this.connectionProperties = new Properties();
        // foreign_keys and busy_timeout are per-connection settings in SQLite.
        this.connectionProperties.setProperty("foreign_keys", "true");
        this.connectionProperties.setProperty("busy_timeout", Integer.toString(BUSY_TIMEOUT_MS));
        // Write transactions take the reserved lock up front so read-then-write sequences never hit SQLITE_BUSY_SNAPSHOT.
        this.connectionProperties.setProperty("transaction_mode", "IMMEDIATE");
    }

    public void init() {
        initDirectories();
        applyAndValidatePragmas();
        initSchema();
        logger.info("Database ready at {}", config.dbFile());
    }

    public Connection openConnection() throws SQLException {
        return DriverManager.getConnection(jdbcUrl, connectionProperties);
    }

    private void initDirectories() {
        try {
            Files.createDirectories(config.rootDir());
            Files.createDirectories(config.inboxDir());
            Files.createDirectories(config.processingDir());
            Files.createDirectories(config.doneRoot());
            Files.createDirectories(config.deadRoot());
            Files.createDirectories(config.auditRoot());
            Files.createDirectories(config.securityRoot());
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize directories", e);
        }
    }

    private void initSchema() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS credentials (
                        credential_id TEXT PRIMARY KEY,
                        tenant_id TEXT NOT NULL,
                        name TEXT NOT NULL,
                        secret_blob TEXT NOT NULL,
                        region TEXT NOT NULL,
                        is_default INTEGER NOT NULL DEFAULT 0,
                        is_active INTEGER NOT NULL DEFAULT 1,
                        created_at_ms INTEGER NOT NULL,
                        updated_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS task_definitions (
                        task_id TEXT PRIMARY KEY,
                        tenant_id TEXT NOT NULL,
                        name TEXT NOT NULL,
                        service_category TEXT NOT NULL,
                        operation TEXT NOT NULL,
                        configuration TEXT NOT NULL,
                        frequency TEXT NOT NULL,
                        is_active INTEGER NOT NULL DEFAULT 1,
                        credential_id TEXT,
                        created_at_ms INTEGER NOT NULL,
                        updated_at_ms INTEGER NOT NULL,
                        last_trigger_at_ms INTEGER NOT NULL,
                        FOREIGN KEY(credential_id) REFERENCES credentials(credential_id) ON DELETE RESTRICT
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS executions (
                        execution_id TEXT PRIMARY KEY,
                        task_id TEXT NOT NULL,
                        tenant_id TEXT NOT NULL,
                        trigger_reason TEXT NOT NULL,
                        status TEXT NOT NULL,
                        queued_at_ms INTEGER NOT NULL,
                        started_at_ms INTEGER,
                        finished_at_ms INTEGER,
                        attempt INTEGER NOT NULL DEFAULT 1,
                        error_classification TEXT,
                        error_detail TEXT,
                        lease_holder TEXT,
                        lease_token TEXT,
                        updated_at_ms INTEGER NOT NULL,
                        FOREIGN KEY(task_id) REFERENCES task_definitions(task_id)
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS results (
                        execution_id TEXT PRIMARY KEY,
                        payload TEXT NOT NULL,
                        produced_at_ms INTEGER NOT NULL,
                        FOREIGN KEY(execution_id) REFERENCES executions(execution_id)
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS leases (
                        task_id TEXT PRIMARY KEY,
                        execution_id TEXT NOT NULL,
                        holder TEXT NOT NULL,
                        token TEXT NOT NULL,
                        acquired_at_ms INTEGER NOT NULL,
                        expires_at_ms INTEGER NOT NULL
                    )
                    """);
            ensureSchemaMigrationsTable(conn);
            applyVersionedMigrations(conn);

            st.execute("CREATE UNIQUE INDEX IF NOT EXISTS ux_credentials_tenant_default ON credentials(tenant_id) WHERE is_default=1");
            st.execute("CREATE INDEX IF NOT EXISTS idx_credentials_tenant ON credentials(tenant_id, created_at_ms)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_tasks_tenant ON task_definitions(tenant_id, created_at_ms)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_tasks_active_frequency ON task_definitions(is_active, frequency)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_tasks_credential ON task_definitions(credential_id)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_executions_task_queued ON executions(task_id, queued_at_ms, execution_id)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_executions_status ON executions(status, updated_at_ms)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_leases_expires ON leases(expires_at_ms)");
        } catch (SQLException e) {
            throw new RuntimeException("Failed to initialize SQLite schema", e);
        }
    }

    private void ensureSchemaMigrationsTable(Connection conn) throws SQLException {
        try (Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS schema_migrations (
                        version TEXT PRIMARY KEY,
                        description TEXT NOT NULL,
                        checksum TEXT NOT NULL,
                        applied_at_ms INTEGER NOT NULL,
                        success INTEGER NOT NULL
                    )
                    """);
        }
    }

    /**
     * Applies every step in {@link #MIGRATIONS} not yet recorded as successful. Each step runs in its own
     * transaction together with its bookkeeping row.
     */
    private void applyVersionedMigrations(Connection conn) throws SQLException {
        Set<String> applied = appliedVersions(conn);
        for (MigrationStep step : MIGRATIONS) {
            if (applied.contains(step.version())) {
                continue;
            }
            conn.setAutoCommit(false);
            try (Statement st = conn.createStatement();
                 PreparedStatement bookkeeping = conn.prepareStatement(
                         "INSERT OR REPLACE INTO schema_migrations(version,description,checksum,applied_at_ms,success) VALUES(?,?,?,?,1)")) {
                for (String sql : step.sql()) {
                    st.execute(sql);
                }
                bookkeeping.setString(1, step.version());
                bookkeeping.setString(2, step.description());
                bookkeeping.setString(3, step.checksum());
                bookkeeping.setLong(4, clock.millis());
                bookkeeping.executeUpdate();
                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            } finally {
                conn.setAutoCommit(true);
            }
            logger.info("Applied schema migration {}", step.version());
        }
    }

    private static Set<String> appliedVersions(Connection conn) throws SQLException {
        Set<String> versions = new HashSet<>();
        try (Statement st = conn.createStatement();
             ResultSet rs = st.executeQuery("SELECT version FROM schema_migrations WHERE success=1")) {
            while (rs.next()) {
                versions.add(rs.getString(1));
            }
        }
        return versions;
    }

    private void applyAndValidatePragmas() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("PRAGMA journal_mode=WAL");
            st.execute("PRAGMA synchronous=NORMAL");
            for (Map.Entry<String, String> expected : EXPECTED_PRAGMAS.entrySet()) {
                String actual = readPragma(st, expected.getKey());
                if (!expected.getValue().equalsIgnoreCase(actual)) {
                    throw new IllegalStateException("SQLite pragma " + expected.getKey() + " is " + actual
                            + ", required " + expected.getValue());
                }
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to apply SQLite pragmas", e);
        }
    }

    private static String readPragma(Statement st, String pragma) throws SQLException {
        try (ResultSet rs = st.executeQuery("PRAGMA " + pragma)) {
            return rs.next() ? rs.getString(1) : null;
        }
    }

    public List<SchemaMigrationRow> listSchemaMigrations() {
        String sql = "SELECT version,description,checksum,applied_at_ms,success FROM schema_migrations ORDER BY applied_at_ms DESC, version DESC";
        List<SchemaMigrationRow> out = new ArrayList<>();
        try (Connection c = openConnection(); PreparedStatement ps = c.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.add(new SchemaMigrationRow(
                        rs.getString("version"),
                        rs.getString("description"),
                        rs.getString("checksum"),
                        rs.getLong("applied_at_ms"),
                        rs.getInt("success") == 1
                ));
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list schema migrations", e);
        }
    }

    private record MigrationStep(String version, String description, List<String> sql) {
        String checksum() {
            return Hashing.sha256Hex(MIGRATION_SCHEMA_VERSION + "|" + version + "|" + String.join(";", sql));
        }
    }

    public record SchemaMigrationRow(
            String version,
            String description,
            String checksum,
            long appliedAtMs,
            boolean success
    ) {
    }
}
