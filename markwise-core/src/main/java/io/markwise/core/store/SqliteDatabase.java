package io.markwise.core.store;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;

public final class SqliteDatabase {
    private static final List<String> SCHEMA = List.of(
        """
        CREATE TABLE IF NOT EXISTS session (
            id TEXT PRIMARY KEY,
            status TEXT NOT NULL,
            model_config TEXT,
            created_at TEXT NOT NULL,
            updated_at TEXT NOT NULL
        )
        """,
        """
        CREATE TABLE IF NOT EXISTS image (
            session_id TEXT NOT NULL,
            role TEXT NOT NULL,
            url TEXT NOT NULL,
            order_index INTEGER NOT NULL,
            PRIMARY KEY (session_id, role, order_index)
        )
        """,
        """
        CREATE TABLE IF NOT EXISTS question (
            session_id TEXT NOT NULL,
            question_id TEXT NOT NULL,
            number INTEGER NOT NULL,
            max_marks REAL NOT NULL,
            PRIMARY KEY (session_id, question_id)
        )
        """,
        """
        CREATE TABLE IF NOT EXISTS result (
            session_id TEXT NOT NULL,
            question_id TEXT NOT NULL,
            model_name TEXT NOT NULL,
            try_index INTEGER NOT NULL,
            marks_awarded REAL,
            rubric_notes TEXT,
            raw_output TEXT,
            validation_errors TEXT,
            updated_at TEXT NOT NULL,
            PRIMARY KEY (session_id, question_id, model_name, try_index)
        )
        """,
        """
        CREATE TABLE IF NOT EXISTS rubric_result (
            session_id TEXT NOT NULL,
            model_name TEXT NOT NULL,
            try_index INTEGER NOT NULL,
            rubric_response TEXT,
            raw_output TEXT,
            validation_errors TEXT,
            updated_at TEXT NOT NULL,
            PRIMARY KEY (session_id, model_name, try_index)
        )
        """,
        """
        CREATE TABLE IF NOT EXISTS token_usage (
            session_id TEXT NOT NULL,
            model_name TEXT NOT NULL,
            try_index INTEGER NOT NULL,
            input_tokens INTEGER NOT NULL,
            output_tokens INTEGER NOT NULL,
            reasoning_tokens INTEGER NOT NULL,
            total_tokens INTEGER NOT NULL,
            cache_creation_input_tokens INTEGER NOT NULL,
            cache_read_input_tokens INTEGER NOT NULL,
            model_id TEXT,
            finish_reason TEXT,
            cost_estimate REAL NOT NULL,
            metadata TEXT,
            PRIMARY KEY (session_id, model_name, try_index)
        )
        """,
        """
        CREATE TABLE IF NOT EXISTS app_settings (
            key TEXT PRIMARY KEY,
            value TEXT NOT NULL,
            updated_at TEXT NOT NULL
        )
        """,
        """
        CREATE INDEX IF NOT EXISTS idx_image_session
        ON image(session_id, role, order_index)
        """
    );

    private final String jdbcUrl;

    public SqliteDatabase(Path dbPath) throws IOException {
        if (dbPath == null) {
            throw new IllegalArgumentException("dbPath must not be null");
        }
        Path parent = dbPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        this.jdbcUrl = "jdbc:sqlite:" + dbPath.toAbsolutePath();
        init();
    }

    Connection openConnection() throws SQLException {
        Connection connection = DriverManager.getConnection(jdbcUrl);
        try (Statement statement = connection.createStatement()) {
            statement.execute("PRAGMA journal_mode=WAL;");
            statement.execute("PRAGMA synchronous=NORMAL;");
            statement.execute("PRAGMA busy_timeout=5000;");
        }
        return connection;
    }

    private void init() throws IOException {
        try (Connection connection = openConnection();
             Statement statement = connection.createStatement()) {
            for (String ddl : SCHEMA) {
                statement.execute(ddl);
            }
        } catch (SQLException e) {
            throw new IOException("Failed to initialize SQLite database", e);
        }
    }
}
