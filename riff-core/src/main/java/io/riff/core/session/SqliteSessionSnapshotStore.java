package io.riff.core.session;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public final class SqliteSessionSnapshotStore implements SessionSnapshotStore {
    private final String jdbcUrl;
    private final ObjectMapper mapper;

    public SqliteSessionSnapshotStore(Path dbPath) throws IOException {
        if (dbPath == null) {
            throw new IllegalArgumentException("dbPath must not be null");
        }
        Files.createDirectories(dbPath.toAbsolutePath().getParent());
        this.jdbcUrl = "jdbc:sqlite:" + dbPath.toAbsolutePath();
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        init();
    }

    @Override
    public synchronized void save(SessionSnapshot snapshot) throws IOException {
        String sql = """
            INSERT INTO session_snapshots (session_id, created_at, updated_at, snapshot_json)
            VALUES (?, ?, datetime('now'), ?)
            ON CONFLICT(session_id) DO UPDATE SET
                updated_at = excluded.updated_at,
                snapshot_json = excluded.snapshot_json
            """;
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            connection.setAutoCommit(false);
            statement.setString(1, snapshot.sessionId());
            statement.setString(2, snapshot.createdAt().toString());
            statement.setString(3, mapper.writeValueAsString(snapshot));
            statement.executeUpdate();
            connection.commit();
        } catch (SQLException e) {
            throw new IOException("Failed to save session " + snapshot.sessionId(), e);
        }
    }

    @Override
    public synchronized Optional<SessionSnapshot> load(String sessionId) throws IOException {
        String sql = "SELECT snapshot_json FROM session_snapshots WHERE session_id = ?";
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, sessionId);
            try (ResultSet resultSet = statement.executeQuery()) {
                if (!resultSet.next()) {
                    return Optional.empty();
                }
                return Optional.of(mapper.readValue(resultSet.getString("snapshot_json"), SessionSnapshot.class));
            }
        } catch (SQLException e) {
            throw new IOException("Failed to load session " + sessionId, e);
        }
    }

    @Override
    public synchronized List<String> list() throws IOException {
        String sql = "SELECT session_id FROM session_snapshots ORDER BY session_id ASC";
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql);
             ResultSet resultSet = statement.executeQuery()) {
            List<String> ids = new ArrayList<>();
            while (resultSet.next()) {
                ids.add(resultSet.getString("session_id"));
            }
            return ids;
        } catch (SQLException e) {
            throw new IOException("Failed to list sessions", e);
        }
    }

    private Connection openConnection() throws SQLException {
        Connection connection = DriverManager.getConnection(jdbcUrl);
        try (Statement statement = connection.createStatement()) {
            statement.execute("PRAGMA journal_mode=WAL;");
            statement.execute("PRAGMA synchronous=NORMAL;");
        }
        return connection;
    }

    private void init() throws IOException {
        String ddl = """
            CREATE TABLE IF NOT EXISTS session_snapshots (
                session_id TEXT PRIMARY KEY,
                created_at TEXT NOT NULL,
                updated_at TEXT NOT NULL,
                snapshot_json TEXT NOT NULL
            )
            """;
        try (Connection connection = openConnection();
             Statement statement = connection.createStatement()) {
            statement.execute(ddl);
        } catch (SQLException e) {
            throw new IOException("Failed to initialize SQLite session store", e);
        }
    }
}
