package io.markwise.core.store;

import java.io.IOException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.util.Objects;
import java.util.Optional;

public final class SqliteSettingsStore implements SettingsStore {
    private final SqliteDatabase database;
    private final Clock clock;

    public SqliteSettingsStore(SqliteDatabase database, Clock clock) {
        this.database = Objects.requireNonNull(database, "database must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public Optional<String> get(String key) throws IOException {
        String sql = "SELECT value FROM app_settings WHERE key = ?";
        try (Connection connection = database.openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, key);
            try (ResultSet resultSet = statement.executeQuery()) {
                return resultSet.next() ? Optional.ofNullable(resultSet.getString("value")) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new IOException("Failed to read setting " + key, e);
        }
    }

    @Override
    public void put(String key, String jsonValue) throws IOException {
        String sql = """
            INSERT INTO app_settings (key, value, updated_at)
            VALUES (?, ?, ?)
            ON CONFLICT (key) DO UPDATE SET value = excluded.value, updated_at = excluded.updated_at
            """;
        try (Connection connection = database.openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, key);
            statement.setString(2, jsonValue);
            statement.setString(3, clock.instant().toString());
            statement.executeUpdate();
        } catch (SQLException e) {
            throw new IOException("Failed to write setting " + key, e);
        }
    }
}
