package io.markwise.core.store;

import io.markwise.core.model.ImageRole;
import io.markwise.core.model.Question;
import io.markwise.core.model.Session;
import io.markwise.core.model.SessionImage;
import io.markwise.core.model.SessionStatus;
import java.io.IOException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

public final class SqliteSessionStore implements SessionStore {
    private final SqliteDatabase database;
    private final Clock clock;

    public SqliteSessionStore(SqliteDatabase database, Clock clock) {
        this.database = Objects.requireNonNull(database, "database must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public Session create() throws IOException {
        String sql = """
            INSERT INTO session (id, status, model_config, created_at, updated_at)
            VALUES (?, ?, NULL, ?, ?)
            """;
        Instant now = clock.instant();
        Session session = new Session(UUID.randomUUID().toString(), SessionStatus.CREATED, null, now, now);
        try (Connection connection = database.openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, session.id());
            statement.setString(2, session.status().wireValue());
            statement.setString(3, now.toString());
            statement.setString(4, now.toString());
            statement.executeUpdate();
            return session;
        } catch (SQLException e) {
            throw new IOException("Failed to create session", e);
        }
    }

    @Override
    public Optional<Session> find(String sessionId) throws IOException {
        String sql = """
            SELECT id, status, model_config, created_at, updated_at
            FROM session
            WHERE id = ?
            """;
        try (Connection connection = database.openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, sessionId);
            try (ResultSet resultSet = statement.executeQuery()) {
                if (!resultSet.next()) {
                    return Optional.empty();
                }
                return Optional.of(new Session(
                    resultSet.getString("id"),
                    SessionStatus.fromWire(resultSet.getString("status")),
                    resultSet.getString("model_config"),
                    Instant.parse(resultSet.getString("created_at")),
                    Instant.parse(resultSet.getString("updated_at"))
                ));
            }
        } catch (SQLException e) {
            throw new IOException("Failed to load session " + sessionId, e);
        }
    }

    @Override
    public void updateStatus(String sessionId, SessionStatus status) throws IOException {
        String sql = "UPDATE session SET status = ?, updated_at = ? WHERE id = ?";
        try (Connection connection = database.openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, status.wireValue());
            statement.setString(2, clock.instant().toString());
            statement.setString(3, sessionId);
            statement.executeUpdate();
        } catch (SQLException e) {
            throw new IOException("Failed to update status of session " + sessionId, e);
        }
    }

    @Override
    public void saveModelConfig(String sessionId, String modelConfigJson) throws IOException {
        String sql = "UPDATE session SET model_config = ?, updated_at = ? WHERE id = ?";
        try (Connection connection = database.openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, modelConfigJson);
            statement.setString(2, clock.instant().toString());
            statement.setString(3, sessionId);
            statement.executeUpdate();
        } catch (SQLException e) {
            throw new IOException("Failed to save model config of session " + sessionId, e);
        }
    }

    @Override
    public void upsertImage(SessionImage image) throws IOException {
        String sql = """
            INSERT INTO image (session_id, role, url, order_index)
            VALUES (?, ?, ?, ?)
            ON CONFLICT (session_id, role, order_index) DO UPDATE SET url = excluded.url
            """;
        try (Connection connection = database.openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, image.sessionId());
            statement.setString(2, image.role().wireValue());
            statement.setString(3, image.url());
            statement.setInt(4, image.orderIndex());
            statement.executeUpdate();
        } catch (SQLException e) {
            throw new IOException("Failed to register image for session " + image.sessionId(), e);
        }
    }

    @Override
    public List<SessionImage> listImages(String sessionId) throws IOException {
        String sql = """
            SELECT session_id, role, url, order_index
            FROM image
            WHERE session_id = ?
            ORDER BY role ASC, order_index ASC
            """;
        try (Connection connection = database.openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, sessionId);
            try (ResultSet resultSet = statement.executeQuery()) {
                List<SessionImage> images = new ArrayList<>();
                while (resultSet.next()) {
                    images.add(new SessionImage(
                        resultSet.getString("session_id"),
                        ImageRole.fromWire(resultSet.getString("role")),
                        resultSet.getString("url"),
                        resultSet.getInt("order_index")
                    ));
                }
                return images;
            }
        } catch (SQLException e) {
            throw new IOException("Failed to list images of session " + sessionId, e);
        }
    }

    @Override
    public void replaceQuestions(String sessionId, List<Question> questions) throws IOException {
        String delete = "DELETE FROM question WHERE session_id = ?";
        String insert = """
            INSERT INTO question (session_id, question_id, number, max_marks)
            VALUES (?, ?, ?, ?)
            """;
        try (Connection connection = database.openConnection()) {
            connection.setAutoCommit(false);
            try (PreparedStatement deleteStatement = connection.prepareStatement(delete);
                 PreparedStatement insertStatement = connection.prepareStatement(insert)) {
                deleteStatement.setString(1, sessionId);
                deleteStatement.executeUpdate();
                for (Question question : questions) {
                    insertStatement.setString(1, sessionId);
                    insertStatement.setString(2, question.questionId());
                    insertStatement.setInt(3, question.number());
                    insertStatement.setDouble(4, question.maxMarks());
                    insertStatement.addBatch();
                }
                insertStatement.executeBatch();
                connection.commit();
            } catch (SQLException e) {
                connection.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new IOException("Failed to configure questions of session " + sessionId, e);
        }
    }

    @Override
    public List<Question> listQuestions(String sessionId) throws IOException {
        String sql = """
            SELECT session_id, question_id, number, max_marks
            FROM question
            WHERE session_id = ?
            ORDER BY number ASC
            """;
        try (Connection connection = database.openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, sessionId);
            try (ResultSet resultSet = statement.executeQuery()) {
                List<Question> questions = new ArrayList<>();
                while (resultSet.next()) {
                    questions.add(new Question(
                        resultSet.getString("session_id"),
                        resultSet.getString("question_id"),
                        resultSet.getInt("number"),
                        resultSet.getDouble("max_marks")
                    ));
                }
                return questions;
            }
        } catch (SQLException e) {
            throw new IOException("Failed to list questions of session " + sessionId, e);
        }
    }
}
