package io.markwise.core.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.markwise.core.model.ResultRow;
import io.markwise.core.model.RubricResultRow;
import io.markwise.core.model.TokenUsageRow;
import io.markwise.core.model.ValidationError;
import java.io.IOException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

public final class SqliteResultStore implements ResultStore {
    private static final TypeReference<Map<String, Object>> JSON_OBJECT = new TypeReference<>() {
    };

    private final SqliteDatabase database;
    private final Clock clock;
    private final ObjectMapper mapper;

    public SqliteResultStore(SqliteDatabase database, Clock clock) {
        this.database = Objects.requireNonNull(database, "database must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.mapper = new ObjectMapper();
    }

    @Override
    public void upsertResults(List<ResultRow> rows) throws IOException {
        if (rows.isEmpty()) {
            return;
        }
        String sql = """
            INSERT INTO result (
                session_id, question_id, model_name, try_index,
                marks_awarded, rubric_notes, raw_output, validation_errors, updated_at
            )
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT (session_id, question_id, model_name, try_index) DO UPDATE SET
                marks_awarded = excluded.marks_awarded,
                rubric_notes = excluded.rubric_notes,
                raw_output = excluded.raw_output,
                validation_errors = excluded.validation_errors,
                updated_at = excluded.updated_at
            """;
        String now = clock.instant().toString();
        try (Connection connection = database.openConnection()) {
            connection.setAutoCommit(false);
            try (PreparedStatement statement = connection.prepareStatement(sql)) {
                for (ResultRow row : rows) {
                    statement.setString(1, row.sessionId());
                    statement.setString(2, row.questionId());
                    statement.setString(3, row.modelName());
                    statement.setInt(4, row.tryIndex());
                    setNullableDouble(statement, 5, row.marksAwarded());
                    statement.setString(6, row.rubricNotes());
                    statement.setString(7, row.rawOutput());
                    statement.setString(8, writeError(row.validationError()));
                    statement.setString(9, now);
                    statement.addBatch();
                }
                statement.executeBatch();
                connection.commit();
            } catch (SQLException e) {
                connection.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new IOException("Failed to upsert " + rows.size() + " result rows", e);
        }
    }

    @Override
    public List<ResultRow> listResults(String sessionId) throws IOException {
        String sql = """
            SELECT session_id, question_id, model_name, try_index,
                   marks_awarded, rubric_notes, raw_output, validation_errors
            FROM result
            WHERE session_id = ?
            ORDER BY question_id ASC, model_name ASC, try_index ASC
            """;
        try (Connection connection = database.openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, sessionId);
            try (ResultSet resultSet = statement.executeQuery()) {
                List<ResultRow> rows = new ArrayList<>();
                while (resultSet.next()) {
                    double marks = resultSet.getDouble("marks_awarded");
                    Double marksAwarded = resultSet.wasNull() ? null : marks;
                    rows.add(new ResultRow(
                        resultSet.getString("session_id"),
                        resultSet.getString("question_id"),
                        resultSet.getString("model_name"),
                        resultSet.getInt("try_index"),
                        marksAwarded,
                        resultSet.getString("rubric_notes"),
                        resultSet.getString("raw_output"),
                        readError(resultSet.getString("validation_errors"))
                    ));
                }
                return rows;
            }
        } catch (SQLException e) {
            throw new IOException("Failed to list results of session " + sessionId, e);
        }
    }

    @Override
    public void upsertRubricResult(RubricResultRow row) throws IOException {
        String sql = """
            INSERT INTO rubric_result (
                session_id, model_name, try_index, rubric_response, raw_output, validation_errors, updated_at
            )
            VALUES (?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT (session_id, model_name, try_index) DO UPDATE SET
                rubric_response = excluded.rubric_response,
                raw_output = excluded.raw_output,
                validation_errors = excluded.validation_errors,
                updated_at = excluded.updated_at
            """;
        try (Connection connection = database.openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, row.sessionId());
            statement.setString(2, row.modelName());
            statement.setInt(3, row.tryIndex());
            statement.setString(4, row.rubricResponse());
            statement.setString(5, row.rawOutput());
            statement.setString(6, writeError(row.validationError()));
            statement.setString(7, clock.instant().toString());
            statement.executeUpdate();
        } catch (SQLException e) {
            throw new IOException("Failed to upsert rubric result for " + row.modelName(), e);
        }
    }

    @Override
    public List<RubricResultRow> listRubricResults(String sessionId) throws IOException {
        String sql = """
            SELECT session_id, model_name, try_index, rubric_response, raw_output, validation_errors
            FROM rubric_result
            WHERE session_id = ?
            ORDER BY model_name ASC, try_index ASC
            """;
        try (Connection connection = database.openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, sessionId);
            try (ResultSet resultSet = statement.executeQuery()) {
                List<RubricResultRow> rows = new ArrayList<>();
                while (resultSet.next()) {
                    rows.add(new RubricResultRow(
                        resultSet.getString("session_id"),
                        resultSet.getString("model_name"),
                        resultSet.getInt("try_index"),
                        resultSet.getString("rubric_response"),
                        resultSet.getString("raw_output"),
                        readError(resultSet.getString("validation_errors"))
                    ));
                }
                return rows;
            }
        } catch (SQLException e) {
            throw new IOException("Failed to list rubric results of session " + sessionId, e);
        }
    }

    @Override
    public void upsertTokenUsage(List<TokenUsageRow> rows) throws IOException {
        if (rows.isEmpty()) {
            return;
        }
        String sql = """
            INSERT INTO token_usage (
                session_id, model_name, try_index, input_tokens, output_tokens, reasoning_tokens,
                total_tokens, cache_creation_input_tokens, cache_read_input_tokens,
                model_id, finish_reason, cost_estimate, metadata
            )
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT (session_id, model_name, try_index) DO UPDATE SET
                input_tokens = excluded.input_tokens,
                output_tokens = excluded.output_tokens,
                reasoning_tokens = excluded.reasoning_tokens,
                total_tokens = excluded.total_tokens,
                cache_creation_input_tokens = excluded.cache_creation_input_tokens,
                cache_read_input_tokens = excluded.cache_read_input_tokens,
                model_id = excluded.model_id,
                finish_reason = excluded.finish_reason,
                cost_estimate = excluded.cost_estimate,
                metadata = excluded.metadata
            """;
        try (Connection connection = database.openConnection()) {
            connection.setAutoCommit(false);
            try (PreparedStatement statement = connection.prepareStatement(sql)) {
                for (TokenUsageRow row : rows) {
                    statement.setString(1, row.sessionId());
                    statement.setString(2, row.modelName());
                    statement.setInt(3, row.tryIndex());
                    statement.setLong(4, row.inputTokens());
                    statement.setLong(5, row.outputTokens());
                    statement.setLong(6, row.reasoningTokens());
                    statement.setLong(7, row.totalTokens());
                    statement.setLong(8, row.cacheCreationInputTokens());
                    statement.setLong(9, row.cacheReadInputTokens());
                    statement.setString(10, row.modelId());
                    statement.setString(11, row.finishReason());
                    statement.setDouble(12, row.costEstimate());
                    statement.setString(13, mapper.writeValueAsString(row.metadata()));
                    statement.addBatch();
                }
                statement.executeBatch();
                connection.commit();
            } catch (SQLException e) {
                connection.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new IOException("Failed to upsert " + rows.size() + " token usage rows", e);
        }
    }

    @Override
    public List<TokenUsageRow> listTokenUsage(String sessionId) throws IOException {
        String sql = """
            SELECT *
            FROM token_usage
            WHERE session_id = ?
            ORDER BY model_name ASC, try_index ASC
            """;
        try (Connection connection = database.openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, sessionId);
            try (ResultSet resultSet = statement.executeQuery()) {
                List<TokenUsageRow> rows = new ArrayList<>();
                while (resultSet.next()) {
                    String metadata = resultSet.getString("metadata");
                    rows.add(new TokenUsageRow(
                        resultSet.getString("session_id"),
                        resultSet.getString("model_name"),
                        resultSet.getInt("try_index"),
                        resultSet.getLong("input_tokens"),
                        resultSet.getLong("output_tokens"),
                        resultSet.getLong("reasoning_tokens"),
                        resultSet.getLong("total_tokens"),
                        resultSet.getLong("cache_creation_input_tokens"),
                        resultSet.getLong("cache_read_input_tokens"),
                        resultSet.getString("model_id"),
                        resultSet.getString("finish_reason"),
                        resultSet.getDouble("cost_estimate"),
                        metadata == null ? Map.of() : mapper.readValue(metadata, JSON_OBJECT)
                    ));
                }
                return rows;
            }
        } catch (SQLException e) {
            throw new IOException("Failed to list token usage of session " + sessionId, e);
        }
    }

    private String writeError(ValidationError error) throws IOException {
        return error == null ? null : mapper.writeValueAsString(error.asMap());
    }

    private ValidationError readError(String json) throws IOException {
        if (json == null || json.isBlank()) {
            return null;
        }
        return ValidationError.fromMap(mapper.readValue(json, JSON_OBJECT));
    }

    private static void setNullableDouble(PreparedStatement statement, int index, Double value) throws SQLException {
        if (value == null) {
            statement.setNull(index, Types.REAL);
        } else {
            statement.setDouble(index, value);
        }
    }
}
