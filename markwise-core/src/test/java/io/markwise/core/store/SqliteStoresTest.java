package io.markwise.core.store;

import static org.assertj.core.api.Assertions.assertThat;

import io.markwise.core.model.ImageRole;
import io.markwise.core.model.Question;
import io.markwise.core.model.ResultRow;
import io.markwise.core.model.RubricResultRow;
import io.markwise.core.model.SentinelQuestion;
import io.markwise.core.model.Session;
import io.markwise.core.model.SessionImage;
import io.markwise.core.model.SessionStatus;
import io.markwise.core.model.TokenUsageRow;
import io.markwise.core.model.ValidationError;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SqliteStoresTest {

    private final Clock clock = Clock.fixed(Instant.parse("2026-02-01T09:00:00Z"), ZoneOffset.UTC);

    @TempDir
    Path tempDir;

    private SqliteSessionStore sessions;
    private SqliteResultStore results;
    private SqliteSettingsStore settings;

    @BeforeEach
    void setUp() throws Exception {
        SqliteDatabase database = new SqliteDatabase(tempDir.resolve("data/markwise.db"));
        sessions = new SqliteSessionStore(database, clock);
        results = new SqliteResultStore(database, clock);
        settings = new SqliteSettingsStore(database, clock);
    }

    @Test
    void shouldCreateAndUpdateSession() throws Exception {
        Session created = sessions.create();

        sessions.updateStatus(created.id(), SessionStatus.GRADING);
        sessions.saveModelConfig(created.id(), "{\"models\":[\"m\"]}");

        Session loaded = sessions.find(created.id()).orElseThrow();
        assertThat(loaded.status()).isEqualTo(SessionStatus.GRADING);
        assertThat(loaded.modelConfig()).isEqualTo("{\"models\":[\"m\"]}");
        assertThat(loaded.createdAt()).isEqualTo(Instant.parse("2026-02-01T09:00:00Z"));
        assertThat(sessions.find("missing")).isEmpty();
    }

    @Test
    void shouldUpsertImagesAndListThemInOrder() throws Exception {
        String id = sessions.create().id();
        sessions.upsertImage(new SessionImage(id, ImageRole.STUDENT, "https://img/2.png", 1));
        sessions.upsertImage(new SessionImage(id, ImageRole.STUDENT, "https://img/old.png", 0));
        sessions.upsertImage(new SessionImage(id, ImageRole.STUDENT, "https://img/1.png", 0));
        sessions.upsertImage(new SessionImage(id, ImageRole.ANSWER_KEY, "https://img/key.png", 0));

        List<SessionImage> images = sessions.listImages(id);

        assertThat(images).extracting(SessionImage::url)
            .containsExactly("https://img/key.png", "https://img/1.png", "https://img/2.png");
    }

    @Test
    void shouldReplaceQuestionSet() throws Exception {
        String id = sessions.create().id();
        sessions.replaceQuestions(id, List.of(new Question(id, "Q2", 2, 3), new Question(id, "Q1", 1, 5)));
        sessions.replaceQuestions(id, List.of(new Question(id, "Q9", 1, 1.5), new Question(id, "Q1", 2, 5)));

        List<Question> questions = sessions.listQuestions(id);

        assertThat(questions).extracting(Question::questionId).containsExactly("Q9", "Q1");
        assertThat(questions.get(0).maxMarks()).isEqualTo(1.5);
    }

    @Test
    void shouldUpsertResultsOnCompositeKey() throws Exception {
        results.upsertResults(List.of(
            new ResultRow("s1", "Q1", "m", 1, 2.0, "first", "{}", null),
            new ResultRow("s1", SentinelQuestion.PARSE_ERROR.questionId(), "m", 2, null, null, "raw",
                ValidationError.of("parse_exception", Map.of("preview", "{\"a\":")))
        ));
        results.upsertResults(List.of(new ResultRow("s1", "Q1", "m", 1, 4.5, "second", "{}", null)));

        List<ResultRow> rows = results.listResults("s1");

        assertThat(rows).hasSize(2);
        assertThat(rows.get(0).questionId()).isEqualTo("Q1");
        assertThat(rows.get(0).marksAwarded()).isEqualTo(4.5);
        assertThat(rows.get(0).rubricNotes()).isEqualTo("second");
        ResultRow sentinel = rows.get(1);
        assertThat(sentinel.marksAwarded()).isNull();
        assertThat(sentinel.validationError().reason()).isEqualTo("parse_exception");
        assertThat(sentinel.validationError().details()).containsEntry("preview", "{\"a\":");
    }

    @Test
    void shouldStoreRubricResultsAndTokenUsage() throws Exception {
        results.upsertRubricResult(new RubricResultRow("s1", "pair_0_r_a", 1, null, "raw", ValidationError.of("missing_grading_criteria")));
        results.upsertRubricResult(new RubricResultRow("s1", "pair_0_r_a", 1, "{\"grading_criteria\":[]}", "raw", null));
        results.upsertTokenUsage(List.of(new TokenUsageRow(
            "s1", "m", 1, 10, 5, 0, 15, 0, 0, "openai/gpt-4o", "stop", 0.000105, Map.of("raw_usage", Map.of("total_tokens", 15))
        )));

        assertThat(results.listRubricResults("s1")).singleElement().satisfies(row -> {
            assertThat(row.rubricResponse()).isEqualTo("{\"grading_criteria\":[]}");
            assertThat(row.validationError()).isNull();
        });
        assertThat(results.listTokenUsage("s1")).singleElement().satisfies(row -> {
            assertThat(row.totalTokens()).isEqualTo(15);
            assertThat(row.finishReason()).isEqualTo("stop");
            assertThat(row.metadata()).containsKey("raw_usage");
        });
    }

    @Test
    void shouldStoreSettingsDocuments() throws Exception {
        assertThat(settings.get("prompt_settings")).isEmpty();

        settings.put("prompt_settings", "{\"system_template\":\"a\"}");
        settings.put("prompt_settings", "{\"system_template\":\"b\"}");

        assertThat(settings.get("prompt_settings")).contains("{\"system_template\":\"b\"}");
    }
}
