package io.markwise.core.results;

import io.markwise.core.error.PersistenceException;
import io.markwise.core.model.ResultRow;
import io.markwise.core.model.SentinelQuestion;
import io.markwise.core.session.SessionService;
import io.markwise.core.store.ResultStore;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

public final class ResultQueryService {
    private static final Comparator<String> TRY_ORDER = Comparator.comparingInt(Integer::parseInt);

    private final SessionService sessions;
    private final ResultStore results;

    public ResultQueryService(SessionService sessions, ResultStore results) {
        this.sessions = Objects.requireNonNull(sessions, "sessions must not be null");
        this.results = Objects.requireNonNull(results, "results must not be null");
    }

    public Map<String, Object> resultsBySession(String sessionId) {
        sessions.require(sessionId);
        List<ResultRow> rows = new ArrayList<>(load(sessionId));
        rows.sort(Comparator.comparingInt(ResultRow::tryIndex));

        Map<String, Map<String, List<Map<String, Object>>>> byQuestion = new TreeMap<>();
        for (ResultRow row : rows) {
            if (row.sentinel()) {
                continue;
            }
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("try_index", row.tryIndex());
            entry.put("marks_awarded", row.marksAwarded());
            entry.put("rubric_notes", row.rubricNotes());
            byQuestion
                .computeIfAbsent(row.questionId(), key -> new TreeMap<>())
                .computeIfAbsent(row.modelName(), key -> new ArrayList<>())
                .add(entry);
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("session_id", sessionId);
        body.put("results_by_question", byQuestion);
        return body;
    }

    public Map<String, Object> errorsBySession(String sessionId) {
        sessions.require(sessionId);
        List<ResultRow> rows = load(sessionId);

        Set<String> answered = new HashSet<>();
        for (ResultRow row : rows) {
            if (!row.sentinel()) {
                answered.add(row.modelName() + "#" + row.tryIndex());
            }
        }

        Map<String, Map<String, List<Map<String, Object>>>> byModel = new TreeMap<>();
        for (ResultRow row : rows) {
            if (!row.sentinel()) {
                continue;
            }
            boolean parseError = SentinelQuestion.PARSE_ERROR.questionId().equals(row.questionId());
            if (parseError && answered.contains(row.modelName() + "#" + row.tryIndex())) {
                continue;
            }
            Map<String, Object> error = new LinkedHashMap<>();
            if (row.validationError() != null) {
                error.putAll(row.validationError().asMap());
            } else {
                error.put("reason", "unknown");
            }
            error.put("stage", parseError ? "assessment" : "rubric");
            byModel
                .computeIfAbsent(row.modelName(), key -> new TreeMap<>(TRY_ORDER))
                .computeIfAbsent(String.valueOf(row.tryIndex()), key -> new ArrayList<>())
                .add(error);
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("session_id", sessionId);
        body.put("errors_by_model_try", byModel);
        return body;
    }

    private List<ResultRow> load(String sessionId) {
        try {
            return results.listResults(sessionId);
        } catch (IOException e) {
            throw new PersistenceException("Failed to load results of session " + sessionId, e);
        }
    }
}
