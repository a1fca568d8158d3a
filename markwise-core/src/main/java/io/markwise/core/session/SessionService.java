package io.markwise.core.session;

import io.markwise.core.error.NotFoundException;
import io.markwise.core.error.PersistenceException;
import io.markwise.core.error.ValidationException;
import io.markwise.core.model.ImageRole;
import io.markwise.core.model.Question;
import io.markwise.core.model.Session;
import io.markwise.core.model.SessionImage;
import io.markwise.core.store.SessionStore;
import java.io.IOException;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

public final class SessionService {
    private final SessionStore store;

    public SessionService(SessionStore store) {
        this.store = Objects.requireNonNull(store, "store must not be null");
    }

    public Session create() {
        try {
            return store.create();
        } catch (IOException e) {
            throw new PersistenceException("Failed to create session", e);
        }
    }

    public Session require(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            throw new ValidationException("session_id is required");
        }
        try {
            return store.find(sessionId).orElseThrow(() -> new NotFoundException("session_id not found"));
        } catch (IOException e) {
            throw new PersistenceException("Failed to load session " + sessionId, e);
        }
    }

    public SessionImage registerImage(String sessionId, String role, String url, Integer orderIndex) {
        if (url == null || url.isBlank()) {
            throw new ValidationException("url must be a non-empty string");
        }
        if (!(url.startsWith("http://") || url.startsWith("https://") || url.startsWith("data:"))) {
            throw new ValidationException("url must start with http(s) or data:");
        }
        if (orderIndex == null || orderIndex < 0) {
            throw new ValidationException("order_index must be >= 0", Map.of("order_index", String.valueOf(orderIndex)));
        }
        ImageRole imageRole;
        try {
            imageRole = ImageRole.fromWire(role);
        } catch (IllegalArgumentException e) {
            throw new ValidationException(
                "role must be one of student, answer_key, grading_rubric",
                Map.of("role", String.valueOf(role))
            );
        }
        require(sessionId);

        SessionImage image = new SessionImage(sessionId, imageRole, url, orderIndex);
        try {
            store.upsertImage(image);
            return image;
        } catch (IOException e) {
            throw new PersistenceException("Failed to register image", e);
        }
    }

    public List<Question> configureQuestions(String sessionId, List<Question> questions) {
        require(sessionId);
        if (questions == null) {
            throw new ValidationException("questions is required");
        }
        Set<String> seenIds = new HashSet<>();
        Set<Integer> seenNumbers = new HashSet<>();
        for (Question question : questions) {
            if (question.questionId().isBlank()) {
                throw new ValidationException("question_id must not be blank");
            }
            if (question.number() < 1) {
                throw new ValidationException("number must be >= 1", Map.of("question_id", question.questionId()));
            }
            if (question.maxMarks() < 0) {
                throw new ValidationException("max_marks must be >= 0", Map.of("question_id", question.questionId()));
            }
            if (!seenIds.add(question.questionId())) {
                throw new ValidationException("duplicate question_id in questions", Map.of("question_id", question.questionId()));
            }
            if (!seenNumbers.add(question.number())) {
                throw new ValidationException("duplicate number in questions", Map.of("number", question.number()));
            }
        }
        try {
            store.replaceQuestions(sessionId, questions);
            return store.listQuestions(sessionId);
        } catch (IOException e) {
            throw new PersistenceException("Failed to configure questions", e);
        }
    }
}
