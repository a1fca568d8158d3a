package io.markwise.core.store;

import io.markwise.core.model.Question;
import io.markwise.core.model.Session;
import io.markwise.core.model.SessionImage;
import io.markwise.core.model.SessionStatus;
import java.io.IOException;
import java.util.List;
import java.util.Optional;

public interface SessionStore {
    Session create() throws IOException;

    Optional<Session> find(String sessionId) throws IOException;

    void updateStatus(String sessionId, SessionStatus status) throws IOException;

    void saveModelConfig(String sessionId, String modelConfigJson) throws IOException;

    void upsertImage(SessionImage image) throws IOException;

    List<SessionImage> listImages(String sessionId) throws IOException;

    void replaceQuestions(String sessionId, List<Question> questions) throws IOException;

    List<Question> listQuestions(String sessionId) throws IOException;
}
