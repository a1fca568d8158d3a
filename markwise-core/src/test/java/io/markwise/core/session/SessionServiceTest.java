package io.markwise.core.session;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.markwise.core.error.NotFoundException;
import io.markwise.core.error.ValidationException;
import io.markwise.core.model.ImageRole;
import io.markwise.core.model.Question;
import io.markwise.core.model.SessionImage;
import io.markwise.core.store.InMemorySessionStore;
import java.util.List;
import org.junit.jupiter.api.Test;

class SessionServiceTest {

    private final InMemorySessionStore store = new InMemorySessionStore();
    private final SessionService service = new SessionService(store);

    @Test
    void shouldUpsertImageOnRoleAndOrder() {
        String id = service.create().id();

        service.registerImage(id, "student", "https://img/a.png", 0);
        service.registerImage(id, "student", "https://img/b.png", 0);
        service.registerImage(id, "answer_key", "data:image/png;base64,AAAA", 0);

        List<SessionImage> images = store.listImages(id);
        assertThat(images).hasSize(2);
        assertThat(images).filteredOn(image -> image.role() == ImageRole.STUDENT)
            .singleElement()
            .satisfies(image -> assertThat(image.url()).isEqualTo("https://img/b.png"));
    }

    @Test
    void shouldValidateImageRegistration() {
        String id = service.create().id();

        assertThatThrownBy(() -> service.registerImage(id, "teacher", "https://img/a.png", 0))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("role");
        assertThatThrownBy(() -> service.registerImage(id, "student", "ftp://img/a.png", 0))
            .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> service.registerImage(id, "student", "https://img/a.png", -1))
            .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> service.registerImage("missing", "student", "https://img/a.png", 0))
            .isInstanceOf(NotFoundException.class);
    }

    @Test
    void shouldReplaceQuestionsWithPayload() {
        String id = service.create().id();
        service.configureQuestions(id, List.of(new Question(id, "Q1", 1, 5), new Question(id, "Q2", 2, 5)));

        service.configureQuestions(id, List.of(new Question(id, "Q3", 1, 10)));

        assertThat(store.listQuestions(id)).extracting(Question::questionId).containsExactly("Q3");
    }

    @Test
    void shouldRejectDuplicateQuestionIdsAndNumbers() {
        String id = service.create().id();

        assertThatThrownBy(() -> service.configureQuestions(id, List.of(new Question(id, "Q1", 1, 5), new Question(id, "Q1", 2, 5))))
            .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> service.configureQuestions(id, List.of(new Question(id, "Q1", 1, 5), new Question(id, "Q2", 1, 5))))
            .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> service.configureQuestions(id, List.of(new Question(id, "Q1", 0, 5))))
            .isInstanceOf(ValidationException.class);
    }
}
