package io.markwise.core.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.markwise.core.error.PersistenceException;
import io.markwise.core.model.ResultRow;
import io.markwise.core.model.RubricResultRow;
import io.markwise.core.retry.RecordingSleeper;
import java.io.IOException;
import java.net.SocketTimeoutException;
import java.sql.SQLException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class PersistenceCoordinatorTest {

    private final InMemoryResultStore store = new InMemoryResultStore();
    private final RecordingSleeper sleeper = new RecordingSleeper();
    private final PersistenceCoordinator coordinator =
        new PersistenceCoordinator(store, PersistenceCoordinator.storageDefaults(), sleeper, 2);

    @Test
    void shouldKeepLastRowPerKey() throws Exception {
        List<ResultRow> rows = List.of(
            row("Q1", "m", 1, 1.0),
            row("Q2", "m", 1, 2.0),
            row("Q1", "m", 1, 3.0)
        );

        int written = coordinator.persistResults(rows);

        assertThat(written).isEqualTo(2);
        List<ResultRow> stored = store.listResults("s1");
        assertThat(stored).hasSize(2);
        assertThat(stored).filteredOn(row -> row.questionId().equals("Q1"))
            .singleElement()
            .satisfies(row -> assertThat(row.marksAwarded()).isEqualTo(3.0));
    }

    @Test
    void shouldOrderDeduplicatedRowsByLastProposal() {
        List<ResultRow> deduplicated = PersistenceCoordinator.deduplicate(List.of(
            row("Q1", "m", 1, 1.0),
            row("Q2", "m", 1, 2.0),
            row("Q1", "m", 1, 3.0)
        ));

        assertThat(deduplicated).extracting(ResultRow::questionId).containsExactly("Q2", "Q1");
    }

    @Test
    void shouldSplitRowsIntoBatches() {
        List<ResultRow> rows = new ArrayList<>();
        for (int i = 1; i <= 5; i++) {
            rows.add(row("Q" + i, "m", 1, (double) i));
        }

        coordinator.persistResults(rows);

        assertThat(store.batchSizes()).containsExactly(2, 2, 1);
    }

    @Test
    void shouldRetryTransientErrorsWithExponentialBackoff() throws Exception {
        store.failNextResultWrites(
            new IOException("write failed", new SocketTimeoutException("timeout")),
            new IOException("write failed", new SQLException("database is locked", "", 5))
        );

        int written = coordinator.persistResults(List.of(row("Q1", "m", 1, 1.0)));

        assertThat(written).isEqualTo(1);
        assertThat(sleeper.sleeps()).containsExactly(Duration.ofSeconds(1), Duration.ofSeconds(2));
        assertThat(store.listResults("s1")).hasSize(1);
    }

    @Test
    void shouldFailWhenTransientErrorsExhaustAttempts() {
        IOException transientError = new IOException("write failed", new SocketTimeoutException("timeout"));
        store.failNextResultWrites(transientError, transientError, transientError);

        assertThatThrownBy(() -> coordinator.persistResults(List.of(row("Q1", "m", 1, 1.0))))
            .isInstanceOf(PersistenceException.class)
            .hasMessageContaining("3 attempt(s)");
        assertThat(sleeper.sleeps()).hasSize(2);
    }

    @Test
    void shouldNotRetryPermanentErrors() {
        store.failNextResultWrites(new IOException("constraint", new SQLException("NOT NULL constraint failed", "", 19)));

        assertThatThrownBy(() -> coordinator.persistResults(List.of(row("Q1", "m", 1, 1.0))))
            .isInstanceOf(PersistenceException.class);
        assertThat(sleeper.sleeps()).isEmpty();
    }

    @Test
    void shouldSwallowRubricWriteFailures() {
        store.failRubricWrites(new IOException("disk full"));

        coordinator.persistRubricResult(new RubricResultRow("s1", "pair", 1, "{}", "{}", null));

        assertThat(store.listRubricResults("s1")).isEmpty();
    }

    private static ResultRow row(String questionId, String model, int tryIndex, Double marks) {
        return new ResultRow("s1", questionId, model, tryIndex, marks, "notes", "{}", null);
    }
}
