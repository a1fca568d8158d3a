package io.markwise.core.store;

import io.markwise.core.error.PersistenceException;
import io.markwise.core.model.ResultRow;
import io.markwise.core.model.RubricResultRow;
import io.markwise.core.model.TokenUsageRow;
import io.markwise.core.retry.RetryPolicy;
import io.markwise.core.retry.Sleeper;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class PersistenceCoordinator {
    private static final Logger LOG = LoggerFactory.getLogger(PersistenceCoordinator.class);
    public static final int BATCH_SIZE = 50;

    private final ResultStore store;
    private final RetryPolicy retryPolicy;
    private final Sleeper sleeper;
    private final int batchSize;

    public PersistenceCoordinator(ResultStore store) {
        this(store, storageDefaults(), Sleeper.system(), BATCH_SIZE);
    }

    public PersistenceCoordinator(ResultStore store, RetryPolicy retryPolicy, Sleeper sleeper, int batchSize) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy must not be null");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be >= 1");
        }
        this.batchSize = batchSize;
    }

    public static RetryPolicy storageDefaults() {
        return RetryPolicy.of(3, Duration.ofSeconds(1), TransientStorageErrors::isTransient);
    }

    public int persistResults(List<ResultRow> proposed) {
        List<ResultRow> rows = deduplicate(proposed);
        for (int from = 0; from < rows.size(); from += batchSize) {
            List<ResultRow> batch = rows.subList(from, Math.min(rows.size(), from + batchSize));
            writeBatch(batch, from / batchSize + 1);
        }
        if (rows.size() < proposed.size()) {
            LOG.info("Dropped {} duplicate result rows", proposed.size() - rows.size());
        }
        return rows.size();
    }

    public void persistRubricResult(RubricResultRow row) {
        try {
            store.upsertRubricResult(row);
        } catch (IOException e) {
            LOG.warn("Failed to persist rubric result model={} try={}", row.modelName(), row.tryIndex(), e);
        }
    }

    public void persistTokenUsage(List<TokenUsageRow> rows) {
        if (rows.isEmpty()) {
            return;
        }
        try {
            store.upsertTokenUsage(rows);
        } catch (IOException | RuntimeException e) {
            LOG.warn("Failed to persist {} token usage rows", rows.size(), e);
        }
    }

    static List<ResultRow> deduplicate(List<ResultRow> proposed) {
        Map<ResultRow.Key, ResultRow> byKey = new LinkedHashMap<>();
        for (ResultRow row : proposed) {
            // remove first so the surviving row takes the position of the last proposal
            byKey.remove(row.key());
            byKey.put(row.key(), row);
        }
        return new ArrayList<>(byKey.values());
    }

    private void writeBatch(List<ResultRow> batch, int batchNumber) {
        for (int attempt = 0; attempt < retryPolicy.maxAttempts(); attempt++) {
            try {
                store.upsertResults(batch);
                return;
            } catch (IOException e) {
                boolean retry = retryPolicy.isRetryable(e) && !retryPolicy.isFinalAttempt(attempt);
                if (!retry) {
                    throw new PersistenceException(
                        "Failed to persist result batch " + batchNumber + " after " + (attempt + 1) + " attempt(s)",
                        e
                    );
                }
                Duration delay = retryPolicy.backoff(attempt);
                LOG.warn("Transient storage error on batch {} attempt {}, retrying in {} ms: {}",
                    batchNumber, attempt + 1, delay.toMillis(), e.getMessage());
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new PersistenceException("Interrupted while retrying result batch " + batchNumber, ie);
                }
            }
        }
    }
}
