package io.markwise.core.store;

import io.markwise.core.model.ResultRow;
import io.markwise.core.model.RubricResultRow;
import io.markwise.core.model.TokenUsageRow;
import java.io.IOException;
import java.util.List;

public interface ResultStore {
    void upsertResults(List<ResultRow> rows) throws IOException;

    List<ResultRow> listResults(String sessionId) throws IOException;

    void upsertRubricResult(RubricResultRow row) throws IOException;

    List<RubricResultRow> listRubricResults(String sessionId) throws IOException;

    void upsertTokenUsage(List<TokenUsageRow> rows) throws IOException;

    List<TokenUsageRow> listTokenUsage(String sessionId) throws IOException;
}
