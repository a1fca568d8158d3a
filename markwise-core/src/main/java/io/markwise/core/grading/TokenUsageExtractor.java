package io.markwise.core.grading;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.markwise.core.model.TokenUsageRow;
import io.markwise.core.provider.RawCompletion;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Map;
import java.util.Optional;

public final class TokenUsageExtractor {
    private static final double INPUT_RATE = 0.003 / 1000;
    private static final double OUTPUT_RATE = 0.015 / 1000;
    private static final double REASONING_RATE = 0.001 / 1000;

    private final ObjectMapper mapper;

    public TokenUsageExtractor() {
        this.mapper = new ObjectMapper();
    }

    public Optional<TokenUsageRow> extract(String sessionId, String modelName, int tryIndex, RawCompletion completion) {
        JsonNode usage = completion.usage();
        if (!usage.isObject() || usage.isEmpty()) {
            return Optional.empty();
        }
        long input = usage.path("prompt_tokens").asLong(0);
        long output = usage.path("completion_tokens").asLong(0);
        long reasoning = usage.path("reasoning_tokens").asLong(0);

        return Optional.of(new TokenUsageRow(
            sessionId,
            modelName,
            tryIndex,
            input,
            output,
            reasoning,
            usage.path("total_tokens").asLong(0),
            usage.path("cache_creation_input_tokens").asLong(0),
            usage.path("cache_read_input_tokens").asLong(0),
            completion.model(),
            completion.finishReason(),
            costEstimate(input, output, reasoning),
            Map.of("raw_usage", mapper.convertValue(usage, Map.class))
        ));
    }

    static double costEstimate(long input, long output, long reasoning) {
        double cost = input * INPUT_RATE + output * OUTPUT_RATE + reasoning * REASONING_RATE;
        return BigDecimal.valueOf(cost).setScale(6, RoundingMode.HALF_EVEN).doubleValue();
    }
}
