package io.markwise.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record MarkwiseConfig(
    GradingConfig grading,
    ProviderConfig openrouter,
    StorageConfig storage,
    GatewayConfig gateway
) {

    public static MarkwiseConfig defaults() {
        return new MarkwiseConfig(
            GradingConfig.defaults(),
            ProviderConfig.defaults(),
            StorageConfig.defaults(),
            GatewayConfig.defaults()
        );
    }

    public MarkwiseConfig withGrading(GradingConfig value) {
        return new MarkwiseConfig(value, openrouter, storage, gateway);
    }

    public MarkwiseConfig withOpenrouter(ProviderConfig value) {
        return new MarkwiseConfig(grading, value, storage, gateway);
    }

    public MarkwiseConfig withStorage(StorageConfig value) {
        return new MarkwiseConfig(grading, openrouter, value, gateway);
    }
}
