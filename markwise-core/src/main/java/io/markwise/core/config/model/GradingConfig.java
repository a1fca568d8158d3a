package io.markwise.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record GradingConfig(
    @JsonAlias({"max_concurrency"}) int maxConcurrency,
    @JsonAlias({"default_tries"}) int defaultTries,
    boolean debug,
    @JsonAlias({"log_dir"}) String logDir,
    @JsonAlias({"request_timeout_seconds"}) int requestTimeoutSeconds
) {

    public static GradingConfig defaults() {
        return new GradingConfig(4, 1, false, "~/.markwise/logs", 60);
    }

    public GradingConfig {
        maxConcurrency = maxConcurrency < 1 ? 4 : maxConcurrency;
        defaultTries = Math.max(1, defaultTries);
        requestTimeoutSeconds = requestTimeoutSeconds < 1 ? 60 : requestTimeoutSeconds;
    }
}
