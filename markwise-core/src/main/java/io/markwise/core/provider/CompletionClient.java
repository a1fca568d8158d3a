package io.markwise.core.provider;

public interface CompletionClient {

    RawCompletion complete(CompletionRequest request);

    default void verifyConfigured() {
    }
}
