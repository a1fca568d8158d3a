package io.markwise.cli;

@FunctionalInterface
public interface ServeRunner {
    int run(Integer portOverride, String hostOverride) throws Exception;
}
