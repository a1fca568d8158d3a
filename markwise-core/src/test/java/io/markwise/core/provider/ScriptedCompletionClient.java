package io.markwise.core.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/** Answers each request through a script; records every request and the peak number of calls in flight. */
public final class ScriptedCompletionClient implements CompletionClient {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Function<CompletionRequest, RawCompletion> script;
    private final List<CompletionRequest> requests = new CopyOnWriteArrayList<>();
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicInteger peakInFlight = new AtomicInteger();
    private final long delayMillis;
    private RuntimeException configurationError;

    public ScriptedCompletionClient(Function<CompletionRequest, RawCompletion> script) {
        this(script, 0);
    }

    public ScriptedCompletionClient(Function<CompletionRequest, RawCompletion> script, long delayMillis) {
        this.script = script;
        this.delayMillis = delayMillis;
    }

    public static RawCompletion completion(String content) {
        ObjectNode body = MAPPER.createObjectNode();
        body.put("model", "test/model");
        ArrayNode choices = body.putArray("choices");
        ObjectNode choice = choices.addObject();
        choice.putObject("message").put("role", "assistant").put("content", content);
        choice.put("finish_reason", "stop");
        ObjectNode usage = body.putObject("usage");
        usage.put("prompt_tokens", 1000);
        usage.put("completion_tokens", 100);
        usage.put("total_tokens", 1100);
        return new RawCompletion(body);
    }

    @Override
    public RawCompletion complete(CompletionRequest request) {
        requests.add(request);
        int current = inFlight.incrementAndGet();
        peakInFlight.accumulateAndGet(current, Math::max);
        try {
            if (delayMillis > 0) {
                Thread.sleep(delayMillis);
            }
            return script.apply(request);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        } finally {
            inFlight.decrementAndGet();
        }
    }

    @Override
    public void verifyConfigured() {
        if (configurationError != null) {
            throw configurationError;
        }
    }

    public void failConfiguration(RuntimeException error) {
        this.configurationError = error;
    }

    public List<CompletionRequest> requests() {
        return List.copyOf(requests);
    }

    public int peakInFlight() {
        return peakInFlight.get();
    }
}
