package io.markwise.core.grading;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.markwise.core.error.GradingException;
import io.markwise.core.error.NotFoundException;
import io.markwise.core.error.PersistenceException;
import io.markwise.core.error.UpstreamException;
import io.markwise.core.error.ValidationException;
import io.markwise.core.model.ChatMessage;
import io.markwise.core.model.GradeRequest;
import io.markwise.core.model.ImageRole;
import io.markwise.core.model.ModelPairSpec;
import io.markwise.core.model.ModelSpec;
import io.markwise.core.model.ParsedAnswer;
import io.markwise.core.model.Question;
import io.markwise.core.model.ResultRow;
import io.markwise.core.model.SentinelQuestion;
import io.markwise.core.model.SessionImage;
import io.markwise.core.model.SessionStatus;
import io.markwise.core.model.TokenUsageRow;
import io.markwise.core.model.ValidationError;
import io.markwise.core.model.WorkItem;
import io.markwise.core.normalize.JsonObjectExtractor;
import io.markwise.core.normalize.ResponseNormalizer;
import io.markwise.core.provider.CompletionClient;
import io.markwise.core.provider.SessionAuditLog;
import io.markwise.core.session.SessionStateMachine;
import io.markwise.core.store.PersistenceCoordinator;
import io.markwise.core.store.SessionStore;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class GradingEngine implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(GradingEngine.class);
    private static final int PREVIEW_LIMIT = 2000;

    private final SessionStore sessions;
    private final CompletionClient client;
    private final PersistenceCoordinator persistence;
    private final PromptSettingsService promptSettings;
    private final SessionStateMachine stateMachine;
    private final TaskPlanner planner;
    private final PromptComposer composer;
    private final RubricStage rubricStage;
    private final AssessmentStage assessmentStage;
    private final TokenUsageExtractor tokenUsage;
    private final ExecutorService executor;
    private final ObjectMapper mapper;
    private final boolean debug;

    public GradingEngine(
        SessionStore sessions,
        CompletionClient client,
        PersistenceCoordinator persistence,
        PromptSettingsService promptSettings,
        SessionAuditLog auditLog,
        int maxConcurrency,
        boolean debug
    ) {
        this(sessions, client, persistence, promptSettings, auditLog, new ConcurrencyLimiter(maxConcurrency), debug);
    }

    public GradingEngine(
        SessionStore sessions,
        CompletionClient client,
        PersistenceCoordinator persistence,
        PromptSettingsService promptSettings,
        SessionAuditLog auditLog,
        ConcurrencyLimiter limiter,
        boolean debug
    ) {
        this.sessions = Objects.requireNonNull(sessions, "sessions must not be null");
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.persistence = Objects.requireNonNull(persistence, "persistence must not be null");
        this.promptSettings = Objects.requireNonNull(promptSettings, "promptSettings must not be null");
        Objects.requireNonNull(limiter, "limiter must not be null");
        this.stateMachine = new SessionStateMachine(sessions);
        this.planner = new TaskPlanner();
        this.composer = new PromptComposer();
        this.rubricStage = new RubricStage(client, limiter, new JsonObjectExtractor(), persistence);
        this.assessmentStage = new AssessmentStage(client, limiter, new ResponseNormalizer(), auditLog);
        this.tokenUsage = new TokenUsageExtractor();
        this.executor = Executors.newCachedThreadPool(workerThreads());
        this.mapper = new ObjectMapper();
        this.debug = debug;
    }

    public GradeOutcome grade(GradeRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        String sessionId = request.sessionId();
        if (sessionId == null || sessionId.isBlank()) {
            throw new ValidationException("session_id is required");
        }

        GradingInputs inputs = loadInputs(sessionId, request);
        List<WorkItem> items = inputs.items();
        client.verifyConfigured();

        saveModelConfig(sessionId, request);
        stateMachine.begin(sessionId);
        LOG.info("Grading session {} with {} work item(s), rubric-conditioned={}",
            sessionId, items.size(), request.rubricConditioned());

        List<CompletableFuture<AssessmentOutcome>> futures = new ArrayList<>();
        for (WorkItem item : items) {
            futures.add(CompletableFuture.supplyAsync(() -> runItem(sessionId, item, inputs), executor));
        }

        List<AssessmentOutcome> outcomes = new ArrayList<>();
        List<Throwable> failures = new ArrayList<>();
        for (int i = 0; i < futures.size(); i++) {
            try {
                outcomes.add(futures.get(i).join());
            } catch (CompletionException e) {
                Throwable cause = e.getCause() == null ? e : e.getCause();
                WorkItem item = items.get(i);
                LOG.warn("Work item failed instance={} try={}: {}", item.instanceId(), item.tryIndex(), cause.getMessage());
                failures.add(cause);
            }
        }

        if (outcomes.isEmpty()) {
            stateMachine.fail(sessionId);
            throw callFailure(failures);
        }

        List<ResultRow> rows = resultRows(sessionId, outcomes);
        int written;
        try {
            written = persistence.persistResults(rows);
        } catch (PersistenceException e) {
            LOG.error("Failed to persist results of session {}", sessionId, e);
            stateMachine.fail(sessionId);
            throw e;
        }
        persistence.persistTokenUsage(tokenUsageRows(sessionId, outcomes));

        boolean anyAnswers = outcomes.stream().anyMatch(AssessmentOutcome::hasAnswers);
        stateMachine.complete(sessionId, anyAnswers);
        SessionStatus status = anyAnswers ? SessionStatus.GRADED : SessionStatus.FAILED;
        LOG.info("Session {} {}: {} succeeded, {} failed, {} row(s) written",
            sessionId, status.wireValue(), outcomes.size(), failures.size(), written);
        return new GradeOutcome(sessionId, items.size(), outcomes.size(), failures.size(), written, status);
    }

    private GradingInputs loadInputs(String sessionId, GradeRequest request) {
        List<SessionImage> images;
        List<Question> questions;
        try {
            if (sessions.find(sessionId).isEmpty()) {
                throw new NotFoundException("session_id not found");
            }
            images = sessions.listImages(sessionId);
            questions = sessions.listQuestions(sessionId);
        } catch (IOException e) {
            throw new PersistenceException("Failed to load session " + sessionId, e);
        }

        List<WorkItem> items = planner.plan(request);
        List<String> studentUrls = urlsFor(images, ImageRole.STUDENT);
        List<String> answerKeyUrls = urlsFor(images, ImageRole.ANSWER_KEY);
        List<String> rubricUrls = urlsFor(images, ImageRole.GRADING_RUBRIC);
        if (studentUrls.isEmpty()) {
            throw new ValidationException("no student images registered for session");
        }
        if (questions.isEmpty()) {
            throw new ValidationException("no questions configured for session");
        }
        if (request.rubricConditioned() && rubricUrls.isEmpty()) {
            throw new ValidationException("model_pairs require at least one grading_rubric image");
        }

        PromptTemplates templates = promptSettings.assessmentTemplates();
        String questionList = composer.questionList(questions);
        List<ChatMessage> plainMessages = composer.assessmentMessages(templates, studentUrls, answerKeyUrls, questionList, "");
        List<ChatMessage> rubricMessages = request.rubricConditioned()
            ? composer.rubricMessages(promptSettings.rubricTemplates(), rubricUrls, questionList)
            : List.of();
        if (debug) {
            LOG.info("Assessment prompt for session {}:\n{}", sessionId, preview(plainMessages));
        }
        return new GradingInputs(items, templates, studentUrls, answerKeyUrls, questionList, plainMessages, rubricMessages);
    }

    private AssessmentOutcome runItem(String sessionId, WorkItem item, GradingInputs inputs) {
        try {
            if (!item.rubricConditioned()) {
                return assessmentStage.run(sessionId, item, inputs.plainMessages(), null);
            }
            RubricOutcome rubric = rubricStage.run(sessionId, item, inputs.rubricMessages());
            List<ChatMessage> messages = composer.assessmentMessages(
                inputs.templates(),
                inputs.studentUrls(),
                inputs.answerKeyUrls(),
                inputs.questionList(),
                rubric.rubricText()
            );
            return assessmentStage.run(sessionId, item, messages, rubric);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GradingException(500, "INTERRUPTED", "Interrupted while grading " + item.instanceId());
        }
    }

    List<ResultRow> resultRows(String sessionId, List<AssessmentOutcome> outcomes) {
        List<ResultRow> rows = new ArrayList<>();
        for (AssessmentOutcome outcome : outcomes) {
            WorkItem item = outcome.item();
            String rawOutput = outcome.completion().json();
            if (outcome.hasAnswers()) {
                for (ParsedAnswer answer : outcome.normalized().answers()) {
                    rows.add(ResultRow.answer(sessionId, item.instanceId(), item.tryIndex(), answer, rawOutput));
                }
            } else {
                ValidationError error = outcome.normalized().error() == null
                    ? ValidationError.of("no_valid_answers")
                    : outcome.normalized().error();
                rows.add(ResultRow.sentinel(
                    sessionId, SentinelQuestion.PARSE_ERROR, item.instanceId(), item.tryIndex(), rawOutput, error
                ));
            }
            if (outcome.rubricFailed()) {
                rows.add(ResultRow.sentinel(
                    sessionId, SentinelQuestion.RUBRIC_ERROR, item.instanceId(), item.tryIndex(), null, outcome.rubric().error()
                ));
            }
        }
        return rows;
    }

    private List<TokenUsageRow> tokenUsageRows(String sessionId, List<AssessmentOutcome> outcomes) {
        List<TokenUsageRow> rows = new ArrayList<>();
        for (AssessmentOutcome outcome : outcomes) {
            try {
                tokenUsage.extract(sessionId, outcome.item().instanceId(), outcome.item().tryIndex(), outcome.completion())
                    .ifPresent(rows::add);
            } catch (RuntimeException e) {
                LOG.warn("Failed to extract token usage for {}", outcome.item().instanceId(), e);
            }
        }
        return rows;
    }

    // the first upstream error wins over generic failures
    static GradingException callFailure(List<Throwable> failures) {
        for (Throwable failure : failures) {
            if (failure instanceof UpstreamException upstream) {
                return upstream;
            }
        }
        for (Throwable failure : failures) {
            if (failure instanceof GradingException grading) {
                return grading;
            }
        }
        Throwable cause = failures.isEmpty() ? null : failures.get(0);
        return new GradingException(500, "INTERNAL_ERROR", "All grading tasks failed", Map.of(), cause);
    }

    private void saveModelConfig(String sessionId, GradeRequest request) {
        Map<String, Object> config = new LinkedHashMap<>();
        config.put("models", request.models().stream().map(ModelSpec::name).toList());
        List<Map<String, Object>> pairs = new ArrayList<>();
        for (ModelPairSpec pair : request.modelPairs()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("rubric_model", pair.rubricModel().name());
            entry.put("assessment_model", pair.assessmentModel().name());
            entry.put("instance_id", pair.instanceId());
            pairs.add(entry);
        }
        config.put("model_pairs", pairs);
        config.put("default_tries", request.defaultTries() == null ? 1 : request.defaultTries());
        try {
            sessions.saveModelConfig(sessionId, mapper.writeValueAsString(config));
        } catch (IOException | RuntimeException e) {
            LOG.warn("Failed to save model configuration of session {}", sessionId, e);
        }
    }

    private static List<String> urlsFor(List<SessionImage> images, ImageRole role) {
        return images.stream()
            .filter(image -> image.role() == role)
            .sorted((a, b) -> Integer.compare(a.orderIndex(), b.orderIndex()))
            .map(SessionImage::url)
            .toList();
    }

    private static String preview(List<ChatMessage> messages) {
        StringBuilder preview = new StringBuilder();
        for (ChatMessage message : messages) {
            preview.append(message.role()).append(": ").append(message.text());
            for (String url : message.imageUrls()) {
                preview.append("\n  [image] ").append(url);
            }
            preview.append('\n');
        }
        return preview.length() <= PREVIEW_LIMIT ? preview.toString() : preview.substring(0, PREVIEW_LIMIT);
    }

    private static ThreadFactory workerThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "markwise-grader-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }

    private record GradingInputs(
        List<WorkItem> items,
        PromptTemplates templates,
        List<String> studentUrls,
        List<String> answerKeyUrls,
        String questionList,
        List<ChatMessage> plainMessages,
        List<ChatMessage> rubricMessages
    ) {
    }
}
