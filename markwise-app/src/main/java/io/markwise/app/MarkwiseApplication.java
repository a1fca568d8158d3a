package io.markwise.app;

import io.markwise.cli.CliContext;
import io.markwise.cli.GradeCommand;
import io.markwise.cli.MarkwiseCliCommand;
import io.markwise.cli.OnboardCommand;
import io.markwise.cli.ServeCommand;
import io.markwise.cli.StatusCommand;
import io.markwise.core.api.GatewayServer;
import io.markwise.core.config.ConfigPaths;
import io.markwise.core.config.ConfigService;
import io.markwise.core.config.model.GradingConfig;
import io.markwise.core.config.model.MarkwiseConfig;
import io.markwise.core.config.model.ProviderConfig;
import io.markwise.core.grading.GradingEngine;
import io.markwise.core.grading.PromptSettingsService;
import io.markwise.core.provider.OpenRouterClient;
import io.markwise.core.provider.SessionAuditLog;
import io.markwise.core.results.ResultQueryService;
import io.markwise.core.retry.RetryPolicy;
import io.markwise.core.retry.Sleeper;
import io.markwise.core.session.SessionService;
import io.markwise.core.store.PersistenceCoordinator;
import io.markwise.core.store.SqliteDatabase;
import io.markwise.core.store.SqliteResultStore;
import io.markwise.core.store.SqliteSessionStore;
import io.markwise.core.store.SqliteSettingsStore;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

public final class MarkwiseApplication {
    private static final Logger LOG = LoggerFactory.getLogger(MarkwiseApplication.class);

    private MarkwiseApplication() {
    }

    public static void main(String[] args) {
        ConfigService configService = new ConfigService();
        Path configPath = ConfigPaths.defaultConfigPath();
        Map<String, String> env = System.getenv();
        MarkwiseConfig config = loadConfig(configService, configPath, env);

        Clock clock = Clock.systemUTC();
        SqliteDatabase database = openDatabase(config);
        SqliteSessionStore sessionStore = new SqliteSessionStore(database, clock);
        SqliteResultStore resultStore = new SqliteResultStore(database, clock);
        PromptSettingsService promptSettings = new PromptSettingsService(new SqliteSettingsStore(database, clock));

        GradingConfig grading = config.grading();
        SessionAuditLog auditLog = new SessionAuditLog(ConfigPaths.resolve(grading.logDir(), "~/.markwise/logs"), clock);
        OpenRouterClient client = buildClient(config.openrouter(), grading, auditLog);

        GradingEngine engine = new GradingEngine(
            sessionStore,
            client,
            new PersistenceCoordinator(resultStore),
            promptSettings,
            auditLog,
            grading.maxConcurrency(),
            grading.debug()
        );
        SessionService sessionService = new SessionService(sessionStore);
        ResultQueryService resultQueries = new ResultQueryService(sessionService, resultStore);

        CliContext context = new CliContext(
            engine,
            configService,
            configPath,
            env,
            (port, host) -> runGateway(
                port == null ? config.gateway().port() : port,
                host == null || host.isBlank() ? config.gateway().host() : host,
                engine,
                sessionService,
                resultQueries,
                promptSettings
            )
        );

        CommandLine commandLine = new CommandLine(new MarkwiseCliCommand());
        commandLine.addSubcommand("onboard", new OnboardCommand(context));
        commandLine.addSubcommand("status", new StatusCommand(context));
        commandLine.addSubcommand("serve", new ServeCommand(context));
        commandLine.addSubcommand("grade", new GradeCommand(context));

        int exitCode;
        try {
            exitCode = commandLine.execute(args);
        } finally {
            engine.close();
        }
        System.exit(exitCode);
    }

    private static MarkwiseConfig loadConfig(ConfigService configService, Path configPath, Map<String, String> env) {
        try {
            return configService.loadEffective(configPath, env);
        } catch (Exception e) {
            LOG.warn("Could not load {}, using defaults with environment overrides: {}", configPath, e.getMessage());
            return configService.applyEnvironment(MarkwiseConfig.defaults(), env);
        }
    }

    private static SqliteDatabase openDatabase(MarkwiseConfig config) {
        Path dbPath = ConfigPaths.resolve(config.storage().dbPath(), "~/.markwise/markwise.db");
        try {
            return new SqliteDatabase(dbPath);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to initialize SQLite database at " + dbPath, e);
        }
    }

    private static OpenRouterClient buildClient(ProviderConfig provider, GradingConfig grading, SessionAuditLog auditLog) {
        String apiBase = provider.apiBase() == null || provider.apiBase().isBlank()
            ? "https://openrouter.ai/api/v1"
            : provider.apiBase();
        if (!provider.configured()) {
            LOG.warn("OPENROUTER_API_KEY is not set; grading calls will be rejected");
        }
        return new OpenRouterClient(
            provider.apiKey(),
            apiBase,
            provider.requestHeaders(),
            Duration.ofSeconds(grading.requestTimeoutSeconds()),
            RetryPolicy.completionDefaults(),
            Sleeper.system(),
            auditLog,
            grading.debug()
        );
    }

    private static int runGateway(
        int port,
        String host,
        GradingEngine engine,
        SessionService sessionService,
        ResultQueryService resultQueries,
        PromptSettingsService promptSettings
    ) throws Exception {
        CountDownLatch shutdown = new CountDownLatch(1);
        try (GatewayServer server = new GatewayServer(port, host, engine, sessionService, resultQueries, promptSettings)) {
            Runtime.getRuntime().addShutdownHook(new Thread(shutdown::countDown));
            server.start();
            System.out.println("Gateway started on http://" + host + ":" + server.port());
            System.out.println("Endpoints: POST /sessions, POST /images/register, POST /questions/config, "
                + "POST /grade/single, GET /results/{session_id}, GET /results/errors/{session_id}, "
                + "GET|PUT /settings/prompt, GET|PUT /settings/rubric-prompt, GET /healthz");
            shutdown.await();
        }
        return 0;
    }
}
