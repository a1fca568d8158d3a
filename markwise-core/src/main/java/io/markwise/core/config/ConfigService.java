package io.markwise.core.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.markwise.core.config.model.GradingConfig;
import io.markwise.core.config.model.MarkwiseConfig;
import io.markwise.core.config.model.ProviderConfig;
import io.markwise.core.config.model.StorageConfig;
import io.markwise.core.error.ConfigException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

public final class ConfigService {
    private final ObjectMapper mapper;

    public ConfigService() {
        mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public MarkwiseConfig load(Path configPath) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        if (!Files.exists(configPath)) {
            return MarkwiseConfig.defaults();
        }

        JsonNode defaultsNode = mapper.valueToTree(MarkwiseConfig.defaults());
        JsonNode existingNode = mapper.readTree(Files.readString(configPath));
        JsonNode merged = deepMerge(defaultsNode, existingNode);
        return mapper.treeToValue(merged, MarkwiseConfig.class);
    }

    public MarkwiseConfig loadEffective(Path configPath, Map<String, String> env) throws IOException {
        return applyEnvironment(load(configPath), env);
    }

    public MarkwiseConfig applyEnvironment(MarkwiseConfig config, Map<String, String> env) {
        Objects.requireNonNull(config, "config must not be null");
        if (env == null || env.isEmpty()) {
            return config;
        }

        ProviderConfig provider = config.openrouter();
        provider = new ProviderConfig(
            env.getOrDefault("OPENROUTER_API_KEY", provider.apiKey()),
            env.getOrDefault("OPENROUTER_BASE_URL", provider.apiBase()),
            env.getOrDefault("OPENROUTER_HTTP_REFERER", provider.httpReferer()),
            env.getOrDefault("OPENROUTER_APP_TITLE", provider.appTitle()),
            provider.extraHeaders()
        );

        GradingConfig grading = config.grading();
        grading = new GradingConfig(
            env.containsKey("GRADING_MAX_CONCURRENCY")
                ? parsePositiveInt("GRADING_MAX_CONCURRENCY", env.get("GRADING_MAX_CONCURRENCY"))
                : grading.maxConcurrency(),
            grading.defaultTries(),
            env.containsKey("OPENROUTER_DEBUG") ? parseFlag(env.get("OPENROUTER_DEBUG")) : grading.debug(),
            env.getOrDefault("GRADE_LOG_DIR", grading.logDir()),
            grading.requestTimeoutSeconds()
        );

        StorageConfig storage = config.storage();
        if (env.containsKey("MARKWISE_DB_PATH")) {
            storage = new StorageConfig(env.get("MARKWISE_DB_PATH"));
        }

        return config.withOpenrouter(provider).withGrading(grading).withStorage(storage);
    }

    public void save(Path configPath, MarkwiseConfig config) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        Objects.requireNonNull(config, "config must not be null");
        Files.createDirectories(configPath.toAbsolutePath().getParent());
        String json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config);
        Files.writeString(configPath, json + System.lineSeparator());
    }

    public OnboardResult onboard(Path configPath, boolean overwrite) throws IOException {
        boolean created = !Files.exists(configPath);
        boolean overwritten = false;

        MarkwiseConfig config;
        if (created || overwrite) {
            config = MarkwiseConfig.defaults();
            overwritten = !created && overwrite;
        } else {
            config = load(configPath);
        }

        save(configPath, config);

        Path logDirectory = ConfigPaths.resolve(config.grading().logDir(), "~/.markwise/logs");
        Files.createDirectories(logDirectory);
        Path databasePath = ConfigPaths.resolve(config.storage().dbPath(), "~/.markwise/markwise.db");
        Path databaseDirectory = databasePath.toAbsolutePath().getParent();
        if (databaseDirectory != null) {
            Files.createDirectories(databaseDirectory);
        }
        return new OnboardResult(
            configPath,
            logDirectory,
            databasePath,
            Files.exists(databasePath),
            created,
            overwritten
        );
    }

    public String toPrettyJson(MarkwiseConfig config) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize config", e);
        }
    }

    static boolean parseFlag(String value) {
        if (value == null) {
            return false;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return normalized.equals("1") || normalized.equals("true") || normalized.equals("yes") || normalized.equals("on");
    }

    private static int parsePositiveInt(String name, String value) {
        try {
            int parsed = Integer.parseInt(value.trim());
            if (parsed < 1) {
                throw new ConfigException(name + " must be a positive integer, got " + value);
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw new ConfigException(name + " must be a positive integer, got " + value);
        }
    }

    private JsonNode deepMerge(JsonNode base, JsonNode override) {
        if (base == null) {
            return override;
        }
        if (override == null) {
            return base;
        }
        if (!base.isObject() || !override.isObject()) {
            return override;
        }

        ObjectNode merged = ((ObjectNode) base).deepCopy();
        override.fields().forEachRemaining(entry -> {
            JsonNode existing = merged.get(entry.getKey());
            merged.set(entry.getKey(), deepMerge(existing, entry.getValue()));
        });
        return merged;
    }
}
