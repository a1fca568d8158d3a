package io.markwise.core.grading;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.markwise.core.error.PersistenceException;
import io.markwise.core.error.ValidationException;
import io.markwise.core.store.SettingsStore;
import java.io.IOException;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class PromptSettingsService {
    private static final Logger LOG = LoggerFactory.getLogger(PromptSettingsService.class);

    private final SettingsStore store;
    private final ObjectMapper mapper;

    public PromptSettingsService(SettingsStore store) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.mapper = new ObjectMapper();
    }

    public PromptTemplates assessmentTemplates() {
        return read(PromptTemplates.SETTINGS_KEY, PromptTemplates.class)
            .map(PromptTemplates::withDefaults)
            .orElseGet(PromptTemplates::defaults);
    }

    public RubricPromptTemplates rubricTemplates() {
        return read(RubricPromptTemplates.SETTINGS_KEY, RubricPromptTemplates.class)
            .map(RubricPromptTemplates::withDefaults)
            .orElseGet(RubricPromptTemplates::defaults);
    }

    public PromptTemplates saveAssessmentTemplates(PromptTemplates templates) {
        if (templates == null || !templates.complete()) {
            throw new ValidationException("system_template, user_template, and schema_template are all required");
        }
        write(PromptTemplates.SETTINGS_KEY, templates);
        return templates;
    }

    public RubricPromptTemplates saveRubricTemplates(RubricPromptTemplates templates) {
        if (templates == null || !templates.complete()) {
            throw new ValidationException("system_template and user_template are both required");
        }
        write(RubricPromptTemplates.SETTINGS_KEY, templates);
        return templates;
    }

    private <T> Optional<T> read(String key, Class<T> type) {
        try {
            Optional<String> json = store.get(key);
            if (json.isEmpty()) {
                return Optional.empty();
            }
            return Optional.ofNullable(mapper.readValue(json.get(), type));
        } catch (IOException e) {
            LOG.warn("Failed to read {} setting, using default templates", key, e);
            return Optional.empty();
        }
    }

    private void write(String key, Object value) {
        try {
            store.put(key, mapper.writeValueAsString(value));
            LOG.info("Saved {} setting", key);
        } catch (IOException e) {
            throw new PersistenceException("Failed to save settings: " + e.getMessage(), e);
        }
    }
}
