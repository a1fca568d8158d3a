package io.markwise.core.store;

import java.io.IOException;
import java.util.Optional;

public interface SettingsStore {
    Optional<String> get(String key) throws IOException;

    void put(String key, String jsonValue) throws IOException;
}
