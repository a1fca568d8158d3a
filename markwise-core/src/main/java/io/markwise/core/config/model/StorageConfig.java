package io.markwise.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record StorageConfig(@JsonAlias({"db_path"}) String dbPath) {

    public static StorageConfig defaults() {
        return new StorageConfig("~/.markwise/markwise.db");
    }
}
