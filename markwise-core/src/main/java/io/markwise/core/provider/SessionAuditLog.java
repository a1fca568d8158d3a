package io.markwise.core.provider;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class SessionAuditLog {
    private static final Logger LOG = LoggerFactory.getLogger(SessionAuditLog.class);

    private final Path directory;
    private final Clock clock;

    public SessionAuditLog(Path directory, Clock clock) {
        this.directory = Objects.requireNonNull(directory, "directory must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public void append(String sessionId, String text) {
        if (sessionId == null || sessionId.isBlank()) {
            return;
        }
        String line = "[" + LocalDateTime.now(clock).truncatedTo(ChronoUnit.SECONDS) + "] " + text + System.lineSeparator();
        try {
            Files.createDirectories(directory);
            Files.writeString(
                fileFor(sessionId),
                line,
                StandardCharsets.UTF_8,
                StandardOpenOption.CREATE,
                StandardOpenOption.APPEND
            );
        } catch (IOException e) {
            LOG.warn("Failed to write session log for {}", sessionId, e);
        }
    }

    public Path fileFor(String sessionId) {
        return directory.resolve("session_" + sessionId.replaceAll("[^A-Za-z0-9._-]", "_") + ".log");
    }
}
