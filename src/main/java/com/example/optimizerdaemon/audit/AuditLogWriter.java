package com.example.optimizerdaemon.audit;

import com.example.optimizerdaemon.config.DaemonProperties;
import com.example.optimizerdaemon.domain.Decision;
import com.example.optimizerdaemon.domain.ExecutionResult;
import com.example.optimizerdaemon.domain.MetricsSnapshot;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.util.regex.Pattern;

/**
 * Append-only audit log of every snapshot, decision and execution outcome.
 * One line per entry: {@code <ISO-8601 timestamp> :: <message>}.
 *
 * The file is never truncated or rotated here. Writes are synchronous so an
 * outcome is on disk before the daemon moves to the next action.
 */
@Slf4j
@Service
public class AuditLogWriter {

    public static final String DECISION_UNAVAILABLE = "[DECISION UNAVAILABLE]";
    public static final String DEGRADED = "[DEGRADED]";

    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\p{Cntrl}\\u2028\\u2029\\u0085]");

    private final Path logPath;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public AuditLogWriter(DaemonProperties properties, ObjectMapper objectMapper, Clock clock) {
        this.logPath = Path.of(properties.getAudit().getLogPath());
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public void daemonStarted() {
        append("=== Optimizer Daemon Started ===");
    }

    public void daemonStopped() {
        append("=== Optimizer Daemon Stopped ===");
    }

    public void snapshot(MetricsSnapshot snapshot) {
        append("Metrics: " + toJson(snapshot));
        if (snapshot.isDegraded()) {
            append(DEGRADED + " Metrics unavailable: " + String.join(", ", snapshot.unavailable()));
        }
    }

    public void decision(Decision decision) {
        append("Decision (" + decision.source() + "): " + toJson(decision.raw()));
    }

    public void decisionUnavailable(String reason) {
        append(DECISION_UNAVAILABLE + " " + reason);
    }

    public void result(ExecutionResult result) {
        append(result.toLogLine());
    }

    public void pendingActionsAborted(int count) {
        append("Shutdown requested, " + count + " pending action(s) not started");
    }

    public Path getLogPath() {
        return logPath;
    }

    private synchronized void append(String message) {
        String timestamp = OffsetDateTime.now(clock).format(DateTimeFormatter.ISO_OFFSET_DATE_TIME);
        // Control characters would split one entry across lines
        String line = timestamp + " :: " + CONTROL_CHARS.matcher(message).replaceAll(" ") + "\n";
        try {
            Path parent = logPath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(logPath, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            log.error("Failed to write audit log {}: {}", logPath, e.getMessage());
        }
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize {} for audit log: {}", value.getClass().getSimpleName(), e.getMessage());
            return String.valueOf(value);
        }
    }
}
