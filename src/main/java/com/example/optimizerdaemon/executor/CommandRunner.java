package com.example.optimizerdaemon.executor;

import com.example.optimizerdaemon.config.DaemonProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs a fixed argument vector directly, without a shell.
 * Non-zero exit, timeout or start failure are reported as {@link HostOperationException}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CommandRunner {

    private final DaemonProperties properties;

    public String run(List<String> command) throws HostOperationException {
        if (command == null || command.isEmpty()) {
            throw new HostOperationException("Empty command");
        }
        String display = String.join(" ", command);
        log.info("Running command: {}", display);

        Path outputFile = null;
        try {
            // Output goes to a file so a chatty command cannot block on a full pipe
            outputFile = Files.createTempFile("optimizer-cmd-", ".out");
            Process process = new ProcessBuilder(command)
                    .redirectErrorStream(true)
                    .redirectOutput(outputFile.toFile())
                    .start();

            int timeout = properties.getActions().getCommandTimeoutSeconds();
            if (!process.waitFor(timeout, TimeUnit.SECONDS)) {
                process.destroyForcibly();
                throw new HostOperationException(display + " timed out after " + timeout + "s");
            }

            String output = new String(Files.readAllBytes(outputFile), StandardCharsets.UTF_8);
            int exitCode = process.exitValue();
            if (exitCode != 0) {
                throw new HostOperationException(String.format("%s exited with code %d: %s",
                        display, exitCode, output.isBlank() ? "(no output)" : output.trim()));
            }
            return output.trim();

        } catch (IOException e) {
            throw new HostOperationException("Failed to run " + display + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new HostOperationException("Interrupted while running " + display, e);
        } finally {
            deleteQuietly(outputFile);
        }
    }

    private void deleteQuietly(Path file) {
        if (file == null) return;
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.debug("Could not delete command output file {}: {}", file, e.getMessage());
        }
    }
}
