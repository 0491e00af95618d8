package com.example.optimizerdaemon.executor;

import com.example.optimizerdaemon.config.DaemonProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.zip.GZIPOutputStream;

/**
 * Host operations for the machine the daemon runs on.
 * Paths and unit names come from configuration only.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LocalHostOperations implements HostOperations {

    private final DaemonProperties properties;
    private final CommandRunner commandRunner;
    private final Clock clock;

    @Override
    public String dropCaches() throws HostOperationException {
        commandRunner.run(List.of("sync"));
        Path dropCaches = Path.of(properties.getActions().getDropCachesPath());
        try {
            Files.writeString(dropCaches, "3", StandardCharsets.US_ASCII);
        } catch (IOException e) {
            throw new HostOperationException("Cannot write " + dropCaches + ": " + describe(e), e);
        }
        return "Synced filesystems and dropped page cache";
    }

    @Override
    public String cleanupTmp() throws HostOperationException {
        Path tmp = Path.of(properties.getActions().getTmpDirectory());
        if (!Files.isDirectory(tmp, LinkOption.NOFOLLOW_LINKS)) {
            throw new HostOperationException("Temp directory not found: " + tmp);
        }

        int removed = 0;
        int failed = 0;
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(tmp)) {
            for (Path entry : entries) {
                try {
                    deleteTree(entry);
                    removed++;
                } catch (IOException e) {
                    failed++;
                    log.debug("Could not remove {}: {}", entry, describe(e));
                }
            }
        } catch (IOException e) {
            throw new HostOperationException("Cannot list " + tmp + ": " + describe(e), e);
        }

        if (failed > 0) {
            log.warn("Temp cleanup left {} entries in {}", failed, tmp);
        }
        return String.format("Removed %d entries from %s (%d could not be removed)", removed, tmp, failed);
    }

    @Override
    public String archiveOldLogs() throws HostOperationException {
        DaemonProperties.ActionsConfig actions = properties.getActions();
        Path logDir = Path.of(actions.getLogDirectory());
        Path archiveDir = actions.resolveArchiveDirectory();
        Path auditLog = Path.of(properties.getAudit().getLogPath()).toAbsolutePath().normalize();
        Instant cutoff = clock.instant().minus(Duration.ofDays(actions.getLogMaxAgeDays()));

        if (!Files.isDirectory(logDir)) {
            throw new HostOperationException("Log directory not found: " + logDir);
        }

        int archived = 0;
        try {
            Files.createDirectories(archiveDir);
            try (DirectoryStream<Path> entries = Files.newDirectoryStream(logDir, "*.log")) {
                for (Path file : entries) {
                    if (!Files.isRegularFile(file, LinkOption.NOFOLLOW_LINKS)
                            || file.toAbsolutePath().normalize().equals(auditLog)
                            || !Files.getLastModifiedTime(file).toInstant().isBefore(cutoff)) {
                        continue;
                    }
                    gzip(file, archiveDir.resolve(file.getFileName() + "." + clock.millis() + ".gz"));
                    Files.delete(file);
                    archived++;
                }
            }
        } catch (IOException e) {
            throw new HostOperationException(String.format("Log archival failed after %d file(s): %s",
                    archived, describe(e)), e);
        }
        return String.format("Archived %d log file(s) older than %d days to %s",
                archived, actions.getLogMaxAgeDays(), archiveDir);
    }

    @Override
    public String restartNetwork() throws HostOperationException {
        String unit = properties.getActions().getNetworkService();
        commandRunner.run(List.of("systemctl", "restart", unit));
        return "Restarted " + unit;
    }

    @Override
    public boolean isRunning(long pid) {
        return ProcessHandle.of(pid).map(ProcessHandle::isAlive).orElse(false);
    }

    @Override
    public String terminate(long pid) throws HostOperationException {
        Optional<ProcessHandle> handle = ProcessHandle.of(pid);
        if (handle.isEmpty() || !handle.get().isAlive()) {
            throw new HostOperationException("Process " + pid + " exited before termination");
        }
        String command = handle.get().info().command().orElse("unknown");
        try {
            if (!handle.get().destroy()) {
                throw new HostOperationException("Termination request for PID " + pid + " was refused");
            }
        } catch (SecurityException e) {
            throw new HostOperationException("Not permitted to terminate PID " + pid + ": " + e.getMessage(), e);
        }
        return "Terminated high-CPU process PID " + pid + " (" + command + ")";
    }

    private static void deleteTree(Path root) throws IOException {
        if (Files.isDirectory(root, LinkOption.NOFOLLOW_LINKS)) {
            Files.walkFileTree(root, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                    Files.deleteIfExists(file);
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
                    if (exc != null) throw exc;
                    Files.deleteIfExists(dir);
                    return FileVisitResult.CONTINUE;
                }
            });
        } else {
            Files.deleteIfExists(root);
        }
    }

    private static void gzip(Path source, Path target) throws IOException {
        try (InputStream in = Files.newInputStream(source);
             OutputStream out = new GZIPOutputStream(Files.newOutputStream(target))) {
            in.transferTo(out);
        }
    }

    private static String describe(IOException e) {
        if (e instanceof NoSuchFileException) {
            return "no such file " + e.getMessage();
        }
        return e.getClass().getSimpleName() + ": " + e.getMessage();
    }
}
