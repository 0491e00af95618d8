package com.example.optimizerdaemon.config;

import com.example.optimizerdaemon.domain.ActionKind;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import okhttp3.HttpUrl;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Central configuration for the Optimizer Daemon.
 * Maps to the 'optimizer-daemon' prefix in application.yml.
 * Invalid values fail the startup instead of being clamped.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "optimizer-daemon")
public class DaemonProperties {

    private DecisionConfig decision = new DecisionConfig();
    private LoopConfig daemon = new LoopConfig();
    private ThresholdConfig thresholds = new ThresholdConfig();
    private MetricsConfig metrics = new MetricsConfig();
    private ActionsConfig actions = new ActionsConfig();
    private AuditConfig audit = new AuditConfig();

    public enum DecisionMode {
        LOCAL, REMOTE
    }

    @Data
    public static class DecisionConfig {
        private DecisionMode mode = DecisionMode.LOCAL;
        private String baseUrl = "https://malcolmai.live";
        private String path = "/optimize";
        private String prompt = "Optimize system performance";
        private int timeoutSeconds = 20;
        /** Sent as a bearer token when non-empty */
        private String apiToken = "";
    }

    @Data
    public static class LoopConfig {
        private int pollIntervalSeconds = 120;
        private boolean autoStart = true;
        private int shutdownTimeoutSeconds = 30;
    }

    @Data
    public static class ThresholdConfig {
        private double cpuPercent = 80.0;
        private double memoryPercent = 85.0;
        private double diskPercent = 90.0;
    }

    @Data
    public static class MetricsConfig {
        private String diskPath = "/";
        private long cpuSampleMillis = 1000;
    }

    @Data
    public static class ActionsConfig {
        /** Per-kind switches keyed by action name (e.g. clear_cache). Missing kinds are enabled. */
        private Map<String, Boolean> enabled = new LinkedHashMap<>();
        private boolean dryRun = false;
        private String tmpDirectory = "/tmp";
        private String logDirectory = "/var/log";
        /** Defaults to {@code <logDirectory>/archive} when empty */
        private String archiveDirectory = "";
        private int logMaxAgeDays = 7;
        private String dropCachesPath = "/proc/sys/vm/drop_caches";
        private String networkService = "NetworkManager";
        private int commandTimeoutSeconds = 60;

        public boolean isEnabled(ActionKind kind) {
            return enabled.getOrDefault(kind.getName(), true);
        }

        public Path resolveArchiveDirectory() {
            if (archiveDirectory == null || archiveDirectory.isBlank()) {
                return Path.of(logDirectory).resolve("archive");
            }
            return Path.of(archiveDirectory);
        }
    }

    @Data
    public static class AuditConfig {
        private String logPath = "optimizer_daemon.log";
    }

    @PostConstruct
    public void validate() {
        requirePositive("daemon.poll-interval-seconds", daemon.getPollIntervalSeconds());
        requirePositive("daemon.shutdown-timeout-seconds", daemon.getShutdownTimeoutSeconds());
        requirePositive("decision.timeout-seconds", decision.getTimeoutSeconds());
        requirePositive("metrics.cpu-sample-millis", metrics.getCpuSampleMillis());
        requirePositive("actions.log-max-age-days", actions.getLogMaxAgeDays());
        requirePositive("actions.command-timeout-seconds", actions.getCommandTimeoutSeconds());

        requirePercent("thresholds.cpu-percent", thresholds.getCpuPercent());
        requirePercent("thresholds.memory-percent", thresholds.getMemoryPercent());
        requirePercent("thresholds.disk-percent", thresholds.getDiskPercent());

        for (String kind : actions.getEnabled().keySet()) {
            if (ActionKind.fromName(kind).isEmpty()) {
                throw new DaemonConfigurationException("actions.enabled." + kind, "unknown action kind");
            }
        }

        if (decision.getMode() == null) {
            throw new DaemonConfigurationException("decision.mode", "must be 'local' or 'remote'");
        }
        if (decision.getMode() == DecisionMode.REMOTE && decisionUrl() == null) {
            throw new DaemonConfigurationException("decision.base-url",
                    "not a valid http(s) URL: " + decision.getBaseUrl() + decision.getPath());
        }

        requireNonBlank("metrics.disk-path", metrics.getDiskPath());
        requireNonBlank("actions.tmp-directory", actions.getTmpDirectory());
        requireNonBlank("actions.log-directory", actions.getLogDirectory());
        requireNonBlank("actions.network-service", actions.getNetworkService());
        requireNonBlank("audit.log-path", audit.getLogPath());
        Path tmp = Path.of(actions.getTmpDirectory()).toAbsolutePath().normalize();
        if (tmp.getParent() == null) {
            throw new DaemonConfigurationException("actions.tmp-directory", "must not be a filesystem root");
        }
    }

    /**
     * Full decision-service URL, or null when base URL and path do not form a valid one.
     */
    public HttpUrl decisionUrl() {
        String base = decision.getBaseUrl() == null ? "" : decision.getBaseUrl().trim();
        String path = decision.getPath() == null ? "" : decision.getPath().trim();
        if (base.endsWith("/") && path.startsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return HttpUrl.parse(base + path);
    }

    private static void requirePositive(String key, long value) {
        if (value <= 0) {
            throw new DaemonConfigurationException(key, "must be positive, was " + value);
        }
    }

    private static void requirePercent(String key, double value) {
        if (Double.isNaN(value) || value < 0 || value > 100) {
            throw new DaemonConfigurationException(key, "must be between 0 and 100, was " + value);
        }
    }

    private static void requireNonBlank(String key, String value) {
        if (value == null || value.isBlank()) {
            throw new DaemonConfigurationException(key, "must not be empty");
        }
    }
}
