package com.example.optimizerdaemon.config;

import com.example.optimizerdaemon.domain.ActionKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class DaemonPropertiesTest {

    private DaemonProperties properties;

    @BeforeEach
    void setUp() {
        properties = new DaemonProperties();
    }

    @Test
    @DisplayName("Defaults are valid")
    void defaultsValidate() {
        assertDoesNotThrow(() -> properties.validate());
        assertEquals(120, properties.getDaemon().getPollIntervalSeconds());
        assertEquals(DaemonProperties.DecisionMode.LOCAL, properties.getDecision().getMode());
        assertEquals("https://malcolmai.live/optimize", properties.decisionUrl().toString());
    }

    @Test
    @DisplayName("Non-positive interval is rejected with its key")
    void rejectsNonPositiveInterval() {
        properties.getDaemon().setPollIntervalSeconds(0);

        DaemonConfigurationException e = assertThrows(DaemonConfigurationException.class, () -> properties.validate());
        assertEquals("daemon.poll-interval-seconds", e.getKey());
    }

    @Test
    @DisplayName("Thresholds outside 0-100 are rejected")
    void rejectsBadPercent() {
        properties.getThresholds().setDiskPercent(150);

        DaemonConfigurationException e = assertThrows(DaemonConfigurationException.class, () -> properties.validate());
        assertEquals("thresholds.disk-percent", e.getKey());
    }

    @Test
    @DisplayName("Unknown action names in the enabled map are rejected")
    void rejectsUnknownEnabledKey() {
        properties.getActions().getEnabled().put("format_disk", true);

        assertThrows(DaemonConfigurationException.class, () -> properties.validate());
    }

    @Test
    @DisplayName("Remote mode needs a valid URL")
    void remoteModeNeedsUrl() {
        properties.getDecision().setMode(DaemonProperties.DecisionMode.REMOTE);
        properties.getDecision().setBaseUrl("not a url");

        DaemonConfigurationException e = assertThrows(DaemonConfigurationException.class, () -> properties.validate());
        assertEquals("decision.base-url", e.getKey());
    }

    @Test
    @DisplayName("A filesystem root is never accepted as temp directory")
    void rejectsRootTmpDirectory() {
        properties.getActions().setTmpDirectory("/");

        DaemonConfigurationException e = assertThrows(DaemonConfigurationException.class, () -> properties.validate());
        assertEquals("actions.tmp-directory", e.getKey());
    }

    @Test
    @DisplayName("Base URL and path join without a double slash")
    void joinsUrl() {
        properties.getDecision().setBaseUrl("http://localhost:8080/");
        properties.getDecision().setPath("/optimize");

        assertEquals("http://localhost:8080/optimize", properties.decisionUrl().toString());
    }

    @Test
    @DisplayName("Actions are enabled unless switched off")
    void enabledFlags() {
        properties.getActions().getEnabled().put("restart_network", false);

        assertTrue(properties.getActions().isEnabled(ActionKind.CLEAR_CACHE));
        assertFalse(properties.getActions().isEnabled(ActionKind.RESTART_NETWORK));
    }

    @Test
    @DisplayName("Archive directory defaults to a subdirectory of the log directory")
    void archiveDirectoryDefault() {
        properties.getActions().setLogDirectory("/var/log");

        assertEquals(Path.of("/var/log/archive"), properties.getActions().resolveArchiveDirectory());

        properties.getActions().setArchiveDirectory("/srv/archive");
        assertEquals(Path.of("/srv/archive"), properties.getActions().resolveArchiveDirectory());
    }
}
