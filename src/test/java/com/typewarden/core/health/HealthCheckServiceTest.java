package com.typewarden.core.health;

import com.typewarden.core.config.CampaignProperties;
import com.typewarden.core.monitor.BuildStabilityHistory;
import com.typewarden.core.monitor.BuildStabilityRecord;
import com.typewarden.core.monitor.ProgressMonitor;
import com.typewarden.core.persistence.HistoryStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class HealthCheckServiceTest {

    @TempDir
    Path tempDir;

    private final CampaignProperties properties = new CampaignProperties();

    @BeforeEach
    void setUp() {
        properties.getReplacer().setBackupDirectory(tempDir.resolve("backups").toString());
        properties.getTypeChecker().setCommand(List.of(tempDir.resolve("no-such-tsc").toString()));
    }

    private static HealthStatus component(List<HealthStatus> results, String name) {
        return results.stream().filter(s -> name.equals(s.component())).findFirst().orElseThrow();
    }

    private static BuildStabilityRecord probe(boolean stable) {
        return new BuildStabilityRecord(Instant.parse("2026-03-01T12:00:00Z"), stable, 10, stable ? 0 : 1,
                stable ? null : "error TS2304: x");
    }

    @Test
    @DisplayName("Missing monitor and history -> DOWN")
    void missingComponentsDown() {
        var service = new HealthCheckService(properties, null, null);
        List<HealthStatus> results = service.checkAll();

        assertEquals(HealthStatus.Status.DOWN, component(results, "monitor").status());
        assertEquals(HealthStatus.Status.DOWN, component(results, "build").status());
    }

    @Test
    @DisplayName("checkAll returns backups, type-checker, monitor, build components")
    void checkAllReturnsAllComponents() {
        var components = new HealthCheckService(properties, null, null).checkAll().stream()
                .map(HealthStatus::component).toList();

        assertEquals(List.of("backups", "type-checker", "monitor", "build"), components);
    }

    @Test
    @DisplayName("Writable backup directory -> backups UP")
    void backupsUp() {
        var results = new HealthCheckService(properties, null, null).checkAll();

        assertEquals(HealthStatus.Status.UP, component(results, "backups").status());
    }

    @Test
    @DisplayName("Type checker not found -> DEGRADED, empty command -> DOWN")
    void typeChecker() {
        var service = new HealthCheckService(properties, null, null);
        assertEquals(HealthStatus.Status.DEGRADED, component(service.checkAll(), "type-checker").status());

        properties.getTypeChecker().setCommand(List.of());
        assertEquals(HealthStatus.Status.DOWN, component(service.checkAll(), "type-checker").status());
    }

    @Test
    @DisplayName("Monitor state maps to health")
    void monitorState() {
        var monitor = mock(ProgressMonitor.class);
        var service = new HealthCheckService(properties, monitor, null);

        when(monitor.getState()).thenReturn(ProgressMonitor.State.RUNNING);
        assertEquals(HealthStatus.Status.UP, component(service.checkAll(), "monitor").status());

        when(monitor.getState()).thenReturn(ProgressMonitor.State.IDLE);
        assertEquals(HealthStatus.Status.DEGRADED, component(service.checkAll(), "monitor").status());

        when(monitor.getState()).thenReturn(ProgressMonitor.State.STOPPED);
        assertEquals(HealthStatus.Status.DOWN, component(service.checkAll(), "monitor").status());
    }

    @Test
    @DisplayName("Build health follows the trailing failure run")
    void buildHealth() {
        var history = new BuildStabilityHistory(10, HistoryStore.inMemory());
        var service = new HealthCheckService(properties, null, history);
        assertEquals(HealthStatus.Status.UP, component(service.checkAll(), "build").status());

        history.record(probe(false));
        assertEquals(HealthStatus.Status.DEGRADED, component(service.checkAll(), "build").status());

        history.record(probe(false));
        history.record(probe(false));
        assertEquals(HealthStatus.Status.DOWN, component(service.checkAll(), "build").status());

        history.record(probe(true));
        assertEquals(HealthStatus.Status.UP, component(service.checkAll(), "build").status());
    }
}
