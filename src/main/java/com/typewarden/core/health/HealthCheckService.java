package com.typewarden.core.health;

import com.typewarden.core.config.CampaignProperties;
import com.typewarden.core.monitor.BuildStabilityHistory;
import com.typewarden.core.monitor.BuildStabilityRecord;
import com.typewarden.core.monitor.ProgressMonitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final CampaignProperties properties;
    private final ProgressMonitor monitor;
    private final BuildStabilityHistory buildHistory;

    public HealthCheckService(
            CampaignProperties properties,
            @Autowired(required = false) ProgressMonitor monitor,
            @Autowired(required = false) BuildStabilityHistory buildHistory) {
        this.properties = properties;
        this.monitor = monitor;
        this.buildHistory = buildHistory;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkBackups());
        results.add(checkTypeChecker());
        results.add(checkMonitor());
        results.add(checkBuild());
        return results;
    }

    private HealthStatus checkBackups() {
        Path dir = Path.of(properties.getReplacer().getBackupDirectory());
        try {
            Files.createDirectories(dir);
            if (Files.isWritable(dir)) {
                return new HealthStatus("backups", HealthStatus.Status.UP,
                        "Backup directory writable", Map.of("path", dir.toAbsolutePath().toString()));
            }
            return new HealthStatus("backups", HealthStatus.Status.DOWN,
                    "Backup directory not writable", Map.of("path", dir.toAbsolutePath().toString()));
        } catch (IOException e) {
            log.warn("Backup directory health check failed: {}", e.getMessage());
            return new HealthStatus("backups", HealthStatus.Status.DOWN,
                    "Backup directory error: " + e.getMessage(), Map.of());
        }
    }

    private HealthStatus checkTypeChecker() {
        List<String> command = properties.getTypeChecker().getCommand();
        if (command == null || command.isEmpty()) {
            return new HealthStatus("type-checker", HealthStatus.Status.DOWN,
                    "No type checker command configured", Map.of());
        }
        String executable = command.get(0);
        if (isOnPath(executable)) {
            return new HealthStatus("type-checker", HealthStatus.Status.UP,
                    "Type checker executable found", Map.of("command", String.join(" ", command)));
        }
        return new HealthStatus("type-checker", HealthStatus.Status.DEGRADED,
                "Executable '" + executable + "' not found on PATH", Map.of("command", String.join(" ", command)));
    }

    private HealthStatus checkMonitor() {
        if (monitor == null) {
            return new HealthStatus("monitor", HealthStatus.Status.DOWN,
                    "No progress monitor configured", Map.of());
        }
        return switch (monitor.getState()) {
            case RUNNING -> new HealthStatus("monitor", HealthStatus.Status.UP, "Monitor running", Map.of());
            case IDLE -> new HealthStatus("monitor", HealthStatus.Status.DEGRADED, "Monitor not started", Map.of());
            case STOPPED -> new HealthStatus("monitor", HealthStatus.Status.DOWN, "Monitor stopped", Map.of());
        };
    }

    private HealthStatus checkBuild() {
        if (buildHistory == null) {
            return new HealthStatus("build", HealthStatus.Status.DOWN,
                    "No build stability history configured", Map.of());
        }
        BuildStabilityRecord latest = buildHistory.latest();
        if (latest == null) {
            return new HealthStatus("build", HealthStatus.Status.UP, "No build probes yet", Map.of());
        }
        int failures = buildHistory.consecutiveFailures();
        if (latest.stable()) {
            return new HealthStatus("build", HealthStatus.Status.UP, "Last build probe passed",
                    Map.of("timestamp", latest.timestamp().toString()));
        }
        HealthStatus.Status status = failures >= properties.getMonitor().getBuildFailureThreshold()
                ? HealthStatus.Status.DOWN
                : HealthStatus.Status.DEGRADED;
        return new HealthStatus("build", status, failures + " consecutive build failure(s)",
                Map.of("timestamp", latest.timestamp().toString(),
                        "errorCount", String.valueOf(latest.errorCount())));
    }

    static boolean isOnPath(String executable) {
        Path direct = Path.of(executable);
        if (direct.isAbsolute() || executable.contains(File.separator)) {
            return Files.isExecutable(direct);
        }
        String path = System.getenv("PATH");
        if (path == null) {
            return false;
        }
        for (String dir : path.split(File.pathSeparator)) {
            if (!dir.isEmpty() && Files.isExecutable(Path.of(dir, executable))) {
                return true;
            }
        }
        return false;
    }
}
