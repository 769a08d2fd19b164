package com.typewarden.core.replacer;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProcessTypeCheckerTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("an empty command is rejected")
    void emptyCommandRejected() {
        assertThrows(IllegalStateException.class,
                () -> new ProcessTypeChecker(List.of(), tempDir, Duration.ofSeconds(1)));
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    @DisplayName("captures merged output and exit code")
    void capturesOutput() {
        var checker = new ProcessTypeChecker(
                List.of("sh", "-c", "echo 'src/a.ts(1,1): error TS1005: x' 1>&2; exit 2"),
                tempDir, Duration.ofSeconds(10));

        TypeCheckResult result = checker.check();

        assertFalse(result.passed());
        assertFalse(result.timedOut());
        assertEquals(2, result.exitCode());
        assertTrue(result.output().contains("error TS1005"));
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    @DisplayName("a clean run passes")
    void cleanRun() {
        var checker = new ProcessTypeChecker(List.of("sh", "-c", "exit 0"), tempDir, Duration.ofSeconds(10));
        assertTrue(checker.check().passed());
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    @DisplayName("a run over the time budget is killed and reported as timed out")
    void timeout() {
        var checker = new ProcessTypeChecker(List.of("sh", "-c", "exec sleep 30"), tempDir, Duration.ofMillis(300));

        TypeCheckResult result = checker.check();

        assertTrue(result.timedOut());
        assertFalse(result.passed());
        assertTrue(result.elapsed().compareTo(Duration.ofSeconds(20)) < 0);
    }

    @Test
    @DisplayName("a missing executable is reported, not thrown")
    void missingExecutable() {
        var checker = new ProcessTypeChecker(List.of("definitely-not-a-real-binary-xyz"), tempDir,
                Duration.ofSeconds(1));

        TypeCheckResult result = checker.check();

        assertFalse(result.passed());
        assertEquals(-1, result.exitCode());
        assertTrue(result.output().startsWith("Type checker could not be started"));
    }
}
