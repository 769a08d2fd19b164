package com.typewarden.core.monitor;

import com.typewarden.core.config.CampaignProperties;
import com.typewarden.core.replacer.CompilerOutputParser;
import com.typewarden.core.replacer.TypeCheckResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class BuildStabilityProbeTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private final CampaignProperties properties = new CampaignProperties();

    private BuildStabilityProbe probeReturning(TypeCheckResult result) {
        return new BuildStabilityProbe(properties, () -> result, new CompilerOutputParser(),
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("a passing check is a stable record")
    void passing() {
        BuildStabilityRecord record = probeReturning(new TypeCheckResult(0, "", false, Duration.ofMillis(120))).probe();

        assertTrue(record.stable());
        assertEquals(0, record.errorCount());
        assertNull(record.errorMessage());
        assertEquals(120, record.buildTimeMs());
        assertEquals(NOW, record.timestamp());
    }

    @Test
    @DisplayName("counts parsed compiler errors")
    void countsErrors() {
        String output = "src/a.ts(1,1): error TS2304: Cannot find name 'A'.\n"
                + "src/b.ts(2,2): error TS2304: Cannot find name 'B'.";

        BuildStabilityRecord record = probeReturning(new TypeCheckResult(2, output, false, Duration.ofMillis(5))).probe();

        assertFalse(record.stable());
        assertEquals(2, record.errorCount());
        assertEquals(output, record.errorMessage());
    }

    @Test
    @DisplayName("error diagnostics with exit code zero are unstable")
    void diagnosticsWithCleanExit() {
        String output = "src/a.ts(1,1): error TS2304: Cannot find name 'A'.";

        BuildStabilityRecord record = probeReturning(new TypeCheckResult(0, output, false, Duration.ofMillis(5))).probe();

        assertFalse(record.stable());
        assertEquals(1, record.errorCount());
        assertEquals(output, record.errorMessage());
    }

    @Test
    @DisplayName("a timeout is unstable with one error")
    void timeout() {
        BuildStabilityRecord record = probeReturning(TypeCheckResult.timedOut("partial", Duration.ofSeconds(30))).probe();

        assertFalse(record.stable());
        assertEquals(1, record.errorCount());
        assertEquals("Type check timed out after 30s", record.errorMessage());
    }

    @Test
    @DisplayName("long error messages are truncated")
    void truncates() {
        properties.getMonitor().setErrorMessageMaxLength(20);

        BuildStabilityRecord record = probeReturning(new TypeCheckResult(2,
                "src/a.ts(1,1): error TS2304: Cannot find name 'SomethingVeryLong'.", false, Duration.ZERO)).probe();

        assertEquals(20, record.errorMessage().length());
        assertEquals("abc", BuildStabilityProbe.truncate("abc", 5));
    }
}
