package com.typewarden.core.engine;

import com.typewarden.core.analysis.CampaignAnalyzer;
import com.typewarden.core.analysis.DocumentationQualityAnalyzer;
import com.typewarden.core.analysis.ReplacementOutcomeTracker;
import com.typewarden.core.classifier.AnyTypeClassifier;
import com.typewarden.core.config.CampaignProperties;
import com.typewarden.core.domain.DomainContextAnalyzer;
import com.typewarden.core.events.EventBus;
import com.typewarden.core.metrics.CampaignMetrics;
import com.typewarden.core.model.AnyTypeCategory;
import com.typewarden.core.model.Classification;
import com.typewarden.core.model.ClassificationContext;
import com.typewarden.core.model.ClassifiedOccurrence;
import com.typewarden.core.model.TypeReplacement;
import com.typewarden.core.persistence.HistoryStore;
import com.typewarden.core.replacer.BackupStore;
import com.typewarden.core.replacer.CompilerOutputParser;
import com.typewarden.core.replacer.SafeTypeReplacer;
import com.typewarden.core.replacer.TypeCheckResult;
import com.typewarden.core.scanner.ContextBuilder;
import com.typewarden.core.scanner.OccurrenceScanner;
import com.typewarden.core.strategy.ReplacementStrategySet;
import com.typewarden.core.strategy.SafetyScorer;
import com.typewarden.core.vcs.GitCheckpointService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class CampaignEngineTest {

    private static final TypeCheckResult CLEAN = new TypeCheckResult(0, "", false, Duration.ofMillis(5));
    private static final TypeCheckResult BROKEN = new TypeCheckResult(2,
            "src/a.ts(1,1): error TS2322: Type 'unknown[]' is not assignable.", false, Duration.ofMillis(5));

    @TempDir
    Path tempDir;

    private final CampaignProperties properties = new CampaignProperties();
    private final AtomicReference<TypeCheckResult> nextCheck = new AtomicReference<>(CLEAN);
    private final GitCheckpointService checkpoints = mock(GitCheckpointService.class);
    private Path root;

    @BeforeEach
    void setUp() throws IOException {
        properties.getReplacer().setBackupDirectory(tempDir.resolve("backups").toString());
        root = Files.createDirectories(tempDir.resolve("project"));
        Path src = Files.createDirectories(root.resolve("src").resolve("util"));
        Files.writeString(src.resolve("a.ts"), "const items: any[] = obj;\n");
        Files.writeString(src.resolve("b.ts"), "try {\n  run();\n} catch (error: any) {\n}\n");
        Files.writeString(src.resolve("c.ts"), "const m: Record<string, any> = {};\n");
    }

    private CampaignEngine engine() {
        var clock = Clock.systemUTC();
        var eventBus = new EventBus();
        var metrics = new CampaignMetrics(new SimpleMeterRegistry());
        var tracker = new ReplacementOutcomeTracker(eventBus, clock, 100, HistoryStore.inMemory());
        var replacer = new SafeTypeReplacer(properties, new BackupStore(properties, clock), nextCheck::get,
                new CompilerOutputParser(), new CampaignLock(), eventBus, metrics, clock);
        return new CampaignEngine(properties,
                new OccurrenceScanner(properties),
                new ContextBuilder(properties, new DomainContextAnalyzer()),
                new AnyTypeClassifier(),
                new ReplacementStrategySet(),
                new SafetyScorer(),
                replacer,
                new CampaignAnalyzer(properties, tracker, new DocumentationQualityAnalyzer(properties), clock),
                tracker,
                checkpoints,
                metrics);
    }

    @Nested
    @DisplayName("plan")
    class PlanTests {

        private ClassifiedOccurrence occurrence(String snippet, AnyTypeCategory category,
                                                boolean intentional, double confidence) {
            var context = new ClassificationContext("src/a.ts", 1, snippet, List.of(snippet),
                    false, null, false, null);
            return new ClassifiedOccurrence(context,
                    new Classification(category, intentional, confidence, intentional ? null : "unknown[]"));
        }

        @Test
        @DisplayName("skips intentional and low-confidence classifications")
        void filters() {
            List<TypeReplacement> planned = engine().plan(List.of(
                    occurrence("const items: any[] = obj;", AnyTypeCategory.ARRAY_TYPE, false, 0.95),
                    occurrence("const more: any[] = obj;", AnyTypeCategory.ARRAY_TYPE, false, 0.5),
                    occurrence("} catch (e: any) {", AnyTypeCategory.ERROR_HANDLING, true, 0.95)));

            assertEquals(1, planned.size());
            TypeReplacement replacement = planned.get(0);
            assertEquals("any[]", replacement.original());
            assertEquals("unknown[]", replacement.replacement());
            assertEquals(AnyTypeCategory.ARRAY_TYPE, replacement.category());
        }

        @Test
        @DisplayName("a high safety score needs no extra validation")
        void validationFlag() {
            TypeReplacement replacement = engine().plan(List.of(
                    occurrence("const items: any[] = obj;", AnyTypeCategory.ARRAY_TYPE, false, 0.9))).get(0);

            assertEquals(1.0, replacement.confidence(), 1e-9);
            assertFalse(replacement.validationRequired());
        }
    }

    @Nested
    @DisplayName("runCampaign")
    class RunTests {

        @Test
        @DisplayName("applies every planned replacement when the build stays green")
        void greenRun() throws IOException {
            CampaignRunResult result = engine().runCampaign(root);

            assertEquals(3, result.occurrencesFound());
            assertEquals(2, result.plannedReplacements());
            assertEquals(2, result.appliedCount());
            assertEquals(0, result.failedCount());
            assertEquals(0, result.filesRemaining());
            assertEquals(100.0, result.successRate());
            assertEquals("const items: unknown[] = obj;\n",
                    Files.readString(root.resolve("src/util/a.ts")));
            assertEquals("const m: Record<string, unknown> = {};\n",
                    Files.readString(root.resolve("src/util/c.ts")));
            assertTrue(Files.readString(root.resolve("src/util/b.ts")).contains("catch (error: any)"));
            assertNull(result.checkpointId());
            verify(checkpoints, never()).createCheckpoint(any(), anyString());
        }

        @Test
        @DisplayName("a broken build leaves every file as it was")
        void brokenBuild() throws IOException {
            nextCheck.set(BROKEN);

            CampaignRunResult result = engine().runCampaign(root);

            assertEquals(0, result.appliedCount());
            assertEquals(2, result.failedCount());
            assertTrue(result.batches().get(0).rollbackPerformed());
            assertEquals("const items: any[] = obj;\n", Files.readString(root.resolve("src/util/a.ts")));
            assertEquals("const m: Record<string, any> = {};\n", Files.readString(root.resolve("src/util/c.ts")));
        }

        @Test
        @DisplayName("stops at the batch limit and reports what is left")
        void batchLimit() throws IOException {
            properties.getCampaign().setMaxFilesPerBatch(1);
            properties.getCampaign().setMaxBatches(1);

            CampaignRunResult result = engine().runCampaign(root);

            assertEquals(1, result.batches().size());
            assertEquals(1, result.appliedCount());
            assertEquals(1, result.filesRemaining());
        }

        @Test
        @DisplayName("takes a git checkpoint first when enabled")
        void checkpoint() throws IOException {
            properties.getCampaign().setGitCheckpoint(true);
            when(checkpoints.createCheckpoint(any(), anyString())).thenReturn(Optional.of("abc123"));

            CampaignRunResult result = engine().runCampaign(root);

            assertEquals("abc123", result.checkpointId());
            verify(checkpoints).createCheckpoint(any(), anyString());
        }
    }

    @Test
    @DisplayName("serves a report over the last classification")
    void currentReport() throws IOException {
        CampaignEngine engine = engine();
        assertEquals(0, engine.currentReport().distribution().totalOccurrences());

        engine.classify(root);

        assertEquals(3, engine.currentReport().distribution().totalOccurrences());
    }
}
