package com.typewarden.core.analysis;

import com.typewarden.core.config.CampaignProperties;
import com.typewarden.core.model.AnyTypeCategory;
import com.typewarden.core.model.Classification;
import com.typewarden.core.model.ClassificationContext;
import com.typewarden.core.model.ClassifiedOccurrence;
import com.typewarden.core.model.CodeDomain;
import com.typewarden.core.model.DomainContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DocumentationQualityAnalyzerTest {

    private static final String EXCELLENT_COMMENT =
            "// Intentionally any because the external API returns a dynamic payload shape";
    private static final String GOOD_COMMENT =
            "Deliberately any because the shape is decided by whichever plugin registers";
    private static final String EXPLAINED_DIRECTIVE =
            "// eslint-disable-next-line @typescript-eslint/no-explicit-any -- vendor payload";
    private static final String BARE_DIRECTIVE =
            "// eslint-disable-next-line @typescript-eslint/no-explicit-any";

    @TempDir
    Path tempDir;

    private final DocumentationQualityAnalyzer analyzer = new DocumentationQualityAnalyzer(new CampaignProperties());

    private static ClassificationContext context(String file, int line, String snippet, CodeDomain domain) {
        return new ClassificationContext(file, line, snippet, List.of(), false, null,
                file.contains(".test."), DomainContext.of(domain));
    }

    private static ClassifiedOccurrence intentional(Path file, int line, String snippet, AnyTypeCategory category,
                                                    CodeDomain domain) {
        return new ClassifiedOccurrence(context(file.toString(), line, snippet, domain),
                new Classification(category, true, 0.9, null));
    }

    private Path write(String relative, String... lines) throws IOException {
        Path file = tempDir.resolve(relative);
        Files.createDirectories(file.getParent());
        return Files.writeString(file, String.join("\n", lines) + "\n");
    }

    @Nested
    @DisplayName("validateDocumentationQuality")
    class ValidationTests {

        @Test
        @DisplayName("a strong comment above an explained directive is complete")
        void completeDocumentation() {
            List<String> lines = List.of(
                    EXCELLENT_COMMENT,
                    EXPLAINED_DIRECTIVE,
                    "const payload: any = await response.json();");

            DocumentationValidation validation = analyzer.validateDocumentationQuality(
                    context("src/services/client.ts", 3, lines.get(2).trim(), CodeDomain.SERVICE), lines);

            assertTrue(validation.hasComment());
            assertEquals(EXCELLENT_COMMENT.substring(2).trim(), validation.comment());
            assertEquals(CommentQuality.EXCELLENT, validation.commentQuality());
            assertTrue(validation.hasLintDisable());
            assertTrue(validation.lintDisableExplained());
            assertTrue(validation.complete());
            assertEquals(List.of("Documentation is complete"), validation.suggestions());
        }

        @Test
        @DisplayName("no comment and no directive yields both suggestions and a domain template")
        void undocumented() {
            List<String> lines = List.of("const payload: any = await response.json();");

            DocumentationValidation validation = analyzer.validateDocumentationQuality(
                    context("src/services/client.ts", 1, lines.get(0), CodeDomain.SERVICE), lines);

            assertFalse(validation.hasComment());
            assertNull(validation.comment());
            assertEquals(CommentQuality.POOR, validation.commentQuality());
            assertFalse(validation.complete());
            assertTrue(validation.suggestions().contains(
                    "Consider: // Intentionally any: External API response with unknown structure"));
            assertTrue(validation.suggestions().stream().anyMatch(s -> s.startsWith("Add: // eslint-disable")));
        }

        @Test
        @DisplayName("a bare directive is not an explanatory comment and lacks a reason")
        void bareDirective() {
            List<String> lines = List.of(BARE_DIRECTIVE, "let cache: any = {};");

            DocumentationValidation validation = analyzer.validateDocumentationQuality(
                    context("src/util/cache.ts", 2, lines.get(1), CodeDomain.UTILITY), lines);

            assertFalse(validation.hasComment());
            assertTrue(validation.hasLintDisable());
            assertFalse(validation.lintDisableExplained());
        }

        @Test
        @DisplayName("a code line between the comment and the occurrence ends the search")
        void codeLineStopsSearch() {
            List<String> lines = List.of(EXCELLENT_COMMENT, "const x = 1;", "let y: any;");

            assertNull(DocumentationQualityAnalyzer.extractComment(lines, 2));
        }

        @Test
        @DisplayName("reads multi-line block comments")
        void blockComment() {
            List<String> lines = List.of(
                    "/**",
                    " * " + GOOD_COMMENT,
                    " */",
                    "export function register(plugin: any) {");

            assertEquals(GOOD_COMMENT, DocumentationQualityAnalyzer.extractComment(lines, 3));
        }

        @Test
        @DisplayName("falls back to a trailing comment on the same line")
        void trailingComment() {
            List<String> lines = List.of("} catch (e: any) { // intentionally any: rethrown unchanged");

            assertEquals("intentionally any: rethrown unchanged", DocumentationQualityAnalyzer.extractComment(lines, 0));
        }

        @Test
        @DisplayName("a directive reason must follow the rule name after --")
        void directiveReason() {
            assertTrue(DocumentationQualityAnalyzer.hasLintExplanation(EXPLAINED_DIRECTIVE));
            assertFalse(DocumentationQualityAnalyzer.hasLintExplanation(BARE_DIRECTIVE));
            assertFalse(DocumentationQualityAnalyzer.hasLintExplanation(BARE_DIRECTIVE + " -- "));
            assertTrue(DocumentationQualityAnalyzer.hasLintExplanation(
                    "/* eslint-disable @typescript-eslint/no-explicit-any -- generated client */"));
        }
    }

    @Nested
    @DisplayName("comment grading")
    class GradingTests {

        @Test
        @DisplayName("short or missing comments are poor")
        void poor() {
            assertEquals(CommentQuality.POOR, analyzer.assessCommentQuality(null));
            assertEquals(CommentQuality.POOR, analyzer.assessCommentQuality("any here"));
        }

        @Test
        @DisplayName("keyword, explanation, context and length add up to the grade")
        void grades() {
            assertEquals(CommentQuality.FAIR, analyzer.assessCommentQuality(
                    "Intentionally any: external API response with dynamic structure"));
            assertEquals(CommentQuality.GOOD, analyzer.assessCommentQuality(GOOD_COMMENT));
            assertEquals(CommentQuality.EXCELLENT, analyzer.assessCommentQuality(EXCELLENT_COMMENT.substring(3)));
        }

        @Test
        @DisplayName("explanation words match whole words only")
        void wholeWords() {
            // "format" and "information" must not count as "for"
            assertEquals(CommentQuality.POOR, analyzer.assessCommentQuality("Keeps the raw format information"));
        }
    }

    @Nested
    @DisplayName("generateQualityReport")
    class ReportTests {

        @Test
        @DisplayName("counts coverage over intentional occurrences only")
        void coverage() throws IOException {
            Path client = write("src/services/client.ts",
                    "const payload: any = await response.json();");
            Path documented = write("src/util/registry.ts",
                    EXCELLENT_COMMENT,
                    EXPLAINED_DIRECTIVE,
                    "const entries: any = load();");
            Path spec = write("src/util/registry.test.ts",
                    "const mock: any = {};");
            Path arrays = write("src/util/list.ts",
                    "const items: any[] = [];");

            DocumentationQualityReport report = analyzer.generateQualityReport(List.of(
                    intentional(client, 1, "const payload: any = await response.json();",
                            AnyTypeCategory.EXTERNAL_API, CodeDomain.SERVICE),
                    intentional(documented, 3, "const entries: any = load();",
                            AnyTypeCategory.DYNAMIC_CONFIG, CodeDomain.UTILITY),
                    intentional(spec, 1, "const mock: any = {};", AnyTypeCategory.TEST_MOCK, CodeDomain.TEST),
                    new ClassifiedOccurrence(context(arrays.toString(), 1, "const items: any[] = [];",
                            CodeDomain.UTILITY),
                            new Classification(AnyTypeCategory.ARRAY_TYPE, false, 0.9, "unknown[]"))));

            assertEquals(3, report.checkedOccurrences());
            assertEquals(0, report.skippedOccurrences());
            assertEquals(1, report.documentedOccurrences());
            assertEquals(1, report.completeOccurrences());
            assertEquals(100.0 / 3, report.compliancePercentage(), 1e-9);
            assertEquals(100.0, report.averageQualityScore());

            assertEquals(2, report.undocumented().size());
            UndocumentedOccurrence first = report.undocumented().get(0);
            assertEquals(client.toString(), first.filePath());
            assertEquals(ReviewPriority.HIGH, first.priority());
            assertEquals(ReviewPriority.LOW, report.undocumented().get(1).priority());
            assertEquals(List.of(client.toString(), spec.toString()), report.undocumentedFiles());

            assertTrue(report.recommendations().get(0).startsWith("Documentation coverage is critically low at 33.3%"));
            assertTrue(report.recommendations().contains("Document these files first: " + client));
        }

        @Test
        @DisplayName("the quality distribution is taken over documented occurrences")
        void qualityDistribution() throws IOException {
            Path file = write("src/util/plugins.ts",
                    "// " + GOOD_COMMENT,
                    "export function register(plugin: any) {}",
                    "// any here",
                    "export function unregister(plugin: any) {}");

            DocumentationQualityReport report = analyzer.generateQualityReport(List.of(
                    intentional(file, 2, "export function register(plugin: any) {}",
                            AnyTypeCategory.FUNCTION_PARAM, CodeDomain.UTILITY),
                    intentional(file, 4, "export function unregister(plugin: any) {}",
                            AnyTypeCategory.FUNCTION_PARAM, CodeDomain.UTILITY)));

            assertEquals(100.0, report.compliancePercentage());
            assertEquals(50.0, report.averageQualityScore());
            DistributionEntry poor = report.qualityDistribution().get(0);
            DistributionEntry good = report.qualityDistribution().get(2);
            assertEquals("POOR", poor.label());
            assertEquals(50.0, poor.percentage());
            assertEquals("GOOD", good.label());
            assertEquals(1, good.count());
            assertTrue(report.recommendations().contains(
                    "1 of 2 comments are rated poor; say why the any is needed"));
            assertTrue(report.recommendations().contains(
                    "2 documented occurrences lack an explained eslint-disable directive"));
        }

        @Test
        @DisplayName("occurrences in unreadable files are skipped, not failed")
        void unreadableFile() {
            DocumentationQualityReport report = analyzer.generateQualityReport(List.of(
                    intentional(tempDir.resolve("gone.ts"), 1, "let x: any;",
                            AnyTypeCategory.LEGACY_COMPATIBILITY, CodeDomain.UTILITY)));

            assertEquals(0, report.checkedOccurrences());
            assertEquals(1, report.skippedOccurrences());
            assertEquals(100.0, report.compliancePercentage());
            assertTrue(report.recommendations().isEmpty());
        }

        @Test
        @DisplayName("no intentional occurrences means full coverage and no recommendations")
        void empty() {
            DocumentationQualityReport report = analyzer.generateQualityReport(List.of());

            assertEquals(100.0, report.compliancePercentage());
            assertEquals(0.0, report.averageQualityScore());
            assertTrue(report.undocumented().isEmpty());
            assertTrue(report.recommendations().isEmpty());
        }
    }
}
