package com.typewarden.core.analysis;

import com.typewarden.core.config.CampaignProperties;
import com.typewarden.core.model.AnyTypeCategory;
import com.typewarden.core.model.ClassificationContext;
import com.typewarden.core.model.ClassifiedOccurrence;
import com.typewarden.core.model.CodeDomain;
import com.typewarden.core.scanner.OccurrenceScanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Checks that every intentional {@code any} the campaign keeps is explained.
 * <p>
 * An occurrence is documented when a comment sits on the same line or in the
 * three lines above it with no code in between. It is complete when that
 * comment grades above {@link CommentQuality#POOR} and an
 * {@code eslint-disable ... no-explicit-any -- reason} directive within two
 * lines carries a reason. Lint directives never count as the explanatory comment.
 */
@Service
public class DocumentationQualityAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(DocumentationQualityAnalyzer.class);

    static final int COMMENT_WINDOW = 3;
    static final int LINT_WINDOW = 2;
    static final double TARGET_COVERAGE = 80.0;
    static final double CRITICAL_COVERAGE = 50.0;
    static final double POOR_SHARE_LIMIT = 20.0;
    static final int PRIORITY_FILE_LIMIT = 5;

    private static final String LINT_RULE = "no-explicit-any";
    private static final Pattern EXPLANATION_WORDS = Pattern.compile("\\b(because|for|due to|requires)\\b");
    private static final Pattern CONTEXT_WORDS =
            Pattern.compile("\\b(api|external|dynamic|flexible|legacy|compatibility)\\b");
    private static final Pattern SERVICE_PATH = Pattern.compile("service|(^|[/\\\\_.-])api");

    private final int minimumCommentLength;
    private final List<String> requiredKeywords;
    private final int excellentScore;
    private final int goodScore;
    private final int fairScore;

    public DocumentationQualityAnalyzer(CampaignProperties properties) {
        CampaignProperties.Documentation settings = properties.getDocumentation();
        this.minimumCommentLength = settings.getMinimumCommentLength();
        this.requiredKeywords = settings.getRequiredKeywords().stream()
                .map(k -> k.toLowerCase(Locale.ROOT))
                .toList();
        this.excellentScore = settings.getExcellentScore();
        this.goodScore = settings.getGoodScore();
        this.fairScore = settings.getFairScore();
    }

    /**
     * Grades the documentation of every intentional occurrence. Each file is
     * read once; occurrences in unreadable files are counted as skipped.
     */
    public DocumentationQualityReport generateQualityReport(List<ClassifiedOccurrence> occurrences) {
        Map<String, List<String>> linesByFile = new HashMap<>();
        var qualityCounts = new EnumMap<CommentQuality, Integer>(CommentQuality.class);
        var undocumented = new ArrayList<UndocumentedOccurrence>();
        int checked = 0;
        int skipped = 0;
        int documented = 0;
        int complete = 0;
        int qualityTotal = 0;

        for (ClassifiedOccurrence occurrence : occurrences) {
            if (!occurrence.classification().isIntentional()) continue;
            ClassificationContext context = occurrence.context();
            if (!linesByFile.containsKey(context.filePath())) {
                linesByFile.put(context.filePath(), readLines(context.filePath()));
            }
            List<String> lines = linesByFile.get(context.filePath());
            if (lines == null) {
                skipped++;
                continue;
            }

            checked++;
            DocumentationValidation validation = validateDocumentationQuality(context, lines);
            if (validation.hasComment()) {
                documented++;
                qualityCounts.merge(validation.commentQuality(), 1, Integer::sum);
                qualityTotal += validation.commentQuality().score();
                if (validation.complete()) complete++;
            } else {
                CodeDomain domain = domainOf(context);
                undocumented.add(new UndocumentedOccurrence(context.filePath(), context.lineNumber(),
                        context.codeSnippet(), occurrence.classification().category(), domain,
                        priorityOf(context, occurrence.classification().category()),
                        commentTemplate(domain, context.codeSnippet())));
            }
        }

        undocumented.sort(Comparator.comparing(UndocumentedOccurrence::priority)
                .thenComparing(UndocumentedOccurrence::filePath)
                .thenComparingInt(UndocumentedOccurrence::lineNumber));

        var distribution = new ArrayList<DistributionEntry>();
        for (CommentQuality quality : CommentQuality.values()) {
            distribution.add(DistributionEntry.of(quality.name(), qualityCounts.getOrDefault(quality, 0), documented));
        }
        double compliance = checked > 0 ? documented * 100.0 / checked : 100.0;
        double averageQuality = documented > 0 ? (double) qualityTotal / documented : 0.0;
        var files = new LinkedHashSet<String>();
        undocumented.forEach(u -> files.add(u.filePath()));

        var report = new DocumentationQualityReport(checked, skipped, documented, complete, compliance,
                averageQuality, distribution, undocumented, List.copyOf(files),
                recommendations(checked, documented, complete, compliance, qualityCounts, undocumented));
        log.info("Documentation check: {}/{} intentional occurrences documented ({}%), {} complete, {} skipped",
                documented, checked, String.format(Locale.ROOT, "%.1f", compliance), complete, skipped);
        return report;
    }

    /**
     * Validates one occurrence against the current contents of its file.
     *
     * @param fileLines the whole file, one entry per line
     */
    public DocumentationValidation validateDocumentationQuality(ClassificationContext context, List<String> fileLines) {
        int index = context.lineNumber() - 1;
        String comment = extractComment(fileLines, index);
        boolean hasComment = comment != null;
        CommentQuality quality = assessCommentQuality(comment);
        String directive = findLintDirective(fileLines, index);
        boolean hasLintDisable = directive != null;
        boolean explained = hasLintDisable && hasLintExplanation(directive);
        boolean complete = hasComment && quality != CommentQuality.POOR && explained;

        var suggestions = new ArrayList<String>();
        if (!hasComment) {
            suggestions.add("Add a comment explaining why this any is intentional");
            suggestions.add("Consider: // Intentionally any: " + commentTemplate(domainOf(context), context.codeSnippet()));
        } else {
            switch (quality) {
                case POOR -> {
                    suggestions.add("Expand the comment to at least " + minimumCommentLength
                            + " characters and say why the any is needed");
                    suggestions.add("Use a keyword such as 'intentionally', 'deliberately' or 'required'");
                }
                case FAIR -> suggestions.add("Name the external dependency or use case that needs the any");
                case GOOD -> suggestions.add("Consider adding domain-specific context to the comment");
                case EXCELLENT -> { }
            }
        }
        if (!hasLintDisable) {
            suggestions.add("Add: // eslint-disable-next-line @typescript-eslint/no-explicit-any -- <reason>");
        } else if (!explained) {
            suggestions.add("Add a '-- <reason>' description to the eslint-disable directive");
        }
        if (suggestions.isEmpty()) {
            suggestions.add("Documentation is complete");
        }
        return new DocumentationValidation(hasComment, comment, quality, hasLintDisable, explained, complete,
                suggestions);
    }

    CommentQuality assessCommentQuality(String comment) {
        if (comment == null || comment.trim().length() < minimumCommentLength) {
            return CommentQuality.POOR;
        }
        String lower = comment.toLowerCase(Locale.ROOT);
        int score = 0;
        if (requiredKeywords.stream().anyMatch(lower::contains)) score += 30;
        if (EXPLANATION_WORDS.matcher(lower).find()) score += 25;
        if (CONTEXT_WORDS.matcher(lower).find()) score += 20;
        if (comment.length() > 50) score += 15;
        if (comment.length() > 100) score += 10;

        if (score >= excellentScore) return CommentQuality.EXCELLENT;
        if (score >= goodScore) return CommentQuality.GOOD;
        if (score >= fairScore) return CommentQuality.FAIR;
        return CommentQuality.POOR;
    }

    /**
     * Returns the explanatory comment for the line at {@code index}, or
     * {@code null}. The nearest comment above wins; a code line ends the search.
     */
    static String extractComment(List<String> lines, int index) {
        int floor = Math.max(0, index - COMMENT_WINDOW);
        for (int i = Math.min(index, lines.size()) - 1; i >= floor; i--) {
            String trimmed = lines.get(i).trim();
            if (trimmed.isEmpty() || isLintDirective(trimmed)) continue;
            if (trimmed.startsWith("//")) {
                return trimmed.substring(2).trim();
            }
            if (trimmed.endsWith("*/") || trimmed.startsWith("*") || trimmed.startsWith("/*")) {
                return blockComment(lines, i);
            }
            break;
        }
        if (index >= 0 && index < lines.size()) {
            String line = lines.get(index);
            int at = line.indexOf("//");
            if (at >= 0 && !isLintDirective(line.substring(at))) {
                return line.substring(at + 2).trim();
            }
        }
        return null;
    }

    private static String blockComment(List<String> lines, int end) {
        int start = end;
        while (start > 0 && !lines.get(start).contains("/*")) {
            start--;
        }
        var text = new StringBuilder();
        for (int i = start; i <= end; i++) {
            String part = lines.get(i).trim()
                    .replaceFirst("^/\\*+", "")
                    .replaceFirst("\\*/.*$", "")
                    .replaceFirst("^\\*+", "")
                    .trim();
            if (part.isEmpty()) continue;
            if (text.length() > 0) text.append(' ');
            text.append(part);
        }
        return text.toString();
    }

    static String findLintDirective(List<String> lines, int index) {
        for (int i = Math.max(0, index - LINT_WINDOW); i <= index && i < lines.size(); i++) {
            String line = lines.get(i);
            if (isLintDirective(line) && line.contains(LINT_RULE)) {
                return line;
            }
        }
        return null;
    }

    static boolean hasLintExplanation(String directive) {
        int separator = directive.indexOf("--", directive.indexOf(LINT_RULE) + LINT_RULE.length());
        if (separator < 0) return false;
        String reason = directive.substring(separator + 2).replaceFirst("\\*/.*$", "").trim();
        return !reason.isEmpty();
    }

    private static boolean isLintDirective(String text) {
        return text.contains("eslint-disable");
    }

    static ReviewPriority priorityOf(ClassificationContext context, AnyTypeCategory category) {
        if (context.isInTestFile()) return ReviewPriority.LOW;
        if (SERVICE_PATH.matcher(context.filePath().toLowerCase(Locale.ROOT)).find()) return ReviewPriority.HIGH;
        String snippet = context.codeSnippet();
        boolean signature = category == AnyTypeCategory.FUNCTION_PARAM || category == AnyTypeCategory.RETURN_TYPE
                || snippet.contains("=>") || snippet.contains("function");
        boolean container = category == AnyTypeCategory.ARRAY_TYPE || category == AnyTypeCategory.RECORD_TYPE
                || snippet.contains("any[]") || snippet.contains("Record<");
        return signature || container ? ReviewPriority.MEDIUM : ReviewPriority.LOW;
    }

    static String commentTemplate(CodeDomain domain, String snippet) {
        return switch (domain) {
            case ASTROLOGICAL -> "External astrological API response with dynamic structure";
            case RECIPE -> "External recipe API with flexible ingredient data";
            case CAMPAIGN -> "Campaign system requires flexible configuration for dynamic behavior";
            case SERVICE -> "External API response with unknown structure";
            case TEST -> "Test mock requires flexible typing for comprehensive testing";
            default -> snippet.contains("catch") || snippet.contains("error")
                    ? "Error handling requires flexible typing for unknown error structures"
                    : "Requires flexible typing for this use case";
        };
    }

    private static CodeDomain domainOf(ClassificationContext context) {
        return context.domainContext() != null ? context.domainContext().domain() : CodeDomain.UTILITY;
    }

    private static List<String> recommendations(int checked, int documented, int complete, double compliance,
                                                Map<CommentQuality, Integer> qualityCounts,
                                                List<UndocumentedOccurrence> undocumented) {
        var out = new ArrayList<String>();
        if (checked == 0) return out;

        String coverage = String.format(Locale.ROOT, "%.1f", compliance);
        if (compliance < CRITICAL_COVERAGE) {
            out.add("Documentation coverage is critically low at " + coverage
                    + "%; explain intentional any usages before the next campaign");
        } else if (compliance < TARGET_COVERAGE) {
            out.add("Documentation coverage " + coverage + "% is below the "
                    + String.format(Locale.ROOT, "%.0f", TARGET_COVERAGE) + "% target");
        } else if (!undocumented.isEmpty()) {
            out.add("Documentation coverage is " + coverage + "%; " + undocumented.size()
                    + " intentional occurrences still lack a comment");
        }

        int poor = qualityCounts.getOrDefault(CommentQuality.POOR, 0);
        if (documented > 0 && poor * 100.0 / documented > POOR_SHARE_LIMIT) {
            out.add(poor + " of " + documented + " comments are rated poor; say why the any is needed");
        }
        if (complete < documented) {
            out.add((documented - complete) + " documented occurrences lack an explained eslint-disable directive");
        }

        List<String> priorityFiles = undocumented.stream()
                .filter(u -> u.priority() == ReviewPriority.HIGH)
                .map(UndocumentedOccurrence::filePath)
                .distinct()
                .limit(PRIORITY_FILE_LIMIT)
                .toList();
        if (!priorityFiles.isEmpty()) {
            out.add("Document these files first: " + String.join(", ", priorityFiles));
        }
        return out;
    }

    private List<String> readLines(String filePath) {
        try {
            return OccurrenceScanner.readLines(Path.of(filePath));
        } catch (IOException e) {
            log.warn("Skipping documentation check for {}: {}", filePath, e.getMessage());
            return null;
        }
    }
}
