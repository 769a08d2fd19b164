package com.typewarden.core.scanner;

import com.typewarden.core.config.CampaignProperties;
import com.typewarden.core.domain.DomainContextAnalyzer;
import com.typewarden.core.model.ClassificationContext;
import com.typewarden.core.model.Occurrence;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns raw occurrences into {@link ClassificationContext}s: surrounding lines,
 * existing comments, test-file detection and the domain verdict.
 */
@Component
public class ContextBuilder {

    private final CampaignProperties properties;
    private final DomainContextAnalyzer domainAnalyzer;

    public ContextBuilder(CampaignProperties properties, DomainContextAnalyzer domainAnalyzer) {
        this.properties = properties;
        this.domainAnalyzer = domainAnalyzer;
    }

    /**
     * Builds contexts for many occurrences, reading each file only once.
     */
    public List<ClassificationContext> buildAll(List<Occurrence> occurrences) throws IOException {
        Map<String, List<String>> linesByFile = new LinkedHashMap<>();
        var contexts = new ArrayList<ClassificationContext>(occurrences.size());
        for (Occurrence occurrence : occurrences) {
            List<String> lines = linesByFile.get(occurrence.filePath());
            if (lines == null) {
                lines = OccurrenceScanner.readLines(Path.of(occurrence.filePath()));
                linesByFile.put(occurrence.filePath(), lines);
            }
            contexts.add(build(occurrence, lines));
        }
        return contexts;
    }

    public ClassificationContext build(Occurrence occurrence, List<String> fileLines) {
        int index = occurrence.lineNumber() - 1;
        int radius = Math.max(0, properties.getScanner().getContextLines());
        int from = Math.max(0, index - radius);
        int to = Math.min(fileLines.size(), index + radius + 1);
        List<String> surrounding = from < to ? fileLines.subList(from, to) : List.of();

        String comment = findComment(fileLines, index);
        var context = new ClassificationContext(
                occurrence.filePath(),
                occurrence.lineNumber(),
                occurrence.codeSnippet(),
                surrounding,
                comment != null,
                comment,
                isTestFile(occurrence.filePath()),
                null);
        return context.withDomainContext(domainAnalyzer.analyze(context));
    }

    /**
     * Returns the trailing comment on the line, or the comment line directly above it.
     */
    static String findComment(List<String> lines, int index) {
        if (index >= 0 && index < lines.size()) {
            String line = lines.get(index);
            int trailing = line.indexOf("//");
            if (trailing >= 0) {
                return line.substring(trailing).trim();
            }
        }
        if (index > 0 && index - 1 < lines.size()) {
            String above = lines.get(index - 1).trim();
            if (above.startsWith("//") || above.startsWith("/*") || above.startsWith("*") || above.endsWith("*/")) {
                return above;
            }
        }
        return null;
    }

    public static boolean isTestFile(String filePath) {
        String normalized = filePath.replace('\\', '/');
        return normalized.contains(".test.")
                || normalized.contains(".spec.")
                || normalized.contains("__tests__/")
                || normalized.contains("/test/")
                || normalized.contains("/tests/")
                || normalized.startsWith("test/")
                || normalized.startsWith("tests/");
    }
}
