package com.typewarden.core.replacer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts structured diagnostics from type checker output.
 * <p>
 * JSON output (an array of diagnostics, or an object with a {@code diagnostics}
 * array) is parsed directly. Plain text, and JSON that fails to parse, goes
 * through the line-based fallback: one diagnostic per {@code error }-prefixed line.
 */
@Component
public class CompilerOutputParser {

    private static final Logger log = LoggerFactory.getLogger(CompilerOutputParser.class);

    /**
     * {@code src/a.ts(3,5): error TS2304: Cannot find name 'Foo'.},
     * {@code src/a.ts:3:5 - error TS2304: ...} or a bare {@code error TS6053: ...}.
     */
    static final Pattern DIAGNOSTIC_LINE = Pattern.compile(
            "^\\s*(?:(?<file>[^()\\s][^()]*?)(?:\\((?<line>\\d+),(?<col>\\d+)\\)|:(?<line2>\\d+):(?<col2>\\d+))\\s*[:-]\\s*)?"
            + "error\\s+(?:(?<code>[A-Z]+\\d+):?\\s*)?(?<message>.*)$");

    private final ObjectMapper objectMapper = new ObjectMapper();

    public List<CompilerDiagnostic> parse(String output) {
        if (output == null || output.isBlank()) {
            return List.of();
        }
        if (looksStructured(output)) {
            ParseResult result = parseStructured(output);
            if (result instanceof ParseResult.Ok ok) {
                return ok.diagnostics();
            }
            if (result instanceof ParseResult.ParseError error) {
                log.warn("Structured compiler output unusable ({}), falling back to line parsing", error.reason());
            }
        }
        return parseLines(output);
    }

    public ParseResult parseStructured(String output) {
        JsonNode root;
        try {
            root = objectMapper.readTree(output);
        } catch (JsonProcessingException e) {
            return new ParseResult.ParseError("invalid JSON: " + e.getOriginalMessage());
        }
        JsonNode entries = root != null && root.isObject() ? root.get("diagnostics") : root;
        if (entries == null || !entries.isArray()) {
            return new ParseResult.ParseError("expected an array of diagnostics");
        }
        var diagnostics = new ArrayList<CompilerDiagnostic>();
        for (JsonNode node : entries) {
            if (!node.isObject()) {
                return new ParseResult.ParseError("diagnostic entry is not an object: " + node);
            }
            String category = text(node, "category");
            if (category != null && !"error".equalsIgnoreCase(category)) {
                continue;
            }
            String file = text(node, "file");
            int line = node.path("line").asInt(0);
            int column = node.path("column").asInt(0);
            String code = text(node, "code");
            String message = text(node, "message");
            if (message == null) {
                return new ParseResult.ParseError("diagnostic entry has no message: " + node);
            }
            diagnostics.add(new CompilerDiagnostic(file, line, column, code, message,
                    render(file, line, column, code, message)));
        }
        return new ParseResult.Ok(diagnostics);
    }

    public List<CompilerDiagnostic> parseLines(String output) {
        var diagnostics = new ArrayList<CompilerDiagnostic>();
        for (String raw : output.split("\\R")) {
            Matcher m = DIAGNOSTIC_LINE.matcher(raw);
            if (!m.matches()) continue;
            String lineGroup = m.group("line") != null ? m.group("line") : m.group("line2");
            String colGroup = m.group("col") != null ? m.group("col") : m.group("col2");
            diagnostics.add(new CompilerDiagnostic(
                    m.group("file") != null ? m.group("file").trim() : null,
                    lineGroup != null ? Integer.parseInt(lineGroup) : 0,
                    colGroup != null ? Integer.parseInt(colGroup) : 0,
                    m.group("code"),
                    m.group("message").trim(),
                    raw.trim()));
        }
        return diagnostics;
    }

    static boolean looksStructured(String output) {
        String trimmed = output.trim();
        return trimmed.startsWith("{") || trimmed.startsWith("[");
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && !value.isNull() ? value.asText() : null;
    }

    private static String render(String file, int line, int column, String code, String message) {
        var sb = new StringBuilder();
        if (file != null) {
            sb.append(file).append('(').append(line).append(',').append(column).append("): ");
        }
        sb.append("error ");
        if (code != null) {
            sb.append(code).append(": ");
        }
        return sb.append(message).toString();
    }
}
