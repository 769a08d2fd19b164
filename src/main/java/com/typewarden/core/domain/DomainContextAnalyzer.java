package com.typewarden.core.domain;

import com.typewarden.core.model.ClassificationContext;
import com.typewarden.core.model.CodeDomain;
import com.typewarden.core.model.DomainContext;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Infers the coarse subsystem an occurrence lives in.
 * <p>
 * Pure function of the context: path tokens decide first (deepest matching
 * path segment wins, fixed domain order breaks exact ties), then content
 * keywords, then the {@link CodeDomain#UTILITY} default. Test files are always
 * {@link CodeDomain#TEST}.
 */
@Component
public class DomainContextAnalyzer {

    /** Tie-break order when two domains match at the same path depth. */
    private static final List<CodeDomain> TIE_BREAK_ORDER = List.of(
            CodeDomain.TEST, CodeDomain.COMPONENT, CodeDomain.ASTROLOGICAL, CodeDomain.CAMPAIGN,
            CodeDomain.INTELLIGENCE, CodeDomain.RECIPE, CodeDomain.SERVICE, CodeDomain.UTILITY);

    private static final Map<CodeDomain, Set<String>> PATH_KEYWORDS = new EnumMap<>(Map.of(
            CodeDomain.TEST, Set.of("test", "tests", "__tests__", "spec", "__mocks__", "mocks"),
            CodeDomain.COMPONENT, Set.of("components", "component", "ui", "views", "view", "pages", "page", "widgets"),
            CodeDomain.ASTROLOGICAL, Set.of("astrology", "astrological", "astro", "astronomy", "planetary",
                    "planets", "zodiac", "ephemeris", "lunar"),
            CodeDomain.CAMPAIGN, Set.of("campaign", "campaigns"),
            CodeDomain.INTELLIGENCE, Set.of("intelligence", "ml", "predictive", "insights"),
            CodeDomain.RECIPE, Set.of("recipe", "recipes", "cuisine", "cuisines", "ingredient", "ingredients",
                    "food", "nutrition"),
            CodeDomain.SERVICE, Set.of("service", "services", "api", "server", "client", "clients"),
            CodeDomain.UTILITY, Set.of("utils", "util", "utilities", "helpers", "helper", "lib", "shared", "common")
    ));

    private static final Map<CodeDomain, List<String>> CONTENT_KEYWORDS = new EnumMap<>(Map.of(
            CodeDomain.TEST, List.of("describe(", "expect(", "jest.", "it("),
            CodeDomain.COMPONENT, List.of("usestate", "useeffect", "props", "jsx", "render("),
            CodeDomain.ASTROLOGICAL, List.of("planet", "zodiac", "lunar", "ephemeris", "astrolog", "horoscope"),
            CodeDomain.CAMPAIGN, List.of("campaign"),
            CodeDomain.INTELLIGENCE, List.of("intelligence", "prediction"),
            CodeDomain.RECIPE, List.of("recipe", "ingredient", "cuisine"),
            CodeDomain.SERVICE, List.of("fetch(", "axios", "endpoint", "http")
    ));

    private static final List<String> API_SIGNALS = List.of("fetch(", "axios", "response", "/api");
    private static final List<String> CONFIG_SIGNALS = List.of("config", "options", "settings");

    public DomainContext analyze(ClassificationContext context) {
        String text = contentOf(context);
        CodeDomain domain = detectDomain(context.filePath(), text, context.isInTestFile());
        return new DomainContext(
                domain,
                intentionalityHints(domain, context.codeSnippet(), text),
                suggestedTypes(domain, context.codeSnippet()),
                preservationReasons(domain, text));
    }

    CodeDomain detectDomain(String filePath, String lowerContent, boolean inTestFile) {
        if (inTestFile) {
            return CodeDomain.TEST;
        }
        CodeDomain byPath = domainFromPath(filePath);
        if (byPath != null) {
            return byPath;
        }
        CodeDomain byContent = domainFromContent(lowerContent);
        return byContent != null ? byContent : CodeDomain.UTILITY;
    }

    /**
     * Deepest matching segment wins. Returns {@code null} when no segment matches.
     */
    static CodeDomain domainFromPath(String filePath) {
        List<List<String>> segments = tokenizePath(filePath);
        for (int depth = segments.size() - 1; depth >= 0; depth--) {
            List<String> tokens = segments.get(depth);
            for (CodeDomain candidate : TIE_BREAK_ORDER) {
                Set<String> keywords = PATH_KEYWORDS.get(candidate);
                for (String token : tokens) {
                    if (keywords.contains(token)) {
                        return candidate;
                    }
                }
            }
        }
        return null;
    }

    static CodeDomain domainFromContent(String lowerContent) {
        CodeDomain best = null;
        int bestHits = 0;
        for (CodeDomain candidate : TIE_BREAK_ORDER) {
            List<String> keywords = CONTENT_KEYWORDS.get(candidate);
            if (keywords == null) continue;
            int hits = 0;
            for (String keyword : keywords) {
                if (lowerContent.contains(keyword)) hits++;
            }
            if (hits > bestHits) {
                best = candidate;
                bestHits = hits;
            }
        }
        return best;
    }

    /**
     * Splits a path into one token list per segment. The file stem is split on
     * punctuation and camelCase boundaries, so {@code RecipeService.ts} yields
     * {@code [recipe, service]}.
     */
    static List<List<String>> tokenizePath(String filePath) {
        String normalized = filePath.replace('\\', '/');
        String[] parts = normalized.split("/");
        var segments = new ArrayList<List<String>>();
        for (int i = 0; i < parts.length; i++) {
            String part = parts[i];
            if (part.isEmpty() || part.equals(".")) continue;
            var tokens = new ArrayList<String>();
            tokens.add(part.toLowerCase(Locale.ROOT));
            boolean fileName = i == parts.length - 1;
            String body = fileName && part.contains(".") ? part.substring(0, part.lastIndexOf('.')) : part;
            for (String piece : body.split("[^A-Za-z0-9_]+|(?<=[a-z0-9])(?=[A-Z])")) {
                if (!piece.isEmpty()) {
                    tokens.add(piece.toLowerCase(Locale.ROOT));
                }
            }
            segments.add(tokens);
        }
        return segments;
    }

    private List<String> intentionalityHints(CodeDomain domain, String snippet, String lowerContent) {
        var hints = new ArrayList<String>();
        String lowerSnippet = snippet.toLowerCase(Locale.ROOT);
        if (containsAny(lowerContent, API_SIGNALS)) {
            hints.add("External API boundary: payload shape is not statically known");
        }
        if (containsAny(lowerSnippet, CONFIG_SIGNALS)) {
            hints.add("Dynamic configuration object");
        }
        if (lowerSnippet.contains("catch") || lowerSnippet.contains("error")) {
            hints.add("Error handling context");
        }
        switch (domain) {
            case ASTROLOGICAL -> {
                hints.add("Astronomical library data may require flexible typing");
                if (lowerContent.contains("position") || lowerContent.contains("planet")) {
                    hints.add("Planetary position data has a library-defined shape");
                }
            }
            case CAMPAIGN -> {
                hints.add("Campaign configuration may require dynamic typing");
                if (lowerContent.contains("metric")) {
                    hints.add("Campaign metrics are aggregated dynamically");
                }
            }
            case INTELLIGENCE -> hints.add("Intelligence systems process heterogeneous inputs");
            case TEST -> hints.add("Test doubles commonly use any for flexibility");
            case SERVICE -> hints.add("Service boundaries may carry untyped payloads");
            case RECIPE, COMPONENT, UTILITY -> { }
        }
        return hints;
    }

    private List<String> suggestedTypes(CodeDomain domain, String snippet) {
        var types = new LinkedHashSet<String>();
        if (snippet.contains("any[]") || snippet.contains("Array<any>")) {
            types.add("unknown[]");
        }
        if (snippet.contains("Record<")) {
            types.add("Record<string, unknown>");
        }
        switch (domain) {
            case ASTROLOGICAL -> {
                types.add("Record<string, number>");
                types.add("unknown");
            }
            case RECIPE -> {
                types.add("Record<string, unknown>");
                types.add("unknown[]");
            }
            case CAMPAIGN, INTELLIGENCE, COMPONENT -> types.add("Record<string, unknown>");
            case TEST -> {
                types.add("jest.Mock");
                types.add("unknown");
            }
            case SERVICE, UTILITY -> types.add("unknown");
        }
        return new ArrayList<>(types);
    }

    private List<String> preservationReasons(CodeDomain domain, String lowerContent) {
        var reasons = new ArrayList<String>();
        switch (domain) {
            case ASTROLOGICAL -> reasons.add("External astronomical library compatibility");
            case CAMPAIGN -> reasons.add("Dynamic campaign configuration");
            case TEST -> reasons.add("Test mocks require flexible typing");
            default -> { }
        }
        if (lowerContent.contains("eslint-disable")) {
            reasons.add("Existing lint suppression documents intent");
        }
        return reasons;
    }

    private static String contentOf(ClassificationContext context) {
        var sb = new StringBuilder(context.codeSnippet());
        for (String line : context.surroundingLines()) {
            sb.append('\n').append(line);
        }
        return sb.toString().toLowerCase(Locale.ROOT);
    }

    private static boolean containsAny(String text, List<String> needles) {
        for (String needle : needles) {
            if (text.contains(needle)) return true;
        }
        return false;
    }
}
