package com.typewarden.core.strategy;

import com.typewarden.core.model.ClassificationContext;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Usage-based guesses for narrower types. Never throws: when no signal is
 * found the result is {@code unknown}.
 */
public final class TypeInference {

    public static final String FALLBACK = "unknown";

    private static final Pattern ARRAY_LITERAL = Pattern.compile("=\\s*\\[([^\\]]+)\\]");
    private static final Pattern STRING_LITERAL = Pattern.compile("^(['\"`]).*\\1$");
    private static final Pattern NUMBER_LITERAL = Pattern.compile("^-?\\d+(?:\\.\\d+)?$");
    private static final Pattern BOOLEAN_LITERAL = Pattern.compile("^(?:true|false)$");

    private static final Pattern PUSH_STRING = Pattern.compile("\\.push\\(\\s*['\"`]");
    private static final Pattern PUSH_NUMBER = Pattern.compile("\\.push\\(\\s*-?\\d");
    private static final Pattern PUSH_BOOLEAN = Pattern.compile("\\.push\\(\\s*(?:true|false)\\b");
    private static final Pattern STRING_METHOD = Pattern.compile(
            "\\.(?:toLowerCase|toUpperCase|trim|startsWith|endsWith|localeCompare)\\(");
    private static final Pattern NUMBER_METHOD = Pattern.compile("\\.toFixed\\(|\\bMath\\.\\w+\\(");

    private static final Pattern OBJECT_VALUE = Pattern.compile(
            "(?:\\w+|['\"][^'\"]+['\"])\\s*:\\s*(['\"][^'\"]*['\"]|-?\\d+(?:\\.\\d+)?|true|false)\\s*[,}]");

    private TypeInference() {}

    /**
     * Element type of an array from literals, {@code push} calls or method usage.
     */
    public static String inferArrayElementType(ClassificationContext context) {
        String text = String.join("\n", context.surroundingLines());

        Matcher literal = ARRAY_LITERAL.matcher(text);
        if (literal.find()) {
            String fromLiteral = uniformLiteralType(literal.group(1).split(","));
            if (fromLiteral != null) return fromLiteral;
        }
        if (PUSH_STRING.matcher(text).find()) return "string";
        if (PUSH_NUMBER.matcher(text).find()) return "number";
        if (PUSH_BOOLEAN.matcher(text).find()) return "boolean";
        if (STRING_METHOD.matcher(text).find()) return "string";
        if (NUMBER_METHOD.matcher(text).find()) return "number";
        return FALLBACK;
    }

    /**
     * Value type of a record from object-literal entries, when they all agree.
     */
    public static String inferRecordValueType(ClassificationContext context) {
        String text = String.join("\n", context.surroundingLines());
        Matcher m = OBJECT_VALUE.matcher(text);
        Set<String> seen = new LinkedHashSet<>();
        while (m.find()) {
            String type = literalType(m.group(1).trim());
            if (type == null) return FALLBACK;
            seen.add(type);
        }
        return seen.size() == 1 ? seen.iterator().next() : FALLBACK;
    }

    static String uniformLiteralType(String[] elements) {
        String common = null;
        for (String raw : elements) {
            String element = raw.trim();
            if (element.isEmpty()) continue;
            String type = literalType(element);
            if (type == null) return null;
            if (common != null && !common.equals(type)) return null;
            common = type;
        }
        return common;
    }

    static String literalType(String token) {
        if (STRING_LITERAL.matcher(token).matches()) return "string";
        if (NUMBER_LITERAL.matcher(token).matches()) return "number";
        if (BOOLEAN_LITERAL.matcher(token).matches()) return "boolean";
        return null;
    }
}
