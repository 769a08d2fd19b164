package com.typewarden.core.strategy;

import com.typewarden.core.model.AnyTypeCategory;
import com.typewarden.core.model.ClassificationContext;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The built-in strategy for every category.
 */
public final class ReplacementStrategies {

    private static final Pattern ERROR_CONTEXT = Pattern.compile("(?i)\\bcatch\\b|\\berror\\b|\\berr\\b|\\bexception\\b");
    private static final Pattern ARRAY_ANNOTATION = Pattern.compile(":\\s*(?:any\\[\\]|Array<\\s*any\\s*>)");
    private static final Pattern CATCH_CLAUSE = Pattern.compile("\\bcatch\\s*\\(");
    private static final Pattern MOCK_FACTORY = Pattern.compile("\\b(?:jest|vi)\\.fn\\(");
    private static final Pattern TYPE_GUARD = Pattern.compile(
            "\\btypeof\\s|\\sinstanceof\\s|\\.parse\\(|\\bis[A-Z]\\w*\\(");
    private static final Pattern STATIC_CONFIG_SHAPE = Pattern.compile(
            "\\b(?:interface|type)\\s+(\\w*(?:Config|Options|Settings|Params|Props))\\b");

    private ReplacementStrategies() {}

    public static List<ReplacementStrategy> defaults() {
        var strategies = new ArrayList<ReplacementStrategy>();
        for (AnyTypeCategory category : AnyTypeCategory.values()) {
            strategies.add(forCategory(category));
        }
        return strategies;
    }

    /**
     * Exhaustive over {@link AnyTypeCategory}: a new category does not compile
     * until it has a strategy here.
     */
    public static ReplacementStrategy forCategory(AnyTypeCategory category) {
        int priority = category.priority();
        return switch (category) {
            case ARRAY_TYPE -> new ReplacementStrategy(category, priority,
                    Pattern.compile("any\\[\\]|Array<\\s*any\\s*>"),
                    ctx -> ARRAY_ANNOTATION.matcher(ctx.codeSnippet()).find()
                            && !inErrorContext(ctx),
                    (m, ctx) -> {
                        String element = TypeInference.inferArrayElementType(ctx);
                        return m.group().startsWith("Array") ? "Array<" + element + ">" : element + "[]";
                    });
            case RECORD_TYPE -> new ReplacementStrategy(category, priority,
                    Pattern.compile("Record<\\s*(?<key>string|number)\\s*,\\s*any\\s*>"
                            + "|(?<index>\\[\\s*\\w+\\s*:\\s*(?:string|number)\\s*\\]\\s*:\\s*)any\\b"),
                    ctx -> !inErrorContext(ctx),
                    (m, ctx) -> m.group("key") != null
                            ? "Record<" + m.group("key") + ", " + TypeInference.inferRecordValueType(ctx) + ">"
                            : m.group("index") + TypeInference.FALLBACK);
            case FUNCTION_PARAM -> new ReplacementStrategy(category, priority,
                    Pattern.compile("[(,]\\s*[A-Za-z_$][\\w$]*\\??\\s*:\\s*any\\b(?!\\[)"),
                    ctx -> !inErrorContext(ctx),
                    ReplacementStrategies::narrowTrailingAny);
            case RETURN_TYPE -> new ReplacementStrategy(category, priority,
                    Pattern.compile("\\)\\s*:\\s*any\\b(?!\\[)(?=\\s*(?:\\{|=>|;))"),
                    ctx -> !inErrorContext(ctx),
                    ReplacementStrategies::narrowTrailingAny);
            case TYPE_ASSERTION -> new ReplacementStrategy(category, priority,
                    Pattern.compile("\\bas\\s+any\\b(?!\\[)|<any>(?=\\s*[\\w$(\\[])"),
                    ctx -> !inErrorContext(ctx) && !MOCK_FACTORY.matcher(ctx.codeSnippet()).find(),
                    (m, ctx) -> m.group().startsWith("<") ? "<unknown>" : "as unknown");
            case TEST_MOCK -> new ReplacementStrategy(category, priority,
                    Pattern.compile("(?<factory>jest|vi)\\.fn\\([^)]*\\)\\s+as\\s+any\\b|(?i:\\bmock\\w*\\??\\s*:\\s*)any\\b"),
                    ctx -> true,
                    (m, ctx) -> {
                        String mockType = "vi".equals(m.group("factory")) ? "vi.Mock" : "jest.Mock";
                        String matched = m.group();
                        return matched.substring(0, matched.length() - "any".length()) + mockType;
                    });
            case EXTERNAL_API -> new ReplacementStrategy(category, priority,
                    Pattern.compile("\\b(?:response|res|data|payload|body|json|apiResponse)\\??\\s*:\\s*any\\b(?!\\[)"),
                    ctx -> surroundingMatches(ctx, TYPE_GUARD),
                    ReplacementStrategies::narrowTrailingAny);
            case DYNAMIC_CONFIG -> new ReplacementStrategy(category, priority,
                    Pattern.compile("(?i)\\b\\w*(?:config|options|settings|params|props|opts)\\??\\s*:\\s*any\\b(?!\\[)"),
                    ctx -> staticConfigShape(ctx) != null,
                    (m, ctx) -> {
                        String matched = m.group();
                        return matched.substring(0, matched.length() - "any".length()) + staticConfigShape(ctx);
                    });
            // legacy shims are left for a human
            case LEGACY_COMPATIBILITY -> new ReplacementStrategy(category, priority,
                    Pattern.compile("(?i)\\b\\w*(?:legacy|deprecated|compat)\\w*\\??\\s*:\\s*any\\b"),
                    ctx -> false,
                    (m, ctx) -> m.group());
            case ERROR_HANDLING -> new ReplacementStrategy(category, priority,
                    Pattern.compile("\\b(?:error|err|e|ex|exception)\\??\\s*:\\s*any\\b(?!\\[)"),
                    ctx -> !CATCH_CLAUSE.matcher(ctx.codeSnippet()).find(),
                    ReplacementStrategies::narrowTrailingAny);
        };
    }

    static boolean inErrorContext(ClassificationContext context) {
        return ERROR_CONTEXT.matcher(context.codeSnippet()).find();
    }

    static String staticConfigShape(ClassificationContext context) {
        for (String line : context.surroundingLines()) {
            Matcher m = STATIC_CONFIG_SHAPE.matcher(line);
            if (m.find()) {
                return m.group(1);
            }
        }
        return null;
    }

    private static boolean surroundingMatches(ClassificationContext context, Pattern pattern) {
        for (String line : context.surroundingLines()) {
            if (pattern.matcher(line).find()) return true;
        }
        return false;
    }

    private static String narrowTrailingAny(Matcher m, ClassificationContext context) {
        String matched = m.group();
        return matched.substring(0, matched.length() - "any".length()) + TypeInference.FALLBACK;
    }
}
