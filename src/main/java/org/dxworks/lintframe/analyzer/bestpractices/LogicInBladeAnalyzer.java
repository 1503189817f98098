package org.dxworks.lintframe.analyzer.bestpractices;

import org.dxworks.lintframe.FileKind;
import org.dxworks.lintframe.analyzer.AbstractFileAnalyzer;
import org.dxworks.lintframe.analyzer.AnalyzerOptions;
import org.dxworks.lintframe.analyzer.FileContext;
import org.dxworks.lintframe.analyzer.support.BladeHeuristics;
import org.dxworks.lintframe.model.AnalyzerMetadata;
import org.dxworks.lintframe.model.Category;
import org.dxworks.lintframe.model.Issue;
import org.dxworks.lintframe.model.Severity;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Line-oriented scan of Blade templates for queries, API calls, heavy computation and other
 * logic that belongs in controllers or view composers.
 * <p>
 * Each line yields at most one finding; the checks run from most to least severe.
 */
public class LogicInBladeAnalyzer extends AbstractFileAnalyzer {

    public static final String ID = "logic-in-blade";

    public static final String CODE_BLOCK_TOO_LONG = "blade-php-block-too-long";
    public static final String CODE_INLINE_PHP = "blade-inline-php";
    public static final String CODE_DB_QUERY = "blade-has-db-query";
    public static final String CODE_API_CALL = "blade-has-api-call";
    public static final String CODE_EXPENSIVE = "blade-expensive-computation";
    public static final String CODE_NESTED_FOREACH = "blade-nested-foreach";
    public static final String CODE_BUSINESS_LOGIC = "blade-has-business-logic";
    public static final String CODE_CALCULATION = "blade-has-calculation";
    public static final String CODE_UNCLOSED_BLOCK = "blade-unclosed-php-block";

    private static final AnalyzerMetadata METADATA = new AnalyzerMetadata(
            ID,
            "Logic in Blade Analyzer",
            "Finds business logic in Blade templates that should be moved to controllers or view composers",
            Category.BEST_PRACTICES,
            Severity.MEDIUM);

    private static final Pattern PHP_OPEN = Pattern.compile("@php\\b");
    private static final Pattern PHP_CLOSE = Pattern.compile("@endphp\\b");
    private static final Pattern FOREACH_OPEN = Pattern.compile("@foreach\\b");
    private static final Pattern FOREACH_CLOSE = Pattern.compile("@endforeach\\b");
    private static final Pattern IF_DIRECTIVE = Pattern.compile("@if\\s*\\(");

    private static final List<Pattern> API_CALLS = List.of(
            Pattern.compile("Http::"),
            Pattern.compile("\\bGuzzle\\b"),
            Pattern.compile("\\bcurl_"),
            Pattern.compile("file_get_contents\\s*\\(\\s*['\"]https?://"));

    private static final List<String> EXPENSIVE_STRING_FUNCTIONS = List.of(
            "preg_match", "preg_replace", "preg_match_all", "preg_split", "str_replace", "str_ireplace",
            "substr_replace", "mb_ereg_replace");
    private static final List<String> EXPENSIVE_COLLECTION_METHODS = List.of(
            "->toArray(", "->all(", "->toJson(", "->jsonSerialize(");

    private static final String COLLECTION_MANIPULATION = "pluck|unique|chunk|groupBy|keyBy|reverse|shuffle|values|keys";
    private static final Pattern FOREACH_OVER_TRANSFORM = Pattern.compile(
            "@foreach\\s*\\(.*->(filter|map|transform|sortBy|" + COLLECTION_MANIPULATION + ")\\(");
    private static final List<String> BUSINESS_LOGIC_FUNCTIONS = List.of(
            "array_filter", "array_map", "array_reduce", "array_walk", "array_merge", "array_combine", "array_diff");

    private static final Pattern PLAIN_ECHO = Pattern.compile("^\\{\\{\\s*\\$\\w+\\s*\\}\\}$");
    private static final Pattern HELPER_ECHO =
            Pattern.compile("\\{\\{\\s*(config|session|cache|request|cookie|auth)\\s*\\(\\s*\\)");
    private static final Pattern FACADE_ECHO =
            Pattern.compile("\\{\\{\\s*(Config|Session|Cache|Request|Cookie|Auth)::");
    private static final Pattern DEFAULT_ECHO = Pattern.compile(
            "\\{\\{\\s*\\$\\w+(?:->\\w+)?\\s*\\?\\?\\s*(?:\\d+|['\"][^'\"]*['\"]|null)\\s*\\}\\}");
    private static final Pattern SINGLE_OPERATION_ECHO = Pattern.compile(
            "\\{\\{\\s*\\$\\w+(?:->\\w+)?\\s*[+\\-*/]\\s*\\$\\w+(?:->\\w+)?\\s*\\}\\}");
    private static final Pattern ARITHMETIC_ECHO = Pattern.compile("\\{\\{.*[+\\-*/%].*\\}\\}");
    private static final Pattern OPERATOR = Pattern.compile("[+\\-*/%]");
    private static final Pattern COMPOUND_ASSIGNMENT = Pattern.compile("\\$\\w+\\s*[+\\-*/%]=");
    private static final Pattern CALL_IN_ARITHMETIC = Pattern.compile("\\{\\{.*\\(.*\\).*[+*/]");

    private final int maxPhpBlockLines;

    public LogicInBladeAnalyzer(AnalyzerOptions options) {
        super(options);
        this.maxPhpBlockLines = options.getPositiveInt("max_php_block_lines", 10);
    }

    @Override
    public AnalyzerMetadata getMetadata() {
        return METADATA;
    }

    @Override
    protected Set<FileKind> fileKinds() {
        return EnumSet.of(FileKind.BLADE);
    }

    @Override
    protected List<Issue> analyzeFile(FileContext context) {
        List<Issue> issues = new ArrayList<>();
        boolean inPhpBlock = false;
        int blockStart = 0;
        int blockLines = 0;
        int foreachDepth = 0;

        for (int lineNumber = 1; lineNumber <= context.lineCount(); lineNumber++) {
            String line = context.line(lineNumber);
            String trimmed = line.trim();

            if (PHP_OPEN.matcher(trimmed).find()) {
                inPhpBlock = true;
                blockStart = lineNumber;
                blockLines = 0;
                continue;
            }
            if (PHP_CLOSE.matcher(trimmed).find()) {
                if (blockLines > maxPhpBlockLines) {
                    issues.add(issue(context, CODE_BLOCK_TOO_LONG, Severity.MEDIUM, blockStart,
                            String.format("PHP block has %d lines (max recommended: %d)", blockLines, maxPhpBlockLines))
                            .withRecommendation("Move complex PHP logic to controllers, view composers, or presenter "
                                    + "classes. Blade templates should focus on presentation only.")
                            .withMetadata("block_lines", blockLines)
                            .withMetadata("max_lines", maxPhpBlockLines));
                }
                inPhpBlock = false;
                continue;
            }
            if (inPhpBlock) blockLines++;

            if (FOREACH_OPEN.matcher(trimmed).find()) foreachDepth++;
            if (FOREACH_CLOSE.matcher(trimmed).find()) foreachDepth = Math.max(0, foreachDepth - 1);

            if (line.contains("<?php")) {
                issues.add(issue(context, CODE_INLINE_PHP, Severity.MEDIUM, lineNumber,
                        "Inline PHP found in Blade template")
                        .withRecommendation("Use Blade directives (@php...@endphp) instead of inline PHP."));
            }

            Issue finding = lineFinding(context, lineNumber, line, trimmed, foreachDepth);
            if (finding != null) issues.add(finding);
        }

        if (inPhpBlock) {
            issues.add(issue(context, CODE_UNCLOSED_BLOCK, Severity.HIGH, blockStart, "Unclosed @php block detected")
                    .withRecommendation("Every @php directive must have a matching @endphp.")
                    .withMetadata("lines_counted", blockLines));
        }
        return issues;
    }

    private Issue lineFinding(FileContext context, int lineNumber, String line, String trimmed, int foreachDepth) {
        if (BladeHeuristics.hasDbQuery(line)) {
            return issue(context, CODE_DB_QUERY, Severity.CRITICAL, lineNumber, "Database query found in Blade template")
                    .withRecommendation("Never query the database from Blade templates. Load all required data in "
                            + "the controller and pass it to the view.");
        }
        if (hasApiCall(line)) {
            return issue(context, CODE_API_CALL, Severity.HIGH, lineNumber, "API call found in Blade template")
                    .withRecommendation("Make API calls in controllers or services. Views should only display "
                            + "pre-fetched data.");
        }
        if (hasExpensiveComputation(line, foreachDepth)) {
            return issue(context, CODE_EXPENSIVE, Severity.MEDIUM, lineNumber,
                    "Expensive computation found in Blade template")
                    .withRecommendation("Move expensive operations to controllers or services. Use view composers "
                            + "for complex transformations.");
        }
        if (foreachDepth >= 2 && FOREACH_OPEN.matcher(trimmed).find()) {
            return issue(context, CODE_NESTED_FOREACH, Severity.MEDIUM, lineNumber,
                    String.format("Nested @foreach detected (depth: %d) - potential performance issue", foreachDepth))
                    .withRecommendation("Flatten nested data in the controller using eager loading or collection "
                            + "methods.")
                    .withMetadata("depth", foreachDepth);
        }
        if (hasBusinessLogic(line)) {
            return issue(context, CODE_BUSINESS_LOGIC, Severity.MEDIUM, lineNumber,
                    "Business logic found in Blade directive")
                    .withRecommendation("Extract business logic to controllers or services. Keep conditionals in "
                            + "views for presentation only.");
        }
        if (hasComplexCalculation(line)) {
            return issue(context, CODE_CALCULATION, Severity.LOW, lineNumber,
                    "Complex calculation found in Blade template")
                    .withRecommendation("Move calculations to the controller, a view composer, or a model accessor.");
        }
        return null;
    }

    private static boolean hasApiCall(String line) {
        for (Pattern pattern : API_CALLS) {
            Matcher m = pattern.matcher(line);
            if (m.find() && !BladeHeuristics.isInsideStringOrComment(line, m.start())) return true;
        }
        return false;
    }

    private static boolean hasExpensiveComputation(String line, int foreachDepth) {
        if (foreachDepth >= 1) {
            for (String fn : EXPENSIVE_STRING_FUNCTIONS) {
                if (Pattern.compile("\\b" + fn + "\\s*\\(").matcher(line).find()) return true;
            }
        }
        for (String method : EXPENSIVE_COLLECTION_METHODS) {
            int pos = line.indexOf(method);
            if (pos >= 0 && !BladeHeuristics.isInsideStringOrComment(line, pos)) return true;
        }
        return false;
    }

    private static boolean hasBusinessLogic(String line) {
        if (IF_DIRECTIVE.matcher(line).find() && countOf(line, "&&") + countOf(line, "||") >= 3) return true;
        if (FOREACH_OVER_TRANSFORM.matcher(line).find()) return true;
        for (String fn : BUSINESS_LOGIC_FUNCTIONS) {
            if (Pattern.compile("\\b" + fn + "\\s*\\(").matcher(line).find()) return true;
        }
        return false;
    }

    private static boolean hasComplexCalculation(String line) {
        if (PLAIN_ECHO.matcher(line.trim()).find()) return false;
        if (HELPER_ECHO.matcher(line).find() || FACADE_ECHO.matcher(line).find()) return false;
        if (DEFAULT_ECHO.matcher(line).find() || SINGLE_OPERATION_ECHO.matcher(line).find()) return false;
        if (ARITHMETIC_ECHO.matcher(line).find()) {
            Matcher ops = OPERATOR.matcher(line);
            int count = 0;
            while (ops.find()) count++;
            if (count >= 2) return true;
        }
        return COMPOUND_ASSIGNMENT.matcher(line).find() || CALL_IN_ARITHMETIC.matcher(line).find();
    }

    private static int countOf(String line, String token) {
        int count = 0;
        for (int i = line.indexOf(token); i >= 0; i = line.indexOf(token, i + token.length())) count++;
        return count;
    }
}
