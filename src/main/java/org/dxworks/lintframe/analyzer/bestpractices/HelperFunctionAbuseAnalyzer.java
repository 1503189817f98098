package org.dxworks.lintframe.analyzer.bestpractices;

import org.dxworks.lintframe.analyzer.AbstractFileAnalyzer;
import org.dxworks.lintframe.analyzer.AnalyzerOptions;
import org.dxworks.lintframe.analyzer.FileContext;
import org.dxworks.lintframe.model.AnalyzerMetadata;
import org.dxworks.lintframe.model.Category;
import org.dxworks.lintframe.model.Issue;
import org.dxworks.lintframe.model.Severity;
import org.dxworks.lintframe.syntax.PhpNodes;
import org.dxworks.lintframe.syntax.SyntaxNode;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Named classes and traits leaning on global Laravel helpers instead of injected dependencies.
 */
public class HelperFunctionAbuseAnalyzer extends AbstractFileAnalyzer {

    public static final String ID = "helper-function-abuse";
    public static final String CODE = "helper-function-abuse";

    private static final AnalyzerMetadata METADATA = new AnalyzerMetadata(
            ID,
            "Helper Function Abuse Analyzer",
            "Detects excessive use of Laravel helper functions that hide dependencies and hinder testing",
            Category.BEST_PRACTICES,
            Severity.LOW);

    static final List<String> DEFAULT_HELPERS = List.of(
            "app", "auth", "cache", "config", "cookie", "event", "logger", "old", "redirect", "request",
            "response", "route", "session", "storage_path", "url", "view", "abort", "abort_if", "abort_unless",
            "bcrypt", "collect", "dd", "dispatch", "info", "now", "optional", "policy", "resolve", "retry", "tap",
            "throw_if", "throw_unless", "today", "validator", "value", "report");

    private final int threshold;
    private final Set<String> helpers;

    public HelperFunctionAbuseAnalyzer(AnalyzerOptions options) {
        super(options);
        this.threshold = options.getNonNegativeInt("threshold", 5);
        List<String> configured = options.getStringList("helper_functions", DEFAULT_HELPERS);
        this.helpers = new HashSet<>(configured.isEmpty() ? DEFAULT_HELPERS : configured);
    }

    @Override
    public AnalyzerMetadata getMetadata() {
        return METADATA;
    }

    @Override
    protected List<Issue> analyzeFile(FileContext context) {
        List<Issue> issues = new ArrayList<>();
        for (SyntaxNode cls : context.tree().root().findAll("class_declaration", "trait_declaration")) {
            String className = PhpNodes.declarationName(cls);
            Map<String, Integer> counts = new LinkedHashMap<>();
            int total = 0;
            for (SyntaxNode call : cls.findAll("function_call_expression")) {
                if (PhpNodes.enclosingClass(call) != cls) continue;
                String name = PhpNodes.callName(call);
                if (name == null || !helpers.contains(name)) continue;
                counts.merge(name, 1, Integer::sum);
                total++;
            }
            if (total <= threshold) continue;

            List<String> usage = new ArrayList<>();
            counts.forEach((name, n) -> usage.add(name + "() (" + n + "x)"));
            issues.add(issue(context, CODE, severityFor(total), cls.startLine(),
                    "Class '" + className + "' uses " + total + " helper function calls (threshold: " + threshold + ")")
                    .withRecommendation("Class '" + className + "' uses " + total + " helper function calls: "
                            + String.join(", ", usage) + ". Helpers hide dependencies and make unit testing "
                            + "difficult; inject the underlying services instead.")
                    .withMetadata("class", className)
                    .withMetadata("helpers", counts)
                    .withMetadata("count", total)
                    .withMetadata("threshold", threshold));
        }
        return issues;
    }

    Severity severityFor(int count) {
        int excess = count - threshold;
        if (excess >= 20) return Severity.HIGH;
        if (excess >= 10) return Severity.MEDIUM;
        return Severity.LOW;
    }
}
