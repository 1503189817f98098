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
import java.util.List;

public class EnvironmentCheckSmellAnalyzer extends AbstractFileAnalyzer {

    public static final String ID = "environment-check-smell";
    public static final String CODE = "environment-check";

    private static final AnalyzerMetadata METADATA = new AnalyzerMetadata(
            ID,
            "Environment Check Code Smell Detector",
            "Detects environment checks that should use configuration values instead",
            Category.BEST_PRACTICES,
            Severity.LOW);

    // providers and exception handlers legitimately branch on the environment
    private static final List<String> DEFAULT_EXCLUDED = List.of(
            "**/*ServiceProvider*", "**/*ExceptionHandler*", "**/Exceptions/Handler.php");

    public EnvironmentCheckSmellAnalyzer(AnalyzerOptions options) {
        super(options);
    }

    @Override
    protected List<String> defaultExcludedPaths() {
        return DEFAULT_EXCLUDED;
    }

    @Override
    public AnalyzerMetadata getMetadata() {
        return METADATA;
    }

    @Override
    protected List<Issue> analyzeFile(FileContext context) {
        List<Issue> issues = new ArrayList<>();
        for (SyntaxNode call : context.tree().root().findAll(PhpNodes.CALLS)) {
            if (!"environment".equals(PhpNodes.callName(call))) continue;
            if (PhpNodes.isMethodCall(call)) {
                SyntaxNode receiver = PhpNodes.receiver(call);
                if (PhpNodes.isFunctionCall(receiver) && "app".equals(PhpNodes.callName(receiver))) {
                    issues.add(issue(context, CODE, Severity.LOW, call,
                            "Using app()->environment() for feature flags or behavior changes")
                            .withRecommendation("Use config values instead of environment checks for feature flags. "
                                    + "Store the decision in config/features.php and read config('features.feature_name')."));
                }
            } else if (PhpNodes.isStaticCall(call) && "App".equals(PhpNodes.shortName(PhpNodes.scopeName(call)))) {
                issues.add(issue(context, CODE, Severity.LOW, call,
                        "Using App::environment() for feature flags or behavior changes")
                        .withRecommendation("Keep environment checks for infrastructure concerns such as logging and "
                                + "debugging. Use config('features.feature_name') for behavior changes."));
            }
        }
        return issues;
    }
}
