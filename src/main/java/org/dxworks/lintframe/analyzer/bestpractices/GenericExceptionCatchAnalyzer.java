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
import java.util.Set;

public class GenericExceptionCatchAnalyzer extends AbstractFileAnalyzer {

    public static final String ID = "generic-exception-catch";
    public static final String CODE = "generic-exception-catch";

    private static final AnalyzerMetadata METADATA = new AnalyzerMetadata(
            ID,
            "Generic Exception Catch Analyzer",
            "Detects catching generic Exception class instead of specific exception types",
            Category.BEST_PRACTICES,
            Severity.LOW);

    static final Set<String> GENERIC_TYPES = Set.of("Exception", "Throwable");

    public GenericExceptionCatchAnalyzer(AnalyzerOptions options) {
        super(options);
    }

    @Override
    public AnalyzerMetadata getMetadata() {
        return METADATA;
    }

    @Override
    protected List<Issue> analyzeFile(FileContext context) {
        List<Issue> issues = new ArrayList<>();
        for (SyntaxNode clause : context.tree().root().findAll("catch_clause")) {
            for (String type : PhpNodes.catchTypes(clause)) {
                if (!GENERIC_TYPES.contains(type)) continue;
                issues.add(issue(context, CODE, Severity.LOW, clause.startLine(),
                        "Catching generic " + type + " instead of specific exception type")
                        .withRecommendation("Catch specific exception types (e.g. ModelNotFoundException, "
                                + "ValidationException) so unexpected errors are not swallowed.")
                        .withMetadata("type", type));
            }
        }
        return issues;
    }
}
