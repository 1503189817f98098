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
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Named classes calling more distinct facades than the threshold allows.
 */
public class FacadeUsageAnalyzer extends AbstractFileAnalyzer {

    public static final String ID = "facade-usage";
    public static final String CODE = "excessive-facade-usage";

    private static final AnalyzerMetadata METADATA = new AnalyzerMetadata(
            ID,
            "Facade Usage",
            "Identifies excessive facade usage that makes classes hard to test and violates dependency inversion",
            Category.BEST_PRACTICES,
            Severity.MEDIUM);

    static final List<String> DEFAULT_FACADES = List.of(
            "App", "Artisan", "Auth", "Blade", "Broadcast", "Bus", "Cache", "Config", "Cookie", "Crypt", "Date",
            "DB", "Eloquent", "Event", "File", "Gate", "Hash", "Http", "Lang", "Log", "Mail", "Notification",
            "Password", "Process", "Queue", "Redirect", "Redis", "Request", "Response", "Route", "Schema",
            "Session", "Storage", "URL", "Validator", "View", "Vite");

    private final int threshold;
    private final Set<String> facades;

    public FacadeUsageAnalyzer(AnalyzerOptions options) {
        super(options);
        this.threshold = options.getNonNegativeInt("threshold", 5);
        this.facades = new HashSet<>(options.getStringListAdding("additional_facades", DEFAULT_FACADES));
    }

    @Override
    public AnalyzerMetadata getMetadata() {
        return METADATA;
    }

    @Override
    protected List<Issue> analyzeFile(FileContext context) {
        List<Issue> issues = new ArrayList<>();
        for (SyntaxNode cls : context.tree().root().findAll("class_declaration")) {
            String className = PhpNodes.declarationName(cls);
            Set<String> used = new LinkedHashSet<>();
            for (SyntaxNode call : cls.findAll("scoped_call_expression")) {
                if (PhpNodes.enclosingClass(call) != cls) continue;
                String facade = PhpNodes.shortName(PhpNodes.scopeName(call));
                if (facade != null && facades.contains(facade)) used.add(facade);
            }
            if (used.size() <= threshold) continue;

            List<String> quoted = new ArrayList<>();
            for (String f : used) quoted.add("'" + f + "'");
            issues.add(issue(context, CODE, severityFor(used.size()), cls.startLine(),
                    "Class '" + className + "' uses " + used.size() + " different facades (threshold: " + threshold + ")")
                    .withRecommendation("Class '" + className + "' uses " + used.size() + " different facades: "
                            + String.join(", ", quoted) + ". Inject the services the class needs through its "
                            + "constructor so its dependencies are visible and can be mocked in tests.")
                    .withMetadata("class", className)
                    .withMetadata("facades", new ArrayList<>(used))
                    .withMetadata("count", used.size())
                    .withMetadata("threshold", threshold));
        }
        return issues;
    }

    Severity severityFor(int count) {
        int excess = count - threshold;
        if (excess >= 5) return Severity.HIGH;
        if (excess >= 3) return Severity.MEDIUM;
        return Severity.LOW;
    }
}
