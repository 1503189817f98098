package org.dxworks.lintframe.analyzer.bestpractices;

import org.dxworks.lintframe.analyzer.AbstractFileAnalyzer;
import org.dxworks.lintframe.analyzer.AnalyzerOptions;
import org.dxworks.lintframe.analyzer.FileContext;
import org.dxworks.lintframe.model.AnalyzerMetadata;
import org.dxworks.lintframe.model.Category;
import org.dxworks.lintframe.model.Issue;
import org.dxworks.lintframe.model.Severity;
import org.dxworks.lintframe.scope.FileSymbols;
import org.dxworks.lintframe.syntax.PhpNodes;
import org.dxworks.lintframe.syntax.SyntaxNode;

import java.util.ArrayList;
import java.util.List;

public class FrameworkOverrideAnalyzer extends AbstractFileAnalyzer {

    public static final String ID = "framework-override";
    public static final String CODE = "framework-override";

    private static final AnalyzerMetadata METADATA = new AnalyzerMetadata(
            ID,
            "Framework Override Detector",
            "Detects dangerous overrides of Laravel framework classes",
            Category.BEST_PRACTICES,
            Severity.HIGH);

    static final List<String> CORE_CLASSES = List.of(
            "Illuminate\\Http\\Request",
            "Illuminate\\Http\\Response",
            "Illuminate\\Http\\RedirectResponse",
            "Illuminate\\Http\\JsonResponse",
            "Illuminate\\Routing\\Router",
            "Illuminate\\Foundation\\Application",
            "Illuminate\\Database\\Eloquent\\Builder",
            "Illuminate\\Database\\Query\\Builder",
            "Illuminate\\Support\\Facades\\Facade");

    public FrameworkOverrideAnalyzer(AnalyzerOptions options) {
        super(options);
    }

    @Override
    public AnalyzerMetadata getMetadata() {
        return METADATA;
    }

    @Override
    protected List<Issue> analyzeFile(FileContext context) {
        List<Issue> issues = new ArrayList<>();
        FileSymbols symbols = FileSymbols.of(context.tree());
        for (SyntaxNode cls : context.tree().root().findAll("class_declaration")) {
            String written = PhpNodes.baseClassName(cls);
            if (written == null) continue;
            String parent = symbols.resolve(written, cls);
            String core = coreClass(parent);
            if (core == null) continue;
            String className = PhpNodes.declarationName(cls);
            issues.add(issue(context, CODE, Severity.HIGH, cls.startLine(),
                    String.format("Class \"%s\" extends core framework class \"%s\"",
                            className != null ? className : "Unknown", core))
                    .withRecommendation("Avoid extending core framework classes. Use the framework's extension points "
                            + "instead: macros (e.g. " + PhpNodes.shortName(core) + "::macro()), service providers, "
                            + "middleware or event listeners. Extended core classes break during framework upgrades.")
                    .withMetadata("class", className)
                    .withMetadata("parent", core));
        }
        return issues;
    }

    /** Core class matching a resolved name, or an unresolved name that is a namespace suffix of one. */
    static String coreClass(String className) {
        if (className == null) return null;
        for (String core : CORE_CLASSES) {
            if (core.equals(className) || core.endsWith("\\" + className)) return core;
        }
        return null;
    }
}
