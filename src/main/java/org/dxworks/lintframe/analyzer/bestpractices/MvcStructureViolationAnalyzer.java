package org.dxworks.lintframe.analyzer.bestpractices;

import org.dxworks.lintframe.FileKind;
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
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Work done in the wrong layer: models that render views, controller methods that have grown
 * into services, and templates that query or write the database.
 */
public class MvcStructureViolationAnalyzer extends AbstractFileAnalyzer {

    public static final String ID = "mvc-structure-violation";
    public static final String CODE_MODEL_RENDERING = "model-rendering-method";
    public static final String CODE_MODEL_VIEW_CALL = "model-calls-view";
    public static final String CODE_FAT_CONTROLLER_METHOD = "controller-method-too-long";
    public static final String CODE_VIEW_QUERY = "view-has-db-query";
    public static final String CODE_VIEW_MODEL_WRITE = "view-creates-model";

    private static final AnalyzerMetadata METADATA = new AnalyzerMetadata(
            ID,
            "MVC Structure Violation Analyzer",
            "Detects violations of Model-View-Controller architectural pattern",
            Category.BEST_PRACTICES,
            Severity.HIGH);

    private static final Set<String> RENDERING_METHODS = Set.of("render", "toHtml", "toView", "renderView");

    private static final List<Pattern> VIEW_QUERIES = List.of(
            Pattern.compile("\\bDB::"),
            Pattern.compile("::where\\s*\\("),
            Pattern.compile("::find\\s*\\("),
            Pattern.compile("::all\\s*\\("),
            Pattern.compile("::get\\s*\\("));
    private static final List<Pattern> VIEW_MODEL_WRITES = List.of(
            Pattern.compile("::create\\s*\\("),
            Pattern.compile("->save\\s*\\("));

    private final int maxControllerMethodLines;

    public MvcStructureViolationAnalyzer(AnalyzerOptions options) {
        super(options);
        this.maxControllerMethodLines = options.getPositiveInt("max_controller_method_lines", 50);
    }

    @Override
    public AnalyzerMetadata getMetadata() {
        return METADATA;
    }

    @Override
    protected Set<FileKind> fileKinds() {
        return EnumSet.of(FileKind.PHP, FileKind.BLADE);
    }

    @Override
    protected List<Issue> analyzeFile(FileContext context) {
        if (context.file().kind == FileKind.BLADE) return checkView(context);

        List<Issue> issues = new ArrayList<>();
        boolean controllerFile = context.relativePath().contains("Http/Controllers/");
        for (SyntaxNode cls : context.tree().root().findAll("class_declaration")) {
            String className = PhpNodes.declarationName(cls);
            if (extendsModel(cls)) {
                checkModel(context, cls, className, issues);
            } else if (controllerFile || (className != null && className.endsWith("Controller"))) {
                checkController(context, cls, className, issues);
            }
        }
        return issues;
    }

    private static boolean extendsModel(SyntaxNode cls) {
        String parent = PhpNodes.baseClassName(cls);
        if (parent == null) return false;
        String name = PhpNodes.stripLeadingBackslash(parent);
        return name.equals("Model") || name.endsWith("\\Model");
    }

    private void checkModel(FileContext context, SyntaxNode cls, String className, List<Issue> issues) {
        for (SyntaxNode method : methodsOf(cls)) {
            String methodName = PhpNodes.declarationName(method);
            if (RENDERING_METHODS.contains(methodName)) {
                issues.add(issue(context, CODE_MODEL_RENDERING, Severity.HIGH, method.startLine(),
                        String.format("Model \"%s\" has rendering method \"%s()\" (MVC violation)", className, methodName))
                        .withRecommendation("Models should not contain view rendering logic. Move this to a controller "
                                + "or view composer."));
            }
            if (callsView(method)) {
                issues.add(issue(context, CODE_MODEL_VIEW_CALL, Severity.HIGH, method.startLine(),
                        String.format("Model \"%s\" method \"%s()\" calls view() helper (MVC violation)", className, methodName))
                        .withRecommendation("Models should not render views. Rendering belongs in controllers."));
            }
        }
    }

    private void checkController(FileContext context, SyntaxNode cls, String className, List<Issue> issues) {
        for (SyntaxNode method : methodsOf(cls)) {
            int lines = method.endLine() - method.startLine();
            if (lines <= maxControllerMethodLines) continue;
            issues.add(issue(context, CODE_FAT_CONTROLLER_METHOD, Severity.HIGH, method.startLine(),
                    String.format("Controller method \"%s::%s()\" has %d lines (max: %d). Large methods indicate "
                                    + "business logic in controller",
                            className == null ? "Unknown" : className, PhpNodes.declarationName(method), lines,
                            maxControllerMethodLines))
                    .withRecommendation("Controllers should be thin and focus on request and response handling. "
                            + "Extract business logic to service classes.")
                    .withMetadata("lines", lines)
                    .withMetadata("max_lines", maxControllerMethodLines));
        }
    }

    private static List<SyntaxNode> methodsOf(SyntaxNode cls) {
        List<SyntaxNode> methods = new ArrayList<>();
        for (SyntaxNode method : cls.findAll("method_declaration")) {
            if (PhpNodes.enclosingClass(method) == cls) methods.add(method);
        }
        return methods;
    }

    private static boolean callsView(SyntaxNode method) {
        SyntaxNode body = PhpNodes.body(method);
        if (body == null) return false;
        for (SyntaxNode call : body.findAll("function_call_expression")) {
            if ("view".equals(PhpNodes.callName(call))) return true;
        }
        return false;
    }

    private List<Issue> checkView(FileContext context) {
        List<Issue> issues = new ArrayList<>();
        for (int lineNumber = 1; lineNumber <= context.lineCount(); lineNumber++) {
            String line = context.line(lineNumber);
            if (matchesAny(VIEW_QUERIES, line)) {
                issues.add(issue(context, CODE_VIEW_QUERY, Severity.CRITICAL, lineNumber,
                        "View contains database query (MVC violation)")
                        .withRecommendation("Views should never contain database queries. Load all data in the "
                                + "controller and pass it to the view."));
            }
            if (matchesAny(VIEW_MODEL_WRITES, line)) {
                issues.add(issue(context, CODE_VIEW_MODEL_WRITE, Severity.CRITICAL, lineNumber,
                        "View contains model creation (MVC violation)")
                        .withRecommendation("Views should never create or modify models. Data manipulation belongs "
                                + "in controllers or services."));
            }
        }
        return issues;
    }

    private static boolean matchesAny(List<Pattern> patterns, String line) {
        for (Pattern pattern : patterns) {
            if (pattern.matcher(line).find()) return true;
        }
        return false;
    }
}
