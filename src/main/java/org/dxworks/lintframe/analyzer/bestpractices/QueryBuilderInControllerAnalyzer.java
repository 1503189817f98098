package org.dxworks.lintframe.analyzer.bestpractices;

import org.dxworks.lintframe.analyzer.AbstractFileAnalyzer;
import org.dxworks.lintframe.analyzer.AnalyzerOptions;
import org.dxworks.lintframe.analyzer.FileContext;
import org.dxworks.lintframe.analyzer.support.LaravelVocabulary;
import org.dxworks.lintframe.model.AnalyzerMetadata;
import org.dxworks.lintframe.model.Category;
import org.dxworks.lintframe.model.Issue;
import org.dxworks.lintframe.model.Severity;
import org.dxworks.lintframe.syntax.PhpNodes;
import org.dxworks.lintframe.syntax.SyntaxNode;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Queries built directly inside controller actions. Simple lookups such as {@code find()} or
 * {@code first()} are allowed; one issue per action and query method.
 */
public class QueryBuilderInControllerAnalyzer extends AbstractFileAnalyzer {

    public static final String ID = "query-builder-in-controller";
    public static final String CODE = "query-in-controller";

    private static final AnalyzerMetadata METADATA = new AnalyzerMetadata(
            ID,
            "Query Builder in Controller",
            "Detects direct database query building in controllers that should use repositories or services",
            Category.BEST_PRACTICES,
            Severity.MEDIUM);

    private static final List<String> ALLOWED_METHODS = List.of(
            "find", "findOrFail", "findMany", "findOr", "all", "get", "first", "firstOrFail", "count");

    private static final Set<String> DB_METHODS = Set.of(
            "table", "select", "insert", "update", "delete", "statement", "raw");

    private static final Set<String> QUERY_METHODS = Set.of(
            "where", "whereIn", "whereNotIn", "whereBetween", "whereNull", "whereNotNull", "whereHas",
            "whereDoesntHave", "orWhere", "whereRaw", "havingRaw", "join", "leftJoin", "rightJoin", "crossJoin",
            "joinSub", "groupBy", "having", "orderBy", "orderByRaw", "select", "selectRaw", "addSelect", "limit",
            "offset", "skip", "take", "union", "unionAll", "when", "unless", "with", "withCount", "withSum",
            "withAvg", "withMin", "withMax", "sum", "avg", "min", "max", "count");

    private static final Set<String> JOINS = Set.of("join", "leftJoin", "rightJoin", "crossJoin", "joinSub");
    private static final Set<String> RAW = Set.of("whereRaw", "havingRaw", "selectRaw", "orderByRaw");
    private static final Set<String> AGGREGATES = Set.of(
            "sum", "avg", "min", "max", "count", "withCount", "withSum", "withAvg");
    private static final Set<String> COMPLEX_WHERES = Set.of("where", "whereIn", "whereHas", "orWhere");

    private final Set<String> allowedMethods;

    public QueryBuilderInControllerAnalyzer(AnalyzerOptions options) {
        super(options);
        this.allowedMethods = new HashSet<>(options.getStringListAdding("allowed_methods", ALLOWED_METHODS));
    }

    @Override
    protected List<String> defaultPaths() {
        return List.of("Controllers/", "**/*Controller.php", "*Controller.php");
    }

    @Override
    public AnalyzerMetadata getMetadata() {
        return METADATA;
    }

    @Override
    protected List<Issue> analyzeFile(FileContext context) {
        List<Issue> issues = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (SyntaxNode method : context.tree().root().findAll("method_declaration")) {
            SyntaxNode cls = PhpNodes.enclosingClass(method);
            String className = cls == null ? "Unknown" : nameOr(PhpNodes.declarationName(cls), "Anonymous");
            String methodName = PhpNodes.declarationName(method);
            SyntaxNode body = PhpNodes.body(method);
            if (body == null) continue;

            for (SyntaxNode call : body.findAll(PhpNodes.CALLS)) {
                if (PhpNodes.isFunctionCall(call) || call.ancestor("method_declaration") != method) continue;
                String name = PhpNodes.callName(call);
                if (name == null) continue;
                if (PhpNodes.isStaticCall(call) && LaravelVocabulary.isDbFacade(PhpNodes.scopeName(call))
                        && DB_METHODS.contains(name)) {
                    report(context, issues, seen, call, "DB::" + name + "()",
                            name.equals("raw") ? "raw_query" : "db_facade", className, methodName);
                    continue;
                }
                if (allowedMethods.contains(name) || !QUERY_METHODS.contains(name)) continue;
                report(context, issues, seen, call, name + "()", categorize(name), className, methodName);
            }
        }
        return issues;
    }

    private void report(FileContext context, List<Issue> issues, Set<String> seen, SyntaxNode call, String query,
                        String type, String className, String methodName) {
        if (!seen.add(className + "::" + methodName + "_" + query)) return;
        issues.add(issue(context, CODE, severityFor(type), call.startLine(),
                "Direct database query '" + query + "' used in controller method '" + methodName + "'")
                .withRecommendation("Controller method '" + methodName + "' contains direct database query '" + query
                        + "'. Keep controllers focused on HTTP concerns and move data access to a repository, "
                        + "a service class or a model scope.")
                .withMetadata("query", query)
                .withMetadata("method", methodName)
                .withMetadata("class", className)
                .withMetadata("type", type));
    }

    private static String categorize(String method) {
        if (JOINS.contains(method)) return "join";
        if (RAW.contains(method)) return "raw_query";
        if (AGGREGATES.contains(method)) return "aggregation";
        if (COMPLEX_WHERES.contains(method)) return "complex_where";
        return "query_builder";
    }

    private static Severity severityFor(String type) {
        return switch (type) {
            case "raw_query", "join" -> Severity.HIGH;
            case "complex_where", "aggregation" -> Severity.MEDIUM;
            default -> Severity.LOW;
        };
    }

    private static String nameOr(String name, String fallback) {
        return name == null ? fallback : name;
    }
}
