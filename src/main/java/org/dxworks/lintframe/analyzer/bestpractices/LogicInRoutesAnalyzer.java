package org.dxworks.lintframe.analyzer.bestpractices;

import org.dxworks.lintframe.analyzer.AbstractFileAnalyzer;
import org.dxworks.lintframe.analyzer.AnalyzerOptions;
import org.dxworks.lintframe.analyzer.FileContext;
import org.dxworks.lintframe.analyzer.support.LaravelVocabulary;
import org.dxworks.lintframe.model.AnalyzerMetadata;
import org.dxworks.lintframe.model.Category;
import org.dxworks.lintframe.model.Issue;
import org.dxworks.lintframe.model.Severity;
import org.dxworks.lintframe.syntax.MethodChain;
import org.dxworks.lintframe.syntax.PhpNodes;
import org.dxworks.lintframe.syntax.SyntaxNode;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Route closures (the closure arguments of {@code Route::get(...)} and friends) that query the
 * database, carry business logic or simply grow too long.
 */
public class LogicInRoutesAnalyzer extends AbstractFileAnalyzer {

    public static final String ID = "logic-in-routes";
    public static final String CODE_DB_QUERIES = "route-has-db-queries";
    public static final String CODE_BUSINESS_LOGIC = "route-has-business-logic";
    public static final String CODE_TOO_LONG = "route-closure-too-long";

    private static final AnalyzerMetadata METADATA = new AnalyzerMetadata(
            ID,
            "Logic in Routes Analyzer",
            "Detects business logic in route files that should be moved to controllers or action classes",
            Category.BEST_PRACTICES,
            Severity.HIGH);

    private static final String DB_QUERIES = "database queries";
    private static final String BUSINESS_LOGIC = "complex business logic";

    private static final Set<String> BUSINESS_LOGIC_FUNCTIONS = Set.of(
            "dispatch", "dispatch_sync", "dispatch_now", "event", "report", "rescue", "broadcast", "app", "resolve",
            "retry");
    private static final Set<String> BUSINESS_LOGIC_FACADES = Set.of(
            "Mail", "Notification", "Queue", "Event", "Bus", "Broadcast");
    private static final Set<String> CONTAINER_METHODS = Set.of("make", "makeWith", "call", "get");
    private static final Set<String> ROUTE_QUERY_METHODS = Set.of(
            "where", "find", "all", "first", "create", "query", "findOrFail", "firstOrFail", "get", "pluck", "count",
            "exists", "doesntExist", "with", "without");
    private static final Set<String> STATIC_QUERY_METHODS = Set.of("where", "find", "all", "first", "create", "query");
    private static final Set<String> BUILDER_METHODS = Set.of(
            "orWhere", "whereIn", "whereNotIn", "whereBetween", "whereNull", "join", "leftJoin", "rightJoin",
            "crossJoin", "having", "havingRaw", "groupBy", "union", "unionAll", "lockForUpdate", "sharedLock");
    private static final Set<String> UTILITY_CLASSES = Set.of(
            "Carbon", "Collection", "Validator", "Cache", "Log", "Session", "Cookie", "Request", "Response", "View",
            "Config", "Str", "Arr", "File", "Storage", "Hash", "Crypt", "Route", "URL", "Redirect", "DB", "App",
            "Auth", "Gate", "Password", "RateLimiter", "Schema");
    private static final Set<String> NON_MODEL_QUERY_CLASSES = Set.of(
            "Carbon", "Collection", "Validator", "Cache", "Log", "Session", "Cookie", "Request", "Response", "View",
            "Config", "Str", "Arr", "File", "Storage", "Hash", "Crypt", "Mail", "Queue", "Event", "Bus", "Gate",
            "Notification", "Password", "URL", "Redirect", "Route");
    private static final Set<String> ARITHMETIC = Set.of("+", "-", "*", "/", "+=", "-=", "*=", "/=");
    private static final Pattern PASCAL_CASE = Pattern.compile("^[A-Z][a-zA-Z0-9]*$");

    private final int maxClosureLines;
    private final int complexChainLength;

    public LogicInRoutesAnalyzer(AnalyzerOptions options) {
        super(options);
        this.maxClosureLines = options.getPositiveInt("max_closure_lines", 5);
        this.complexChainLength = options.getPositiveInt("complex_chain_length", 3);
    }

    @Override
    protected List<String> defaultPaths() {
        return List.of("routes/");
    }

    @Override
    public AnalyzerMetadata getMetadata() {
        return METADATA;
    }

    @Override
    protected List<Issue> analyzeFile(FileContext context) {
        List<Issue> issues = new ArrayList<>();
        Set<SyntaxNode> seen = new HashSet<>();
        for (SyntaxNode call : context.tree().root().findAll("scoped_call_expression")) {
            if (!isRouteFacade(PhpNodes.scopeName(call))) continue;
            for (SyntaxNode argument : PhpNodes.arguments(call)) {
                if (argument.is("anonymous_function", "anonymous_function_creation_expression") && seen.add(argument)) {
                    Issue issue = checkClosure(context, argument);
                    if (issue != null) issues.add(issue);
                }
            }
        }
        return issues;
    }

    private static boolean isRouteFacade(String name) {
        return "Route".equals(name) || "Illuminate\\Support\\Facades\\Route".equals(name);
    }

    private Issue checkClosure(FileContext context, SyntaxNode closure) {
        List<String> problems = new ArrayList<>();
        Severity severity = Severity.LOW;
        boolean hasQueries = hasDbQueries(closure);
        boolean hasLogic = hasBusinessLogic(closure);
        if (hasQueries) {
            problems.add(DB_QUERIES);
            severity = Severity.CRITICAL;
        }
        if (hasLogic) {
            problems.add(BUSINESS_LOGIC);
            if (!severity.isAtLeast(Severity.HIGH)) severity = Severity.HIGH;
        }
        int lineCount = closure.endLine() - closure.startLine() + 1;
        if (lineCount > maxClosureLines) {
            problems.add(String.format("%d lines (max: %d)", lineCount, maxClosureLines));
            if (!severity.isAtLeast(Severity.MEDIUM)) severity = Severity.MEDIUM;
        }
        if (problems.isEmpty()) return null;

        String code;
        String recommendation;
        if (hasQueries) {
            code = CODE_DB_QUERIES;
            recommendation = "Database queries should not be in route files. Move this logic to a controller "
                    + "method and use repositories or services for data access.";
        } else if (hasLogic) {
            code = CODE_BUSINESS_LOGIC;
            recommendation = "Business logic belongs in service classes or controllers. Route files should only "
                    + "define routes.";
        } else {
            code = CODE_TOO_LONG;
            recommendation = "Move route logic to a controller method or single-action controller.";
        }
        return issue(context, code, severity, closure.startLine(),
                "Route closure contains " + String.join(", ", problems))
                .withRecommendation(recommendation)
                .withMetadata("problems", problems)
                .withMetadata("line_count", lineCount)
                .withMetadata("has_db_queries", hasQueries)
                .withMetadata("has_business_logic", hasLogic);
    }

    private static boolean hasDbQueries(SyntaxNode closure) {
        for (SyntaxNode call : closure.findAll(PhpNodes.CALLS)) {
            String method = PhpNodes.callName(call);
            if (PhpNodes.isStaticCall(call)) {
                String cls = PhpNodes.scopeName(call);
                if (LaravelVocabulary.isDbFacade(cls)) return true;
                if (cls != null && STATIC_QUERY_METHODS.contains(method)
                        && (cls.endsWith("Model") || isPlainModelName(cls))) {
                    return true;
                }
            } else if (PhpNodes.isMethodCall(call) && BUILDER_METHODS.contains(method)) {
                return true;
            }
        }
        return false;
    }

    private static boolean isPlainModelName(String cls) {
        return cls.matches("^[A-Z][a-zA-Z]+$") && !NON_MODEL_QUERY_CLASSES.contains(cls);
    }

    private boolean hasBusinessLogic(SyntaxNode closure) {
        SyntaxNode body = PhpNodes.body(closure);
        if (body == null) return false;
        for (SyntaxNode call : body.findAll(PhpNodes.CALLS)) {
            String method = PhpNodes.callName(call);
            if (PhpNodes.isFunctionCall(call)) {
                if (BUSINESS_LOGIC_FUNCTIONS.contains(method)) return true;
            } else if (PhpNodes.isStaticCall(call)) {
                String cls = PhpNodes.scopeName(call);
                if (cls == null) continue;
                String shortName = PhpNodes.shortName(cls);
                boolean frameworkFacade = cls.equals(shortName) || cls.startsWith("Illuminate\\Support\\Facades\\");
                if (frameworkFacade && BUSINESS_LOGIC_FACADES.contains(shortName)) return true;
                if (frameworkFacade && "App".equals(shortName) && CONTAINER_METHODS.contains(method)) return true;
                if (PASCAL_CASE.matcher(cls).matches() && !UTILITY_CLASSES.contains(cls)
                        && !ROUTE_QUERY_METHODS.contains(method)) {
                    return true;
                }
            } else if (PhpNodes.isChainTop(call) && instanceChainLength(call) >= complexChainLength) {
                return true;
            }
        }
        for (SyntaxNode statement : body.findAll("if_statement")) {
            SyntaxNode outer = statement.parent() == null ? null : statement.parent().ancestor("if_statement");
            if (outer != null && outer.isWithin(body)) return true;
        }
        SyntaxNode firstLoop = body.findFirst(PhpNodes.LOOPS);
        if (firstLoop != null) {
            for (SyntaxNode op : body.findAll("binary_expression", "augmented_assignment_expression")) {
                if (op.startByte() >= firstLoop.startByte() && ARITHMETIC.contains(op.token())) return true;
            }
        }
        return false;
    }

    private static int instanceChainLength(SyntaxNode call) {
        MethodChain chain = PhpNodes.chain(call);
        int count = 0;
        for (MethodChain.Link link : chain.links()) {
            if (!link.isStatic) count++;
        }
        return count;
    }
}
