package org.dxworks.lintframe.analyzer.bestpractices;

import org.dxworks.lintframe.analyzer.AbstractFileAnalyzer;
import org.dxworks.lintframe.analyzer.AnalyzerOptions;
import org.dxworks.lintframe.analyzer.FileContext;
import org.dxworks.lintframe.analyzer.support.PathFilter;
import org.dxworks.lintframe.analyzer.support.WildcardPattern;
import org.dxworks.lintframe.model.AnalyzerMetadata;
import org.dxworks.lintframe.model.Category;
import org.dxworks.lintframe.model.Issue;
import org.dxworks.lintframe.model.Severity;
import org.dxworks.lintframe.syntax.PhpNodes;
import org.dxworks.lintframe.syntax.SyntaxNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Failures that disappear without trace: empty catch blocks, catch blocks that neither log nor
 * rethrow, overly broad catches and the {@code @} error-suppression operator.
 */
public class SilentFailureAnalyzer extends AbstractFileAnalyzer {

    public static final String ID = "silent-failure";
    public static final String CODE_EMPTY_CATCH = "empty-catch";
    public static final String CODE_UNLOGGED_CATCH = "catch-without-logging";
    public static final String CODE_BROAD_CATCH = "broad-catch";
    public static final String CODE_ERROR_SUPPRESSION = "error-suppression";

    private static final AnalyzerMetadata METADATA = new AnalyzerMetadata(
            ID,
            "Silent Failure Analyzer",
            "Detects empty catch blocks and error suppression that hide failures",
            Category.BEST_PRACTICES,
            Severity.MEDIUM);

    private static final Set<String> BROAD_TYPES = Set.of("Throwable", "Exception", "Error");

    private static final List<String> INTENTIONAL_MARKERS = List.of(
            "intentional", "deliberately", "on purpose", "expected to fail", "expected exception", "safe to ignore",
            "safely ignore", "can be ignored", "may be ignored", "optional", "not critical", "non-critical",
            "best effort", "best-effort", "fire and forget", "fire-and-forget", "no action needed",
            "no action required", "nothing to do", "noop", "no-op", "@suppress", "@ignore", "phpstan-ignore",
            "psalm-suppress", "swallow", "don't care", "doesn't matter", "not important");

    private static final Set<String> LOG_METHODS = Set.of(
            "error", "warning", "info", "debug", "log", "critical", "alert", "emergency", "notice",
            "captureException", "notifyException", "report", "notify");
    private static final Set<String> ERROR_TRACKERS = Set.of("Raygun", "Rollbar", "Honeybadger");
    private static final List<String> HANDLER_HINTS = List.of("log", "error", "exception", "report", "handle", "notify", "fail");
    private static final List<String> FALLBACK_VARIABLES = List.of(
            "default", "fallback", "backup", "cached", "empty", "placeholder", "alternative");
    private static final List<String> FALLBACK_CALLS = List.of(
            "default", "fallback", "backup", "empty", "cached", "retry", "attempt", "recover", "restore");
    private static final Set<String> FALLBACK_STATIC_CLASSES = Set.of("Cache", "Config", "Session", "Storage", "Redis");

    private final PathFilter whitelistDirs;
    private final WildcardPattern whitelistClasses;
    private final WildcardPattern whitelistExceptions;
    private final WildcardPattern whitelistFunctions;
    private final WildcardPattern whitelistStaticMethods;
    private final WildcardPattern whitelistInstanceMethods;

    public SilentFailureAnalyzer(AnalyzerOptions options) {
        super(options);
        List<String> dirs = new ArrayList<>();
        for (String dir : options.getStringList("whitelist_dirs", List.of("tests", "database/seeders", "database/factories"))) {
            dirs.add(dir.endsWith("/") ? dir : dir + "/");
        }
        this.whitelistDirs = new PathFilter(dirs);
        this.whitelistClasses = new WildcardPattern(options.getStringList("whitelist_classes",
                List.of("*Test", "*TestCase", "*Seeder", "DatabaseSeeder")));
        this.whitelistExceptions = new WildcardPattern(options.getStringList("whitelist_exceptions",
                List.of("ModelNotFoundException", "NotFoundException", "NotFoundHttpException", "ValidationException")));
        this.whitelistFunctions = new WildcardPattern(options.getStringList("whitelist_error_suppression_functions",
                List.of("unlink", "fopen", "file_get_contents", "mkdir", "rmdir")));
        this.whitelistStaticMethods = new WildcardPattern(options.getStringList(
                "whitelist_error_suppression_static_methods",
                List.of("Storage::delete", "Storage::deleteDirectory", "File::delete", "File::deleteDirectory")));
        this.whitelistInstanceMethods = new WildcardPattern(options.getStringList(
                "whitelist_error_suppression_instance_methods", List.of("delete", "close", "unlink")));
    }

    @Override
    public AnalyzerMetadata getMetadata() {
        return METADATA;
    }

    @Override
    protected List<Issue> analyzeFile(FileContext context) {
        if (whitelistDirs.matches(context.relativePath())) return List.of();
        List<Issue> issues = new ArrayList<>();
        for (SyntaxNode clause : context.tree().root().findAll("catch_clause")) {
            if (inWhitelistedClass(clause)) continue;
            checkCatch(context, clause, issues);
        }
        for (SyntaxNode op : context.tree().root().findAll("unary_op_expression")) {
            if (!"@".equals(op.token()) || inWhitelistedClass(op)) continue;
            checkSuppression(context, op, issues);
        }
        return issues;
    }

    private boolean inWhitelistedClass(SyntaxNode node) {
        for (SyntaxNode cls = node.ancestor("class_declaration"); cls != null; cls = cls.ancestor("class_declaration")) {
            if (whitelistClasses.matches(PhpNodes.declarationName(cls))) return true;
        }
        return false;
    }

    private void checkCatch(FileContext context, SyntaxNode clause, List<Issue> issues) {
        List<String> types = PhpNodes.catchTypes(clause);
        List<String> broad = new ArrayList<>();
        for (String type : types) {
            if (BROAD_TYPES.contains(PhpNodes.shortName(type))) broad.add(PhpNodes.shortName(type));
        }
        if (broad.isEmpty()) {
            for (String type : types) {
                if (whitelistExceptions.matchesClass(PhpNodes.shortName(type), type)) return;
            }
        }

        SyntaxNode body = PhpNodes.body(clause);
        if (body == null || body.childCount() == 0) {
            if (hasIntentionalComment(context, clause)) return;
            issues.add(issue(context, CODE_EMPTY_CATCH, Severity.HIGH, clause.startLine(),
                    "Empty catch block silently swallows exceptions")
                    .withRecommendation("Never use empty catch blocks. At minimum, log the exception. If it really "
                            + "can be ignored, add a comment saying so."));
            return;
        }

        boolean rethrows = !body.findAll("throw_expression", "throw_statement").isEmpty();
        boolean handles = hasLoggingOrFallback(body);
        if (!broad.isEmpty() && !rethrows) {
            String joined = String.join("|", broad);
            issues.add(issue(context, CODE_BROAD_CATCH, Severity.HIGH, clause.startLine(),
                    "Catching " + joined + " is overly broad and can mask fatal errors")
                    .withRecommendation("Catch specific exception types instead of " + joined + ". Broad catches hide "
                            + "programming errors like TypeError and ArgumentCountError."));
            return;
        }
        if (usesExceptionVariable(clause, body)) return;
        if (!handles && !rethrows) {
            issues.add(issue(context, CODE_UNLOGGED_CATCH, Severity.MEDIUM, clause.startLine(),
                    "Catch block does not log exception or rethrow")
                    .withRecommendation("Log caught exceptions with Log::error() or report(), or rethrow them."));
        }
    }

    private static boolean hasIntentionalComment(FileContext context, SyntaxNode clause) {
        for (SyntaxNode comment : context.tree().comments()) {
            if (comment.startByte() < clause.startByte() || comment.endByte() > clause.endByte()) continue;
            String text = comment.text().toLowerCase(Locale.ROOT);
            for (String marker : INTENTIONAL_MARKERS) {
                if (text.contains(marker)) return true;
            }
        }
        return false;
    }

    private static boolean usesExceptionVariable(SyntaxNode clause, SyntaxNode body) {
        String variable = PhpNodes.variableName(clause.child("name"));
        if (variable == null) {
            SyntaxNode declared = clause.firstChild("variable_name");
            variable = PhpNodes.variableName(declared);
        }
        if (variable == null) return false;
        for (SyntaxNode use : body.findAll("variable_name")) {
            if (variable.equals(PhpNodes.variableName(use))) return true;
        }
        return false;
    }

    private static boolean hasLoggingOrFallback(SyntaxNode body) {
        if (!body.findAll("return_statement", "continue_statement", "break_statement").isEmpty()) return true;
        for (SyntaxNode statement : body.findAll("expression_statement")) {
            SyntaxNode expr = statement.child(0);
            if (expr == null) continue;
            if (isLogging(expr)) return true;
            if (PhpNodes.isFunctionCall(expr) && "rescue".equals(PhpNodes.callName(expr))) return true;
            if (expr.is("assignment_expression") && isFallbackAssignment(expr)) return true;
        }
        return false;
    }

    private static boolean isLogging(SyntaxNode expr) {
        String name = PhpNodes.callName(expr);
        if (PhpNodes.isStaticCall(expr)) {
            String cls = PhpNodes.scopeName(expr);
            if (cls == null) return false;
            String shortName = PhpNodes.shortName(cls);
            return shortName.equals("Log")
                    || (shortName.equals("DB") && "rollback".equalsIgnoreCase(name))
                    || cls.contains("Sentry") || cls.contains("Bugsnag")
                    || ERROR_TRACKERS.contains(shortName);
        }
        if (PhpNodes.isFunctionCall(expr)) {
            if (name == null) return false;
            if (Set.of("logger", "report", "abort", "abort_if", "abort_unless").contains(name)) return true;
            if (name.contains("Sentry\\captureException") || name.contains("Bugsnag\\")) return true;
            if (name.equals("rescue")) {
                SyntaxNode third = PhpNodes.argument(expr, 2);
                return third != null && "true".equalsIgnoreCase(third.text());
            }
            return false;
        }
        if (PhpNodes.isMethodCall(expr) && name != null) {
            if (LOG_METHODS.contains(name)) return true;
            SyntaxNode receiver = PhpNodes.receiver(expr);
            if (Set.of("flash", "put", "push").contains(name) && isSession(receiver)) return true;
            if (PhpNodes.isThis(receiver)) {
                String lower = name.toLowerCase(Locale.ROOT);
                for (String hint : HANDLER_HINTS) {
                    if (lower.contains(hint)) return true;
                }
            }
        }
        return false;
    }

    private static boolean isSession(SyntaxNode receiver) {
        if (PhpNodes.isFunctionCall(receiver)) return "session".equals(PhpNodes.callName(receiver));
        String variable = PhpNodes.variableName(receiver);
        return variable != null && variable.toLowerCase(Locale.ROOT).contains("session");
    }

    private static boolean isFallbackAssignment(SyntaxNode assignment) {
        String target = PhpNodes.variableName(assignment.child("left"));
        if (target != null && containsAny(target, FALLBACK_VARIABLES)) return true;
        SyntaxNode value = assignment.child("right");
        if (value == null) return false;
        if (PhpNodes.isMethodCall(value) || PhpNodes.isFunctionCall(value)) {
            String name = PhpNodes.callName(value);
            return name != null && containsAny(name, FALLBACK_CALLS);
        }
        if (PhpNodes.isStaticCall(value)) {
            String cls = PhpNodes.shortName(PhpNodes.scopeName(value));
            String name = PhpNodes.callName(value);
            if (cls == null || name == null || !FALLBACK_STATIC_CLASSES.contains(cls)) return false;
            return (name.equals("get") && PhpNodes.arguments(value).size() >= 2)
                    || Set.of("remember", "rememberForever", "pull").contains(name);
        }
        if (value.is("binary_expression") && "??".equals(value.token())) return isComputed(value.child("right"));
        if (value.is("conditional_expression")) return isComputed(value.child("alternative"));
        return value.is("object_creation_expression");
    }

    private static boolean isComputed(SyntaxNode node) {
        return node != null && (PhpNodes.isCall(node) || node.is("object_creation_expression"));
    }

    private static boolean containsAny(String name, List<String> fragments) {
        String lower = name.toLowerCase(Locale.ROOT);
        for (String fragment : fragments) {
            if (lower.contains(fragment)) return true;
        }
        return false;
    }

    private void checkSuppression(FileContext context, SyntaxNode op, List<Issue> issues) {
        SyntaxNode expr = op.lastChild();
        if (expr != null && isWhitelistedSuppression(expr)) return;

        boolean inCatch = op.ancestor("catch_clause") != null;
        boolean dynamic = expr != null && PhpNodes.isCall(expr) && PhpNodes.callName(expr) == null;
        String message;
        String recommendation;
        Severity severity;
        if (inCatch) {
            severity = Severity.HIGH;
            message = "Error suppression operator (@) inside catch block creates double silencing";
            recommendation = "Dynamic or nested error suppression is highly discouraged. Use explicit try-catch with logging.";
        } else if (dynamic) {
            severity = Severity.HIGH;
            message = "Dynamic error suppression is particularly dangerous";
            recommendation = "Dynamic or nested error suppression is highly discouraged. Use explicit try-catch with logging.";
        } else {
            severity = Severity.MEDIUM;
            message = "Error suppression operator (@) hides errors";
            recommendation = "Avoid the @ operator. Handle errors explicitly with try-catch or check return values.";
        }
        issues.add(issue(context, CODE_ERROR_SUPPRESSION, severity, op.startLine(), message)
                .withRecommendation(recommendation));
    }

    private boolean isWhitelistedSuppression(SyntaxNode expr) {
        String name = PhpNodes.callName(expr);
        if (name == null) return false;
        if (PhpNodes.isFunctionCall(expr)) return whitelistFunctions.matchesClass(PhpNodes.shortName(name), name);
        if (PhpNodes.isStaticCall(expr)) {
            String cls = PhpNodes.scopeName(expr);
            if (cls == null) return false;
            return whitelistStaticMethods.matchesClass(PhpNodes.shortName(cls) + "::" + name, cls + "::" + name);
        }
        return PhpNodes.isMethodCall(expr) && whitelistInstanceMethods.matches(name);
    }
}
