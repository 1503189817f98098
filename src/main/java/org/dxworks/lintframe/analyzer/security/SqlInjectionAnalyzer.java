package org.dxworks.lintframe.analyzer.security;

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
 * Raw SQL built from concatenation, interpolation or request input, plus database access that
 * bypasses the framework's parameter binding altogether.
 */
public class SqlInjectionAnalyzer extends AbstractFileAnalyzer {

    public static final String ID = "sql-injection";
    public static final String CODE_RAW_SQL = "sql-injection-raw";
    public static final String CODE_UNPREPARED = "sql-injection-unprepared";
    public static final String CODE_NATIVE_FUNCTION = "native-database-function";
    public static final String CODE_NATIVE_CONNECTION = "native-database-connection";

    private static final AnalyzerMetadata METADATA = new AnalyzerMetadata(
            ID,
            "SQL Injection Analyzer",
            "Detects potential SQL injection vulnerabilities in database queries",
            Category.SECURITY,
            Severity.CRITICAL);

    private static final Set<String> RAW_METHODS = Set.of("raw", "whereRaw", "havingRaw", "orderByRaw", "selectRaw");
    private static final Set<String> DB_STATEMENTS = Set.of("select", "insert", "update", "delete");
    private static final Set<String> NATIVE_CLASSES = Set.of("PDO", "mysqli");

    static final List<String> USER_INPUT_SOURCES = List.of(
            "$_GET", "$_POST", "$_REQUEST", "$_COOKIE", "request(",
            "Request::input", "Request::get", "Request::all", "Request::query", "Request::post",
            "Request::cookie", "Request::header", "Request::route", "Input::get", "Input::all",
            "$request->input", "$request->get", "$request->all", "$request->query", "$request->post",
            "$request->cookie");

    private static final List<String> MYSQLI_FUNCTIONS = List.of(
            "mysqli_connect", "mysqli_execute", "mysqli_stmt_execute", "mysqli_stmt_close",
            "mysqli_stmt_fetch", "mysqli_stmt_get_result", "mysqli_stmt_more_results",
            "mysqli_stmt_next_result", "mysqli_stmt_prepare", "mysqli_close", "mysqli_commit",
            "mysqli_begin_transaction", "mysqli_init", "mysqli_insert_id", "mysqli_prepare",
            "mysqli_query", "mysqli_real_connect", "mysqli_real_query", "mysqli_store_result",
            "mysqli_use_result", "mysqli_multi_query");

    private static final List<String> POSTGRES_FUNCTIONS = List.of(
            "pg_connect", "pg_close", "pg_affected_rows", "pg_delete", "pg_execute",
            "pg_fetch_all", "pg_fetch_result", "pg_fetch_row", "pg_fetch_all_columns",
            "pg_fetch_array", "pg_fetch_assoc", "pg_fetch_object", "pg_flush", "pg_insert",
            "pg_get_result", "pg_pconnect", "pg_prepare", "pg_query", "pg_query_params",
            "pg_select", "pg_send_execute", "pg_send_prepare", "pg_send_query",
            "pg_send_query_params");

    private final Set<String> nativeFunctions = new HashSet<>();

    public SqlInjectionAnalyzer(AnalyzerOptions options) {
        super(options);
        nativeFunctions.addAll(options.getStringList("mysqli_functions", MYSQLI_FUNCTIONS));
        nativeFunctions.addAll(options.getStringList("postgres_functions", POSTGRES_FUNCTIONS));
    }

    @Override
    public AnalyzerMetadata getMetadata() {
        return METADATA;
    }

    @Override
    protected List<Issue> analyzeFile(FileContext context) {
        List<Issue> issues = new ArrayList<>();
        SyntaxNode root = context.tree().root();
        for (SyntaxNode call : root.findAll(PhpNodes.CALLS)) {
            String name = PhpNodes.callName(call);
            if (name == null) continue;
            if (PhpNodes.isStaticCall(call)) {
                if (!LaravelVocabulary.isDbFacade(PhpNodes.scopeName(call))) continue;
                if (name.equals("unprepared")) {
                    issues.add(sqlIssue(context, CODE_UNPREPARED, call, "DB::unprepared()",
                            "Avoid DB::unprepared(). Use prepared statements with DB::select(), DB::insert() "
                                    + "and the other statement methods with parameter binding."));
                } else if ((RAW_METHODS.contains(name) || DB_STATEMENTS.contains(name)) && isVulnerable(call)) {
                    issues.add(sqlIssue(context, CODE_RAW_SQL, call, "DB::" + name + "()",
                            DB_STATEMENTS.contains(name)
                                    ? "Use parameter binding with placeholders"
                                    : "Use parameter binding: DB::" + name + "('column = ?', [$value]) instead of concatenation"));
                }
            } else if (PhpNodes.isMethodCall(call)) {
                if (RAW_METHODS.contains(name) && isVulnerable(call)) {
                    issues.add(sqlIssue(context, CODE_RAW_SQL, call, name + "()",
                            "Use parameter binding: ->" + name + "('column = ?', [$value]) instead of concatenation"));
                }
            } else if (PhpNodes.isFunctionCall(call) && nativeFunctions.contains(name)) {
                issues.add(sqlIssue(context, CODE_NATIVE_FUNCTION, call, name + "()",
                        "Avoid native PHP database functions. Use the DB facade or Eloquent for parameter binding."));
            }
        }
        for (SyntaxNode creation : root.findAll("object_creation_expression")) {
            String cls = PhpNodes.instantiatedClass(creation);
            if (cls == null || !NATIVE_CLASSES.contains(cls)) continue;
            issues.add(sqlIssue(context, CODE_NATIVE_CONNECTION, creation, "new " + cls + "()",
                    "Avoid direct PDO/mysqli usage. Use the DB facade or Eloquent instead."));
        }
        return issues;
    }

    private Issue sqlIssue(FileContext context, String code, SyntaxNode node, String method, String recommendation) {
        return issue(context, code, Severity.CRITICAL, node.startLine(),
                "Potential SQL injection: " + method + " with string concatenation or user input")
                .withRecommendation(recommendation)
                .withMetadata("method", method);
    }

    static boolean isVulnerable(SyntaxNode call) {
        for (SyntaxNode arg : PhpNodes.arguments(call)) {
            if (hasConcatenation(arg) || hasInterpolation(arg) || hasUserInput(arg)) return true;
        }
        return false;
    }

    private static boolean hasConcatenation(SyntaxNode node) {
        for (SyntaxNode binary : node.findAll("binary_expression")) {
            if (".".equals(binary.token())) return true;
        }
        return false;
    }

    private static boolean hasInterpolation(SyntaxNode node) {
        for (SyntaxNode string : node.findAll("encapsed_string", "heredoc")) {
            if (PhpNodes.isInterpolated(string)) return true;
        }
        return false;
    }

    private static boolean hasUserInput(SyntaxNode node) {
        String code = node.text().replace(" ", "");
        for (String source : USER_INPUT_SOURCES) {
            if (code.contains(source)) return true;
        }
        return false;
    }
}
