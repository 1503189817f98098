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
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Raw SQL passed to the DB facade that the query builder expresses just as well:
 * {@code DB::raw('COUNT(*)')}, {@code DB::select('select * from users')} and plain
 * single-table inserts, updates and deletes.
 */
public class RawEloquentAvoidanceAnalyzer extends AbstractFileAnalyzer {

    public static final String ID = "raw-eloquent-avoidance";
    public static final String CODE_RAW = "raw-simple-expression";
    public static final String CODE_SELECT = "raw-simple-select";
    public static final String CODE_MODIFICATION = "raw-simple-modification";

    private static final AnalyzerMetadata METADATA = new AnalyzerMetadata(
            ID,
            "Unnecessary Raw SQL Detector",
            "Flags unnecessary use of raw SQL when Eloquent methods are available",
            Category.BEST_PRACTICES,
            Severity.LOW,
            Severity.MEDIUM);

    private static final List<Pattern> SIMPLE_EXPRESSIONS = List.of(
            Pattern.compile("^count\\s*\\(\\s*\\*\\s*\\)$"),
            Pattern.compile("^(sum|avg|max|min)\\s*\\(\\s*\\w+\\s*\\)$"));

    private static final List<Pattern> SIMPLE_SELECTS = List.of(
            Pattern.compile("^select\\s+\\*\\s+from\\s+\\w+\\s+where\\s+\\w+\\s*=\\s*\\??\\s*$"),
            Pattern.compile("^select\\s+\\*\\s+from\\s+\\w+\\s*$"),
            Pattern.compile("^select\\s+[\\w,\\s]+\\s+from\\s+\\w+\\s*$"));

    private static final List<Pattern> SIMPLE_MODIFICATIONS = List.of(
            Pattern.compile("^insert\\s+into\\s+\\w+\\s*\\("),
            Pattern.compile("^update\\s+\\w+\\s+set\\s+\\w+\\s*="),
            Pattern.compile("^delete\\s+from\\s+\\w+\\s+where\\s+\\w+\\s*="));

    public RawEloquentAvoidanceAnalyzer(AnalyzerOptions options) {
        super(options);
    }

    @Override
    public AnalyzerMetadata getMetadata() {
        return METADATA;
    }

    @Override
    protected List<Issue> analyzeFile(FileContext context) {
        List<Issue> issues = new ArrayList<>();
        for (SyntaxNode call : context.tree().root().findAll("scoped_call_expression")) {
            if (!LaravelVocabulary.isDbFacade(PhpNodes.scopeName(call))) continue;
            String method = PhpNodes.callName(call);
            String literal = PhpNodes.stringValue(PhpNodes.argument(call, 0));
            if (method == null || literal == null) continue;
            String sql = literal.trim().toLowerCase(Locale.ROOT);

            switch (method) {
                case "raw" -> {
                    if (matchesAny(SIMPLE_EXPRESSIONS, sql)) {
                        issues.add(issue(context, CODE_RAW, Severity.LOW, call,
                                "Using DB::raw() for simple query that could use Eloquent methods")
                                .withRecommendation("Use Eloquent methods instead of raw SQL, for example "
                                        + aggregateAlternative(sql) + ".")
                                .withMetadata("sql", shorten(literal)));
                    }
                }
                case "select" -> {
                    if (matchesAny(SIMPLE_SELECTS, sql)) {
                        issues.add(issue(context, CODE_SELECT, Severity.LOW, call,
                                "Simple SELECT query using DB::select() could use Eloquent")
                                .withRecommendation("Use the Eloquent query builder, for example Model::where(...)->get().")
                                .withMetadata("sql", shorten(literal)));
                    }
                }
                case "insert", "update", "delete" -> {
                    if (matchesAny(SIMPLE_MODIFICATIONS, sql) && !sql.contains("join") && !sql.contains("select")) {
                        issues.add(issue(context, CODE_MODIFICATION, Severity.LOW, call,
                                "Simple " + method.toUpperCase(Locale.ROOT) + " query could use Eloquent")
                                .withRecommendation("Use Eloquent methods: " + modificationAlternative(method) + ".")
                                .withMetadata("sql", shorten(literal)));
                    }
                }
                default -> {
                }
            }
        }
        return issues;
    }

    private static boolean matchesAny(List<Pattern> patterns, String sql) {
        for (Pattern pattern : patterns) {
            if (pattern.matcher(sql).find()) return true;
        }
        return false;
    }

    private static String aggregateAlternative(String sql) {
        if (sql.contains("count")) return "Model::count() or Model::where(...)->count()";
        if (sql.contains("sum")) return "Model::sum('column')";
        if (sql.contains("avg")) return "Model::avg('column')";
        if (sql.contains("max")) return "Model::max('column')";
        if (sql.contains("min")) return "Model::min('column')";
        return "the query builder aggregate methods";
    }

    private static String modificationAlternative(String method) {
        return switch (method) {
            case "insert" -> "Model::create([...]) or Model::insert([...])";
            case "update" -> "Model::where(...)->update([...]) or $model->update([...])";
            default -> "Model::where(...)->delete() or $model->delete()";
        };
    }

    private static String shorten(String sql) {
        return sql.length() > 50 ? sql.substring(0, 50) + "..." : sql;
    }
}
