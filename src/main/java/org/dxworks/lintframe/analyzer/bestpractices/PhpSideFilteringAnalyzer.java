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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Collections fetched in full and then filtered in PHP: {@code Post::all()->filter(...)},
 * {@code $query->get()->whereIn(...)}.
 */
public class PhpSideFilteringAnalyzer extends AbstractFileAnalyzer {

    public static final String ID = "php-side-filtering";
    public static final String CODE = "php-side-filtering";

    private static final AnalyzerMetadata METADATA = new AnalyzerMetadata(
            ID,
            "PHP-Side Collection Filtering Analyzer",
            "Detects filter(), reject(), whereIn(), and whereNotIn() usage after database fetch",
            Category.BEST_PRACTICES,
            Severity.CRITICAL);

    private static final Set<String> FETCHES = Set.of("all", "get");
    private static final Set<String> PAGED_FETCHES = Set.of(
            "get", "all", "paginate", "simplePaginate", "cursorPaginate", "cursor", "pluck", "findMany");
    private static final Set<String> FILTERS = Set.of("filter", "reject", "whereIn", "whereNotIn");

    private static final Set<String> EXCLUDED_PROPERTIES = Set.of(
            "id", "name", "title", "status", "type", "data", "value", "key", "config", "options", "settings",
            "attributes", "service", "client", "http", "response", "request", "cache", "session", "connection",
            "driver", "handler", "manager", "factory", "builder", "query", "result", "output", "input", "error",
            "message", "content", "body", "headers", "params", "args", "context", "container", "app", "instance",
            "logger", "validator");
    private static final Set<String> RELATIONSHIP_TERMS = Set.of(
            "parent", "owner", "children", "author", "creator", "members", "followers", "following", "friends",
            "roles", "permissions", "tags", "categories", "items", "entries", "records");
    private static final Set<String> NON_PLURAL_ENDINGS = Set.of(
            "status", "class", "address", "access", "process", "success", "progress");

    private static final Map<String, String> ADVICE = new LinkedHashMap<>();

    static {
        ADVICE.put("filter", "Replace filter() with where() clauses before get()/all() to filter at database level.");
        ADVICE.put("reject", "Replace reject() with where() or whereNot() clauses before get()/all() to filter at "
                + "database level.");
        ADVICE.put("whereIn", "Move whereIn() into the query builder before get()/all().");
        ADVICE.put("whereNotIn", "Move whereNotIn() into the query builder before get()/all().");
    }

    private final List<String> whitelist;

    public PhpSideFilteringAnalyzer(AnalyzerOptions options) {
        super(options);
        this.whitelist = options.getStringList("whitelist", List.of());
    }

    @Override
    public AnalyzerMetadata getMetadata() {
        return METADATA;
    }

    @Override
    protected List<Issue> analyzeFile(FileContext context) {
        for (String fragment : whitelist) {
            if (context.relativePath().contains(fragment)) return List.of();
        }
        List<Issue> issues = new ArrayList<>();
        for (SyntaxNode call : context.tree().root().findAll(PhpNodes.METHOD_CALLS)) {
            if (!PhpNodes.isChainTop(call)) continue;
            MethodChain chain = PhpNodes.chain(call);
            List<String> names = chain.names();
            String filter = filterAfterFetch(names);
            if (filter == null || !isEloquentSource(chain, names)) continue;

            String pattern = String.join("->", names);
            issues.add(issue(context, CODE, Severity.CRITICAL, call.startLine(),
                    "Filtering data in PHP instead of database: " + pattern)
                    .withRecommendation(ADVICE.get(filter) + " The pattern \"" + pattern + "\" loads every row into "
                            + "memory before filtering.")
                    .withMetadata("chain", pattern));
        }
        return issues;
    }

    /** The filter method directly following a full fetch, or null. */
    private static String filterAfterFetch(List<String> names) {
        for (int i = 0; i + 1 < names.size(); i++) {
            if (FETCHES.contains(names.get(i)) && FILTERS.contains(names.get(i + 1))) return names.get(i + 1);
        }
        return null;
    }

    private static boolean isEloquentSource(MethodChain chain, List<String> names) {
        if (chain.isStatic()) return looksLikeModel(chain.staticClass());
        SyntaxNode root = chain.root();
        if (root == null || PhpNodes.isFunctionCall(root)) return false;
        if (PhpNodes.isPropertyAccess(root)) {
            SyntaxNode name = root.child("name");
            return name != null && looksLikeRelationship(name.text());
        }
        if (PhpNodes.variableName(root) != null) {
            boolean fetch = false;
            boolean filter = false;
            for (String name : names) {
                fetch |= PAGED_FETCHES.contains(name);
                filter |= FILTERS.contains(name);
            }
            return fetch && filter;
        }
        return false;
    }

    private static boolean looksLikeModel(String className) {
        if (className == null) return false;
        String shortName = PhpNodes.shortName(className);
        if (LaravelVocabulary.NON_MODEL_CLASSES.contains(shortName)) return false;
        if (!className.equals(shortName)) {
            String namespace = className.substring(0, className.length() - shortName.length() - 1);
            return namespace.startsWith("App\\Model") || namespace.contains("\\Models");
        }
        return !shortName.isEmpty() && Character.isUpperCase(shortName.charAt(0));
    }

    private static boolean looksLikeRelationship(String name) {
        if (EXCLUDED_PROPERTIES.contains(name)) return false;
        if (RELATIONSHIP_TERMS.contains(name)) return true;
        if (name.length() > 4 && name.endsWith("ies")) return true;
        return name.length() > 3 && name.endsWith("s") && !name.endsWith("ss") && !NON_PLURAL_ENDINGS.contains(name);
    }
}
