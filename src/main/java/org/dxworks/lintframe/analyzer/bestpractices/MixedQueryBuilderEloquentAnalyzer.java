package org.dxworks.lintframe.analyzer.bestpractices;

import org.dxworks.lintframe.analyzer.AbstractFileAnalyzer;
import org.dxworks.lintframe.analyzer.AnalyzerOptions;
import org.dxworks.lintframe.analyzer.FileContext;
import org.dxworks.lintframe.analyzer.support.LaravelVocabulary;
import org.dxworks.lintframe.analyzer.support.ProvenanceResolver;
import org.dxworks.lintframe.analyzer.support.ProvenanceTrackingVisitor;
import org.dxworks.lintframe.analyzer.support.WildcardPattern;
import org.dxworks.lintframe.model.AnalyzerMetadata;
import org.dxworks.lintframe.model.Category;
import org.dxworks.lintframe.model.Issue;
import org.dxworks.lintframe.model.Severity;
import org.dxworks.lintframe.registry.ModelRegistry;
import org.dxworks.lintframe.scope.Provenance;
import org.dxworks.lintframe.scope.ScopeTracker;
import org.dxworks.lintframe.syntax.MethodChain;
import org.dxworks.lintframe.syntax.PhpNodes;
import org.dxworks.lintframe.syntax.SyntaxNode;
import org.dxworks.lintframe.syntax.SyntaxTree;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Classes that reach the same table through both Eloquent and the query builder, or that lean on
 * the query builder for many tables that already have models.
 */
public class MixedQueryBuilderEloquentAnalyzer extends AbstractFileAnalyzer {

    public static final String ID = "mixed-query-builder-eloquent";
    public static final String CODE_SAME_TABLE = "mixed-same-table";
    public static final String CODE_SIGNIFICANT = "mixed-significant";

    private static final AnalyzerMetadata METADATA = new AnalyzerMetadata(
            ID,
            "Mixed Query Builder and Eloquent Analyzer",
            "Detects classes that access the same tables through both Eloquent and the query builder",
            Category.BEST_PRACTICES,
            Severity.MEDIUM);

    /** Instance methods that query or persist, as opposed to relationship accessors. */
    private static final Set<String> MODEL_INSTANCE_METHODS = Set.of(
            "save", "update", "delete", "forceDelete", "restore", "fresh", "refresh", "push", "touch",
            "increment", "decrement", "replicate", "load", "loadMissing", "loadCount");

    private static final String[] TO_BASE = {"toBase", "getQuery"};

    private final int threshold;
    private final boolean countToBaseAsQueryBuilder;
    private final WildcardPattern whitelist;

    public MixedQueryBuilderEloquentAnalyzer(AnalyzerOptions options) {
        super(options);
        this.threshold = options.getNonNegativeInt("threshold", 2);
        this.countToBaseAsQueryBuilder = options.getBoolean("count_to_base_as_query_builder", true);
        this.whitelist = new WildcardPattern(options.getStringList("whitelist", List.of()));
    }

    @Override
    public AnalyzerMetadata getMetadata() {
        return METADATA;
    }

    @Override
    protected List<Issue> analyzeFile(FileContext context) {
        Visitor visitor = new Visitor(context, new ProvenanceResolver(context.registry(), false));
        context.walk(visitor);
        return visitor.issues;
    }

    /** Tables touched by one class, with the first line of each usage. */
    private static final class UnitUsage {
        final String name;
        final String fqcn;
        final SyntaxNode node;
        final Map<String, Integer> eloquentTables = new TreeMap<>();
        final Map<String, Integer> queryBuilderTables = new TreeMap<>();

        UnitUsage(String name, String fqcn, SyntaxNode node) {
            this.name = name;
            this.fqcn = fqcn;
            this.node = node;
        }
    }

    private final class Visitor extends ProvenanceTrackingVisitor {
        private final FileContext context;
        private final List<Issue> issues = new ArrayList<>();
        private final Deque<UnitUsage> units = new ArrayDeque<>();

        Visitor(FileContext context, ProvenanceResolver resolver) {
            super(resolver);
            this.context = context;
        }

        @Override
        public void beforeTraverse(SyntaxTree tree, ScopeTracker scope) {
            String fileName = context.file().fileName();
            String unitName = fileName.endsWith(".php") ? fileName.substring(0, fileName.length() - 4) : fileName;
            units.push(new UnitUsage(unitName, null, tree.root()));
        }

        @Override
        public void enterNode(SyntaxNode node, ScopeTracker scope) {
            super.enterNode(node, scope);
            if (node.is("class_declaration")) {
                units.push(new UnitUsage(scope.currentClassName(), scope.currentClassFqcn(), node));
            } else if (PhpNodes.isAnonymousClass(node)) {
                units.push(new UnitUsage("class@anonymous", null, node));
            } else if ((PhpNodes.isMethodCall(node) || PhpNodes.isStaticCall(node)) && PhpNodes.isChainTop(node)) {
                recordChain(PhpNodes.chain(node), node.startLine(), scope);
            }
        }

        @Override
        public void leaveNode(SyntaxNode node, ScopeTracker scope) {
            if (units.size() > 1 && units.peek().node == node) {
                report(units.pop());
            }
        }

        @Override
        public void afterTraverse(SyntaxTree tree, ScopeTracker scope) {
            while (!units.isEmpty()) report(units.pop());
        }

        private void recordChain(MethodChain chain, int line, ScopeTracker scope) {
            ModelRegistry registry = resolver.registry();
            if (chain.isStatic()) {
                String cls = chain.staticClass();
                if (cls == null) return;
                if (LaravelVocabulary.isDbFacade(cls)) {
                    String table = ProvenanceResolver.dbTable(chain);
                    if (table != null) record(units.peek().queryBuilderTables, table, line);
                    return;
                }
                Optional<String> model = resolver.modelFor(cls, scope);
                if (model.isEmpty()) return;
                registry.resolveTable(model.get()).ifPresent(table -> recordModelChain(chain, table, line));
                return;
            }

            String variable = chain.rootVariable();
            if (variable == null || "this".equals(variable)) return;
            Provenance provenance = scope.lookup(variable);
            switch (provenance.kind()) {
                case QUERY_BUILDER -> provenance.table().ifPresent(t -> record(units.peek().queryBuilderTables, t, line));
                case ELOQUENT_BUILDER -> resolver.tableOf(provenance).ifPresent(t -> recordModelChain(chain, t, line));
                case MODEL_CLASS -> {
                    MethodChain.Link first = chain.first();
                    if (first != null && MODEL_INSTANCE_METHODS.contains(first.name)) {
                        resolver.tableOf(provenance).ifPresent(t -> record(units.peek().eloquentTables, t, line));
                    }
                }
                default -> {
                }
            }
        }

        private void recordModelChain(MethodChain chain, String table, int line) {
            if (countToBaseAsQueryBuilder && chain.contains(TO_BASE)) {
                record(units.peek().queryBuilderTables, table, line);
            } else {
                record(units.peek().eloquentTables, table, line);
            }
        }

        private void record(Map<String, Integer> tables, String table, int line) {
            tables.merge(table, line, Math::min);
        }

        private void report(UnitUsage unit) {
            if (unit.eloquentTables.isEmpty() || unit.queryBuilderTables.isEmpty()) return;
            if (whitelist.matchesClass(unit.name, unit.fqcn)) return;

            for (Map.Entry<String, Integer> entry : unit.queryBuilderTables.entrySet()) {
                String table = entry.getKey();
                if (!unit.eloquentTables.containsKey(table)) continue;
                issues.add(issue(context, CODE_SAME_TABLE, Severity.HIGH, entry.getValue(),
                        String.format("Class \"%s\" uses both Eloquent and Query Builder for table \"%s\"", unit.name, table))
                        .withRecommendation("Pick one data access style for \"" + table + "\". Use the Eloquent model "
                                + "consistently, or isolate raw query builder access in a repository.")
                        .withMetadata("class", unit.name)
                        .withMetadata("table", table)
                        .withMetadata("eloquent_line", unit.eloquentTables.get(table))
                        .withMetadata("query_builder_line", entry.getValue()));
            }

            Set<String> modelledTables = new TreeSet<>();
            for (String table : unit.queryBuilderTables.keySet()) {
                if (resolver.registry().hasModelForTable(table)) modelledTables.add(table);
            }
            if (modelledTables.size() > threshold) {
                int line = Integer.MAX_VALUE;
                for (String table : modelledTables) line = Math.min(line, unit.queryBuilderTables.get(table));
                issues.add(issue(context, CODE_SIGNIFICANT, Severity.LOW, line,
                        String.format("Class \"%s\" uses Query Builder for %d tables that have Eloquent models",
                                unit.name, modelledTables.size()))
                        .withRecommendation("Tables " + String.join(", ", modelledTables)
                                + " have models; prefer the models over DB::table() for them.")
                        .withMetadata("class", unit.name)
                        .withMetadata("tables", new ArrayList<>(modelledTables))
                        .withMetadata("threshold", threshold));
            }
        }
    }
}
