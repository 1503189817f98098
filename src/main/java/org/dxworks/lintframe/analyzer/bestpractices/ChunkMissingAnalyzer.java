package org.dxworks.lintframe.analyzer.bestpractices;

import org.dxworks.lintframe.analyzer.AbstractFileAnalyzer;
import org.dxworks.lintframe.analyzer.AnalyzerOptions;
import org.dxworks.lintframe.analyzer.FileContext;
import org.dxworks.lintframe.analyzer.support.ProvenanceResolver;
import org.dxworks.lintframe.analyzer.support.ProvenanceTrackingVisitor;
import org.dxworks.lintframe.model.AnalyzerMetadata;
import org.dxworks.lintframe.model.Category;
import org.dxworks.lintframe.model.Issue;
import org.dxworks.lintframe.model.Severity;
import org.dxworks.lintframe.scope.Provenance;
import org.dxworks.lintframe.scope.ScopeTracker;
import org.dxworks.lintframe.syntax.MethodChain;
import org.dxworks.lintframe.syntax.PhpNodes;
import org.dxworks.lintframe.syntax.SyntaxNode;
import org.dxworks.lintframe.syntax.SyntaxTree;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Loops over {@code Model::all()} or {@code ->get()} results that load a whole table into memory.
 */
public class ChunkMissingAnalyzer extends AbstractFileAnalyzer {

    public static final String ID = "chunk-missing";
    public static final String CODE = "chunk-missing";

    private static final AnalyzerMetadata METADATA = new AnalyzerMetadata(
            ID,
            "Missing Chunk Analyzer",
            "Detects queries on large datasets without chunk() or cursor() for memory efficiency",
            Category.BEST_PRACTICES,
            Severity.HIGH);

    private static final Set<String> SAFE_METHODS = Set.of(
            "chunk", "chunkById", "cursor", "lazy", "lazyById", "paginate", "simplePaginate", "cursorPaginate");

    private static final Set<String> SMALL_DATASET_METHODS = Set.of(
            "limit", "take", "first", "firstOrFail", "firstWhere", "find", "findOrFail", "findOr", "sole",
            "soleOrFail", "value");

    public ChunkMissingAnalyzer(AnalyzerOptions options) {
        super(options);
    }

    @Override
    public AnalyzerMetadata getMetadata() {
        return METADATA;
    }

    @Override
    protected List<Issue> analyzeFile(FileContext context) {
        Visitor visitor = new Visitor(context, new ProvenanceResolver(context.registry(), true));
        context.walk(visitor);
        return visitor.issues;
    }

    private final class Visitor extends ProvenanceTrackingVisitor {
        private final FileContext context;
        private final List<Issue> issues = new ArrayList<>();
        // variable -> rendered fetch chain, one table per function body
        private final Deque<Map<String, String>> fetchedVariables = new ArrayDeque<>();

        Visitor(FileContext context, ProvenanceResolver resolver) {
            super(resolver);
            this.context = context;
        }

        @Override
        public void beforeTraverse(SyntaxTree tree, ScopeTracker scope) {
            fetchedVariables.push(new HashMap<>());
        }

        @Override
        public void enterNode(SyntaxNode node, ScopeTracker scope) {
            super.enterNode(node, scope);
            if (node.is(PhpNodes.FUNCTIONS) || PhpNodes.isClosure(node)) {
                fetchedVariables.push(new HashMap<>());
            } else if (node.is("assignment_expression")) {
                trackAssignment(node, scope);
            } else if (node.is("foreach_statement")) {
                checkLoop(node, scope);
            }
        }

        @Override
        public void leaveNode(SyntaxNode node, ScopeTracker scope) {
            if (node.is(PhpNodes.FUNCTIONS) || PhpNodes.isClosure(node)) fetchedVariables.pop();
        }

        private void trackAssignment(SyntaxNode assignment, ScopeTracker scope) {
            String variable = PhpNodes.variableName(assignment.child("left"));
            if (variable == null) return;
            String fetch = unboundedFetch(assignment.child("right"), scope);
            if (fetch != null) {
                fetchedVariables.peek().put(variable, fetch);
            } else {
                fetchedVariables.peek().remove(variable);
            }
        }

        private void checkLoop(SyntaxNode loop, ScopeTracker scope) {
            SyntaxNode source = ProvenanceTrackingVisitor.foreachSource(loop);
            String direct = unboundedFetch(source, scope);
            if (direct != null) {
                issues.add(issue(context, CODE, Severity.HIGH, loop.startLine(),
                        "Looping over ->all() or ->get() without chunk() can cause memory issues on large datasets")
                        .withRecommendation("Use Model::chunk(200, function ($records) { ... }) or Model::cursor() for "
                                + "memory-efficient iteration. chunk() processes records in batches, cursor() uses a generator.")
                        .withMetadata("query", direct));
                return;
            }
            String variable = PhpNodes.variableName(source);
            String assigned = variable == null ? null : fetchedVariables.peek().get(variable);
            if (assigned != null) {
                issues.add(issue(context, CODE, Severity.HIGH, loop.startLine(),
                        "Looping over a variable assigned with ->all() or ->get() can cause memory issues on large datasets")
                        .withRecommendation("Use Model::chunk(200, function ($records) { ... }) or Model::cursor() for "
                                + "memory-efficient iteration. Alternatively, use Model::lazy() which returns a generator.")
                        .withMetadata("query", assigned)
                        .withMetadata("variable", "$" + variable));
            }
        }

        /** Rendered chain when the expression fetches every matching row, else null. */
        private String unboundedFetch(SyntaxNode expression, ScopeTracker scope) {
            if (!PhpNodes.isMethodCall(expression) && !PhpNodes.isStaticCall(expression)) return null;
            MethodChain chain = PhpNodes.chain(expression);
            if (!chain.contains("all", "get")) return null;
            for (String name : chain.names()) {
                if (SAFE_METHODS.contains(name) || SMALL_DATASET_METHODS.contains(name)) return null;
            }
            if (chain.isStatic()) {
                return resolver.modelFor(chain.staticClass(), scope).isPresent() ? chain.render() : null;
            }
            String variable = chain.rootVariable();
            if (variable == null) return null;
            Provenance provenance = scope.lookup(variable);
            return provenance.kind() == Provenance.Kind.ELOQUENT_BUILDER ? chain.render() : null;
        }
    }
}
