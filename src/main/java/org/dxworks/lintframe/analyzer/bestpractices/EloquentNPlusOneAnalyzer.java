package org.dxworks.lintframe.analyzer.bestpractices;

import org.dxworks.lintframe.analyzer.AbstractFileAnalyzer;
import org.dxworks.lintframe.analyzer.AnalyzerOptions;
import org.dxworks.lintframe.analyzer.FileContext;
import org.dxworks.lintframe.analyzer.support.LaravelVocabulary;
import org.dxworks.lintframe.analyzer.support.ProvenanceResolver;
import org.dxworks.lintframe.analyzer.support.ProvenanceTrackingVisitor;
import org.dxworks.lintframe.model.AnalyzerMetadata;
import org.dxworks.lintframe.model.Category;
import org.dxworks.lintframe.model.Issue;
import org.dxworks.lintframe.model.Severity;
import org.dxworks.lintframe.scope.EagerLoadSet;
import org.dxworks.lintframe.scope.Provenance;
import org.dxworks.lintframe.scope.ScopeTracker;
import org.dxworks.lintframe.syntax.MethodChain;
import org.dxworks.lintframe.syntax.PhpNodes;
import org.dxworks.lintframe.syntax.SyntaxNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Relationship access and queries inside loops.
 * <p>
 * Only {@code foreach} binds an element variable to a collection, so relationship tracking is
 * limited to it; {@code for}, {@code while} and {@code do} loops are still checked for queries in
 * their bodies.
 */
public class EloquentNPlusOneAnalyzer extends AbstractFileAnalyzer {

    public static final String ID = "eloquent-n-plus-one";
    public static final String CODE_RELATIONSHIP = "n-plus-one-relationship";
    public static final String CODE_QUERY_IN_LOOP = "query-in-loop";

    private static final AnalyzerMetadata METADATA = new AnalyzerMetadata(
            ID,
            "Eloquent N+1 Query Analyzer",
            "Detects lazy-loaded relationships and queries executed once per loop iteration",
            Category.PERFORMANCE,
            Severity.HIGH);

    static final List<String> DEFAULT_ATTRIBUTE_NAMES = List.of(
            "id", "uuid", "name", "title", "slug", "email", "password", "remember_token", "username",
            "first_name", "last_name", "full_name", "phone", "address", "city", "country", "zip",
            "description", "content", "body", "text", "summary", "excerpt", "subject", "message",
            "note", "notes", "label", "status", "state", "type", "kind", "code", "key", "value",
            "token", "price", "amount", "total", "quantity", "count", "score", "rating", "level",
            "order", "position", "sort", "rank", "active", "enabled", "visible", "published",
            "created_at", "updated_at", "deleted_at", "published_at", "email_verified_at",
            "date", "time", "year", "month", "day", "url", "path", "image", "avatar", "photo",
            "color", "size", "weight", "age", "gender", "bio", "locale", "currency", "data", "meta",
            "settings", "options", "attributes", "original", "pivot", "exists", "incrementing",
            "timestamps", "wasRecentlyCreated", "ip_address", "user_agent"
    );

    private static final Set<String> TRACKED_TERMINALS = Set.of(
            "all", "get", "cursor", "lazy", "paginate", "simplePaginate", "cursorPaginate");

    private static final Set<String> RELATION_QUERY_METHODS = Set.of(
            "where", "whereIn", "whereHas", "whereNotNull", "whereNull", "orderBy", "latest", "oldest",
            "get", "first", "firstWhere", "find", "count", "exists", "doesntExist", "pluck", "sum",
            "avg", "max", "min", "value", "paginate", "limit", "take");

    private final Set<String> attributeNames;

    public EloquentNPlusOneAnalyzer(AnalyzerOptions options) {
        super(options);
        this.attributeNames = new HashSet<>(options.getStringListAdding("attribute_names", DEFAULT_ATTRIBUTE_NAMES));
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

    boolean isAttribute(String segment) {
        if (attributeNames.contains(segment)) return true;
        return segment.endsWith("_id") || segment.endsWith("_at") || segment.endsWith("_count")
                || segment.startsWith("is_") || segment.startsWith("has_");
    }

    private static final class LoopFrame {
        final SyntaxNode node;
        final String loopType;
        final SyntaxNode body;
        final String variable;
        final EagerLoadSet eagerLoads;
        final Set<String> reported = new HashSet<>();
        final Set<String> guarded = new HashSet<>();
        final Set<Integer> queryLines = new HashSet<>();

        LoopFrame(SyntaxNode node, String loopType, String variable, EagerLoadSet eagerLoads) {
            this.node = node;
            this.loopType = loopType;
            this.body = PhpNodes.body(node);
            this.variable = variable;
            this.eagerLoads = eagerLoads;
        }

        boolean tracksRelationships() {
            return variable != null && eagerLoads != null;
        }

        boolean inBody(SyntaxNode n) {
            return body != null && n.isWithin(body);
        }
    }

    private final class Visitor extends ProvenanceTrackingVisitor {
        private final FileContext context;
        private final List<Issue> issues = new ArrayList<>();
        private final Deque<LoopFrame> loops = new ArrayDeque<>();

        Visitor(FileContext context, ProvenanceResolver resolver) {
            super(resolver);
            this.context = context;
        }

        @Override
        public void enterNode(SyntaxNode node, ScopeTracker scope) {
            super.enterNode(node, scope);
            if (PhpNodes.isLoop(node)) {
                loops.push(newFrame(node, scope));
                return;
            }
            if (loops.isEmpty()) return;
            if (PhpNodes.isPropertyAccess(node) && isOutermostAccess(node)) {
                checkRelationshipAccess(node);
            } else if (PhpNodes.isMethodCall(node)) {
                checkGuard(node);
                checkQueryInLoop(node, scope);
            } else if (PhpNodes.isStaticCall(node)) {
                checkQueryInLoop(node, scope);
            }
        }

        @Override
        public void leaveNode(SyntaxNode node, ScopeTracker scope) {
            if (!loops.isEmpty() && loops.peek().node == node) loops.pop();
        }

        private LoopFrame newFrame(SyntaxNode loop, ScopeTracker scope) {
            String loopType = switch (loop.kind()) {
                case "foreach_statement" -> "foreach";
                case "for_statement" -> "for";
                case "while_statement" -> "while";
                default -> "do-while";
            };
            if (!loop.is("foreach_statement")) return new LoopFrame(loop, loopType, null, null);
            String variable = ProvenanceTrackingVisitor.foreachValueVariable(loop);
            return new LoopFrame(loop, loopType, variable, trackedEagerLoads(ProvenanceTrackingVisitor.foreachSource(loop), scope));
        }

        /** Eager loads of an iterated source that is known to be a model collection, else null. */
        private EagerLoadSet trackedEagerLoads(SyntaxNode source, ScopeTracker scope) {
            if (source == null) return null;
            if (PhpNodes.isMethodCall(source) || PhpNodes.isStaticCall(source)) {
                MethodChain chain = PhpNodes.chain(source);
                if (chain.last() == null || !TRACKED_TERMINALS.contains(chain.last().name)) return null;
                Provenance provenance = resolver.resolveChain(chain, scope);
                return provenance.kind() == Provenance.Kind.MODEL_CLASS ? provenance.eagerLoads() : null;
            }
            String variable = PhpNodes.variableName(source);
            if (variable != null) {
                Provenance provenance = scope.lookup(variable);
                return provenance.kind() == Provenance.Kind.MODEL_CLASS ? provenance.eagerLoads() : null;
            }
            if (PhpNodes.isPropertyAccess(source)) {
                List<String> path = PhpNodes.propertyPath(source);
                String root = PhpNodes.variableName(PhpNodes.propertyRoot(source));
                LoopFrame outer = frameFor(root, source);
                if (outer == null || path.isEmpty()) return null;
                EagerLoadSet nested = outer.eagerLoads;
                for (String segment : path) nested = nested.nested(segment);
                return nested;
            }
            return null;
        }

        private LoopFrame frameFor(String variable, SyntaxNode node) {
            if (variable == null) return null;
            for (LoopFrame frame : loops) {
                if (frame.tracksRelationships() && variable.equals(frame.variable) && frame.inBody(node)) {
                    return frame;
                }
            }
            return null;
        }

        private LoopFrame innermostLoopContaining(SyntaxNode node) {
            for (LoopFrame frame : loops) {
                if (frame.inBody(node)) return frame;
            }
            return null;
        }

        private boolean isOutermostAccess(SyntaxNode access) {
            SyntaxNode parent = access.parent();
            return parent == null || !PhpNodes.isPropertyAccess(parent) || PhpNodes.receiver(parent) != access;
        }

        private void checkRelationshipAccess(SyntaxNode access) {
            List<String> segments = new ArrayList<>(PhpNodes.propertyPath(access));
            if (segments.isEmpty()) return;
            String root = PhpNodes.variableName(PhpNodes.propertyRoot(access));
            LoopFrame frame = frameFor(root, access);
            if (frame == null) return;

            // the last segment of a longer chain, or an assignment target, is a value
            SyntaxNode parent = access.parent();
            boolean assigned = parent != null && parent.is("assignment_expression", "augmented_assignment_expression")
                    && "left".equals(access.field());
            if (assigned || segments.size() >= 2) {
                segments.remove(segments.size() - 1);
            }

            List<String> relations = new ArrayList<>();
            for (String segment : segments) {
                if (isAttribute(segment)) break;
                relations.add(segment);
            }
            if (relations.isEmpty()) return;

            String path = String.join(".", relations);
            if (frame.eagerLoads.covers(path) || isGuarded(root, path)) return;
            if (!frame.reported.add(path)) return;

            issues.add(issue(context, CODE_RELATIONSHIP, Severity.HIGH, access,
                    "Potential N+1 query: accessing '" + path + "' inside loop")
                    .withRecommendation("Accessing the '" + path + "' relationship inside a " + frame.loopType
                            + " will trigger a separate database query for each iteration, causing an N+1 query problem. "
                            + "Eager load it with ->with('" + path + "') before the loop or ->load('" + path + "') on the collection.")
                    .withMetadata("relationship", path)
                    .withMetadata("variable", "$" + frame.variable)
                    .withMetadata("loop_type", frame.loopType));
        }

        /** A guard holds for the rest of the loop it is written in, including loops nested below it. */
        private void checkGuard(SyntaxNode call) {
            if (!"relationLoaded".equals(PhpNodes.callName(call))) return;
            String variable = PhpNodes.variableName(PhpNodes.receiver(call));
            if (frameFor(variable, call) == null) return;
            LoopFrame frame = innermostLoopContaining(call);
            String relation = PhpNodes.stringValue(PhpNodes.argument(call, 0));
            if (frame != null && relation != null) frame.guarded.add(guardKey(variable, relation));
        }

        private boolean isGuarded(String variable, String path) {
            for (LoopFrame frame : loops) {
                if (frame.guarded.contains(guardKey(variable, path))) return true;
            }
            return false;
        }

        private String guardKey(String variable, String relation) {
            return variable + "->" + relation;
        }

        private void checkQueryInLoop(SyntaxNode call, ScopeTracker scope) {
            if (!PhpNodes.isChainTop(call)) return;
            LoopFrame frame = innermostLoopContaining(call);
            if (frame == null) return;
            MethodChain chain = PhpNodes.chain(call);
            MethodChain.Link first = chain.first();
            if (first == null || first.name == null) return;

            String description = null;
            if (chain.isStatic()) {
                String cls = chain.staticClass();
                if (LaravelVocabulary.isDbFacade(cls)) {
                    if (Set.of("table", "select", "selectOne").contains(first.name)) description = chain.render();
                } else if (LaravelVocabulary.MODEL_QUERY_METHODS.contains(first.name)
                        && resolver.modelFor(cls, scope).isPresent()) {
                    description = chain.render();
                }
            } else if (chain.links().size() >= 2 && RELATION_QUERY_METHODS.contains(chain.links().get(1).name)) {
                String variable = chain.rootVariable();
                if (frameFor(variable, call) != null && !isAttribute(first.name)) {
                    description = chain.render();
                }
            }
            if (description == null || !frame.queryLines.add(call.startLine())) return;

            issues.add(issue(context, CODE_QUERY_IN_LOOP, Severity.HIGH, call,
                    "Query executed inside " + frame.loopType + " loop: " + description)
                    .withRecommendation("Move the query out of the loop: load the data once before iterating "
                            + "(eager loading, whereIn on collected keys, or a keyed lookup).")
                    .withMetadata("query", description)
                    .withMetadata("loop_type", frame.loopType));
        }
    }
}
