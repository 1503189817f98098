package org.dxworks.lintframe.analyzer.bestpractices;

import org.dxworks.lintframe.analyzer.AbstractFileAnalyzer;
import org.dxworks.lintframe.analyzer.AnalyzerOptions;
import org.dxworks.lintframe.analyzer.FileContext;
import org.dxworks.lintframe.analyzer.support.LaravelVocabulary;
import org.dxworks.lintframe.analyzer.support.ProvenanceResolver;
import org.dxworks.lintframe.analyzer.support.ProvenanceTrackingVisitor;
import org.dxworks.lintframe.analyzer.support.WriteOperationSite;
import org.dxworks.lintframe.model.AnalyzerMetadata;
import org.dxworks.lintframe.model.Category;
import org.dxworks.lintframe.model.Issue;
import org.dxworks.lintframe.model.Severity;
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
 * Methods performing several database writes that are not wrapped in a transaction.
 * <p>
 * A write is protected when it runs inside the closure handed directly to
 * {@code DB::transaction()}, or lexically between {@code DB::beginTransaction()} and
 * {@code DB::commit()}/{@code DB::rollBack()} in the same method.
 */
public class MissingDatabaseTransactionsAnalyzer extends AbstractFileAnalyzer {

    public static final String ID = "missing-database-transactions";
    public static final String CODE = "missing-transaction";

    private static final AnalyzerMetadata METADATA = new AnalyzerMetadata(
            ID,
            "Missing Database Transactions Analyzer",
            "Detects methods with multiple database writes that are not wrapped in a transaction",
            Category.RELIABILITY,
            Severity.HIGH);

    private static final List<String> DEFAULT_EXCLUDED = List.of(
            "tests/", "Tests/", "database/seeders/", "database/factories/", "database/migrations/",
            "**/*Test.php", "**/*Seeder.php", "**/*Factory.php");

    private static final Set<String> DB_WRITE_METHODS = Set.of(
            "insert", "update", "delete", "statement", "affectingStatement", "unprepared");

    private static final List<String> STATIC_MODEL_WRITES = List.of(
            "create", "forceCreate", "insert", "insertGetId", "insertOrIgnore", "upsert", "updateOrCreate",
            "updateOrInsert", "firstOrCreate", "destroy", "truncate");

    private static final List<String> INSTANCE_WRITES = List.of(
            "save", "saveQuietly", "update", "updateQuietly", "delete", "deleteQuietly", "forceDelete",
            "restore", "touch", "insert", "insertGetId", "insertOrIgnore", "upsert", "increment", "decrement",
            "create", "createMany", "updateOrCreate", "updateOrInsert", "firstOrCreate", "attach", "detach", "sync",
            "syncWithoutDetaching", "toggle", "updateExistingPivot", "associate", "dissociate", "saveMany");

    private static final Set<String> TRANSACTION_OPEN = Set.of("beginTransaction");
    private static final Set<String> TRANSACTION_CLOSE = Set.of("commit", "rollBack", "rollback");

    /** Words in a receiver name that mark a non-relational store. */
    private static final Set<String> NON_DURABLE_WORDS = Set.of(
            "cache", "session", "redis", "storage", "disk", "filesystem", "file", "files", "queue",
            "cookie", "cookies", "log", "logger", "lock", "limiter", "ratelimiter");

    private static final Set<String> NON_DURABLE_HELPERS = Set.of(
            "cache", "session", "cookie", "logger", "storage_path", "collect", "response", "redis");

    private final int threshold;
    private final Set<String> staticWrites;
    private final Set<String> instanceWrites;

    public MissingDatabaseTransactionsAnalyzer(AnalyzerOptions options) {
        super(options);
        this.threshold = options.getPositiveInt("threshold", 2);
        List<String> additional = options.getStringList("additional_write_methods", List.of());
        this.staticWrites = new HashSet<>(STATIC_MODEL_WRITES);
        this.staticWrites.addAll(additional);
        this.instanceWrites = new HashSet<>(INSTANCE_WRITES);
        this.instanceWrites.addAll(additional);
    }

    @Override
    protected List<String> defaultExcludedPaths() {
        return DEFAULT_EXCLUDED;
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

    private static final class MethodState {
        final SyntaxNode node;
        final String className;
        final String methodName;
        final List<WriteOperationSite> writes = new ArrayList<>();
        int explicitDepth;

        MethodState(SyntaxNode node, String className, String methodName) {
            this.node = node;
            this.className = className;
            this.methodName = methodName;
        }
    }

    private final class Visitor extends ProvenanceTrackingVisitor {
        private final FileContext context;
        private final List<Issue> issues = new ArrayList<>();
        private final Deque<MethodState> methods = new ArrayDeque<>();

        Visitor(FileContext context, ProvenanceResolver resolver) {
            super(resolver);
            this.context = context;
        }

        @Override
        public void enterNode(SyntaxNode node, ScopeTracker scope) {
            super.enterNode(node, scope);
            if (node.is(PhpNodes.FUNCTIONS)) {
                String className = node.is("method_declaration")
                        ? (scope.currentClassName() != null ? scope.currentClassName() : "class@anonymous")
                        : null;
                methods.push(new MethodState(node, className, PhpNodes.declarationName(node)));
                return;
            }
            if (PhpNodes.isClosure(node)) {
                if (isTransactionCallback(node)) scope.markContext(Provenance.TRANSACTION_PROTECTED);
                return;
            }
            if (methods.isEmpty() || !(PhpNodes.isMethodCall(node) || PhpNodes.isStaticCall(node))) return;

            MethodState state = methods.peek();
            String name = PhpNodes.callName(node);
            if (name == null) return;
            if (isDbFacadeCall(node)) {
                if (TRANSACTION_OPEN.contains(name)) {
                    state.explicitDepth++;
                    return;
                }
                if (TRANSACTION_CLOSE.contains(name)) {
                    state.explicitDepth = Math.max(0, state.explicitDepth - 1);
                    return;
                }
            }
            if (isWrite(node, name, scope)) {
                boolean protectedWrite = state.explicitDepth > 0
                        || scope.hasContext(Provenance.Kind.TRANSACTION_PROTECTED);
                state.writes.add(new WriteOperationSite(node.startLine(), name, protectedWrite, node));
            }
        }

        @Override
        public void leaveNode(SyntaxNode node, ScopeTracker scope) {
            if (!methods.isEmpty() && methods.peek().node == node) {
                report(methods.pop());
            }
        }

        /** The closure is the first argument of DB::transaction() or DB::connection()->transaction(). */
        private boolean isTransactionCallback(SyntaxNode closure) {
            SyntaxNode parent = closure.parent();
            if (parent != null && parent.is("argument")) parent = parent.parent();
            if (parent == null || !parent.is("arguments")) return false;
            SyntaxNode call = parent.parent();
            if (!"transaction".equals(PhpNodes.callName(call))) return false;
            if (PhpNodes.argument(call, 0) != closure) return false;
            return isDbFacadeCall(call);
        }

        private boolean isDbFacadeCall(SyntaxNode call) {
            MethodChain chain = PhpNodes.chain(call);
            return chain.isStatic() && LaravelVocabulary.isDbFacade(chain.staticClass());
        }

        private boolean isWrite(SyntaxNode call, String name, ScopeTracker scope) {
            if (PhpNodes.isStaticCall(call)) {
                String cls = PhpNodes.scopeName(call);
                if (cls == null) return false;
                if (LaravelVocabulary.isDbFacade(cls)) return DB_WRITE_METHODS.contains(name);
                if (LaravelVocabulary.isFacade(cls)) return false;
                return staticWrites.contains(name) && resolver.modelFor(cls, scope).isPresent();
            }
            if (!instanceWrites.contains(name)) return false;
            MethodChain chain = PhpNodes.chain(call);
            if (chain.isStatic()) {
                String cls = chain.staticClass();
                if (cls == null) return false;
                if (LaravelVocabulary.isDbFacade(cls)) return true;
                if (LaravelVocabulary.isFacade(cls)) return false;
                return resolver.modelFor(cls, scope).isPresent();
            }
            return isDurableReceiver(chain.root(), scope);
        }

        private boolean isDurableReceiver(SyntaxNode root, ScopeTracker scope) {
            if (root == null) return false;
            if (PhpNodes.isFunctionCall(root)) {
                String helper = PhpNodes.callName(root);
                return helper == null || !NON_DURABLE_HELPERS.contains(helper);
            }
            if (PhpNodes.isPropertyAccess(root)) {
                for (String segment : PhpNodes.propertyPath(root)) {
                    if (namesNonDurableStore(segment)) return false;
                }
                return true;
            }
            String variable = PhpNodes.variableName(root);
            if (variable != null) {
                if ("this".equals(variable)) return isInsideModel(scope);
                return !namesNonDurableStore(variable);
            }
            return true;
        }

        private boolean isInsideModel(ScopeTracker scope) {
            if (resolver.registry().isModel(scope.currentClassFqcn())) return true;
            for (String ancestor : scope.currentClassChain()) {
                if (resolver.registry().isModel(ancestor)) return true;
                String shortName = PhpNodes.shortName(ancestor);
                if (shortName.equals("Model") || shortName.equals("Authenticatable") || shortName.equals("Pivot")) return true;
            }
            return false;
        }

        private void report(MethodState state) {
            List<Integer> lines = new ArrayList<>();
            List<String> operations = new ArrayList<>();
            for (WriteOperationSite site : state.writes) {
                if (site.protectedByTransaction) continue;
                lines.add(site.line);
                operations.add(site.operation);
            }
            if (lines.size() < threshold) return;

            String message = state.className != null
                    ? String.format("Method \"%s::%s()\" has %d write operations without transaction protection",
                    state.className, state.methodName, lines.size())
                    : String.format("Function \"%s()\" has %d write operations without transaction protection",
                    state.methodName, lines.size());
            StringBuilder lineList = new StringBuilder();
            for (Integer line : lines) {
                if (lineList.length() > 0) lineList.append(", ");
                lineList.append(line);
            }
            issues.add(issue(context, CODE, Severity.HIGH, state.node.startLine(), message)
                    .withRecommendation("Wrap the writes on lines " + lineList
                            + " in DB::transaction(function () { ... }) so they are committed or rolled back together.")
                    .withMetadata("count", lines.size())
                    .withMetadata("lines", lines)
                    .withMetadata("operations", operations)
                    .withMetadata("method", state.methodName)
                    .withMetadata("class", state.className));
        }
    }

    /** Splits camelCase and snake_case and checks each word. */
    static boolean namesNonDurableStore(String name) {
        if (name == null) return false;
        for (String word : name.split("_|(?<=[a-z0-9])(?=[A-Z])")) {
            if (NON_DURABLE_WORDS.contains(word.toLowerCase())) return true;
        }
        return false;
    }
}
