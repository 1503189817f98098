package org.dxworks.lintframe.analyzer.support;

import org.dxworks.lintframe.registry.ModelRegistry;
import org.dxworks.lintframe.scope.EagerLoadSet;
import org.dxworks.lintframe.scope.Provenance;
import org.dxworks.lintframe.scope.ScopeTracker;
import org.dxworks.lintframe.syntax.MethodChain;
import org.dxworks.lintframe.syntax.PhpNodes;
import org.dxworks.lintframe.syntax.SyntaxNode;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Works out what an expression evaluates to, as far as model and query lineage go.
 * <p>
 * In strict mode only classes the {@link ModelRegistry} confirms are models count. Lenient mode
 * also accepts classes absent from the registry whose names look like models, which suits rules
 * that do not need a table name.
 */
public class ProvenanceResolver {

    private static final Set<String> EAGER_METHODS = Set.of("with");
    private static final Set<String> LOAD_METHODS = Set.of("load", "loadMissing", "loadCount");
    private static final Set<String> TO_BASE_METHODS = Set.of("toBase", "getQuery");

    private final ModelRegistry registry;
    private final boolean lenient;

    public ProvenanceResolver(ModelRegistry registry, boolean lenient) {
        this.registry = registry;
        this.lenient = lenient;
    }

    public ModelRegistry registry() {
        return registry;
    }

    /** Model class referenced by a class name as written at the current position. */
    public Optional<String> modelFor(String written, ScopeTracker scope) {
        if (written == null) return Optional.empty();
        String resolved = scope.resolveClassName(written);
        if (resolved == null) return Optional.empty();
        Optional<String> found = registry.findModel(resolved);
        // call scopes arrive without their leading backslash, so a qualified name may already be absolute
        if (found.isEmpty() && written.contains("\\")) found = registry.findModel(PhpNodes.stripLeadingBackslash(written));
        if (found.isPresent() || !lenient || registry.isDeclared(resolved)) return found;
        if (LaravelVocabulary.isFacade(written)) return Optional.empty();
        return LaravelVocabulary.looksLikeModel(PhpNodes.shortName(resolved)) ? Optional.of(resolved) : Optional.empty();
    }

    public Provenance resolve(SyntaxNode expression, ScopeTracker scope) {
        if (expression == null) return Provenance.UNKNOWN;
        if (expression.is("parenthesized_expression") && expression.childCount() == 1) {
            return resolve(expression.child(0), scope);
        }
        String variable = PhpNodes.variableName(expression);
        if (variable != null) return scope.lookup(variable);
        if (expression.is("object_creation_expression")) {
            return modelFor(PhpNodes.instantiatedClass(expression), scope)
                    .map(Provenance::modelClass)
                    .orElse(Provenance.UNKNOWN);
        }
        if (PhpNodes.isMethodCall(expression) || PhpNodes.isStaticCall(expression)) {
            return resolveChain(PhpNodes.chain(expression), scope);
        }
        return Provenance.UNKNOWN;
    }

    public Provenance resolveChain(MethodChain chain, ScopeTracker scope) {
        if (chain.isEmpty()) return resolve(chain.root(), scope);
        List<MethodChain.Link> links = chain.links();
        Provenance current;
        int index = 0;
        if (chain.isStatic()) {
            String cls = chain.staticClass();
            if (cls == null) return Provenance.UNKNOWN;
            if (LaravelVocabulary.isDbFacade(cls)) {
                String table = dbTable(chain);
                if (table == null) return Provenance.UNKNOWN;
                current = Provenance.queryBuilder(table);
                index = chain.find("table") != null ? links.indexOf(chain.find("table")) + 1 : links.size();
            } else {
                Optional<String> model = modelFor(cls, scope);
                if (model.isEmpty()) return Provenance.UNKNOWN;
                current = Provenance.eloquentBuilder(model.get(), EagerLoadSet.EMPTY);
            }
        } else {
            current = resolve(chain.root(), scope);
        }
        for (int i = index; i < links.size() && current.kind() != Provenance.Kind.UNKNOWN; i++) {
            current = apply(current, links.get(i));
        }
        return current;
    }

    /** Table named by {@code DB::table('x')} or {@code DB::connection(..)->table('x')}, literal only. */
    public static String dbTable(MethodChain chain) {
        if (!chain.isStatic() || !LaravelVocabulary.isDbFacade(chain.staticClass())) return null;
        List<MethodChain.Link> links = chain.links();
        int i = 0;
        if (i < links.size() && "connection".equals(links.get(i).name)) i++;
        if (i < links.size() && "table".equals(links.get(i).name)) {
            return PhpNodes.stringValue(PhpNodes.argument(links.get(i).call, 0));
        }
        return null;
    }

    /** Result of calling {@code link} on a value of the given provenance. */
    public Provenance apply(Provenance current, MethodChain.Link link) {
        String name = link.name;
        if (name == null) return Provenance.UNKNOWN;
        switch (current.kind()) {
            case ELOQUENT_BUILDER -> {
                String model = current.model().orElseThrow();
                if (EAGER_METHODS.contains(name)) {
                    return Provenance.eloquentBuilder(model,
                            current.eagerLoads().with(EagerLoadSet.fromArguments(link.arguments())));
                }
                if (TO_BASE_METHODS.contains(name)) {
                    return registry.resolveTable(model).map(Provenance::queryBuilder).orElse(Provenance.UNKNOWN);
                }
                if (LaravelVocabulary.FETCH_METHODS.contains(name)) {
                    return Provenance.modelClass(model, current.eagerLoads());
                }
                if (LaravelVocabulary.SCALAR_TERMINALS.contains(name)) return Provenance.UNKNOWN;
                return current;
            }
            case MODEL_CLASS -> {
                String model = current.model().orElseThrow();
                if (LOAD_METHODS.contains(name)) {
                    return Provenance.modelClass(model,
                            current.eagerLoads().with(EagerLoadSet.fromArguments(link.arguments())));
                }
                if (LaravelVocabulary.COLLECTION_METHODS.contains(name) || "refresh".equals(name)) {
                    return current;
                }
                return Provenance.UNKNOWN;
            }
            case QUERY_BUILDER -> {
                if (LaravelVocabulary.FETCH_METHODS.contains(name) || LaravelVocabulary.SCALAR_TERMINALS.contains(name)) {
                    return Provenance.UNKNOWN;
                }
                return current;
            }
            default -> {
                return Provenance.UNKNOWN;
            }
        }
    }

    /** Table behind a provenance: the literal for query builders, the registry entry for models. */
    public Optional<String> tableOf(Provenance provenance) {
        if (provenance.kind() == Provenance.Kind.QUERY_BUILDER) return provenance.table();
        return provenance.model().flatMap(registry::resolveTable);
    }
}
