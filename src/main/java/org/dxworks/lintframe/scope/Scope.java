package org.dxworks.lintframe.scope;

import org.dxworks.lintframe.syntax.SyntaxNode;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * One lexical nesting level. The parent link is a lookup reference only; frames are owned by the
 * {@link ScopeTracker} stack.
 */
public class Scope {

    private final ScopeKind kind;
    private final String name;
    private final String qualifiedName;
    private final Scope parent;
    private final SyntaxNode node;
    private final List<String> classChain;
    private final Map<String, Provenance> bindings;
    private Provenance context = Provenance.UNKNOWN;

    Scope(ScopeKind kind, String name, String qualifiedName, Scope parent, SyntaxNode node, List<String> classChain) {
        this.kind = kind;
        this.name = name;
        this.qualifiedName = qualifiedName;
        this.parent = parent;
        this.node = node;
        this.classChain = classChain == null ? Collections.emptyList() : Collections.unmodifiableList(classChain);
        this.bindings = kind.ownsBindings() ? new HashMap<>() : Collections.emptyMap();
    }

    public ScopeKind kind() {
        return kind;
    }

    /** Null for anonymous classes and closures. */
    public String name() {
        return name;
    }

    /** Fully qualified name for named classes, namespace name for namespaces, otherwise null. */
    public String qualifiedName() {
        return qualifiedName;
    }

    public Scope parent() {
        return parent;
    }

    public SyntaxNode node() {
        return node;
    }

    /** Ancestors of a class frame, nearest first. */
    public List<String> classChain() {
        return classChain;
    }

    public Provenance context() {
        return context;
    }

    void setContext(Provenance context) {
        this.context = context;
    }

    void bind(String variable, Provenance provenance) {
        if (!kind.ownsBindings()) {
            throw new IllegalStateException(kind + " frames do not own bindings");
        }
        bindings.put(variable, provenance);
    }

    Provenance lookup(String variable) {
        return bindings.getOrDefault(variable, Provenance.UNKNOWN);
    }

    @Override
    public String toString() {
        return kind + (name != null ? "(" + name + ")" : "");
    }
}
