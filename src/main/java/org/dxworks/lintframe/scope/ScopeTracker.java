package org.dxworks.lintframe.scope;

import org.dxworks.lintframe.syntax.PhpNodes;
import org.dxworks.lintframe.syntax.SyntaxNode;
import org.dxworks.lintframe.syntax.SyntaxTree;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Explicit stack of lexical frames maintained while a file is walked.
 * <p>
 * Variable bindings belong to the innermost method or closure frame. A closure starts with an
 * empty table even when it imports outer variables with {@code use}, so provenance never leaks
 * across function boundaries.
 */
public class ScopeTracker {

    private final Deque<Scope> stack = new ArrayDeque<>();
    private final ClassHierarchy hierarchy;
    private FileSymbols symbols;
    private String fileNamespace = "";

    public ScopeTracker(ClassHierarchy hierarchy) {
        this.hierarchy = hierarchy == null ? ClassHierarchy.EMPTY : hierarchy;
    }

    public void enterFile(SyntaxTree tree) {
        stack.clear();
        symbols = FileSymbols.of(tree);
        fileNamespace = "";
        stack.push(new Scope(ScopeKind.FILE, null, null, null, tree.root(), null));
    }

    public FileSymbols symbols() {
        return symbols;
    }

    public static boolean introducesScope(SyntaxNode node) {
        if (node.is("namespace_definition")) {
            return node.child("body") != null || node.firstChild("compound_statement") != null;
        }
        return node.is(PhpNodes.CLASS_LIKE)
                || PhpNodes.isAnonymousClass(node)
                || node.is(PhpNodes.FUNCTIONS)
                || node.is(PhpNodes.CLOSURES);
    }

    /** A namespace declared without braces applies to the rest of the file. */
    public void declareNamespace(SyntaxNode namespaceDefinition) {
        fileNamespace = FileSymbols.nameOf(namespaceDefinition);
    }

    public void enterScope(SyntaxNode node) {
        Scope parent = stack.peek();
        Scope scope;
        if (node.is("namespace_definition")) {
            String name = FileSymbols.nameOf(node);
            scope = new Scope(ScopeKind.NAMESPACE, name, name, parent, node, null);
        } else if (node.is(PhpNodes.CLASS_LIKE)) {
            String name = PhpNodes.declarationName(node);
            String ns = currentNamespace();
            String fqcn = name == null ? null : (ns.isEmpty() ? name : ns + "\\" + name);
            scope = new Scope(ScopeKind.CLASS, name, fqcn, parent, node, resolveChain(fqcn, node));
        } else if (PhpNodes.isAnonymousClass(node)) {
            scope = new Scope(ScopeKind.ANONYMOUS_CLASS, null, null, parent, node, resolveChain(null, node));
        } else if (node.is(PhpNodes.FUNCTIONS)) {
            scope = new Scope(ScopeKind.METHOD, PhpNodes.declarationName(node), null, parent, node, null);
        } else if (node.is(PhpNodes.CLOSURES)) {
            scope = new Scope(ScopeKind.CLOSURE, null, null, parent, node, null);
        } else {
            throw new IllegalArgumentException("Node does not introduce a scope: " + node.kind());
        }
        stack.push(scope);
    }

    public void leaveScope() {
        if (stack.size() <= 1) {
            throw new IllegalStateException("leaveScope() without matching enterScope()");
        }
        stack.pop();
    }

    private List<String> resolveChain(String ownFqcn, SyntaxNode classNode) {
        String written = PhpNodes.baseClassName(classNode);
        if (written == null) return Collections.emptyList();
        List<String> chain = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        if (ownFqcn != null) visited.add(ownFqcn);
        String current = resolveClassName(written);
        while (current != null && visited.add(current)) {
            chain.add(current);
            FileSymbols.DeclaredClass local = symbols == null ? null : symbols.declaredClass(current);
            current = local != null ? local.parent : hierarchy.parentOf(current).orElse(null);
        }
        return chain;
    }

    public Scope current() {
        return stack.peek();
    }

    public int depth() {
        return stack.size();
    }

    public String currentNamespace() {
        for (Scope scope : stack) {
            if (scope.kind() == ScopeKind.NAMESPACE) return scope.qualifiedName();
        }
        return fileNamespace;
    }

    public Scope currentClass() {
        for (Scope scope : stack) {
            if (scope.kind().isClass()) return scope;
        }
        return null;
    }

    /** Short name of the innermost class; null inside anonymous classes or outside classes. */
    public String currentClassName() {
        Scope cls = currentClass();
        return cls == null ? null : cls.name();
    }

    public String currentClassFqcn() {
        Scope cls = currentClass();
        return cls == null ? null : cls.qualifiedName();
    }

    public List<String> currentClassChain() {
        Scope cls = currentClass();
        return cls == null ? Collections.emptyList() : cls.classChain();
    }

    public Scope currentMethod() {
        for (Scope scope : stack) {
            if (scope.kind() == ScopeKind.METHOD) return scope;
            if (scope.kind().isClass()) return null;
        }
        return null;
    }

    public String currentMethodName() {
        Scope method = currentMethod();
        return method == null ? null : method.name();
    }

    /** True when a closure frame sits between the current position and the enclosing method. */
    public boolean insideClosure() {
        for (Scope scope : stack) {
            if (scope.kind() == ScopeKind.CLOSURE) return true;
            if (scope.kind() == ScopeKind.METHOD || scope.kind().isClass()) return false;
        }
        return false;
    }

    public void bind(String variable, Provenance provenance) {
        Scope owner = bindingOwner();
        if (owner != null && variable != null) owner.bind(variable, provenance);
    }

    public Provenance lookup(String variable) {
        Scope owner = bindingOwner();
        return owner == null || variable == null ? Provenance.UNKNOWN : owner.lookup(variable);
    }

    private Scope bindingOwner() {
        for (Scope scope : stack) {
            if (scope.kind().ownsBindings()) return scope;
            if (scope.kind().isClass()) return null;
        }
        return null;
    }

    /** Tags the current frame, e.g. a closure that runs inside a transaction. */
    public void markContext(Provenance context) {
        Scope top = stack.peek();
        if (top != null) top.setContext(context);
    }

    /** Whether any frame up to and including the enclosing method carries the given context. */
    public boolean hasContext(Provenance.Kind kind) {
        for (Scope scope : stack) {
            if (scope.context().kind() == kind) return true;
            if (scope.kind() == ScopeKind.METHOD || scope.kind().isClass()) return false;
        }
        return false;
    }

    /**
     * Fully qualified name for a class reference as written at the current position.
     * {@code self} and {@code static} give the current class, {@code parent} its parent.
     */
    public String resolveClassName(String written) {
        if (written == null || written.isEmpty()) return null;
        String lower = written.toLowerCase();
        if (lower.equals("self") || lower.equals("static")) return currentClassFqcn();
        if (lower.equals("parent")) {
            List<String> chain = currentClassChain();
            return chain.isEmpty() ? null : chain.get(0);
        }
        if (symbols == null) return written.startsWith("\\") ? written.substring(1) : written;
        return symbols.resolve(written, currentNamespace());
    }
}
