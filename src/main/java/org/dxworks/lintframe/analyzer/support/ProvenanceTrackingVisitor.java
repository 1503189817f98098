package org.dxworks.lintframe.analyzer.support;

import org.dxworks.lintframe.scope.NodeVisitor;
import org.dxworks.lintframe.scope.Provenance;
import org.dxworks.lintframe.scope.ScopeTracker;
import org.dxworks.lintframe.syntax.MethodChain;
import org.dxworks.lintframe.syntax.PhpNodes;
import org.dxworks.lintframe.syntax.SyntaxNode;

/**
 * Base visitor that keeps variable bindings current: assignments, {@code load()} calls on a bound
 * variable and {@code foreach} value variables. Subclasses call {@code super.enterNode} first.
 */
public abstract class ProvenanceTrackingVisitor implements NodeVisitor {

    protected final ProvenanceResolver resolver;

    protected ProvenanceTrackingVisitor(ProvenanceResolver resolver) {
        this.resolver = resolver;
    }

    @Override
    public void enterNode(SyntaxNode node, ScopeTracker scope) {
        if (node.is("assignment_expression")) {
            trackAssignment(node, scope);
        } else if (PhpNodes.isMethodCall(node)) {
            trackLoad(node, scope);
        } else if (node.is("foreach_statement")) {
            trackLoopVariable(node, scope);
        }
    }

    private void trackAssignment(SyntaxNode assignment, ScopeTracker scope) {
        SyntaxNode left = assignment.child("left");
        if (left == null) left = assignment.child(0);
        String variable = PhpNodes.variableName(left);
        if (variable == null || "this".equals(variable)) return;
        SyntaxNode right = assignment.child("right");
        if (right == null) right = assignment.lastChild();
        scope.bind(variable, resolver.resolve(right, scope));
    }

    private void trackLoad(SyntaxNode call, ScopeTracker scope) {
        String name = PhpNodes.callName(call);
        if (!"load".equals(name) && !"loadMissing".equals(name)) return;
        if (!PhpNodes.isChainTop(call) || call.parent() == null || !call.parent().is("expression_statement")) return;
        MethodChain chain = PhpNodes.chain(call);
        String variable = chain.rootVariable();
        if (variable == null || chain.links().size() != 1) return;
        Provenance current = scope.lookup(variable);
        if (current.kind() != Provenance.Kind.MODEL_CLASS) return;
        scope.bind(variable, resolver.apply(current, chain.first()));
    }

    private void trackLoopVariable(SyntaxNode loop, ScopeTracker scope) {
        String variable = foreachValueVariable(loop);
        if (variable == null) return;
        Provenance source = resolver.resolve(foreachSource(loop), scope);
        scope.bind(variable, source.kind() == Provenance.Kind.MODEL_CLASS ? source : Provenance.UNKNOWN);
    }

    public static SyntaxNode foreachSource(SyntaxNode loop) {
        return loop.child(0);
    }

    /** Value variable of {@code foreach ($xs as $x)} or {@code foreach ($xs as $k => $x)}, without {@code $}. */
    public static String foreachValueVariable(SyntaxNode loop) {
        SyntaxNode binding = loop.child(1);
        if (binding == null) return null;
        if (binding.is("pair", "foreach_pair")) binding = binding.lastChild();
        if (binding != null && binding.is("by_ref")) binding = binding.child(0);
        return PhpNodes.variableName(binding);
    }
}
