package org.dxworks.lintframe.scope;

import org.dxworks.lintframe.syntax.SyntaxNode;
import org.dxworks.lintframe.syntax.SyntaxTree;

import java.util.List;

/**
 * Depth-first walk that keeps a {@link ScopeTracker} in step with the tree while any number of
 * visitors observe the same traversal.
 */
public class TreeWalker {

    private final ClassHierarchy hierarchy;

    public TreeWalker(ClassHierarchy hierarchy) {
        this.hierarchy = hierarchy;
    }

    public ScopeTracker walk(SyntaxTree tree, NodeVisitor... visitors) {
        return walk(tree, List.of(visitors));
    }

    public ScopeTracker walk(SyntaxTree tree, List<NodeVisitor> visitors) {
        ScopeTracker scope = new ScopeTracker(hierarchy);
        scope.enterFile(tree);
        for (NodeVisitor v : visitors) v.beforeTraverse(tree, scope);
        visit(tree.root(), scope, visitors);
        for (NodeVisitor v : visitors) v.afterTraverse(tree, scope);
        return scope;
    }

    private void visit(SyntaxNode node, ScopeTracker scope, List<NodeVisitor> visitors) {
        boolean pushed = ScopeTracker.introducesScope(node);
        if (pushed) {
            scope.enterScope(node);
        } else if (node.is("namespace_definition")) {
            scope.declareNamespace(node);
        }
        try {
            for (NodeVisitor v : visitors) v.enterNode(node, scope);
            for (SyntaxNode child : node.children()) {
                visit(child, scope, visitors);
            }
            for (NodeVisitor v : visitors) v.leaveNode(node, scope);
        } finally {
            if (pushed) scope.leaveScope();
        }
    }
}
