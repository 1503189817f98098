package org.dxworks.lintframe.scope;

import org.dxworks.lintframe.syntax.SyntaxNode;
import org.dxworks.lintframe.syntax.SyntaxTree;

/**
 * Callback interface driven by {@link TreeWalker}. For scope-introducing nodes the new frame is
 * already current in {@link #enterNode} and still current in {@link #leaveNode}.
 */
public interface NodeVisitor {

    default void beforeTraverse(SyntaxTree tree, ScopeTracker scope) {
    }

    default void enterNode(SyntaxNode node, ScopeTracker scope) {
    }

    default void leaveNode(SyntaxNode node, ScopeTracker scope) {
    }

    default void afterTraverse(SyntaxTree tree, ScopeTracker scope) {
    }
}
