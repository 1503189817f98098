package org.dxworks.lintframe.analyzer.support;

import org.dxworks.lintframe.syntax.SyntaxNode;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Set;

/**
 * Size and complexity measures over a syntax subtree.
 */
public final class CodeMetrics {

    private static final Set<String> BRANCHES = Set.of(
            "if_statement", "else_if_clause", "case_statement", "for_statement", "foreach_statement",
            "while_statement", "do_statement", "catch_clause", "conditional_expression", "match_expression");

    private static final Set<String> LOGICAL_OPERATORS = Set.of("&&", "||", "and", "or", "??");

    private CodeMetrics() {
    }

    /**
     * Cyclomatic complexity: one plus a point per branch, loop, catch, ternary, match arm
     * condition and short-circuit operator. Nested closures count towards the enclosing code.
     */
    public static int cyclomaticComplexity(SyntaxNode root) {
        if (root == null) return 1;
        int complexity = 1;
        Deque<SyntaxNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            SyntaxNode node = stack.pop();
            if (BRANCHES.contains(node.kind())) {
                complexity++;
            } else if (node.is("binary_expression") && LOGICAL_OPERATORS.contains(node.token())) {
                complexity++;
            } else if (node.is("match_conditional_expression")) {
                SyntaxNode conditions = node.child("conditional_expressions");
                if (conditions == null) conditions = node.firstChild("match_condition_list");
                complexity += conditions != null ? Math.max(1, conditions.childCount()) : 1;
            }
            for (SyntaxNode child : node.children()) stack.push(child);
        }
        return complexity;
    }

    /** Lines spanned by the node, first and last inclusive. */
    public static int lines(SyntaxNode node) {
        return node == null ? 0 : node.endLine() - node.startLine() + 1;
    }
}
