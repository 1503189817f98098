package org.dxworks.lintframe.syntax;

import org.treesitter.TSNode;

import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Bridges native tree-sitter nodes to the owned {@link SyntaxNode} model.
 */
public class TreeSitterHelper {

    private TreeSitterHelper() {
    }

    /**
     * Copies the native tree into owned nodes. Iterative, so deeply nested expressions
     * (long concatenations, long method chains) cannot exhaust the call stack.
     */
    public static SyntaxTree materialize(String source, TSNode root) {
        byte[] bytes = source.getBytes(StandardCharsets.UTF_8);
        List<SyntaxNode> comments = new ArrayList<>();
        SyntaxNode rootNode = newNode(root, null, bytes, null);

        Deque<TSNode> nativeStack = new ArrayDeque<>();
        Deque<SyntaxNode> ownedStack = new ArrayDeque<>();
        nativeStack.push(root);
        ownedStack.push(rootNode);

        while (!nativeStack.isEmpty()) {
            TSNode tsNode = nativeStack.pop();
            SyntaxNode owner = ownedStack.pop();
            List<TSNode> pendingNative = new ArrayList<>();
            List<SyntaxNode> pendingOwned = new ArrayList<>();

            // getFieldNameForChild expects the total child index, anonymous tokens included
            int count = tsNode.getChildCount();
            for (int i = 0; i < count; i++) {
                TSNode child = tsNode.getChild(i);
                if (child == null || child.isNull()) continue;
                if (!child.isNamed()) {
                    if (owner.token() == null) owner.setToken(child.getType());
                    continue;
                }
                if ("comment".equals(child.getType())) {
                    comments.add(newNode(child, null, bytes, owner));
                    continue;
                }
                SyntaxNode childNode = newNode(child, tsNode.getFieldNameForChild(i), bytes, owner);
                owner.addChild(childNode);
                pendingNative.add(child);
                pendingOwned.add(childNode);
            }
            for (int i = pendingNative.size() - 1; i >= 0; i--) {
                nativeStack.push(pendingNative.get(i));
                ownedStack.push(pendingOwned.get(i));
            }
        }

        comments.sort((a, b) -> Integer.compare(a.startByte(), b.startByte()));
        return new SyntaxTree(source, rootNode, comments);
    }

    /**
     * Line (1-based) of the first ERROR or MISSING node, or -1 when the tree is clean.
     */
    public static int firstErrorLine(TSNode root) {
        Deque<TSNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            TSNode node = stack.pop();
            if (node == null || node.isNull()) continue;
            if ("ERROR".equals(node.getType()) || node.isMissing()) {
                return node.getStartPoint().getRow() + 1;
            }
            if (!node.hasError()) continue;
            for (int i = node.getChildCount() - 1; i >= 0; i--) {
                stack.push(node.getChild(i));
            }
        }
        return -1;
    }

    private static SyntaxNode newNode(TSNode node, String field, byte[] bytes, SyntaxNode parent) {
        return new SyntaxNode(
                node.getType(),
                field,
                bytes,
                node.getStartByte(),
                node.getEndByte(),
                node.getStartPoint().getRow() + 1,
                node.getEndPoint().getRow() + 1,
                node.getStartPoint().getColumn(),
                parent);
    }
}
