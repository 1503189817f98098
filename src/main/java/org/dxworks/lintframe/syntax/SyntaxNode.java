package org.dxworks.lintframe.syntax;

import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * Owned, read-only copy of a tree-sitter node.
 * <p>
 * Only named, non-comment children are kept. The first anonymous child (an operator, an arrow,
 * a keyword) is remembered as {@link #token()} so binary and unary expressions can be told apart
 * without keeping every punctuation node around.
 */
public class SyntaxNode {

    private final String kind;
    private final String field;
    private final byte[] source;
    private final int startByte;
    private final int endByte;
    private final int startLine;
    private final int endLine;
    private final int startColumn;
    private final SyntaxNode parent;
    private final List<SyntaxNode> children = new ArrayList<>();
    private String token;
    private String text;

    SyntaxNode(String kind, String field, byte[] source, int startByte, int endByte,
               int startLine, int endLine, int startColumn, SyntaxNode parent) {
        this.kind = kind;
        this.field = field;
        this.source = source;
        this.startByte = startByte;
        this.endByte = endByte;
        this.startLine = startLine;
        this.endLine = endLine;
        this.startColumn = startColumn;
        this.parent = parent;
    }

    void addChild(SyntaxNode child) {
        children.add(child);
    }

    void setToken(String token) {
        this.token = token;
    }

    public String kind() {
        return kind;
    }

    /** Field name this node occupies in its parent, or null. */
    public String field() {
        return field;
    }

    public String token() {
        return token;
    }

    public int startLine() {
        return startLine;
    }

    public int endLine() {
        return endLine;
    }

    public int startColumn() {
        return startColumn;
    }

    public int startByte() {
        return startByte;
    }

    public int endByte() {
        return endByte;
    }

    public int lineCount() {
        return endLine - startLine + 1;
    }

    public SyntaxNode parent() {
        return parent;
    }

    public List<SyntaxNode> children() {
        return Collections.unmodifiableList(children);
    }

    public int childCount() {
        return children.size();
    }

    public SyntaxNode child(int index) {
        if (index < 0 || index >= children.size()) return null;
        return children.get(index);
    }

    public SyntaxNode lastChild() {
        return children.isEmpty() ? null : children.get(children.size() - 1);
    }

    public String text() {
        if (text == null) {
            int start = Math.max(0, startByte);
            int end = Math.min(source.length, endByte);
            text = start >= end ? "" : new String(source, start, end - start, StandardCharsets.UTF_8)
                    .replace("\r\n", "\n").replace("\r", "\n");
        }
        return text;
    }

    public boolean is(String... kinds) {
        for (String k : kinds) {
            if (kind.equals(k)) return true;
        }
        return false;
    }

    /** First child stored under the given field name. */
    public SyntaxNode child(String fieldName) {
        for (SyntaxNode c : children) {
            if (fieldName.equals(c.field)) return c;
        }
        return null;
    }

    public SyntaxNode firstChild(String... kinds) {
        for (SyntaxNode c : children) {
            if (c.is(kinds)) return c;
        }
        return null;
    }

    public List<SyntaxNode> childrenOfKind(String... kinds) {
        List<SyntaxNode> result = new ArrayList<>();
        for (SyntaxNode c : children) {
            if (c.is(kinds)) result.add(c);
        }
        return result;
    }

    /** Pre-order search, this node included. */
    public SyntaxNode findFirst(String... kinds) {
        Deque<SyntaxNode> stack = new ArrayDeque<>();
        stack.push(this);
        while (!stack.isEmpty()) {
            SyntaxNode node = stack.pop();
            if (node.is(kinds)) return node;
            for (int i = node.children.size() - 1; i >= 0; i--) {
                stack.push(node.children.get(i));
            }
        }
        return null;
    }

    /** All matching nodes in pre-order, this node included. */
    public List<SyntaxNode> findAll(String... kinds) {
        List<SyntaxNode> result = new ArrayList<>();
        Deque<SyntaxNode> stack = new ArrayDeque<>();
        stack.push(this);
        while (!stack.isEmpty()) {
            SyntaxNode node = stack.pop();
            if (node.is(kinds)) result.add(node);
            for (int i = node.children.size() - 1; i >= 0; i--) {
                stack.push(node.children.get(i));
            }
        }
        return result;
    }

    public SyntaxNode ancestor(String... kinds) {
        SyntaxNode current = parent;
        while (current != null) {
            if (current.is(kinds)) return current;
            current = current.parent;
        }
        return null;
    }

    /** True when this node lies inside {@code other} (or is {@code other}). */
    public boolean isWithin(SyntaxNode other) {
        return other != null && startByte >= other.startByte && endByte <= other.endByte;
    }

    @Override
    public String toString() {
        return kind + "@" + startLine;
    }
}
