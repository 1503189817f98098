package org.dxworks.lintframe.syntax;

import java.util.Collections;
import java.util.List;

public class SyntaxTree {

    private final String source;
    private final String[] lines;
    private final SyntaxNode root;
    private final List<SyntaxNode> comments;

    SyntaxTree(String source, SyntaxNode root, List<SyntaxNode> comments) {
        this.source = source;
        this.lines = source.replace("\r\n", "\n").replace("\r", "\n").split("\n", -1);
        this.root = root;
        this.comments = comments;
    }

    public SyntaxNode root() {
        return root;
    }

    public String source() {
        return source;
    }

    /** Comments in source order; they are not part of {@link SyntaxNode#children()}. */
    public List<SyntaxNode> comments() {
        return Collections.unmodifiableList(comments);
    }

    public int lineCount() {
        return lines.length;
    }

    /** 1-based line text, or empty when out of range. */
    public String line(int lineNumber) {
        if (lineNumber < 1 || lineNumber > lines.length) return "";
        return lines[lineNumber - 1];
    }
}
