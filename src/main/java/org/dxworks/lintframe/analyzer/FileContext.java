package org.dxworks.lintframe.analyzer;

import org.dxworks.lintframe.registry.ModelRegistry;
import org.dxworks.lintframe.scope.NodeVisitor;
import org.dxworks.lintframe.scope.ScopeTracker;
import org.dxworks.lintframe.scope.TreeWalker;
import org.dxworks.lintframe.suppression.SuppressionIndex;
import org.dxworks.lintframe.suppression.SuppressionScanner;
import org.dxworks.lintframe.syntax.SyntaxTree;

/**
 * Everything an analyzer may read about one file. Templates carry no syntax tree.
 */
public class FileContext {

    private final SourceFile file;
    private final SyntaxTree tree;
    private final SuppressionIndex suppressions;
    private final ModelRegistry registry;
    private final String[] lines;

    private FileContext(SourceFile file, SyntaxTree tree, SuppressionIndex suppressions, ModelRegistry registry) {
        this.file = file;
        this.tree = tree;
        this.suppressions = suppressions;
        this.registry = registry;
        this.lines = file.content.replace("\r\n", "\n").replace("\r", "\n").split("\n", -1);
    }

    public static FileContext forSource(SourceFile file, SyntaxTree tree, ModelRegistry registry) {
        return new FileContext(file, tree, SuppressionScanner.scan(tree), registry);
    }

    public static FileContext forTemplate(SourceFile file, ModelRegistry registry) {
        return new FileContext(file, null, SuppressionScanner.scanText(file.content), registry);
    }

    public ScopeTracker walk(NodeVisitor... visitors) {
        if (tree == null) {
            throw new IllegalStateException("No syntax tree for " + file.relativePath);
        }
        return new TreeWalker(registry).walk(tree, visitors);
    }

    public SourceFile file() {
        return file;
    }

    public String relativePath() {
        return file.relativePath;
    }

    public String source() {
        return file.content;
    }

    public SyntaxTree tree() {
        return tree;
    }

    public boolean hasTree() {
        return tree != null;
    }

    public SuppressionIndex suppressions() {
        return suppressions;
    }

    public ModelRegistry registry() {
        return registry;
    }

    public int lineCount() {
        return lines.length;
    }

    /** 1-based; empty when out of range. */
    public String line(int lineNumber) {
        if (lineNumber < 1 || lineNumber > lines.length) return "";
        return lines[lineNumber - 1];
    }
}
