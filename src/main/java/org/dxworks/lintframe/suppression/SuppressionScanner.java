package org.dxworks.lintframe.suppression;

import org.dxworks.lintframe.syntax.PhpNodes;
import org.dxworks.lintframe.syntax.SyntaxNode;
import org.dxworks.lintframe.syntax.SyntaxTree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads {@code @lintframe-ignore} markers ({@code @shieldci-ignore} is accepted too) from the
 * comments of a parsed file.
 * <ul>
 *     <li>before the first declaration of the file: the whole file</li>
 *     <li>directly above a class declaration or its attributes: the class span</li>
 *     <li>anywhere else: the comment's own line and the line after it</li>
 * </ul>
 * An optional comma separated list of analyzer ids narrows the marker to those analyzers.
 */
public class SuppressionScanner {

    private static final Pattern MARKER = Pattern.compile(
            "@(?:lintframe|shieldci)-ignore(?:[ \\t]+([a-z0-9_-]+(?:[ \\t]*,[ \\t]*[a-z0-9_-]+)*))?",
            Pattern.CASE_INSENSITIVE);

    private SuppressionScanner() {
    }

    public static SuppressionIndex scan(SyntaxTree tree) {
        List<SuppressionIndex.Entry> entries = new ArrayList<>();
        List<SyntaxNode> comments = tree.comments();
        if (comments.isEmpty()) return SuppressionIndex.NONE;

        List<SyntaxNode> classes = tree.root().findAll(PhpNodes.CLASS_LIKE);
        int firstDeclarationLine = firstDeclarationLine(tree.root());

        for (SyntaxNode comment : comments) {
            Set<String> ids = markerIds(comment.text());
            if (ids == null) continue;

            SyntaxNode annotated = classDirectlyAfter(comment, classes, tree);
            if (annotated != null) {
                entries.add(new SuppressionIndex.Entry(SuppressionIndex.Granularity.CLASS,
                        annotated.startLine(), annotated.endLine(), ids));
            } else if (comment.endLine() < firstDeclarationLine) {
                entries.add(new SuppressionIndex.Entry(SuppressionIndex.Granularity.FILE,
                        1, Integer.MAX_VALUE, ids));
            }
            entries.add(new SuppressionIndex.Entry(SuppressionIndex.Granularity.LINE,
                    comment.startLine(), comment.endLine() + 1, ids));
        }
        return new SuppressionIndex(entries);
    }

    /**
     * Line-level markers for templates that are not parsed as PHP: {@code {{-- @lintframe-ignore --}}}
     * and PHP comments alike.
     */
    public static SuppressionIndex scanText(String source) {
        List<SuppressionIndex.Entry> entries = new ArrayList<>();
        String[] lines = source.replace("\r\n", "\n").split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            Set<String> ids = markerIds(lines[i]);
            if (ids == null) continue;
            int line = i + 1;
            if (line == firstCodeLine(lines)) {
                entries.add(new SuppressionIndex.Entry(SuppressionIndex.Granularity.FILE, 1, Integer.MAX_VALUE, ids));
            }
            entries.add(new SuppressionIndex.Entry(SuppressionIndex.Granularity.LINE, line, line + 1, ids));
        }
        return entries.isEmpty() ? SuppressionIndex.NONE : new SuppressionIndex(entries);
    }

    private static int firstCodeLine(String[] lines) {
        for (int i = 0; i < lines.length; i++) {
            if (!lines[i].isBlank()) return i + 1;
        }
        return -1;
    }

    /** Analyzer ids of a marker (empty for the generic form), or null when the text has no marker. */
    static Set<String> markerIds(String text) {
        Matcher m = MARKER.matcher(text);
        if (!m.find()) return null;
        String list = m.group(1);
        if (list == null) return Collections.emptySet();
        Set<String> ids = new LinkedHashSet<>();
        for (String id : list.split(",")) {
            String trimmed = id.trim().toLowerCase();
            if (!trimmed.isEmpty()) ids.add(trimmed);
        }
        return ids;
    }

    private static int firstDeclarationLine(SyntaxNode root) {
        for (SyntaxNode child : root.children()) {
            if (child.is("php_tag", "text", "namespace_use_declaration", "declare_statement")) continue;
            if (child.is("namespace_definition") && child.child("body") == null
                    && child.firstChild("compound_statement") == null) {
                continue;
            }
            return child.startLine();
        }
        return Integer.MAX_VALUE;
    }

    // The class must be the next code after the comment: only blank lines, other comments or
    // attributes may sit in between.
    private static SyntaxNode classDirectlyAfter(SyntaxNode comment, List<SyntaxNode> classes, SyntaxTree tree) {
        for (SyntaxNode cls : classes) {
            if (cls.startByte() < comment.endByte()) continue;
            if (onlyTriviaBetween(comment.endLine() + 1, cls.startLine() - 1, tree)) return cls;
        }
        return null;
    }

    private static boolean onlyTriviaBetween(int fromLine, int toLine, SyntaxTree tree) {
        for (int line = fromLine; line <= toLine; line++) {
            String text = tree.line(line).trim();
            if (text.isEmpty() || text.startsWith("//") || text.startsWith("#") || text.startsWith("*")
                    || text.startsWith("/*")) {
                continue;
            }
            return false;
        }
        return true;
    }
}
