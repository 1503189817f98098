package org.dxworks.lintframe.syntax;

import org.treesitter.TSLanguage;
import org.treesitter.TSNode;
import org.treesitter.TSParser;
import org.treesitter.TSTree;

/**
 * Parses PHP source into an owned {@link SyntaxTree}.
 * <p>
 * The grammar is shared; a fresh native parser is created per call, so instances may be used
 * from several worker threads at once.
 */
public class PhpParser {

    private static final TSLanguage PHP;

    static {
        try {
            PHP = (TSLanguage) Class.forName("org.treesitter.TreeSitterPhp").getDeclaredConstructor().newInstance();
        } catch (Exception e) {
            throw new RuntimeException("Failed to initialize Tree-sitter PHP grammar", e);
        }
    }

    public SyntaxTree parse(String source) throws ParseException {
        String content = stripBom(source);
        TSParser parser = new TSParser();
        parser.setLanguage(PHP);
        TSTree tree = parser.parseString(null, content);
        if (tree == null) {
            throw new ParseException("Parser produced no tree", 1);
        }
        TSNode root = tree.getRootNode();
        if (root == null || root.isNull()) {
            throw new ParseException("Parser produced no tree", 1);
        }
        if (root.hasError()) {
            int line = TreeSitterHelper.firstErrorLine(root);
            throw new ParseException("Syntax error near line " + Math.max(line, 1), Math.max(line, 1));
        }
        return TreeSitterHelper.materialize(content, root);
    }

    static String stripBom(String content) {
        if (content != null && !content.isEmpty() && content.charAt(0) == '\uFEFF') {
            return content.substring(1);
        }
        return content;
    }
}
