package org.dxworks.lintframe.syntax;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A fluent call chain such as {@code User::with('posts')->where('active', 1)->get()}, decomposed
 * into its root expression and the calls applied to it, innermost first.
 */
public class MethodChain {

    public static class Link {
        public final String name;
        public final SyntaxNode call;
        public final boolean isStatic;

        Link(String name, SyntaxNode call, boolean isStatic) {
            this.name = name;
            this.call = call;
            this.isStatic = isStatic;
        }

        public List<SyntaxNode> arguments() {
            return PhpNodes.arguments(call);
        }
    }

    private final SyntaxNode root;
    private final List<Link> links;

    MethodChain(SyntaxNode root, List<Link> links) {
        this.root = root;
        this.links = links;
    }

    /** Receiver of the innermost call: a class name for static chains, otherwise an expression. */
    public SyntaxNode root() {
        return root;
    }

    public List<Link> links() {
        return Collections.unmodifiableList(links);
    }

    public boolean isEmpty() {
        return links.isEmpty();
    }

    public boolean isStatic() {
        return !links.isEmpty() && links.get(0).isStatic;
    }

    /** Class named by a static chain root (leading backslash removed), or null. */
    public String staticClass() {
        if (!isStatic() || root == null) return null;
        if (root.is("name", "qualified_name", "relative_scope")) {
            return PhpNodes.stripLeadingBackslash(root.text());
        }
        return null;
    }

    /** Variable name at the root (without {@code $}), or null. */
    public String rootVariable() {
        return PhpNodes.variableName(root);
    }

    public List<String> names() {
        List<String> names = new ArrayList<>();
        for (Link link : links) names.add(link.name);
        return names;
    }

    public boolean contains(String... methodNames) {
        for (Link link : links) {
            for (String m : methodNames) {
                if (m.equals(link.name)) return true;
            }
        }
        return false;
    }

    public Link first() {
        return links.isEmpty() ? null : links.get(0);
    }

    public Link last() {
        return links.isEmpty() ? null : links.get(links.size() - 1);
    }

    public Link find(String methodName) {
        for (Link link : links) {
            if (methodName.equals(link.name)) return link;
        }
        return null;
    }

    public String render() {
        StringBuilder sb = new StringBuilder();
        String cls = staticClass();
        if (cls != null) {
            sb.append(cls);
        } else if (root != null) {
            sb.append(root.text().length() > 40 ? root.kind() : root.text());
        }
        for (Link link : links) {
            sb.append(link.isStatic ? "::" : "->").append(link.name).append("()");
        }
        return sb.toString();
    }
}
