package org.dxworks.lintframe.scope;

import org.dxworks.lintframe.syntax.PhpNodes;
import org.dxworks.lintframe.syntax.SyntaxNode;
import org.dxworks.lintframe.syntax.SyntaxTree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Names declared and imported by one file: namespaces, {@code use} aliases and class declarations
 * with their parents resolved to fully qualified names.
 */
public class FileSymbols {

    public static class DeclaredClass {
        public final SyntaxNode node;
        public final String fqcn;
        public final String shortName;
        public final String parent;

        DeclaredClass(SyntaxNode node, String fqcn, String shortName, String parent) {
            this.node = node;
            this.fqcn = fqcn;
            this.shortName = shortName;
            this.parent = parent;
        }
    }

    private final Map<String, String> imports = new LinkedHashMap<>();
    private final List<SyntaxNode> bracelessNamespaces = new ArrayList<>();
    private final List<DeclaredClass> classes = new ArrayList<>();
    private final Map<String, DeclaredClass> classesByFqcn = new HashMap<>();
    private final Map<SyntaxNode, DeclaredClass> classesByNode = new HashMap<>();

    private FileSymbols() {
    }

    public static FileSymbols of(SyntaxTree tree) {
        FileSymbols symbols = new FileSymbols();
        SyntaxNode root = tree.root();
        for (SyntaxNode ns : root.findAll("namespace_definition")) {
            if (ns.child("body") == null && ns.firstChild("compound_statement") == null) {
                symbols.bracelessNamespaces.add(ns);
            }
        }
        for (SyntaxNode use : root.findAll("namespace_use_declaration")) {
            symbols.collectImports(use);
        }
        for (SyntaxNode decl : root.findAll(PhpNodes.CLASS_LIKE)) {
            String shortName = PhpNodes.declarationName(decl);
            if (shortName == null) continue;
            String namespace = symbols.namespaceAt(decl);
            String fqcn = namespace.isEmpty() ? shortName : namespace + "\\" + shortName;
            String parentWritten = PhpNodes.baseClassName(decl);
            String parent = parentWritten == null ? null : symbols.resolve(parentWritten, decl);
            DeclaredClass declared = new DeclaredClass(decl, fqcn, shortName, parent);
            symbols.classes.add(declared);
            symbols.classesByFqcn.putIfAbsent(fqcn, declared);
            symbols.classesByNode.put(decl, declared);
        }
        return symbols;
    }

    private void collectImports(SyntaxNode use) {
        String text = use.text();
        if (text.startsWith("use function") || text.startsWith("use const")) return;
        SyntaxNode group = use.firstChild("namespace_use_group");
        if (group != null) {
            SyntaxNode prefixNode = use.firstChild("namespace_name", "qualified_name", "name");
            String prefix = prefixNode == null ? "" : PhpNodes.stripLeadingBackslash(prefixNode.text());
            for (SyntaxNode clause : group.children()) {
                addClause(clause, prefix);
            }
            return;
        }
        for (SyntaxNode clause : use.childrenOfKind("namespace_use_clause")) {
            addClause(clause, "");
        }
    }

    private void addClause(SyntaxNode clause, String prefix) {
        List<SyntaxNode> names = clause.childrenOfKind("name", "qualified_name", "namespace_name");
        if (names.isEmpty()) return;
        SyntaxNode target = names.get(0);
        String alias = null;
        SyntaxNode aliasNode = clause.child("alias");
        if (aliasNode == null) {
            SyntaxNode aliasing = clause.firstChild("namespace_aliasing_clause");
            if (aliasing != null) aliasNode = aliasing.firstChild("name");
        }
        if (aliasNode == null && names.size() > 1) aliasNode = names.get(names.size() - 1);
        if (aliasNode != null && aliasNode != target) alias = aliasNode.text();

        String fqcn = PhpNodes.stripLeadingBackslash(target.text());
        if (!prefix.isEmpty()) fqcn = prefix + "\\" + fqcn;
        imports.put(alias != null ? alias : PhpNodes.shortName(fqcn), fqcn);
    }

    /** Namespace enclosing {@code node}: a braced namespace block, else the last braceless declaration before it. */
    public String namespaceAt(SyntaxNode node) {
        SyntaxNode braced = node.ancestor("namespace_definition");
        if (braced != null) return nameOf(braced);
        String current = "";
        for (SyntaxNode ns : bracelessNamespaces) {
            if (ns.startByte() < node.startByte()) current = nameOf(ns);
        }
        return current;
    }

    static String nameOf(SyntaxNode namespaceDefinition) {
        SyntaxNode name = namespaceDefinition.child("name");
        if (name == null) name = namespaceDefinition.firstChild("namespace_name");
        return name == null ? "" : PhpNodes.stripLeadingBackslash(name.text());
    }

    /**
     * Resolves a class name as written at {@code node}. Relative names ({@code self}, {@code static},
     * {@code parent}) are not handled here.
     */
    public String resolve(String written, SyntaxNode node) {
        return resolve(written, namespaceAt(node));
    }

    public String resolve(String written, String namespace) {
        if (written == null || written.isEmpty()) return null;
        if (written.startsWith("\\")) return written.substring(1);
        int sep = written.indexOf('\\');
        String head = sep >= 0 ? written.substring(0, sep) : written;
        String imported = importFor(head);
        if (imported != null) {
            return sep >= 0 ? imported + written.substring(sep) : imported;
        }
        return namespace == null || namespace.isEmpty() ? written : namespace + "\\" + written;
    }

    private String importFor(String alias) {
        String exact = imports.get(alias);
        if (exact != null) return exact;
        for (Map.Entry<String, String> e : imports.entrySet()) {
            if (e.getKey().equalsIgnoreCase(alias)) return e.getValue();
        }
        return null;
    }

    public Map<String, String> imports() {
        return Collections.unmodifiableMap(imports);
    }

    public List<DeclaredClass> classes() {
        return Collections.unmodifiableList(classes);
    }

    public DeclaredClass declaredClass(String fqcn) {
        return classesByFqcn.get(fqcn);
    }

    public DeclaredClass declaredClass(SyntaxNode node) {
        return classesByNode.get(node);
    }
}
