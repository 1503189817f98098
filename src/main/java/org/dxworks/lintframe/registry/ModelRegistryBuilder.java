package org.dxworks.lintframe.registry;

import org.dxworks.lintframe.scope.FileSymbols;
import org.dxworks.lintframe.syntax.ParseException;
import org.dxworks.lintframe.syntax.PhpNodes;
import org.dxworks.lintframe.syntax.PhpParser;
import org.dxworks.lintframe.syntax.SyntaxNode;
import org.dxworks.lintframe.syntax.SyntaxTree;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Single-threaded pre-pass over the model directories. Unreadable or unparseable files are
 * skipped with a warning; the result is never null.
 */
public class ModelRegistryBuilder {

    private final PhpParser parser;
    private final List<String> baseClasses;
    private final Map<String, String> tableMappings;

    public ModelRegistryBuilder(PhpParser parser, List<String> baseClasses, Map<String, String> tableMappings) {
        this.parser = parser;
        this.baseClasses = baseClasses == null ? Collections.emptyList() : baseClasses;
        this.tableMappings = tableMappings == null ? Collections.emptyMap() : tableMappings;
    }

    public ModelRegistry build(Path projectRoot, List<String> modelPaths) {
        List<ModelDeclaration> declarations = new ArrayList<>();
        for (String modelPath : modelPaths) {
            Path dir = projectRoot.resolve(modelPath);
            if (!Files.isDirectory(dir)) continue;
            for (Path file : listPhpFiles(dir)) {
                declarations.addAll(scanFile(projectRoot, file));
            }
        }
        return new ModelRegistry(declarations, baseClasses, tableMappings);
    }

    /** Builds a registry from in-memory sources keyed by display path. */
    public ModelRegistry buildFromSources(Map<String, String> sources) {
        List<ModelDeclaration> declarations = new ArrayList<>();
        for (Map.Entry<String, String> e : sources.entrySet()) {
            try {
                declarations.addAll(declarationsIn(parser.parse(e.getValue()), e.getKey()));
            } catch (ParseException ex) {
                System.err.println("Warning: Skipping unparseable model file " + e.getKey() + ": " + ex.getMessage());
            }
        }
        return new ModelRegistry(declarations, baseClasses, tableMappings);
    }

    private List<Path> listPhpFiles(Path dir) {
        try (Stream<Path> paths = Files.walk(dir)) {
            return paths.filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(".php"))
                    .filter(p -> !p.getFileName().toString().endsWith(".blade.php"))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            System.err.println("Warning: Cannot list model directory " + dir + ": " + e.getMessage());
            return Collections.emptyList();
        }
    }

    private List<ModelDeclaration> scanFile(Path projectRoot, Path file) {
        String display = projectRoot.relativize(file).toString().replace('\\', '/');
        try {
            String content = Files.readString(file, StandardCharsets.UTF_8);
            return declarationsIn(parser.parse(content), display);
        } catch (ParseException e) {
            System.err.println("Warning: Skipping unparseable model file " + display + ": " + e.getMessage());
        } catch (IOException e) {
            System.err.println("Warning: Cannot read model file " + display + ": " + e.getMessage());
        }
        return Collections.emptyList();
    }

    static List<ModelDeclaration> declarationsIn(SyntaxTree tree, String file) {
        List<ModelDeclaration> result = new ArrayList<>();
        FileSymbols symbols = FileSymbols.of(tree);
        for (FileSymbols.DeclaredClass declared : symbols.classes()) {
            if (!declared.node.is("class_declaration")) continue;
            ModelDeclaration d = new ModelDeclaration(declared.fqcn, declared.shortName, declared.parent, file);
            SyntaxNode body = PhpNodes.body(declared.node);
            if (body != null) readTableOverrides(body, d);
            result.add(d);
        }
        return result;
    }

    private static void readTableOverrides(SyntaxNode body, ModelDeclaration d) {
        for (SyntaxNode member : body.children()) {
            if (member.is("property_declaration")) {
                for (SyntaxNode element : member.childrenOfKind("property_element")) {
                    SyntaxNode var = element.firstChild("variable_name");
                    if (!"table".equals(PhpNodes.variableName(var))) continue;
                    SyntaxNode value = propertyDefault(element);
                    if (value == null) continue;
                    String literal = PhpNodes.stringValue(value);
                    if (literal != null) {
                        d.tableProperty = literal;
                    } else {
                        d.tablePropertyDynamic = true;
                    }
                }
            } else if (member.is("method_declaration")) {
                String name = PhpNodes.declarationName(member);
                if (name == null || !name.equalsIgnoreCase("getTable")) continue;
                String literal = literalReturn(PhpNodes.body(member));
                if (literal != null) {
                    d.getTableLiteral = literal;
                } else {
                    d.getTableDynamic = true;
                }
            }
        }
    }

    private static SyntaxNode propertyDefault(SyntaxNode element) {
        SyntaxNode value = element.child("default_value");
        if (value != null) return value;
        SyntaxNode initializer = element.firstChild("property_initializer");
        if (initializer != null) return initializer.child(0);
        return null;
    }

    /** Literal of a body consisting of exactly {@code return '<literal>';}, else null. */
    private static String literalReturn(SyntaxNode body) {
        if (body == null || body.childCount() != 1) return null;
        SyntaxNode statement = body.child(0);
        if (!statement.is("return_statement") || statement.childCount() != 1) return null;
        return PhpNodes.stringValue(statement.child(0));
    }
}
