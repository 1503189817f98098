package org.dxworks.lintframe.registry;

import org.dxworks.lintframe.scope.ClassHierarchy;
import org.dxworks.lintframe.syntax.PhpNodes;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Inheritance graph of the scanned model directories and the table each model maps to.
 * <p>
 * Built once per run and read-only afterwards, so concurrent readers need no locking.
 */
public class ModelRegistry implements ClassHierarchy {

    public static final List<String> DEFAULT_BASE_CLASSES = List.of(
            "Illuminate\\Database\\Eloquent\\Model",
            "Illuminate\\Foundation\\Auth\\User",
            "Illuminate\\Database\\Eloquent\\Relations\\Pivot",
            "Illuminate\\Database\\Eloquent\\Relations\\MorphPivot"
    );

    private static final Set<String> BASE_SHORT_NAMES = Set.of("Model", "Authenticatable", "Pivot", "MorphPivot");

    private static final Map<String, ModelRegistry> CACHE = new ConcurrentHashMap<>();

    private final Map<String, ModelDeclaration> declarations = new HashMap<>();
    private final Set<String> baseClasses;
    private final Set<String> models = new TreeSet<>();
    private final Map<String, String> tables = new TreeMap<>();
    private final Map<String, List<String>> modelsByShortName = new HashMap<>();
    private final Set<String> modelTables = new HashSet<>();

    public ModelRegistry(Collection<ModelDeclaration> declared, Collection<String> baseClasses,
                         Map<String, String> tableMappings) {
        for (ModelDeclaration d : declared) declarations.putIfAbsent(d.fqcn, d);
        Set<String> bases = new LinkedHashSet<>();
        for (String b : (baseClasses == null || baseClasses.isEmpty() ? DEFAULT_BASE_CLASSES : baseClasses)) {
            bases.add(PhpNodes.stripLeadingBackslash(b));
        }
        this.baseClasses = Collections.unmodifiableSet(bases);
        Map<String, String> mappings = tableMappings == null ? Collections.emptyMap() : tableMappings;

        for (ModelDeclaration d : declarations.values()) {
            if (!descendsFromBase(d.fqcn)) continue;
            models.add(d.fqcn);
            modelsByShortName.computeIfAbsent(d.shortName, k -> new ArrayList<>()).add(d.fqcn);
            String mapped = mappings.containsKey(d.fqcn) ? mappings.get(d.fqcn) : mappings.get(d.shortName);
            String table = mapped != null ? mapped : computeTable(d);
            if (table != null) {
                tables.put(d.fqcn, table);
                modelTables.add(table);
            }
        }
    }

    public static ModelRegistry empty() {
        return new ModelRegistry(Collections.emptyList(), DEFAULT_BASE_CLASSES, Collections.emptyMap());
    }

    /**
     * Process-wide cache keyed by the scanned directories, so repeated runs over the same tree
     * do not rescan it.
     */
    public static ModelRegistry cached(String key, Supplier<ModelRegistry> builder) {
        return CACHE.computeIfAbsent(key, k -> builder.get());
    }

    public static void clearCache() {
        CACHE.clear();
    }

    public Optional<String> resolveTable(String className) {
        if (className == null) return Optional.empty();
        return Optional.ofNullable(tables.get(PhpNodes.stripLeadingBackslash(className)));
    }

    public boolean isModel(String className) {
        return className != null && models.contains(PhpNodes.stripLeadingBackslash(className));
    }

    /** True when the class was found in a model directory, model or not. */
    public boolean isDeclared(String className) {
        return className != null && declarations.containsKey(PhpNodes.stripLeadingBackslash(className));
    }

    /**
     * Model for a class reference: the exact name when it is a model, otherwise the single model
     * sharing its short name (references from files without the matching import).
     */
    public Optional<String> findModel(String className) {
        if (className == null) return Optional.empty();
        String name = PhpNodes.stripLeadingBackslash(className);
        if (models.contains(name)) return Optional.of(name);
        if (declarations.containsKey(name)) return Optional.empty();
        List<String> candidates = modelsByShortName.get(PhpNodes.shortName(name));
        if (candidates != null && candidates.size() == 1) return Optional.of(candidates.get(0));
        return Optional.empty();
    }

    public boolean hasModelForTable(String table) {
        return modelTables.contains(table);
    }

    @Override
    public Optional<String> parentOf(String fqcn) {
        ModelDeclaration d = declarations.get(fqcn);
        return d == null ? Optional.empty() : Optional.ofNullable(d.parent);
    }

    public int size() {
        return models.size();
    }

    private boolean descendsFromBase(String fqcn) {
        Set<String> visited = new HashSet<>();
        String current = fqcn;
        while (current != null) {
            if (!visited.add(current)) return false;
            if (!current.equals(fqcn) && baseClasses.contains(current)) return true;
            ModelDeclaration d = declarations.get(current);
            if (d == null) {
                return !current.equals(fqcn) && BASE_SHORT_NAMES.contains(PhpNodes.shortName(current));
            }
            current = d.parent;
        }
        return false;
    }

    private String computeTable(ModelDeclaration model) {
        Set<String> visited = new HashSet<>();
        ModelDeclaration current = model;
        while (current != null && visited.add(current.fqcn)) {
            if (current.getTableLiteral != null) return current.getTableLiteral;
            if (current.tableProperty != null) return current.tableProperty;
            if (current.getTableDynamic || current.tablePropertyDynamic) return null;
            current = current.parent == null ? null : declarations.get(current.parent);
        }
        return Pluralizer.tableName(model.shortName);
    }
}
