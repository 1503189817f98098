package org.dxworks.lintframe;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.dxworks.lintframe.analyzer.AnalyzerOptions;
import org.dxworks.lintframe.model.Category;
import org.dxworks.lintframe.registry.ModelRegistry;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Global settings plus one option bag per analyzer id, read from {@code lintframe-config.yml}.
 * Instances are immutable; the {@code with...} methods return modified copies.
 */
public class LintframeConfig {

    private static final int DEFAULT_MAX_FILE_LINES = 20000;
    private static final String CONFIG_FILE_NAME = "lintframe-config.yml";
    private static final String DEFAULT_ENVIRONMENT = "production";
    private static final List<String> DEFAULT_PATHS = List.of("app", "routes", "resources/views", "database", "config");
    private static final List<String> DEFAULT_EXCLUDED_PATHS = List.of(
            "**/vendor/**", "**/node_modules/**", "**/storage/**", "**/bootstrap/cache/**");
    private static final List<String> DEFAULT_MODEL_PATHS = List.of("app/Models");

    private final int maxFileLines;
    private final int threads;
    private final String environment;
    private final List<String> paths;
    private final List<String> excludedPaths;
    private final Set<String> disabledAnalyzers;
    private final Set<Category> enabledCategories;
    private final List<String> modelPaths;
    private final Map<String, String> tableMappings;
    private final List<String> baseClasses;
    private final Map<String, Map<String, Object>> analyzers;

    private LintframeConfig(int maxFileLines, int threads, String environment, List<String> paths,
                            List<String> excludedPaths, Set<String> disabledAnalyzers,
                            Set<Category> enabledCategories, List<String> modelPaths,
                            Map<String, String> tableMappings, List<String> baseClasses,
                            Map<String, Map<String, Object>> analyzers) {
        this.maxFileLines = maxFileLines;
        this.threads = threads;
        this.environment = environment;
        this.paths = List.copyOf(paths);
        this.excludedPaths = List.copyOf(excludedPaths);
        this.disabledAnalyzers = Set.copyOf(disabledAnalyzers);
        this.enabledCategories = Set.copyOf(enabledCategories);
        this.modelPaths = List.copyOf(modelPaths);
        this.tableMappings = Map.copyOf(tableMappings);
        this.baseClasses = List.copyOf(baseClasses);
        this.analyzers = Collections.unmodifiableMap(new LinkedHashMap<>(analyzers));
    }

    public static LintframeConfig defaults() {
        return new LintframeConfig(DEFAULT_MAX_FILE_LINES, 0, DEFAULT_ENVIRONMENT, DEFAULT_PATHS,
                DEFAULT_EXCLUDED_PATHS, Set.of(), Set.of(), DEFAULT_MODEL_PATHS, Map.of(),
                ModelRegistry.DEFAULT_BASE_CLASSES, Map.of());
    }

    public static LintframeConfig load() {
        return load(Paths.get(CONFIG_FILE_NAME));
    }

    /**
     * Reads the YAML file. A missing file yields the defaults; a malformed one is a
     * {@link ConfigurationException}.
     */
    public static LintframeConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            return defaults();
        }
        try {
            ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory())
                    .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
            YamlConfig yamlConfig = yamlMapper.readValue(configPath.toFile(), YamlConfig.class);
            return yamlConfig == null ? defaults() : fromYaml(yamlConfig);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read configuration " + configPath + ": " + e.getMessage(), e);
        }
    }

    private static LintframeConfig fromYaml(YamlConfig yaml) {
        int effectiveMaxFileLines = (yaml.maxFileLines != null && yaml.maxFileLines > 0)
                ? yaml.maxFileLines
                : DEFAULT_MAX_FILE_LINES;
        if (yaml.threads != null && yaml.threads < 0) {
            throw new ConfigurationException("threads must be >= 0, got " + yaml.threads);
        }
        int effectiveThreads = yaml.threads != null ? yaml.threads : 0;
        String effectiveEnvironment = yaml.environment != null ? yaml.environment : DEFAULT_ENVIRONMENT;

        Set<Category> categories = new HashSet<>();
        if (yaml.enabledCategories != null) {
            for (String name : yaml.enabledCategories) {
                Category category = Category.fromValue(name);
                if (category == null) {
                    throw new ConfigurationException("Unknown category in enabledCategories: " + name);
                }
                categories.add(category);
            }
        }

        RegistryYaml registry = yaml.registry != null ? yaml.registry : new RegistryYaml();
        Map<String, Map<String, Object>> analyzerBags = new LinkedHashMap<>();
        if (yaml.analyzers != null) {
            for (Map.Entry<String, Object> e : yaml.analyzers.entrySet()) {
                analyzerBags.put(e.getKey(), toOptionBag(e.getKey(), e.getValue()));
            }
        }

        return new LintframeConfig(
                effectiveMaxFileLines,
                effectiveThreads,
                effectiveEnvironment,
                yaml.paths != null ? yaml.paths : DEFAULT_PATHS,
                yaml.excludedPaths != null ? yaml.excludedPaths : DEFAULT_EXCLUDED_PATHS,
                yaml.disabledAnalyzers != null ? new HashSet<>(yaml.disabledAnalyzers) : Set.of(),
                categories,
                registry.modelPaths != null ? registry.modelPaths : DEFAULT_MODEL_PATHS,
                registry.tableMappings != null ? registry.tableMappings : Map.of(),
                registry.baseClasses != null && !registry.baseClasses.isEmpty()
                        ? registry.baseClasses
                        : ModelRegistry.DEFAULT_BASE_CLASSES,
                analyzerBags);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> toOptionBag(String analyzerId, Object value) {
        if (value == null) return new HashMap<>();
        if (!(value instanceof Map<?, ?> map)) {
            throw new ConfigurationException("Options for analyzer '" + analyzerId + "' must be a mapping");
        }
        return new LinkedHashMap<>((Map<String, Object>) map);
    }

    public int getMaxFileLines() {
        return maxFileLines;
    }

    /** Worker count; 0 in the file means one per available processor. */
    public int getThreads() {
        return threads > 0 ? threads : Math.max(1, Runtime.getRuntime().availableProcessors());
    }

    public String getEnvironment() {
        return environment;
    }

    public List<String> getPaths() {
        return paths;
    }

    public List<String> getExcludedPaths() {
        return excludedPaths;
    }

    public List<String> getModelPaths() {
        return modelPaths;
    }

    public Map<String, String> getTableMappings() {
        return tableMappings;
    }

    public List<String> getBaseClasses() {
        return baseClasses;
    }

    public boolean isAnalyzerEnabled(String analyzerId, Category category) {
        if (disabledAnalyzers.contains(analyzerId)) return false;
        return enabledCategories.isEmpty() || enabledCategories.contains(category);
    }

    public AnalyzerOptions getAnalyzerOptions(String analyzerId) {
        Map<String, Object> bag = analyzers.get(analyzerId);
        return new AnalyzerOptions(analyzerId, bag == null ? Map.of() : bag);
    }

    /** Key identifying the registry inputs, used to share a built registry between runs. */
    public String registryCacheKey(Path projectRoot) {
        List<String> dirs = new ArrayList<>();
        for (String p : modelPaths) dirs.add(projectRoot.resolve(p).toAbsolutePath().normalize().toString());
        Collections.sort(dirs);
        return String.join("|", dirs) + "#" + baseClasses + "#" + new TreeMap<>(tableMappings);
    }

    public LintframeConfig withAnalyzerOptions(String analyzerId, Map<String, Object> options) {
        Map<String, Map<String, Object>> copy = new LinkedHashMap<>(analyzers);
        copy.put(analyzerId, new LinkedHashMap<>(options));
        return new LintframeConfig(maxFileLines, threads, environment, paths, excludedPaths, disabledAnalyzers,
                enabledCategories, modelPaths, tableMappings, baseClasses, copy);
    }

    public LintframeConfig withPaths(List<String> newPaths) {
        return new LintframeConfig(maxFileLines, threads, environment, newPaths, excludedPaths, disabledAnalyzers,
                enabledCategories, modelPaths, tableMappings, baseClasses, analyzers);
    }

    public LintframeConfig withModelPaths(List<String> newModelPaths) {
        return new LintframeConfig(maxFileLines, threads, environment, paths, excludedPaths, disabledAnalyzers,
                enabledCategories, newModelPaths, tableMappings, baseClasses, analyzers);
    }

    public LintframeConfig withEnvironment(String newEnvironment) {
        return new LintframeConfig(maxFileLines, threads, newEnvironment, paths, excludedPaths, disabledAnalyzers,
                enabledCategories, modelPaths, tableMappings, baseClasses, analyzers);
    }

    public LintframeConfig withThreads(int newThreads) {
        return new LintframeConfig(maxFileLines, newThreads, environment, paths, excludedPaths, disabledAnalyzers,
                enabledCategories, modelPaths, tableMappings, baseClasses, analyzers);
    }

    public LintframeConfig withDisabledAnalyzers(Set<String> ids) {
        return new LintframeConfig(maxFileLines, threads, environment, paths, excludedPaths, ids,
                enabledCategories, modelPaths, tableMappings, baseClasses, analyzers);
    }

    public LintframeConfig withMaxFileLines(int newMaxFileLines) {
        int effective = newMaxFileLines > 0 ? newMaxFileLines : DEFAULT_MAX_FILE_LINES;
        return new LintframeConfig(effective, threads, environment, paths, excludedPaths, disabledAnalyzers,
                enabledCategories, modelPaths, tableMappings, baseClasses, analyzers);
    }

    private static class YamlConfig {
        public Integer maxFileLines;
        public Integer threads;
        public String environment;
        public List<String> paths;
        public List<String> excludedPaths;
        public List<String> disabledAnalyzers;
        public List<String> enabledCategories;
        public RegistryYaml registry;
        public Map<String, Object> analyzers;
    }

    private static class RegistryYaml {
        public List<String> modelPaths;
        public Map<String, String> tableMappings;
        public List<String> baseClasses;
    }
}
