package org.dxworks.lintframe;

import org.dxworks.lintframe.analyzer.Analyzer;
import org.dxworks.lintframe.analyzer.AnalyzerOptions;
import org.dxworks.lintframe.analyzer.FileContext;
import org.dxworks.lintframe.analyzer.SourceFile;
import org.dxworks.lintframe.model.Issue;
import org.dxworks.lintframe.registry.ModelRegistry;
import org.dxworks.lintframe.registry.ModelRegistryBuilder;
import org.dxworks.lintframe.syntax.ParseException;
import org.dxworks.lintframe.syntax.PhpParser;
import org.dxworks.lintframe.syntax.SyntaxTree;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class TestUtils {

    public static final Path SAMPLES = Paths.get("src/test/resources/samples/php");
    public static final Path LARAVEL_APP = SAMPLES.resolve("laravel-app");

    private static final PhpParser PARSER = new PhpParser();

    public static SyntaxTree parse(String source) {
        try {
            return PARSER.parse(source);
        } catch (ParseException e) {
            throw new AssertionError("Fixture does not parse: " + e.getMessage(), e);
        }
    }

    public static AnalyzerOptions options(String analyzerId, Object... keyValues) {
        Map<String, Object> values = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            values.put((String) keyValues[i], keyValues[i + 1]);
        }
        return new AnalyzerOptions(analyzerId, values);
    }

    /** Registry built from in-memory model sources, keyed by their display path. */
    public static ModelRegistry registry(String... modelSources) {
        Map<String, String> sources = new LinkedHashMap<>();
        for (int i = 0; i < modelSources.length; i++) {
            sources.put("app/Models/Model" + i + ".php", modelSources[i]);
        }
        return new ModelRegistryBuilder(PARSER, ModelRegistry.DEFAULT_BASE_CLASSES, Map.of()).buildFromSources(sources);
    }

    public static ModelRegistry userAndPostRegistry() {
        return registry(
                "<?php\nnamespace App\\Models;\nuse Illuminate\\Database\\Eloquent\\Model;\nclass User extends Model {}\n",
                "<?php\nnamespace App\\Models;\nuse Illuminate\\Database\\Eloquent\\Model;\nclass Post extends Model {}\n");
    }

    public static FileContext context(String relativePath, String source, ModelRegistry registry) {
        SourceFile file = sourceFile(relativePath, source);
        if (file.kind == FileKind.BLADE) return FileContext.forTemplate(file, registry);
        return FileContext.forSource(file, parse(source), registry);
    }

    public static SourceFile sourceFile(String relativePath, String source) {
        Path path = Paths.get(relativePath);
        FileKind kind = FileKind.detect(path).orElseThrow();
        return new SourceFile(path, relativePath, kind, source);
    }

    /** Runs the analyzer the way the runner does, honouring its path filters. */
    public static List<Issue> analyze(Analyzer analyzer, String relativePath, String source, ModelRegistry registry) {
        SourceFile file = sourceFile(relativePath, source);
        if (!analyzer.accepts(file)) return List.of();
        return analyzer.analyze(context(relativePath, source, registry));
    }

    public static List<Issue> analyze(Analyzer analyzer, String relativePath, String source) {
        return analyze(analyzer, relativePath, source, ModelRegistry.empty());
    }

    public static List<String> codes(List<Issue> issues) {
        List<String> codes = new ArrayList<>();
        for (Issue issue : issues) codes.add(issue.code);
        return codes;
    }

    public static List<Integer> lines(List<Issue> issues) {
        List<Integer> lines = new ArrayList<>();
        for (Issue issue : issues) lines.add(issue.line());
        return lines;
    }
}
