package org.dxworks.lintframe;

import org.dxworks.lintframe.analyzer.Analyzer;
import org.dxworks.lintframe.analyzer.FileContext;
import org.dxworks.lintframe.analyzer.ProjectAnalyzer;
import org.dxworks.lintframe.analyzer.ProjectContext;
import org.dxworks.lintframe.analyzer.SourceFile;
import org.dxworks.lintframe.model.AnalyzerReport;
import org.dxworks.lintframe.model.Issue;
import org.dxworks.lintframe.model.RunReport;
import org.dxworks.lintframe.registry.ModelRegistry;
import org.dxworks.lintframe.registry.ModelRegistryBuilder;
import org.dxworks.lintframe.syntax.ParseException;
import org.dxworks.lintframe.syntax.PhpParser;
import org.dxworks.lintframe.syntax.SyntaxTree;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs a set of analyzers over one project: collects files, builds the model registry, analyses
 * files on a worker pool, then lets project-level analyzers conclude.
 */
public class AnalysisRunner {

    private final LintframeConfig config;
    private final List<Analyzer> analyzers;
    private final PhpParser parser = new PhpParser();
    private boolean verbose = true;

    public AnalysisRunner(LintframeConfig config) {
        this(config, AnalyzerRegistry.buildAnalyzers(config));
    }

    public AnalysisRunner(LintframeConfig config, List<Analyzer> analyzers) {
        this.config = config;
        this.analyzers = List.copyOf(analyzers);
    }

    public AnalysisRunner quiet() {
        this.verbose = false;
        return this;
    }

    public RunReport run(Path projectRoot) throws IOException {
        Path root = projectRoot.toAbsolutePath().normalize();
        RunReport report = new RunReport();
        report.startedAt = Instant.now().toString();
        report.projectRoot = root.toString();

        List<SourceFile> files = new SourceFileCollector(config).collect(root);
        log("Found " + files.size() + " source files");

        ModelRegistry registry = ModelRegistry.cached(config.registryCacheKey(root),
                () -> new ModelRegistryBuilder(parser, config.getBaseClasses(), config.getTableMappings())
                        .build(root, config.getModelPaths()));
        log("Model registry: " + registry.size() + " models");

        ProjectContext project = new ProjectContext(root, config, registry, files.size());
        Map<Analyzer, AnalyzerReport> skipped = new LinkedHashMap<>();
        Map<Analyzer, AtomicInteger> accepted = new LinkedHashMap<>();
        Map<Analyzer, ConcurrentLinkedQueue<Issue>> found = new LinkedHashMap<>();
        List<Analyzer> active = new ArrayList<>();
        for (Analyzer analyzer : analyzers) {
            Optional<String> reason = analyzer.skipReason(project);
            if (reason.isPresent()) {
                skipped.put(analyzer, AnalyzerReport.skipped(analyzer.getMetadata(), reason.get()));
                continue;
            }
            int count = 0;
            for (SourceFile file : files) {
                if (analyzer.accepts(file)) count++;
            }
            if (count == 0 && !(analyzer instanceof ProjectAnalyzer)) {
                skipped.put(analyzer, AnalyzerReport.skipped(analyzer.getMetadata(), "No applicable files found"));
                continue;
            }
            active.add(analyzer);
            accepted.put(analyzer, new AtomicInteger(count));
            found.put(analyzer, new ConcurrentLinkedQueue<>());
        }

        AtomicInteger parseFailures = new AtomicInteger();
        AtomicInteger analysisErrors = new AtomicInteger();
        AtomicInteger progress = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(config.getThreads());
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (SourceFile file : files) {
                futures.add(pool.submit(() -> {
                    int current = progress.incrementAndGet();
                    log("[" + current + "/" + files.size() + "] Analyzing " + file.kind.getName() + ": " + file.relativePath);
                    analyzeFile(file, registry, active, found, parseFailures, analysisErrors);
                }));
            }
            for (Future<?> future : futures) {
                future.get();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Analysis interrupted", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Analysis worker failed", e.getCause());
        } finally {
            pool.shutdownNow();
        }

        for (Analyzer analyzer : analyzers) {
            AnalyzerReport skippedReport = skipped.get(analyzer);
            if (skippedReport != null) {
                report.reports.add(skippedReport);
                continue;
            }
            List<Issue> issues = new ArrayList<>(found.get(analyzer));
            if (analyzer instanceof ProjectAnalyzer projectAnalyzer) {
                try {
                    issues.addAll(projectAnalyzer.conclude(project));
                } catch (RuntimeException e) {
                    analysisErrors.incrementAndGet();
                    warn("Error in " + analyzer.getId() + " while concluding: " + e);
                }
            }
            report.reports.add(AnalyzerReport.of(analyzer.getMetadata(), accepted.get(analyzer).get(), issues));
        }

        report.filesAnalyzed = files.size();
        report.parseFailures = parseFailures.get();
        report.analysisErrors = analysisErrors.get();
        report.computeStatus();
        report.endedAt = Instant.now().toString();
        return report;
    }

    private void analyzeFile(SourceFile file, ModelRegistry registry, List<Analyzer> active,
                             Map<Analyzer, ConcurrentLinkedQueue<Issue>> found,
                             AtomicInteger parseFailures, AtomicInteger analysisErrors) {
        FileContext context;
        if (file.kind == FileKind.PHP) {
            SyntaxTree tree;
            try {
                tree = parser.parse(file.content);
            } catch (ParseException e) {
                parseFailures.incrementAndGet();
                warn("Warning: Skipping " + file.relativePath + ": " + e.getMessage());
                return;
            }
            context = FileContext.forSource(file, tree, registry);
        } else {
            context = FileContext.forTemplate(file, registry);
        }

        boolean failed = false;
        for (Analyzer analyzer : active) {
            if (!analyzer.accepts(file)) continue;
            try {
                found.get(analyzer).addAll(analyzer.analyze(context));
            } catch (RuntimeException e) {
                failed = true;
                warn("Error in " + analyzer.getId() + " analyzing " + file.relativePath + ": " + e);
            }
        }
        if (failed) analysisErrors.incrementAndGet();
    }

    private void log(String message) {
        if (!verbose) return;
        synchronized (System.out) {
            System.out.println(message);
        }
    }

    private static void warn(String message) {
        synchronized (System.err) {
            System.err.println(message);
        }
    }
}
