package org.dxworks.lintframe;

import org.dxworks.lintframe.analyzer.Analyzer;
import org.dxworks.lintframe.analyzer.AnalyzerOptions;
import org.dxworks.lintframe.analyzer.FileContext;
import org.dxworks.lintframe.analyzer.SourceFile;
import org.dxworks.lintframe.analyzer.bestpractices.EloquentNPlusOneAnalyzer;
import org.dxworks.lintframe.analyzer.bestpractices.MissingErrorTrackingAnalyzer;
import org.dxworks.lintframe.analyzer.bestpractices.QueryBuilderInControllerAnalyzer;
import org.dxworks.lintframe.model.AnalyzerMetadata;
import org.dxworks.lintframe.model.AnalyzerReport;
import org.dxworks.lintframe.model.Category;
import org.dxworks.lintframe.model.Issue;
import org.dxworks.lintframe.model.RunReport;
import org.dxworks.lintframe.model.Severity;
import org.dxworks.lintframe.model.Status;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import static org.dxworks.lintframe.TestUtils.LARAVEL_APP;
import static org.junit.jupiter.api.Assertions.*;

class AnalysisRunnerTest {

    private static RunReport run(LintframeConfig config) throws IOException {
        return new AnalysisRunner(config).quiet().run(LARAVEL_APP);
    }

    private static List<String> summary(RunReport report) {
        List<String> lines = new ArrayList<>();
        for (AnalyzerReport analyzerReport : report.reports) {
            for (Issue issue : analyzerReport.issues) {
                lines.add(analyzerReport.id + " " + issue.location + " " + issue.message);
            }
        }
        return lines;
    }

    @Test
    void run_LaravelApp_ReportsEveryAnalyzerInRegistrationOrder() throws IOException {
        RunReport report = run(LintframeConfig.defaults());

        List<String> ids = new ArrayList<>();
        for (AnalyzerReport analyzerReport : report.reports) ids.add(analyzerReport.id);
        assertEquals(AnalyzerRegistry.allAnalyzerIds(), ids);
        assertEquals(6, report.filesAnalyzed);
        assertEquals(1, report.parseFailures);
        assertEquals(0, report.analysisErrors);
        assertEquals(Status.FAILED, report.status);
        assertTrue(report.isFailed());
    }

    @Test
    void run_LaravelApp_FindsLazyRelationshipInController() throws IOException {
        AnalyzerReport nPlusOne = run(LintframeConfig.defaults()).report(EloquentNPlusOneAnalyzer.ID);

        assertEquals(Status.FAILED, nPlusOne.status);
        assertEquals(1, nPlusOne.issues.size());
        Issue issue = nPlusOne.issues.get(0);
        assertEquals("app/Http/Controllers/PostController.php", issue.location.file);
        assertEquals(14, issue.line());
        assertEquals("user", issue.metadata.get("relationship"));
    }

    @Test
    void run_LaravelApp_ErrorTrackingDependsOnEnvironment() throws IOException {
        AnalyzerReport production = run(LintframeConfig.defaults()).report(MissingErrorTrackingAnalyzer.ID);
        assertEquals(Status.FAILED, production.status);
        assertEquals("composer.json", production.issues.get(0).location.file);

        AnalyzerReport local = run(LintframeConfig.defaults().withEnvironment("local")).report(MissingErrorTrackingAnalyzer.ID);
        assertEquals(Status.SKIPPED, local.status);
        assertEquals("Not relevant for the 'local' environment", local.message);
        assertTrue(local.issues.isEmpty());
    }

    @Test
    void run_IsDeterministicAcrossThreadCounts() throws IOException {
        List<String> single = summary(run(LintframeConfig.defaults().withThreads(1)));
        List<String> parallel = summary(run(LintframeConfig.defaults().withThreads(4)));

        assertFalse(single.isEmpty());
        assertEquals(single, parallel);
    }

    @Test
    void run_AnalyzerWithoutFilesIsSkipped() throws IOException {
        LintframeConfig config = LintframeConfig.defaults().withPaths(List.of("app/Models"));
        RunReport report = new AnalysisRunner(config, List.of(
                AnalyzerRegistry.create(QueryBuilderInControllerAnalyzer.ID, AnalyzerOptions.empty(QueryBuilderInControllerAnalyzer.ID))))
                .quiet().run(LARAVEL_APP);

        AnalyzerReport skipped = report.reports.get(0);
        assertEquals(Status.SKIPPED, skipped.status);
        assertEquals("No applicable files found", skipped.message);
        assertEquals(Status.PASSED, report.status);
        assertEquals(0, report.parseFailures);
    }

    @Test
    void run_FailingAnalyzerIsCountedOncePerFile() throws IOException {
        Analyzer exploding = new Analyzer() {
            private final AnalyzerMetadata metadata = new AnalyzerMetadata(
                    "exploding", "Exploding", "Fails on every file", Category.RELIABILITY, Severity.LOW);

            @Override
            public AnalyzerMetadata getMetadata() {
                return metadata;
            }

            @Override
            public boolean accepts(SourceFile file) {
                return file.relativePath.startsWith("app/Models/");
            }

            @Override
            public List<Issue> analyze(FileContext context) {
                throw new IllegalStateException("boom");
            }
        };
        RunReport report = new AnalysisRunner(LintframeConfig.defaults(), List.of(exploding)).quiet().run(LARAVEL_APP);

        assertEquals(2, report.analysisErrors);
        assertEquals(Status.PASSED, report.report("exploding").status);
        assertEquals(2, report.report("exploding").filesAnalyzed);
    }
}
