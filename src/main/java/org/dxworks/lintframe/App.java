package org.dxworks.lintframe;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.dxworks.lintframe.model.AnalyzerReport;
import org.dxworks.lintframe.model.RunReport;
import org.dxworks.lintframe.model.Status;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

public class App {
    static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    public static void main(String[] args) {
        System.exit(run(args));
    }

    public static int run(String[] args) {
        if (args.length < 2) {
            System.err.println("Usage: java -jar lintframe.jar <project-root> <output-file> [config-file]");
            System.err.println("  <project-root>: Path to the Laravel project");
            System.err.println("  <output-file>:  Path to the JSON report");
            System.err.println("  [config-file]:  YAML configuration (default: lintframe-config.yml)");
            return 2;
        }

        Path projectRoot = Paths.get(args[0]);
        if (!Files.isDirectory(projectRoot)) {
            System.err.println("Error: Project root does not exist: " + projectRoot);
            return 2;
        }
        Path output = Paths.get(args[1]);

        LintframeConfig config;
        AnalysisRunner runner;
        try {
            if (args.length >= 3) {
                Path configPath = Paths.get(args[2]);
                if (!Files.isRegularFile(configPath)) {
                    System.err.println("Error: Config file does not exist: " + configPath);
                    return 2;
                }
                config = LintframeConfig.load(configPath);
            } else {
                config = LintframeConfig.load();
            }
            runner = new AnalysisRunner(config);
        } catch (ConfigurationException e) {
            System.err.println("Error: " + e.getMessage());
            return 2;
        }

        System.out.println("Starting analysis...");
        System.out.println("Project: " + projectRoot.toAbsolutePath());

        RunReport report;
        try {
            report = runner.run(projectRoot);
            if (output.getParent() != null) {
                Files.createDirectories(output.getParent());
            }
            MAPPER.writeValue(output.toFile(), report);
        } catch (IOException e) {
            System.err.println("Error: " + e.getMessage());
            return 1;
        }

        printSummary(report, output);
        return report.isFailed() ? 1 : 0;
    }

    private static void printSummary(RunReport report, Path output) {
        System.out.println("\n" + "=".repeat(60));
        System.out.println("Analysis complete: " + report.status.getValue());
        System.out.println("Files analyzed: " + report.filesAnalyzed);
        if (report.parseFailures > 0) {
            System.out.println("Parse failures: " + report.parseFailures);
        }
        if (report.analysisErrors > 0) {
            System.out.println("Analysis errors: " + report.analysisErrors);
        }
        for (AnalyzerReport analyzerReport : report.reports) {
            if (analyzerReport.status == Status.PASSED || analyzerReport.status == Status.SKIPPED) continue;
            System.out.println("  " + analyzerReport.status.getValue() + "  " + analyzerReport.id
                    + ": " + analyzerReport.issues.size() + " issue(s)");
        }
        System.out.println("Total issues: " + report.issueCount());
        System.out.println("Report written to: " + output.toAbsolutePath());
        System.out.println("=".repeat(60));
    }
}
