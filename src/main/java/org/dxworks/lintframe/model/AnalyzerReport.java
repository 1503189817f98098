package org.dxworks.lintframe.model;

import java.util.ArrayList;
import java.util.List;

public class AnalyzerReport {
    public String id;
    public String name;
    public Category category;
    public Status status;
    public String message;
    public int filesAnalyzed;
    public List<Issue> issues = new ArrayList<>();

    public static AnalyzerReport of(AnalyzerMetadata metadata, int filesAnalyzed, List<Issue> issues) {
        AnalyzerReport report = base(metadata);
        report.filesAnalyzed = filesAnalyzed;
        report.issues.addAll(issues);
        report.issues.sort(Issue.ORDER);
        report.status = statusFor(metadata, report.issues);
        report.message = switch (report.status) {
            case PASSED -> "No issues found";
            case WARNING -> "Found " + report.issues.size() + " issue(s) below the failure threshold";
            default -> "Found " + report.issues.size() + " issue(s)";
        };
        return report;
    }

    public static AnalyzerReport skipped(AnalyzerMetadata metadata, String reason) {
        AnalyzerReport report = base(metadata);
        report.status = Status.SKIPPED;
        report.message = reason;
        return report;
    }

    public static Status statusFor(AnalyzerMetadata metadata, List<Issue> issues) {
        if (issues.isEmpty()) return Status.PASSED;
        for (Issue issue : issues) {
            if (issue.severity.isAtLeast(metadata.failureThreshold)) return Status.FAILED;
        }
        return Status.WARNING;
    }

    private static AnalyzerReport base(AnalyzerMetadata metadata) {
        AnalyzerReport report = new AnalyzerReport();
        report.id = metadata.id;
        report.name = metadata.name;
        report.category = metadata.category;
        return report;
    }
}
