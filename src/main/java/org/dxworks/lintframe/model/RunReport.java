package org.dxworks.lintframe.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.ArrayList;
import java.util.List;

public class RunReport {
    public String startedAt;
    public String endedAt;
    public String projectRoot;
    public int filesAnalyzed;
    public int parseFailures;
    public int analysisErrors;
    public Status status;
    public List<AnalyzerReport> reports = new ArrayList<>();

    public void computeStatus() {
        status = Status.PASSED;
        for (AnalyzerReport report : reports) {
            if (report.status == Status.FAILED) {
                status = Status.FAILED;
                return;
            }
            if (report.status == Status.WARNING) status = Status.WARNING;
        }
    }

    @JsonIgnore
    public boolean isFailed() {
        return status == Status.FAILED;
    }

    public AnalyzerReport report(String analyzerId) {
        for (AnalyzerReport report : reports) {
            if (report.id.equals(analyzerId)) return report;
        }
        return null;
    }

    public int issueCount() {
        int count = 0;
        for (AnalyzerReport report : reports) count += report.issues.size();
        return count;
    }
}
