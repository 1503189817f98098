package org.dxworks.lintframe.model;

/**
 * Static description of an analyzer. The failure threshold decides between
 * {@link Status#FAILED} and {@link Status#WARNING} when issues are found.
 */
public class AnalyzerMetadata {
    public final String id;
    public final String name;
    public final String description;
    public final Category category;
    public final Severity severity;
    public final Severity failureThreshold;

    public AnalyzerMetadata(String id, String name, String description, Category category, Severity severity) {
        this(id, name, description, category, severity, Severity.LOW);
    }

    public AnalyzerMetadata(String id, String name, String description, Category category,
                            Severity severity, Severity failureThreshold) {
        this.id = id;
        this.name = name;
        this.description = description;
        this.category = category;
        this.severity = severity;
        this.failureThreshold = failureThreshold;
    }
}
