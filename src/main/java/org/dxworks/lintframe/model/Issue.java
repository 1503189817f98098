package org.dxworks.lintframe.model;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;

public class Issue {

    /** File, then line, then analyzer, then message. */
    public static final Comparator<Issue> ORDER = Comparator
            .comparing((Issue i) -> i.location.file == null ? "" : i.location.file)
            .thenComparingInt(i -> i.location.startLine)
            .thenComparing(i -> i.analyzerId)
            .thenComparing(i -> i.message);

    public String analyzerId;
    public String code;
    public Severity severity;
    public String message;
    public String recommendation;
    public Location location;
    public String excerpt;
    public Map<String, Object> metadata = new LinkedHashMap<>();

    public Issue() {
    }

    public Issue(String analyzerId, String code, Severity severity, String message, Location location) {
        this.analyzerId = analyzerId;
        this.code = code;
        this.severity = severity;
        this.message = message;
        this.location = location;
    }

    public Issue withRecommendation(String recommendation) {
        this.recommendation = recommendation;
        return this;
    }

    public Issue withExcerpt(String excerpt) {
        this.excerpt = excerpt;
        return this;
    }

    public Issue withMetadata(String key, Object value) {
        this.metadata.put(key, value);
        return this;
    }

    public int line() {
        return location.startLine;
    }

    @Override
    public String toString() {
        return severity.getValue() + " " + code + " " + location + " " + message;
    }
}
