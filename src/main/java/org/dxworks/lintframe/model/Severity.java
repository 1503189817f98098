package org.dxworks.lintframe.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Severity {
    LOW("low", 1),
    MEDIUM("medium", 2),
    HIGH("high", 3),
    CRITICAL("critical", 4);

    private final String value;
    private final int level;

    Severity(String value, int level) {
        this.value = value;
        this.level = level;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public int getLevel() {
        return level;
    }

    public boolean isAtLeast(Severity other) {
        return level >= other.level;
    }

    public static Severity fromValue(String value) {
        for (Severity s : values()) {
            if (s.value.equalsIgnoreCase(value)) return s;
        }
        throw new IllegalArgumentException("Unknown severity: " + value);
    }
}
