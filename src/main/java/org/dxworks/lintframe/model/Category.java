package org.dxworks.lintframe.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Category {
    BEST_PRACTICES("best-practices"),
    SECURITY("security"),
    PERFORMANCE("performance"),
    RELIABILITY("reliability");

    private final String value;

    Category(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static Category fromValue(String value) {
        for (Category c : values()) {
            if (c.value.equalsIgnoreCase(value) || c.name().equalsIgnoreCase(value)) return c;
        }
        return null;
    }
}
