package org.dxworks.lintframe.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Status {
    PASSED("passed"),
    WARNING("warning"),
    FAILED("failed"),
    SKIPPED("skipped");

    private final String value;

    Status(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
