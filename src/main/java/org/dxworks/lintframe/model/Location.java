package org.dxworks.lintframe.model;

import java.util.Objects;

public class Location {
    public String file;
    public int startLine;
    public int endLine;

    public Location() {
    }

    public Location(String file, int startLine, int endLine) {
        this.file = file;
        this.startLine = startLine;
        this.endLine = Math.max(startLine, endLine);
    }

    public Location(String file, int line) {
        this(file, line, line);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Location other)) return false;
        return startLine == other.startLine && endLine == other.endLine && Objects.equals(file, other.file);
    }

    @Override
    public int hashCode() {
        return Objects.hash(file, startLine, endLine);
    }

    @Override
    public String toString() {
        return file + ":" + startLine;
    }
}
