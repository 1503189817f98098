package org.dxworks.lintframe.analyzer;

import org.dxworks.lintframe.FileKind;

import java.nio.file.Path;

public class SourceFile {
    public final Path path;
    /** Path relative to the project root, always with forward slashes. */
    public final String relativePath;
    public final FileKind kind;
    public final String content;

    public SourceFile(Path path, String relativePath, FileKind kind, String content) {
        this.path = path;
        this.relativePath = relativePath.replace('\\', '/');
        this.kind = kind;
        this.content = content;
    }

    public String fileName() {
        int idx = relativePath.lastIndexOf('/');
        return idx >= 0 ? relativePath.substring(idx + 1) : relativePath;
    }

    @Override
    public String toString() {
        return relativePath;
    }
}
