package org.dxworks.lintframe;

import java.nio.file.Path;
import java.util.Optional;

public enum FileKind {
    BLADE("blade", ".blade.php"),
    PHP("php", ".php");

    private final String name;
    private final String suffix;

    FileKind(String name, String suffix) {
        this.name = name;
        this.suffix = suffix;
    }

    public String getName() {
        return name;
    }

    public boolean matchesFileName(String fileName) {
        return fileName.endsWith(suffix);
    }

    /** Blade templates are checked before plain PHP since they share the extension. */
    public static Optional<FileKind> detect(Path path) {
        String fileName = path.getFileName().toString().toLowerCase();
        for (FileKind kind : values()) {
            if (kind.matchesFileName(fileName)) return Optional.of(kind);
        }
        return Optional.empty();
    }
}
