package org.dxworks.lintframe;

import org.dxworks.lintframe.analyzer.SourceFile;
import org.dxworks.lintframe.analyzer.support.PathFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.TreeSet;
import java.util.stream.Stream;

/**
 * Walks the configured sub-paths of a project and reads every PHP and Blade file that is not
 * excluded and not longer than {@code maxFileLines}.
 */
public class SourceFileCollector {

    private final LintframeConfig config;
    private final PathFilter excluded;

    public SourceFileCollector(LintframeConfig config) {
        this.config = config;
        this.excluded = new PathFilter(config.getExcludedPaths());
    }

    public List<SourceFile> collect(Path projectRoot) throws IOException {
        Path root = projectRoot.toAbsolutePath().normalize();
        TreeSet<Path> candidates = new TreeSet<>();
        for (String sub : config.getPaths()) {
            Path start = root.resolve(sub).normalize();
            if (!start.startsWith(root)) {
                System.err.println("Warning: Ignoring path outside the project: " + sub);
                continue;
            }
            if (Files.isRegularFile(start)) {
                candidates.add(start);
            } else if (Files.isDirectory(start)) {
                try (Stream<Path> stream = Files.walk(start)) {
                    stream.filter(Files::isRegularFile).forEach(candidates::add);
                }
            }
        }

        List<SourceFile> files = new ArrayList<>();
        for (Path path : candidates) {
            String relative = root.relativize(path).toString().replace('\\', '/');
            Optional<FileKind> kind = FileKind.detect(path);
            if (kind.isEmpty() || excluded.matches(relative)) continue;
            String content;
            try {
                content = Files.readString(path, StandardCharsets.UTF_8);
            } catch (IOException e) {
                System.err.println("Warning: Cannot read " + relative + ": " + e.getMessage());
                continue;
            }
            if (!withinMaxLines(content, config.getMaxFileLines())) {
                System.err.println("Warning: Skipping " + relative + " (more than " + config.getMaxFileLines() + " lines)");
                continue;
            }
            files.add(new SourceFile(path, relative, kind.get(), content));
        }
        return files;
    }

    static boolean withinMaxLines(String content, int maxFileLines) {
        long count = content.lines().limit((long) maxFileLines + 1L).count();
        return count <= maxFileLines;
    }
}
