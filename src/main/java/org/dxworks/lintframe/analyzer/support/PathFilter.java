package org.dxworks.lintframe.analyzer.support;

import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.List;

/**
 * Matches project-relative paths against configured patterns. Patterns containing {@code *} are
 * globs; anything else matches as a path fragment ({@code tests/} matches {@code tests/Unit/A.php}
 * and {@code app/tests/B.php}). Globs are tried on the path with and without a leading slash, so
 * {@code **}{@code /vendor/**} also matches a top-level {@code vendor/} directory.
 */
public class PathFilter {

    private final List<String> fragments = new ArrayList<>();
    private final List<PathMatcher> globs = new ArrayList<>();

    public PathFilter(List<String> patterns) {
        for (String pattern : patterns) {
            String normalized = pattern.replace('\\', '/');
            if (normalized.contains("*")) {
                globs.add(FileSystems.getDefault().getPathMatcher("glob:" + normalized));
            } else if (!normalized.isEmpty()) {
                fragments.add(normalized);
            }
        }
    }

    public boolean isEmpty() {
        return fragments.isEmpty() && globs.isEmpty();
    }

    public boolean matches(String relativePath) {
        String path = relativePath.replace('\\', '/');
        String anchored = "/" + path;
        for (String fragment : fragments) {
            String f = fragment.startsWith("/") ? fragment : "/" + fragment;
            if (anchored.contains(f)) return true;
        }
        for (PathMatcher glob : globs) {
            if (glob.matches(Path.of(path)) || glob.matches(Path.of(anchored))) return true;
        }
        return false;
    }
}
