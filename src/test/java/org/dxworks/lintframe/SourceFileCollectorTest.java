package org.dxworks.lintframe;

import org.dxworks.lintframe.analyzer.SourceFile;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.dxworks.lintframe.TestUtils.LARAVEL_APP;
import static org.junit.jupiter.api.Assertions.*;

class SourceFileCollectorTest {

    @TempDir
    Path tempDir;

    private static List<String> paths(List<SourceFile> files) {
        List<String> paths = new ArrayList<>();
        for (SourceFile file : files) paths.add(file.relativePath);
        return paths;
    }

    @Test
    void collectsConfiguredPathsInSortedOrder() throws IOException {
        List<SourceFile> files = new SourceFileCollector(LintframeConfig.defaults()).collect(LARAVEL_APP);

        assertEquals(List.of(
                "app/Http/Controllers/PostController.php",
                "app/Legacy/Broken.php",
                "app/Models/Post.php",
                "app/Models/User.php",
                "resources/views/posts/index.blade.php",
                "routes/web.php"), paths(files));
        assertEquals(FileKind.BLADE, files.get(4).kind);
        assertEquals(FileKind.PHP, files.get(5).kind);
    }

    @Test
    void excludedDirectoriesAreSkippedEvenWhenListed() throws IOException {
        LintframeConfig config = LintframeConfig.defaults().withPaths(List.of("storage", "routes"));

        assertEquals(List.of("routes/web.php"), paths(new SourceFileCollector(config).collect(LARAVEL_APP)));
    }

    @Test
    void oversizedAndForeignFilesAreIgnored() throws IOException {
        Files.createDirectories(tempDir.resolve("app"));
        Files.writeString(tempDir.resolve("app/Small.php"), "<?php\necho 1;\n");
        Files.writeString(tempDir.resolve("app/Large.php"), "<?php\n" + "echo 1;\n".repeat(10));
        Files.writeString(tempDir.resolve("app/readme.md"), "# notes\n");
        LintframeConfig config = LintframeConfig.defaults().withPaths(List.of("app", "../outside")).withMaxFileLines(5);

        assertEquals(List.of("app/Small.php"), paths(new SourceFileCollector(config).collect(tempDir)));
    }

    @Test
    void lineLimitIsInclusive() {
        assertTrue(SourceFileCollector.withinMaxLines("a\nb\nc", 3));
        assertFalse(SourceFileCollector.withinMaxLines("a\nb\nc\nd", 3));
        assertTrue(SourceFileCollector.withinMaxLines("", 1));
    }
}
