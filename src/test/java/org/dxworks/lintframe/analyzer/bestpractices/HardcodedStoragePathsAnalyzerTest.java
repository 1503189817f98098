package org.dxworks.lintframe.analyzer.bestpractices;

import org.dxworks.lintframe.analyzer.AnalyzerOptions;
import org.dxworks.lintframe.model.Issue;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.dxworks.lintframe.TestUtils.*;
import static org.junit.jupiter.api.Assertions.*;

class HardcodedStoragePathsAnalyzerTest {

    private final HardcodedStoragePathsAnalyzer analyzer =
            new HardcodedStoragePathsAnalyzer(AnalyzerOptions.empty(HardcodedStoragePathsAnalyzer.ID));

    private List<Issue> run(HardcodedStoragePathsAnalyzer analyzer, String statements) {
        return analyze(analyzer, "app/Services/ExportService.php", "<?php\n" + statements);
    }

    @Test
    void absoluteAndRelativeServerPathsAreAlwaysReported() {
        List<Issue> issues = run(analyzer,
                "$a = '/var/www/html/storage/app/export.csv';\n"
                        + "$b = 'C:\\storage\\logs\\laravel.log';\n"
                        + "$c = '../public/uploads/avatar.png';\n");

        assertEquals(List.of(2, 3, 4), lines(issues));
        assertEquals("Hardcoded storage path found: \"/var/www/html/storage/app/export.csv\"", issues.get(0).message);
        assertTrue(issues.get(1).recommendation.startsWith("Use Laravel path helper: storage_path('logs/...')"));
        assertTrue(issues.get(2).recommendation.startsWith("Use Laravel path helper: public_path(...)"));
    }

    @Test
    void rootRelativePathsNeedFilesystemContext() {
        List<Issue> issues = run(analyzer,
                "$url = '/storage/app/reports';\n"
                        + "$csv = file_get_contents('/storage/app/reports/daily.csv');\n"
                        + "$logo = Storage::get('/public/images/logo.png');\n"
                        + "$disk->put('/storage/exports/' . $name, $data);\n"
                        + "$disk->put('/app/exports/x.csv', $data);\n"
                        + "$link = '/app/dashboard';\n");

        assertEquals(List.of(3, 4, 5), lines(issues));
        assertEquals("/storage/exports/", issues.get(2).metadata.get("path"));
    }

    @Test
    void urlsAndAllowedPathsAreIgnored() {
        HardcodedStoragePathsAnalyzer allowing = new HardcodedStoragePathsAnalyzer(
                options(HardcodedStoragePathsAnalyzer.ID, "allowed_paths", List.of("/var/www/shared")));

        List<Issue> issues = run(allowing,
                "$cdn = 'https://cdn.example.org/var/www/storage/a.png';\n"
                        + "$shared = '/var/www/shared/storage/a.png';\n");

        assertTrue(issues.isEmpty(), issues::toString);
    }

    @Test
    void additionalPatternsAreAlwaysReported() {
        HardcodedStoragePathsAnalyzer custom = new HardcodedStoragePathsAnalyzer(
                options(HardcodedStoragePathsAnalyzer.ID, "additional_patterns", Map.of("^/mnt/shared/", "config('paths.shared')")));

        List<Issue> issues = run(custom, "$path = '/mnt/shared/invoices';\n");

        assertEquals(1, issues.size());
        assertTrue(issues.get(0).recommendation.contains("config('paths.shared')"));
    }
}
