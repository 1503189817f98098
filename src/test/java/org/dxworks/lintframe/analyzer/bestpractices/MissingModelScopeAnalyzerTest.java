package org.dxworks.lintframe.analyzer.bestpractices;

import org.dxworks.lintframe.LintframeConfig;
import org.dxworks.lintframe.analyzer.AnalyzerOptions;
import org.dxworks.lintframe.analyzer.ProjectContext;
import org.dxworks.lintframe.model.Issue;
import org.dxworks.lintframe.registry.ModelRegistry;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.dxworks.lintframe.TestUtils.*;
import static org.junit.jupiter.api.Assertions.*;

class MissingModelScopeAnalyzerTest {

    private static final ProjectContext PROJECT =
            new ProjectContext(Path.of("."), LintframeConfig.defaults(), ModelRegistry.empty(), 2);

    private static String controller(String name, String statement) {
        return "<?php\nnamespace App\\Http\\Controllers;\n\nclass " + name + "\n{\n"
                + "    public function index()\n    {\n" + statement + "    }\n}\n";
    }

    private static final String ADMINS =
            "        return User::where('active', true)->where('role', 'admin')->get();\n";

    @Test
    void repeatedWhereSequenceIsReportedOnceConcluded() {
        MissingModelScopeAnalyzer analyzer = new MissingModelScopeAnalyzer(AnalyzerOptions.empty(MissingModelScopeAnalyzer.ID));

        assertTrue(analyze(analyzer, "app/Http/Controllers/UserController.php", controller("UserController", ADMINS)).isEmpty());
        analyze(analyzer, "app/Http/Controllers/AdminController.php", controller("AdminController", ADMINS));
        analyze(analyzer, "app/Http/Controllers/PostController.php", controller("PostController",
                "        return Post::where('published', true)->where('featured', true)->get();\n"));

        List<Issue> issues = analyzer.conclude(PROJECT);

        assertEquals(1, issues.size());
        Issue issue = issues.get(0);
        assertEquals("Query pattern \"where('active', 'true', ...)->where('role', 'admin', ...)\" appears 2 times across the codebase",
                issue.message);
        assertEquals("app/Http/Controllers/AdminController.php", issue.location.file);
        assertEquals(8, issue.line());
        assertTrue(issue.recommendation.endsWith("Found 2 occurrences at: AdminController.php:8, UserController.php:8"));
        assertTrue(analyzer.conclude(PROJECT).isEmpty(), "occurrences are drained by conclude");
    }

    @Test
    void minimumOccurrencesIsConfigurable() {
        MissingModelScopeAnalyzer analyzer = new MissingModelScopeAnalyzer(
                options(MissingModelScopeAnalyzer.ID, "min_occurrences", 3));

        analyze(analyzer, "app/Http/Controllers/UserController.php", controller("UserController", ADMINS));
        analyze(analyzer, "app/Http/Controllers/AdminController.php", controller("AdminController", ADMINS));

        assertTrue(analyzer.conclude(PROJECT).isEmpty());
    }

    @Test
    void suppressedOccurrencesAndNonModelsDoNotCount() {
        MissingModelScopeAnalyzer analyzer = new MissingModelScopeAnalyzer(AnalyzerOptions.empty(MissingModelScopeAnalyzer.ID));

        analyze(analyzer, "app/Http/Controllers/UserController.php", controller("UserController", ADMINS));
        analyze(analyzer, "app/Http/Controllers/AdminController.php", controller("AdminController",
                "        // @lintframe-ignore missing-model-scope\n" + ADMINS));
        analyze(analyzer, "app/Http/Controllers/ReportController.php", controller("ReportController",
                "        return UserRepository::where('active', true)->where('role', 'admin')->get();\n"));

        assertTrue(analyzer.conclude(PROJECT).isEmpty());
    }
}
