package org.dxworks.lintframe.analyzer.bestpractices;

import org.dxworks.lintframe.analyzer.AnalyzerOptions;
import org.dxworks.lintframe.model.Issue;
import org.dxworks.lintframe.model.Severity;
import org.dxworks.lintframe.registry.ModelRegistry;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.dxworks.lintframe.TestUtils.*;
import static org.junit.jupiter.api.Assertions.*;

class MixedQueryBuilderEloquentAnalyzerTest {

    private static final String HEADER = "<?php\nnamespace App\\Http\\Controllers;\n\n"
            + "use App\\Models\\Post;\nuse App\\Models\\User;\nuse Illuminate\\Support\\Facades\\DB;\n\n";

    private final MixedQueryBuilderEloquentAnalyzer analyzer =
            new MixedQueryBuilderEloquentAnalyzer(AnalyzerOptions.empty(MixedQueryBuilderEloquentAnalyzer.ID));

    private List<Issue> run(MixedQueryBuilderEloquentAnalyzer analyzer, ModelRegistry models, String php) {
        return analyze(analyzer, "app/Http/Controllers/ReportController.php", php, models);
    }

    @Test
    void sameTableThroughBothStylesIsReported() {
        String php = HEADER
                + "class ReportController\n{\n"
                + "    public function index()\n    {\n"
                + "        $active = User::where('active', 1)->get();\n"
                + "        $total = DB::table('users')->count();\n"
                + "    }\n}\n";

        List<Issue> issues = run(analyzer, userAndPostRegistry(), php);

        assertEquals(1, issues.size());
        Issue issue = issues.get(0);
        assertEquals(MixedQueryBuilderEloquentAnalyzer.CODE_SAME_TABLE, issue.code);
        assertEquals(Severity.HIGH, issue.severity);
        assertEquals("Class \"ReportController\" uses both Eloquent and Query Builder for table \"users\"", issue.message);
        assertEquals(13, issue.line());
        assertEquals(12, issue.metadata.get("eloquent_line"));
    }

    @Test
    void differentTablesAreFine() {
        String php = HEADER
                + "class ReportController\n{\n"
                + "    public function index()\n    {\n"
                + "        $users = User::all();\n"
                + "        $pending = DB::table('jobs')->count();\n"
                + "        $sessions = DB::table('sessions')->where('user_id', 1)->get();\n"
                + "    }\n}\n";

        assertTrue(run(analyzer, userAndPostRegistry(), php).isEmpty());
    }

    @Test
    void usageIsTrackedThroughVariables() {
        String php = HEADER
                + "class ReportController\n{\n"
                + "    public function index()\n    {\n"
                + "        $query = Post::query();\n"
                + "        $posts = $query->where('published', true)->get();\n"
                + "        $builder = DB::table('posts');\n"
                + "        $count = $builder->where('published', false)->count();\n"
                + "    }\n}\n";

        List<Issue> issues = run(analyzer, userAndPostRegistry(), php);

        assertEquals(List.of(MixedQueryBuilderEloquentAnalyzer.CODE_SAME_TABLE), codes(issues));
        assertEquals("posts", issues.get(0).metadata.get("table"));
    }

    @Test
    void toBaseCountsAsQueryBuilderUnlessDisabled() {
        String php = HEADER
                + "class ReportController\n{\n"
                + "    public function index()\n    {\n"
                + "        $user = User::find(1);\n"
                + "        $rows = User::query()->toBase()->get();\n"
                + "    }\n}\n";

        assertEquals(1, run(analyzer, userAndPostRegistry(), php).size());

        MixedQueryBuilderEloquentAnalyzer lenient = new MixedQueryBuilderEloquentAnalyzer(
                options(MixedQueryBuilderEloquentAnalyzer.ID, "count_to_base_as_query_builder", false));
        assertTrue(run(lenient, userAndPostRegistry(), php).isEmpty());
    }

    @Test
    void queryBuilderForManyModelledTablesIsReported() {
        ModelRegistry models = registry(
                "<?php\nnamespace App\\Models;\nuse Illuminate\\Database\\Eloquent\\Model;\nclass User extends Model {}\n",
                "<?php\nnamespace App\\Models;\nuse Illuminate\\Database\\Eloquent\\Model;\nclass Post extends Model {}\n",
                "<?php\nnamespace App\\Models;\nuse Illuminate\\Database\\Eloquent\\Model;\nclass Comment extends Model {}\n");
        String php = HEADER
                + "class ReportController\n{\n"
                + "    public function index()\n    {\n"
                + "        $latest = Post::latest()->first();\n"
                + "        $a = DB::table('users')->count();\n"
                + "        $b = DB::table('posts')->count();\n"
                + "        $c = DB::table('comments')->count();\n"
                + "    }\n}\n";

        List<Issue> issues = run(analyzer, models, php);

        assertEquals(List.of(MixedQueryBuilderEloquentAnalyzer.CODE_SAME_TABLE, MixedQueryBuilderEloquentAnalyzer.CODE_SIGNIFICANT),
                codes(issues));
        Issue significant = issues.get(1);
        assertEquals(Severity.LOW, significant.severity);
        assertEquals(List.of("comments", "posts", "users"), significant.metadata.get("tables"));
        assertEquals(13, significant.line());
    }

    @Test
    void queryBuilderOnlyClassIsNotMixing() {
        ModelRegistry models = registry(
                "<?php\nnamespace App\\Models;\nuse Illuminate\\Database\\Eloquent\\Model;\nclass User extends Model {}\n",
                "<?php\nnamespace App\\Models;\nuse Illuminate\\Database\\Eloquent\\Model;\nclass Post extends Model {}\n",
                "<?php\nnamespace App\\Models;\nuse Illuminate\\Database\\Eloquent\\Model;\nclass Comment extends Model {}\n");
        String php = HEADER
                + "class ReportController\n{\n"
                + "    public function index()\n    {\n"
                + "        $a = DB::table('users')->count();\n"
                + "        $b = DB::table('posts')->count();\n"
                + "        $c = DB::table('comments')->count();\n"
                + "    }\n}\n";

        assertTrue(run(analyzer, models, php).isEmpty());
    }

    @Test
    void whitelistedClassesAreSkipped() {
        MixedQueryBuilderEloquentAnalyzer whitelisted = new MixedQueryBuilderEloquentAnalyzer(
                options(MixedQueryBuilderEloquentAnalyzer.ID, "whitelist", List.of("*Controller")));
        String php = HEADER
                + "class ReportController\n{\n"
                + "    public function index()\n    {\n"
                + "        User::where('active', 1)->get();\n"
                + "        DB::table('users')->count();\n"
                + "    }\n}\n";

        assertTrue(run(whitelisted, userAndPostRegistry(), php).isEmpty());
    }

    @Test
    void classesAreJudgedSeparately() {
        String php = HEADER
                + "class ReportController\n{\n"
                + "    public function index()\n    {\n"
                + "        User::where('active', 1)->get();\n"
                + "    }\n}\n\n"
                + "class StatsController\n{\n"
                + "    public function index()\n    {\n"
                + "        DB::table('users')->count();\n"
                + "    }\n}\n";

        assertTrue(run(analyzer, userAndPostRegistry(), php).isEmpty());
    }
}
