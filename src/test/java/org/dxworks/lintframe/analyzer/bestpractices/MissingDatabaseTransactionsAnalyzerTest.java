package org.dxworks.lintframe.analyzer.bestpractices;

import org.dxworks.lintframe.analyzer.AnalyzerOptions;
import org.dxworks.lintframe.model.Issue;
import org.dxworks.lintframe.registry.ModelRegistry;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.dxworks.lintframe.TestUtils.*;
import static org.junit.jupiter.api.Assertions.*;

class MissingDatabaseTransactionsAnalyzerTest {

    private final ModelRegistry models = userAndPostRegistry();

    private List<Issue> run(MissingDatabaseTransactionsAnalyzer analyzer, String path, String body) {
        String php = "<?php\nnamespace App\\Services;\n\nuse App\\Models\\Post;\nuse App\\Models\\User;\n"
                + "use Illuminate\\Support\\Facades\\DB;\n\nclass UserService\n{\n"
                + "    public function register(array $data)\n    {\n" + body + "    }\n}\n";
        return analyze(analyzer, path, php, models);
    }

    private List<Issue> run(String body) {
        return run(new MissingDatabaseTransactionsAnalyzer(AnalyzerOptions.empty(MissingDatabaseTransactionsAnalyzer.ID)),
                "app/Services/UserService.php", body);
    }

    @Test
    void twoUnprotectedWritesAreReported() {
        List<Issue> issues = run(
                "        $user = User::create($data);\n"
                        + "        $post = new Post();\n"
                        + "        $post->save();\n");

        assertEquals(1, issues.size());
        Issue issue = issues.get(0);
        assertEquals(MissingDatabaseTransactionsAnalyzer.CODE, issue.code);
        assertEquals("Method \"UserService::register()\" has 2 write operations without transaction protection", issue.message);
        assertEquals(List.of(12, 14), issue.metadata.get("lines"));
        assertEquals(List.of("create", "save"), issue.metadata.get("operations"));
        assertEquals(10, issue.line());
    }

    @Test
    void singleWriteIsBelowThreshold() {
        assertTrue(run("        User::create($data);\n").isEmpty());
    }

    @Test
    void writesInsideTransactionClosureAreProtected() {
        List<Issue> issues = run(
                "        DB::transaction(function () use ($data) {\n"
                        + "            $user = User::create($data);\n"
                        + "            $user->posts()->create(['title' => 'first']);\n"
                        + "            DB::table('audit')->insert(['event' => 'register']);\n"
                        + "        });\n");

        assertTrue(issues.isEmpty(), issues::toString);
    }

    @Test
    void emptyTransactionDoesNotProtectEarlierWrites() {
        List<Issue> issues = run(
                "        $user = User::create($data);\n"
                        + "        $user->update(['active' => true]);\n"
                        + "        DB::transaction(function () {\n"
                        + "        });\n");

        assertEquals(1, issues.size());
        assertEquals(2, issues.get(0).metadata.get("count"));
    }

    @Test
    void explicitTransactionBoundariesProtectWrites() {
        List<Issue> issues = run(
                "        DB::beginTransaction();\n"
                        + "        try {\n"
                        + "            User::create($data);\n"
                        + "            DB::table('audit')->insert(['event' => 'register']);\n"
                        + "            DB::commit();\n"
                        + "        } catch (\\Throwable $e) {\n"
                        + "            DB::rollBack();\n"
                        + "            throw $e;\n"
                        + "        }\n");

        assertTrue(issues.isEmpty(), issues::toString);
    }

    @Test
    void touchAndPivotWritesCount() {
        List<Issue> issues = run(
                "        $user = User::find($data['id']);\n"
                        + "        $user->touch();\n"
                        + "        $user->roles()->sync($data['roles']);\n"
                        + "        $user->tags()->attach($data['tag']);\n");

        assertEquals(1, issues.size());
        assertEquals(List.of(13, 14, 15), issues.get(0).metadata.get("lines"));
        assertEquals(List.of("touch", "sync", "attach"), issues.get(0).metadata.get("operations"));
    }

    @Test
    void updateOrInsertOnTheQueryBuilderCounts() {
        List<Issue> issues = run(
                "        DB::table('users')->updateOrInsert(['email' => $data['email']], $data);\n"
                        + "        DB::table('audit')->updateOrInsert(['event' => 'register'], ['at' => now()]);\n");

        assertEquals(1, issues.size());
        assertEquals(List.of("updateOrInsert", "updateOrInsert"), issues.get(0).metadata.get("operations"));
    }

    @Test
    void collectionPushIsNotAWrite() {
        List<Issue> issues = run(
                "        $items = collect();\n"
                        + "        $items->push(1);\n"
                        + "        $items->push(2);\n");

        assertTrue(issues.isEmpty(), issues::toString);
    }

    @Test
    void closureNotPassedToTransactionIsUnprotected() {
        List<Issue> issues = run(
                "        $work = function () use ($data) {\n"
                        + "            User::create($data);\n"
                        + "            Post::create($data);\n"
                        + "        };\n"
                        + "        DB::transaction($work);\n");

        assertEquals(1, issues.size());
        assertEquals(List.of(13, 14), issues.get(0).metadata.get("lines"));
    }

    @Test
    void nonDatabaseStoresAreNotWrites() {
        List<Issue> issues = run(
                "        \\Cache::put('key', $data);\n"
                        + "        cache()->delete('key');\n"
                        + "        $this->cache->delete('key');\n"
                        + "        $sessionStore->update($data);\n");

        assertTrue(issues.isEmpty(), issues::toString);
    }

    @Test
    void thresholdIsConfigurable() {
        MissingDatabaseTransactionsAnalyzer analyzer = new MissingDatabaseTransactionsAnalyzer(
                options(MissingDatabaseTransactionsAnalyzer.ID, "threshold", 3));
        String body = "        User::create($data);\n        Post::create($data);\n";

        assertTrue(run(analyzer, "app/Services/UserService.php", body).isEmpty());
    }

    @Test
    void testsAndSeedersAreExcludedByDefault() {
        MissingDatabaseTransactionsAnalyzer analyzer = new MissingDatabaseTransactionsAnalyzer(
                AnalyzerOptions.empty(MissingDatabaseTransactionsAnalyzer.ID));
        String body = "        User::create($data);\n        Post::create($data);\n";

        assertTrue(run(analyzer, "tests/Feature/UserServiceTest.php", body).isEmpty());
        assertTrue(run(analyzer, "database/seeders/UserSeeder.php", body).isEmpty());
        assertEquals(1, run(analyzer, "app/Services/UserService.php", body).size());
    }

    @Test
    void nameSplittingRecognisesStores() {
        assertTrue(MissingDatabaseTransactionsAnalyzer.namesNonDurableStore("userCache"));
        assertTrue(MissingDatabaseTransactionsAnalyzer.namesNonDurableStore("rate_limiter"));
        assertFalse(MissingDatabaseTransactionsAnalyzer.namesNonDurableStore("orders"));
    }
}
