package org.dxworks.lintframe.analyzer.bestpractices;

import org.dxworks.lintframe.analyzer.AnalyzerOptions;
import org.dxworks.lintframe.model.Issue;
import org.dxworks.lintframe.model.Severity;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.dxworks.lintframe.TestUtils.*;
import static org.junit.jupiter.api.Assertions.*;

class LogicInRoutesAnalyzerTest {

    private static final String ROUTES = "<?php\n"
            + "use Illuminate\\Support\\Facades\\Route;\n\n"
            + "Route::get('/', function () {\n"
            + "    return view('welcome');\n"
            + "});\n\n"
            + "Route::get('/users/{id}', function ($id) {\n"
            + "    return User::find($id);\n"
            + "});\n\n"
            + "Route::post('/orders', function () {\n"
            + "    dispatch(new ProcessOrder());\n"
            + "});\n\n"
            + "Route::get('/report', function () {\n"
            + "    $a = 1;\n"
            + "    $b = 2;\n"
            + "    $c = 3;\n"
            + "    $d = 4;\n"
            + "    return $a;\n"
            + "});\n"
            + "Route::get('/home', [HomeController::class, 'index']);\n"
            + "Route::get('/numbers', function () { return collect([3, 1, 2])->sort()->values()->all(); });\n";

    private final LogicInRoutesAnalyzer analyzer = new LogicInRoutesAnalyzer(AnalyzerOptions.empty(LogicInRoutesAnalyzer.ID));

    @Test
    void routeClosuresAreClassified() {
        List<Issue> issues = analyze(analyzer, "routes/web.php", ROUTES);

        assertEquals(List.of(
                LogicInRoutesAnalyzer.CODE_DB_QUERIES,
                LogicInRoutesAnalyzer.CODE_BUSINESS_LOGIC,
                LogicInRoutesAnalyzer.CODE_TOO_LONG,
                LogicInRoutesAnalyzer.CODE_BUSINESS_LOGIC), codes(issues));
        assertEquals(List.of(8, 12, 16, 24), lines(issues));

        assertEquals("Route closure contains database queries", issues.get(0).message);
        assertEquals(Severity.CRITICAL, issues.get(0).severity);
        assertEquals("Route closure contains complex business logic", issues.get(1).message);
        assertEquals(Severity.HIGH, issues.get(1).severity);
        assertEquals("Route closure contains 7 lines (max: 5)", issues.get(2).message);
        assertEquals(Severity.MEDIUM, issues.get(2).severity);
    }

    @Test
    void limitsAreConfigurable() {
        LogicInRoutesAnalyzer relaxed = new LogicInRoutesAnalyzer(options(LogicInRoutesAnalyzer.ID,
                "max_closure_lines", 10, "complex_chain_length", 4));

        assertEquals(List.of(8, 12), lines(analyze(relaxed, "routes/web.php", ROUTES)));
    }

    @Test
    void onlyRouteFilesAreChecked() {
        assertTrue(analyze(analyzer, "app/Providers/RouteServiceProvider.php", ROUTES).isEmpty());
    }
}
