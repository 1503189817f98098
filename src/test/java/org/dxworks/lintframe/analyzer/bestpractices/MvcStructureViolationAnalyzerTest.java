package org.dxworks.lintframe.analyzer.bestpractices;

import org.dxworks.lintframe.analyzer.AnalyzerOptions;
import org.dxworks.lintframe.model.Issue;
import org.dxworks.lintframe.model.Severity;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.dxworks.lintframe.TestUtils.*;
import static org.junit.jupiter.api.Assertions.*;

class MvcStructureViolationAnalyzerTest {

    private static final String INVOICE = "<?php\n"
            + "namespace App\\Models;\n\n"
            + "use Illuminate\\Database\\Eloquent\\Model;\n\n"
            + "class Invoice extends Model\n{\n"
            + "    public function render()\n"
            + "    {\n"
            + "        return view('invoice', ['invoice' => $this]);\n"
            + "    }\n\n"
            + "    public function total()\n"
            + "    {\n"
            + "        return 1;\n"
            + "    }\n"
            + "}\n";

    private static final String REPORTS = "<?php\n"
            + "namespace App\\Http\\Controllers;\n\n"
            + "class ReportController extends Controller\n{\n"
            + "    public function show()\n"
            + "    {\n"
            + "        $a = 1;\n"
            + "        $b = 2;\n"
            + "        return $a + $b;\n"
            + "    }\n\n"
            + "    public function index()\n"
            + "    {\n"
            + "        return 1;\n"
            + "    }\n"
            + "}\n";

    private final MvcStructureViolationAnalyzer analyzer =
            new MvcStructureViolationAnalyzer(AnalyzerOptions.empty(MvcStructureViolationAnalyzer.ID));

    @Test
    void modelThatRendersIsReportedTwice() {
        List<Issue> issues = analyze(analyzer, "app/Models/Invoice.php", INVOICE);

        assertEquals(List.of(MvcStructureViolationAnalyzer.CODE_MODEL_RENDERING, MvcStructureViolationAnalyzer.CODE_MODEL_VIEW_CALL),
                codes(issues));
        assertEquals(List.of(8, 8), lines(issues));
        assertEquals("Model \"Invoice\" has rendering method \"render()\" (MVC violation)", issues.get(0).message);
    }

    @Test
    void longControllerMethodsAreReportedAboveTheLimit() {
        assertTrue(analyze(analyzer, "app/Http/Controllers/ReportController.php", REPORTS).isEmpty());

        MvcStructureViolationAnalyzer strict = new MvcStructureViolationAnalyzer(
                options(MvcStructureViolationAnalyzer.ID, "max_controller_method_lines", 3));
        List<Issue> issues = analyze(strict, "app/Http/Controllers/ReportController.php", REPORTS);

        assertEquals(1, issues.size());
        Issue issue = issues.get(0);
        assertEquals(6, issue.line());
        assertTrue(issue.message.startsWith("Controller method \"ReportController::show()\" has 5 lines (max: 3)"));
        assertEquals(5, issue.metadata.get("lines"));
    }

    @Test
    void templatesThatQueryOrWriteAreCritical() {
        String view = "<ul>\n"
                + "@foreach (\\App\\Models\\Order::where('paid', true)->get() as $order)\n"
                + "    <li>{{ $order->total }}</li>\n"
                + "@endforeach\n"
                + "</ul>\n"
                + "@php(\\App\\Models\\Visit::create(['seen' => true]))\n";

        List<Issue> issues = analyze(analyzer, "resources/views/orders.blade.php", view);

        assertEquals(List.of(MvcStructureViolationAnalyzer.CODE_VIEW_QUERY, MvcStructureViolationAnalyzer.CODE_VIEW_MODEL_WRITE),
                codes(issues));
        assertEquals(List.of(2, 6), lines(issues));
        assertTrue(issues.stream().allMatch(i -> i.severity == Severity.CRITICAL));
    }
}
