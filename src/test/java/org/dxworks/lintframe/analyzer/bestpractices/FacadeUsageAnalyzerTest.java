package org.dxworks.lintframe.analyzer.bestpractices;

import org.dxworks.lintframe.analyzer.AnalyzerOptions;
import org.dxworks.lintframe.model.Issue;
import org.dxworks.lintframe.model.Severity;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.dxworks.lintframe.TestUtils.*;
import static org.junit.jupiter.api.Assertions.*;

class FacadeUsageAnalyzerTest {

    private static final String SOURCE = "<?php\n"
            + "namespace App\\Services;\n\n"
            + "class OrderService\n{\n"
            + "    public function place($order)\n    {\n"
            + "        DB::table('orders')->insert($order);\n"
            + "        Cache::forget('orders');\n"
            + "        Log::info('placed');\n"
            + "        Log::debug('again');\n"
            + "        $user = Auth::user();\n"
            + "        Mail::to($user)->send(new OrderPlaced($order));\n"
            + "        Event::dispatch(new OrderCreated($order));\n"
            + "        $helper = new class {\n"
            + "            public function run() { Storage::put('a', 'b'); Queue::push('job'); }\n"
            + "        };\n"
            + "        Carbon::now();\n"
            + "    }\n}\n";

    @Test
    void classOverThresholdIsReported() {
        FacadeUsageAnalyzer analyzer = new FacadeUsageAnalyzer(AnalyzerOptions.empty(FacadeUsageAnalyzer.ID));

        List<Issue> issues = analyze(analyzer, "app/Services/OrderService.php", SOURCE);

        assertEquals(1, issues.size());
        Issue issue = issues.get(0);
        assertEquals("Class 'OrderService' uses 6 different facades (threshold: 5)", issue.message);
        assertEquals(List.of("DB", "Cache", "Log", "Auth", "Mail", "Event"), issue.metadata.get("facades"));
        assertEquals(Severity.LOW, issue.severity);
        assertEquals(4, issue.line());
    }

    @Test
    void severityGrowsWithTheExcess() {
        FacadeUsageAnalyzer analyzer = new FacadeUsageAnalyzer(options(FacadeUsageAnalyzer.ID, "threshold", 2));

        assertEquals(Severity.MEDIUM, analyze(analyzer, "app/Services/OrderService.php", SOURCE).get(0).severity);
        assertEquals(Severity.LOW, analyzer.severityFor(3));
        assertEquals(Severity.HIGH, analyzer.severityFor(7));
    }

    @Test
    void customFacadesCount() {
        FacadeUsageAnalyzer analyzer = new FacadeUsageAnalyzer(options(FacadeUsageAnalyzer.ID,
                "threshold", 6, "additional_facades", List.of("Carbon")));

        List<Issue> issues = analyze(analyzer, "app/Services/OrderService.php", SOURCE);

        assertEquals(1, issues.size());
        assertEquals(7, issues.get(0).metadata.get("count"));
    }
}
