package org.dxworks.lintframe.analyzer.bestpractices;

import org.dxworks.lintframe.analyzer.AnalyzerOptions;
import org.dxworks.lintframe.model.Issue;
import org.dxworks.lintframe.model.Severity;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.dxworks.lintframe.TestUtils.*;
import static org.junit.jupiter.api.Assertions.*;

class LogicInBladeAnalyzerTest {

    private static final String VIEW = "resources/views/orders/index.blade.php";

    private final LogicInBladeAnalyzer analyzer = new LogicInBladeAnalyzer(AnalyzerOptions.empty(LogicInBladeAnalyzer.ID));

    @Test
    void eachLineReportsItsMostSevereFinding() {
        String template = String.join("\n",
                "<h1>{{ $title }}</h1>",
                "@php",
                "    $total = 0;",
                "@endphp",
                "@foreach ($orders as $order)",
                "    {{ $order->user()->first()->name }}",
                "    @foreach ($order->items as $item)",
                "        {{ str_replace('-', ' ', $item->sku) }}",
                "    @endforeach",
                "@endforeach",
                "{{ Http::get('https://api.example.com/rates')->json() }}",
                "@if ($user->active && $user->verified && $user->paid && !$user->banned)",
                "{{ $order->price * $order->qty + $shipping }}",
                "{{ $price ?? 0 }}",
                "<?php echo $x; ?>",
                "{{ $a + $b }}",
                "");

        List<Issue> issues = analyze(analyzer, VIEW, template);

        assertEquals(List.of(
                LogicInBladeAnalyzer.CODE_DB_QUERY,
                LogicInBladeAnalyzer.CODE_NESTED_FOREACH,
                LogicInBladeAnalyzer.CODE_EXPENSIVE,
                LogicInBladeAnalyzer.CODE_API_CALL,
                LogicInBladeAnalyzer.CODE_BUSINESS_LOGIC,
                LogicInBladeAnalyzer.CODE_CALCULATION,
                LogicInBladeAnalyzer.CODE_INLINE_PHP), codes(issues));
        assertEquals(List.of(6, 7, 8, 11, 12, 13, 15), lines(issues));
        assertEquals(Severity.CRITICAL, issues.get(0).severity);
        assertEquals("Nested @foreach detected (depth: 2) - potential performance issue", issues.get(1).message);
    }

    @Test
    void longAndUnclosedPhpBlocksAreReported() {
        LogicInBladeAnalyzer strict = new LogicInBladeAnalyzer(options(LogicInBladeAnalyzer.ID, "max_php_block_lines", 2));
        String template = String.join("\n",
                "@php",
                "    $a = 1;",
                "    $b = 2;",
                "    $c = 3;",
                "@endphp",
                "<p>{{ $a }}</p>",
                "@php",
                "    $d = 4;",
                "");

        List<Issue> issues = analyze(strict, VIEW, template);

        assertEquals(List.of(LogicInBladeAnalyzer.CODE_BLOCK_TOO_LONG, LogicInBladeAnalyzer.CODE_UNCLOSED_BLOCK), codes(issues));
        assertEquals(List.of(1, 7), lines(issues));
        assertEquals("PHP block has 3 lines (max recommended: 2)", issues.get(0).message);
        assertEquals(Severity.HIGH, issues.get(1).severity);
    }

    @Test
    void onlyBladeTemplatesAreScanned() {
        assertTrue(analyze(analyzer, "app/Http/Controllers/OrderController.php", "<?php\n$users = DB::table('users')->get();\n")
                .isEmpty());
    }
}
