package org.dxworks.lintframe.analyzer.support;

import org.dxworks.lintframe.syntax.SyntaxNode;
import org.junit.jupiter.api.Test;

import static org.dxworks.lintframe.TestUtils.parse;
import static org.junit.jupiter.api.Assertions.*;

class CodeMetricsTest {

    private static SyntaxNode function(String source) {
        return parse(source).root().findFirst("function_definition");
    }

    @Test
    void straightLineCodeHasComplexityOne() {
        SyntaxNode f = function("<?php\nfunction f($a)\n{\n    return $a + 1;\n}\n");

        assertEquals(1, CodeMetrics.cyclomaticComplexity(f));
        assertEquals(4, CodeMetrics.lines(f));
    }

    @Test
    void loopsCatchesAndCasesAddAPointEach() {
        SyntaxNode f = function("<?php\n"
                + "function g($v)\n"
                + "{\n"
                + "    try {\n"
                + "        while ($v > 0) {\n"
                + "            $v--;\n"
                + "        }\n"
                + "    } catch (Exception $e) {\n"
                + "        return 0;\n"
                + "    }\n"
                + "    switch ($v) {\n"
                + "        case 1:\n"
                + "            return 1;\n"
                + "        case 2:\n"
                + "            return 2;\n"
                + "        default:\n"
                + "            return 3;\n"
                + "    }\n"
                + "}\n");

        assertEquals(5, CodeMetrics.cyclomaticComplexity(f));
        assertEquals(18, CodeMetrics.lines(f));
    }

    @Test
    void shortCircuitOperatorsCount() {
        SyntaxNode f = function("<?php\nfunction h($a, $b)\n{\n    return ($a && $b) || ($a ?? $b);\n}\n");

        assertEquals(4, CodeMetrics.cyclomaticComplexity(f));
    }

    @Test
    void missingNodeIsTrivial() {
        assertEquals(1, CodeMetrics.cyclomaticComplexity(null));
        assertEquals(0, CodeMetrics.lines(null));
    }
}
