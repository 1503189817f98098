package org.dxworks.lintframe.analyzer.bestpractices;

import org.dxworks.lintframe.analyzer.AnalyzerOptions;
import org.dxworks.lintframe.model.Issue;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.dxworks.lintframe.TestUtils.*;
import static org.junit.jupiter.api.Assertions.*;

class GenericExceptionCatchAnalyzerTest {

    @Test
    void genericCatchTypesAreReportedOncePerType() {
        String php = "<?php\n"
                + "function import($file) {\n"
                + "    try {\n"
                + "        parse($file);\n"
                + "    } catch (\\Exception $e) {\n"
                + "        report($e);\n"
                + "    }\n"
                + "    try {\n"
                + "        parse($file);\n"
                + "    } catch (InvalidArgumentException | Throwable $e) {\n"
                + "        report($e);\n"
                + "    }\n"
                + "    try {\n"
                + "        parse($file);\n"
                + "    } catch (\\App\\Exceptions\\ImportException $e) {\n"
                + "        report($e);\n"
                + "    }\n"
                + "}\n";

        List<Issue> issues = analyze(new GenericExceptionCatchAnalyzer(AnalyzerOptions.empty(GenericExceptionCatchAnalyzer.ID)),
                "app/Support/import.php", php);

        assertEquals(List.of(5, 10), lines(issues));
        assertEquals("Catching generic Exception instead of specific exception type", issues.get(0).message);
        assertEquals("Throwable", issues.get(1).metadata.get("type"));
    }
}
