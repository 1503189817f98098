package org.dxworks.lintframe.analyzer.bestpractices;

import org.dxworks.lintframe.analyzer.AnalyzerOptions;
import org.dxworks.lintframe.model.Issue;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.dxworks.lintframe.TestUtils.*;
import static org.junit.jupiter.api.Assertions.*;

class EnvironmentCheckSmellAnalyzerTest {

    private static final String SOURCE = "<?php\n"
            + "namespace App\\Http\\Controllers;\n\n"
            + "use Illuminate\\Support\\Facades\\App;\n\n"
            + "class CheckoutController\n{\n"
            + "    public function store()\n    {\n"
            + "        if (app()->environment('production')) {\n"
            + "            $this->charge();\n"
            + "        }\n"
            + "        if (App::environment(['local', 'staging'])) {\n"
            + "            $this->fake();\n"
            + "        }\n"
            + "        if ($this->environment('x') || config('features.beta')) {\n"
            + "        }\n"
            + "    }\n}\n";

    private final EnvironmentCheckSmellAnalyzer analyzer =
            new EnvironmentCheckSmellAnalyzer(AnalyzerOptions.empty(EnvironmentCheckSmellAnalyzer.ID));

    @Test
    void environmentBranchesAreReported() {
        List<Issue> issues = analyze(analyzer, "app/Http/Controllers/CheckoutController.php", SOURCE);

        assertEquals(List.of(10, 13), lines(issues));
        assertEquals("Using app()->environment() for feature flags or behavior changes", issues.get(0).message);
        assertEquals("Using App::environment() for feature flags or behavior changes", issues.get(1).message);
    }

    @Test
    void providersAndHandlersMayCheckTheEnvironment() {
        assertTrue(analyze(analyzer, "app/Providers/AppServiceProvider.php", SOURCE).isEmpty());
        assertTrue(analyze(analyzer, "app/Exceptions/Handler.php", SOURCE).isEmpty());
    }
}
