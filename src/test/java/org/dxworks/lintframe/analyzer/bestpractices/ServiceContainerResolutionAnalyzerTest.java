package org.dxworks.lintframe.analyzer.bestpractices;

import org.dxworks.lintframe.analyzer.AnalyzerOptions;
import org.dxworks.lintframe.model.Issue;
import org.dxworks.lintframe.model.Severity;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.dxworks.lintframe.TestUtils.*;
import static org.junit.jupiter.api.Assertions.*;

class ServiceContainerResolutionAnalyzerTest {

    private static final String BILLING = "<?php\n"
            + "namespace App\\Services;\n\n"
            + "use Illuminate\\Support\\Facades\\App;\n\n"
            + "class BillingService\n{\n"
            + "    public function charge($gateway)\n"
            + "    {\n"
            + "        $mailer = app()->make(Mailer::class);\n"
            + "        $stripe = App::make('stripe');\n"
            + "        $queue = resolve($gateway);\n"
            + "        $config = app('config');\n"
            + "        app()->singleton(Gateway::class, StripeGateway::class);\n"
            + "        $local = app()->isLocal();\n"
            + "        $deferred = function () { return app()->make(Mailer::class); };\n"
            + "        $client = new PaymentService();\n"
            + "        return app(Reporter::class);\n"
            + "    }\n"
            + "}\n";

    private final ServiceContainerResolutionAnalyzer analyzer =
            new ServiceContainerResolutionAnalyzer(AnalyzerOptions.empty(ServiceContainerResolutionAnalyzer.ID));

    @Test
    void serviceLocationAndBindingsAreReported() {
        List<Issue> issues = analyze(analyzer, "app/Services/BillingService.php", BILLING);

        assertEquals(List.of(10, 11, 12, 14, 18), lines(issues));
        assertEquals(List.of("app()->make()", "App::make()", "resolve()", "app()->singleton()", "app()"),
                issues.stream().map(i -> i.metadata.get("pattern")).toList());
        assertEquals(List.of(Severity.MEDIUM, Severity.HIGH, Severity.MEDIUM, Severity.HIGH, Severity.MEDIUM),
                issues.stream().map(i -> i.severity).toList());
        assertEquals(ServiceContainerResolutionAnalyzer.CODE_BINDING, issues.get(3).code);
        assertEquals("Manual service resolution in 'BillingService::charge': app()->make()", issues.get(0).message);
        assertEquals("variable", issues.get(2).metadata.get("argument_type"));
    }

    @Test
    void manualInstantiationIsOptIn() {
        ServiceContainerResolutionAnalyzer strict = new ServiceContainerResolutionAnalyzer(
                options(ServiceContainerResolutionAnalyzer.ID, "detect_manual_instantiation", true));

        List<Issue> issues = analyze(strict, "app/Services/BillingService.php", BILLING);

        assertEquals(List.of(10, 11, 12, 14, 17, 18), lines(issues));
        assertEquals("new PaymentService()", issues.get(4).metadata.get("pattern"));
        assertEquals(ServiceContainerResolutionAnalyzer.CODE_INSTANTIATION, issues.get(4).code);
    }

    @Test
    void providersWhitelistedDirectoriesAndClassesAreSkipped() {
        assertTrue(analyze(analyzer, "app/Providers/BillingServiceProvider.php", BILLING).isEmpty());
        assertTrue(analyze(analyzer, "routes/web.php", BILLING).isEmpty());
        assertTrue(analyze(analyzer, "app/Console/Commands/Charge.php",
                BILLING.replace("class BillingService", "class ChargeCommand")).isEmpty());
        assertTrue(analyze(analyzer, "app/Support/Billing.php",
                BILLING.replace("class BillingService", "class BillingProvider extends \\Illuminate\\Support\\ServiceProvider")).isEmpty());
    }
}
