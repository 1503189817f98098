package org.dxworks.lintframe.analyzer.bestpractices;

import org.dxworks.lintframe.analyzer.AnalyzerOptions;
import org.dxworks.lintframe.model.Issue;
import org.dxworks.lintframe.model.Severity;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.dxworks.lintframe.TestUtils.*;
import static org.junit.jupiter.api.Assertions.*;

class SilentFailureAnalyzerTest {

    private final SilentFailureAnalyzer analyzer = new SilentFailureAnalyzer(AnalyzerOptions.empty(SilentFailureAnalyzer.ID));

    private static String service(String className, String body) {
        return "<?php\nnamespace App\\Services;\n\nclass " + className + "\n{\n"
                + "    public function charge($order)\n    {\n" + body + "    }\n}\n";
    }

    private List<Issue> run(String body) {
        return analyze(analyzer, "app/Services/PaymentService.php", service("PaymentService", body));
    }

    @Test
    void emptyCatchIsReported() {
        List<Issue> issues = run(
                "        try {\n"
                        + "            $this->gateway->charge($order);\n"
                        + "        } catch (PaymentException $e) {\n"
                        + "        }\n");

        assertEquals(1, issues.size());
        assertEquals(SilentFailureAnalyzer.CODE_EMPTY_CATCH, issues.get(0).code);
        assertEquals(Severity.HIGH, issues.get(0).severity);
        assertEquals(10, issues.get(0).line());
    }

    @Test
    void commentExplainingTheEmptyCatchIsAccepted() {
        List<Issue> issues = run(
                "        try {\n"
                        + "            $this->gateway->charge($order);\n"
                        + "        } catch (PaymentException $e) {\n"
                        + "            // intentionally ignored, the webhook retries\n"
                        + "        }\n");

        assertTrue(issues.isEmpty(), issues::toString);
    }

    @Test
    void broadCatchWithoutRethrowIsReported() {
        List<Issue> issues = run(
                "        try {\n"
                        + "            $this->gateway->charge($order);\n"
                        + "        } catch (\\Exception $e) {\n"
                        + "            $this->retries++;\n"
                        + "        }\n");

        assertEquals(List.of(SilentFailureAnalyzer.CODE_BROAD_CATCH), codes(issues));
        assertEquals("Catching Exception is overly broad and can mask fatal errors", issues.get(0).message);
    }

    @Test
    void broadCatchThatRethrowsIsFine() {
        List<Issue> issues = run(
                "        try {\n"
                        + "            $this->gateway->charge($order);\n"
                        + "        } catch (\\Throwable $e) {\n"
                        + "            Log::error('charge failed');\n"
                        + "            throw $e;\n"
                        + "        }\n");

        assertTrue(issues.isEmpty(), issues::toString);
    }

    @Test
    void catchThatNeitherLogsNorRethrowsIsReported() {
        List<Issue> issues = run(
                "        try {\n"
                        + "            $this->gateway->charge($order);\n"
                        + "        } catch (PaymentException $e) {\n"
                        + "            $this->failed = true;\n"
                        + "        }\n");

        assertEquals(List.of(SilentFailureAnalyzer.CODE_UNLOGGED_CATCH), codes(issues));
        assertEquals(Severity.MEDIUM, issues.get(0).severity);
    }

    @Test
    void loggingFallbackOrUsingTheExceptionCountsAsHandling() {
        List<Issue> issues = run(
                "        try {\n"
                        + "            $this->gateway->charge($order);\n"
                        + "        } catch (PaymentException $ex) {\n"
                        + "            Log::warning('charge failed');\n"
                        + "        }\n"
                        + "        try {\n"
                        + "            $rate = $this->rates->current();\n"
                        + "        } catch (RateException $ex) {\n"
                        + "            $rate = Cache::get('rate', 1.0);\n"
                        + "        }\n"
                        + "        try {\n"
                        + "            $this->gateway->refund($order);\n"
                        + "        } catch (PaymentException $e) {\n"
                        + "            $this->lastError = $e->getMessage();\n"
                        + "        }\n"
                        + "        try {\n"
                        + "            $this->gateway->capture($order);\n"
                        + "        } catch (PaymentException $e) {\n"
                        + "            return false;\n"
                        + "        }\n");

        assertTrue(issues.isEmpty(), issues::toString);
    }

    @Test
    void whitelistedExceptionsAreIgnored() {
        List<Issue> issues = run(
                "        try {\n"
                        + "            $user = User::findOrFail($order);\n"
                        + "        } catch (ModelNotFoundException $e) {\n"
                        + "        }\n");

        assertTrue(issues.isEmpty(), issues::toString);
    }

    @Test
    void errorSuppressionSeverityDependsOnContext() {
        List<Issue> issues = run(
                "        $value = @$order['key'];\n"
                        + "        @unlink($order->path);\n"
                        + "        @$order->delete();\n"
                        + "        $handler = $order->handler;\n"
                        + "        @$handler($order);\n"
                        + "        try {\n"
                        + "            $this->gateway->charge($order);\n"
                        + "        } catch (PaymentException $e) {\n"
                        + "            Log::error($e->getMessage());\n"
                        + "            @file_put_contents('/tmp/failed', $order->id);\n"
                        + "        }\n");

        assertEquals(List.of(8, 12, 17), lines(issues));
        assertEquals(List.of(Severity.MEDIUM, Severity.HIGH, Severity.HIGH),
                issues.stream().map(i -> i.severity).toList());
        assertEquals("Dynamic error suppression is particularly dangerous", issues.get(1).message);
        assertEquals("Error suppression operator (@) inside catch block creates double silencing", issues.get(2).message);
    }

    @Test
    void testDirectoriesAndTestClassesAreWhitelisted() {
        String body = "        try {\n            $this->run();\n        } catch (\\Exception $e) {\n        }\n";

        assertTrue(analyze(analyzer, "tests/Feature/PaymentTest.php", service("PaymentTest", body)).isEmpty());
        assertTrue(analyze(analyzer, "app/Support/PaymentTest.php", service("PaymentTest", body)).isEmpty());
        assertEquals(1, analyze(analyzer, "app/Services/PaymentService.php", service("PaymentService", body)).size());
    }

    @Test
    void whitelistsAreConfigurable() {
        SilentFailureAnalyzer configured = new SilentFailureAnalyzer(options(SilentFailureAnalyzer.ID,
                "whitelist_dirs", List.of("app/Legacy"),
                "whitelist_error_suppression_functions", List.of("json_*")));

        String body = "        $data = @json_decode($order);\n        $raw = @file_get_contents($order);\n";

        assertTrue(analyze(configured, "app/Legacy/PaymentService.php", service("PaymentService", body)).isEmpty());
        assertEquals(List.of(9), lines(analyze(configured, "app/Services/PaymentService.php", service("PaymentService", body))));
    }
}
