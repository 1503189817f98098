package org.dxworks.lintframe;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.dxworks.lintframe.TestUtils.LARAVEL_APP;
import static org.junit.jupiter.api.Assertions.*;

class AppTest {

    @TempDir
    Path tempDir;

    @Test
    void usageErrorsExitWithTwo() {
        assertEquals(2, App.run(new String[]{}));
        assertEquals(2, App.run(new String[]{tempDir.resolve("missing").toString(), tempDir.resolve("out.json").toString()}));
        assertEquals(2, App.run(new String[]{LARAVEL_APP.toString(), tempDir.resolve("out.json").toString(),
                tempDir.resolve("absent.yml").toString()}));
        assertFalse(Files.exists(tempDir.resolve("out.json")));
    }

    @Test
    void invalidConfigurationExitsWithTwo() throws IOException {
        Path config = tempDir.resolve("lintframe-config.yml");
        Files.writeString(config, "analyzers:\n  fat-model:\n    method_threshold: lots\n");

        assertEquals(2, App.run(new String[]{LARAVEL_APP.toString(), tempDir.resolve("out.json").toString(), config.toString()}));
    }

    @Test
    void failingProjectWritesReportAndExitsWithOne() throws IOException {
        Path output = tempDir.resolve("reports/lintframe.json");

        assertEquals(1, App.run(new String[]{LARAVEL_APP.toString(), output.toString()}));

        JsonNode report = new ObjectMapper().readTree(output.toFile());
        assertEquals("failed", report.get("status").asText());
        assertEquals(6, report.get("filesAnalyzed").asInt());
        assertEquals(1, report.get("parseFailures").asInt());
        assertEquals(24, report.get("reports").size());
        JsonNode first = report.get("reports").get(0);
        assertEquals("eloquent-n-plus-one", first.get("id").asText());
        assertEquals("performance", first.get("category").asText());
        assertEquals("high", first.get("issues").get(0).get("severity").asText());
    }

    @Test
    void cleanProjectExitsWithZero() throws IOException {
        Path project = tempDir.resolve("clean");
        Files.createDirectories(project.resolve("app/Support"));
        Files.writeString(project.resolve("composer.json"),
                "{\"require\": {\"laravel/framework\": \"^11.0\", \"sentry/sentry-laravel\": \"^4.0\"}}\n");
        Files.writeString(project.resolve("app/Support/Clock.php"), "<?php\n\n"
                + "namespace App\\Support;\n\n"
                + "class Clock\n{\n"
                + "    public function now(): int\n"
                + "    {\n"
                + "        return time();\n"
                + "    }\n"
                + "}\n");
        Path output = tempDir.resolve("clean.json");

        assertEquals(0, App.run(new String[]{project.toString(), output.toString()}));
        assertEquals("passed", new ObjectMapper().readTree(output.toFile()).get("status").asText());
    }
}
