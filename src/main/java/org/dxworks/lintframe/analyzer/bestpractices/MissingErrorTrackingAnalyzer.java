package org.dxworks.lintframe.analyzer.bestpractices;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.dxworks.lintframe.analyzer.AnalyzerOptions;
import org.dxworks.lintframe.analyzer.FileContext;
import org.dxworks.lintframe.analyzer.ProjectAnalyzer;
import org.dxworks.lintframe.analyzer.ProjectContext;
import org.dxworks.lintframe.analyzer.SourceFile;
import org.dxworks.lintframe.model.AnalyzerMetadata;
import org.dxworks.lintframe.model.Category;
import org.dxworks.lintframe.model.Issue;
import org.dxworks.lintframe.model.Location;
import org.dxworks.lintframe.model.Severity;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Checks composer.json for an error tracking client. Only meaningful for deployed environments.
 */
public class MissingErrorTrackingAnalyzer implements ProjectAnalyzer {

    public static final String ID = "missing-error-tracking";
    public static final String CODE = "missing-error-tracking";

    private static final AnalyzerMetadata METADATA = new AnalyzerMetadata(
            ID,
            "Missing Error Tracking Detector",
            "Detects production applications without error tracking services like Sentry",
            Category.BEST_PRACTICES,
            Severity.MEDIUM);

    static final List<String> ERROR_TRACKING_PACKAGES = List.of(
            "sentry/sentry-laravel",
            "bugsnag/bugsnag-laravel",
            "rollbar/rollbar-laravel",
            "airbrake/phpbrake",
            "honeybadger-io/honeybadger-laravel");

    private final List<String> environments;
    private final List<String> packages;

    public MissingErrorTrackingAnalyzer(AnalyzerOptions options) {
        this.environments = options.getStringList("environments", List.of("production", "staging"));
        this.packages = options.getStringListAdding("additional_packages", ERROR_TRACKING_PACKAGES);
    }

    @Override
    public AnalyzerMetadata getMetadata() {
        return METADATA;
    }

    @Override
    public boolean accepts(SourceFile file) {
        return false;
    }

    @Override
    public List<Issue> analyze(FileContext context) {
        return List.of();
    }

    @Override
    public Optional<String> skipReason(ProjectContext project) {
        String environment = project.config().getEnvironment();
        if (environments.contains(environment)) return Optional.empty();
        return Optional.of("Not relevant for the '" + environment + "' environment");
    }

    @Override
    public List<Issue> conclude(ProjectContext project) {
        Path composer = project.projectRoot().resolve("composer.json");
        if (!Files.isRegularFile(composer)) return List.of();

        JsonNode root;
        try {
            root = new ObjectMapper().readTree(composer.toFile());
        } catch (IOException e) {
            synchronized (System.err) {
                System.err.println("Warning: cannot read " + composer + ": " + e.getMessage());
            }
            return List.of();
        }
        for (String pkg : packages) {
            if (root.path("require").has(pkg) || root.path("require-dev").has(pkg)) return List.of();
        }
        return List.of(new Issue(ID, CODE, Severity.MEDIUM, "No error tracking service found in composer.json",
                new Location("composer.json", 1))
                .withRecommendation("Install an error tracking service such as Sentry (sentry/sentry-laravel), "
                        + "Bugsnag or Rollbar for production error monitoring, automatic error grouping and faster debugging."));
    }
}
