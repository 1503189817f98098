package org.dxworks.lintframe.analyzer.bestpractices;

import org.dxworks.lintframe.analyzer.AbstractFileAnalyzer;
import org.dxworks.lintframe.analyzer.AnalyzerOptions;
import org.dxworks.lintframe.analyzer.FileContext;
import org.dxworks.lintframe.model.AnalyzerMetadata;
import org.dxworks.lintframe.model.Category;
import org.dxworks.lintframe.model.Issue;
import org.dxworks.lintframe.model.Severity;
import org.dxworks.lintframe.syntax.PhpNodes;
import org.dxworks.lintframe.syntax.SyntaxNode;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Endpoint URLs and key-like literals that belong in {@code config/} files.
 */
public class ConfigOutsideConfigAnalyzer extends AbstractFileAnalyzer {

    public static final String ID = "config-outside-config";
    public static final String CODE_URL = "hardcoded-url";
    public static final String CODE_API_KEY = "hardcoded-api-key";

    private static final AnalyzerMetadata METADATA = new AnalyzerMetadata(
            ID,
            "Hardcoded Configuration Detector",
            "Detects configuration values hardcoded in code instead of config files",
            Category.BEST_PRACTICES,
            Severity.MEDIUM);

    private static final Pattern URL = Pattern.compile("^https?://.*", Pattern.DOTALL);
    private static final Pattern API_KEY = Pattern.compile("^[a-zA-Z0-9]{20,}$");
    private static final List<String> DOCUMENTATION_HOSTS = List.of(
            "example.com", "laravel.com", "github.com", "stackoverflow.com");

    public ConfigOutsideConfigAnalyzer(AnalyzerOptions options) {
        super(options);
    }

    @Override
    protected List<String> defaultExcludedPaths() {
        return List.of("config/");
    }

    @Override
    public AnalyzerMetadata getMetadata() {
        return METADATA;
    }

    @Override
    protected List<Issue> analyzeFile(FileContext context) {
        List<Issue> issues = new ArrayList<>();
        for (SyntaxNode literal : context.tree().root().findAll(PhpNodes.STRINGS)) {
            String value = PhpNodes.stringValue(literal);
            if (value == null) continue;
            if (URL.matcher(value).matches() && !isDocumentationUrl(value)) {
                String shown = value.length() > 50 ? value.substring(0, 50) : value;
                issues.add(issue(context, CODE_URL, Severity.MEDIUM, literal,
                        "Hardcoded URL: \"" + shown + "\"")
                        .withRecommendation("Move URLs to a config file (e.g. config/services.php) and read them with "
                                + "config('services.api.url').")
                        .withMetadata("url", value));
            }
            if (API_KEY.matcher(value).matches() && value.length() > 30) {
                issues.add(issue(context, CODE_API_KEY, Severity.HIGH, literal,
                        "Possible hardcoded API key or secret detected")
                        .withRecommendation("Never hardcode API keys in source code. Read them from environment "
                                + "variables through a config file: config('services.api.key')."));
            }
        }
        return issues;
    }

    private static boolean isDocumentationUrl(String url) {
        for (String host : DOCUMENTATION_HOSTS) {
            if (url.contains(host)) return true;
        }
        return false;
    }
}
