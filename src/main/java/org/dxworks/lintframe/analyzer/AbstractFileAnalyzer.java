package org.dxworks.lintframe.analyzer;

import org.dxworks.lintframe.FileKind;
import org.dxworks.lintframe.analyzer.support.PathFilter;
import org.dxworks.lintframe.model.Issue;
import org.dxworks.lintframe.model.Location;
import org.dxworks.lintframe.model.Severity;
import org.dxworks.lintframe.syntax.SyntaxNode;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Common plumbing for per-file rules: path scoping through the {@code paths} and
 * {@code excluded_paths} options, issue construction with excerpts and uniform suppression.
 */
public abstract class AbstractFileAnalyzer implements Analyzer {

    private static final int MAX_EXCERPT_LENGTH = 200;

    protected final AnalyzerOptions options;
    private final PathFilter includes;
    private final PathFilter excludes;

    protected AbstractFileAnalyzer(AnalyzerOptions options) {
        this.options = options;
        this.includes = new PathFilter(options.getStringList("paths", defaultPaths()));
        this.excludes = new PathFilter(options.getStringList("excluded_paths", defaultExcludedPaths()));
    }

    /** Path fragments the rule is limited to; empty means every scanned file. */
    protected List<String> defaultPaths() {
        return List.of();
    }

    protected List<String> defaultExcludedPaths() {
        return List.of();
    }

    protected Set<FileKind> fileKinds() {
        return EnumSet.of(FileKind.PHP);
    }

    @Override
    public boolean accepts(SourceFile file) {
        if (!fileKinds().contains(file.kind)) return false;
        if (!includes.isEmpty() && !includes.matches(file.relativePath)) return false;
        return !excludes.matches(file.relativePath);
    }

    @Override
    public final List<Issue> analyze(FileContext context) {
        if (context.file().kind == FileKind.PHP && !context.hasTree()) return List.of();
        List<Issue> kept = new ArrayList<>();
        for (Issue issue : analyzeFile(context)) {
            if (!context.suppressions().isSuppressed(getId(), issue.line())) kept.add(issue);
        }
        return kept;
    }

    protected abstract List<Issue> analyzeFile(FileContext context);

    protected Issue issue(FileContext context, String code, Severity severity, SyntaxNode node, String message) {
        return issue(context, code, severity, node.startLine(), node.endLine(), message);
    }

    protected Issue issue(FileContext context, String code, Severity severity, int line, String message) {
        return issue(context, code, severity, line, line, message);
    }

    protected Issue issue(FileContext context, String code, Severity severity, int startLine, int endLine,
                          String message) {
        Issue issue = new Issue(getId(), code, severity, message,
                new Location(context.relativePath(), startLine, endLine));
        String excerpt = context.line(startLine).trim();
        if (!excerpt.isEmpty()) {
            issue.excerpt = excerpt.length() > MAX_EXCERPT_LENGTH ? excerpt.substring(0, MAX_EXCERPT_LENGTH) : excerpt;
        }
        return issue;
    }
}
