package org.dxworks.lintframe.analyzer.bestpractices;

import org.dxworks.lintframe.analyzer.AbstractFileAnalyzer;
import org.dxworks.lintframe.analyzer.AnalyzerOptions;
import org.dxworks.lintframe.analyzer.FileContext;
import org.dxworks.lintframe.analyzer.ProjectAnalyzer;
import org.dxworks.lintframe.analyzer.ProjectContext;
import org.dxworks.lintframe.analyzer.support.LaravelVocabulary;
import org.dxworks.lintframe.model.AnalyzerMetadata;
import org.dxworks.lintframe.model.Category;
import org.dxworks.lintframe.model.Issue;
import org.dxworks.lintframe.model.Location;
import org.dxworks.lintframe.model.Severity;
import org.dxworks.lintframe.syntax.MethodChain;
import org.dxworks.lintframe.syntax.PhpNodes;
import org.dxworks.lintframe.syntax.SyntaxNode;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Where-clause sequences repeated across the codebase, which usually deserve a local scope on
 * the model.
 * <p>
 * Files only contribute occurrences; issues are produced in {@link #conclude} once every file
 * has been seen.
 */
public class MissingModelScopeAnalyzer extends AbstractFileAnalyzer implements ProjectAnalyzer {

    public static final String ID = "missing-model-scope";
    public static final String CODE = "missing-model-scope";

    private static final AnalyzerMetadata METADATA = new AnalyzerMetadata(
            ID,
            "Missing Model Scope Detector",
            "Detects repeated query patterns that should be extracted to model scopes",
            Category.BEST_PRACTICES,
            Severity.LOW,
            Severity.HIGH);

    private static final int MIN_SEQUENCE_LENGTH = 2;

    static class Occurrence {
        final String file;
        final int line;
        final String pattern;

        Occurrence(String file, int line, String pattern) {
            this.file = file;
            this.line = line;
            this.pattern = pattern;
        }
    }

    private static class WhereCall {
        final String method;
        final List<String> args;

        WhereCall(String method, List<String> args) {
            this.method = method;
            this.args = args;
        }
    }

    private final int minOccurrences;
    private final Map<String, ConcurrentLinkedQueue<Occurrence>> occurrences = new ConcurrentHashMap<>();

    public MissingModelScopeAnalyzer(AnalyzerOptions options) {
        super(options);
        this.minOccurrences = options.getPositiveInt("min_occurrences", 2);
    }

    @Override
    public AnalyzerMetadata getMetadata() {
        return METADATA;
    }

    @Override
    protected List<Issue> analyzeFile(FileContext context) {
        for (SyntaxNode call : context.tree().root().findAll(PhpNodes.CALLS)) {
            if (!PhpNodes.isChainTop(call) || PhpNodes.isFunctionCall(call)) continue;
            if (context.suppressions().isSuppressed(ID, call.startLine())) continue;
            MethodChain chain = PhpNodes.chain(call);
            if (!onModel(chain)) continue;
            List<WhereCall> wheres = whereCalls(chain);
            if (wheres.size() < MIN_SEQUENCE_LENGTH) continue;
            for (int start = 0; start < wheres.size(); start++) {
                for (int end = start + MIN_SEQUENCE_LENGTH; end <= wheres.size(); end++) {
                    List<WhereCall> sequence = wheres.subList(start, end);
                    occurrences.computeIfAbsent(signature(sequence), k -> new ConcurrentLinkedQueue<>())
                            .add(new Occurrence(context.relativePath(), call.startLine(), pattern(sequence)));
                }
            }
        }
        return List.of();
    }

    @Override
    public List<Issue> conclude(ProjectContext project) {
        List<Issue> issues = new ArrayList<>();
        Map<String, ConcurrentLinkedQueue<Occurrence>> drained = new TreeMap<>(occurrences);
        occurrences.clear();
        for (ConcurrentLinkedQueue<Occurrence> queue : drained.values()) {
            if (queue.size() < minOccurrences) continue;
            List<Occurrence> found = new ArrayList<>(queue);
            found.sort(Comparator.comparing((Occurrence o) -> o.file).thenComparingInt(o -> o.line));
            Occurrence first = found.get(0);

            List<String> shown = new ArrayList<>();
            for (Occurrence o : found.subList(0, Math.min(3, found.size()))) {
                shown.add(fileName(o.file) + ":" + o.line);
            }
            issues.add(new Issue(ID, CODE, Severity.LOW,
                    String.format("Query pattern \"%s\" appears %d times across the codebase", first.pattern, found.size()),
                    new Location(first.file, first.line))
                    .withRecommendation(String.format("Extract this query pattern to a model scope for reusability. "
                            + "Found %d occurrences at: %s", found.size(), String.join(", ", shown)))
                    .withMetadata("pattern", first.pattern)
                    .withMetadata("occurrences", found.size()));
        }
        return issues;
    }

    private static boolean onModel(MethodChain chain) {
        if (!chain.isStatic()) return true;
        String cls = chain.staticClass();
        return cls != null && LaravelVocabulary.looksLikeModel(PhpNodes.shortName(cls));
    }

    private static List<WhereCall> whereCalls(MethodChain chain) {
        List<WhereCall> wheres = new ArrayList<>();
        for (MethodChain.Link link : chain.links()) {
            if (link.name == null || !link.name.startsWith("where") && !link.name.equals("orWhere")) continue;
            List<String> args = new ArrayList<>();
            for (SyntaxNode arg : link.arguments()) {
                String literal = PhpNodes.stringValue(arg);
                if (literal != null) {
                    args.add(literal);
                } else if (arg.is("integer", "boolean", "null", "name")) {
                    args.add(arg.text());
                }
            }
            wheres.add(new WhereCall(link.name, args));
        }
        return wheres;
    }

    private static String signature(List<WhereCall> sequence) {
        List<String> parts = new ArrayList<>();
        for (WhereCall call : sequence) parts.add(call.method + "(" + String.join(",", call.args) + ")");
        return String.join("->", parts);
    }

    private static String pattern(List<WhereCall> sequence) {
        List<String> parts = new ArrayList<>();
        for (WhereCall call : sequence) {
            if (call.args.isEmpty()) {
                parts.add(call.method + "(...)");
            } else {
                parts.add(call.method + "('" + String.join("', '", call.args.subList(0, Math.min(2, call.args.size())))
                        + "', ...)");
            }
        }
        return String.join("->", parts);
    }

    private static String fileName(String path) {
        int slash = path.lastIndexOf('/');
        return slash >= 0 ? path.substring(slash + 1) : path;
    }
}
