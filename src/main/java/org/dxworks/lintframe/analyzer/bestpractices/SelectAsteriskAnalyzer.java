package org.dxworks.lintframe.analyzer.bestpractices;

import org.dxworks.lintframe.analyzer.AbstractFileAnalyzer;
import org.dxworks.lintframe.analyzer.AnalyzerOptions;
import org.dxworks.lintframe.analyzer.FileContext;
import org.dxworks.lintframe.analyzer.support.LaravelVocabulary;
import org.dxworks.lintframe.model.AnalyzerMetadata;
import org.dxworks.lintframe.model.Category;
import org.dxworks.lintframe.model.Issue;
import org.dxworks.lintframe.model.Severity;
import org.dxworks.lintframe.syntax.MethodChain;
import org.dxworks.lintframe.syntax.PhpNodes;
import org.dxworks.lintframe.syntax.SyntaxNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

public class SelectAsteriskAnalyzer extends AbstractFileAnalyzer {

    public static final String ID = "select-asterisk";
    public static final String CODE = "select-asterisk";

    private static final AnalyzerMetadata METADATA = new AnalyzerMetadata(
            ID,
            "Select Asterisk Detector",
            "Detects queries fetching all columns when only specific columns are needed",
            Category.BEST_PRACTICES,
            Severity.LOW,
            Severity.MEDIUM);

    private static final Set<String> TERMINALS = Set.of("all", "get", "first", "find");
    private static final Set<String> COLUMN_SELECTION = Set.of("select", "addSelect", "selectRaw");

    public SelectAsteriskAnalyzer(AnalyzerOptions options) {
        super(options);
    }

    @Override
    public AnalyzerMetadata getMetadata() {
        return METADATA;
    }

    @Override
    protected List<Issue> analyzeFile(FileContext context) {
        List<Issue> issues = new ArrayList<>();
        for (SyntaxNode call : context.tree().root().findAll(PhpNodes.CALLS)) {
            if (PhpNodes.isFunctionCall(call) || !PhpNodes.isChainTop(call)) continue;
            MethodChain chain = PhpNodes.chain(call);
            List<MethodChain.Link> links = chain.links();
            for (int i = 0; i < links.size(); i++) {
                MethodChain.Link link = links.get(i);
                if (!TERMINALS.contains(link.name)) continue;
                if (isQuery(chain, i) && !selectsColumns(links, i)) {
                    issues.add(issue(context, CODE, Severity.LOW, link.call.startLine(),
                            String.format("Query using ->%s() without ->select() fetches all columns", link.name))
                            .withRecommendation("Use ->select(['col1', 'col2']) to fetch only the needed columns. This "
                                    + "reduces memory usage and network transfer for wide tables or TEXT/BLOB columns.")
                            .withMetadata("method", link.name));
                }
                break;
            }
        }
        return issues;
    }

    /** Model or DB::table chains, or instance chains that were built up with query methods. */
    private static boolean isQuery(MethodChain chain, int terminalIndex) {
        if (chain.isStatic()) {
            String cls = chain.staticClass();
            if (LaravelVocabulary.isDbFacade(cls)) return "table".equals(chain.first().name);
            return cls != null && LaravelVocabulary.looksLikeModel(PhpNodes.shortName(cls));
        }
        if (PhpNodes.isFunctionCall(chain.root())) return false;
        for (int i = 0; i < terminalIndex; i++) {
            if (LaravelVocabulary.MODEL_QUERY_METHODS.contains(chain.links().get(i).name)) return true;
        }
        return false;
    }

    private static boolean selectsColumns(List<MethodChain.Link> links, int terminalIndex) {
        for (int i = 0; i < terminalIndex; i++) {
            if (COLUMN_SELECTION.contains(links.get(i).name)) return true;
        }
        for (SyntaxNode argument : links.get(terminalIndex).arguments()) {
            if (argument.is("array_creation_expression")) return true;
        }
        return false;
    }
}
