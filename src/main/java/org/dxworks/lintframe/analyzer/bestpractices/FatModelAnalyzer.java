package org.dxworks.lintframe.analyzer.bestpractices;

import org.dxworks.lintframe.analyzer.AbstractFileAnalyzer;
import org.dxworks.lintframe.analyzer.AnalyzerOptions;
import org.dxworks.lintframe.analyzer.FileContext;
import org.dxworks.lintframe.analyzer.support.CodeMetrics;
import org.dxworks.lintframe.model.AnalyzerMetadata;
import org.dxworks.lintframe.model.Category;
import org.dxworks.lintframe.model.Issue;
import org.dxworks.lintframe.model.Severity;
import org.dxworks.lintframe.scope.FileSymbols;
import org.dxworks.lintframe.syntax.MethodChain;
import org.dxworks.lintframe.syntax.PhpNodes;
import org.dxworks.lintframe.syntax.SyntaxNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Models carrying business logic that belongs in services: too many public business methods,
 * too many lines, or overly complex methods.
 */
public class FatModelAnalyzer extends AbstractFileAnalyzer {

    public static final String ID = "fat-model";
    public static final String CODE_METHODS = "fat-model-methods";
    public static final String CODE_LOC = "fat-model-loc";
    public static final String CODE_COMPLEXITY = "fat-model-complexity";

    private static final AnalyzerMetadata METADATA = new AnalyzerMetadata(
            ID,
            "Fat Model Analyzer",
            "Detects Eloquent models with too much business logic that should be extracted to services",
            Category.BEST_PRACTICES,
            Severity.MEDIUM);

    private static final Set<String> FRAMEWORK_METHODS = Set.of(
            "boot", "booting", "booted", "casts", "newEloquentBuilder", "newCollection", "newFactory",
            "resolveRouteBinding", "resolveChildRouteBinding", "getRouteKeyName", "getRouteKey", "toArray",
            "toJson", "broadcastOn", "broadcastWith", "broadcastAs", "prunable", "shouldBeSearchable",
            "toSearchableArray", "searchableAs");

    private static final List<String> RELATION_TYPES = List.of(
            "Relation", "HasOne", "HasMany", "BelongsTo", "BelongsToMany", "MorphTo", "MorphOne", "MorphMany",
            "MorphToMany", "HasOneThrough", "HasManyThrough", "MorphedByMany");

    private static final String[] RELATION_METHODS = {
            "hasOne", "hasMany", "belongsTo", "belongsToMany", "morphTo", "morphOne", "morphMany", "morphToMany",
            "hasOneThrough", "hasManyThrough", "morphedByMany"};

    private static final Pattern BASE_MODEL = Pattern.compile(".*Base[A-Z]\\w*Model$");
    private static final Set<String> MODEL_PARENTS = Set.of("Model", "Pivot", "MorphPivot", "Authenticatable");

    private final int methodThreshold;
    private final int locThreshold;
    private final int complexityThreshold;

    public FatModelAnalyzer(AnalyzerOptions options) {
        super(options);
        this.methodThreshold = options.getNonNegativeInt("method_threshold", 15);
        this.locThreshold = options.getNonNegativeInt("loc_threshold", 300);
        this.complexityThreshold = options.getNonNegativeInt("complexity_threshold", 10);
    }

    @Override
    protected List<String> defaultPaths() {
        return List.of("app/Models");
    }

    @Override
    public AnalyzerMetadata getMetadata() {
        return METADATA;
    }

    @Override
    protected List<Issue> analyzeFile(FileContext context) {
        List<Issue> issues = new ArrayList<>();
        FileSymbols symbols = FileSymbols.of(context.tree());
        for (FileSymbols.DeclaredClass cls : symbols.classes()) {
            if (!cls.node.is("class_declaration") || !isModel(cls, context)) continue;
            analyzeModel(context, cls, issues);
        }
        return issues;
    }

    private boolean isModel(FileSymbols.DeclaredClass cls, FileContext context) {
        if (context.registry().isModel(cls.fqcn)) return true;
        String parent = cls.parent;
        if (parent == null) return false;
        if (parent.equals("Illuminate\\Foundation\\Auth\\User")) return true;
        String shortParent = PhpNodes.shortName(parent);
        return MODEL_PARENTS.contains(shortParent)
                || shortParent.endsWith("BaseModel")
                || parent.contains("\\Models\\Base")
                || BASE_MODEL.matcher(parent).matches();
    }

    private void analyzeModel(FileContext context, FileSymbols.DeclaredClass cls, List<Issue> issues) {
        SyntaxNode body = PhpNodes.body(cls.node);
        if (body == null) return;
        List<SyntaxNode> businessMethods = new ArrayList<>();
        int statementLines = 0;
        for (SyntaxNode member : body.children()) {
            if (member.is("method_declaration")) {
                statementLines += CodeMetrics.lines(member);
                if (isBusinessMethod(member)) businessMethods.add(member);
            } else if (member.is("property_declaration")) {
                statementLines += CodeMetrics.lines(member);
            }
        }

        if (businessMethods.size() > methodThreshold) {
            int excess = businessMethods.size() - methodThreshold;
            issues.add(issue(context, CODE_METHODS, graded(excess, 15, 5), cls.node.startLine(),
                    String.format("Model \"%s\" has %d business methods (threshold: %d). Consider extracting logic to service classes",
                            cls.shortName, businessMethods.size(), methodThreshold))
                    .withRecommendation("Move business logic to service classes. Models should focus on data "
                            + "representation, relationships and simple accessors or mutators.")
                    .withMetadata("model", cls.shortName)
                    .withMetadata("business_methods", businessMethods.size()));
        }

        if (statementLines > locThreshold) {
            issues.add(issue(context, CODE_LOC, graded(statementLines - locThreshold, 200, 100), cls.node.startLine(),
                    String.format("Model \"%s\" has %d statement lines (threshold: %d). Model is too large",
                            cls.shortName, statementLines, locThreshold))
                    .withRecommendation("Extract business logic to services, reusable behaviour to traits and "
                            + "query logic to repositories or scopes.")
                    .withMetadata("model", cls.shortName)
                    .withMetadata("lines", statementLines));
        }

        for (SyntaxNode method : businessMethods) {
            int complexity = CodeMetrics.cyclomaticComplexity(PhpNodes.body(method));
            if (complexity <= complexityThreshold) continue;
            String name = PhpNodes.declarationName(method);
            issues.add(issue(context, CODE_COMPLEXITY, graded(complexity - complexityThreshold, 15, 5), method.startLine(),
                    String.format("Method \"%s::%s()\" has complexity of %d (threshold: %d)",
                            cls.shortName, name, complexity, complexityThreshold))
                    .withRecommendation("Complex methods in models indicate business logic that should be extracted "
                            + "to service classes.")
                    .withMetadata("model", cls.shortName)
                    .withMetadata("method", name)
                    .withMetadata("complexity", complexity));
        }
    }

    private static Severity graded(int excess, int high, int medium) {
        if (excess >= high) return Severity.HIGH;
        if (excess >= medium) return Severity.MEDIUM;
        return Severity.LOW;
    }

    static boolean isBusinessMethod(SyntaxNode method) {
        String name = PhpNodes.declarationName(method);
        if (name == null || FRAMEWORK_METHODS.contains(name)) return false;
        if (name.startsWith("scope") || name.endsWith("Attribute")) return false;
        SyntaxNode visibility = method.firstChild("visibility_modifier");
        if (visibility != null && !visibility.text().equals("public")) return false;
        return !isRelationship(method);
    }

    private static boolean isRelationship(SyntaxNode method) {
        SyntaxNode returnType = method.child("return_type");
        if (returnType != null) {
            for (SyntaxNode typeName : returnType.findAll("name", "qualified_name")) {
                for (String relation : RELATION_TYPES) {
                    if (typeName.text().endsWith(relation)) return true;
                }
            }
        }
        SyntaxNode body = PhpNodes.body(method);
        if (body == null) return false;
        List<SyntaxNode> returns = body.childrenOfKind("return_statement");
        if (returns.isEmpty() || returns.get(returns.size() - 1).childCount() == 0) return false;
        SyntaxNode returned = returns.get(returns.size() - 1).child(0);
        if (!PhpNodes.isMethodCall(returned)) return false;
        MethodChain chain = PhpNodes.chain(returned);
        return chain.contains(RELATION_METHODS);
    }
}
