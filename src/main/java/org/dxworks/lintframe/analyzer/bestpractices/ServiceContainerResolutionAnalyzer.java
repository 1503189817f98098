package org.dxworks.lintframe.analyzer.bestpractices;

import org.dxworks.lintframe.analyzer.AbstractFileAnalyzer;
import org.dxworks.lintframe.analyzer.AnalyzerOptions;
import org.dxworks.lintframe.analyzer.FileContext;
import org.dxworks.lintframe.analyzer.support.PathFilter;
import org.dxworks.lintframe.analyzer.support.WildcardPattern;
import org.dxworks.lintframe.model.AnalyzerMetadata;
import org.dxworks.lintframe.model.Category;
import org.dxworks.lintframe.model.Issue;
import org.dxworks.lintframe.model.Severity;
import org.dxworks.lintframe.scope.FileSymbols;
import org.dxworks.lintframe.syntax.PhpNodes;
import org.dxworks.lintframe.syntax.SyntaxNode;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Service locator usage: {@code app()->make()}, {@code App::make()}, {@code resolve()},
 * {@code app('service')} and {@code Container::getInstance()->make()}. Container bindings made
 * outside a service provider are reported as well.
 * <p>
 * Resolution inside closures is tolerated since closures cannot take constructor injection.
 */
public class ServiceContainerResolutionAnalyzer extends AbstractFileAnalyzer {

    public static final String ID = "service-container-resolution";
    public static final String CODE_RESOLUTION = "manual-service-resolution";
    public static final String CODE_BINDING = "binding-outside-provider";
    public static final String CODE_INSTANTIATION = "manual-instantiation";

    private static final AnalyzerMetadata METADATA = new AnalyzerMetadata(
            ID,
            "Service Container Resolution Analyzer",
            "Detects manual service container resolution that should use dependency injection",
            Category.BEST_PRACTICES,
            Severity.MEDIUM);

    static final List<String> DEFAULT_WHITELIST_DIRS = List.of(
            "tests", "database/migrations", "database/seeders", "database/factories", "routes");

    static final List<String> DEFAULT_WHITELIST_CLASSES = List.of(
            "*Command", "*Seeder", "DatabaseSeeder", "*Job", "*Listener", "*Middleware", "*Observer", "*Factory",
            "*Handler");

    static final List<String> DEFAULT_WHITELIST_METHODS = List.of(
            "environment", "isLocal", "isProduction", "runningInConsole", "runningUnitTests", "bound", "has",
            "resolved", "isShared", "isAlias", "call", "tagged", "when", "needs", "give", "giveTagged", "giveConfig",
            "extend", "alias", "terminating", "booted", "booting", "basePath", "configPath", "databasePath",
            "resourcePath", "storagePath", "publicPath", "langPath", "bootstrapPath", "getLocale", "setLocale",
            "isLocale", "currentLocale", "version", "name", "abort", "flush", "forgetInstance", "forgetInstances",
            "forgetScopedInstances");

    static final List<String> DEFAULT_WHITELIST_SERVICES = List.of(
            "config", "request", "log", "cache", "session", "view", "validator", "translator", "events", "files",
            "router", "db", "auth", "hash", "cookie", "queue", "mail", "url", "redirect", "blade.compiler",
            "encrypter");

    private static final Set<String> BINDING_METHODS = Set.of("bind", "singleton", "instance", "scoped");

    private final PathFilter whitelistDirs;
    private final WildcardPattern whitelistClasses;
    private final Set<String> whitelistMethods;
    private final Set<String> whitelistServices;
    private final Set<String> resolutionMethods;
    private final boolean detectManualInstantiation;
    private final WildcardPattern instantiationPatterns;

    public ServiceContainerResolutionAnalyzer(AnalyzerOptions options) {
        super(options);
        List<String> dirs = new ArrayList<>();
        for (String dir : options.getStringList("whitelist_dirs", DEFAULT_WHITELIST_DIRS)) {
            dirs.add(dir.endsWith("/") ? dir : dir + "/");
        }
        this.whitelistDirs = new PathFilter(dirs);
        this.whitelistClasses = new WildcardPattern(options.getStringList("whitelist_classes", DEFAULT_WHITELIST_CLASSES));
        this.whitelistMethods = new HashSet<>(options.getStringList("whitelist_methods", DEFAULT_WHITELIST_METHODS));
        this.whitelistServices = new HashSet<>(options.getStringList("whitelist_services", DEFAULT_WHITELIST_SERVICES));
        this.resolutionMethods = new HashSet<>(List.of("make", "makeWith", "resolve"));
        if (options.getBoolean("detect_psr_get", false)) resolutionMethods.add("get");
        this.detectManualInstantiation = options.getBoolean("detect_manual_instantiation", false);
        this.instantiationPatterns = new WildcardPattern(options.getStringList("manual_instantiation_patterns",
                List.of("*Service", "*Repository", "*Handler")));
    }

    @Override
    public AnalyzerMetadata getMetadata() {
        return METADATA;
    }

    @Override
    protected List<Issue> analyzeFile(FileContext context) {
        if (whitelistDirs.matches(context.relativePath()) || context.relativePath().endsWith("ServiceProvider.php")) {
            return List.of();
        }
        FileSymbols symbols = FileSymbols.of(context.tree());
        for (FileSymbols.DeclaredClass cls : symbols.classes()) {
            if (isServiceProvider(PhpNodes.baseClassName(cls.node))) return List.of();
        }

        List<Issue> issues = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (SyntaxNode node : context.tree().root().findAll(
                "function_call_expression", "member_call_expression", "scoped_call_expression",
                "object_creation_expression")) {
            SyntaxNode cls = node.ancestor("class_declaration");
            if (cls != null && isWhitelistedClass(symbols, cls)) continue;
            Finding finding = classify(node);
            if (finding == null) continue;
            if (!finding.binding && PhpNodes.isInsideClosure(node, null)) continue;
            if (!seen.add(node.startLine() + ":" + finding.pattern)) continue;

            String where = location(node, cls);
            issues.add(issue(context, finding.code, finding.severity, node.startLine(),
                    "Manual service resolution in '" + where + "': " + finding.pattern)
                    .withRecommendation(recommendation(finding, where))
                    .withMetadata("pattern", finding.pattern)
                    .withMetadata("location", where)
                    .withMetadata("class", cls == null ? "Unknown" : PhpNodes.declarationName(cls))
                    .withMetadata("argument_type", finding.argumentType));
        }
        return issues;
    }

    private static class Finding {
        final String code;
        final String pattern;
        final Severity severity;
        final String argumentType;
        final boolean binding;

        Finding(String code, String pattern, Severity severity, String argumentType, boolean binding) {
            this.code = code;
            this.pattern = pattern;
            this.severity = severity;
            this.argumentType = argumentType;
            this.binding = binding;
        }
    }

    private Finding classify(SyntaxNode node) {
        if (node.is("object_creation_expression")) {
            String cls = PhpNodes.instantiatedClass(node);
            if (!detectManualInstantiation || cls == null || !instantiationPatterns.matches(cls)) return null;
            return new Finding(CODE_INSTANTIATION, "new " + cls + "()", Severity.LOW, "instantiation", false);
        }
        String name = PhpNodes.callName(node);
        if (name == null) return null;

        if (PhpNodes.isFunctionCall(node)) {
            if (name.equals("resolve")) return resolution("resolve()", node);
            if (name.equals("app") && !PhpNodes.arguments(node).isEmpty()) {
                String service = PhpNodes.stringValue(PhpNodes.argument(node, 0));
                if (service != null && whitelistServices.contains(service)) return null;
                return resolution("app()", node);
            }
            return null;
        }
        if (PhpNodes.isStaticCall(node)) {
            String cls = PhpNodes.scopeName(node);
            if (("App".equals(cls) || (cls != null && cls.endsWith("\\App"))) && resolutionMethods.contains(name)) {
                return resolution("App::" + name + "()", node);
            }
            return null;
        }
        SyntaxNode receiver = PhpNodes.receiver(node);
        if (PhpNodes.isFunctionCall(receiver) && "app".equals(PhpNodes.callName(receiver))) {
            if (whitelistMethods.contains(name)) return null;
            if (resolutionMethods.contains(name)) return resolution("app()->" + name + "()", node);
            if (BINDING_METHODS.contains(name)) {
                return new Finding(CODE_BINDING, "app()->" + name + "()", Severity.HIGH, "binding", true);
            }
            return null;
        }
        if (PhpNodes.isStaticCall(receiver) && "getInstance".equals(PhpNodes.callName(receiver))) {
            String cls = PhpNodes.scopeName(receiver);
            if (cls != null && cls.contains("Container") && resolutionMethods.contains(name)) {
                return resolution("Container::getInstance()->" + name + "()", node);
            }
        }
        return null;
    }

    private static Finding resolution(String pattern, SyntaxNode call) {
        String type = argumentType(call);
        Severity severity = type.equals("string") ? Severity.HIGH : Severity.MEDIUM;
        return new Finding(CODE_RESOLUTION, pattern, severity, type, false);
    }

    private static String argumentType(SyntaxNode call) {
        List<SyntaxNode> args = PhpNodes.arguments(call);
        if (args.isEmpty()) return "none";
        SyntaxNode first = args.get(0);
        if (first.is("class_constant_access_expression") && first.text().endsWith("::class")) return "class";
        if (PhpNodes.isStringLiteral(first)) return "string";
        if (PhpNodes.variableName(first) != null) return "variable";
        return "unknown";
    }

    private static boolean isServiceProvider(String parent) {
        return parent != null && PhpNodes.stripLeadingBackslash(parent).endsWith("ServiceProvider");
    }

    private boolean isWhitelistedClass(FileSymbols symbols, SyntaxNode cls) {
        FileSymbols.DeclaredClass declared = symbols.declaredClass(cls);
        if (declared != null) return whitelistClasses.matchesClass(declared.shortName, declared.fqcn);
        return whitelistClasses.matches(PhpNodes.declarationName(cls));
    }

    private static String location(SyntaxNode node, SyntaxNode cls) {
        SyntaxNode method = node.ancestor("method_declaration");
        String className = cls == null ? null : PhpNodes.declarationName(cls);
        if (method != null) return (className == null ? "Unknown" : className) + "::" + PhpNodes.declarationName(method);
        return className != null ? className : "global scope";
    }

    private static String recommendation(Finding finding, String where) {
        String base = "Manual service container resolution detected using '" + finding.pattern + "' in '" + where + "'. ";
        if (finding.binding) {
            return base + "Container bindings belong in a service provider's register() method, for example "
                    + "$this->app->bind(Interface::class, Implementation::class).";
        }
        if (finding.pattern.startsWith("new ")) {
            return base + "Let the container manage the dependency through constructor injection.";
        }
        return base + "Service location hides dependencies and makes testing harder. Use constructor injection, "
                + "or method injection in controller actions.";
    }
}
