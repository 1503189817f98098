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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Filesystem paths written as literals instead of {@code storage_path()}, {@code public_path()}
 * and friends.
 * <p>
 * Absolute server paths, Windows drive paths and {@code ./} or {@code ../} relative paths are
 * always reported. Root-relative paths such as {@code /storage/app/x} are only reported when the
 * literal flows into a filesystem call, since the same text is often a URL.
 */
public class HardcodedStoragePathsAnalyzer extends AbstractFileAnalyzer {

    public static final String ID = "hardcoded-storage-paths";
    public static final String CODE = "hardcoded-storage-path";

    private static final AnalyzerMetadata METADATA = new AnalyzerMetadata(
            ID,
            "Hardcoded Storage Paths Analyzer",
            "Finds hardcoded storage/public paths instead of Laravel path helpers",
            Category.BEST_PRACTICES,
            Severity.MEDIUM);

    private enum Context { NONE, WEAK, STRONG }

    private static final Map<Pattern, String> ALWAYS_FLAG = new LinkedHashMap<>();
    private static final Map<Pattern, String> CONTEXT_REQUIRED = new LinkedHashMap<>();

    static {
        always("/var/www/.*storage", "storage_path(...)");
        always("/var/www/.*public", "public_path(...)");
        always("/var/www/.*app/", "app_path(...)");
        always("/var/www/.*resources", "resource_path(...)");
        always("/var/www/.*database", "database_path(...)");
        always("/var/www/.*config", "config_path(...)");
        always("[A-Z]:\\\\storage\\\\app\\\\", "storage_path('app/...')");
        always("[A-Z]:\\\\storage\\\\logs\\\\", "storage_path('logs/...')");
        always("[A-Z]:\\\\storage\\\\framework\\\\", "storage_path('framework/...')");
        always("[A-Z]:\\\\storage\\\\", "storage_path(...)");
        always("[A-Z]:\\\\public\\\\uploads\\\\", "public_path('uploads/...')");
        always("[A-Z]:\\\\public\\\\images\\\\", "public_path('images/...')");
        always("[A-Z]:\\\\public\\\\", "public_path(...)");
        always("[A-Z]:\\\\app\\\\", "app_path(...)");
        always("[A-Z]:\\\\resources\\\\", "resource_path(...)");
        always("[A-Z]:\\\\database\\\\", "database_path(...)");
        always("[A-Z]:\\\\config\\\\", "config_path(...)");
        for (String dir : List.of("storage", "public", "app", "resources", "database", "config")) {
            String helper = (dir.equals("resources") ? "resource" : dir) + "_path(...)";
            always("\\.\\./" + dir + "/", helper);
            always("\\./" + dir + "/", helper);
        }

        contextual("^/storage/app/", "storage_path('app/...')");
        contextual("^/storage/logs/", "storage_path('logs/...')");
        contextual("^/storage/framework/", "storage_path('framework/...')");
        contextual("^/storage/", "storage_path(...)");
        contextual("^/public/uploads/", "public_path('uploads/...')");
        contextual("^/public/images/", "public_path('images/...')");
        contextual("^/public/", "public_path(...)");
        contextual("^/app/", "app_path(...)");
        contextual("^/resources/", "resource_path(...)");
        contextual("^/database/", "database_path(...)");
        contextual("^/config/", "config_path(...)");
    }

    // these two prefixes are common in URLs, so they need a definite filesystem call
    private static final Set<String> STRONG_CONTEXT_PATTERNS = Set.of("^/public/", "^/app/");

    private static final Set<String> FILESYSTEM_FUNCTIONS = Set.of(
            "file_get_contents", "file_put_contents", "fopen", "fread", "fwrite", "fclose", "file", "readfile",
            "fgets", "fgetc", "fgetcsv", "fputcsv", "file_exists", "is_file", "is_dir", "is_readable",
            "is_writable", "is_writeable", "is_executable", "is_link", "mkdir", "rmdir", "opendir", "readdir",
            "closedir", "scandir", "glob", "unlink", "copy", "rename", "move_uploaded_file", "chmod", "chown",
            "chgrp", "touch", "link", "symlink", "readlink", "filesize", "filetype", "filemtime", "fileatime",
            "filectime", "stat", "lstat", "pathinfo", "realpath", "dirname", "basename");

    private static final Set<String> FILESYSTEM_STATIC_METHODS = Set.of(
            "get", "put", "exists", "missing", "path", "delete", "copy", "move", "size", "lastModified", "files",
            "allFiles", "directories", "allDirectories", "makeDirectory", "deleteDirectory", "append", "prepend",
            "read", "write", "readStream", "writeStream");

    private static final Set<String> FILESYSTEM_INSTANCE_METHODS = Set.of(
            "get", "put", "exists", "delete", "copy", "move", "read", "write", "append", "prepend", "size",
            "lastModified", "path");

    private static final Set<String> FILESYSTEM_FACADES = Set.of(
            "Storage", "File", "Illuminate\\Support\\Facades\\Storage", "Illuminate\\Support\\Facades\\File");
    private static final Set<String> UPLOAD_FILE_CLASSES = Set.of(
            "UploadedFile", "Illuminate\\Http\\UploadedFile", "Symfony\\Component\\HttpFoundation\\File\\UploadedFile");
    private static final Set<String> FILESYSTEM_SERVICES = Set.of(
            "files", "filesystem", "Illuminate\\Filesystem\\Filesystem", "Illuminate\\Contracts\\Filesystem\\Filesystem");
    private static final Set<String> RESPONSE_FILE_METHODS = Set.of("download", "file", "streamDownload");
    private static final Set<String> ASSET_HELPERS = Set.of(
            "asset", "secure_asset", "mix", "url", "secure_url", "route", "action", "to_route", "redirect");
    private static final List<String> FILESYSTEM_VARIABLE_HINTS = List.of(
            "file", "filesystem", "storage", "disk", "fs", "directory", "dir");

    private static void always(String regex, String helper) {
        ALWAYS_FLAG.put(Pattern.compile(regex, Pattern.CASE_INSENSITIVE), helper);
    }

    private static void contextual(String regex, String helper) {
        CONTEXT_REQUIRED.put(Pattern.compile(regex, Pattern.CASE_INSENSITIVE), helper);
    }

    private final List<String> allowedPaths;
    private final Map<Pattern, String> alwaysFlag;

    public HardcodedStoragePathsAnalyzer(AnalyzerOptions options) {
        super(options);
        this.allowedPaths = options.getStringList("allowed_paths", List.of());
        this.alwaysFlag = new LinkedHashMap<>(ALWAYS_FLAG);
        this.alwaysFlag.putAll(options.getPatternMap("additional_patterns"));
    }

    @Override
    public AnalyzerMetadata getMetadata() {
        return METADATA;
    }

    @Override
    protected List<Issue> analyzeFile(FileContext context) {
        List<Issue> issues = new ArrayList<>();
        for (SyntaxNode literal : context.tree().root().findAll(PhpNodes.STRINGS)) {
            String value = literalText(literal);
            if (value == null || value.isEmpty()) continue;
            Issue issue = checkPath(context, literal, value);
            if (issue != null) issues.add(issue);
        }
        return issues;
    }

    /** Literal value; for interpolated strings, the constant parts joined. */
    private static String literalText(SyntaxNode literal) {
        String value = PhpNodes.stringValue(literal);
        if (value != null) return value;
        StringBuilder sb = new StringBuilder();
        for (SyntaxNode part : literal.children()) {
            if (part.is("string_content", "string_value")) sb.append(part.text());
        }
        return sb.toString();
    }

    private Issue checkPath(FileContext context, SyntaxNode literal, String value) {
        if (value.regionMatches(true, 0, "http://", 0, 7) || value.regionMatches(true, 0, "https://", 0, 8)) {
            return null;
        }
        for (String allowed : allowedPaths) {
            if (value.contains(allowed)) return null;
        }
        for (Map.Entry<Pattern, String> entry : alwaysFlag.entrySet()) {
            if (entry.getKey().matcher(value).find()) {
                return pathIssue(context, literal, value, helperAdvice(entry.getValue()));
            }
        }
        for (Map.Entry<Pattern, String> entry : CONTEXT_REQUIRED.entrySet()) {
            if (!entry.getKey().matcher(value).find()) continue;
            Context required = STRONG_CONTEXT_PATTERNS.contains(entry.getKey().pattern()) ? Context.STRONG : Context.WEAK;
            if (contextStrength(literal).compareTo(required) < 0) return null;
            String advice = entry.getKey().pattern().contains("public") && isAssetContext(literal)
                    ? "Use asset('...') for URLs in templates instead of hardcoded paths."
                    : helperAdvice(entry.getValue());
            return pathIssue(context, literal, value, advice);
        }
        return null;
    }

    private Issue pathIssue(FileContext context, SyntaxNode literal, String value, String recommendation) {
        String shown = value.length() > 50 ? value.substring(0, 50) : value;
        return issue(context, CODE, Severity.MEDIUM, literal, "Hardcoded storage path found: \"" + shown + "\"")
                .withRecommendation(recommendation)
                .withMetadata("path", value);
    }

    private static String helperAdvice(String helper) {
        return "Use Laravel path helper: " + helper + ". This keeps paths portable across environments and "
                + "storage drivers.";
    }

    /** Call that receives the literal as an argument, possibly through concatenation or an array. */
    private static SyntaxNode receivingCall(SyntaxNode literal) {
        SyntaxNode current = literal.parent();
        while (current != null) {
            if (PhpNodes.isCall(current) || current.is("object_creation_expression")) return current;
            boolean passThrough = current.is("argument", "arguments", "array_element_initializer",
                    "array_creation_expression", "parenthesized_expression")
                    || (current.is("binary_expression") && ".".equals(current.token()));
            if (!passThrough) return null;
            current = current.parent();
        }
        return null;
    }

    private static Context contextStrength(SyntaxNode literal) {
        SyntaxNode call = receivingCall(literal);
        if (call == null || !isArgument(literal, call)) return Context.NONE;
        String name = PhpNodes.callName(call);
        if (name == null) return Context.NONE;
        if (PhpNodes.isFunctionCall(call)) {
            return FILESYSTEM_FUNCTIONS.contains(name.toLowerCase()) ? Context.STRONG : Context.NONE;
        }
        if (PhpNodes.isStaticCall(call)) {
            String cls = PhpNodes.scopeName(call);
            if (FILESYSTEM_FACADES.contains(cls) && FILESYSTEM_STATIC_METHODS.contains(name)) return Context.STRONG;
            return UPLOAD_FILE_CLASSES.contains(cls) ? Context.STRONG : Context.NONE;
        }
        if (!PhpNodes.isMethodCall(call)) return Context.NONE;
        SyntaxNode receiver = PhpNodes.receiver(call);
        if (PhpNodes.isStaticCall(receiver) && FILESYSTEM_FACADES.contains(PhpNodes.scopeName(receiver))
                && FILESYSTEM_INSTANCE_METHODS.contains(name)) {
            return Context.STRONG;
        }
        if (isFilesystemService(receiver) && FILESYSTEM_INSTANCE_METHODS.contains(name)) return Context.STRONG;
        if (RESPONSE_FILE_METHODS.contains(name) && isResponse(receiver)) return Context.STRONG;
        if (FILESYSTEM_INSTANCE_METHODS.contains(name) && isFilesystemVariable(receiver)) return Context.WEAK;
        return Context.NONE;
    }

    private static boolean isArgument(SyntaxNode literal, SyntaxNode call) {
        for (SyntaxNode argument : PhpNodes.arguments(call)) {
            if (literal.isWithin(argument)) return true;
        }
        return false;
    }

    private static boolean isAssetContext(SyntaxNode literal) {
        SyntaxNode call = receivingCall(literal);
        if (call == null) return false;
        String name = PhpNodes.callName(call);
        if (name == null) return false;
        if (PhpNodes.isFunctionCall(call)) return ASSET_HELPERS.contains(name.toLowerCase());
        if (PhpNodes.isStaticCall(call)) {
            String cls = PhpNodes.shortName(PhpNodes.scopeName(call));
            return ("Storage".equals(cls) && (name.equalsIgnoreCase("url") || name.equalsIgnoreCase("temporaryUrl")))
                    || ("Vite".equals(cls) && name.equals("asset"))
                    || "URL".equals(cls);
        }
        SyntaxNode receiver = PhpNodes.receiver(call);
        return PhpNodes.isFunctionCall(receiver) && "url".equals(PhpNodes.callName(receiver));
    }

    private static boolean isFilesystemService(SyntaxNode node) {
        if (!PhpNodes.isFunctionCall(node)) return false;
        String fn = PhpNodes.callName(node);
        if (!"app".equals(fn) && !"resolve".equals(fn)) return false;
        SyntaxNode first = PhpNodes.argument(node, 0);
        String literal = PhpNodes.stringValue(first);
        if (literal != null) return FILESYSTEM_SERVICES.contains(literal);
        return first != null && first.is("class_constant_access_expression") && first.text().contains("Filesystem");
    }

    private static boolean isResponse(SyntaxNode node) {
        if (PhpNodes.isFunctionCall(node)) return "response".equals(PhpNodes.callName(node));
        return "response".equalsIgnoreCase(PhpNodes.variableName(node));
    }

    private static boolean isFilesystemVariable(SyntaxNode node) {
        String name = PhpNodes.variableName(node);
        if (name == null && PhpNodes.isPropertyAccess(node)) {
            SyntaxNode property = node.child("name");
            name = property != null ? property.text() : null;
        }
        if (name == null) return false;
        String lower = name.toLowerCase();
        for (String hint : FILESYSTEM_VARIABLE_HINTS) {
            if (lower.contains(hint)) return true;
        }
        return false;
    }
}
