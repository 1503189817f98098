package org.dxworks.lintframe.analyzer.support;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Text heuristics for Blade templates, which are scanned line by line rather than parsed.
 */
public final class BladeHeuristics {

    private static final List<Pattern> DEFINITE_DB = List.of(
            Pattern.compile("\\bDB::"),
            Pattern.compile("->query\\s*\\("));

    private static final List<Pattern> SELF_TERMINAL_DB = List.of(
            Pattern.compile("::find\\s*\\("),
            Pattern.compile("::all\\s*\\("),
            Pattern.compile("::first\\s*\\("),
            Pattern.compile("::create\\s*\\("),
            Pattern.compile("::update\\s*\\("),
            Pattern.compile("::delete\\s*\\("),
            Pattern.compile("::insert\\s*\\("),
            Pattern.compile("::upsert\\s*\\("));

    private static final Pattern STATIC_WHERE = Pattern.compile("::where\\s*\\(");
    private static final Pattern MODEL_SAVE = Pattern.compile("\\$(\\w+)->save\\s*\\(");
    private static final Pattern RELATION_TERMINAL =
            Pattern.compile("\\$(\\w+)->(\\w+)\\(\\)->(get|first|find|count|exists|pluck|sum|avg|min|max)\\s*\\(");
    private static final Pattern CLASS_BEFORE_CALL =
            Pattern.compile("\\\\?(?:[A-Za-z_][A-Za-z0-9_]*\\\\)*([A-Za-z_][A-Za-z0-9_]*)$");
    private static final Pattern TRAILING_VARIABLE = Pattern.compile("\\$\\w+$");

    private static final List<String> TERMINAL_DB_METHODS = List.of(
            "->get(", "->first(", "->find(", "->count(", "->exists(", "->pluck(", "->sum(", "->avg(",
            "->min(", "->max(", "->paginate(");

    private static final List<String> MODEL_NAMESPACE_INDICATORS = List.of("\\Models\\", "\\Model\\");

    private static final List<String> COLLECTION_VARIABLE_HINTS = List.of(
            "collection", "items", "list", "array", "data", "results", "rows", "records", "entries");

    private static final List<String> NON_DB_GETTERS = List.of(
            "config()", "session()", "cache()", "request()", "cookie()");

    private static final Set<String> NON_DB_SAVE_VARIABLES = Set.of(
            "file", "upload", "image", "photo", "document", "attachment", "pdf", "excel", "csv", "export",
            "cache", "temp", "storage");

    private static final Set<String> NON_ELOQUENT_CLASSES = Set.of(
            "Collection", "Arr", "Carbon", "CarbonImmutable", "DateTime", "DateTimeImmutable", "Factory", "Str",
            "Validator");

    private static final List<String> NON_MODEL_SUFFIXES = List.of(
            "Service", "Repository", "Helper", "Handler", "Provider", "Facade", "Controller", "Middleware",
            "Policy", "Event", "Listener", "Job", "Mail", "Notification", "Command", "Request", "Rule",
            "Exception", "Trait", "Interface", "Contract", "Test", "Seeder", "Migration", "Observer", "Scope",
            "Cast", "Enum", "Factory", "Action");

    // only treated as queries when the line ends the chain with a terminal
    private static final List<String> AMBIGUOUS_SUFFIXES = List.of("Resource", "Manager", "Builder");

    private BladeHeuristics() {
    }

    public static boolean hasDbQuery(String line) {
        for (String getter : NON_DB_GETTERS) {
            if (line.contains(getter) && line.contains("->get(")) return false;
        }
        for (Pattern pattern : DEFINITE_DB) {
            Matcher m = pattern.matcher(line);
            if (m.find() && !isInsideStringOrComment(line, m.start())) return true;
        }
        for (Pattern pattern : SELF_TERMINAL_DB) {
            Matcher m = pattern.matcher(line);
            if (m.find() && !isInsideStringOrComment(line, m.start()) && !isNonEloquentStaticCall(line, m.start())) {
                return true;
            }
        }
        Matcher where = STATIC_WHERE.matcher(line);
        if (where.find() && !isInsideStringOrComment(line, where.start())
                && !isNonEloquentStaticCall(line, where.start())
                && (isFromModelsNamespace(line, where.start()) || hasTerminalMethod(line))) {
            return true;
        }
        Matcher save = MODEL_SAVE.matcher(line);
        if (save.find()) {
            if (isInsideStringOrComment(line, save.start())) return false;
            return !NON_DB_SAVE_VARIABLES.contains(save.group(1));
        }
        Matcher relation = RELATION_TERMINAL.matcher(line);
        if (relation.find()) {
            if (isInsideStringOrComment(line, relation.start())) return false;
            String variable = relation.group(1).toLowerCase(Locale.ROOT);
            for (String hint : COLLECTION_VARIABLE_HINTS) {
                if (variable.contains(hint)) return false;
            }
            return true;
        }
        return false;
    }

    public static boolean hasTerminalMethod(String line) {
        for (String terminal : TERMINAL_DB_METHODS) {
            if (line.contains(terminal)) return true;
        }
        return false;
    }

    private static boolean isFromModelsNamespace(String line, int position) {
        String before = line.substring(0, position);
        for (String indicator : MODEL_NAMESPACE_INDICATORS) {
            if (before.contains(indicator)) return true;
        }
        return false;
    }

    /** Whether the class in front of a {@code ::} call at the given offset is clearly not a model. */
    static boolean isNonEloquentStaticCall(String line, int position) {
        String trimmed = line.substring(0, position).stripTrailing();
        if (trimmed.endsWith(")") || TRAILING_VARIABLE.matcher(trimmed).find()) return true;
        Matcher m = CLASS_BEFORE_CALL.matcher(trimmed);
        if (!m.find()) return false;
        String className = m.group(1);
        if (NON_ELOQUENT_CLASSES.contains(className)) return true;
        for (String suffix : NON_MODEL_SUFFIXES) {
            if (className.endsWith(suffix)) return true;
        }
        for (String suffix : AMBIGUOUS_SUFFIXES) {
            if (className.endsWith(suffix)) return !hasTerminalMethod(line);
        }
        return false;
    }

    /** Whether the offset falls after a {@code //} comment or inside a quoted string. */
    public static boolean isInsideStringOrComment(String line, int position) {
        if (line.substring(0, position).contains("//")) return true;
        boolean inSingle = false;
        boolean inDouble = false;
        for (int i = 0; i < position; i++) {
            char c = line.charAt(i);
            if (i > 0 && line.charAt(i - 1) == '\\') continue;
            if (c == '\'' && !inDouble) {
                inSingle = !inSingle;
            } else if (c == '"' && !inSingle) {
                inDouble = !inDouble;
            }
        }
        return inSingle || inDouble;
    }
}
