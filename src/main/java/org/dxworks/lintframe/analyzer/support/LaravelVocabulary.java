package org.dxworks.lintframe.analyzer.support;

import org.dxworks.lintframe.syntax.PhpNodes;

import java.util.List;
import java.util.Set;

/**
 * Framework names shared by several analyzers: facades, query methods and the heuristics used to
 * tell a model class from a utility class.
 */
public final class LaravelVocabulary {

    public static final Set<String> FACADES = Set.of(
            "App", "Artisan", "Auth", "Blade", "Broadcast", "Bus", "Cache", "Config", "Cookie", "Crypt",
            "DB", "Event", "File", "Gate", "Hash", "Http", "Lang", "Log", "Mail", "Notification",
            "Password", "Queue", "RateLimiter", "Redirect", "Redis", "Request", "Response", "Route",
            "Schema", "Session", "Storage", "URL", "Validator", "View"
    );

    /** Classes that expose static {@code get}/{@code all}/{@code where} but never hit the database. */
    public static final Set<String> NON_MODEL_CLASSES = Set.of(
            "Collection", "LazyCollection", "EloquentCollection", "Arr", "Str", "Stringable",
            "Carbon", "CarbonImmutable", "DateTime", "DateTimeImmutable", "Config", "Session",
            "Request", "Cache", "Cookie", "Http", "Response", "Log", "DB", "File", "Storage", "Queue",
            "Mail", "Notification", "Event", "Gate", "Auth", "Validator", "View", "URL", "Route",
            "Redirect", "Crypt", "Hash", "Password", "RateLimiter", "Bus", "Artisan", "App", "Builder",
            "Factory", "Faker", "Client", "GuzzleHttp", "Schema", "Redis", "Lang", "Blade", "Broadcast",
            "Container", "Closure", "Exception", "self", "static", "parent"
    );

    public static final List<String> NON_MODEL_SUFFIXES = List.of(
            "Service", "Repository", "Controller", "Helper", "Helpers", "Facade", "Manager", "Factory",
            "Provider", "Request", "Resource", "Job", "Event", "Listener", "Exception", "Middleware",
            "Policy", "Rule", "Command", "Handler", "Collection", "Builder", "Client", "Test", "Util",
            "Utils", "Enum", "Action", "Mailer", "Notification", "Observer", "Seeder"
    );

    /** Terminal reads that return model instances or collections. */
    public static final Set<String> FETCH_METHODS = Set.of(
            "get", "all", "first", "firstOrFail", "find", "findOrFail", "findMany", "findOr", "sole",
            "firstWhere", "paginate", "simplePaginate", "cursorPaginate", "cursor", "lazy", "lazyById",
            "create", "make", "forceCreate", "firstOrCreate", "firstOrNew", "updateOrCreate"
    );

    /** Terminal calls whose result is not a model: scalars, booleans, bulk writes. */
    public static final Set<String> SCALAR_TERMINALS = Set.of(
            "count", "exists", "doesntExist", "sum", "avg", "average", "min", "max", "value", "pluck",
            "implode", "update", "delete", "insert", "insertGetId", "insertOrIgnore", "upsert",
            "increment", "decrement", "forceDelete", "destroy", "truncate", "chunk", "chunkById",
            "each", "eachById", "toSql", "dd", "dump"
    );

    /** Static calls on a model that issue (or start) a query. */
    public static final Set<String> MODEL_QUERY_METHODS = Set.of(
            "where", "whereIn", "whereNotIn", "whereHas", "whereBetween", "whereNull", "whereNotNull",
            "orWhere", "find", "findOrFail", "findMany", "first", "firstOrFail", "firstWhere", "get",
            "all", "count", "exists", "pluck", "value", "sum", "avg", "max", "min", "query", "with",
            "latest", "oldest", "orderBy", "select", "paginate", "sole", "firstOrCreate", "updateOrCreate"
    );

    public static final Set<String> DB_QUERY_METHODS = Set.of(
            "table", "select", "selectOne", "insert", "update", "delete", "statement", "raw", "query",
            "scalar", "affectingStatement", "unprepared"
    );

    public static final Set<String> COLLECTION_METHODS = Set.of(
            "filter", "reject", "where", "whereIn", "whereNotIn", "sortBy", "sortByDesc", "values",
            "take", "skip", "slice", "unique", "reverse", "merge", "keyBy", "tap", "shuffle", "fresh"
    );

    public static final Set<String> LARAVEL_HELPERS = Set.of(
            "auth", "request", "session", "cache", "config", "app", "view", "redirect", "response",
            "url", "route", "logger", "event", "dispatch", "abort", "abort_if", "abort_unless",
            "back", "old", "validator", "trans", "__", "info", "report", "resolve", "policy",
            "broadcast", "cookie", "encrypt", "decrypt", "bcrypt", "now", "today", "optional"
    );

    private LaravelVocabulary() {
    }

    public static boolean isDbFacade(String className) {
        if (className == null) return false;
        String name = PhpNodes.stripLeadingBackslash(className);
        return name.equals("DB") || name.equals("Illuminate\\Support\\Facades\\DB");
    }

    public static boolean isFacade(String className) {
        return className != null && FACADES.contains(PhpNodes.shortName(PhpNodes.stripLeadingBackslash(className)));
    }

    /** PascalCase, not a framework utility, no service-style suffix. */
    public static boolean looksLikeModel(String shortName) {
        if (shortName == null || shortName.length() < 2) return false;
        if (!Character.isUpperCase(shortName.charAt(0))) return false;
        if (shortName.equals(shortName.toUpperCase())) return false;
        if (shortName.contains("_")) return false;
        if (NON_MODEL_CLASSES.contains(shortName)) return false;
        for (String suffix : NON_MODEL_SUFFIXES) {
            if (shortName.endsWith(suffix) && !shortName.equals(suffix)) return false;
        }
        return true;
    }
}
