package org.dxworks.lintframe.scope;

import org.dxworks.lintframe.syntax.PhpNodes;
import org.dxworks.lintframe.syntax.SyntaxNode;

import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Relationship paths requested for eager loading, e.g. {@code user}, {@code user.team}.
 */
public final class EagerLoadSet {

    public static final EagerLoadSet EMPTY = new EagerLoadSet(Collections.emptySet());

    private final Set<String> paths;

    private EagerLoadSet(Set<String> paths) {
        this.paths = paths;
    }

    public static EagerLoadSet of(String... paths) {
        return EMPTY.with(List.of(paths));
    }

    /**
     * Reads the arguments of {@code with()}, {@code load()} or {@code loadMissing()}: literal strings,
     * lists of literal strings and the string keys of associative arrays. Callback values are opaque.
     */
    public static EagerLoadSet fromArguments(List<SyntaxNode> arguments) {
        Set<String> found = new TreeSet<>();
        for (SyntaxNode arg : arguments) {
            String literal = PhpNodes.stringValue(arg);
            if (literal != null) {
                found.add(normalize(literal));
                continue;
            }
            for (SyntaxNode[] entry : PhpNodes.arrayEntries(arg)) {
                String value = entry[0] != null ? PhpNodes.stringValue(entry[0]) : PhpNodes.stringValue(entry[1]);
                if (value != null) found.add(normalize(value));
            }
        }
        found.remove("");
        return EMPTY.with(found);
    }

    // "author:id,name" selects columns; only the relation name matters
    private static String normalize(String path) {
        int colon = path.indexOf(':');
        return (colon >= 0 ? path.substring(0, colon) : path).trim();
    }

    public EagerLoadSet with(Iterable<String> more) {
        Set<String> merged = new TreeSet<>(paths);
        for (String p : more) merged.add(p);
        return new EagerLoadSet(Collections.unmodifiableSet(merged));
    }

    public EagerLoadSet with(EagerLoadSet other) {
        return with(other.paths);
    }

    /** True when {@code path} is a member, or a segment-wise prefix of a member. */
    public boolean covers(String path) {
        for (String p : paths) {
            if (p.equals(path) || p.startsWith(path + ".")) return true;
        }
        return false;
    }

    /** Paths below {@code relation}: {@code {posts.comments}} nested under {@code posts} is {@code {comments}}. */
    public EagerLoadSet nested(String relation) {
        Set<String> sub = new TreeSet<>();
        String prefix = relation + ".";
        for (String p : paths) {
            if (p.startsWith(prefix)) sub.add(p.substring(prefix.length()));
        }
        return sub.isEmpty() ? EMPTY : new EagerLoadSet(Collections.unmodifiableSet(sub));
    }

    public Set<String> paths() {
        return paths;
    }

    public boolean isEmpty() {
        return paths.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof EagerLoadSet other && paths.equals(other.paths);
    }

    @Override
    public int hashCode() {
        return paths.hashCode();
    }

    @Override
    public String toString() {
        return paths.toString();
    }
}
