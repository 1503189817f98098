package org.dxworks.lintframe.analyzer.support;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Class-name patterns such as {@code *Command} or {@code App\Services\*}.
 */
public class WildcardPattern {

    private final List<Pattern> patterns = new ArrayList<>();

    public WildcardPattern(List<String> wildcards) {
        for (String w : wildcards) {
            String[] parts = w.split("\\*", -1);
            StringBuilder regex = new StringBuilder();
            for (int i = 0; i < parts.length; i++) {
                if (i > 0) regex.append(".*");
                regex.append(Pattern.quote(parts[i]));
            }
            patterns.add(Pattern.compile(regex.toString()));
        }
    }

    public boolean matches(String name) {
        if (name == null) return false;
        for (Pattern p : patterns) {
            if (p.matcher(name).matches()) return true;
        }
        return false;
    }

    /** Matches the short name or the fully qualified name; anonymous classes never match. */
    public boolean matchesClass(String shortName, String fqcn) {
        return matches(shortName) || matches(fqcn);
    }
}
