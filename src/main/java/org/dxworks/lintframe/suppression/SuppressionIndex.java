package org.dxworks.lintframe.suppression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * Line ranges of one file in which findings are suppressed, either for every analyzer or for a
 * named set of analyzer ids.
 */
public class SuppressionIndex {

    public static final SuppressionIndex NONE = new SuppressionIndex(Collections.emptyList());

    public enum Granularity {
        FILE,
        CLASS,
        LINE
    }

    public static class Entry {
        public final Granularity granularity;
        public final int startLine;
        public final int endLine;
        /** Empty means every analyzer. */
        public final Set<String> analyzerIds;

        public Entry(Granularity granularity, int startLine, int endLine, Set<String> analyzerIds) {
            this.granularity = granularity;
            this.startLine = startLine;
            this.endLine = endLine;
            this.analyzerIds = analyzerIds;
        }

        boolean matches(String analyzerId, int line) {
            return line >= startLine && line <= endLine
                    && (analyzerIds.isEmpty() || analyzerIds.contains(analyzerId));
        }
    }

    private final List<Entry> entries;

    public SuppressionIndex(List<Entry> entries) {
        this.entries = Collections.unmodifiableList(new ArrayList<>(entries));
    }

    public boolean isSuppressed(String analyzerId, int line) {
        for (Entry entry : entries) {
            if (entry.matches(analyzerId, line)) return true;
        }
        return false;
    }

    public List<Entry> entries() {
        return entries;
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }
}
