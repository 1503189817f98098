package org.dxworks.lintframe.analyzer;

import org.dxworks.lintframe.model.AnalyzerMetadata;
import org.dxworks.lintframe.model.Issue;

import java.util.List;
import java.util.Optional;

/**
 * One rule. Implementations keep only immutable configuration; everything learned about a file
 * lives in objects created inside {@link #analyze}, so a single instance serves all worker threads.
 */
public interface Analyzer {

    AnalyzerMetadata getMetadata();

    default String getId() {
        return getMetadata().id;
    }

    boolean accepts(SourceFile file);

    List<Issue> analyze(FileContext context);

    /** Reason to skip the analyzer for the whole project, if any. */
    default Optional<String> skipReason(ProjectContext project) {
        return Optional.empty();
    }
}
