package org.dxworks.lintframe.analyzer;

import org.dxworks.lintframe.model.Issue;

import java.util.List;

/**
 * A rule whose findings depend on more than one file. {@link #conclude} runs once, after every
 * file has been analysed.
 */
public interface ProjectAnalyzer extends Analyzer {

    List<Issue> conclude(ProjectContext project);
}
