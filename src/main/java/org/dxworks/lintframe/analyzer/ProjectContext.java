package org.dxworks.lintframe.analyzer;

import org.dxworks.lintframe.LintframeConfig;
import org.dxworks.lintframe.registry.ModelRegistry;

import java.nio.file.Path;

public class ProjectContext {
    private final Path projectRoot;
    private final LintframeConfig config;
    private final ModelRegistry registry;
    private final int filesAnalyzed;

    public ProjectContext(Path projectRoot, LintframeConfig config, ModelRegistry registry, int filesAnalyzed) {
        this.projectRoot = projectRoot;
        this.config = config;
        this.registry = registry;
        this.filesAnalyzed = filesAnalyzed;
    }

    public Path projectRoot() {
        return projectRoot;
    }

    public LintframeConfig config() {
        return config;
    }

    public ModelRegistry registry() {
        return registry;
    }

    public int filesAnalyzed() {
        return filesAnalyzed;
    }
}
