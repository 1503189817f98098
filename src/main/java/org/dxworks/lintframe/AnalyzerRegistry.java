package org.dxworks.lintframe;

import org.dxworks.lintframe.analyzer.Analyzer;
import org.dxworks.lintframe.analyzer.AnalyzerOptions;
import org.dxworks.lintframe.analyzer.bestpractices.ChunkMissingAnalyzer;
import org.dxworks.lintframe.analyzer.bestpractices.ConfigOutsideConfigAnalyzer;
import org.dxworks.lintframe.analyzer.bestpractices.EloquentNPlusOneAnalyzer;
import org.dxworks.lintframe.analyzer.bestpractices.EnvironmentCheckSmellAnalyzer;
import org.dxworks.lintframe.analyzer.bestpractices.FacadeUsageAnalyzer;
import org.dxworks.lintframe.analyzer.bestpractices.FatModelAnalyzer;
import org.dxworks.lintframe.analyzer.bestpractices.FrameworkOverrideAnalyzer;
import org.dxworks.lintframe.analyzer.bestpractices.GenericExceptionCatchAnalyzer;
import org.dxworks.lintframe.analyzer.bestpractices.HardcodedStoragePathsAnalyzer;
import org.dxworks.lintframe.analyzer.bestpractices.HelperFunctionAbuseAnalyzer;
import org.dxworks.lintframe.analyzer.bestpractices.LogicInBladeAnalyzer;
import org.dxworks.lintframe.analyzer.bestpractices.LogicInRoutesAnalyzer;
import org.dxworks.lintframe.analyzer.bestpractices.MissingDatabaseTransactionsAnalyzer;
import org.dxworks.lintframe.analyzer.bestpractices.MissingErrorTrackingAnalyzer;
import org.dxworks.lintframe.analyzer.bestpractices.MissingModelScopeAnalyzer;
import org.dxworks.lintframe.analyzer.bestpractices.MixedQueryBuilderEloquentAnalyzer;
import org.dxworks.lintframe.analyzer.bestpractices.MvcStructureViolationAnalyzer;
import org.dxworks.lintframe.analyzer.bestpractices.PhpSideFilteringAnalyzer;
import org.dxworks.lintframe.analyzer.bestpractices.QueryBuilderInControllerAnalyzer;
import org.dxworks.lintframe.analyzer.bestpractices.RawEloquentAvoidanceAnalyzer;
import org.dxworks.lintframe.analyzer.bestpractices.SelectAsteriskAnalyzer;
import org.dxworks.lintframe.analyzer.bestpractices.ServiceContainerResolutionAnalyzer;
import org.dxworks.lintframe.analyzer.bestpractices.SilentFailureAnalyzer;
import org.dxworks.lintframe.analyzer.security.SqlInjectionAnalyzer;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Id to factory table for every known analyzer. Registration order is report order.
 */
public class AnalyzerRegistry {

    private static final Map<String, Function<AnalyzerOptions, Analyzer>> FACTORIES = new LinkedHashMap<>();

    static {
        FACTORIES.put(EloquentNPlusOneAnalyzer.ID, EloquentNPlusOneAnalyzer::new);
        FACTORIES.put(MixedQueryBuilderEloquentAnalyzer.ID, MixedQueryBuilderEloquentAnalyzer::new);
        FACTORIES.put(MissingDatabaseTransactionsAnalyzer.ID, MissingDatabaseTransactionsAnalyzer::new);
        FACTORIES.put(ChunkMissingAnalyzer.ID, ChunkMissingAnalyzer::new);
        FACTORIES.put(ConfigOutsideConfigAnalyzer.ID, ConfigOutsideConfigAnalyzer::new);
        FACTORIES.put(EnvironmentCheckSmellAnalyzer.ID, EnvironmentCheckSmellAnalyzer::new);
        FACTORIES.put(FacadeUsageAnalyzer.ID, FacadeUsageAnalyzer::new);
        FACTORIES.put(FatModelAnalyzer.ID, FatModelAnalyzer::new);
        FACTORIES.put(FrameworkOverrideAnalyzer.ID, FrameworkOverrideAnalyzer::new);
        FACTORIES.put(GenericExceptionCatchAnalyzer.ID, GenericExceptionCatchAnalyzer::new);
        FACTORIES.put(HardcodedStoragePathsAnalyzer.ID, HardcodedStoragePathsAnalyzer::new);
        FACTORIES.put(HelperFunctionAbuseAnalyzer.ID, HelperFunctionAbuseAnalyzer::new);
        FACTORIES.put(LogicInBladeAnalyzer.ID, LogicInBladeAnalyzer::new);
        FACTORIES.put(LogicInRoutesAnalyzer.ID, LogicInRoutesAnalyzer::new);
        FACTORIES.put(MissingErrorTrackingAnalyzer.ID, MissingErrorTrackingAnalyzer::new);
        FACTORIES.put(MissingModelScopeAnalyzer.ID, MissingModelScopeAnalyzer::new);
        FACTORIES.put(MvcStructureViolationAnalyzer.ID, MvcStructureViolationAnalyzer::new);
        FACTORIES.put(PhpSideFilteringAnalyzer.ID, PhpSideFilteringAnalyzer::new);
        FACTORIES.put(QueryBuilderInControllerAnalyzer.ID, QueryBuilderInControllerAnalyzer::new);
        FACTORIES.put(RawEloquentAvoidanceAnalyzer.ID, RawEloquentAvoidanceAnalyzer::new);
        FACTORIES.put(SelectAsteriskAnalyzer.ID, SelectAsteriskAnalyzer::new);
        FACTORIES.put(ServiceContainerResolutionAnalyzer.ID, ServiceContainerResolutionAnalyzer::new);
        FACTORIES.put(SilentFailureAnalyzer.ID, SilentFailureAnalyzer::new);
        FACTORIES.put(SqlInjectionAnalyzer.ID, SqlInjectionAnalyzer::new);
    }

    private AnalyzerRegistry() {
    }

    public static List<String> allAnalyzerIds() {
        return new ArrayList<>(FACTORIES.keySet());
    }

    public static Analyzer create(String analyzerId, AnalyzerOptions options) {
        Function<AnalyzerOptions, Analyzer> factory = FACTORIES.get(analyzerId);
        if (factory == null) {
            throw new IllegalArgumentException("Unknown analyzer: " + analyzerId);
        }
        return factory.apply(options);
    }

    /**
     * Instantiates every analyzer the configuration enables. Option errors surface here as
     * {@link ConfigurationException}, before any file is read.
     */
    public static List<Analyzer> buildAnalyzers(LintframeConfig config) {
        List<Analyzer> analyzers = new ArrayList<>();
        for (String id : FACTORIES.keySet()) {
            Analyzer analyzer = create(id, config.getAnalyzerOptions(id));
            if (config.isAnalyzerEnabled(id, analyzer.getMetadata().category)) {
                analyzers.add(analyzer);
            }
        }
        return analyzers;
    }
}
