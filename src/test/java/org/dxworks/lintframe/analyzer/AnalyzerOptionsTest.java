package org.dxworks.lintframe.analyzer;

import org.dxworks.lintframe.ConfigurationException;
import org.dxworks.lintframe.analyzer.bestpractices.HardcodedStoragePathsAnalyzer;
import org.dxworks.lintframe.analyzer.bestpractices.MissingDatabaseTransactionsAnalyzer;
import org.dxworks.lintframe.analyzer.bestpractices.SilentFailureAnalyzer;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.dxworks.lintframe.TestUtils.options;
import static org.junit.jupiter.api.Assertions.*;

class AnalyzerOptionsTest {

    @Test
    void typedGettersFallBackToDefaults() {
        AnalyzerOptions opts = AnalyzerOptions.empty("x");

        assertEquals(4, opts.getInt("threshold", 4));
        assertTrue(opts.getBoolean("flag", true));
        assertEquals(List.of("a"), opts.getStringList("list", List.of("a")));
        assertFalse(opts.has("threshold"));
    }

    @Test
    void numericStringsAndBooleanStringsAreAccepted() {
        AnalyzerOptions opts = options("x", "threshold", "7", "flag", "false", "whole", 3.0);

        assertEquals(7, opts.getInt("threshold", 1));
        assertEquals(3, opts.getInt("whole", 1));
        assertFalse(opts.getBoolean("flag", true));
    }

    @Test
    void addingListsKeepDefaultsFirst() {
        AnalyzerOptions opts = options("x", "extra", List.of("c"));

        assertEquals(List.of("a", "b", "c"), opts.getStringListAdding("extra", List.of("a", "b")));
        assertEquals(List.of("a"), opts.getStringListAdding("missing", List.of("a")));
    }

    @Test
    void wrongTypesFailFast() {
        AnalyzerOptions opts = options("x", "threshold", "many", "list", "not-a-list", "mixed", List.of("a", 1),
                "fraction", 1.5, "negative", -2, "zero", 0);

        assertThrows(ConfigurationException.class, () -> opts.getInt("threshold", 1));
        assertThrows(ConfigurationException.class, () -> opts.getInt("fraction", 1));
        assertThrows(ConfigurationException.class, () -> opts.getStringList("list", List.of()));
        assertThrows(ConfigurationException.class, () -> opts.getStringList("mixed", List.of()));
        assertThrows(ConfigurationException.class, () -> opts.getNonNegativeInt("negative", 1));
        assertThrows(ConfigurationException.class, () -> opts.getPositiveInt("zero", 1));
    }

    @Test
    void configurationErrorsSurfaceWhenAnalyzersAreBuilt() {
        assertThrows(ConfigurationException.class, () -> new MissingDatabaseTransactionsAnalyzer(
                options(MissingDatabaseTransactionsAnalyzer.ID, "threshold", -1)));
        assertThrows(ConfigurationException.class, () -> new SilentFailureAnalyzer(
                options(SilentFailureAnalyzer.ID, "whitelist_dirs", "tests")));

        ConfigurationException e = assertThrows(ConfigurationException.class, () -> new HardcodedStoragePathsAnalyzer(
                options(HardcodedStoragePathsAnalyzer.ID, "additional_patterns", Map.of("([unclosed", "broken"))));
        assertTrue(e.getMessage().contains("additional_patterns"));
    }
}
