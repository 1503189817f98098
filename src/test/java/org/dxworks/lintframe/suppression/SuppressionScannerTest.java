package org.dxworks.lintframe.suppression;

import org.junit.jupiter.api.Test;

import static org.dxworks.lintframe.TestUtils.parse;
import static org.junit.jupiter.api.Assertions.*;

class SuppressionScannerTest {

    private static final String TWO_CLASSES = String.join("\n",
            "<?php",
            "",
            "namespace App\\Services;",
            "",
            "// @lintframe-ignore eloquent-n-plus-one, silent-failure",
            "class First",
            "{",
            "    public function a() {}",
            "}",
            "",
            "class Second",
            "{",
            "    // @lintframe-ignore",
            "    public function b() {}",
            "",
            "    public function c() {}",
            "}",
            "");

    @Test
    void classMarkerCoversOnlyThatClassAndTheNamedRules() {
        SuppressionIndex index = SuppressionScanner.scan(parse(TWO_CLASSES));

        assertTrue(index.isSuppressed("eloquent-n-plus-one", 8));
        assertTrue(index.isSuppressed("silent-failure", 9));
        assertFalse(index.isSuppressed("sql-injection", 8));
        assertFalse(index.isSuppressed("eloquent-n-plus-one", 14), "sibling class is unaffected");
    }

    @Test
    void genericLineMarkerCoversItsLineAndTheNext() {
        SuppressionIndex index = SuppressionScanner.scan(parse(TWO_CLASSES));

        assertTrue(index.isSuppressed("sql-injection", 14));
        assertTrue(index.isSuppressed("fat-model", 14));
        assertFalse(index.isSuppressed("sql-injection", 12));
        assertFalse(index.isSuppressed("sql-injection", 16));
    }

    @Test
    void markerBeforeFirstDeclarationCoversTheFile() {
        SuppressionIndex index = SuppressionScanner.scan(parse(
                "<?php\n// @shieldci-ignore sql-injection\n\nnamespace App;\n\nfunction query() {}\n\nfunction other() {}\n"));

        assertTrue(index.isSuppressed("sql-injection", 8));
        assertTrue(index.isSuppressed("sql-injection", 500));
        assertFalse(index.isSuppressed("silent-failure", 8));
    }

    @Test
    void commentsWithoutMarkerProduceEmptyIndex() {
        SuppressionIndex index = SuppressionScanner.scan(parse("<?php\n// ignore me\n$a = 1;\n"));

        assertTrue(index.isEmpty());
        assertFalse(index.isSuppressed("sql-injection", 3));
    }

    @Test
    void markerIdsAreCaseInsensitive() {
        assertEquals(java.util.Set.of("sql-injection", "fat-model"),
                SuppressionScanner.markerIds("/* @LINTFRAME-IGNORE SQL-Injection, fat-model */"));
        assertTrue(SuppressionScanner.markerIds("// @lintframe-ignore").isEmpty());
        assertNull(SuppressionScanner.markerIds("// nothing here"));
    }

    @Test
    void templatesUseLineMarkers() {
        SuppressionIndex index = SuppressionScanner.scanText(
                "<div>\n{{-- @lintframe-ignore logic-in-blade --}}\n@php $x = 1; @endphp\n</div>\n");

        assertTrue(index.isSuppressed("logic-in-blade", 3));
        assertFalse(index.isSuppressed("logic-in-blade", 4));
        assertFalse(index.isSuppressed("mvc-structure-violation", 3));
    }
}
