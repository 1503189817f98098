package org.dxworks.lintframe.analyzer.support;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class WildcardPatternTest {

    @Test
    void starMatchesAnySequence() {
        WildcardPattern pattern = new WildcardPattern(List.of("*Command", "App\\Services\\*"));

        assertTrue(pattern.matches("ImportCommand"));
        assertTrue(pattern.matches("Command"));
        assertTrue(pattern.matches("App\\Services\\Billing\\Charge"));
        assertFalse(pattern.matches("CommandBus"));
        assertFalse(pattern.matches(null));
    }

    @Test
    void regexCharactersAreLiteral() {
        WildcardPattern pattern = new WildcardPattern(List.of("User.Repository"));

        assertTrue(pattern.matches("User.Repository"));
        assertFalse(pattern.matches("UserXRepository"));
    }

    @Test
    void classesMatchOnShortOrQualifiedName() {
        WildcardPattern pattern = new WildcardPattern(List.of("App\\Http\\Controllers\\Admin\\*"));

        assertTrue(pattern.matchesClass("UserController", "App\\Http\\Controllers\\Admin\\UserController"));
        assertFalse(pattern.matchesClass("UserController", "App\\Http\\Controllers\\UserController"));
        assertFalse(pattern.matchesClass("UserController", null));
    }
}
