package com.labelops.core.service;

import com.labelops.config.ServiceRule;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ServiceMatcherTest {

    private static final ServiceRule EXPRESS = ServiceRule.tagged("Tracked 24", "EXPRESS");
    private static final ServiceRule SIGNED = ServiceRule.tagged("Special Delivery", "SIGNED");
    private static final ServiceRule STANDARD = ServiceRule.fallback("Tracked 48");
    private static final List<ServiceRule> RULES = List.of(EXPRESS, SIGNED, STANDARD);

    @Test
    void firstLineTagSelectsService() {
        assertEquals(EXPRESS, ServiceMatcher.match("express\nJane Doe\n1 Road", RULES));
    }

    @Test
    void serviceDirectiveSelectsService() {
        assertEquals(SIGNED, ServiceMatcher.match("Jane Doe\nSERVICE = signed\n1 Road", RULES));
    }

    @Test
    void bracketedOrInlineTagSelectsService() {
        assertEquals(SIGNED, ServiceMatcher.match("Jane Doe [SIGNED]\n1 Road", RULES));
    }

    @Test
    void tagInsideAnotherWordDoesNotMatch() {
        assertEquals(STANDARD, ServiceMatcher.match("Jane Doe\n1 Expressway\nLeeds", RULES));
    }

    @Test
    void earlierRuleWinsWhenSeveralTagsOccur() {
        assertEquals(EXPRESS, ServiceMatcher.match("SIGNED\nJane Doe\nEXPRESS please", RULES));
    }

    @Test
    void fallsBackToDefaultRule() {
        assertEquals(STANDARD, ServiceMatcher.match("Jane Doe\n1 Road", RULES));
        assertEquals(STANDARD, ServiceMatcher.match(null, RULES));
    }

    @Test
    void missingDefaultRuleIsAnError() {
        assertThrows(IllegalArgumentException.class, () -> ServiceMatcher.match("Jane", List.of(EXPRESS)));
    }
}
