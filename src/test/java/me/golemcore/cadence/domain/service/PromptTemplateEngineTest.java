package me.golemcore.cadence.domain.service;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class PromptTemplateEngineTest {

    private final PromptTemplateEngine engine = new PromptTemplateEngine();

    @Test
    void shouldSubstituteKnownVariables() {
        String rendered = engine.render("Today is {{TODAY}}. Sites: {{ SITES }}.",
                Map.of("TODAY", "2026-02-11", "SITES", "site-sinai"));

        assertEquals("Today is 2026-02-11. Sites: site-sinai.", rendered);
    }

    @Test
    void shouldLeaveUnknownPlaceholdersForLaterPass() {
        assertEquals("Hello {{NAME}} from a", engine.render("Hello {{NAME}} from {{SITE}}", Map.of("SITE", "a")));
    }

    @Test
    void shouldKeepDollarSignsInValues() {
        assertEquals("Cost: $3.50", engine.render("Cost: {{COST}}", Map.of("COST", "$3.50")));
    }

    @Test
    void shouldHandleNullInputs() {
        assertNull(engine.render(null, Map.of()));
        assertEquals("{{X}}", engine.render("{{X}}", null));
    }
}
