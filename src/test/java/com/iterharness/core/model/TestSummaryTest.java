package com.iterharness.core.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TestSummaryTest {

    @Test
    void markdownShowsPlaceholdersForEmptyLists() {
        var summary = new TestSummary("t", true, TestOutcome.PASSED, "12ms", "2026-01-01T00:00:00Z",
                null, null, null, null);

        String md = summary.toMarkdown();

        assertTrue(md.contains("**Result:** PASS"));
        assertTrue(md.contains("## Screenshots\n- None captured"));
        assertTrue(md.contains("## Errors\nNone"));
    }

    @Test
    void jsonUsesSnakeCaseKeys() throws Exception {
        var summary = new TestSummary("search_flow", false, TestOutcome.FAILED, "1.000s", "now",
                List.of("a.png"), List.of("test.log"), "details", List.of("boom"));

        var json = new ObjectMapper().readTree(new ObjectMapper().writeValueAsString(summary));

        assertEquals("search_flow", json.get("test_name").asText());
        assertEquals("FAILED", json.get("outcome").asText());
        assertEquals("boom", json.get("errors").get(0).asText());
        assertFalse(json.has("testName"));
    }

    @Test
    void testKindParsesAliases() {
        assertEquals(TestKind.MCP, TestKind.fromString("mcp-protocol"));
        assertEquals(TestKind.SERVICE, TestKind.fromString("service-lifecycle"));
        assertEquals(TestKind.UI, TestKind.fromString("UI"));
        assertThrows(IllegalArgumentException.class, () -> TestKind.fromString("perf"));
    }

    @Test
    void lifecycleOnlyMovesForward() {
        assertTrue(LifecycleState.CREATED.canTransitionTo(LifecycleState.STARTED));
        assertTrue(LifecycleState.STARTED.canTransitionTo(LifecycleState.STOPPED));
        assertFalse(LifecycleState.STOPPED.canTransitionTo(LifecycleState.STARTED));
        assertFalse(LifecycleState.STARTED.canTransitionTo(LifecycleState.CREATED));
    }
}
