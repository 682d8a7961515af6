package com.juno.core.llm;

import com.juno.core.model.RunMessage;
import com.juno.core.oracle.GradeResult;
import com.juno.core.oracle.RouteDecision;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class LlmOracleTest {

    private LlmService llmService;
    private LlmOracle oracle;

    @BeforeEach
    void setUp() {
        llmService = mock(LlmService.class);
        oracle = new LlmOracle(llmService);
    }

    @Test
    @DisplayName("grade normalizes scores given out of ten")
    void gradeNormalizes() {
        when(llmService.structuredCall(anyString(), anyString(), eq(GradeResult.class)))
                .thenReturn(new GradeResult(8.0, "Good.", List.of()));

        var grade = oracle.grade("research", "task", "output");

        assertEquals(0.8, grade.score(), 1e-9);
        assertEquals("Good.", grade.comments());
    }

    @Test
    @DisplayName("normalizeScore clamps into the unit interval")
    void normalizeScore() {
        assertEquals(0.7, LlmOracle.normalizeScore(0.7));
        assertEquals(1.0, LlmOracle.normalizeScore(12.0));
        assertEquals(0.0, LlmOracle.normalizeScore(-0.5));
    }

    @Test
    @DisplayName("a score just over one is clamped rather than read as out of ten")
    void normalizeScoreSlightlyOver() {
        assertEquals(1.0, LlmOracle.normalizeScore(1.05));
        assertEquals(1.0, LlmOracle.normalizeScore(1.9));
        assertEquals(0.2, LlmOracle.normalizeScore(2.0), 1e-9);
    }

    @Test
    @DisplayName("route lists the members and FINISH as choices")
    void routePrompt() {
        when(llmService.structuredCall(anyString(), anyString(), eq(RouteDecision.class)))
                .thenReturn(new RouteDecision("search", ""));

        oracle.route("research supervisor", List.of(), List.of("search", "web_scraper"));

        ArgumentCaptor<String> system = ArgumentCaptor.forClass(String.class);
        verify(llmService).structuredCall(system.capture(), eq("(no messages yet)"), eq(RouteDecision.class));
        assertTrue(system.getValue().contains("You are research supervisor"));
        assertTrue(system.getValue().contains("search, web_scraper, FINISH"));
    }

    @Test
    @DisplayName("formatHistory keeps only the most recent messages")
    void formatHistory() {
        var history = new ArrayList<RunMessage>();
        for (int i = 0; i < LlmOracle.HISTORY_LIMIT + 3; i++) {
            history.add(new RunMessage("agent", "m" + i));
        }

        String text = LlmOracle.formatHistory(history);

        assertFalse(text.contains("[agent] m2\n"));
        assertTrue(text.startsWith("[agent] m3"));
        assertTrue(text.endsWith("[agent] m" + (LlmOracle.HISTORY_LIMIT + 2)));
    }

    @Test
    @DisplayName("an empty narrative is reported as an empty response")
    void emptyNarrative() {
        when(llmService.structuredCall(anyString(), anyString(), eq(LlmOracle.ReportNarrative.class)))
                .thenReturn(new LlmOracle.ReportNarrative(""));
        assertThrows(LlmEmptyResponseException.class, () -> oracle.synthesizeReport("{}"));
    }

    @Test
    @DisplayName("code fix requests list prior fixes")
    void codeFixPrompt() {
        oracle.proposeCodeFix(List.of("slow search"), List.of());

        ArgumentCaptor<String> user = ArgumentCaptor.forClass(String.class);
        verify(llmService).structuredCall(anyString(), user.capture(), any());
        assertTrue(user.getValue().contains("- slow search"));
        assertTrue(user.getValue().contains("Fixes already applied:\n- none"));
    }
}
