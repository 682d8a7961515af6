package com.juno.core.teams;

import com.juno.core.config.JunoProperties;
import com.juno.core.evaluation.SystemEvaluationEngine;
import com.juno.core.llm.LlmService;
import com.juno.core.model.Team;
import com.juno.core.oracle.Oracle;
import com.juno.sandbox.CodeSandbox;
import com.juno.tools.DocumentTools;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

class TeamRegistryTest {

    @TempDir
    Path workspace;

    private TeamRegistry registry;

    @BeforeEach
    void setUp() {
        var props = new JunoProperties();
        props.setWorkingDirectory(workspace.toString());
        registry = new TeamRegistry(mock(LlmService.class), mock(Oracle.class), mock(SystemEvaluationEngine.class),
                mock(CodeSandbox.class), props, Clock.systemUTC());
    }

    @Test
    @DisplayName("each team is built once with its members in working order")
    void members() {
        assertEquals(List.of("search", "web_scraper"), registry.router(Team.RESEARCH).members());
        assertEquals(List.of("note_taker", "doc_writer"), registry.router(Team.WRITING).members());
        assertEquals(List.of("evaluator", "code_agent"), registry.router(Team.JUNO).members());
        assertSame(registry.router(Team.JUNO), registry.router(Team.JUNO));
    }

    @Test
    @DisplayName("toolsFor exposes only the named tools")
    void toolsFor() {
        var tools = TeamRegistry.toolsFor(new DocumentTools(workspace), "writeDocument", "readDocument");

        Set<String> names = tools.stream().map(t -> t.getToolDefinition().name()).collect(Collectors.toSet());
        assertEquals(Set.of("writeDocument", "readDocument"), names);
    }

    @Test
    @DisplayName("the doc writer prompt lists the workspace files")
    void docWriterPrompt() {
        assertTrue(TeamRegistry.docWriterPrompt(List.of()).contains("(none)"));
        String prompt = TeamRegistry.docWriterPrompt(List.of("outline.txt", "report.md"));
        assertTrue(prompt.contains("outline.txt\nreport.md"));
    }
}
