package com.juno.core.teams;

import com.juno.core.config.JunoProperties;
import com.juno.core.evaluation.SystemEvaluationEngine;
import com.juno.core.llm.LlmService;
import com.juno.core.model.Team;
import com.juno.core.oracle.Oracle;
import com.juno.core.router.OracleRoutingPolicy;
import com.juno.core.router.TeamRouter;
import com.juno.core.router.TeamWorker;
import com.juno.sandbox.CodeSandbox;
import com.juno.tools.DocumentTools;
import com.juno.tools.WebTools;
import org.bsc.langgraph4j.GraphStateException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.ai.tool.method.MethodToolCallbackProvider;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Clock;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds the nested team graphs on first use and hands out the compiled
 * {@link TeamRouter} per team.
 * <ul>
 *   <li>research: {@code search}, {@code web_scraper}</li>
 *   <li>writing: {@code note_taker}, {@code doc_writer}</li>
 *   <li>juno: {@code evaluator}, {@code code_agent}</li>
 * </ul>
 * Routers are built lazily so that options set on the command line
 * (working directory, iteration limit) are in effect.
 */
@Component
public class TeamRegistry {

    private static final Logger log = LoggerFactory.getLogger(TeamRegistry.class);

    static final String SEARCH_PROMPT = """
            You are a research assistant who can search for up-to-date information using the searchWeb tool.
            Report the relevant findings with their sources.
            """;
    static final String SCRAPER_PROMPT = """
            You are a research assistant who can fetch specified URLs for more detailed information
            using the scrapeWebpages tool. Report the relevant details you found.
            """;
    static final String NOTE_TAKER_PROMPT = """
            You are an expert senior researcher tasked with writing a paper outline and taking notes
            to craft a perfect paper. Save the outline with the createOutline tool.
            """;
    static final String DOC_WRITER_PROMPT = """
            You are an expert writing a research document. Below are the files currently in your directory:
            %s
            Write, edit and read documents with the tools provided. Report what you wrote.
            """;

    private final LlmService llmService;
    private final Oracle oracle;
    private final SystemEvaluationEngine evaluationEngine;
    private final CodeSandbox sandbox;
    private final JunoProperties properties;
    private final Clock clock;
    private final Map<Team, TeamRouter> routers = new EnumMap<>(Team.class);

    public TeamRegistry(LlmService llmService, Oracle oracle, SystemEvaluationEngine evaluationEngine,
                        CodeSandbox sandbox, JunoProperties properties, Clock clock) {
        this.llmService = llmService;
        this.oracle = oracle;
        this.evaluationEngine = evaluationEngine;
        this.sandbox = sandbox;
        this.properties = properties;
        this.clock = clock;
    }

    public synchronized TeamRouter router(Team team) {
        return routers.computeIfAbsent(team, this::build);
    }

    private TeamRouter build(Team team) {
        var members = new LinkedHashMap<String, TeamWorker>();
        switch (team) {
            case RESEARCH -> {
                var web = new WebTools(properties.getTools());
                members.put("search", new LlmTeamWorker(llmService, "search", SEARCH_PROMPT,
                        toolsFor(web, "searchWeb")));
                members.put("web_scraper", new LlmTeamWorker(llmService, "web_scraper", SCRAPER_PROMPT,
                        toolsFor(web, "scrapeWebpages")));
            }
            case WRITING -> {
                var docs = new DocumentTools(Path.of(properties.getWorkingDirectory()));
                members.put("note_taker", new LlmTeamWorker(llmService, "note_taker", NOTE_TAKER_PROMPT,
                        toolsFor(docs, "createOutline", "readDocument")));
                members.put("doc_writer", new LlmTeamWorker(llmService, "doc_writer",
                        () -> docWriterPrompt(docs.listDocuments()),
                        toolsFor(docs, "writeDocument", "editDocument", "readDocument")));
            }
            case JUNO -> {
                members.put(EvaluatorWorker.NAME, new EvaluatorWorker(evaluationEngine));
                members.put(CodeAgentWorker.NAME, new CodeAgentWorker(oracle, sandbox, clock));
            }
        }
        try {
            var router = new TeamRouter(team.id(), members, new OracleRoutingPolicy(oracle),
                    properties.getMaxIterations());
            log.info("Built {} team with members {}", team.id(), router.members());
            return router;
        } catch (GraphStateException e) {
            throw new IllegalStateException("Could not build the " + team.id() + " team graph", e);
        }
    }

    static String docWriterPrompt(List<String> files) {
        return String.format(DOC_WRITER_PROMPT, files.isEmpty() ? "(none)" : String.join("\n", files));
    }

    static List<ToolCallback> toolsFor(Object toolObject, String... names) {
        var wanted = Set.of(names);
        var callbacks = MethodToolCallbackProvider.builder()
                .toolObjects(toolObject)
                .build()
                .getToolCallbacks();
        return Arrays.stream(callbacks)
                .filter(cb -> wanted.contains(cb.getToolDefinition().name()))
                .toList();
    }
}
