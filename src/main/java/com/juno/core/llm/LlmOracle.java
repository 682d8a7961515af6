package com.juno.core.llm;

import com.juno.core.model.RunMessage;
import com.juno.core.oracle.CodeFixProposal;
import com.juno.core.oracle.GeneratedTask;
import com.juno.core.oracle.GradeResult;
import com.juno.core.oracle.Oracle;
import com.juno.core.oracle.RouteDecision;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.stream.Collectors;

/**
 * {@link Oracle} backed by the chat model through {@link LlmService}.
 * <p>
 * All text scraping stays in this class: callers receive typed records or
 * an exception.
 */
@Service
public class LlmOracle implements Oracle {

    static final int HISTORY_LIMIT = 12;
    static final double TEN_POINT_SCALE_MIN = 2.0;

    private static final String GRADER_PROMPT = """
            You are a strict reviewer grading the output of an AI agent team.
            Judge the output against the task for accuracy, completeness, clarity and relevance.
            Return a score between 0.0 and 1.0, short comments, and a list of concrete issues.
            Return an empty issues list when the output has no problems.
            """;

    private static final String ROUTER_PROMPT = """
            You are %s, coordinating a team of workers: %s.
            Given the conversation so far, choose which worker should act next.
            When the work is complete, answer FINISH.
            Answer with exactly one of: %s.
            """;

    private static final String TASK_PROMPT = """
            You create realistic, self-contained tasks for a team of research and writing agents.
            A task must be answerable with web research and a written document of at most one page.
            """;

    private static final String CODE_FIX_PROMPT = """
            You are a senior engineer improving an autonomous multi-agent system.
            For each issue, propose a small fix with a self-contained Python snippet that demonstrates
            or tests the change. The snippet must run without network access or extra packages and
            must print nothing to standard error. Avoid repeating fixes that were already applied.
            """;

    private static final String REPORT_PROMPT = """
            You analyse performance evaluations of an autonomous multi-agent system.
            Summarize strengths, weaknesses and the most important next improvements in a few paragraphs.
            """;

    private final LlmService llmService;

    public LlmOracle(LlmService llmService) {
        this.llmService = llmService;
    }

    @Override
    public GradeResult grade(String team, String task, String result) {
        String user = "Team: " + team + "\n\nTask:\n" + task + "\n\nOutput:\n" + result;
        var grade = llmService.structuredCall(GRADER_PROMPT, user, GradeResult.class);
        return new GradeResult(normalizeScore(grade.score()), grade.comments(), grade.issues());
    }

    @Override
    public RouteDecision route(String supervisor, List<RunMessage> history, List<String> options) {
        String choices = String.join(", ", options) + ", " + RouteDecision.FINISH;
        String system = String.format(ROUTER_PROMPT, supervisor, String.join(", ", options), choices);
        return llmService.structuredCall(system, formatHistory(history), RouteDecision.class);
    }

    @Override
    public GeneratedTask generateTask(String category) {
        return llmService.structuredCall(TASK_PROMPT, "Create one new task in the category: " + category,
                GeneratedTask.class);
    }

    @Override
    public CodeFixProposal proposeCodeFix(List<String> issues, List<String> priorFixes) {
        String user = "Issues:\n" + bullets(issues) + "\n\nFixes already applied:\n"
                + (priorFixes.isEmpty() ? "- none" : bullets(priorFixes));
        return llmService.structuredCall(CODE_FIX_PROMPT, user, CodeFixProposal.class);
    }

    @Override
    public String synthesizeReport(String summaryJson) {
        var narrative = llmService.structuredCall(REPORT_PROMPT, "Evaluation data:\n" + summaryJson,
                ReportNarrative.class);
        if (narrative.narrative() == null || narrative.narrative().isBlank()) {
            throw new LlmEmptyResponseException("Report narrative was empty");
        }
        return narrative.narrative();
    }

    /**
     * Clamps into [0, 1]. Scores of {@value #TEN_POINT_SCALE_MIN} or more are
     * read as out of ten first.
     */
    static double normalizeScore(double score) {
        double value = score >= TEN_POINT_SCALE_MIN ? score / 10.0 : score;
        return Math.max(0.0, Math.min(1.0, value));
    }

    static String formatHistory(List<RunMessage> history) {
        if (history.isEmpty()) {
            return "(no messages yet)";
        }
        return history.subList(Math.max(0, history.size() - HISTORY_LIMIT), history.size()).stream()
                .map(m -> "[" + m.author() + "] " + m.content())
                .collect(Collectors.joining("\n\n"));
    }

    private static String bullets(List<String> items) {
        return items.stream().map(i -> "- " + i).collect(Collectors.joining("\n"));
    }

    public record ReportNarrative(String narrative) {}
}
