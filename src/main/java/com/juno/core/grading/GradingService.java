package com.juno.core.grading;

import com.juno.core.config.JunoProperties;
import com.juno.core.model.ResourceChangeRequest;
import com.juno.core.model.RunMessage;
import com.juno.core.model.TaskExecutionRecord;
import com.juno.core.model.Team;
import com.juno.core.oracle.GradeResult;
import com.juno.core.oracle.Oracle;
import com.juno.core.state.RunState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Grades team output against the current task and decides when the
 * improvement team must step in.
 * <p>
 * Escalation happens when a resource request is outstanding, when a team's
 * low-quality streak reaches its limit, or when the missed-deadline counter
 * reaches its limit. Once every enabled worker team has been graded for the
 * current task, the task deadline and size are reset for the next task.
 */
@Service
public class GradingService {

    private static final Logger log = LoggerFactory.getLogger(GradingService.class);

    public static final String RESOURCE_REQUEST = "resource_request";
    public static final String LOW_QUALITY = "low_quality";
    public static final String MISSED_DEADLINES = "missed_deadlines";

    static final int FEEDBACK_HISTORY = 5;
    static final String SUPERVISOR = "supervisor";

    private final Oracle oracle;
    private final Clock clock;

    public GradingService(Oracle oracle, Clock clock) {
        this.oracle = oracle;
        this.clock = clock;
    }

    /**
     * Grades a successful team output. A grader failure yields the neutral
     * score with a parse-error issue.
     */
    public GradingOutcome gradeOutput(RunState state, Team team, String output, JunoProperties props) {
        GradeResult grade;
        try {
            grade = oracle.grade(team.id(), state.currentTask(), output);
        } catch (RuntimeException e) {
            log.warn("Grading {} output failed, using neutral score: {}", team.id(), e.getMessage());
            grade = GradeResult.parseError(e.getMessage());
        }
        return applyGrade(state, team, grade, true, props);
    }

    /**
     * Grades a team run that raised an error: zero score, counted as an error.
     */
    public GradingOutcome gradeFailure(RunState state, Team team, String error, JunoProperties props) {
        var grade = new GradeResult(0.0, "Team execution failed.", List.of("execution failure: " + error));
        return applyGrade(state, team, grade, false, props);
    }

    GradingOutcome applyGrade(RunState state, Team team, GradeResult grade, boolean success, JunoProperties props) {
        String teamName = team.id();
        var improvement = props.getImprovement();
        Instant now = clock.instant();
        Instant deadline = state.currentTaskDeadline().orElse(null);
        boolean deadlineMet = TaskExecutionRecord.isDeadlineMet(now, deadline);

        var update = new HashMap<String, Object>();
        var messages = new ArrayList<RunMessage>();
        messages.add(new RunMessage(SUPERVISOR, feedbackMessage(teamName, grade, now, deadline)));

        var performances = new HashMap<>(state.agentPerformances());
        performances.put(teamName, state.agentPerformance(teamName)
                .withGrade(grade.score(), success, latestDuration(state, teamName)));
        update.put("agentPerformances", Map.copyOf(performances));

        var feedback = new HashMap<>(state.supervisorFeedback());
        var teamFeedback = new ArrayList<>(feedback.getOrDefault(teamName, List.of()));
        teamFeedback.add(grade.comments());
        feedback.put(teamName, List.copyOf(teamFeedback));
        update.put("supervisorFeedback", Map.copyOf(feedback));

        int streak = grade.score() < props.getQuality().getThreshold() ? state.lowQualityCount(teamName) + 1 : 0;
        var streaks = new HashMap<>(state.lowQualityCounts());
        streaks.put(teamName, streak);
        update.put("lowQualityCounts", Map.copyOf(streaks));

        int missed = deadlineMet ? state.missedDeadlinesCount() : state.missedDeadlinesCount() + 1;
        update.put("missedDeadlinesCount", missed);

        var reasons = new ArrayList<String>();
        List<ResourceChangeRequest> requests = state.resourceChangeRequests();
        if (!requests.isEmpty()) {
            reasons.add(RESOURCE_REQUEST);
        }
        if (streak >= improvement.getLowQualityStreakLimit()) {
            reasons.add(LOW_QUALITY);
        }
        if (missed >= improvement.getMissedDeadlineLimit()) {
            reasons.add(MISSED_DEADLINES);
        }
        if (!reasons.isEmpty()) {
            String request = requests.isEmpty()
                    ? improvementRequest(teamName, streak, missed, grade.issues(), teamFeedback, improvement)
                    : resourceScalingRequest(requests.get(requests.size() - 1), grade.issues());
            messages.add(new RunMessage(SUPERVISOR, request));
            update.put("pendingRoute", Team.JUNO.nodeName());
            var issues = new ArrayList<>(state.issuesIdentified());
            grade.issues().forEach(issue -> issues.add(teamName + ": " + issue));
            update.put("issuesIdentified", List.copyOf(issues));
            update.put("escalationCount", state.escalationCount() + 1);
            log.info("Escalating {} to the improvement team: {}", teamName, reasons);
        }

        var graded = new ArrayList<>(state.gradedTeams());
        if (!graded.contains(teamName)) {
            graded.add(teamName);
        }
        update.put("gradedTeams", List.copyOf(graded));
        boolean allGraded = props.workerTeams().stream().allMatch(t -> graded.contains(t.id()));
        if (allGraded) {
            update.put("currentTaskDeadline", 0L);
            update.put("currentTaskSize", 1.0);
        }

        update.put(RunState.MESSAGES, List.copyOf(messages));
        log.info("Graded {}: score={} deadlineMet={} streak={}", teamName,
                String.format(Locale.ROOT, "%.2f", grade.score()), deadlineMet, streak);
        return new GradingOutcome(grade, deadlineMet, List.copyOf(reasons), update);
    }

    private static double latestDuration(RunState state, String team) {
        var metrics = state.metrics();
        for (int i = metrics.size() - 1; i >= 0; i--) {
            if (metrics.get(i).teamName().equals(team)) {
                return metrics.get(i).durationSeconds();
            }
        }
        return 0.0;
    }

    static String feedbackMessage(String team, GradeResult grade, Instant now, Instant deadline) {
        var sb = new StringBuilder("Supervisor Feedback for ").append(team).append(" team:\n\n")
                .append(String.format(Locale.ROOT, "Score: %.2f/1.0%n", grade.score()));
        if (deadline != null) {
            double seconds = Math.abs(Duration.between(now, deadline).toMillis()) / 1000.0;
            if (TaskExecutionRecord.isDeadlineMet(now, deadline)) {
                sb.append(String.format(Locale.ROOT, "Deadline met with %.1f seconds remaining.%n", seconds));
            } else {
                sb.append(String.format(Locale.ROOT, "Deadline missed by %.1f seconds.%n", seconds));
            }
        }
        sb.append("\nComments: ").append(grade.comments());
        if (!grade.issues().isEmpty()) {
            sb.append("\n\nIssues:\n").append(bullets(grade.issues()));
        }
        return sb.toString();
    }

    static String resourceScalingRequest(ResourceChangeRequest request, List<String> issues) {
        return "RESOURCE SCALING REQUEST\n\n"
                + "Team: " + request.team() + "\n"
                + "Current agents: " + request.currentAgents() + "\n"
                + "Recommended agents: " + request.recommendedAgents() + "\n"
                + "Reason: " + request.reason() + "\n\n"
                + "Recent performance issues:\n" + bullets(issues) + "\n\n"
                + "Apply the recommended allocation and monitor performance afterwards.";
    }

    static String improvementRequest(String team, int streak, int missed, List<String> issues,
                                     List<String> feedback, JunoProperties.Improvement limits) {
        var reason = new StringBuilder();
        if (streak >= limits.getLowQualityStreakLimit()) {
            reason.append("The ").append(team).append(" team has produced low-quality output ")
                    .append(streak).append(" times consecutively.");
        }
        if (missed >= limits.getMissedDeadlineLimit()) {
            if (reason.length() > 0) {
                reason.append('\n');
            }
            reason.append("The system has missed ").append(missed).append(" deadlines recently.");
        }
        var recent = feedback.subList(Math.max(0, feedback.size() - FEEDBACK_HISTORY), feedback.size());
        return "IMPROVEMENT REQUEST\n\n" + reason + "\n\n"
                + "Recent issues:\n" + bullets(issues) + "\n\n"
                + "Previous feedback:\n" + bullets(recent) + "\n\n"
                + "Analyze these issues and improve the " + team + " team's quality and deadline performance.";
    }

    private static String bullets(List<String> items) {
        if (items.isEmpty()) {
            return "- none";
        }
        return items.stream().map(i -> "- " + i).collect(Collectors.joining("\n"));
    }
}
