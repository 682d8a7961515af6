package com.juno.core.scaling;

import com.juno.core.model.AppliedResourceChange;
import com.juno.core.model.TaskExecutionRecord;
import com.juno.core.model.TeamPerformance;
import com.juno.core.state.RunState;
import org.springframework.stereotype.Service;

import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;

/**
 * Judges whether adding capacity to a team paid for itself.
 * <p>
 * Performance is compared between the task records a team produced with the
 * old agent count and those produced with the new one, and the weighted
 * performance ratio is divided by the resource ratio.
 */
@Service
public class ResourceScalingEvaluator {

    static final double QUALITY_WEIGHT = 0.3;
    static final double SUCCESS_WEIGHT = 0.2;
    static final double SPEED_WEIGHT = 0.3;
    static final double DEADLINE_WEIGHT = 0.2;

    private static final DateTimeFormatter TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneId.systemDefault());

    /**
     * Averages over every record of {@code team} produced while it held
     * exactly {@code agentCount} agents. All zeros when there are none.
     */
    public TeamPerformance teamPerformance(RunState state, String team, int agentCount) {
        return summarize(state.metrics().stream()
                .filter(m -> m.teamName().equals(team) && m.agentCount() == agentCount)
                .toList());
    }

    public TeamPerformance summarize(List<TaskExecutionRecord> records) {
        if (records.isEmpty()) {
            return TeamPerformance.ZERO;
        }
        int n = records.size();
        double quality = 0.0;
        double duration = 0.0;
        int successes = 0;
        int deadlinesMet = 0;
        for (TaskExecutionRecord r : records) {
            quality += r.quality();
            duration += r.durationSeconds();
            if (r.success()) successes++;
            if (r.deadlineMet()) deadlinesMet++;
        }
        return new TeamPerformance(quality / n, (double) successes / n, duration / n, (double) deadlinesMet / n);
    }

    /**
     * Weighted performance ratio over resource ratio, minus one. Positive when
     * the performance gain outpaced the added agents.
     */
    public double efficiencyChange(TeamPerformance before, TeamPerformance after, int oldAgents, int newAgents) {
        if (oldAgents == 0 || newAgents == 0) {
            return 0.0;
        }
        double resourceRatio = (double) newAgents / oldAgents;
        double qualityRatio = ratio(after.avgQuality(), before.avgQuality());
        double successRatio = ratio(after.successRate(), before.successRate());
        // lower duration is better
        double speedRatio = after.avgDurationSeconds() > 0
                ? before.avgDurationSeconds() / after.avgDurationSeconds()
                : 1.0;
        double deadlineRatio = ratio(after.deadlineMetRate(), before.deadlineMetRate());

        double performanceChange = QUALITY_WEIGHT * qualityRatio
                + SUCCESS_WEIGHT * successRatio
                + SPEED_WEIGHT * speedRatio
                + DEADLINE_WEIGHT * deadlineRatio;
        return performanceChange / resourceRatio - 1.0;
    }

    public ScalingAssessment monitorNewResource(RunState state, String team, int oldAgents, int newAgents) {
        var before = teamPerformance(state, team, oldAgents);
        var after = teamPerformance(state, team, newAgents);
        return assess(team, efficiencyChange(before, after, oldAgents, newAgents));
    }

    public ScalingAssessment assess(String team, double efficiency) {
        String pct = percent(Math.abs(efficiency));
        String narrative;
        if (efficiency > 0.2) {
            narrative = "Resource scaling for " + team + " team was highly successful. Efficiency improved by "
                    + pct + ". The additional resources have significantly improved performance.";
        } else if (efficiency > 0.0) {
            narrative = "Resource scaling for " + team + " team was modestly successful. Efficiency improved by "
                    + pct + ". The additional resources have slightly improved performance.";
        } else if (efficiency > -0.1) {
            narrative = "Resource scaling for " + team + " team had neutral impact. Efficiency changed by "
                    + percent(efficiency) + ". The additional resources did not significantly affect performance.";
        } else {
            narrative = "Resource scaling for " + team + " team was inefficient. Efficiency decreased by "
                    + pct + ". Consider optimizing or reverting the resource allocation.";
        }
        return new ScalingAssessment(efficiency > 0.0, narrative, efficiency);
    }

    public String recommendation(double efficiency) {
        if (efficiency > 0.1) {
            return "Keep the new resource allocation.";
        }
        if (efficiency > -0.1) {
            return "Continue monitoring the resource allocation.";
        }
        return "Consider reverting to the previous resource allocation.";
    }

    /**
     * Markdown report on the effect of an applied resource change.
     */
    public String monitoringReport(RunState state, AppliedResourceChange change) {
        var assessment = monitorNewResource(state, change.team(), change.oldAgents(), change.newAgents());
        return "## Resource Change Monitoring Report\n\n"
                + "Team: " + change.team() + "\n"
                + "Previous agent count: " + change.oldAgents() + "\n"
                + "New agent count: " + change.newAgents() + "\n"
                + "Change timestamp: " + TIMESTAMP.format(change.appliedAt()) + "\n\n"
                + "### Performance Analysis\n\n"
                + "Efficiency change: " + percent(assessment.efficiencyChange()) + "\n"
                + "Status: " + (assessment.success() ? "Success" : "Suboptimal") + "\n\n"
                + "### Comments\n\n" + assessment.narrative() + "\n\n"
                + "### Recommendation\n\n" + recommendation(assessment.efficiencyChange());
    }

    private static double ratio(double after, double before) {
        return before > 0 ? after / before : 1.0;
    }

    private static String percent(double value) {
        return String.format(Locale.ROOT, "%.1f%%", value * 100.0);
    }
}
