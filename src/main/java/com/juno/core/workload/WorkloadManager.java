package com.juno.core.workload;

import com.juno.core.config.JunoProperties;
import com.juno.core.model.ResourceChangeRequest;
import com.juno.core.model.RunMessage;
import com.juno.core.model.TaskExecutionRecord;
import com.juno.core.model.Team;
import com.juno.core.state.RunState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Random;

/**
 * Applies supervisor pressure to the current task: random workload increases,
 * deadlines scaled by task size, and requests for more agents when recent
 * deadlines are being missed.
 */
@Service
public class WorkloadManager {

    private static final Logger log = LoggerFactory.getLogger(WorkloadManager.class);

    static final int RESOURCE_WINDOW = 10;
    static final double MISS_RATE_LIMIT = 0.2;
    static final double QUALITY_LIMIT = 0.7;
    static final String SYSTEM = "system";

    private final Clock clock;
    private final Random random;

    @Autowired
    public WorkloadManager(Clock clock) {
        this(clock, new Random());
    }

    public WorkloadManager(Clock clock, Random random) {
        this.clock = clock;
        this.random = random;
    }

    /**
     * Possibly inflates the size multiplier of the current task.
     * A draw above the configured probability leaves the size unchanged.
     */
    public WorkloadChange maybeIncreaseWorkload(RunState state, JunoProperties props) {
        var cfg = props.getWorkload();
        double current = state.currentTaskSize();
        if (!cfg.isDynamic()) {
            return WorkloadChange.unchanged(current);
        }
        if (random.nextDouble() > cfg.getIncreaseProbability()) {
            return WorkloadChange.unchanged(current);
        }
        if (current >= cfg.getMaxMultiplier()) {
            return WorkloadChange.unchanged(current);
        }
        double increase = 0.2 + random.nextDouble() * 0.3;
        double next = Math.round(Math.min(cfg.getMaxMultiplier(), current + increase) * 10.0) / 10.0;
        if (next <= current) {
            return WorkloadChange.unchanged(current);
        }
        return new WorkloadChange(true, next);
    }

    /**
     * Deadline for a task of the given size: the default deadline scaled by
     * size, with a uniform jitter of plus or minus ten percent.
     */
    public Instant computeDeadline(JunoProperties props, double taskSize) {
        double baseSeconds = props.getWorkload().getDefaultDeadlineMinutes() * 60.0;
        double jitter = 0.9 + random.nextDouble() * 0.2;
        long millis = Math.round(baseSeconds * taskSize * jitter * 1000.0);
        return clock.instant().plusMillis(millis);
    }

    /**
     * Looks at the last {@value #RESOURCE_WINDOW} task records and requests one
     * more agent for the team with the most missed deadlines, when deadlines
     * are being missed often or quality is low. Teams at their maximum and
     * teams with a request already outstanding are skipped.
     */
    public Optional<ResourceChangeRequest> evaluateResourceNeed(RunState state, JunoProperties props) {
        if (!props.getResources().isScaling()) {
            return Optional.empty();
        }
        List<TaskExecutionRecord> metrics = state.metrics();
        if (metrics.isEmpty()) {
            return Optional.empty();
        }
        var window = metrics.subList(Math.max(0, metrics.size() - RESOURCE_WINDOW), metrics.size());

        var missedByTeam = new LinkedHashMap<String, Integer>();
        int missed = 0;
        double qualitySum = 0.0;
        for (TaskExecutionRecord record : window) {
            qualitySum += record.quality();
            if (!record.deadlineMet()) {
                missed++;
                missedByTeam.merge(record.teamName(), 1, Integer::sum);
            }
        }
        double missRate = (double) missed / window.size();
        double avgQuality = qualitySum / window.size();
        if (missRate < MISS_RATE_LIMIT && avgQuality > QUALITY_LIMIT) {
            return Optional.empty();
        }

        String problemTeam = null;
        int most = 0;
        for (var entry : missedByTeam.entrySet()) {
            if (entry.getValue() > most) {
                most = entry.getValue();
                problemTeam = entry.getKey();
            }
        }
        if (problemTeam == null) {
            return Optional.empty();
        }
        var resources = state.teamResources().get(problemTeam);
        if (resources == null || !resources.canScaleUp()) {
            log.debug("Team {} cannot scale beyond its maximum", problemTeam);
            return Optional.empty();
        }
        String team = problemTeam;
        if (state.resourceChangeRequests().stream().anyMatch(r -> r.team().equals(team))) {
            return Optional.empty();
        }
        String reason = String.format(Locale.ROOT, "High deadline miss rate (%.1f%%) for team %s",
                missRate * 100.0, problemTeam);
        return Optional.of(new ResourceChangeRequest(problemTeam, resources.currentAgents(),
                resources.currentAgents() + 1, reason, clock.instant()));
    }

    /**
     * Runs the workload increase, deadline assignment and resource check in
     * order and returns the resulting state update. Does nothing without a
     * current task; the deadline is only assigned when none is set.
     */
    public Map<String, Object> applyAdjustments(RunState state, JunoProperties props) {
        if (!state.hasCurrentTask()) {
            return Map.of();
        }
        var update = new HashMap<String, Object>();
        var messages = new ArrayList<RunMessage>();

        var change = maybeIncreaseWorkload(state, props);
        double size = state.currentTaskSize();
        if (change.changed()) {
            size = change.sizeMultiplier();
            update.put("currentTaskSize", size);
            messages.add(new RunMessage(SYSTEM, "**NOTICE**: Supervisor has increased the workload. Task size is now "
                    + size + "x standard."));
            log.info("Workload increased to {}x", size);
        }

        if (state.currentTaskDeadline().isEmpty()) {
            Instant deadline = computeDeadline(props, size);
            update.put("currentTaskDeadline", deadline.toEpochMilli());
            String display = DateTimeFormatter.ofPattern("HH:mm:ss").withZone(clock.getZone()).format(deadline);
            messages.add(new RunMessage(SYSTEM, "**DEADLINE**: This task must be completed by " + display + "."));
            log.info("Deadline set to {}", deadline);
        }

        var request = evaluateResourceNeed(state, props);
        if (request.isPresent()) {
            var r = request.get();
            var requests = new ArrayList<>(state.resourceChangeRequests());
            requests.add(r);
            update.put("resourceChangeRequests", List.copyOf(requests));
            if (state.pendingRoute().isBlank()) {
                update.put("pendingRoute", Team.JUNO.nodeName());
            }
            messages.add(new RunMessage(SYSTEM, "**RESOURCE REQUEST**: Team " + r.team()
                    + " requires additional resources. Recommendation: Increase from " + r.currentAgents()
                    + " to " + r.recommendedAgents() + " agents. Reason: " + r.reason()));
            log.info("Resource request for team {}: {} -> {} agents", r.team(), r.currentAgents(), r.recommendedAgents());
        }

        if (!messages.isEmpty()) {
            update.put(RunState.MESSAGES, List.copyOf(messages));
        }
        return update;
    }
}
