package com.juno.core.config;

import com.juno.core.model.ImprovementPolicy;
import com.juno.core.model.PerformanceTarget;
import com.juno.core.model.Team;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties for a Juno run.
 * <p>
 * Bound from the {@code juno.*} namespace in application.yml.
 */
@Component
@ConfigurationProperties(prefix = "juno")
public class JunoProperties {

    private List<String> enabledTeams = new ArrayList<>(List.of("research", "writing", "juno"));
    private String workingDirectory = "/tmp/hierarchical_agents_workspace";
    private String sandboxDirectory = "/tmp/hierarchical_agents_sandbox";
    private int recursionLimit = 100;
    private int maxCycles = 10;
    private int maxIterations = 10;
    private boolean autoGenerateTasks = true;
    private List<String> taskCategories = new ArrayList<>(List.of(
            "Research and report",
            "Market analysis",
            "Technical documentation",
            "Creative writing",
            "Data analysis",
            "Summarization"));
    private Map<String, Double> performanceTargets = new LinkedHashMap<>(Map.of(
            "avg_response_time", 10.0,
            "success_rate", 0.95,
            "response_quality", 0.8,
            "task_completion_rate", 0.9));

    private Workload workload = new Workload();
    private Resources resources = new Resources();
    private Quality quality = new Quality();
    private Improvement improvement = new Improvement();
    private Tools tools = new Tools();
    private Sandbox sandbox = new Sandbox();

    /**
     * Checks the configuration for errors that must stop a run before it starts.
     *
     * @throws JunoConfigurationException describing the first problem found
     */
    public void validate() {
        if (enabledTeams == null || enabledTeams.isEmpty()) {
            throw new JunoConfigurationException("juno.enabled-teams must name at least one team");
        }
        for (String name : enabledTeams) {
            try {
                Team.fromId(name);
            } catch (IllegalArgumentException e) {
                throw new JunoConfigurationException("Unknown team in juno.enabled-teams: " + name, e);
            }
        }
        if (workerTeams().isEmpty()) {
            throw new JunoConfigurationException("juno.enabled-teams must include a worker team (research or writing)");
        }
        if (maxCycles <= 0) {
            throw new JunoConfigurationException("juno.max-cycles must be positive, got " + maxCycles);
        }
        if (recursionLimit <= 0) {
            throw new JunoConfigurationException("juno.recursion-limit must be positive, got " + recursionLimit);
        }
        if (maxIterations <= 0) {
            throw new JunoConfigurationException("juno.max-iterations must be positive, got " + maxIterations);
        }
        if (autoGenerateTasks && (taskCategories == null || taskCategories.isEmpty())) {
            throw new JunoConfigurationException("juno.task-categories must not be empty when auto-generate-tasks is on");
        }
        if (workload.increaseProbability < 0.0 || workload.increaseProbability > 1.0) {
            throw new JunoConfigurationException("juno.workload.increase-probability must be within [0, 1]");
        }
        if (workload.maxMultiplier < 1.0) {
            throw new JunoConfigurationException("juno.workload.max-multiplier must be at least 1.0");
        }
        if (workload.defaultDeadlineMinutes <= 0) {
            throw new JunoConfigurationException("juno.workload.default-deadline-minutes must be positive");
        }
        if (resources.minAgents < 1 || resources.minAgents > resources.maxAgents) {
            throw new JunoConfigurationException("juno.resources requires 1 <= min-agents <= max-agents");
        }
        if (resources.initialAgents < resources.minAgents || resources.initialAgents > resources.maxAgents) {
            throw new JunoConfigurationException("juno.resources.initial-agents must lie within [min-agents, max-agents]");
        }
        if (quality.threshold < 0.0 || quality.threshold > 1.0) {
            throw new JunoConfigurationException("juno.quality.threshold must be within [0, 1]");
        }
    }

    /** Enabled teams in configuration order. Call after {@link #validate()}. */
    public List<Team> teams() {
        return enabledTeams.stream().map(Team::fromId).distinct().toList();
    }

    public List<Team> workerTeams() {
        return enabledTeams.stream()
                .map(name -> {
                    try {
                        return Team.fromId(name);
                    } catch (IllegalArgumentException e) {
                        return null;
                    }
                })
                .filter(t -> t != null && t.isWorker())
                .distinct()
                .toList();
    }

    public boolean isJunoEnabled() {
        return teams().contains(Team.JUNO);
    }

    /** Configured targets with no measurement yet. */
    public List<PerformanceTarget> initialTargets() {
        return performanceTargets.entrySet().stream()
                .map(e -> new PerformanceTarget(e.getKey(), e.getValue(), 0.0, describe(e.getKey())))
                .toList();
    }

    private static String describe(String metric) {
        return switch (metric) {
            case "avg_response_time", "avg_duration" -> "Average task duration in seconds";
            case "success_rate" -> "Share of task attempts that completed without error";
            case "response_quality", "avg_quality" -> "Average graded quality";
            case "task_completion_rate" -> "Share of tasks completed";
            case "deadline_met_rate" -> "Share of tasks finished before their deadline";
            default -> "Custom target (not measured)";
        };
    }

    public List<String> getEnabledTeams() { return enabledTeams; }
    public void setEnabledTeams(List<String> enabledTeams) { this.enabledTeams = enabledTeams; }

    public String getWorkingDirectory() { return workingDirectory; }
    public void setWorkingDirectory(String workingDirectory) { this.workingDirectory = workingDirectory; }

    public String getSandboxDirectory() { return sandboxDirectory; }
    public void setSandboxDirectory(String sandboxDirectory) { this.sandboxDirectory = sandboxDirectory; }

    public int getRecursionLimit() { return recursionLimit; }
    public void setRecursionLimit(int recursionLimit) { this.recursionLimit = recursionLimit; }

    public int getMaxCycles() { return maxCycles; }
    public void setMaxCycles(int maxCycles) { this.maxCycles = maxCycles; }

    public int getMaxIterations() { return maxIterations; }
    public void setMaxIterations(int maxIterations) { this.maxIterations = maxIterations; }

    public boolean isAutoGenerateTasks() { return autoGenerateTasks; }
    public void setAutoGenerateTasks(boolean autoGenerateTasks) { this.autoGenerateTasks = autoGenerateTasks; }

    public List<String> getTaskCategories() { return taskCategories; }
    public void setTaskCategories(List<String> taskCategories) { this.taskCategories = taskCategories; }

    public Map<String, Double> getPerformanceTargets() { return performanceTargets; }
    public void setPerformanceTargets(Map<String, Double> performanceTargets) { this.performanceTargets = performanceTargets; }

    public Workload getWorkload() { return workload; }
    public void setWorkload(Workload workload) { this.workload = workload; }

    public Resources getResources() { return resources; }
    public void setResources(Resources resources) { this.resources = resources; }

    public Quality getQuality() { return quality; }
    public void setQuality(Quality quality) { this.quality = quality; }

    public Improvement getImprovement() { return improvement; }
    public void setImprovement(Improvement improvement) { this.improvement = improvement; }

    public Tools getTools() { return tools; }
    public void setTools(Tools tools) { this.tools = tools; }

    public Sandbox getSandbox() { return sandbox; }
    public void setSandbox(Sandbox sandbox) { this.sandbox = sandbox; }

    /**
     * Dynamic workload and deadline settings.
     */
    public static class Workload {
        private boolean dynamic = true;
        private double increaseProbability = 0.3;
        private double maxMultiplier = 2.0;
        private int defaultDeadlineMinutes = 30;

        public boolean isDynamic() { return dynamic; }
        public void setDynamic(boolean dynamic) { this.dynamic = dynamic; }

        public double getIncreaseProbability() { return increaseProbability; }
        public void setIncreaseProbability(double increaseProbability) { this.increaseProbability = increaseProbability; }

        public double getMaxMultiplier() { return maxMultiplier; }
        public void setMaxMultiplier(double maxMultiplier) { this.maxMultiplier = maxMultiplier; }

        public int getDefaultDeadlineMinutes() { return defaultDeadlineMinutes; }
        public void setDefaultDeadlineMinutes(int defaultDeadlineMinutes) { this.defaultDeadlineMinutes = defaultDeadlineMinutes; }
    }

    /**
     * Per-team agent allocation bounds.
     */
    public static class Resources {
        private boolean scaling = true;
        private int minAgents = 1;
        private int maxAgents = 3;
        private int initialAgents = 1;
        private double scalingFactor = 1.0;

        public boolean isScaling() { return scaling; }
        public void setScaling(boolean scaling) { this.scaling = scaling; }

        public int getMinAgents() { return minAgents; }
        public void setMinAgents(int minAgents) { this.minAgents = minAgents; }

        public int getMaxAgents() { return maxAgents; }
        public void setMaxAgents(int maxAgents) { this.maxAgents = maxAgents; }

        public int getInitialAgents() { return initialAgents; }
        public void setInitialAgents(int initialAgents) { this.initialAgents = initialAgents; }

        public double getScalingFactor() { return scalingFactor; }
        public void setScalingFactor(double scalingFactor) { this.scalingFactor = scalingFactor; }
    }

    public static class Quality {
        private double threshold = 0.7;

        public double getThreshold() { return threshold; }
        public void setThreshold(double threshold) { this.threshold = threshold; }
    }

    /**
     * Escalation thresholds and limits on what the improvement team may change.
     */
    public static class Improvement {
        private int lowQualityStreakLimit = 3;
        private int missedDeadlineLimit = 2;
        private int errorLimit = 3;
        private int minQualitySamples = 3;
        private double qualityFloor = 0.5;
        private int minAttempts = 5;
        private double successRateFloor = 0.7;
        private boolean allowCodeChanges = true;
        private int maxCodeChangesPerCycle = 3;
        private int codeChangeCooldown = 2;
        private int evaluationFrequency = 1;
        private double codeImprovementThreshold = 0.7;

        public ImprovementPolicy toPolicy() {
            return new ImprovementPolicy(errorLimit, minQualitySamples, qualityFloor, minAttempts, successRateFloor);
        }

        public int getLowQualityStreakLimit() { return lowQualityStreakLimit; }
        public void setLowQualityStreakLimit(int lowQualityStreakLimit) { this.lowQualityStreakLimit = lowQualityStreakLimit; }

        public int getMissedDeadlineLimit() { return missedDeadlineLimit; }
        public void setMissedDeadlineLimit(int missedDeadlineLimit) { this.missedDeadlineLimit = missedDeadlineLimit; }

        public int getErrorLimit() { return errorLimit; }
        public void setErrorLimit(int errorLimit) { this.errorLimit = errorLimit; }

        public int getMinQualitySamples() { return minQualitySamples; }
        public void setMinQualitySamples(int minQualitySamples) { this.minQualitySamples = minQualitySamples; }

        public double getQualityFloor() { return qualityFloor; }
        public void setQualityFloor(double qualityFloor) { this.qualityFloor = qualityFloor; }

        public int getMinAttempts() { return minAttempts; }
        public void setMinAttempts(int minAttempts) { this.minAttempts = minAttempts; }

        public double getSuccessRateFloor() { return successRateFloor; }
        public void setSuccessRateFloor(double successRateFloor) { this.successRateFloor = successRateFloor; }

        public boolean isAllowCodeChanges() { return allowCodeChanges; }
        public void setAllowCodeChanges(boolean allowCodeChanges) { this.allowCodeChanges = allowCodeChanges; }

        public int getMaxCodeChangesPerCycle() { return maxCodeChangesPerCycle; }
        public void setMaxCodeChangesPerCycle(int maxCodeChangesPerCycle) { this.maxCodeChangesPerCycle = maxCodeChangesPerCycle; }

        public int getCodeChangeCooldown() { return codeChangeCooldown; }
        public void setCodeChangeCooldown(int codeChangeCooldown) { this.codeChangeCooldown = codeChangeCooldown; }

        public int getEvaluationFrequency() { return evaluationFrequency; }
        public void setEvaluationFrequency(int evaluationFrequency) { this.evaluationFrequency = evaluationFrequency; }

        public double getCodeImprovementThreshold() { return codeImprovementThreshold; }
        public void setCodeImprovementThreshold(double codeImprovementThreshold) { this.codeImprovementThreshold = codeImprovementThreshold; }
    }

    public static class Tools {
        private String tavilyApiKey = "";
        private int searchResults = 5;
        private int fetchTimeoutSeconds = 20;

        public String getTavilyApiKey() { return tavilyApiKey; }
        public void setTavilyApiKey(String tavilyApiKey) { this.tavilyApiKey = tavilyApiKey; }

        public int getSearchResults() { return searchResults; }
        public void setSearchResults(int searchResults) { this.searchResults = searchResults; }

        public int getFetchTimeoutSeconds() { return fetchTimeoutSeconds; }
        public void setFetchTimeoutSeconds(int fetchTimeoutSeconds) { this.fetchTimeoutSeconds = fetchTimeoutSeconds; }
    }

    public static class Sandbox {
        private String command = "python3";
        private int timeoutSeconds = 30;

        public String getCommand() { return command; }
        public void setCommand(String command) { this.command = command; }

        public int getTimeoutSeconds() { return timeoutSeconds; }
        public void setTimeoutSeconds(int timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }
    }
}
