package com.juno.core.events;

import java.util.Arrays;

/**
 * Every event a run publishes, with the console category it is shown under
 * and whether it is shown without {@code --verbose}.
 */
public enum JunoEventType {

    RUN_STARTED("run.started", Category.RUN, true),
    RUN_COMPLETED("run.completed", Category.COMPLETE, true),
    TASK_GENERATED("task.generated", Category.TASK, true),
    TEAM_COMPLETED("team.completed", Category.TEAM, false),
    TEAM_FAILED("team.failed", Category.TEAM_FAILURE, true),
    TEAM_GRADED("team.graded", Category.TEAM, true),
    WORKLOAD_INCREASED("workload.increased", Category.WORKLOAD, false),
    DEADLINE_ASSIGNED("deadline.assigned", Category.WORKLOAD, false),
    RESOURCE_REQUESTED("resource.requested", Category.RESOURCES, false),
    RESOURCE_APPLIED("resource.applied", Category.RESOURCES, true),
    IMPROVEMENT_ESCALATED("improvement.escalated", Category.IMPROVEMENT, true),
    IMPROVEMENT_COMPLETED("improvement.completed", Category.IMPROVEMENT, false),
    CODE_CHANGE("code.change", Category.IMPROVEMENT, true);

    /** Console grouping of event types. */
    public enum Category {
        RUN, TASK, TEAM, TEAM_FAILURE, WORKLOAD, RESOURCES, IMPROVEMENT, COMPLETE
    }

    private final String id;
    private final Category category;
    private final boolean key;

    JunoEventType(String id, Category category, boolean key) {
        this.id = id;
        this.category = category;
        this.key = key;
    }

    public String id() {
        return id;
    }

    public Category category() {
        return category;
    }

    /** Shown in the default (non-verbose) watch output. */
    public boolean isKey() {
        return key;
    }

    public static JunoEventType fromId(String id) {
        return Arrays.stream(values())
                .filter(t -> t.id.equals(id))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown event type: " + id));
    }
}
