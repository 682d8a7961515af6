package com.juno.core.model;

import java.util.Arrays;

/**
 * The teams the top-level supervisor can route to.
 */
public enum Team {
    RESEARCH("research", "research_team"),
    WRITING("writing", "writing_team"),
    JUNO("juno", "juno_team");

    private final String id;
    private final String nodeName;

    Team(String id, String nodeName) {
        this.id = id;
        this.nodeName = nodeName;
    }

    public String id() {
        return id;
    }

    public String nodeName() {
        return nodeName;
    }

    /** Worker teams produce graded output; the improvement team does not. */
    public boolean isWorker() {
        return this != JUNO;
    }

    public static Team fromId(String id) {
        return Arrays.stream(values())
                .filter(t -> t.id.equalsIgnoreCase(id) || t.nodeName.equalsIgnoreCase(id))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown team: " + id));
    }
}
