package com.juno.core.router;

import com.juno.core.model.RunMessage;
import org.bsc.langgraph4j.state.AgentState;
import org.bsc.langgraph4j.state.Channel;
import org.bsc.langgraph4j.state.Channels;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * State of one nested team run.
 */
public class TeamState extends AgentState {

    public static final Map<String, Channel<?>> SCHEMA = Map.of(
            "task",     Channels.base(() -> ""),
            "next",     Channels.base(() -> ""),
            "steps",    Channels.base(() -> 0),
            "tokens",   Channels.base(() -> 0L),
            "visited",  Channels.base((Supplier<List<String>>) List::of),
            "context",  Channels.base((Supplier<Map<String, Object>>) Map::of),
            "messages", Channels.appender(ArrayList::new)
    );

    public TeamState(Map<String, Object> initData) {
        super(initData);
    }

    public String task() {
        return this.<String>value("task").orElse("");
    }

    public String next() {
        return this.<String>value("next").orElse("");
    }

    public int steps() {
        return this.<Number>value("steps").map(Number::intValue).orElse(0);
    }

    public long tokens() {
        return this.<Number>value("tokens").map(Number::longValue).orElse(0L);
    }

    public List<String> visited() {
        return this.<List<String>>value("visited").orElse(List.of());
    }

    /** Values shared between the members of the team. */
    public Map<String, Object> context() {
        return this.<Map<String, Object>>value("context").orElse(Map.of());
    }

    public List<RunMessage> messages() {
        return this.<List<RunMessage>>value("messages").orElse(List.of());
    }
}
