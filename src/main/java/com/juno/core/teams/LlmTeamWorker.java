package com.juno.core.teams;

import com.juno.core.llm.LlmService;
import com.juno.core.model.RunMessage;
import com.juno.core.router.TeamState;
import com.juno.core.router.TeamWorker;
import com.juno.core.router.WorkerResult;
import org.springframework.ai.tool.ToolCallback;

import java.util.List;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Team member that answers with the chat model, optionally using tools.
 */
public class LlmTeamWorker implements TeamWorker {

    static final int CONVERSATION_LIMIT = 8;

    private final LlmService llmService;
    private final String name;
    private final Supplier<String> systemPrompt;
    private final ToolCallback[] tools;

    public LlmTeamWorker(LlmService llmService, String name, String systemPrompt, List<ToolCallback> tools) {
        this(llmService, name, () -> systemPrompt, tools);
    }

    /**
     * @param systemPrompt evaluated on every call, for prompts that describe changing state
     */
    public LlmTeamWorker(LlmService llmService, String name, Supplier<String> systemPrompt, List<ToolCallback> tools) {
        this.llmService = llmService;
        this.name = name;
        this.systemPrompt = systemPrompt;
        this.tools = tools.toArray(new ToolCallback[0]);
    }

    public String name() {
        return name;
    }

    @Override
    public WorkerResult perform(TeamState state) {
        var reply = llmService.structuredCallWithTools(systemPrompt.get(), prompt(state), WorkerReply.class, tools);
        String content = reply == null || reply.content() == null ? "" : reply.content();
        return WorkerResult.of(content);
    }

    static String prompt(TeamState state) {
        List<RunMessage> messages = state.messages();
        String conversation = messages.subList(Math.max(0, messages.size() - CONVERSATION_LIMIT), messages.size())
                .stream()
                .map(m -> "[" + m.author() + "] " + m.content())
                .collect(Collectors.joining("\n\n"));
        return "Task:\n" + state.task() + "\n\nTeam conversation so far:\n" + conversation
                + "\n\nDo your part of the task and report the result.";
    }
}
