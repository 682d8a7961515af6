package com.juno.core.router;

import java.util.Map;

/**
 * Output of one team member.
 *
 * @param content        message appended to the team conversation
 * @param contextUpdates values merged into the team context
 * @param tokensUsed     estimated tokens spent
 */
public record WorkerResult(String content, Map<String, Object> contextUpdates, long tokensUsed) {

    public WorkerResult {
        content = content == null ? "" : content;
        contextUpdates = contextUpdates == null ? Map.of() : contextUpdates;
    }

    public static WorkerResult of(String content) {
        return new WorkerResult(content, Map.of(), estimateTokens(content));
    }

    /** Rough token estimate of four characters per token. */
    public static long estimateTokens(String text) {
        return text == null ? 0 : (text.length() + 3) / 4;
    }
}
