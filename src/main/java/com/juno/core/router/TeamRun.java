package com.juno.core.router;

import com.juno.core.model.RunMessage;

import java.util.List;
import java.util.Map;

/**
 * Outcome of a nested team run.
 *
 * @param output   content of the last member message, the team's deliverable
 * @param messages the team conversation
 * @param context  team context after the run
 * @param visited  members in the order they worked
 */
public record TeamRun(String output, List<RunMessage> messages, Map<String, Object> context,
                      List<String> visited, long tokensUsed) {}
