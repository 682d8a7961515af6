package com.juno.core.teams;

/**
 * Structured answer of an LLM-backed team member.
 */
public record WorkerReply(String content) {}
