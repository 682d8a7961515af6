package com.juno.core.model;

import java.io.Serializable;

/**
 * An entry in the run's conversation log.
 *
 * @param author  node, team or agent that produced the message
 * @param content message text
 */
public record RunMessage(String author, String content) implements Serializable {}
