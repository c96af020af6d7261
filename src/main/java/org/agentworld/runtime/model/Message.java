package org.agentworld.runtime.model;

/**
 * The latest message of a conversation.
 */
public record Message(String author, String text, long timestamp) {
}
