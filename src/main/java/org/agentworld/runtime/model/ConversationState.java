package org.agentworld.runtime.model;

/**
 * Lifecycle of a {@link Conversation}, derived from its fields.
 */
public enum ConversationState {
    /** The creator invited someone who has not answered yet. */
    REQUESTED,
    /** Every invitee has answered; participants exchange messages. */
    ACTIVE,
    /** Terminal. */
    FINISHED
}
