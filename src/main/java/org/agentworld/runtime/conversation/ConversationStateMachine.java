package org.agentworld.runtime.conversation;

import org.agentworld.runtime.ValidationException;
import org.agentworld.runtime.model.Conversation;
import org.agentworld.runtime.model.ConversationState;
import org.agentworld.runtime.model.Message;
import org.agentworld.runtime.model.World;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Transitions of {@link Conversation}s inside a {@link World}.
 * <p>
 * <pre>
 *   start ──► REQUESTED ──accept──► ACTIVE ──leave(last) / finish──► FINISHED
 *                 │                                                     ▲
 *                 └──────────────────────reject─────────────────────────┘
 * </pre>
 * Every operation validates all of its preconditions before it touches the conversation, so a
 * {@link ValidationException} always leaves the world unchanged.
 */
public final class ConversationStateMachine {

    private static final Logger LOGGER = LoggerFactory.getLogger(ConversationStateMachine.class);

    /**
     * Creates a conversation in state {@link ConversationState#REQUESTED}.
     *
     * @return The new conversation, already added to the world.
     */
    public Conversation start(final World world, final String creatorId, final String inviteeId, final long now) {
        requirePlayer(world, creatorId);
        requirePlayer(world, inviteeId);
        if (creatorId.equals(inviteeId)) {
            throw new ValidationException("Player " + creatorId + " cannot invite themselves");
        }
        world.activeConversationOf(creatorId).ifPresent(c -> {
            throw new ValidationException("Player " + creatorId + " is already in conversation " + c.getId());
        });
        world.activeConversationOf(inviteeId).ifPresent(c -> {
            throw new ValidationException("Player " + inviteeId + " is already in conversation " + c.getId());
        });

        final Conversation conversation = new Conversation(world.allocateId(World.CONVERSATION_PREFIX), creatorId, now);
        conversation.invite(inviteeId);
        world.addConversation(conversation);
        LOGGER.debug("Conversation {} requested by {} for {}", conversation.getId(), creatorId, inviteeId);
        return conversation;
    }

    public void accept(final World world, final String playerId, final String conversationId) {
        final Conversation conversation = requireOpen(world, conversationId);
        requireInvitee(conversation, playerId);
        conversation.admitInvitee();
        LOGGER.debug("Player {} accepted conversation {}", playerId, conversationId);
    }

    /**
     * The invitee declines; the conversation ends without affecting any other conversation of the
     * creator.
     */
    public void reject(final World world, final String playerId, final String conversationId, final long now) {
        final Conversation conversation = requireOpen(world, conversationId);
        requireInvitee(conversation, playerId);
        conversation.finish(now);
        LOGGER.debug("Player {} rejected conversation {}", playerId, conversationId);
    }

    public void setTyping(final World world, final String playerId, final String conversationId, final boolean typing) {
        final Conversation conversation = requireOpen(world, conversationId);
        requireParticipant(conversation, playerId);
        conversation.setTyping(playerId, typing);
    }

    public void sendMessage(final World world, final String playerId, final String conversationId,
                            final String text, final long now) {
        final Conversation conversation = requireOpen(world, conversationId);
        requireParticipant(conversation, playerId);
        if (text == null || text.isBlank()) {
            throw new ValidationException("Message text must not be empty");
        }
        conversation.recordMessage(new Message(playerId, text, now));
    }

    /**
     * Removes the player from the participants. If nobody is left the conversation finishes.
     */
    public void leave(final World world, final String playerId, final String conversationId, final long now) {
        final Conversation conversation = requireOpen(world, conversationId);
        requireParticipant(conversation, playerId);
        conversation.removeParticipant(playerId, now);
        LOGGER.debug("Player {} left conversation {} (finished={})", playerId, conversationId, conversation.isFinished());
    }

    public void finish(final World world, final String playerId, final String conversationId, final long now) {
        final Conversation conversation = requireOpen(world, conversationId);
        requireParticipant(conversation, playerId);
        conversation.finish(now);
        LOGGER.debug("Player {} finished conversation {}", playerId, conversationId);
    }

    /**
     * Takes the player out of whatever conversation it is part of, as participant or invitee.
     * Used when the player itself is leaving the world.
     */
    public void withdraw(final World world, final String playerId, final long now) {
        world.activeConversationOf(playerId).ifPresent(conversation -> {
            if (conversation.isParticipant(playerId)) {
                conversation.removeParticipant(playerId, now);
                if (conversation.getState() == ConversationState.REQUESTED) {
                    // the creator left before the invitee answered
                    conversation.finish(now);
                }
            } else {
                conversation.finish(now);
            }
        });
    }

    private static void requirePlayer(final World world, final String playerId) {
        if (playerId == null || world.findPlayer(playerId).isEmpty()) {
            throw new ValidationException("Invalid player ID " + playerId);
        }
    }

    private static Conversation requireOpen(final World world, final String conversationId) {
        final Conversation conversation = world.findConversation(conversationId)
            .orElseThrow(() -> new ValidationException("Couldn't find conversation: " + conversationId));
        if (conversation.isFinished()) {
            throw new ValidationException("Conversation " + conversationId + " is already finished");
        }
        return conversation;
    }

    private static void requireParticipant(final Conversation conversation, final String playerId) {
        if (playerId == null || !conversation.isParticipant(playerId)) {
            throw new ValidationException("Player " + playerId + " is not in conversation " + conversation.getId());
        }
    }

    private static void requireInvitee(final Conversation conversation, final String playerId) {
        if (conversation.getState() != ConversationState.REQUESTED || playerId == null
                || !playerId.equals(conversation.getInvitee())) {
            throw new ValidationException("Player " + playerId + " has no pending invite to conversation " + conversation.getId());
        }
    }
}
