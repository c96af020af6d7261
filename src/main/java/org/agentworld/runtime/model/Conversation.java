package org.agentworld.runtime.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A bounded social interaction between players.
 * <p>
 * Invariants kept by this class regardless of the caller:
 * <ul>
 *   <li>{@code finished} only ever changes from {@code false} to {@code true}.</li>
 *   <li>An empty participant set implies {@code finished}.</li>
 *   <li>The typing set is a subset of the participant set.</li>
 * </ul>
 * Authorization (who may call what) is checked by the conversation state machine.
 */
public class Conversation {

    private final String id;
    private final String creator;
    private final long created;
    private final Set<String> participants = new LinkedHashSet<>();
    private final Set<String> typing = new LinkedHashSet<>();
    private String invitee;
    private Message lastMessage;
    private int numMessages;
    private boolean finished;
    private Long finishedAt;

    public Conversation(final String id, final String creator, final long created) {
        this.id = id;
        this.creator = creator;
        this.created = created;
        this.participants.add(creator);
    }

    /**
     * Restores a conversation from its persisted form.
     */
    public static Conversation restore(final String id, final String creator, final long created,
                                       final Set<String> participants, final String invitee,
                                       final Message lastMessage, final int numMessages,
                                       final Set<String> typing, final boolean finished, final Long finishedAt) {
        final Conversation c = new Conversation(id, creator, created);
        c.participants.clear();
        c.participants.addAll(participants);
        c.invitee = invitee;
        c.lastMessage = lastMessage;
        c.numMessages = numMessages;
        c.finished = finished || participants.isEmpty();
        c.finishedAt = c.finished ? (finishedAt != null ? finishedAt : created) : null;
        if (!c.finished) {
            for (final String p : typing) {
                if (c.participants.contains(p)) {
                    c.typing.add(p);
                }
            }
        }
        return c;
    }

    public Conversation copy() {
        return restore(id, creator, created, participants, invitee, lastMessage, numMessages, typing, finished, finishedAt);
    }

    public String getId() {
        return id;
    }

    public String getCreator() {
        return creator;
    }

    public long getCreated() {
        return created;
    }

    public Set<String> getParticipants() {
        return Collections.unmodifiableSet(participants);
    }

    public Set<String> getTyping() {
        return Collections.unmodifiableSet(typing);
    }

    public String getInvitee() {
        return invitee;
    }

    public Message getLastMessage() {
        return lastMessage;
    }

    public int getNumMessages() {
        return numMessages;
    }

    public boolean isFinished() {
        return finished;
    }

    public Long getFinishedAt() {
        return finishedAt;
    }

    public ConversationState getState() {
        if (finished) {
            return ConversationState.FINISHED;
        }
        return invitee != null ? ConversationState.REQUESTED : ConversationState.ACTIVE;
    }

    public boolean isParticipant(final String playerId) {
        return participants.contains(playerId);
    }

    /**
     * @return {@code true} if the player takes part in this conversation or has a pending invite to it.
     */
    public boolean involves(final String playerId) {
        return participants.contains(playerId) || playerId.equals(invitee);
    }

    public void invite(final String playerId) {
        this.invitee = playerId;
    }

    /**
     * Moves the pending invitee into the participant set.
     */
    public void admitInvitee() {
        if (invitee != null) {
            participants.add(invitee);
            invitee = null;
        }
    }

    public void setTyping(final String playerId, final boolean isTyping) {
        if (isTyping && participants.contains(playerId)) {
            typing.add(playerId);
        } else {
            typing.remove(playerId);
        }
    }

    public void recordMessage(final Message message) {
        this.lastMessage = message;
        this.numMessages++;
        this.typing.remove(message.author());
    }

    /**
     * Removes a participant. Removing the last participant finishes the conversation.
     */
    public void removeParticipant(final String playerId, final long now) {
        participants.remove(playerId);
        typing.remove(playerId);
        if (participants.isEmpty()) {
            finish(now);
        }
    }

    /**
     * Marks the conversation as finished and clears the typing set. Has no effect if it already is.
     */
    public void finish(final long now) {
        typing.clear();
        invitee = null;
        if (!finished) {
            finished = true;
            finishedAt = now;
        }
    }
}
