package org.agentworld.runtime.model;

/**
 * An autonomous entity bound to exactly one {@link Player}. Decisions are made by an external
 * policy; the agent only records which operation it is waiting on.
 */
public class Agent {

    private final String id;
    private final String playerId;
    private final Personality personality;
    private final String ownerId;
    private InProgressOperation inProgressOperation;
    private Long lastInviteAttempt;

    public Agent(final String id, final String playerId, final Personality personality, final String ownerId) {
        this.id = id;
        this.playerId = playerId;
        this.personality = personality;
        this.ownerId = ownerId;
    }

    public Agent copy() {
        final Agent copy = new Agent(id, playerId, personality, ownerId);
        copy.inProgressOperation = inProgressOperation;
        copy.lastInviteAttempt = lastInviteAttempt;
        return copy;
    }

    public String getId() {
        return id;
    }

    public String getPlayerId() {
        return playerId;
    }

    public Personality getPersonality() {
        return personality;
    }

    public String getOwnerId() {
        return ownerId;
    }

    public InProgressOperation getInProgressOperation() {
        return inProgressOperation;
    }

    public void setInProgressOperation(final InProgressOperation inProgressOperation) {
        this.inProgressOperation = inProgressOperation;
    }

    public Long getLastInviteAttempt() {
        return lastInviteAttempt;
    }

    public void setLastInviteAttempt(final Long lastInviteAttempt) {
        this.lastInviteAttempt = lastInviteAttempt;
    }
}
