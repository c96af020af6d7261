package org.agentworld.runtime.command;

import org.agentworld.runtime.ValidationException;
import org.agentworld.runtime.model.Personality;
import org.agentworld.runtime.pathfinding.Tile;

/**
 * A typed command against one world. There is one record per {@link CommandType}; the record
 * components are the command's arguments. Compact constructors reject malformed arguments, so a
 * successfully parsed command is always well-formed (its references may still be stale).
 */
public interface WorldCommand {

    CommandType type();

    /** Adds a new player; returns {@code {playerId}}. */
    record Join(String name, String ownerId, String zone, Tile position) implements WorldCommand {
        public Join {
            requireText(name, "name");
        }

        @Override
        public CommandType type() {
            return CommandType.JOIN;
        }
    }

    /** The player leaves the world and is archived. */
    record Leave(String playerId) implements WorldCommand {
        public Leave {
            requireText(playerId, "playerId");
        }

        @Override
        public CommandType type() {
            return CommandType.LEAVE;
        }
    }

    /** Starts walking to {@code destination}, or stops when it is {@code null}. */
    record MoveTo(String playerId, Tile destination) implements WorldCommand {
        public MoveTo {
            requireText(playerId, "playerId");
        }

        @Override
        public CommandType type() {
            return CommandType.MOVE_TO;
        }
    }

    /** Sets the player's activity for {@code durationMs}, or clears it when no description is given. */
    record SetActivity(String playerId, String description, String emoji, long durationMs) implements WorldCommand {
        public SetActivity {
            requireText(playerId, "playerId");
            if (description != null && durationMs <= 0) {
                throw new ValidationException("durationMs must be positive");
            }
        }

        @Override
        public CommandType type() {
            return CommandType.SET_ACTIVITY;
        }
    }

    /** Adds a player together with the agent controlling it; returns {@code {agentId, playerId}}. */
    record CreateAgent(String name, Personality personality, String ownerId, String zone, Tile position) implements WorldCommand {
        public CreateAgent {
            requireText(name, "name");
        }

        @Override
        public CommandType type() {
            return CommandType.CREATE_AGENT;
        }
    }

    /** Records that the agent is waiting on an external operation. */
    record StartOperation(String agentId, String name, String operationId) implements WorldCommand {
        public StartOperation {
            requireText(agentId, "agentId");
            requireText(name, "name");
            requireText(operationId, "operationId");
        }

        @Override
        public CommandType type() {
            return CommandType.START_OPERATION;
        }
    }

    /**
     * Delivers the result of an operation. At most one of {@code invitee}, {@code destination} and
     * {@code activity} is acted on, in that order of preference.
     */
    record FinishOperation(String agentId, String operationId, Tile destination, String invitee,
                           ActivityRequest activity) implements WorldCommand {
        public FinishOperation {
            requireText(agentId, "agentId");
            requireText(operationId, "operationId");
        }

        @Override
        public CommandType type() {
            return CommandType.FINISH_OPERATION;
        }
    }

    /** Force-clears an operation; {@code operationId == null} clears whatever is in progress. */
    record ClearOperation(String agentId, String operationId, String reason) implements WorldCommand {
        public ClearOperation {
            requireText(agentId, "agentId");
        }

        @Override
        public CommandType type() {
            return CommandType.CLEAR_OPERATION;
        }
    }

    /** Archives an agent together with its player. */
    record ArchiveAgent(String agentId, String reason) implements WorldCommand {
        public ArchiveAgent {
            requireText(agentId, "agentId");
        }

        @Override
        public CommandType type() {
            return CommandType.ARCHIVE_AGENT;
        }
    }

    /** Archives a player (and its agent, if any). */
    record ArchivePlayer(String playerId, String reason) implements WorldCommand {
        public ArchivePlayer {
            requireText(playerId, "playerId");
        }

        @Override
        public CommandType type() {
            return CommandType.ARCHIVE_PLAYER;
        }
    }

    /** Invites another player; returns {@code {conversationId}}. */
    record StartConversation(String playerId, String inviteeId) implements WorldCommand {
        public StartConversation {
            requireText(playerId, "playerId");
            requireText(inviteeId, "inviteeId");
        }

        @Override
        public CommandType type() {
            return CommandType.START_CONVERSATION;
        }
    }

    record AcceptInvite(String playerId, String conversationId) implements WorldCommand {
        public AcceptInvite {
            requireText(playerId, "playerId");
            requireText(conversationId, "conversationId");
        }

        @Override
        public CommandType type() {
            return CommandType.ACCEPT_INVITE;
        }
    }

    record RejectInvite(String playerId, String conversationId) implements WorldCommand {
        public RejectInvite {
            requireText(playerId, "playerId");
            requireText(conversationId, "conversationId");
        }

        @Override
        public CommandType type() {
            return CommandType.REJECT_INVITE;
        }
    }

    record SetTyping(String playerId, String conversationId, boolean typing) implements WorldCommand {
        public SetTyping {
            requireText(playerId, "playerId");
            requireText(conversationId, "conversationId");
        }

        @Override
        public CommandType type() {
            return CommandType.SET_TYPING;
        }
    }

    record SendMessage(String playerId, String conversationId, String text) implements WorldCommand {
        public SendMessage {
            requireText(playerId, "playerId");
            requireText(conversationId, "conversationId");
            requireText(text, "text");
        }

        @Override
        public CommandType type() {
            return CommandType.SEND_MESSAGE;
        }
    }

    record LeaveConversation(String playerId, String conversationId) implements WorldCommand {
        public LeaveConversation {
            requireText(playerId, "playerId");
            requireText(conversationId, "conversationId");
        }

        @Override
        public CommandType type() {
            return CommandType.LEAVE_CONVERSATION;
        }
    }

    record FinishConversation(String playerId, String conversationId) implements WorldCommand {
        public FinishConversation {
            requireText(playerId, "playerId");
            requireText(conversationId, "conversationId");
        }

        @Override
        public CommandType type() {
            return CommandType.FINISH_CONVERSATION;
        }
    }

    /** Activity requested by a finishing operation. */
    record ActivityRequest(String description, String emoji, long durationMs) {
        public ActivityRequest {
            requireText(description, "activity.description");
            if (durationMs <= 0) {
                throw new ValidationException("activity.durationMs must be positive");
            }
        }
    }

    private static void requireText(final String value, final String field) {
        if (value == null || value.isBlank()) {
            throw new ValidationException("Missing required argument '" + field + "'");
        }
    }
}
