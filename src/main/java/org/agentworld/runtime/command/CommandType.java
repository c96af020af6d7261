package org.agentworld.runtime.command;

import java.util.Arrays;
import java.util.Optional;

/**
 * The closed set of commands a world accepts. Each constant carries the name used on the wire and
 * in the input log, and the record type its arguments bind to.
 */
public enum CommandType {
    JOIN("join", WorldCommand.Join.class),
    LEAVE("leave", WorldCommand.Leave.class),
    MOVE_TO("moveTo", WorldCommand.MoveTo.class),
    SET_ACTIVITY("setActivity", WorldCommand.SetActivity.class),
    CREATE_AGENT("createAgent", WorldCommand.CreateAgent.class),
    START_OPERATION("startOperation", WorldCommand.StartOperation.class),
    FINISH_OPERATION("finishOperation", WorldCommand.FinishOperation.class),
    CLEAR_OPERATION("clearOperation", WorldCommand.ClearOperation.class),
    ARCHIVE_AGENT("archiveAgent", WorldCommand.ArchiveAgent.class),
    ARCHIVE_PLAYER("archivePlayer", WorldCommand.ArchivePlayer.class),
    START_CONVERSATION("startConversation", WorldCommand.StartConversation.class),
    ACCEPT_INVITE("acceptInvite", WorldCommand.AcceptInvite.class),
    REJECT_INVITE("rejectInvite", WorldCommand.RejectInvite.class),
    SET_TYPING("setTyping", WorldCommand.SetTyping.class),
    SEND_MESSAGE("sendMessage", WorldCommand.SendMessage.class),
    LEAVE_CONVERSATION("leaveConversation", WorldCommand.LeaveConversation.class),
    FINISH_CONVERSATION("finishConversation", WorldCommand.FinishConversation.class);

    private final String wireName;
    private final Class<? extends WorldCommand> argumentType;

    CommandType(final String wireName, final Class<? extends WorldCommand> argumentType) {
        this.wireName = wireName;
        this.argumentType = argumentType;
    }

    public String wireName() {
        return wireName;
    }

    public Class<? extends WorldCommand> argumentType() {
        return argumentType;
    }

    public static Optional<CommandType> fromWireName(final String name) {
        return Arrays.stream(values()).filter(t -> t.wireName.equals(name)).findFirst();
    }
}
