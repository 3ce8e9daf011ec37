package com.deepansh.historyagent.exception;

public class ConversationBusyException extends AgentException {

    public ConversationBusyException(String conversationId) {
        super("A turn is already in progress for conversation " + conversationId);
    }
}
