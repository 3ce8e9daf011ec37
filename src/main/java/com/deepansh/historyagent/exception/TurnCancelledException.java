package com.deepansh.historyagent.exception;

public class TurnCancelledException extends AgentException {

    public TurnCancelledException(String message) {
        super(message);
    }
}
