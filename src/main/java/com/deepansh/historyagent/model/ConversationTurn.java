package com.deepansh.historyagent.model;

import lombok.Value;

/** A completed earlier exchange of the same conversation. */
@Value
public class ConversationTurn {
    String userQuery;
    String response;
}
