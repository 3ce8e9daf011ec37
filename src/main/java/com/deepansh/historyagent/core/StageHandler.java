package com.deepansh.historyagent.core;

import com.deepansh.historyagent.model.AgentState;
import com.deepansh.historyagent.model.Stage;

/**
 * Executes one non-terminal stage and names the stage to move to.
 */
@FunctionalInterface
public interface StageHandler {

    StageOutcome execute(AgentState state, CancellationToken token);

    record StageOutcome(Stage nextStage, AgentState state) {}
}
