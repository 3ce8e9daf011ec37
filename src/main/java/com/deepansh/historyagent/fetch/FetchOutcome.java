package com.deepansh.historyagent.fetch;

import com.deepansh.historyagent.model.ErrorRecord;
import com.deepansh.historyagent.model.FetchResult;

import java.util.List;

/**
 * Results of the data-fetch stage, one per planned call in plan order,
 * plus the recoverable errors noted along the way.
 */
public record FetchOutcome(List<FetchResult> results, List<ErrorRecord> errors) {}
