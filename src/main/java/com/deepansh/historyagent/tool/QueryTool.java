package com.deepansh.historyagent.tool;

import com.deepansh.historyagent.exception.ToolExecutionException;

import java.util.List;
import java.util.Map;

/**
 * Contract every query tool must implement.
 *
 * The {@link #getParameterSchema()} return value is embedded in the planner prompt
 * so the model knows exactly how to invoke the tool, and is used to validate
 * resolved arguments before any invocation.
 */
public interface QueryTool {

    /** Unique snake_case name the planner uses to invoke this tool */
    String getName();

    /**
     * Human-readable description. This is the primary signal the planner uses
     * to decide when to call this tool.
     */
    String getDescription();

    /** JSON Schema (as a Map) describing the tool's input parameters */
    Map<String, Object> getParameterSchema();

    /**
     * Runs the query with arguments already validated against the parameter schema.
     * Rows come back most relevant first.
     *
     * @throws ToolExecutionException when the underlying query fails
     */
    List<Map<String, Object>> invoke(Map<String, Object> arguments);
}
