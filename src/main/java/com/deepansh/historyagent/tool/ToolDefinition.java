package com.deepansh.historyagent.tool;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Immutable snapshot of a tool's name, description and parameter schema.
 * Decouples the prompt format from the QueryTool implementation.
 */
@Value
@Builder
public class ToolDefinition {

    String name;
    String description;
    Map<String, Object> parameterSchema;

    public static ToolDefinition from(QueryTool tool) {
        return ToolDefinition.builder()
                .name(tool.getName())
                .description(tool.getDescription().strip())
                .parameterSchema(tool.getParameterSchema())
                .build();
    }
}
