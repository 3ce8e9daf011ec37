package com.deepansh.historyagent.tool;

import com.deepansh.historyagent.exception.ToolExecutionException;
import com.deepansh.historyagent.llm.JsonSchemaValidator;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.networknt.schema.JsonSchema;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Central registry for all QueryTool implementations.
 *
 * Spring auto-discovers every @Component that implements QueryTool
 * and injects them as a List<QueryTool>. The registry is built once at startup
 * and never changes afterwards; two tools with the same name abort startup.
 */
@Component
@Slf4j
public class ToolRegistry {

    private final Map<String, QueryTool> tools;
    private final Map<String, JsonSchema> parameterSchemas;
    private final JsonSchemaValidator validator;
    private final ObjectMapper objectMapper;

    public ToolRegistry(List<QueryTool> toolBeans, JsonSchemaValidator validator, ObjectMapper objectMapper) {
        Map<String, QueryTool> byName = new TreeMap<>();
        toolBeans.forEach(tool -> {
            if (byName.putIfAbsent(tool.getName(), tool) != null) {
                throw new IllegalStateException("Duplicate tool name: " + tool.getName());
            }
            log.info("Registered tool: [{}]", tool.getName());
        });
        this.tools = Collections.unmodifiableMap(byName);
        Map<String, JsonSchema> schemas = new TreeMap<>();
        byName.forEach((name, tool) -> schemas.put(name, validator.compile(tool.getParameterSchema())));
        this.parameterSchemas = Collections.unmodifiableMap(schemas);
        this.validator = validator;
        this.objectMapper = objectMapper;
        log.info("Total tools registered: {}", tools.size());
    }

    /** Definitions in name order, so prompts built from them are stable */
    public List<ToolDefinition> getAllDefinitions() {
        return tools.values().stream()
                .map(ToolDefinition::from)
                .toList();
    }

    public Optional<ToolDefinition> findDefinition(String name) {
        return Optional.ofNullable(tools.get(name)).map(ToolDefinition::from);
    }

    public boolean hasTool(String name) {
        return name != null && tools.containsKey(name);
    }

    public Set<String> toolNames() {
        return tools.keySet();
    }

    /**
     * Checks arguments against the tool's parameter schema.
     *
     * @return violations, empty when the arguments are valid
     */
    public List<String> validateArguments(String name, Map<String, Object> arguments) {
        require(name);
        JsonNode node = objectMapper.valueToTree(arguments);
        return validator.validate(node, parameterSchemas.get(name));
    }

    /**
     * Invokes a tool. Failures surface as {@link ToolExecutionException}: bad argument
     * values are not retryable, anything else unexpected is.
     */
    public List<Map<String, Object>> invoke(String name, Map<String, Object> arguments) {
        QueryTool tool = require(name);
        log.info("Executing tool: [{}] with args: {}", name, arguments);
        try {
            List<Map<String, Object>> rows = tool.invoke(arguments);
            log.debug("Tool [{}] returned {} row(s)", name, rows.size());
            return rows;
        } catch (ToolExecutionException e) {
            throw e;
        } catch (IllegalArgumentException e) {
            throw ToolExecutionException.nonRetryable(
                    "Tool '" + name + "' rejected its arguments: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            log.error("Unexpected error in tool [{}]", name, e);
            throw new ToolExecutionException("Tool '" + name + "' failed: " + e.getMessage(), e);
        }
    }

    public int toolCount() {
        return tools.size();
    }

    private QueryTool require(String name) {
        QueryTool tool = tools.get(name);
        if (tool == null) {
            throw new IllegalArgumentException(String.format(
                    "Unknown tool '%s'. Available tools: %s", name, tools.keySet()));
        }
        return tool;
    }
}
