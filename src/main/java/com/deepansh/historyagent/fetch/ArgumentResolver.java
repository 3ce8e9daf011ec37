package com.deepansh.historyagent.fetch;

import com.deepansh.historyagent.config.AgentProperties;
import com.deepansh.historyagent.core.CancellationToken;
import com.deepansh.historyagent.exception.ArgumentResolutionException;
import com.deepansh.historyagent.exception.GenerationUnavailableException;
import com.deepansh.historyagent.exception.SchemaValidationException;
import com.deepansh.historyagent.history.DateRange;
import com.deepansh.historyagent.llm.GenerationClient;
import com.deepansh.historyagent.llm.OutputSchema;
import com.deepansh.historyagent.model.ToolCall;
import com.deepansh.historyagent.resilience.PolicyExecutor;
import com.deepansh.historyagent.tool.ToolArguments;
import com.deepansh.historyagent.tool.ToolDefinition;
import com.deepansh.historyagent.tool.ToolRegistry;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeoutException;

/**
 * Turns a planned call's raw argument spec into concrete arguments that satisfy the
 * tool's parameter schema.
 *
 * A {@code time_range} phrase is resolved locally first. Arguments that then validate
 * are used as they are; otherwise the generation client fills them in against the tool
 * schema and the result is validated once more. Every failure on this path surfaces as
 * {@link ArgumentResolutionException}, so the query service is never called with
 * arguments that were not validated.
 */
@Component
@Slf4j
public class ArgumentResolver {

    static final String TIME_RANGE = "time_range";

    private static final TypeReference<Map<String, Object>> ARGS_TYPE = new TypeReference<>() {};

    private final ToolRegistry toolRegistry;
    private final TimeRangeResolver timeRangeResolver;
    private final GenerationClient generationClient;
    private final PolicyExecutor policyExecutor;
    private final AgentProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public ArgumentResolver(ToolRegistry toolRegistry,
                            TimeRangeResolver timeRangeResolver,
                            GenerationClient generationClient,
                            PolicyExecutor policyExecutor,
                            AgentProperties properties,
                            ObjectMapper objectMapper,
                            Clock clock) {
        this.toolRegistry = toolRegistry;
        this.timeRangeResolver = timeRangeResolver;
        this.generationClient = generationClient;
        this.policyExecutor = policyExecutor;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public Map<String, Object> resolve(ToolCall call, String userQuery, CancellationToken token) {
        String toolName = call.getName();
        ToolDefinition definition = toolRegistry.findDefinition(toolName)
                .orElseThrow(() -> new ArgumentResolutionException(toolName, List.of("tool is not registered")));

        Map<String, Object> args = new LinkedHashMap<>(call.getRawArgsSpec());
        Object timeRange = args.remove(TIME_RANGE);
        boolean unresolvedPhrase = false;

        if (timeRange != null) {
            Optional<DateRange> range = timeRangeResolver.resolve(timeRange.toString());
            if (range.isPresent()) {
                applyRange(args, range.get(), definition);
            } else {
                unresolvedPhrase = true;
                log.debug("Time range '{}' for [{}] needs generation", timeRange, toolName);
            }
        }

        List<String> violations = violations(toolName, args);
        if (violations.isEmpty() && !unresolvedPhrase) {
            return args;
        }

        log.info("Filling arguments for [{}] via generation [violations={}]", toolName, violations);
        Map<String, Object> generated = generate(definition, args, timeRange, userQuery, token);

        List<String> remaining = violations(toolName, generated);
        if (!remaining.isEmpty()) {
            throw new ArgumentResolutionException(toolName, remaining);
        }
        return generated;
    }

    /** Schema violations plus the checks a schema cannot express: parseable dates, start not after end */
    private List<String> violations(String toolName, Map<String, Object> args) {
        List<String> violations = new ArrayList<>(toolRegistry.validateArguments(toolName, args));
        LocalDate start = parseDate(args, ToolArguments.START_DATE, violations);
        LocalDate end = parseDate(args, ToolArguments.END_DATE, violations);
        if (start != null && end != null && start.isAfter(end)) {
            violations.add(String.format("%s %s is after %s %s",
                    ToolArguments.START_DATE, start, ToolArguments.END_DATE, end));
        }
        return violations;
    }

    private static LocalDate parseDate(Map<String, Object> args, String key, List<String> violations) {
        try {
            return ToolArguments.date(args, key);
        } catch (IllegalArgumentException e) {
            violations.add(e.getMessage());
            return null;
        }
    }

    private void applyRange(Map<String, Object> args, DateRange range, ToolDefinition definition) {
        Object properties = definition.getParameterSchema().get("properties");
        if (!(properties instanceof Map<?, ?> props) || !props.containsKey(ToolArguments.START_DATE)) {
            return;
        }
        // explicit dates from the planner win over the phrase
        if (range.start() != null) args.putIfAbsent(ToolArguments.START_DATE, range.start().toString());
        if (range.end() != null) args.putIfAbsent(ToolArguments.END_DATE, range.end().toString());
    }

    private Map<String, Object> generate(ToolDefinition definition, Map<String, Object> partial,
                                         Object timeRange, String userQuery, CancellationToken token) {
        String toolName = definition.getName();
        OutputSchema schema = OutputSchema.of(toolName + "_arguments",
                "Arguments for the " + toolName + " tool", definition.getParameterSchema());

        String prompt = """
                You fill in the arguments of one listening-history query tool.
                Tool: %s
                Description: %s
                Use concrete values only. Dates are YYYY-MM-DD. Current date: %s
                """.formatted(toolName, definition.getDescription().replaceAll("\\s+", " "), LocalDate.now(clock));

        StringBuilder context = new StringBuilder()
                .append("User request: ").append(userQuery).append('\n')
                .append("Arguments proposed so far: ").append(toJson(partial));
        if (timeRange != null) {
            context.append('\n').append("Requested time range: ").append(timeRange);
        }

        try {
            JsonNode output = policyExecutor.execute(
                    properties.singleGenerationPolicy("arguments-" + toolName),
                    () -> generationClient.generateStructured(schema, prompt, context.toString()),
                    ex -> false,
                    token);
            if (output == null || !output.isObject()) {
                throw new ArgumentResolutionException(toolName, List.of("generated arguments are not an object"));
            }
            return objectMapper.convertValue(output, ARGS_TYPE);
        } catch (SchemaValidationException | GenerationUnavailableException e) {
            throw new ArgumentResolutionException(toolName, e.getMessage(), e);
        } catch (TimeoutException e) {
            throw new ArgumentResolutionException(toolName, "argument generation timed out", e);
        }
    }

    private String toJson(Map<String, Object> args) {
        try {
            return objectMapper.writeValueAsString(args);
        } catch (JsonProcessingException e) {
            return args.toString();
        }
    }
}
