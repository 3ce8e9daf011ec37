package com.deepansh.historyagent.tool.impl;

import com.deepansh.historyagent.history.ListeningHistoryQueryService;
import com.deepansh.historyagent.history.TimeBucket;
import com.deepansh.historyagent.tool.QueryTool;
import com.deepansh.historyagent.tool.ToolArguments;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Listening activity grouped by hour of day, weekday, month or year.
 */
@Component
public class ListeningTrendTool implements QueryTool {

    private final ListeningHistoryQueryService history;

    public ListeningTrendTool(ListeningHistoryQueryService history) {
        this.history = history;
    }

    @Override
    public String getName() {
        return "listening_trend";
    }

    @Override
    public String getDescription() {
        return """
                Plays and minutes grouped by time bucket (hour of day, weekday, month or year).
                Use for habits and evolution: "when do I listen most", "how did my listening change".
                Month (yyyy-MM) and year rows are returned newest first.
                """;
    }

    @Override
    public Map<String, Object> getParameterSchema() {
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("bucket", Map.of(
                "type", "string",
                "enum", TimeBucket.wireNames(),
                "description", "Grouping granularity"));
        return ToolArguments.objectSchema(ToolArguments.withDateRange(properties), List.of("bucket"));
    }

    @Override
    public List<Map<String, Object>> invoke(Map<String, Object> arguments) {
        String value = ToolArguments.string(arguments, "bucket");
        TimeBucket bucket = TimeBucket.fromWireName(value)
                .orElseThrow(() -> new IllegalArgumentException("Unknown bucket: " + value));

        return history.listeningTrend(bucket, ToolArguments.dateRange(arguments)).stream()
                .map(point -> {
                    Map<String, Object> row = new LinkedHashMap<>();
                    row.put(bucket.wireName(), point.bucket());
                    row.put("plays", point.plays());
                    row.put("minutes_played", point.minutesPlayed());
                    return row;
                })
                .toList();
    }
}
