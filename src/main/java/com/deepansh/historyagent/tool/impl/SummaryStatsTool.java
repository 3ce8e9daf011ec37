package com.deepansh.historyagent.tool.impl;

import com.deepansh.historyagent.history.DateRange;
import com.deepansh.historyagent.history.ListeningHistoryQueryService;
import com.deepansh.historyagent.history.SummaryStats;
import com.deepansh.historyagent.tool.QueryTool;
import com.deepansh.historyagent.tool.ToolArguments;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Overall totals for a period: plays, minutes, distinct tracks and artists, first/last day.
 * Always returns exactly one row, zeroed when nothing was played in the range.
 */
@Component
public class SummaryStatsTool implements QueryTool {

    private final ListeningHistoryQueryService history;

    public SummaryStatsTool(ListeningHistoryQueryService history) {
        this.history = history;
    }

    @Override
    public String getName() {
        return "summary_stats";
    }

    @Override
    public String getDescription() {
        return """
                Overall listening statistics for a period: total plays, total minutes listened,
                number of distinct tracks and artists, and the first and last day with activity.
                Use for "how much did I listen", "how many artists", or as context for insights.
                """;
    }

    @Override
    public Map<String, Object> getParameterSchema() {
        return ToolArguments.objectSchema(ToolArguments.withDateRange(Map.of()), List.of());
    }

    @Override
    public List<Map<String, Object>> invoke(Map<String, Object> arguments) {
        DateRange range = ToolArguments.dateRange(arguments);
        SummaryStats stats = history.summaryStats(range);

        Map<String, Object> row = new LinkedHashMap<>();
        row.put("total_records", stats.totalRecords());
        row.put("total_listening_minutes", stats.totalListeningMinutes());
        row.put("unique_tracks", stats.uniqueTracks());
        row.put("unique_artists", stats.uniqueArtists());
        row.put("first_date", stats.firstDate() == null ? null : stats.firstDate().toString());
        row.put("last_date", stats.lastDate() == null ? null : stats.lastDate().toString());
        return List.of(row);
    }
}
