package com.deepansh.historyagent.tool.impl;

import com.deepansh.historyagent.history.EntityRanking;
import com.deepansh.historyagent.history.EntityType;
import com.deepansh.historyagent.history.ListeningHistoryQueryService;
import com.deepansh.historyagent.tool.QueryTool;
import com.deepansh.historyagent.tool.ToolArguments;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ranks artists, tracks or albums by listening time.
 */
@Component
public class TopEntitiesTool implements QueryTool {

    static final int MAX_N = 50;

    private final ListeningHistoryQueryService history;

    public TopEntitiesTool(ListeningHistoryQueryService history) {
        this.history = history;
    }

    @Override
    public String getName() {
        return "top_n_entities";
    }

    @Override
    public String getDescription() {
        return """
                The most-listened artists, tracks or albums in a period, ranked by minutes played.
                Use for "who was my top artist", "my most played songs", "favourite albums".
                Pass "artist" to rank one artist's tracks or albums ("my top Radiohead songs").
                """;
    }

    @Override
    public Map<String, Object> getParameterSchema() {
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("entity", Map.of(
                "type", "string",
                "enum", EntityType.wireNames(),
                "description", "What to rank"));
        properties.put("n", Map.of(
                "type", "integer",
                "minimum", 1,
                "maximum", MAX_N,
                "description", "How many entries to return"));
        properties.put("artist", Map.of(
                "type", "string",
                "description", "Only rank this artist's tracks or albums"));
        return ToolArguments.objectSchema(ToolArguments.withDateRange(properties), List.of("entity", "n"));
    }

    @Override
    public List<Map<String, Object>> invoke(Map<String, Object> arguments) {
        String entity = ToolArguments.string(arguments, "entity");
        EntityType type = EntityType.fromWireName(entity)
                .orElseThrow(() -> new IllegalArgumentException("Unknown entity type: " + entity));
        int n = ToolArguments.integer(arguments, "n", 10);
        String artist = ToolArguments.string(arguments, "artist");

        return history.topEntities(type, n, ToolArguments.dateRange(arguments), artist).stream()
                .map(ranking -> toRow(type, ranking))
                .toList();
    }

    private Map<String, Object> toRow(EntityType type, EntityRanking ranking) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("rank", ranking.rank());
        row.put(type.wireName(), ranking.name());
        if (type != EntityType.ARTIST) {
            row.put("artist", ranking.artist());
        }
        row.put("play_count", ranking.playCount());
        row.put("minutes_played", ranking.minutesPlayed());
        return row;
    }
}
