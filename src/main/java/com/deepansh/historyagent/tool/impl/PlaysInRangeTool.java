package com.deepansh.historyagent.tool.impl;

import com.deepansh.historyagent.history.ListeningHistoryQueryService;
import com.deepansh.historyagent.tool.QueryTool;
import com.deepansh.historyagent.tool.ToolArguments;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Individual plays between two dates, most recent first, optionally for one artist.
 */
@Component
public class PlaysInRangeTool implements QueryTool {

    static final int DEFAULT_LIMIT = 50;
    static final int MAX_LIMIT = 200;

    private final ListeningHistoryQueryService history;

    public PlaysInRangeTool(ListeningHistoryQueryService history) {
        this.history = history;
    }

    @Override
    public String getName() {
        return "plays_in_range";
    }

    @Override
    public String getDescription() {
        return """
                Individual plays (timestamp, track, artist, album, minutes, skipped) between two dates,
                most recent first. Filter by artist to answer "when did I last listen to X".
                """;
    }

    @Override
    public Map<String, Object> getParameterSchema() {
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put(ToolArguments.START_DATE, ToolArguments.dateProperty("Inclusive start date (YYYY-MM-DD)"));
        properties.put(ToolArguments.END_DATE, ToolArguments.dateProperty("Inclusive end date (YYYY-MM-DD)"));
        properties.put("artist", Map.of(
                "type", "string",
                "description", "Only plays by this artist (case-insensitive exact match)"));
        properties.put("limit", Map.of(
                "type", "integer",
                "minimum", 1,
                "maximum", MAX_LIMIT,
                "description", "Maximum number of plays to return, default " + DEFAULT_LIMIT));
        return ToolArguments.objectSchema(properties, List.of(ToolArguments.START_DATE, ToolArguments.END_DATE));
    }

    @Override
    public List<Map<String, Object>> invoke(Map<String, Object> arguments) {
        int limit = ToolArguments.integer(arguments, "limit", DEFAULT_LIMIT);
        String artist = ToolArguments.string(arguments, "artist");

        return history.playsInRange(ToolArguments.dateRange(arguments), artist, limit).stream()
                .map(play -> {
                    Map<String, Object> row = new LinkedHashMap<>();
                    row.put("played_at", play.getPlayedAt().toString());
                    row.put("track", play.getTrack());
                    row.put("artist", play.getArtist());
                    row.put("album", play.getAlbum());
                    row.put("minutes_played", Math.round(play.getMsPlayed() / 6000.0) / 10.0);
                    row.put("skipped", play.isSkipped());
                    return row;
                })
                .toList();
    }
}
