package com.deepansh.historyagent.tool.impl;

import com.deepansh.historyagent.history.InMemoryListeningHistory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.deepansh.historyagent.TestFixtures.play;
import static org.assertj.core.api.Assertions.assertThat;

class PlaysInRangeToolTest {

    private PlaysInRangeTool tool;

    @BeforeEach
    void setUp() {
        tool = new PlaysInRangeTool(new InMemoryListeningHistory(List.of(
                play("2025-03-02T21:40", "Bjork", "Joga", "Homogenic", 6),
                play("2025-03-05T09:00", "Portishead", "Roads", "Dummy", 3),
                play("2025-04-01T09:00", "Bjork", "Hunter", "Homogenic", 4))));
    }

    @Test
    void parameterSchema_requiresBothDates() {
        assertThat(tool.getParameterSchema().get("required")).isEqualTo(List.of("start_date", "end_date"));
    }

    @Test
    void invoke_filtersByRangeAndArtist() {
        List<Map<String, Object>> rows = tool.invoke(Map.of(
                "start_date", "2025-03-01", "end_date", "2025-03-31", "artist", "BJORK"));

        assertThat(rows).singleElement().satisfies(row -> {
            assertThat(row).containsEntry("track", "Joga")
                    .containsEntry("played_at", "2025-03-02T21:40")
                    .containsEntry("minutes_played", 6.0)
                    .containsEntry("skipped", false);
        });
    }

    @Test
    void invoke_appliesLimit_mostRecentFirst() {
        List<Map<String, Object>> rows = tool.invoke(Map.of(
                "start_date", "2025-01-01", "end_date", "2025-12-31", "limit", 2));

        assertThat(rows).extracting(r -> r.get("track")).containsExactly("Hunter", "Roads");
    }
}
