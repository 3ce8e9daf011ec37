package com.deepansh.historyagent.history;

import java.time.LocalDate;

public record SummaryStats(
        long totalRecords,
        long totalListeningMinutes,
        LocalDate firstDate,
        LocalDate lastDate,
        long uniqueTracks,
        long uniqueArtists
) {
    public static SummaryStats empty() {
        return new SummaryStats(0, 0, null, null, 0, 0);
    }
}
