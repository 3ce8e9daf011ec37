package com.deepansh.historyagent.history;

/**
 * A ranked artist, track or album. {@code artist} is null when ranking artists.
 */
public record EntityRanking(int rank, String name, String artist, long playCount, long minutesPlayed) {}
