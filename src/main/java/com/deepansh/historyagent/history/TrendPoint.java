package com.deepansh.historyagent.history;

public record TrendPoint(String bucket, long plays, long minutesPlayed) {}
