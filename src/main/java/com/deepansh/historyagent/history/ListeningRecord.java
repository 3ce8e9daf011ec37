package com.deepansh.historyagent.history;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * One play event from the streaming history, already converted to the configured zone.
 */
@Value
@Builder
public class ListeningRecord {
    LocalDateTime playedAt;
    String track;
    String artist;
    String album;
    long msPlayed;
    boolean skipped;
}
