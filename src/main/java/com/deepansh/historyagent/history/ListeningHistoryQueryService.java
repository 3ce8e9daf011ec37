package com.deepansh.historyagent.history;

import java.util.List;

/**
 * Typed query operations over the listening history.
 *
 * The agent depends only on these operations, their parameters and result shapes;
 * storage and parsing are the implementation's concern. Ordered results always put the
 * most relevant row first (highest rank, most recent play) so callers can cut from the tail.
 */
public interface ListeningHistoryQueryService {

    SummaryStats summaryStats(DateRange range);

    /**
     * Top {@code n} entities by listening time, ties broken by play count then name.
     * A non-blank {@code artist} restricts the ranking to that artist's plays.
     */
    List<EntityRanking> topEntities(EntityType type, int n, DateRange range, String artist);

    /**
     * Listening activity grouped by time bucket. Hour and weekday buckets come in clock order;
     * month ({@code yyyy-MM}) and year buckets come newest first.
     */
    List<TrendPoint> listeningTrend(TimeBucket bucket, DateRange range);

    /** Individual plays in the range, most recent first, optionally for one artist */
    List<ListeningRecord> playsInRange(DateRange range, String artist, int limit);
}
